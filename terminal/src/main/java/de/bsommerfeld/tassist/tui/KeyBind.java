package de.bsommerfeld.tassist.tui;

/**
 * A named action of a tab, triggered by {@link #key()}. Tabs receive the
 * {@link #name()} in {@link TabKind#handleKey}; the {@link #label()} is shown
 * in the footer.
 */
public record KeyBind(String name, String label, KeyStroke key) {

    public static KeyBind of(String name, String label, KeyStroke key) {
        return new KeyBind(name, label, key);
    }
}
