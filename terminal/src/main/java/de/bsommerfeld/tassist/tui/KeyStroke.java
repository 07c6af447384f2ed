package de.bsommerfeld.tassist.tui;

import java.util.Locale;

/**
 * A single key press, optionally combined with Ctrl.
 *
 * <p>
 * Printable characters use {@link Key#CHAR} and carry the character; every
 * other key carries {@code '\0'}. Ctrl combinations with letters are stored in
 * lower case, so {@code Ctrl+T} and {@code Ctrl+t} are the same stroke.
 */
public record KeyStroke(Key key, char character, boolean ctrl) {

    public enum Key {
        CHAR, ENTER, ESCAPE, TAB, BACKSPACE, DELETE, UP, DOWN, LEFT, RIGHT, UNKNOWN
    }

    public KeyStroke {
        if (key != Key.CHAR) {
            character = '\0';
        } else if (ctrl) {
            character = Character.toLowerCase(character);
        }
    }

    public static KeyStroke of(char character) {
        return new KeyStroke(Key.CHAR, character, false);
    }

    public static KeyStroke of(Key key) {
        return new KeyStroke(key, '\0', false);
    }

    public static KeyStroke ctrl(char character) {
        return new KeyStroke(Key.CHAR, character, true);
    }

    public static KeyStroke ctrl(Key key) {
        return new KeyStroke(key, '\0', true);
    }

    /** Human-readable form used in keybind hints, e.g. {@code Ctrl+Left}. */
    @Override
    public String toString() {
        String name;
        if (key == Key.CHAR) {
            name = ctrl ? String.valueOf(Character.toUpperCase(character)) : String.valueOf(character);
        } else {
            String lower = key.name().toLowerCase(Locale.ROOT);
            name = Character.toUpperCase(lower.charAt(0)) + lower.substring(1);
        }
        return ctrl ? "Ctrl+" + name : name;
    }
}
