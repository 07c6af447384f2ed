package de.bsommerfeld.tassist.tui;

/** An open tab: its id and the kind currently shown in it. */
public record Tab(int id, TabKind<?> kind) {
}
