package de.bsommerfeld.tassist.tui;

import de.bsommerfeld.tassist.tui.KeyStroke.Key;

import java.io.IOException;
import java.util.Optional;

/**
 * Turns raw terminal input into {@link KeyStroke}s.
 *
 * <p>
 * Understands plain characters, control characters, and the CSI/SS3 escape
 * sequences xterm-compatible terminals send for arrow keys, including the
 * {@code ESC [ 1 ; 5 X} form for Ctrl+arrow. An ESC that is not followed by
 * more input within {@link #ESCAPE_TIMEOUT_MS} is the Escape key itself.
 * Sequences it does not know, and Alt combinations, are consumed and reported
 * as {@link Key#UNKNOWN}, which nothing binds.
 */
public final class KeyDecoder {

    static final long ESCAPE_TIMEOUT_MS = 50;

    private static final int ESC = 27;
    private static final int EOF = -1;
    private static final int TIMEOUT = -2;

    /** Source of raw input, shaped like JLine's {@code NonBlockingReader}. */
    public interface Input {

        /** Blocking read; {@code -1} at end of input. */
        int read() throws IOException;

        /** Read with timeout; {@code -2} on timeout, {@code -1} at end of input. */
        int read(long timeoutMs) throws IOException;
    }

    private final Input input;

    public KeyDecoder(Input input) {
        this.input = input;
    }

    public Optional<KeyStroke> next() throws IOException {
        int c = input.read();
        if (c == EOF) {
            return Optional.empty();
        }
        if (c == ESC) {
            return Optional.of(escape());
        }
        return Optional.of(plain(c));
    }

    private static KeyStroke plain(int c) {
        switch (c) {
            case '\r':
            case '\n':
                return KeyStroke.of(Key.ENTER);
            case '\t':
                return KeyStroke.of(Key.TAB);
            case 8:
            case 127:
                return KeyStroke.of(Key.BACKSPACE);
            default:
                if (c >= 1 && c <= 26) {
                    return KeyStroke.ctrl((char) ('a' + c - 1));
                }
                return KeyStroke.of((char) c);
        }
    }

    private KeyStroke escape() throws IOException {
        int next = input.read(ESCAPE_TIMEOUT_MS);
        if (next == TIMEOUT || next == EOF) {
            return KeyStroke.of(Key.ESCAPE);
        }
        if (next != '[' && next != 'O') {
            return KeyStroke.of(Key.UNKNOWN);
        }
        StringBuilder params = new StringBuilder();
        int c = input.read(ESCAPE_TIMEOUT_MS);
        while (c >= '0' && c <= '9' || c == ';') {
            params.append((char) c);
            c = input.read(ESCAPE_TIMEOUT_MS);
        }
        boolean ctrl = params.toString().endsWith(";5");
        switch (c) {
            case 'A':
                return new KeyStroke(Key.UP, '\0', ctrl);
            case 'B':
                return new KeyStroke(Key.DOWN, '\0', ctrl);
            case 'C':
                return new KeyStroke(Key.RIGHT, '\0', ctrl);
            case 'D':
                return new KeyStroke(Key.LEFT, '\0', ctrl);
            case '~':
                if (params.toString().equals("3")) {
                    return KeyStroke.of(Key.DELETE);
                }
                return KeyStroke.of(Key.UNKNOWN);
            default:
                return KeyStroke.of(Key.UNKNOWN);
        }
    }
}
