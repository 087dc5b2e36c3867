package io.jiscodepoints.data;

import static io.jiscodepoints.data.CodePointTables.concat;
import static io.jiscodepoints.data.CodePointTables.rangeClosed;

/**
 * JIS X 0201 code point tables. Every method returns a new array.
 */
public final class JisX0201CodePoints {

    public static final int YEN_SIGN = 0x00A5;
    public static final int OVERLINE = 0x203E;

    private JisX0201CodePoints() {
    }

    /**
     * The Roman half: ASCII printable with YEN SIGN at 0x5C and OVERLINE at 0x7E,
     * so neither REVERSE SOLIDUS nor TILDE is included. 95 values.
     */
    public static int[] latinLetters() {
        return concat(
                rangeClosed(0x20, 0x5B),
                new int[]{YEN_SIGN},
                rangeClosed(0x5D, 0x7D),
                new int[]{OVERLINE});
    }

    /**
     * Halfwidth punctuation and katakana U+FF61-U+FF9F, 63 values.
     */
    public static int[] katakana() {
        return rangeClosed(0xFF61, 0xFF9F);
    }

    public static int[] all() {
        return concat(latinLetters(), katakana());
    }
}
