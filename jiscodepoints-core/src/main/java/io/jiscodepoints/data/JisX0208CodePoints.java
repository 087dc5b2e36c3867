package io.jiscodepoints.data;

import static io.jiscodepoints.data.CodePointTables.concat;

/**
 * Non-kanji tables of JIS X 0208, one per row group. Every method returns a
 * new array, decoded from the {@code EUC-JP} charset.
 */
public final class JisX0208CodePoints {

    private JisX0208CodePoints() {
    }

    /**
     * Rows 1-2: punctuation, brackets, math and unit symbols, 147 values.
     */
    public static int[] specialChars() {
        return KutenDecoder.jisX0208Rows(1, 2);
    }

    /**
     * Row 3: fullwidth digits and Latin letters, 62 values.
     */
    public static int[] latinLetters() {
        return KutenDecoder.jisX0208Rows(3, 3);
    }

    /**
     * Row 4, 83 values.
     */
    public static int[] hiragana() {
        return KutenDecoder.jisX0208Rows(4, 4);
    }

    /**
     * Row 5, 86 values.
     */
    public static int[] katakana() {
        return KutenDecoder.jisX0208Rows(5, 5);
    }

    /**
     * Row 6, 48 values.
     */
    public static int[] greekLetters() {
        return KutenDecoder.jisX0208Rows(6, 6);
    }

    /**
     * Row 7, 66 values.
     */
    public static int[] cyrillicLetters() {
        return KutenDecoder.jisX0208Rows(7, 7);
    }

    /**
     * Row 8, 32 values.
     */
    public static int[] boxDrawingChars() {
        return KutenDecoder.jisX0208Rows(8, 8);
    }

    /**
     * Every non-kanji character, 524 values.
     */
    public static int[] all() {
        return concat(hiragana(), katakana(), latinLetters(), greekLetters(),
                cyrillicLetters(), specialChars(), boxDrawingChars());
    }
}
