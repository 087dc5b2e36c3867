package io.jiscodepoints.data;

/**
 * JIS X 0208 kanji: level 1 (rows 16-47) and level 2 (rows 48-84).
 */
public final class JisX0208KanjiCodePoints {

    public static final int FIRST_KANJI_ROW = 16;
    public static final int LAST_LEVEL1_ROW = 47;
    public static final int LAST_KANJI_ROW = 84;

    private JisX0208KanjiCodePoints() {
    }

    /**
     * Both levels, 6355 values.
     */
    public static int[] kanji() {
        return KutenDecoder.jisX0208Rows(FIRST_KANJI_ROW, LAST_KANJI_ROW);
    }

    public static int[] level1() {
        return KutenDecoder.jisX0208Rows(FIRST_KANJI_ROW, LAST_LEVEL1_ROW);
    }

    public static int[] level2() {
        return KutenDecoder.jisX0208Rows(LAST_LEVEL1_ROW + 1, LAST_KANJI_ROW);
    }
}
