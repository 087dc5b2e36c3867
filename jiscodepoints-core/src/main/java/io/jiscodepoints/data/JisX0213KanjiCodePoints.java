package io.jiscodepoints.data;

/**
 * JIS X 0213 kanji, levels 1 through 4 across both planes, including the
 * supplementary-plane ideographs.
 * <p>
 * Built from the JDK's {@code x-SJIS_0213} charset. Plane 1 rows 1 through 13
 * hold symbols (among them the ditto mark U+4EDD, which Unicode classes as an
 * ideograph) and are not decoded; kanji start at plane 1 row 14. Ideographs in
 * the CJK Symbols and Punctuation block are never kanji.
 */
public final class JisX0213KanjiCodePoints {

    // plane 1, row 14, cell 1
    static final int FIRST_KANJI_SEQUENCE = 0x879F;

    private JisX0213KanjiCodePoints() {
    }

    public static int[] kanji() {
        return KutenDecoder.shiftJis2004DoubleBytes(FIRST_KANJI_SEQUENCE, JisX0213KanjiCodePoints::isKanji);
    }

    static boolean isKanji(int codePoint) {
        return Character.isIdeographic(codePoint)
                && Character.UnicodeBlock.of(codePoint) != Character.UnicodeBlock.CJK_SYMBOLS_AND_PUNCTUATION;
    }
}
