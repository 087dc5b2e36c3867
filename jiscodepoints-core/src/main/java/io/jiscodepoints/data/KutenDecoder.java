package io.jiscodepoints.data;

import io.jiscodepoints.core.JisCodePointsException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.UnsupportedCharsetException;
import java.util.Locale;
import java.util.function.IntPredicate;
import java.util.stream.IntStream;

/**
 * Builds code point tables by decoding positions of the JIS character sets
 * through the JDK's legacy charsets.
 * <p>
 * A position that decodes to anything but a single code point (unassigned,
 * malformed, or a base-plus-combining sequence) is skipped.
 */
final class KutenDecoder {
    private static final Logger log = LoggerFactory.getLogger(KutenDecoder.class);

    static final String EUC_JP = "EUC-JP";
    static final String SHIFT_JIS_2004 = "x-SJIS_0213";

    private static final int ROWS = 94;
    private static final int CELLS = 94;
    private static final int EUC_OFFSET = 0xA0;
    private static final int REPLACEMENT_CHARACTER = 0xFFFD;

    private KutenDecoder() {
    }

    /**
     * Decodes JIS X 0208 rows {@code firstRow} through {@code lastRow} (1-based,
     * inclusive) in row/cell order.
     */
    static int[] jisX0208Rows(int firstRow, int lastRow) {
        if (firstRow < 1 || lastRow > ROWS || firstRow > lastRow) {
            throw new IllegalArgumentException("invalid JIS X 0208 rows: " + firstRow + ".." + lastRow);
        }
        var charset = charset(EUC_JP);
        var table = IntStream.rangeClosed(firstRow, lastRow)
                .flatMap(row -> IntStream.rangeClosed(1, CELLS)
                        .map(cell -> decode(charset, EUC_OFFSET + row, EUC_OFFSET + cell)))
                .filter(codePoint -> codePoint >= 0)
                .toArray();
        log.debug("Decoded {} code points from JIS X 0208 rows {}-{}", table.length, firstRow, lastRow);
        return table;
    }

    /**
     * Decodes the double-byte Shift_JIS-2004 sequences from {@code firstSequence}
     * (lead byte in the high 8 bits, trail byte in the low 8) onwards, and keeps
     * the code points accepted by {@code filter}.
     */
    static int[] shiftJis2004DoubleBytes(int firstSequence, IntPredicate filter) {
        var charset = charset(SHIFT_JIS_2004);
        var table = IntStream.concat(IntStream.rangeClosed(0x81, 0x9F), IntStream.rangeClosed(0xE0, 0xFC))
                .flatMap(lead -> IntStream.concat(IntStream.rangeClosed(0x40, 0x7E), IntStream.rangeClosed(0x80, 0xFC))
                        .filter(trail -> (lead << 8 | trail) >= firstSequence)
                        .map(trail -> decode(charset, lead, trail)))
                .filter(codePoint -> codePoint >= 0)
                .filter(filter)
                .distinct()
                .toArray();
        log.debug("Decoded {} code points from {} starting at 0x{}", table.length, SHIFT_JIS_2004,
                Integer.toHexString(firstSequence).toUpperCase(Locale.ROOT));
        return table;
    }

    static Charset charset(String name) {
        try {
            return Charset.forName(name);
        } catch (UnsupportedCharsetException | IllegalCharsetNameException e) {
            throw new JisCodePointsException("Charset " + name + " is not available in this JDK", e);
        }
    }

    // returns -1 when the pair does not decode to exactly one assigned code point
    private static int decode(Charset charset, int first, int second) {
        var decoded = new String(new byte[]{(byte) first, (byte) second}, charset);
        if (decoded.codePointCount(0, decoded.length()) != 1) {
            return -1;
        }
        var codePoint = decoded.codePointAt(0);
        return codePoint == REPLACEMENT_CHARACTER ? -1 : codePoint;
    }
}
