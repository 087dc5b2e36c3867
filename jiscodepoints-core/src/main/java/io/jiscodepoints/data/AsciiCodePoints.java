package io.jiscodepoints.data;

import static io.jiscodepoints.data.CodePointTables.concat;
import static io.jiscodepoints.data.CodePointTables.rangeClosed;

/**
 * ASCII code point tables. Every method returns a new array.
 */
public final class AsciiCodePoints {

    public static final int LINE_FEED = 0x0A;
    public static final int CARRIAGE_RETURN = 0x0D;
    public static final int DELETE = 0x7F;

    private AsciiCodePoints() {
    }

    /**
     * C0 controls 0x00-0x1F plus DEL, 33 values.
     */
    public static int[] control() {
        return concat(rangeClosed(0x00, 0x1F), new int[]{DELETE});
    }

    /**
     * 0x20-0x7E, 95 values.
     */
    public static int[] printable() {
        return rangeClosed(0x20, 0x7E);
    }

    public static int[] crlf() {
        return new int[]{LINE_FEED, CARRIAGE_RETURN};
    }

    /**
     * Control followed by printable, 128 values. CR and LF are already controls.
     */
    public static int[] all() {
        return concat(control(), printable());
    }
}
