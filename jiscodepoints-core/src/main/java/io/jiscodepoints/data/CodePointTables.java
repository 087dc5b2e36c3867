package io.jiscodepoints.data;

import java.util.Arrays;
import java.util.stream.IntStream;

final class CodePointTables {

    private CodePointTables() {
    }

    static int[] rangeClosed(int from, int to) {
        return IntStream.rangeClosed(from, to).toArray();
    }

    static int[] concat(int[]... tables) {
        var length = Arrays.stream(tables).mapToInt(table -> table.length).sum();
        var out = new int[length];
        var offset = 0;
        for (var table : tables) {
            System.arraycopy(table, 0, out, offset, table.length);
            offset += table.length;
        }
        return out;
    }
}
