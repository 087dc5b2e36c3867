package io.jiscodepoints.kernel;

/**
 * A code point found outside a set, with its character index (code point
 * count, not UTF-16 index) in the scanned text.
 */
public record ExcludedCodePoint(int codePoint, int position) {

    public ExcludedCodePoint {
        if (position < 0) {
            throw new IllegalArgumentException("position must be non-negative: " + position);
        }
    }
}
