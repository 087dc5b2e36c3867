package io.jiscodepoints.kernel;

/**
 * Primitive iterator over code point values, avoiding boxing.
 */
public interface IntEnumerator {

    boolean hasNext();

    /**
     * @throws java.util.NoSuchElementException if no values remain
     */
    int nextInt();
}
