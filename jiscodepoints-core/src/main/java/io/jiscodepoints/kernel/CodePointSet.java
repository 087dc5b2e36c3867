package io.jiscodepoints.kernel;

import io.jiscodepoints.core.CodePointValidationException;
import io.jiscodepoints.core.ValidationError;
import io.jiscodepoints.data.AsciiCodePoints;
import io.jiscodepoints.util.Lazy;

import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.stream.IntStream;

/**
 * Immutable set of Unicode code points.
 * <p>
 * <b>Contract:</b>
 * <ul>
 *   <li>This is a <b>set</b> - construction deduplicates, input order is irrelevant.</li>
 *   <li>Membership is exact code point equality. No case or range folding.</li>
 *   <li>Text is scanned by code point: a supplementary character is one value
 *       at one position, never two surrogates.</li>
 *   <li>Set algebra returns new instances and never modifies either operand.</li>
 *   <li>equals() and hashCode() depend only on the contained values.</li>
 *   <li>Iteration order is unspecified.</li>
 * </ul>
 * <p>
 * Values are held in a sorted, duplicate-free array: membership is a binary
 * search and set algebra is a linear merge.
 */
public final class CodePointSet {

    private static final int[] NO_VALUES = new int[0];
    private static final CodePointSet EMPTY = new CodePointSet(NO_VALUES);

    private static final Lazy<CodePointSet> ASCII_CONTROL = Lazy.of(CodePointSet::asciiControl);
    private static final Lazy<CodePointSet> ASCII_PRINTABLE = Lazy.of(CodePointSet::asciiPrintable);
    private static final Lazy<CodePointSet> CRLF = Lazy.of(CodePointSet::crlf);
    private static final Lazy<CodePointSet> ASCII_ALL = Lazy.of(CodePointSet::asciiAll);

    // sorted ascending, no duplicates
    private final int[] values;

    private CodePointSet(int[] values) {
        this.values = values;
    }

    public static CodePointSet empty() {
        return EMPTY;
    }

    /**
     * Creates a set from code point values. Duplicates are collapsed.
     *
     * @throws IllegalArgumentException if a value is outside 0..0x10FFFF
     */
    public static CodePointSet of(int... codePoints) {
        Objects.requireNonNull(codePoints, "codePoints");
        return new CodePointSet(normalize(codePoints.clone(), codePoints.length));
    }

    public static CodePointSet fromCodePoints(Collection<Integer> codePoints) {
        Objects.requireNonNull(codePoints, "codePoints");
        var raw = new int[codePoints.size()];
        var i = 0;
        for (Integer codePoint : codePoints) {
            raw[i++] = Objects.requireNonNull(codePoint, "codePoint");
        }
        return new CodePointSet(normalize(raw, raw.length));
    }

    /**
     * Creates a set holding every code point that occurs in {@code text}.
     */
    public static CodePointSet fromString(CharSequence text) {
        Objects.requireNonNull(text, "text");
        var raw = text.codePoints().toArray();
        return new CodePointSet(normalize(raw, raw.length));
    }

    public static Builder builder() {
        return new Builder();
    }

    // ---------------------------------------------------------------- membership

    /**
     * Tests whether every code point of {@code text} is a member.
     * The empty string is always contained.
     */
    public boolean contains(CharSequence text) {
        Objects.requireNonNull(text, "text");
        var length = text.length();
        var i = 0;
        while (i < length) {
            var codePoint = Character.codePointAt(text, i);
            if (!containsCodePoint(codePoint)) {
                return false;
            }
            i += Character.charCount(codePoint);
        }
        return true;
    }

    public boolean containsCodePoint(int codePoint) {
        return Arrays.binarySearch(values, codePoint) >= 0;
    }

    // ---------------------------------------------------------------- exclusions

    /**
     * Returns the first code point of {@code text} that is not a member,
     * together with its character index.
     */
    public Optional<ExcludedCodePoint> firstExcludedWithPosition(CharSequence text) {
        Objects.requireNonNull(text, "text");
        var length = text.length();
        var i = 0;
        var position = 0;
        while (i < length) {
            var codePoint = Character.codePointAt(text, i);
            if (!containsCodePoint(codePoint)) {
                return Optional.of(new ExcludedCodePoint(codePoint, position));
            }
            i += Character.charCount(codePoint);
            position++;
        }
        return Optional.empty();
    }

    public OptionalInt firstExcluded(CharSequence text) {
        return firstExcludedWithPosition(text)
                .map(excluded -> OptionalInt.of(excluded.codePoint()))
                .orElseGet(OptionalInt::empty);
    }

    /**
     * Returns every distinct code point of {@code text} that is not a member,
     * in the order each is first seen.
     */
    public int[] allExcluded(CharSequence text) {
        Objects.requireNonNull(text, "text");
        var excluded = new LinkedHashSet<Integer>();
        text.codePoints()
                .filter(codePoint -> !containsCodePoint(codePoint))
                .forEach(excluded::add);
        return excluded.stream().mapToInt(Integer::intValue).toArray();
    }

    // ---------------------------------------------------------------- validation

    /**
     * Returns the validation error for {@code text}, or empty when every
     * code point is a member.
     */
    public Optional<ValidationError> check(CharSequence text) {
        return firstExcludedWithPosition(text)
                .map(excluded -> ValidationError.of(excluded.codePoint(), excluded.position()));
    }

    /**
     * @throws CodePointValidationException if {@code text} holds a code point outside this set
     */
    public void validate(CharSequence text) {
        var error = check(text);
        if (error.isPresent()) {
            throw new CodePointValidationException(error.get());
        }
    }

    /**
     * Like {@link #validate(CharSequence)}, reporting {@code message} instead of
     * the default description.
     */
    public void validate(CharSequence text, String message) {
        Objects.requireNonNull(message, "message");
        var error = check(text);
        if (error.isPresent()) {
            throw new CodePointValidationException(error.get().withMessage(message));
        }
    }

    // ---------------------------------------------------------------- set algebra

    public CodePointSet union(CodePointSet other) {
        Objects.requireNonNull(other, "other");
        var a = values;
        var b = other.values;
        var out = new int[a.length + b.length];
        int i = 0, j = 0, n = 0;
        while (i < a.length && j < b.length) {
            if (a[i] < b[j]) {
                out[n++] = a[i++];
            } else if (a[i] > b[j]) {
                out[n++] = b[j++];
            } else {
                out[n++] = a[i++];
                j++;
            }
        }
        while (i < a.length) {
            out[n++] = a[i++];
        }
        while (j < b.length) {
            out[n++] = b[j++];
        }
        return wrap(out, n);
    }

    public CodePointSet intersection(CodePointSet other) {
        Objects.requireNonNull(other, "other");
        var a = values;
        var b = other.values;
        var out = new int[Math.min(a.length, b.length)];
        int i = 0, j = 0, n = 0;
        while (i < a.length && j < b.length) {
            if (a[i] < b[j]) {
                i++;
            } else if (a[i] > b[j]) {
                j++;
            } else {
                out[n++] = a[i++];
                j++;
            }
        }
        return wrap(out, n);
    }

    /**
     * Code points in this set and not in {@code other}.
     */
    public CodePointSet difference(CodePointSet other) {
        Objects.requireNonNull(other, "other");
        var a = values;
        var b = other.values;
        var out = new int[a.length];
        int i = 0, j = 0, n = 0;
        while (i < a.length) {
            if (j == b.length || a[i] < b[j]) {
                out[n++] = a[i++];
            } else if (a[i] > b[j]) {
                j++;
            } else {
                i++;
                j++;
            }
        }
        return wrap(out, n);
    }

    /**
     * Code points in exactly one of the two sets.
     */
    public CodePointSet symmetricDifference(CodePointSet other) {
        Objects.requireNonNull(other, "other");
        var a = values;
        var b = other.values;
        var out = new int[a.length + b.length];
        int i = 0, j = 0, n = 0;
        while (i < a.length && j < b.length) {
            if (a[i] < b[j]) {
                out[n++] = a[i++];
            } else if (a[i] > b[j]) {
                out[n++] = b[j++];
            } else {
                i++;
                j++;
            }
        }
        while (i < a.length) {
            out[n++] = a[i++];
        }
        while (j < b.length) {
            out[n++] = b[j++];
        }
        return wrap(out, n);
    }

    /**
     * Inclusive: every set is a subset of itself.
     */
    public boolean isSubsetOf(CodePointSet other) {
        Objects.requireNonNull(other, "other");
        var a = values;
        var b = other.values;
        if (a.length > b.length) {
            return false;
        }
        var j = 0;
        for (var value : a) {
            while (j < b.length && b[j] < value) {
                j++;
            }
            if (j == b.length || b[j] != value) {
                return false;
            }
            j++;
        }
        return true;
    }

    public boolean isSupersetOf(CodePointSet other) {
        Objects.requireNonNull(other, "other");
        return other.isSubsetOf(this);
    }

    // ---------------------------------------------------------------- introspection

    public int size() {
        return values.length;
    }

    public boolean isEmpty() {
        return values.length == 0;
    }

    /**
     * Returns a copy of the contained code points.
     */
    public int[] toIntArray() {
        return values.clone();
    }

    public IntStream stream() {
        return Arrays.stream(values);
    }

    public IntEnumerator enumerator() {
        var snapshot = values;
        return new IntEnumerator() {
            private int index;

            @Override
            public boolean hasNext() {
                return index < snapshot.length;
            }

            @Override
            public int nextInt() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                return snapshot[index++];
            }
        };
    }

    // ---------------------------------------------------------------- well-known ASCII sets

    /**
     * C0 controls 0x00-0x1F and DEL 0x7F.
     */
    public static CodePointSet asciiControl() {
        return of(AsciiCodePoints.control());
    }

    public static CodePointSet asciiControlCached() {
        return ASCII_CONTROL.get();
    }

    /**
     * 0x20-0x7E.
     */
    public static CodePointSet asciiPrintable() {
        return of(AsciiCodePoints.printable());
    }

    public static CodePointSet asciiPrintableCached() {
        return ASCII_PRINTABLE.get();
    }

    /**
     * LF and CR.
     */
    public static CodePointSet crlf() {
        return of(AsciiCodePoints.crlf());
    }

    public static CodePointSet crlfCached() {
        return CRLF.get();
    }

    /**
     * All 128 ASCII code points.
     */
    public static CodePointSet asciiAll() {
        return of(AsciiCodePoints.all());
    }

    public static CodePointSet asciiAllCached() {
        return ASCII_ALL.get();
    }

    // ---------------------------------------------------------------- object

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        return Arrays.equals(values, ((CodePointSet) obj).values);
    }

    /**
     * Computed over the sorted values, so equal sets hash equally.
     */
    @Override
    public int hashCode() {
        return Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "CodePointSet(" + values.length + " items)";
    }

    // always a fresh instance, even when a result equals an operand
    private static CodePointSet wrap(int[] sortedDistinct, int length) {
        return new CodePointSet(length == sortedDistinct.length ? sortedDistinct : Arrays.copyOf(sortedDistinct, length));
    }

    // sorts and dedupes the first length entries of raw in place
    private static int[] normalize(int[] raw, int length) {
        if (length == 0) {
            return NO_VALUES;
        }
        for (var i = 0; i < length; i++) {
            requireCodePoint(raw[i]);
        }
        Arrays.sort(raw, 0, length);
        var n = 1;
        for (var i = 1; i < length; i++) {
            if (raw[i] != raw[n - 1]) {
                raw[n++] = raw[i];
            }
        }
        return n == raw.length ? raw : Arrays.copyOf(raw, n);
    }

    private static void requireCodePoint(int codePoint) {
        if (!Character.isValidCodePoint(codePoint)) {
            throw new IllegalArgumentException("code point out of range: " + ValidationError.formatCodePoint(codePoint));
        }
    }

    /**
     * Accumulates code points for a new {@link CodePointSet}.
     * <pre>
     * CodePointSet digitsAndYen = CodePointSet.builder()
     *     .addRange('0', '9')
     *     .add(0x00A5)
     *     .build();
     * </pre>
     * Not thread-safe. The builder can keep accumulating after {@link #build()}.
     */
    public static final class Builder {
        private static final int DEFAULT_CAPACITY = 16;

        private int[] values = new int[DEFAULT_CAPACITY];
        private int size;

        private Builder() {
        }

        public Builder add(int... codePoints) {
            Objects.requireNonNull(codePoints, "codePoints");
            for (var codePoint : codePoints) {
                append(codePoint);
            }
            return this;
        }

        /**
         * Adds {@code from} through {@code to}, both inclusive.
         */
        public Builder addRange(int from, int to) {
            requireCodePoint(from);
            requireCodePoint(to);
            if (from > to) {
                throw new IllegalArgumentException("invalid range: "
                        + ValidationError.formatCodePoint(from) + ".." + ValidationError.formatCodePoint(to));
            }
            ensureCapacity(size + (to - from + 1));
            for (var codePoint = from; codePoint <= to; codePoint++) {
                values[size++] = codePoint;
            }
            return this;
        }

        public Builder addAll(CharSequence text) {
            Objects.requireNonNull(text, "text");
            text.codePoints().forEach(this::append);
            return this;
        }

        public Builder addAll(CodePointSet set) {
            Objects.requireNonNull(set, "set");
            ensureCapacity(size + set.values.length);
            System.arraycopy(set.values, 0, values, size, set.values.length);
            size += set.values.length;
            return this;
        }

        public CodePointSet build() {
            if (size == 0) {
                return EMPTY;
            }
            return new CodePointSet(normalize(Arrays.copyOf(values, size), size));
        }

        private void append(int codePoint) {
            requireCodePoint(codePoint);
            ensureCapacity(size + 1);
            values[size++] = codePoint;
        }

        private void ensureCapacity(int neededCapacity) {
            if (neededCapacity <= values.length) {
                return;
            }
            values = Arrays.copyOf(values, Math.max(values.length * 2, neededCapacity));
        }
    }
}
