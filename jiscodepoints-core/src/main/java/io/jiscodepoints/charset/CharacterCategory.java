package io.jiscodepoints.charset;

import io.jiscodepoints.core.ValidationError;
import io.jiscodepoints.data.AsciiCodePoints;
import io.jiscodepoints.data.JisX0201CodePoints;
import io.jiscodepoints.data.JisX0208CodePoints;
import io.jiscodepoints.data.JisX0208KanjiCodePoints;
import io.jiscodepoints.data.JisX0213KanjiCodePoints;
import io.jiscodepoints.kernel.CodePointSet;
import io.jiscodepoints.util.Lazy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Named character sets of the supported standards.
 * <p>
 * Each constant is a data table plus a cached {@link CodePointSet}. The cached
 * set is built on first use of {@link #codePoints()}, exactly once even under
 * concurrent first access, and the same instance is returned afterwards. The
 * ASCII constants share their cached instances with
 * {@link CodePointSet#asciiControlCached()} and its siblings.
 * <p>
 * Usage:
 * <pre>
 * CharacterCategory.JISX0208_HIRAGANA.contains("ひらがな");
 * CharacterCategory.union(JISX0208_HIRAGANA, JISX0208_KATAKANA).validate(input);
 * </pre>
 */
public enum CharacterCategory {

    ASCII_CONTROL("ASCII control characters", CodePointSet::asciiControlCached, AsciiCodePoints::control),
    ASCII_PRINTABLE("ASCII printable characters", CodePointSet::asciiPrintableCached, AsciiCodePoints::printable),
    CRLF("CR and LF", CodePointSet::crlfCached, AsciiCodePoints::crlf),
    ASCII_ALL("ASCII", CodePointSet::asciiAllCached, AsciiCodePoints::all),

    JISX0201_LATIN_LETTERS("JIS X 0201 Latin letters", JisX0201CodePoints::latinLetters),
    JISX0201_KATAKANA("JIS X 0201 halfwidth katakana", JisX0201CodePoints::katakana),
    JISX0201("JIS X 0201", JisX0201CodePoints::all),

    JISX0208_HIRAGANA("JIS X 0208 hiragana", JisX0208CodePoints::hiragana),
    JISX0208_KATAKANA("JIS X 0208 katakana", JisX0208CodePoints::katakana),
    JISX0208_LATIN_LETTERS("JIS X 0208 fullwidth Latin letters", JisX0208CodePoints::latinLetters),
    JISX0208_GREEK_LETTERS("JIS X 0208 Greek letters", JisX0208CodePoints::greekLetters),
    JISX0208_CYRILLIC_LETTERS("JIS X 0208 Cyrillic letters", JisX0208CodePoints::cyrillicLetters),
    JISX0208_SPECIAL_CHARS("JIS X 0208 special characters", JisX0208CodePoints::specialChars),
    JISX0208_BOX_DRAWING_CHARS("JIS X 0208 box drawing characters", JisX0208CodePoints::boxDrawingChars),
    JISX0208("JIS X 0208 non-kanji", JisX0208CodePoints::all),

    JISX0208_KANJI("JIS X 0208 kanji", JisX0208KanjiCodePoints::kanji),
    JISX0213_KANJI("JIS X 0213 kanji", JisX0213KanjiCodePoints::kanji);

    private static final Logger log = LoggerFactory.getLogger(CharacterCategory.class);

    private final String displayName;
    private final Supplier<int[]> table;
    private final Lazy<CodePointSet> cached;

    CharacterCategory(String displayName, Supplier<int[]> table) {
        this.displayName = displayName;
        this.table = table;
        this.cached = Lazy.of(this::buildCached);
    }

    CharacterCategory(String displayName, Supplier<CodePointSet> shared, Supplier<int[]> table) {
        this.displayName = displayName;
        this.table = table;
        this.cached = Lazy.of(shared);
    }

    /**
     * Returns the shared, lazily built set for this category.
     */
    public CodePointSet codePoints() {
        return cached.get();
    }

    /**
     * Builds a fresh set from this category's table.
     */
    public CodePointSet newCodePoints() {
        return CodePointSet.of(table.get());
    }

    public boolean contains(CharSequence text) {
        return codePoints().contains(text);
    }

    public Optional<ValidationError> check(CharSequence text) {
        return codePoints().check(text);
    }

    /**
     * @throws io.jiscodepoints.core.CodePointValidationException on the first character outside this category
     */
    public void validate(CharSequence text) {
        codePoints().validate(text);
    }

    public String displayName() {
        return displayName;
    }

    /**
     * Returns a new set covering all of {@code categories}.
     */
    public static CodePointSet union(CharacterCategory... categories) {
        Objects.requireNonNull(categories, "categories");
        var builder = CodePointSet.builder();
        for (var category : categories) {
            builder.addAll(Objects.requireNonNull(category, "category").codePoints());
        }
        return builder.build();
    }

    private CodePointSet buildCached() {
        var set = newCodePoints();
        log.debug("Initialized {} ({} code points)", displayName, set.size());
        return set;
    }
}
