package io.jiscodepoints.benchmarks;

import io.jiscodepoints.charset.CharacterCategory;
import io.jiscodepoints.kernel.CodePointSet;
import io.jiscodepoints.kernel.MultiSetMembership;
import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.OutputTimeUnit;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.Warmup;
import org.openjdk.jmh.infra.Blackhole;

import java.util.List;
import java.util.Random;
import java.util.concurrent.TimeUnit;

@State(Scope.Benchmark)
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.NANOSECONDS)
@Warmup(iterations = 2, time = 2, timeUnit = TimeUnit.SECONDS)
@Measurement(iterations = 3, time = 2, timeUnit = TimeUnit.SECONDS)
@Fork(1)
public class CodePointSetBenchmark {

    @Param({"16", "1024"})
    public int textLength;

    private CodePointSet kanji;
    private CodePointSet hiragana;
    private CodePointSet katakana;
    private List<CodePointSet> kana;
    private String kanjiText;
    private String kanaText;
    private String kanaTextWithTrailingLatin;

    @Setup(Level.Trial)
    public void setup() {
        kanji = CharacterCategory.JISX0208_KANJI.codePoints();
        hiragana = CharacterCategory.JISX0208_HIRAGANA.codePoints();
        katakana = CharacterCategory.JISX0208_KATAKANA.codePoints();
        kana = List.of(hiragana, katakana);

        var random = new Random(42);
        kanjiText = randomText(random, kanji.toIntArray(), textLength);
        kanaText = randomText(random, hiragana.union(katakana).toIntArray(), textLength);
        kanaTextWithTrailingLatin = kanaText + "x";
    }

    @Benchmark
    public boolean containsKanji() {
        return kanji.contains(kanjiText);
    }

    @Benchmark
    public void firstExcludedAtEnd(Blackhole blackhole) {
        blackhole.consume(hiragana.union(katakana).firstExcludedWithPosition(kanaTextWithTrailingLatin));
    }

    @Benchmark
    public boolean containsAllInAnyKana() {
        return MultiSetMembership.containsAllInAny(kanaText, kana);
    }

    @Benchmark
    public int[] allExcludedKanjiFromKana() {
        return hiragana.allExcluded(kanjiText);
    }

    @Benchmark
    public CodePointSet unionKanjiAndKana() {
        return kanji.union(hiragana);
    }

    @Benchmark
    public CodePointSet buildKanjiSet() {
        return CharacterCategory.JISX0208_KANJI.newCodePoints();
    }

    private static String randomText(Random random, int[] alphabet, int length) {
        var text = new StringBuilder(length);
        for (var i = 0; i < length; i++) {
            text.appendCodePoint(alphabet[random.nextInt(alphabet.length)]);
        }
        return text.toString();
    }
}
