package io.jiscodepoints.kernel;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class AsciiCodePointSetTest {

    @Test
    void printableShouldAcceptVisibleAsciiAndSpace() {
        var printable = CodePointSet.asciiPrintable();

        assertThat(printable.size()).isEqualTo(95);
        assertThat(printable.contains("Hello World!")).isTrue();
        assertThat(printable.contains("Hello World 123!@#")).isTrue();
        assertThat(printable.contains("Hello\n")).isFalse();
        assertThat(printable.firstExcluded("a-b-c-あ")).hasValue(0x3042);
    }

    @Test
    void printableShouldReportNulPosition() {
        var error = CodePointSet.asciiPrintable().check("Hello\0World").orElseThrow();

        assertThat(error.codePoint()).isZero();
        assertThat(error.position()).isEqualTo(5);
        assertThat(error.message()).contains("U+0000").endsWith("at position 5");
    }

    @Test
    void controlShouldHoldC0AndDelete() {
        var control = CodePointSet.asciiControl();

        assertThat(control.size()).isEqualTo(33);
        assertThat(control.contains("\n\r\t")).isTrue();
        assertThat(control.containsCodePoint(0x7F)).isTrue();
        assertThat(control.containsCodePoint(0x20)).isFalse();
        assertThat(control.contains("a\n\r\t")).isFalse();
        assertThat(control.firstExcluded("\n\rA\t")).hasValue(0x41);
    }

    @Test
    void crlfShouldHoldExactlyCarriageReturnAndLineFeed() {
        var crlf = CodePointSet.crlf();

        assertThat(crlf).isEqualTo(CodePointSet.of(0x0A, 0x0D));
        assertThat(crlf.contains("\r\n")).isTrue();
        assertThat(crlf.contains("\r\n\t")).isFalse();
        assertThat(crlf.firstExcluded("\r\n\t")).hasValue(0x09);
    }

    @Test
    void allShouldBeUnionOfControlAndPrintable() {
        var all = CodePointSet.asciiAll();

        assertThat(all.size()).isEqualTo(128);
        assertThat(all).isEqualTo(CodePointSet.asciiControl().union(CodePointSet.asciiPrintable()));
        assertThat(all.isSupersetOf(CodePointSet.crlf())).isTrue();
        assertThat(all.contains("Tab\tand\r\nDEL\u007F")).isTrue();
        assertThat(all.contains("é")).isFalse();
    }

    @Test
    void controlAndPrintableShouldBeDisjoint() {
        assertThat(CodePointSet.asciiControl().intersection(CodePointSet.asciiPrintable()).isEmpty()).isTrue();
    }

    @Test
    void cachedAccessorsShouldReturnSameInstance() {
        assertThat(CodePointSet.asciiControlCached()).isSameAs(CodePointSet.asciiControlCached());
        assertThat(CodePointSet.asciiPrintableCached()).isSameAs(CodePointSet.asciiPrintableCached());
        assertThat(CodePointSet.crlfCached()).isSameAs(CodePointSet.crlfCached());
        assertThat(CodePointSet.asciiAllCached()).isSameAs(CodePointSet.asciiAllCached());
    }

    @Test
    void cachedAccessorsShouldEqualAllocatingFactories() {
        assertThat(CodePointSet.asciiPrintableCached())
                .isEqualTo(CodePointSet.asciiPrintable())
                .isNotSameAs(CodePointSet.asciiPrintable());
        assertThat(CodePointSet.asciiAllCached()).isEqualTo(CodePointSet.asciiAll());
    }

    @Test
    void cachedAccessorShouldYieldOneInstanceAcrossThreads() throws Exception {
        var threads = 8;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        var start = new CountDownLatch(1);
        List<Future<CodePointSet>> results = new ArrayList<>();
        try {
            for (var t = 0; t < threads; t++) {
                results.add(pool.submit(() -> {
                    start.await();
                    return CodePointSet.crlfCached();
                }));
            }
            start.countDown();

            for (var result : results) {
                assertThat(result.get(10, TimeUnit.SECONDS)).isSameAs(CodePointSet.crlfCached());
            }
        } finally {
            pool.shutdownNow();
        }
    }
}
