package io.jiscodepoints.data;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class AsciiCodePointsTest {

    @Test
    void controlShouldListC0ThenDelete() {
        var control = AsciiCodePoints.control();

        assertThat(control).hasSize(33);
        assertThat(control[0]).isZero();
        assertThat(control[31]).isEqualTo(0x1F);
        assertThat(control[32]).isEqualTo(AsciiCodePoints.DELETE);
    }

    @Test
    void printableShouldSpanSpaceToTilde() {
        assertThat(AsciiCodePoints.printable())
                .hasSize(95)
                .startsWith(0x20)
                .endsWith(0x7E);
    }

    @Test
    void allShouldConcatenateControlAndPrintable() {
        assertThat(AsciiCodePoints.all())
                .hasSize(128)
                .doesNotHaveDuplicates()
                .contains(AsciiCodePoints.LINE_FEED, AsciiCodePoints.CARRIAGE_RETURN);
    }

    @Test
    void shouldReturnFreshArrays() {
        var first = AsciiCodePoints.crlf();
        first[0] = 'x';

        assertThat(AsciiCodePoints.crlf()).containsExactly(0x0A, 0x0D);
    }
}
