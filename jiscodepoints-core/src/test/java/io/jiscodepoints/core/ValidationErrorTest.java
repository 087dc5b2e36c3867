package io.jiscodepoints.core;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ValidationErrorTest {

    @Test
    void shouldRenderCharacterCodePointAndPosition() {
        var error = ValidationError.of(0x3046, 2);

        assertThat(error.message()).isEqualTo("invalid character 'う' (U+3046) at position 2");
        assertThat(error.toString()).isEqualTo(error.message());
    }

    @Test
    void shouldPadCodePointToFourDigits() {
        var error = ValidationError.of(0x0A, 0);

        assertThat(error.message()).contains("(U+000A)").endsWith("at position 0");
    }

    @Test
    void shouldRenderSupplementaryCodePointWithAllDigits() {
        var error = ValidationError.of(0x2000B, 5);

        assertThat(error.message()).isEqualTo("invalid character '𠀋' (U+2000B) at position 5");
    }

    @Test
    void shouldSubstituteReplacementGlyphForSurrogate() {
        var error = ValidationError.of(0xD800, 1);

        assertThat(error.message()).isEqualTo("invalid character '�' (U+D800) at position 1");
    }

    @Test
    void shouldSubstituteReplacementGlyphForOutOfRangeValue() {
        var error = ValidationError.of(0x110000, 0);

        assertThat(error.message()).contains("'�'").contains("U+110000");
    }

    @Test
    void shouldKeepCodePointAndPositionWithCustomMessage() {
        var error = ValidationError.withMessage(0x41, 0, "custom msg");

        assertThat(error.message()).isEqualTo("custom msg");
        assertThat(error.codePoint()).isEqualTo(0x41);
        assertThat(error.position()).isZero();
    }

    @Test
    void shouldReplaceMessageOnCopy() {
        var error = ValidationError.of(0x41, 3).withMessage("latin not allowed");

        assertThat(error).isEqualTo(new ValidationError(0x41, 3, "latin not allowed"));
    }

    @Test
    void shouldRejectNegativePosition() {
        assertThatThrownBy(() -> ValidationError.of(0x41, -1))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void exceptionShouldCarryError() {
        var error = ValidationError.of(0x78, 1);
        var exception = new CodePointValidationException(error);

        assertThat(exception)
                .isInstanceOf(JisCodePointsException.class)
                .hasMessage("invalid character 'x' (U+0078) at position 1");
        assertThat(exception.error()).isSameAs(error);
        assertThat(exception.codePoint()).isEqualTo(0x78);
        assertThat(exception.position()).isEqualTo(1);
    }
}
