package io.jiscodepoints.kernel;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.Random;
import java.util.stream.IntStream;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

class CodePointSetAlgebraTest {

    private static final CodePointSet A = CodePointSet.of(0x3042, 0x3044);
    private static final CodePointSet B = CodePointSet.of(0x3044, 0x3046);

    @Test
    void unionShouldCoverBothOperands() {
        var union = A.union(B);

        assertThat(union.size()).isEqualTo(3);
        assertThat(union.contains("あいう")).isTrue();
    }

    @Test
    void intersectionShouldKeepSharedValues() {
        var intersection = A.intersection(B);

        assertThat(intersection.size()).isEqualTo(1);
        assertThat(intersection.contains("い")).isTrue();
        assertThat(intersection.contains("あ")).isFalse();
        assertThat(intersection.contains("う")).isFalse();
    }

    @Test
    void differenceShouldKeepLeftOnlyValues() {
        var difference = A.difference(B);

        assertThat(difference.size()).isEqualTo(1);
        assertThat(difference.contains("あ")).isTrue();
        assertThat(difference.contains("い")).isFalse();
    }

    @Test
    void symmetricDifferenceShouldDropSharedValues() {
        var symmetric = A.symmetricDifference(B);

        assertThat(symmetric.contains("あ")).isTrue();
        assertThat(symmetric.contains("う")).isTrue();
        assertThat(symmetric.contains("い")).isFalse();
        assertThat(symmetric.size()).isEqualTo(2);
    }

    @Test
    void operationsShouldNotModifyOperands() {
        var left = CodePointSet.of(0x3042, 0x3044);
        var right = CodePointSet.of(0x3044, 0x3046);

        left.union(right);
        left.intersection(right);
        left.difference(right);
        left.symmetricDifference(right);

        assertThat(left).isEqualTo(A);
        assertThat(right).isEqualTo(B);
    }

    @Test
    void operationsShouldReturnNewInstances() {
        var empty = CodePointSet.empty();

        assertThat(A.union(empty)).isEqualTo(A).isNotSameAs(A);
        assertThat(A.intersection(A)).isEqualTo(A).isNotSameAs(A);
    }

    @Test
    void subsetAndSupersetShouldBeInclusive() {
        assertThat(A.isSubsetOf(A)).isTrue();
        assertThat(A.isSupersetOf(A)).isTrue();
        assertThat(CodePointSet.empty().isSubsetOf(A)).isTrue();
        assertThat(A.isSubsetOf(B)).isFalse();
        assertThat(A.union(B).isSupersetOf(B)).isTrue();
        assertThat(B.isSupersetOf(A.union(B))).isFalse();
    }

    static Stream<Arguments> randomPairs() {
        var random = new Random(20240101L);
        return IntStream.range(0, 25).mapToObj(i -> Arguments.of(
                randomSet(random, random.nextInt(40)),
                randomSet(random, random.nextInt(40))));
    }

    @ParameterizedTest
    @MethodSource("randomPairs")
    void unionShouldBeSupersetOfOperands(CodePointSet s, CodePointSet t) {
        assertThat(s.union(t).isSupersetOf(s)).isTrue();
        assertThat(s.union(t).isSupersetOf(t)).isTrue();
    }

    @ParameterizedTest
    @MethodSource("randomPairs")
    void intersectionShouldBeSubsetOfOperands(CodePointSet s, CodePointSet t) {
        assertThat(s.intersection(t).isSubsetOf(s)).isTrue();
        assertThat(s.intersection(t).isSubsetOf(t)).isTrue();
    }

    @ParameterizedTest
    @MethodSource("randomPairs")
    void differenceShouldBeDisjointFromSubtrahend(CodePointSet s, CodePointSet t) {
        assertThat(s.difference(t).intersection(t).isEmpty()).isTrue();
    }

    @ParameterizedTest
    @MethodSource("randomPairs")
    void symmetricDifferenceShouldEqualUnionMinusIntersection(CodePointSet s, CodePointSet t) {
        var expected = s.union(t).difference(s.intersection(t));

        assertThat(s.symmetricDifference(t)).isEqualTo(expected);
        assertThat(s.symmetricDifference(t).hashCode()).isEqualTo(expected.hashCode());
        assertThat(t.symmetricDifference(s)).isEqualTo(expected);
    }

    @ParameterizedTest
    @MethodSource("randomPairs")
    void unionAndIntersectionShouldBeIdempotent(CodePointSet s, CodePointSet t) {
        assertThat(s.union(s)).isEqualTo(s);
        assertThat(s.intersection(s)).isEqualTo(s);
        assertThat(t.union(t)).isEqualTo(t);
    }

    @ParameterizedTest
    @MethodSource("randomPairs")
    void sizesShouldFollowInclusionExclusion(CodePointSet s, CodePointSet t) {
        assertThat(s.union(t).size() + s.intersection(t).size()).isEqualTo(s.size() + t.size());
        assertThat(s.isSubsetOf(t)).isEqualTo(s.difference(t).isEmpty());
    }

    @ParameterizedTest
    @MethodSource("randomPairs")
    void containsShouldAgreeWithFirstExcluded(CodePointSet s, CodePointSet t) {
        var text = new StringBuilder();
        t.stream().forEach(text::appendCodePoint);

        assertThat(s.contains(text)).isEqualTo(s.firstExcluded(text).isEmpty());
        assertThat(s.contains(text)).isEqualTo(t.isSubsetOf(s));
        assertThat(s.allExcluded(text)).doesNotHaveDuplicates();
    }

    private static CodePointSet randomSet(Random random, int size) {
        var values = new int[size];
        for (var i = 0; i < size; i++) {
            // small alphabet so pairs overlap, with some supplementary values
            values[i] = random.nextBoolean() ? 0x3041 + random.nextInt(48) : 0x20000 + random.nextInt(16);
        }
        return CodePointSet.of(values);
    }
}
