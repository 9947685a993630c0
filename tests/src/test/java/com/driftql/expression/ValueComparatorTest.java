package com.driftql.expression;

import com.driftql.test.TestBase;
import com.driftql.test.TestCategories;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("ValueComparator Tests")
public class ValueComparatorTest extends TestBase {

    private final ValueComparator comparator = ValueComparator.INSTANCE;

    @Test
    @DisplayName("Values of different types sort null < bool < number < string < array < object")
    void testCrossTypeOrder() {
        List<Object> values = new ArrayList<>(Arrays.asList(
            Map.of("a", 1), List.of(1), "a", 1L, true, null));

        values.sort(comparator);

        assertThat(values).containsExactly(null, true, 1L, "a", List.of(1), Map.of("a", 1));
    }

    @Test
    @DisplayName("Numbers compare by value regardless of their Java type")
    void testNumbers() {
        assertThat(comparator.compare(1L, 1.0)).isZero();
        assertThat(comparator.compare(2, 10L)).isNegative();
        assertThat(comparator.compare(2.5, 2L)).isPositive();
    }

    @Test
    @DisplayName("Strings compare lexicographically")
    void testStrings() {
        assertThat(comparator.compare("abc", "abd")).isNegative();
        assertThat(comparator.compare("b", "abc")).isPositive();
    }

    @Test
    @DisplayName("Arrays compare element-wise, then by length")
    void testArrays() {
        assertThat(comparator.compare(List.of(1, 2), List.of(1, 3))).isNegative();
        assertThat(comparator.compare(List.of(1, 2), List.of(1))).isPositive();
        assertThat(comparator.compare(List.of(1, "a"), List.of(1L, "a"))).isZero();
    }

    @Test
    @DisplayName("Objects compare by sorted keys, then by values")
    void testObjects() {
        assertThat(comparator.compare(Map.of("a", 1, "b", 2), Map.of("b", 2, "a", 1))).isZero();
        assertThat(comparator.compare(Map.of("a", 1), Map.of("b", 1))).isNegative();
        assertThat(comparator.compare(Map.of("a", 2), Map.of("a", 1))).isPositive();
    }

    @Test
    @DisplayName("Non-document values are rejected")
    void testRejectsForeignTypes() {
        assertThatThrownBy(() -> comparator.compare(new Object(), 1))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Not a document value");
    }
}
