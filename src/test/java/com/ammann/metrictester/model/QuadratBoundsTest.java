/* (C)2026 */
package com.ammann.metrictester.model;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class QuadratBoundsTest {

    private final QuadratBounds base = new QuadratBounds(1, 10, 20, 10, 20);

    @ParameterizedTest
    @CsvSource({
        "15, 25, 15, 25, true",
        "20, 30, 10, 20, true",
        "21, 31, 10, 20, false",
        "10, 20, 21, 31, false",
        "0, 9, 0, 9, false",
        "12, 18, 12, 18, true"
    })
    void overlapIsInclusive(int xMin, int xMax, int yMin, int yMax, boolean expected) {
        QuadratBounds other = new QuadratBounds(2, xMin, xMax, yMin, yMax);

        assertThat(base.overlaps(other)).isEqualTo(expected);
        assertThat(other.overlaps(base)).isEqualTo(expected);
    }

    @ParameterizedTest
    @CsvSource({"10, 10, true", "20, 20, true", "15.5, 19.9, true", "9.99, 15, false", "15, 20.01, false"})
    void containsIsInclusive(double x, double y, boolean expected) {
        assertThat(base.contains(x, y)).isEqualTo(expected);
    }
}
