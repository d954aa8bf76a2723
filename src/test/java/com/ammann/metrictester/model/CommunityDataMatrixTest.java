/* (C)2026 */
package com.ammann.metrictester.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.ammann.metrictester.exception.ValidationException;
import com.ammann.metrictester.support.TestDataFactory;
import java.util.List;
import org.junit.jupiter.api.Test;

class CommunityDataMatrixTest {

    private final CommunityDataMatrix cdm = TestDataFactory.threeUnitMatrix();

    @Test
    void reportsRichnessAndPresence() {
        assertThat(cdm.richness(0)).isEqualTo(2);
        assertThat(cdm.richness(2)).isEqualTo(1);
        assertThat(cdm.presentSpecies(1)).containsExactly("a", "c");
        assertThat(cdm.presentColumns(2)).containsExactly(3);
        assertThat(cdm.columnTotal(0)).isEqualTo(3.0);
        assertThat(cdm.columnOf("d")).isEqualTo(3);
        assertThat(cdm.columnOf("z")).isEqualTo(-1);
    }

    @Test
    void copiesInputCells() {
        double[][] cells = {{1, 0}};
        CommunityDataMatrix matrix = CommunityDataMatrix.of(List.of("1"), List.of("a", "b"), cells);

        cells[0][0] = 5;

        assertThat(matrix.abundance(0, 0)).isEqualTo(1.0);
        assertThat(matrix.toArray()[0]).containsExactly(1.0, 0.0);
    }

    @Test
    void rejectsNegativeAndNonFiniteCells() {
        assertThatThrownBy(() -> CommunityDataMatrix.of(List.of("1"), List.of("a"), new double[][] {{-1}}))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> CommunityDataMatrix.of(List.of("1"), List.of("a"), new double[][] {{Double.NaN}}))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void rejectsMismatchedDimensionsAndDuplicateLabels() {
        assertThatThrownBy(() -> CommunityDataMatrix.of(List.of("1", "2"), List.of("a"), new double[][] {{1}}))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> CommunityDataMatrix.of(List.of("1"), List.of("a", "b"), new double[][] {{1}}))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> CommunityDataMatrix.of(List.of("1"), List.of("a", "a"), new double[][] {{1, 1}}))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("unique label");
    }

    @Test
    void relabelKeepsCells() {
        CommunityDataMatrix relabelled = cdm.withSpecies(List.of("d", "c", "b", "a"));

        assertThat(relabelled.presentSpecies(0)).containsExactly("d", "c");
        assertThat(relabelled.abundance(1, 2)).isEqualTo(3.0);
    }
}
