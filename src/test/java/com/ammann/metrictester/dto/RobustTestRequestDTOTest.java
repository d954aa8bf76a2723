/* (C)2026 */
package com.ammann.metrictester.dto;

import static org.assertj.core.api.Assertions.assertThat;

import com.ammann.metrictester.model.RobustTestResult;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class RobustTestRequestDTOTest
{
    @Test
    void nullEntriesBecomeNan()
    {
        Map<String, List<Double>> columns = new LinkedHashMap<>();
        columns.put("MPD", Arrays.asList(1.0, null, -2.0));
        columns.put("PSV", null);

        Map<String, double[]> converted = new RobustTestRequestDTO(columns, "greater").toColumns();

        assertThat(converted.keySet()).containsExactly("MPD", "PSV");
        assertThat(converted.get("MPD")).containsExactly(1.0, Double.NaN, -2.0);
        assertThat(converted.get("PSV")).isNull();
    }

    @Test
    void missingColumnsGiveEmptyMap()
    {
        assertThat(new RobustTestRequestDTO(null, null).toColumns()).isEmpty();
    }

    @Test
    void resultNamesItsMethod()
    {
        RobustTestResultDTO exact = RobustTestResultDTO.from(new RobustTestResult(3.0, 0.0625, 5, 15.0, true));
        RobustTestResultDTO approx = RobustTestResultDTO.from(new RobustTestResult(Double.NaN, Double.NaN, 0, 0.0, false));

        assertThat(exact.method()).isEqualTo("exact");
        assertThat(exact.pValue()).isEqualTo(0.0625);
        assertThat(approx.method()).isEqualTo("normal approximation");
        assertThat(approx.estimate()).isNull();
        assertThat(approx.pValue()).isNull();
    }
}
