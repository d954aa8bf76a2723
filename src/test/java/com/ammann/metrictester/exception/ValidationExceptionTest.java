/* (C)2026 */
package com.ammann.metrictester.exception;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.MethodSource;

class ValidationExceptionTest
{

    @ParameterizedTest
    @MethodSource("insufficientDataSamples")
    void buildsInsufficientDataMessages(String resource, int required, int actual, String expected)
    {
        ValidationException ex = ValidationException.insufficientData(resource, required, actual);
        assertThat(ex.getMessage()).isEqualTo(expected);
    }

    @ParameterizedTest
    @CsvSource({
            "quadratLength,-1,positive integer",
            "groupBy,species,richness or quadrat"
    })
    void buildsInvalidParameterMessage(String param, String value, String expectedFragment)
    {
        ValidationException ex = ValidationException.invalidParameter(param, value, expectedFragment);
        assertThat(ex.getMessage()).contains(param, value, expectedFragment);
    }

    @Test
    void specializedExceptionsAreValidationFailures()
    {
        assertThat(UnknownRegistryNameException.metric("PSE")).isInstanceOf(ValidationException.class);
        assertThat(InfeasibleParametersException.coverage(0.5, 0.4)).isInstanceOf(ValidationException.class);
        assertThat(InvalidInputTypeException.expected("NullsInput", "text")).isInstanceOf(ValidationException.class);
    }

    @Test
    void unknownNameKeepsRegistryAndName()
    {
        UnknownRegistryNameException ex = UnknownRegistryNameException.nullModel("trialSwap");

        assertThat(ex.getRegistry()).isEqualTo("null model");
        assertThat(ex.getName()).isEqualTo("trialSwap");
        assertThat(ex.getMessage()).isEqualTo("Unknown null model 'trialSwap'");
    }

    @Test
    void coverageMessageNamesBothFractions()
    {
        assertThat(InfeasibleParametersException.coverage(0.5, 0.4).getMessage())
                .contains("0.500", "0.40", "Sample less of total arena");
    }

    @Test
    void invalidInputNamesTheActualType()
    {
        assertThat(InvalidInputTypeException.expected("NullsInput", "text").getMessage())
                .isEqualTo("Input needs to be a prepared NullsInput, but got String");
        assertThat(InvalidInputTypeException.expected("MetricsInput", null).getMessage())
                .endsWith("but got null");
    }

    private static Stream<Arguments> insufficientDataSamples()
    {
        return Stream.of(
                Arguments.of("arena individuals", 1, 0,
                        "Insufficient arena individuals: need at least 1, but got 0"),
                Arguments.of("species in regional pool", 5, 2,
                        "Insufficient species in regional pool: need at least 5, but got 2")
        );
    }
}
