/* (C)2026 */
package com.ammann.metrictester.resource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.ammann.metrictester.dto.AnalysisRequestDTO;
import com.ammann.metrictester.dto.AnalysisResponseDTO;
import com.ammann.metrictester.dto.CommunityMatrixDTO;
import com.ammann.metrictester.dto.NullModelResultDTO;
import com.ammann.metrictester.dto.RobustTestRequestDTO;
import com.ammann.metrictester.dto.RobustTestResultDTO;
import com.ammann.metrictester.enumeration.Alternative;
import com.ammann.metrictester.enumeration.GroupingMode;
import com.ammann.metrictester.exception.ValidationException;
import com.ammann.metrictester.model.AnalysisResult;
import com.ammann.metrictester.model.MetricTable;
import com.ammann.metrictester.service.AnalysisService;
import com.ammann.metrictester.service.MetricRegistry;
import com.ammann.metrictester.service.MetricRunnerService;
import com.ammann.metrictester.service.RobustTestService;
import com.ammann.metrictester.service.SignificanceService;
import com.ammann.metrictester.service.StandardizationService;
import com.ammann.metrictester.service.SummaryService;
import com.ammann.metrictester.support.TestDataFactory;
import jakarta.ws.rs.core.Response;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class AnalysisResourceTest {

    private AnalysisResource resource;

    @BeforeEach
    void setUp() {
        resource = new AnalysisResource();
        resource.analysisService = new AnalysisService(
                new MetricRunnerService(new MetricRegistry()),
                TestDataFactory.directRandomization(4, 99L),
                new SummaryService(0.95),
                new StandardizationService(),
                new SignificanceService(),
                new RobustTestService());
        resource.robustTestService = new RobustTestService();
    }

    @Test
    void runsAnalysisGroupedByRichnessByDefault() {
        AnalysisRequestDTO request = new AnalysisRequestDTO(
                TestDataFactory.BALANCED_NEWICK,
                CommunityMatrixDTO.from(TestDataFactory.sixUnitMatrix()),
                List.of("a", "a", "b", "c", "d"),
                List.of("MPD"),
                List.of("richness", "taxaLabels"),
                null,
                null);

        Response response = resource.runAnalysis(request);

        assertThat(response.getStatus()).isEqualTo(200);
        AnalysisResponseDTO body = (AnalysisResponseDTO) response.getEntity();
        assertThat(body.groupBy()).isEqualTo("richness");
        assertThat(body.alternative()).isEqualTo("TWO_SIDED");
        assertThat(body.observed().metrics()).containsExactly("richness", "MPD");
        assertThat(body.nulls().keySet()).containsExactly("richness", "taxaLabels");
        NullModelResultDTO richness = body.nulls().get("richness");
        assertThat(richness.replicates()).isEqualTo(4);
        assertThat(richness.ses()).hasSize(6);
        assertThat(richness.significance()).allSatisfy(row -> assertThat(row.codes().get("MPD")).isBetween(0, 2));
        assertThat(richness.robust()).containsOnlyKeys("MPD");
    }

    @Test
    void passesParsedOptionsToService() {
        AnalysisService service = mock(AnalysisService.class);
        MetricTable observed = new MetricTable(List.of("richness"), List.of());
        when(service.analyze(any(), any(), any(), any(), any(), eq(GroupingMode.QUADRAT), eq(Alternative.LESS)))
                .thenReturn(new AnalysisResult(observed, GroupingMode.QUADRAT, Alternative.LESS, Map.of()));
        resource.analysisService = service;

        Response response = resource.runAnalysis(new AnalysisRequestDTO(
                TestDataFactory.BALANCED_NEWICK,
                CommunityMatrixDTO.from(TestDataFactory.threeUnitMatrix()),
                null, null, null, "Quadrat", "less"));

        AnalysisResponseDTO body = (AnalysisResponseDTO) response.getEntity();
        assertThat(body.groupBy()).isEqualTo("quadrat");
        assertThat(body.alternative()).isEqualTo("LESS");
        assertThat(body.nulls()).isEmpty();
    }

    @Test
    void rejectsUnknownGrouping() {
        AnalysisRequestDTO request = new AnalysisRequestDTO(
                TestDataFactory.BALANCED_NEWICK,
                CommunityMatrixDTO.from(TestDataFactory.sixUnitMatrix()),
                null, null, null, "species", null);

        assertThatThrownBy(() -> resource.runAnalysis(request))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("groupBy");
    }

    @Test
    void rejectsMissingMatrix() {
        assertThatThrownBy(() -> resource.runAnalysis(
                        new AnalysisRequestDTO(TestDataFactory.BALANCED_NEWICK, null, null, null, null, null, null)))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    @SuppressWarnings("unchecked")
    void testsColumnsSkippingIdentityColumns() {
        RobustTestRequestDTO request = new RobustTestRequestDTO(
                Map.of(
                        "richness", List.of(2.0, 3.0, 4.0),
                        "SES", List.of(1.0, 2.0, 3.0, 4.0, 5.0)),
                "greater");

        Response response = resource.robustTest(request);

        Map<String, RobustTestResultDTO> body = (Map<String, RobustTestResultDTO>) response.getEntity();
        assertThat(body).containsOnlyKeys("SES");
        assertThat(body.get("SES").pValue()).isEqualTo(0.03125);
        assertThat(body.get("SES").method()).isEqualTo("exact");
    }

    @Test
    void rejectsRobustTestWithoutColumns() {
        assertThatThrownBy(() -> resource.robustTest(new RobustTestRequestDTO(null, null)))
                .isInstanceOf(ValidationException.class);
    }
}
