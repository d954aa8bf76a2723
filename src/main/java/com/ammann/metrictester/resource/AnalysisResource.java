/* (C)2026 */
package com.ammann.metrictester.resource;

import com.ammann.metrictester.dto.AnalysisRequestDTO;
import com.ammann.metrictester.dto.AnalysisResponseDTO;
import com.ammann.metrictester.dto.RobustTestRequestDTO;
import com.ammann.metrictester.dto.RobustTestResultDTO;
import com.ammann.metrictester.enumeration.Alternative;
import com.ammann.metrictester.enumeration.GroupingMode;
import com.ammann.metrictester.exception.ValidationException;
import com.ammann.metrictester.model.AnalysisResult;
import com.ammann.metrictester.model.PhylogeneticTree;
import com.ammann.metrictester.model.RegionalAbundance;
import com.ammann.metrictester.model.RobustTestResult;
import com.ammann.metrictester.properties.ApiProperties;
import com.ammann.metrictester.service.AnalysisService;
import com.ammann.metrictester.service.RobustTestService;
import jakarta.inject.Inject;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import java.util.LinkedHashMap;
import java.util.Map;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.media.Content;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;

/**
 * REST resource running randomization analyses and standalone signed-rank tests.
 *
 * <p>Analyses run synchronously; the randomization itself is spread over the randomization
 * executor.
 */
@Path(ApiProperties.BASE_URL_V1 + ApiProperties.Analysis.BASE)
@Tag(name = "Analysis API", description = "Null model randomization, SES and significance")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class AnalysisResource {

    private static final Logger LOG = Logger.getLogger(AnalysisResource.class);

    @Inject
    AnalysisService analysisService;

    @Inject
    RobustTestService robustTestService;

    @POST
    @Path(ApiProperties.Analysis.RUN)
    @Operation(
            summary = "Run a randomization analysis",
            description = "Calculates observed metrics, randomizes the community under the selected null models and "
                    + "returns per null model summaries, SES, significance codes and signed-rank tests"
    )
    @APIResponses({
            @APIResponse(responseCode = "200", description = "Analysis completed",
                    content = @Content(schema = @Schema(implementation = AnalysisResponseDTO.class))),
            @APIResponse(responseCode = "400", description = "Invalid input or unknown metric or null model"),
            @APIResponse(responseCode = "409", description = "Observed units could not be aligned with the null summary"),
            @APIResponse(responseCode = "500", description = "Internal server error")
    })
    public Response runAnalysis(AnalysisRequestDTO request) {
        if (request == null || request.cdm() == null) {
            throw new ValidationException("Analysis requires a newick tree and a community data matrix");
        }
        GroupingMode mode = request.groupBy() == null
                ? GroupingMode.RICHNESS
                : GroupingMode.fromColumn(request.groupBy());
        Alternative alternative = Alternative.parse(request.alternative());
        PhylogeneticTree tree = PhylogeneticTree.fromNewick(request.newick());
        RegionalAbundance regional = request.regionalAbundance() == null || request.regionalAbundance().isEmpty()
                ? null
                : RegionalAbundance.ofIndividuals(request.regionalAbundance());

        LOG.debugf("Analysis request: metrics=%s nulls=%s groupBy=%s alternative=%s",
                request.metrics(), request.nulls(), mode.getColumn(), alternative);

        AnalysisResult result = analysisService.analyze(
                request.cdm().toMatrix(), tree, regional, request.metrics(), request.nulls(), mode, alternative);
        return Response.ok(AnalysisResponseDTO.from(result)).build();
    }

    @POST
    @Path(ApiProperties.Analysis.ROBUST_TEST)
    @Operation(
            summary = "Signed-rank test",
            description = "Tests each named column against a location of zero; richness and quadrat columns are skipped"
    )
    @APIResponses({
            @APIResponse(responseCode = "200", description = "Columns tested"),
            @APIResponse(responseCode = "400", description = "Invalid columns or alternative")
    })
    public Response robustTest(RobustTestRequestDTO request) {
        if (request == null || request.columns() == null) {
            throw new ValidationException("Signed-rank test requires columns");
        }
        Map<String, RobustTestResult> results = robustTestService.testColumns(
                request.toColumns(), Alternative.parse(request.alternative()));
        Map<String, RobustTestResultDTO> response = new LinkedHashMap<>();
        results.forEach((column, result) -> response.put(column, RobustTestResultDTO.from(result)));
        return Response.ok(response).build();
    }
}
