/* (C)2026 */
package com.ammann.metrictester.resource;

import com.ammann.metrictester.dto.MetricTableDTO;
import com.ammann.metrictester.dto.MetricsRequestDTO;
import com.ammann.metrictester.exception.ValidationException;
import com.ammann.metrictester.model.MetricTable;
import com.ammann.metrictester.model.PhylogeneticTree;
import com.ammann.metrictester.properties.ApiProperties;
import com.ammann.metrictester.service.MetricRunnerService;
import jakarta.inject.Inject;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.media.Content;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;

/**
 * REST resource calculating observed phylogenetic community metrics.
 */
@Path(ApiProperties.BASE_URL_V1 + ApiProperties.Metrics.BASE)
@Tag(name = "Metrics API", description = "Observed phylogenetic community structure metrics")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class MetricsResource {

    private static final Logger LOG = Logger.getLogger(MetricsResource.class);

    @Inject
    MetricRunnerService metricRunner;

    @POST
    @Path(ApiProperties.Metrics.OBSERVED)
    @Operation(
            summary = "Calculate observed metrics",
            description = "Calculates the selected metrics for every unit of a community data matrix"
    )
    @APIResponses({
            @APIResponse(responseCode = "200", description = "Metrics calculated",
                    content = @Content(schema = @Schema(implementation = MetricTableDTO.class))),
            @APIResponse(responseCode = "400", description = "Invalid tree, matrix or metric name")
    })
    public Response calculateObserved(MetricsRequestDTO request) {
        if (request == null || request.cdm() == null) {
            throw new ValidationException("Metric calculation requires a newick tree and a community data matrix");
        }
        PhylogeneticTree tree = PhylogeneticTree.fromNewick(request.newick());
        MetricTable table = metricRunner.runMetrics(request.cdm().toMatrix(), tree, request.metrics());

        LOG.infof("Calculated %d metrics for %d units", table.metrics().size(), table.rows().size());
        return Response.ok(MetricTableDTO.from(table)).build();
    }
}
