/* (C)2026 */
package com.ammann.metrictester.resource;

import com.ammann.metrictester.dto.ArenaSamplingRequestDTO;
import com.ammann.metrictester.dto.QuadratBoundsDTO;
import com.ammann.metrictester.dto.QuadratPlacementRequestDTO;
import com.ammann.metrictester.dto.SampledCommunityDTO;
import com.ammann.metrictester.exception.ValidationException;
import com.ammann.metrictester.model.QuadratBounds;
import com.ammann.metrictester.model.SampledCommunity;
import com.ammann.metrictester.properties.ApiProperties;
import com.ammann.metrictester.service.QuadratPlacementService;
import jakarta.inject.Inject;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import java.util.List;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.media.Content;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;

/**
 * REST resource for quadrat placement and arena sampling.
 */
@Path(ApiProperties.BASE_URL_V1 + ApiProperties.Quadrats.BASE)
@Tag(name = "Quadrat API", description = "Quadrat placement in simulated arenas")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class QuadratResource {

    private static final Logger LOG = Logger.getLogger(QuadratResource.class);

    @Inject
    QuadratPlacementService placementService;

    @POST
    @Path(ApiProperties.Quadrats.PLACE)
    @Operation(
            summary = "Place quadrats",
            description = "Places non-overlapping square quadrats at random integer origins in a square arena"
    )
    @APIResponses({
            @APIResponse(responseCode = "200", description = "Quadrats placed",
                    content = @Content(schema = @Schema(implementation = QuadratBoundsDTO.class))),
            @APIResponse(responseCode = "400", description = "Invalid or infeasible parameters"),
            @APIResponse(responseCode = "409", description = "A quadrat found no free position")
    })
    public Response placeQuadrats(QuadratPlacementRequestDTO request) {
        if (request == null || request.count() == null || request.arenaLength() == null
                || request.quadratLength() == null) {
            throw new ValidationException("Quadrat placement requires count, arenaLength and quadratLength");
        }
        LOG.debugf("Quadrat placement request: count=%d arenaLength=%d quadratLength=%d",
                request.count(), request.arenaLength(), request.quadratLength());

        List<QuadratBounds> bounds = placementService.placeQuadrats(
                request.count(), request.arenaLength(), request.quadratLength());
        return Response.ok(bounds.stream().map(QuadratBoundsDTO::from).toList()).build();
    }

    @POST
    @Path(ApiProperties.Quadrats.SAMPLE)
    @Operation(
            summary = "Sample an arena",
            description = "Places quadrats in a simulated arena and returns the community data matrix of their contents"
    )
    @APIResponses({
            @APIResponse(responseCode = "200", description = "Arena sampled",
                    content = @Content(schema = @Schema(implementation = SampledCommunityDTO.class))),
            @APIResponse(responseCode = "400", description = "Invalid arena or parameters"),
            @APIResponse(responseCode = "409", description = "A quadrat found no free position")
    })
    public Response sampleArena(ArenaSamplingRequestDTO request) {
        if (request == null || request.arena() == null || request.quadratCount() == null
                || request.quadratLength() == null) {
            throw new ValidationException("Arena sampling requires arena, quadratCount and quadratLength");
        }
        SampledCommunity sampled = placementService.sampleArena(
                request.arena().toArena(), request.quadratCount(), request.quadratLength());
        return Response.ok(SampledCommunityDTO.from(sampled)).build();
    }
}
