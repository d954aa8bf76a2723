/* (C)2026 */
package com.ammann.metrictester.resource;

import com.ammann.metrictester.dto.CatalogueDTO;
import com.ammann.metrictester.properties.ApiProperties;
import com.ammann.metrictester.service.MetricRegistry;
import com.ammann.metrictester.service.NullRegistry;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;

/**
 * REST resource listing the registered metrics and null models.
 */
@Path(ApiProperties.BASE_URL_V1 + ApiProperties.Registry.BASE)
@Tag(name = "Registry API", description = "Metric and null model catalogues")
@Produces(MediaType.APPLICATION_JSON)
public class RegistryResource {

    @Inject MetricRegistry metricRegistry;

    @Inject NullRegistry nullRegistry;

    @GET
    @Path(ApiProperties.Registry.METRICS)
    @Operation(summary = "List metrics", description = "Returns the metric catalogue, richness first")
    public Response getMetrics() {
        return Response.ok(new CatalogueDTO("metrics", metricRegistry.names())).build();
    }

    @GET
    @Path(ApiProperties.Registry.NULLS)
    @Operation(summary = "List null models", description = "Returns the null model catalogue")
    public Response getNulls() {
        return Response.ok(new CatalogueDTO("nulls", nullRegistry.names())).build();
    }
}
