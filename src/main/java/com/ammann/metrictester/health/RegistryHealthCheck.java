/* (C)2026 */
package com.ammann.metrictester.health;

import com.ammann.metrictester.model.MetricTable;
import com.ammann.metrictester.service.MetricRegistry;
import com.ammann.metrictester.service.NullRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.List;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.HealthCheckResponseBuilder;
import org.eclipse.microprofile.health.Readiness;
import org.jboss.logging.Logger;

/**
 * Readiness check for the metric and null model catalogues.
 *
 * <p>The service is ready when both catalogues are non-empty and the metric catalogue starts
 * with richness, which every metric table relies on.
 */
@Readiness
@ApplicationScoped
public class RegistryHealthCheck implements HealthCheck {

    private static final Logger LOG = Logger.getLogger(RegistryHealthCheck.class);
    private static final String HEALTH_CHECK_NAME = "registries";

    @Inject MetricRegistry metricRegistry;

    @Inject NullRegistry nullRegistry;

    @Override
    public HealthCheckResponse call() {
        List<String> metrics = metricRegistry.names();
        List<String> nulls = nullRegistry.names();
        boolean richnessFirst = !metrics.isEmpty() && MetricTable.RICHNESS.equals(metrics.get(0));

        HealthCheckResponseBuilder builder = HealthCheckResponse.named(HEALTH_CHECK_NAME)
                .withData("metrics", metrics.size())
                .withData("nulls", nulls.size())
                .withData("richness-first", richnessFirst);

        if (!richnessFirst || nulls.isEmpty()) {
            LOG.warnf("Registries not ready: metrics=%s nulls=%s", metrics, nulls);
            return builder.down().build();
        }
        return builder.up().build();
    }
}
