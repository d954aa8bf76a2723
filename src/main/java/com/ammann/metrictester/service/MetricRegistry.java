/* (C)2026 */
package com.ammann.metrictester.service;

import com.ammann.metrictester.exception.UnknownRegistryNameException;
import com.ammann.metrictester.metric.CommunityMetric;
import com.ammann.metrictester.metric.PhylogeneticMetrics;
import com.ammann.metrictester.model.MetricTable;
import jakarta.enterprise.context.ApplicationScoped;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jboss.logging.Logger;

/**
 * Catalogue of named community metrics.
 *
 * <p>The richness metric is part of every catalogue and heads every selection, whatever subset
 * the caller asks for. The catalogue is fixed once the registry is built.
 */
@ApplicationScoped
public class MetricRegistry {

    private static final Logger LOG = Logger.getLogger(MetricRegistry.class);

    private final Map<String, CommunityMetric> catalogue;

    /** Registry holding the built-in metrics. */
    public MetricRegistry() {
        this(builtIns());
    }

    /**
     * Registry over a caller-defined catalogue. The canonical richness metric is added in front
     * if the catalogue does not define one; a caller-defined richness entry is moved to the front.
     *
     * @param metrics metrics by name, in catalogue order
     */
    public MetricRegistry(Map<String, CommunityMetric> metrics) {
        Map<String, CommunityMetric> ordered = new LinkedHashMap<>();
        ordered.put(MetricTable.RICHNESS,
                metrics.getOrDefault(MetricTable.RICHNESS, PhylogeneticMetrics::richness));
        metrics.forEach(ordered::putIfAbsent);
        this.catalogue = Collections.unmodifiableMap(ordered);
        LOG.debugf("Metric registry initialized with %d metrics: %s", catalogue.size(), catalogue.keySet());
    }

    private static Map<String, CommunityMetric> builtIns() {
        Map<String, CommunityMetric> metrics = new LinkedHashMap<>();
        metrics.put(MetricTable.RICHNESS, PhylogeneticMetrics::richness);
        metrics.put("PSV", PhylogeneticMetrics::psv);
        metrics.put("PSR", PhylogeneticMetrics::psr);
        metrics.put("PSC", PhylogeneticMetrics::psc);
        metrics.put("MPD", PhylogeneticMetrics::mpd);
        metrics.put("MNTD", PhylogeneticMetrics::mntd);
        metrics.put("PD", PhylogeneticMetrics::pd);
        return metrics;
    }

    /**
     * Resolves a metric subset.
     *
     * @param names requested metric names, {@code null} or empty for the whole catalogue
     * @return metrics by name, richness first, then the requested metrics in request order
     * @throws UnknownRegistryNameException if a name is not in the catalogue
     */
    public Map<String, CommunityMetric> select(Collection<String> names) {
        if (names == null || names.isEmpty()) {
            return catalogue;
        }
        Map<String, CommunityMetric> selected = new LinkedHashMap<>();
        selected.put(MetricTable.RICHNESS, catalogue.get(MetricTable.RICHNESS));
        for (String name : names) {
            CommunityMetric metric = catalogue.get(name);
            if (metric == null) {
                throw UnknownRegistryNameException.metric(name);
            }
            selected.putIfAbsent(name, metric);
        }
        return Collections.unmodifiableMap(selected);
    }

    /** Names of all metrics in catalogue order. */
    public List<String> names() {
        return List.copyOf(catalogue.keySet());
    }
}
