/* (C)2026 */
package com.ammann.metrictester.service;

import com.ammann.metrictester.exception.UnknownRegistryNameException;
import com.ammann.metrictester.nulls.NullModel;
import com.ammann.metrictester.nulls.NullModels;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Catalogue of named null models. The built-in models produce the configured number of
 * replicates per run.
 */
@ApplicationScoped
public class NullRegistry {

    private static final Logger LOG = Logger.getLogger(NullRegistry.class);

    private final Map<String, NullModel> catalogue;

    @Inject
    public NullRegistry(
            @ConfigProperty(name = "metrictester.randomization.replicates", defaultValue = "100")
                    int replicates,
            @ConfigProperty(name = "metrictester.randomization.swap-iterations", defaultValue = "1000")
                    int swapIterations) {
        this(builtIns(replicates, swapIterations));
        LOG.infof("Null registry initialized: replicates=%d swapIterations=%d models=%s",
                replicates, swapIterations, catalogue.keySet());
    }

    /**
     * Registry over a caller-defined catalogue.
     *
     * @param nullModels null models by name, in catalogue order
     */
    public NullRegistry(Map<String, NullModel> nullModels) {
        this.catalogue = Collections.unmodifiableMap(new LinkedHashMap<>(nullModels));
    }

    private static Map<String, NullModel> builtIns(int replicates, int swapIterations) {
        Map<String, NullModel> models = new LinkedHashMap<>();
        models.put("richness", NullModels.richness(replicates));
        models.put("frequency", NullModels.frequency(replicates));
        models.put("taxaLabels", NullModels.taxaLabels(replicates));
        models.put("independentSwap", NullModels.independentSwap(replicates, swapIterations));
        models.put("regional", NullModels.regional(replicates));
        return models;
    }

    /**
     * Resolves a null model subset.
     *
     * @param names requested null model names, {@code null} or empty for the whole catalogue
     * @return null models by name in request order
     * @throws UnknownRegistryNameException if a name is not in the catalogue
     */
    public Map<String, NullModel> select(Collection<String> names) {
        if (names == null || names.isEmpty()) {
            return catalogue;
        }
        Map<String, NullModel> selected = new LinkedHashMap<>();
        for (String name : names) {
            NullModel model = catalogue.get(name);
            if (model == null) {
                throw UnknownRegistryNameException.nullModel(name);
            }
            selected.putIfAbsent(name, model);
        }
        return Collections.unmodifiableMap(selected);
    }

    public List<String> names() {
        return List.copyOf(catalogue.keySet());
    }
}
