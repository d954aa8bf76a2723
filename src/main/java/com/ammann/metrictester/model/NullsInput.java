/* (C)2026 */
package com.ammann.metrictester.model;

import com.ammann.metrictester.exception.ValidationException;
import java.util.List;
import org.jboss.logging.Logger;

/**
 * Prepared context handed to every null model: the tree, the observed community data matrix
 * and the regional abundance pool.
 *
 * <p>{@link #prepare} is the only constructor, so a randomization run cannot be started with an
 * unchecked context.
 */
public final class NullsInput {

    private static final Logger LOG = Logger.getLogger(NullsInput.class);

    private final PhylogeneticTree tree;
    private final CommunityDataMatrix cdm;
    private final RegionalAbundance regionalAbundance;

    private NullsInput(PhylogeneticTree tree, CommunityDataMatrix cdm, RegionalAbundance regionalAbundance) {
        this.tree = tree;
        this.cdm = cdm;
        this.regionalAbundance = regionalAbundance;
    }

    /**
     * Prepares the randomization context.
     *
     * @param tree phylogeny covering every species of {@code cdm} and of the pool
     * @param cdm observed community data matrix
     * @param regionalAbundance source pool, or {@code null} to derive it from {@code cdm}
     * @return the prepared context
     */
    public static NullsInput prepare(
            PhylogeneticTree tree, CommunityDataMatrix cdm, RegionalAbundance regionalAbundance) {
        if (cdm == null || tree == null) {
            throw new ValidationException("Null randomization requires a community data matrix and a tree");
        }
        MetricsInput.requireCovered(cdm, tree);
        RegionalAbundance pool = regionalAbundance;
        if (pool == null) {
            LOG.warn("Regional abundance not provided. Assumed to be equivalent to CDM");
            pool = RegionalAbundance.fromCommunity(cdm);
        }
        List<String> foreign = pool.species().stream().filter(s -> !tree.containsTip(s)).toList();
        if (!foreign.isEmpty()) {
            throw new ValidationException(
                    "Regional abundance contains species that are not tips of the tree: " + foreign);
        }
        return new NullsInput(tree, cdm, pool);
    }

    public PhylogeneticTree tree() {
        return tree;
    }

    public CommunityDataMatrix cdm() {
        return cdm;
    }

    public RegionalAbundance regionalAbundance() {
        return regionalAbundance;
    }
}
