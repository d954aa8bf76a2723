/* (C)2026 */
package com.ammann.metrictester.service;

import com.ammann.metrictester.enumeration.Alternative;
import com.ammann.metrictester.enumeration.GroupingMode;
import com.ammann.metrictester.exception.ValidationException;
import com.ammann.metrictester.model.AnalysisResult;
import com.ammann.metrictester.model.CommunityDataMatrix;
import com.ammann.metrictester.model.MergedTable;
import com.ammann.metrictester.model.MetricTable;
import com.ammann.metrictester.model.MetricsInput;
import com.ammann.metrictester.model.NullModelResult;
import com.ammann.metrictester.model.NullsInput;
import com.ammann.metrictester.model.PhylogeneticTree;
import com.ammann.metrictester.model.RegionalAbundance;
import com.ammann.metrictester.model.ReplicateTable;
import com.ammann.metrictester.model.SesTable;
import com.ammann.metrictester.model.SummaryTable;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import org.jboss.logging.Logger;

/**
 * Runs the full chain for one dataset: observed metrics, randomization under every selected null
 * model, then per null model summary, merge, standardization, significance and robust test.
 */
@ApplicationScoped
public class AnalysisService {

    private static final Logger LOG = Logger.getLogger(AnalysisService.class);

    private final MetricRunnerService metricRunner;
    private final RandomizationService randomization;
    private final SummaryService summaryService;
    private final StandardizationService standardization;
    private final SignificanceService significance;
    private final RobustTestService robustTest;

    @Inject
    public AnalysisService(
            MetricRunnerService metricRunner,
            RandomizationService randomization,
            SummaryService summaryService,
            StandardizationService standardization,
            SignificanceService significance,
            RobustTestService robustTest)
    {
        this.metricRunner = metricRunner;
        this.randomization = randomization;
        this.summaryService = summaryService;
        this.standardization = standardization;
        this.significance = significance;
        this.robustTest = robustTest;
    }

    /**
     * Analyzes one community.
     *
     * @param cdm observed community data matrix
     * @param tree phylogeny covering the matrix and the regional pool
     * @param regionalAbundance species pool, {@code null} to derive it from the matrix
     * @param metricNames metric subset, {@code null} or empty for all
     * @param nullNames null model subset, {@code null} or empty for all
     * @param mode how replicates are pooled before comparison
     * @param alternative alternative hypothesis of the robust test
     * @return observed metrics and per-null results
     */
    public AnalysisResult analyze(
            CommunityDataMatrix cdm,
            PhylogeneticTree tree,
            RegionalAbundance regionalAbundance,
            Collection<String> metricNames,
            Collection<String> nullNames,
            GroupingMode mode,
            Alternative alternative)
    {
        if (mode == null) {
            throw ValidationException.invalidParameter("groupBy", null, "richness or quadrat");
        }
        if (alternative == null) {
            throw ValidationException.invalidParameter("alternative", null, "TWO_SIDED, GREATER or LESS");
        }
        long started = System.currentTimeMillis();

        MetricTable observed = metricRunner.runMetrics(MetricsInput.prepare(cdm, tree), metricNames);
        NullsInput nullsInput = NullsInput.prepare(tree, cdm, regionalAbundance);
        Map<String, ReplicateTable> replicates = randomization.runNulls(nullsInput, nullNames, metricNames);

        Map<String, NullModelResult> results = new LinkedHashMap<>();
        replicates.forEach((name, table) -> {
            SummaryTable summary = summaryService.summarize(table, mode);
            MergedTable merged = summaryService.merge(observed, summary);
            SesTable ses = standardization.standardize(merged);
            results.put(name, new NullModelResult(
                    table,
                    summary,
                    ses,
                    significance.classify(merged),
                    robustTest.test(ses, alternative)));
        });

        LOG.infof("Analysis of %d units finished in %d ms: metrics=%s nulls=%s groupBy=%s",
                cdm.unitCount(), System.currentTimeMillis() - started,
                observed.metrics(), results.keySet(), mode.getColumn());
        return new AnalysisResult(observed, mode, alternative, results);
    }
}
