/* (C)2026 */
package com.ammann.metrictester.service;

import com.ammann.metrictester.exception.InvalidInputTypeException;
import com.ammann.metrictester.exception.SomeThingWentWrongException;
import com.ammann.metrictester.metric.CommunityMetric;
import com.ammann.metrictester.model.CommunityDataMatrix;
import com.ammann.metrictester.model.MetricRow;
import com.ammann.metrictester.model.MetricTable;
import com.ammann.metrictester.model.MetricsInput;
import com.ammann.metrictester.model.NullsInput;
import com.ammann.metrictester.model.ReplicateTable;
import com.ammann.metrictester.model.ReplicateTable.ReplicateRow;
import com.ammann.metrictester.nulls.NullModel;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.inject.Named;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Runs the selected null models against a prepared randomization context and records the
 * metrics of every randomized matrix.
 *
 * <p>Work is fanned out on the randomization executor in two stages. First every null model
 * produces its matrices as one task; then every (null model, replicate) pair is measured as one
 * task. No task waits on another, so a bounded pool cannot starve itself. Each null model draws
 * from its own generator, seeded with {@code seed + index} when a seed is configured, so results
 * do not depend on scheduling. Tables are assembled only after every task has finished; a
 * failing task fails the whole run and no partial result is returned.
 */
@ApplicationScoped
public class RandomizationService {

    private static final Logger LOG = Logger.getLogger(RandomizationService.class);

    private final MetricRunnerService metricRunner;
    private final MetricRegistry metricRegistry;
    private final NullRegistry nullRegistry;
    private final Executor executor;
    private final Optional<Long> seed;
    private final MeterRegistry meterRegistry;

    @Inject
    public RandomizationService(
            MetricRunnerService metricRunner,
            MetricRegistry metricRegistry,
            NullRegistry nullRegistry,
            @Named("randomization-executor") Executor executor,
            @ConfigProperty(name = "metrictester.randomization.seed") Optional<Long> seed,
            MeterRegistry meterRegistry)
    {
        this.metricRunner = metricRunner;
        this.metricRegistry = metricRegistry;
        this.nullRegistry = nullRegistry;
        this.executor = executor;
        this.seed = seed;
        this.meterRegistry = meterRegistry;
    }

    /**
     * Randomizes the observed matrix under each selected null model and calculates the selected
     * metrics on every randomized matrix.
     *
     * @param input prepared randomization context
     * @param nullNames null model subset, {@code null} or empty for all
     * @param metricNames metric subset, {@code null} or empty for all; richness is always included
     * @return one replicate table per null model, in selection order
     * @throws InvalidInputTypeException if {@code input} is missing
     */
    public Map<String, ReplicateTable> runNulls(
            NullsInput input, Collection<String> nullNames, Collection<String> metricNames)
    {
        if (input == null) {
            throw InvalidInputTypeException.expected("NullsInput", null);
        }
        Map<String, NullModel> nullModels = nullRegistry.select(nullNames);
        Map<String, CommunityMetric> metrics = metricRegistry.select(metricNames);
        List<String> metricColumns = List.copyOf(metrics.keySet());
        long started = System.nanoTime();

        LOG.infof("Starting randomization: nulls=%s metrics=%s seed=%s",
                nullModels.keySet(), metricColumns, seed.map(String::valueOf).orElse("none"));

        Map<String, CompletableFuture<List<CommunityDataMatrix>>> randomized = new LinkedHashMap<>();
        int index = 0;
        for (Map.Entry<String, NullModel> entry : nullModels.entrySet()) {
            RandomGenerator random = generatorFor(index++);
            NullModel model = entry.getValue();
            randomized.put(entry.getKey(),
                    CompletableFuture.supplyAsync(() -> model.randomize(input, random), executor));
        }

        Map<String, List<CompletableFuture<MetricTable>>> measured = new LinkedHashMap<>();
        for (Map.Entry<String, CompletableFuture<List<CommunityDataMatrix>>> entry : randomized.entrySet()) {
            List<CommunityDataMatrix> matrices = await(entry.getValue());
            if (matrices.isEmpty()) {
                LOG.warnf("Null model '%s' produced no randomized matrices", entry.getKey());
            }
            List<CompletableFuture<MetricTable>> tasks = new ArrayList<>(matrices.size());
            for (CommunityDataMatrix matrix : matrices) {
                tasks.add(CompletableFuture.supplyAsync(
                        () -> metricRunner.runResolved(MetricsInput.prepare(matrix, input.tree()), metrics),
                        executor));
            }
            measured.put(entry.getKey(), tasks);
        }

        Map<String, ReplicateTable> results = new LinkedHashMap<>();
        for (Map.Entry<String, List<CompletableFuture<MetricTable>>> entry : measured.entrySet()) {
            List<ReplicateRow> rows = new ArrayList<>();
            int replicate = 1;
            for (CompletableFuture<MetricTable> task : entry.getValue()) {
                for (MetricRow row : await(task).rows()) {
                    rows.add(new ReplicateRow(replicate, row));
                }
                replicate++;
            }
            results.put(entry.getKey(), new ReplicateTable(entry.getKey(), metricColumns, rows));
            recordReplicates(entry.getKey(), entry.getValue().size());
        }

        Duration elapsed = Duration.ofNanos(System.nanoTime() - started);
        recordRunDuration(elapsed);
        LOG.infof("Randomization finished in %d ms: %s", elapsed.toMillis(), summarize(results));
        return results;
    }

    private RandomGenerator generatorFor(int index) {
        return seed.<RandomGenerator>map(s -> new Well19937c(s + index)).orElseGet(Well19937c::new);
    }

    private static <T> T await(CompletableFuture<T> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new SomeThingWentWrongException(cause);
        }
    }

    private static String summarize(Map<String, ReplicateTable> results) {
        StringBuilder summary = new StringBuilder();
        results.forEach((name, table) -> {
            if (summary.length() > 0) {
                summary.append(", ");
            }
            summary.append(name).append('=').append(table.replicateCount()).append(" replicates");
        });
        return summary.toString();
    }

    private void recordReplicates(String nullModel, int replicates) {
        if (meterRegistry == null) {
            return;
        }
        Counter.builder("randomization_replicates_total")
                .description("Total number of randomized matrices measured, by null model")
                .tag("null", nullModel)
                .register(meterRegistry)
                .increment(replicates);
    }

    private void recordRunDuration(Duration elapsed) {
        if (meterRegistry == null) {
            return;
        }
        Timer.builder("randomization_run_seconds")
                .description("Wall-clock duration of complete randomization runs")
                .register(meterRegistry)
                .record(elapsed);
    }
}
