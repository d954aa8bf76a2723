/* (C)2026 */
package com.ammann.metrictester.service;

import com.ammann.metrictester.exception.ValidationException;
import com.ammann.metrictester.model.GroupSummary;
import com.ammann.metrictester.model.MergedTable;
import com.ammann.metrictester.model.MergedTable.MergedRow;
import com.ammann.metrictester.model.SesTable;
import com.ammann.metrictester.model.SesTable.ScoreRow;
import jakarta.enterprise.context.ApplicationScoped;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jboss.logging.Logger;

/**
 * Turns merged observed values into standardized effect sizes,
 * {@code (observed - mean) / sd} of the matching null group.
 *
 * <p>A group whose sd is zero or undefined borrows the mean of the usable sds of the same metric
 * across the distinct groups of the table. Without any usable sd the score is NaN.
 */
@ApplicationScoped
public class StandardizationService {

    private static final Logger LOG = Logger.getLogger(StandardizationService.class);

    public SesTable standardize(MergedTable merged) {
        if (merged == null) {
            throw new ValidationException("Standardizing requires a merged table");
        }

        Map<String, GroupSummary> groups = new LinkedHashMap<>();
        for (MergedRow row : merged.rows()) {
            groups.putIfAbsent(row.groupKey(), row.group());
        }
        Map<String, Double> substitutes = new LinkedHashMap<>();
        for (String metric : merged.metrics()) {
            substitutes.put(metric, substituteSd(metric, groups));
        }

        List<ScoreRow> rows = new ArrayList<>(merged.rows().size());
        int substituted = 0;
        for (MergedRow row : merged.rows()) {
            Map<String, Double> scores = new LinkedHashMap<>();
            for (String metric : merged.metrics()) {
                double sd = row.group().metric(metric).sd();
                if (!usable(sd)) {
                    sd = substitutes.get(metric);
                    substituted++;
                }
                double mean = row.group().metric(metric).mean();
                scores.put(metric, (row.observed().value(metric) - mean) / sd);
            }
            rows.add(new ScoreRow(row.observed().unitId(), row.groupKey(), scores));
        }

        if (substituted > 0) {
            LOG.warnf("Null model '%s': %d scores used a substituted sd (zero or undefined group sd)",
                    merged.nullModel(), substituted);
        }
        return new SesTable(merged.nullModel(), merged.mode(), merged.metrics(), rows);
    }

    private static double substituteSd(String metric, Map<String, GroupSummary> groups) {
        double total = 0.0;
        int count = 0;
        for (GroupSummary group : groups.values()) {
            double sd = group.metric(metric).sd();
            if (usable(sd)) {
                total += sd;
                count++;
            }
        }
        return count > 0 ? total / count : Double.NaN;
    }

    private static boolean usable(double sd) {
        return Double.isFinite(sd) && sd != 0.0;
    }
}
