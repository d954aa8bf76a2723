/* (C)2026 */
package com.ammann.metrictester.service;

import com.ammann.metrictester.enumeration.Significance;
import com.ammann.metrictester.exception.ValidationException;
import com.ammann.metrictester.model.MergedTable;
import com.ammann.metrictester.model.MergedTable.MergedRow;
import com.ammann.metrictester.model.MetricSummary;
import com.ammann.metrictester.model.SignificanceTable;
import com.ammann.metrictester.model.SignificanceTable.SignificanceRow;
import jakarta.enterprise.context.ApplicationScoped;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jboss.logging.Logger;

/**
 * Classifies each observed metric value against the confidence bounds of its null group.
 *
 * @see Significance#classify(double, double, double)
 */
@ApplicationScoped
public class SignificanceService {

    private static final Logger LOG = Logger.getLogger(SignificanceService.class);

    public SignificanceTable classify(MergedTable merged) {
        if (merged == null) {
            throw new ValidationException("Classifying requires a merged table");
        }
        Map<Significance, Integer> tally = new EnumMap<>(Significance.class);
        List<SignificanceRow> rows = new ArrayList<>(merged.rows().size());
        for (MergedRow row : merged.rows()) {
            Map<String, Significance> calls = new LinkedHashMap<>();
            for (String metric : merged.metrics()) {
                MetricSummary bounds = row.group().metric(metric);
                Significance call = Significance.classify(
                        row.observed().value(metric), bounds.lower(), bounds.upper());
                calls.put(metric, call);
                tally.merge(call, 1, Integer::sum);
            }
            rows.add(new SignificanceRow(row.observed().unitId(), row.groupKey(), calls));
        }
        LOG.debugf("Null model '%s' significance calls: %s", merged.nullModel(), tally);
        return new SignificanceTable(merged.nullModel(), merged.mode(), merged.metrics(), rows);
    }
}
