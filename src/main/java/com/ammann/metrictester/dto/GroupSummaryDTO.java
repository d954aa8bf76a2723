/* (C)2026 */
package com.ammann.metrictester.dto;

import com.ammann.metrictester.model.GroupSummary;
import java.util.LinkedHashMap;
import java.util.Map;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Null distributions of one grouping key")
public record GroupSummaryDTO(
        @Schema(description = "Grouping key (richness level or quadrat id)") String key,
        @Schema(description = "Summary per metric") Map<String, MetricSummaryDTO> metrics) {

    public static GroupSummaryDTO from(GroupSummary group) {
        Map<String, MetricSummaryDTO> metrics = new LinkedHashMap<>();
        group.metrics().forEach((name, summary) -> metrics.put(name, MetricSummaryDTO.from(summary)));
        return new GroupSummaryDTO(group.key(), metrics);
    }
}
