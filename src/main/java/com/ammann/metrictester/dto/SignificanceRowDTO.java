/* (C)2026 */
package com.ammann.metrictester.dto;

import com.ammann.metrictester.model.SignificanceTable.SignificanceRow;
import java.util.LinkedHashMap;
import java.util.Map;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Significance codes of one observed unit: 0 not significant, 1 clustered, 2 overdispersed, null undefined")
public record SignificanceRowDTO(
        @Schema(description = "Unit identifier") String quadrat,
        @Schema(description = "Grouping key the unit was compared under") String group,
        @Schema(description = "Significance code per metric, null where observed value or bounds are undefined") Map<String, Integer> codes) {

    public static SignificanceRowDTO from(SignificanceRow row) {
        Map<String, Integer> codes = new LinkedHashMap<>();
        row.calls().forEach((metric, call) -> codes.put(metric, call.getCode()));
        return new SignificanceRowDTO(row.unitId(), row.groupKey(), codes);
    }
}
