/* (C)2026 */
package com.ammann.metrictester.enumeration;

import com.ammann.metrictester.exception.ValidationException;

/**
 * Key used to pool randomization replicates before they are compared with observed values.
 *
 * <p>{@link #RICHNESS} compares an observed unit with every randomized unit of the same
 * species richness. {@link #QUADRAT} compares it with the randomized versions of the same
 * unit only.
 */
public enum GroupingMode
{
    /** Pool replicate rows by species richness. */
    RICHNESS("richness"),
    /** Pool replicate rows by unit (quadrat) identity. */
    QUADRAT("quadrat");

    private final String column;

    GroupingMode(String column) {
        this.column = column;
    }

    /**
     * Returns the grouping key of a unit under this mode.
     *
     * @param unitId identity of the unit
     * @param richness species richness of the unit
     * @return richness as a decimal string, or the unit id
     */
    public String keyOf(String unitId, int richness) {
        return this == RICHNESS ? Integer.toString(richness) : unitId;
    }

    /**
     * Resolves a mode from its column name, case-insensitively.
     *
     * @throws ValidationException if the name is neither richness nor quadrat
     */
    public static GroupingMode fromColumn(String column) {
        for (GroupingMode mode : values()) {
            if (mode.column.equalsIgnoreCase(column)) {
                return mode;
            }
        }
        throw ValidationException.invalidParameter("groupBy", column, "richness or quadrat");
    }

    /** Name of the column that holds the grouping key in tabular output. */
    public String getColumn() { return column; }
}
