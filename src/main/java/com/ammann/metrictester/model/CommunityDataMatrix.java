/* (C)2026 */
package com.ammann.metrictester.model;

import com.ammann.metrictester.exception.ValidationException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Immutable sites-by-species abundance table.
 *
 * <p>Rows are sampling units (sites or quadrats), columns are species, cells are non-negative
 * abundances where 0 means absent. Unit ids and species labels are unique. The richness of each
 * row (number of cells above zero) is computed once on construction and carried with the matrix.
 */
public final class CommunityDataMatrix {

    private final List<String> unitIds;
    private final List<String> species;
    private final Map<String, Integer> speciesIndex;
    private final double[][] abundances;
    private final int[] richness;

    private CommunityDataMatrix(List<String> unitIds, List<String> species, double[][] abundances) {
        this.unitIds = List.copyOf(unitIds);
        this.species = List.copyOf(species);
        this.abundances = abundances;
        this.speciesIndex = new HashMap<>();
        for (int column = 0; column < this.species.size(); column++) {
            speciesIndex.put(this.species.get(column), column);
        }
        this.richness = new int[abundances.length];
        for (int row = 0; row < abundances.length; row++) {
            int present = 0;
            for (double value : abundances[row]) {
                if (value > 0) present++;
            }
            richness[row] = present;
        }
    }

    /**
     * Creates a matrix after validating labels and cell values. The abundance array is copied.
     *
     * @param unitIds row labels, unique
     * @param species column labels, unique
     * @param abundances {@code unitIds.size()} rows of {@code species.size()} finite, non-negative values
     * @return the matrix
     * @throws ValidationException if labels repeat, dimensions disagree, or a cell is invalid
     */
    public static CommunityDataMatrix of(
            List<String> unitIds, List<String> species, double[][] abundances) {
        if (unitIds == null || species == null || abundances == null) {
            throw new ValidationException("Community data matrix requires unit ids, species and abundances");
        }
        requireUnique("unit id", unitIds);
        requireUnique("species", species);
        if (abundances.length != unitIds.size()) {
            throw ValidationException.invalidParameter(
                    "abundances", abundances.length + " rows", unitIds.size() + " rows");
        }
        double[][] copy = new double[abundances.length][];
        for (int row = 0; row < abundances.length; row++) {
            double[] values = abundances[row];
            if (values == null || values.length != species.size()) {
                throw ValidationException.invalidParameter(
                        "abundances[" + unitIds.get(row) + "]",
                        values == null ? "null" : values.length + " columns",
                        species.size() + " columns");
            }
            for (double value : values) {
                if (!Double.isFinite(value) || value < 0) {
                    throw ValidationException.invalidParameter(
                            "abundances[" + unitIds.get(row) + "]", value, "finite non-negative value");
                }
            }
            copy[row] = values.clone();
        }
        return new CommunityDataMatrix(unitIds, species, copy);
    }

    private static void requireUnique(String what, List<String> labels) {
        Set<String> seen = new HashSet<>();
        for (String label : labels) {
            if (label == null || label.isBlank()) {
                throw ValidationException.invalidParameter(what, label, "non-blank label");
            }
            if (!seen.add(label)) {
                throw ValidationException.invalidParameter(what, label, "unique label");
            }
        }
    }

    /**
     * Returns a matrix with the same labels and new cell values, as produced by a null model.
     * The values are validated and copied like in {@link #of}.
     */
    public CommunityDataMatrix withAbundances(double[][] newAbundances) {
        return of(unitIds, species, newAbundances);
    }

    /**
     * Returns a matrix with the same cells under a relabelled set of species columns.
     */
    public CommunityDataMatrix withSpecies(List<String> newSpecies) {
        if (newSpecies.size() != species.size()) {
            throw ValidationException.invalidParameter(
                    "species", newSpecies.size() + " labels", species.size() + " labels");
        }
        requireUnique("species", newSpecies);
        return new CommunityDataMatrix(unitIds, newSpecies, abundances);
    }

    public int unitCount() {
        return unitIds.size();
    }

    public int speciesCount() {
        return species.size();
    }

    public List<String> unitIds() {
        return unitIds;
    }

    public List<String> species() {
        return species;
    }

    public String unitId(int row) {
        return unitIds.get(row);
    }

    public int columnOf(String speciesLabel) {
        Integer column = speciesIndex.get(speciesLabel);
        return column == null ? -1 : column;
    }

    public double abundance(int row, int column) {
        return abundances[row][column];
    }

    /** Copy of the abundances of one unit. */
    public double[] row(int row) {
        return abundances[row].clone();
    }

    /** Deep copy of all cell values, suitable as scratch space for a randomization. */
    public double[][] toArray() {
        double[][] copy = new double[abundances.length][];
        for (int row = 0; row < abundances.length; row++) {
            copy[row] = abundances[row].clone();
        }
        return copy;
    }

    /** Number of species with a non-zero abundance in the given unit. */
    public int richness(int row) {
        return richness[row];
    }

    /** Column indices of the species present in the given unit, in column order. */
    public int[] presentColumns(int row) {
        int[] present = new int[richness[row]];
        int next = 0;
        double[] values = abundances[row];
        for (int column = 0; column < values.length; column++) {
            if (values[column] > 0) {
                present[next++] = column;
            }
        }
        return present;
    }

    /** Labels of the species present in the given unit. */
    public List<String> presentSpecies(int row) {
        List<String> present = new ArrayList<>(richness[row]);
        for (int column : presentColumns(row)) {
            present.add(species.get(column));
        }
        return present;
    }

    public double columnTotal(int column) {
        double total = 0.0;
        for (double[] values : abundances) {
            total += values[column];
        }
        return total;
    }

    @Override
    public String toString() {
        return "CommunityDataMatrix[" + unitIds.size() + " units x " + species.size() + " species]";
    }
}
