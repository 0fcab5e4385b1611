package de.conciso.ratingsim.model;

import de.conciso.ratingsim.exception.InvalidParameterException;

import java.util.Arrays;

/**
 * Immutable N x K matrix of linear-scale attribute values, one row per entity.
 * Every cell is checked to be finite and strictly positive on construction.
 */
public final class AttributeMatrix {

    private final double[][] cells;
    private final int attributes;

    private AttributeMatrix(double[][] cells, int attributes) {
        this.cells = cells;
        this.attributes = attributes;
    }

    public static AttributeMatrix of(double[][] rows) {
        if (rows.length == 0) {
            throw InvalidParameterException.of("entities", 0, "at least one entity");
        }
        int k = rows[0].length;
        if (k == 0) {
            throw InvalidParameterException.of("attributes", 0, "at least one attribute");
        }
        double[][] copy = new double[rows.length][];
        for (int i = 0; i < rows.length; i++) {
            if (rows[i].length != k) {
                throw InvalidParameterException.of("row " + i + " length", rows[i].length, String.valueOf(k));
            }
            for (int j = 0; j < k; j++) {
                double v = rows[i][j];
                if (!(v > 0.0) || Double.isInfinite(v)) {
                    throw InvalidParameterException.of("attribute[" + i + "][" + j + "]", v, "a finite value > 0");
                }
            }
            copy[i] = rows[i].clone();
        }
        return new AttributeMatrix(copy, k);
    }

    public int entities() {
        return cells.length;
    }

    public int attributes() {
        return attributes;
    }

    public double get(int entity, int attribute) {
        return cells[entity][attribute];
    }

    public double[] row(int entity) {
        return cells[entity].clone();
    }

    public double[] column(int attribute) {
        double[] column = new double[cells.length];
        for (int i = 0; i < cells.length; i++) column[i] = cells[i][attribute];
        return column;
    }

    public double[][] toArray() {
        double[][] copy = new double[cells.length][];
        for (int i = 0; i < cells.length; i++) copy[i] = cells[i].clone();
        return copy;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof AttributeMatrix other && Arrays.deepEquals(cells, other.cells);
    }

    @Override
    public int hashCode() {
        return Arrays.deepHashCode(cells);
    }
}
