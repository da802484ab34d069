package uk.ac.ox.well.swalign.utils.alignment.sw;

import java.util.Objects;

/**
 * A (row, column) position in the alignment matrices.  Rows index seq2, columns index seq1; position 0 on either
 * axis is the sentinel before the first symbol.
 */
public final class MatrixCoordinate {
    private final int row;
    private final int column;

    public MatrixCoordinate(int row, int column) {
        this.row = row;
        this.column = column;
    }

    public int getRow() { return row; }

    public int getColumn() { return column; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;

        MatrixCoordinate that = (MatrixCoordinate) o;
        return row == that.row && column == that.column;
    }

    @Override
    public int hashCode() {
        return Objects.hash(row, column);
    }

    @Override
    public String toString() {
        return "(" + row + ", " + column + ")";
    }
}
