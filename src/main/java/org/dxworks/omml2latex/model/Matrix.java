package org.dxworks.omml2latex.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Rows of cells. Rows may differ in length; such a matrix is converted cell by cell as given
 * and reported as ragged.
 */
public final class Matrix implements MarkupNode {
    public final List<List<MarkupNode>> rows;

    public Matrix(List<? extends List<? extends MarkupNode>> rows) {
        List<List<MarkupNode>> copy = new ArrayList<>();
        if (rows != null) {
            for (List<? extends MarkupNode> row : rows) {
                copy.add(NodeLists.copy(row));
            }
        }
        this.rows = Collections.unmodifiableList(copy);
    }

    public boolean isRagged() {
        for (List<MarkupNode> row : rows) {
            if (row.size() != rows.get(0).size()) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String kind() {
        return "matrix";
    }

    /**
     * Cells in row-major order.
     */
    @Override
    public List<MarkupNode> slots() {
        List<MarkupNode> cells = new ArrayList<>();
        for (List<MarkupNode> row : rows) {
            cells.addAll(row);
        }
        return cells;
    }

    @Override
    public <R, A> R accept(MarkupVisitor<R, A> visitor, A arg) {
        return visitor.visitMatrix(this, arg);
    }
}
