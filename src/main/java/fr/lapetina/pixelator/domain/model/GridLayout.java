package fr.lapetina.pixelator.domain.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Frozen plan of one pixelation call: image size, column widths, row heights
 * and the stripe orientation derived from them.
 */
public record GridLayout(
        int width,
        int height,
        PartitionSequence columns,
        PartitionSequence rows,
        Orientation orientation
) {
    public GridLayout {
        Objects.requireNonNull(columns, "Columns are required");
        Objects.requireNonNull(rows, "Rows are required");
        Objects.requireNonNull(orientation, "Orientation is required");
        if (columns.dimension() != width) {
            throw new IllegalArgumentException("Columns sum to " + columns.dimension() + ", width is " + width);
        }
        if (rows.dimension() != height) {
            throw new IllegalArgumentException("Rows sum to " + rows.dimension() + ", height is " + height);
        }
    }

    /**
     * Partition sliced into stripes.
     */
    public PartitionSequence outer() {
        return orientation == Orientation.COLUMNS ? columns : rows;
    }

    /**
     * Partition applied inside every stripe.
     */
    public PartitionSequence inner() {
        return orientation == Orientation.COLUMNS ? rows : columns;
    }

    public int stripeCount() {
        return outer().size();
    }

    public int cellCount() {
        return columns.size() * rows.size();
    }

    /**
     * One task per outer entry, offsets accumulated in partition order.
     */
    public List<StripeTask> stripeTasks() {
        PartitionSequence outer = outer();
        List<StripeTask> tasks = new ArrayList<>(outer.size());
        for (int i = 0; i < outer.size(); i++) {
            tasks.add(new StripeTask(i, outer.get(i), outer.offset(i)));
        }
        return Collections.unmodifiableList(tasks);
    }

    public Region stripeRegion(StripeTask task) {
        return orientation.stripeRegion(task, width, height);
    }

    @Override
    public String toString() {
        return "GridLayout{" + width + "x" + height
                + ", cells=" + columns.size() + "x" + rows.size()
                + ", orientation=" + orientation
                + ", stripes=" + stripeCount() + '}';
    }
}
