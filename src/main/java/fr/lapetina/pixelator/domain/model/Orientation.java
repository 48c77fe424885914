package fr.lapetina.pixelator.domain.model;

/**
 * Which axis is sliced into stripes.
 *
 * <p>{@link #COLUMNS}: stripes are full-height columns, cells are stacked
 * vertically inside each stripe. {@link #ROWS}: stripes are full-width rows,
 * cells are laid out horizontally.
 */
public enum Orientation {

    COLUMNS {
        @Override
        public Region stripeRegion(StripeTask task, int imageWidth, int imageHeight) {
            return new Region(task.outerOffset(), 0, task.outerSize(), imageHeight);
        }

        @Override
        public Region cellRegion(int innerOffset, int innerSize, int stripeSize) {
            return new Region(0, innerOffset, stripeSize, innerSize);
        }
    },

    ROWS {
        @Override
        public Region stripeRegion(StripeTask task, int imageWidth, int imageHeight) {
            return new Region(0, task.outerOffset(), imageWidth, task.outerSize());
        }

        @Override
        public Region cellRegion(int innerOffset, int innerSize, int stripeSize) {
            return new Region(innerOffset, 0, innerSize, stripeSize);
        }
    };

    /**
     * The axis with more cells becomes the outer axis; ties slice columns.
     */
    public static Orientation forGrid(int xCells, int yCells) {
        return xCells >= yCells ? COLUMNS : ROWS;
    }

    /**
     * Region of the whole image covered by one stripe.
     */
    public abstract Region stripeRegion(StripeTask task, int imageWidth, int imageHeight);

    /**
     * Region of one cell, relative to the top-left corner of its stripe.
     */
    public abstract Region cellRegion(int innerOffset, int innerSize, int stripeSize);
}
