package fr.lapetina.pixelator.domain.model;

import java.util.Arrays;
import java.util.List;
import java.util.stream.IntStream;

/**
 * Ordered pixel extents of the cells along one axis.
 * Entries are positive and sum to the axis dimension. Immutable.
 */
public final class PartitionSequence {

    private final int[] extents;
    private final int[] offsets;
    private final int dimension;

    public PartitionSequence(int[] extents) {
        if (extents == null || extents.length == 0) {
            throw new IllegalArgumentException("Partition must have at least one entry");
        }
        this.extents = extents.clone();
        this.offsets = new int[extents.length];
        int sum = 0;
        for (int i = 0; i < this.extents.length; i++) {
            if (this.extents[i] <= 0) {
                throw new IllegalArgumentException("Partition entry " + i + " is not positive: " + this.extents[i]);
            }
            offsets[i] = sum;
            sum += this.extents[i];
        }
        this.dimension = sum;
    }

    public int size() {
        return extents.length;
    }

    public int get(int index) {
        return extents[index];
    }

    /**
     * Pixel offset of entry {@code index}, i.e. the sum of all preceding entries.
     */
    public int offset(int index) {
        return offsets[index];
    }

    /**
     * Sum of all entries.
     */
    public int dimension() {
        return dimension;
    }

    public boolean isUniform() {
        return IntStream.of(extents).allMatch(e -> e == extents[0]);
    }

    public int[] toArray() {
        return extents.clone();
    }

    public List<Integer> asList() {
        return IntStream.of(extents).boxed().toList();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PartitionSequence other)) return false;
        return Arrays.equals(extents, other.extents);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(extents);
    }

    @Override
    public String toString() {
        return Arrays.toString(extents);
    }
}
