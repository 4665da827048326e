package com.datakeeper.operation.downsampling;

import java.util.Locale;

/**
 * Block reduction applied to each group of a downsampled axis.
 */
public enum ReductionMethod {

    MEAN {
        @Override
        double reduce(double[] block) {
            return SUM.reduce(block) / block.length;
        }
    },
    SUM {
        @Override
        double reduce(double[] block) {
            double sum = 0;
            for (double value : block) {
                sum += value;
            }
            return sum;
        }
    },
    MAX {
        @Override
        double reduce(double[] block) {
            double max = block[0];
            for (int i = 1; i < block.length; i++) {
                max = Math.max(max, block[i]);
            }
            return max;
        }
    },
    MIN {
        @Override
        double reduce(double[] block) {
            double min = block[0];
            for (int i = 1; i < block.length; i++) {
                min = Math.min(min, block[i]);
            }
            return min;
        }
    },
    /** First element of each block, no aggregation. */
    FIRST {
        @Override
        double reduce(double[] block) {
            return block[0];
        }
    };

    /**
     * Reduce a non-empty block to a single value.
     */
    abstract double reduce(double[] block);

    /**
     * Element type of the reduced array: the mean is always floating point, sums of
     * integers widen to long, the other methods keep the source type.
     */
    public Class<?> resultType(Class<?> sourceType) {
        if (this == MEAN) {
            return double.class;
        }
        if (this == SUM && (sourceType == byte.class || sourceType == short.class || sourceType == int.class)) {
            return long.class;
        }
        return sourceType;
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parse a method name. Empty, "none" and "first" select {@link #FIRST}.
     *
     * @throws IllegalArgumentException for an unsupported method
     */
    public static ReductionMethod fromName(String name) {
        if (name == null || name.isBlank() || "none".equalsIgnoreCase(name.trim())) {
            return FIRST;
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(
                    "Method '" + name + "' not supported. Use 'mean', 'sum', 'max', 'min', 'first' or 'none'.");
        }
    }
}
