package com.datakeeper.operation.downsampling;

/**
 * Block reduction of the time axis (axis 0) and the channel axis (axis 1) of an array.
 */
public final class Downsampler {

    private Downsampler() {
    }

    /**
     * Downsample an array in time and/or channels.
     * <p>
     * Each reduced axis is truncated to the largest multiple of its factor, then every group of
     * {@code factor} consecutive elements is reduced to one. Temporal reduction runs first.
     *
     * @param data           Array shaped (time, channels, ...)
     * @param temporalFactor Time axis factor, null for none
     * @param spatialFactor  Channel axis factor, null for none
     * @param method         Reduction applied to each group
     * @return Reduced array; {@code data} itself when no factor is given
     * @throws IllegalArgumentException for a factor below 1, or a spatial factor on a 1-D array
     */
    public static NumericArray downsampleDataset(NumericArray data, Integer temporalFactor,
                                                 Integer spatialFactor, ReductionMethod method) {
        NumericArray result = data;
        if (temporalFactor != null) {
            result = reduceAxis(result, 0, temporalFactor, method);
        }
        if (spatialFactor != null) {
            if (result.getRank() < 2) {
                throw new IllegalArgumentException("Spatial downsampling needs a channel axis, got " + result);
            }
            result = reduceAxis(result, 1, spatialFactor, method);
        }
        return result;
    }

    /**
     * Reduce one axis by {@code factor}, dropping the remainder tail.
     */
    static NumericArray reduceAxis(NumericArray data, int axis, int factor, ReductionMethod method) {
        if (factor < 1) {
            throw new IllegalArgumentException("Downsampling factor must be at least 1, got " + factor);
        }
        if (data.getRank() == 0) {
            throw new IllegalArgumentException("Cannot downsample a scalar");
        }
        int[] shape = data.getShape();
        int outer = 1;
        for (int i = 0; i < axis; i++) {
            outer *= shape[i];
        }
        int inner = 1;
        for (int i = axis + 1; i < shape.length; i++) {
            inner *= shape[i];
        }
        int length = shape[axis];
        int groups = length / factor;

        int[] outShape = shape.clone();
        outShape[axis] = groups;
        double[] in = data.values();
        double[] out = new double[outer * groups * inner];
        double[] block = new double[factor];

        for (int o = 0; o < outer; o++) {
            for (int g = 0; g < groups; g++) {
                for (int i = 0; i < inner; i++) {
                    for (int j = 0; j < factor; j++) {
                        block[j] = in[(o * length + g * factor + j) * inner + i];
                    }
                    out[(o * groups + g) * inner + i] = method.reduce(block);
                }
            }
        }
        return new NumericArray(out, outShape, method.resultType(data.getElementType()));
    }
}
