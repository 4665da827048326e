package com.datakeeper.config;

import java.util.List;

/**
 * One downsampling step of a downsampler action.
 *
 * @param dimension       "temporal" (time axis) or "spatial" (channel axis)
 * @param algorithm       Reduction method name (mean, sum, max, min, first)
 * @param factor          Block size along the reduced axis
 * @param datasets        Dataset paths inside each container file
 * @param applyToChannels Channel selection, only "all" is supported
 */
public record DownsamplingMethod(
        String dimension,
        String algorithm,
        int factor,
        List<String> datasets,
        String applyToChannels
) {
    public static final String TEMPORAL = "temporal";
    public static final String SPATIAL = "spatial";

    public DownsamplingMethod {
        datasets = datasets == null ? List.of("data") : List.copyOf(datasets);
        applyToChannels = applyToChannels == null ? "all" : applyToChannels;
    }

    public boolean isTemporal() {
        return TEMPORAL.equalsIgnoreCase(dimension);
    }

    public boolean isSpatial() {
        return SPATIAL.equalsIgnoreCase(dimension);
    }
}
