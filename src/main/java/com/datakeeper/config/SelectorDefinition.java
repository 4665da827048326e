package com.datakeeper.config;

import java.util.List;

/**
 * Matching criteria a policy context must satisfy.
 *
 * @param dataTypes Allowed data types (file extensions)
 * @param tags      Tags, empty when the selector does not filter on tags
 * @param paths     Root directories the policy operates on
 */
public record SelectorDefinition(
        List<String> dataTypes,
        List<String> tags,
        List<String> paths
) {
    public static final List<String> DEFAULT_DATA_TYPES = List.of("hdf5");

    public SelectorDefinition {
        dataTypes = dataTypes == null ? DEFAULT_DATA_TYPES : List.copyOf(dataTypes);
        tags = tags == null ? List.of() : List.copyOf(tags);
        paths = paths == null ? List.of() : List.copyOf(paths);
    }

    public boolean hasTags() {
        return !tags.isEmpty();
    }
}
