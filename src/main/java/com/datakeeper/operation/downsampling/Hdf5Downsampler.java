package com.datakeeper.operation.downsampling;

import io.jhdf.HdfFile;
import io.jhdf.WritableHdfFile;
import io.jhdf.api.Attribute;
import io.jhdf.api.Dataset;
import io.jhdf.api.Group;
import io.jhdf.api.Node;
import io.jhdf.api.WritableGroup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BiConsumer;

/**
 * Rewrites HDF5 files with some of their datasets downsampled.
 * <p>
 * A file is rewritten into {@code <name>_temp.<ext>} next to it, then moved over the original.
 * If anything fails before the move the temporary file is removed and the original is untouched.
 */
public class Hdf5Downsampler {

    private static final Logger log = LoggerFactory.getLogger(Hdf5Downsampler.class);

    public static final String TEMP_SUFFIX = "_temp";

    public static final String ATTR_DOWNSAMPLED = "downsampled_from_original";
    public static final String ATTR_TEMPORAL_FACTOR = "temporal_downsampling_factor";
    public static final String ATTR_SPATIAL_FACTOR = "spatial_downsampling_factor";
    public static final String ATTR_METHOD = "downsampling_method";

    static final String WRITER_ATTRIBUTE = "_jHDF";

    /**
     * Downsample the target datasets of every file. Files are processed independently.
     *
     * @param files          HDF5 files
     * @param datasetPaths   Paths of the datasets to downsample inside each file
     * @param temporalFactor Time axis factor, null for none
     * @param spatialFactor  Channel axis factor, null for none
     * @param method         Reduction method
     * @return Error message per failed file, empty when every file was rewritten
     */
    public Map<Path, String> downsampleHdf5Files(List<Path> files, List<String> datasetPaths,
                                                 Integer temporalFactor, Integer spatialFactor,
                                                 ReductionMethod method) {
        Map<Path, String> failures = new LinkedHashMap<>();
        for (Path file : files) {
            try {
                downsampleHdf5File(file, datasetPaths, temporalFactor, spatialFactor, method);
            } catch (IOException | RuntimeException e) {
                log.error("Failed to downsample {}: {}", file, e.getMessage(), e);
                failures.put(file, e.getClass().getSimpleName() + ": " + e.getMessage());
            }
        }
        return failures;
    }

    /**
     * Downsample the target datasets of one file in place. Every other group, dataset and
     * attribute is carried over to the rewritten file unchanged.
     */
    public void downsampleHdf5File(Path file, List<String> datasetPaths, Integer temporalFactor,
                                   Integer spatialFactor, ReductionMethod method)
            throws IOException {
        Path tempFile = tempFileFor(file);
        log.debug("Downsampling {} via {}: datasets={}, temporal={}, spatial={}, method={}",
                file, tempFile, datasetPaths, temporalFactor, spatialFactor, method.label());
        Files.deleteIfExists(tempFile);

        try {
            try (HdfFile source = new HdfFile(file);
                 WritableHdfFile target = HdfFile.write(tempFile)) {
                List<String> targets = datasetPaths.stream().map(Hdf5Downsampler::normalizePath).toList();
                Map<String, WritableGroup> groups = new HashMap<>();
                groups.put("", target);

                copyAttributes(source, target::putAttribute);
                copyGroup(source, target, "", targets, groups);

                for (String path : targets) {
                    Dataset dataset = source.getDatasetByPath(path);
                    NumericArray downsampled = Downsampler.downsampleDataset(
                            NumericArray.fromJavaArray(dataset.getData()), temporalFactor, spatialFactor, method);
                    if (downsampled.size() == 0) {
                        throw new IllegalArgumentException("Downsampling " + path + " of " + file
                                + " leaves no data, factor exceeds the axis length");
                    }

                    WritableGroup parent = ensureGroup(target, parentPath(path), groups);
                    var written = parent.putDataset(leafName(path), downsampled.toJavaArray());
                    BiConsumer<String, Object> attributes = written::putAttribute;
                    copyAttributes(dataset, attributes);
                    attributes.accept(ATTR_DOWNSAMPLED, 1);
                    if (temporalFactor != null) {
                        attributes.accept(ATTR_TEMPORAL_FACTOR, temporalFactor);
                    }
                    if (spatialFactor != null) {
                        attributes.accept(ATTR_SPATIAL_FACTOR, spatialFactor);
                    }
                    attributes.accept(ATTR_METHOD, method.label());
                    log.debug("Downsampled {}:{} to {}", file, path, downsampled);
                }
            }
        } catch (RuntimeException e) {
            Files.deleteIfExists(tempFile);
            throw e;
        }

        replace(tempFile, file);
        log.info("Rewrote {} with downsampled datasets {}", file, datasetPaths);
    }

    private void copyGroup(Group source, WritableGroup target, String path, List<String> excluded,
                           Map<String, WritableGroup> groups) {
        for (Node child : source.getChildren().values()) {
            String childPath = path.isEmpty() ? child.getName() : path + "/" + child.getName();
            if (isExcluded(childPath, excluded)) {
                log.debug("Skipping excluded path: {}", childPath);
                continue;
            }
            if (child.isLink()) {
                log.warn("Skipping link {}, links are not copied", childPath);
                continue;
            }
            if (child.isGroup()) {
                WritableGroup group = target.putGroup(child.getName());
                groups.put(childPath, group);
                copyAttributes(child, group::putAttribute);
                copyGroup((Group) child, group, childPath, excluded, groups);
            } else if (child instanceof Dataset dataset) {
                var copy = target.putDataset(child.getName(), dataset.getData());
                copyAttributes(child, copy::putAttribute);
            } else {
                throw new IllegalStateException("Cannot copy HDF5 node " + childPath + " of type " + child.getType());
            }
        }
    }

    private static void copyAttributes(Node node, BiConsumer<String, Object> target) {
        for (Map.Entry<String, Attribute> entry : node.getAttributes().entrySet()) {
            // written by the library itself on every file it creates
            if (WRITER_ATTRIBUTE.equals(entry.getKey())) {
                continue;
            }
            target.accept(entry.getKey(), entry.getValue().getData());
        }
    }

    private static WritableGroup ensureGroup(WritableGroup root, String path, Map<String, WritableGroup> groups) {
        WritableGroup group = groups.get(path);
        if (group != null) {
            return group;
        }
        WritableGroup parent = ensureGroup(root, parentPath(path), groups);
        group = parent.putGroup(leafName(path));
        groups.put(path, group);
        return group;
    }

    /**
     * Move the rewritten file over the original, atomically where the filesystem allows it.
     */
    static void replace(Path tempFile, Path original) throws IOException {
        try {
            Files.move(tempFile, original, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("Atomic move not supported for {}, falling back to replace", original);
            Files.move(tempFile, original, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    /**
     * Temporary file used while rewriting {@code file}: {@code data.h5} becomes {@code data_temp.h5}.
     */
    public static Path tempFileFor(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String tempName = dot > 0
                ? name.substring(0, dot) + TEMP_SUFFIX + name.substring(dot)
                : name + TEMP_SUFFIX;
        return file.resolveSibling(tempName);
    }

    /**
     * Whether {@code file} is a temporary rewrite file.
     */
    public static boolean isTempFile(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String stem = dot > 0 ? name.substring(0, dot) : name;
        return stem.endsWith(TEMP_SUFFIX) && stem.length() > TEMP_SUFFIX.length();
    }

    /**
     * Original file a temporary rewrite file belongs to.
     */
    public static Path originalFileFor(Path tempFile) {
        String name = tempFile.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String stem = dot > 0 ? name.substring(0, dot) : name;
        String extension = dot > 0 ? name.substring(dot) : "";
        return tempFile.resolveSibling(stem.substring(0, stem.length() - TEMP_SUFFIX.length()) + extension);
    }

    private static boolean isExcluded(String path, List<String> excluded) {
        for (String target : excluded) {
            if (path.equals(target) || path.startsWith(target + "/")) {
                return true;
            }
        }
        return false;
    }

    static String normalizePath(String path) {
        String normalized = path.trim();
        while (normalized.startsWith("/")) {
            normalized = normalized.substring(1);
        }
        while (normalized.endsWith("/")) {
            normalized = normalized.substring(0, normalized.length() - 1);
        }
        return normalized;
    }

    private static String parentPath(String path) {
        int slash = path.lastIndexOf('/');
        return slash < 0 ? "" : path.substring(0, slash);
    }

    private static String leafName(String path) {
        return path.substring(path.lastIndexOf('/') + 1);
    }
}
