package com.datakeeper.operation.downsampling;

import com.datakeeper.config.DownsamplingMethod;
import com.datakeeper.operation.JobStatusReporter;
import com.datakeeper.operation.Operation;
import com.datakeeper.operation.OperationResult;
import com.datakeeper.operation.retention.FileRetention;
import com.datakeeper.plugin.PluginRegistry;
import com.datakeeper.policy.PolicyContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Applies the context's downsampling methods, in order, to every matching file under the
 * selector paths.
 * <p>
 * Files are independent: a file that fails keeps its original content and the run ends
 * with status failed, listing every failed file.
 */
public class DataDownSamplingOperation implements Operation {

    private static final Logger log = LoggerFactory.getLogger(DataDownSamplingOperation.class);

    public static final String NAME = "datadownsampling";

    private final Hdf5Downsampler hdf5Downsampler;

    public DataDownSamplingOperation() {
        this(new Hdf5Downsampler());
    }

    public DataDownSamplingOperation(Hdf5Downsampler hdf5Downsampler) {
        this.hdf5Downsampler = hdf5Downsampler;
    }

    public static void register(PluginRegistry registry) {
        registry.registerOperation(DataDownSamplingOperation.class, DataDownSamplingOperation::new);
    }

    @Override
    public OperationResult execute(PolicyContext context) {
        JobStatusReporter reporter = JobStatusReporter.forContext(context);
        List<DownsamplingMethod> methods = context.getMethods();
        log.info("Executing downsampling: policy={}, paths={}, types={}, methods={}",
                context.getPolicyId().orElse("-"), context.getFilePaths(), context.getDataTypes(), methods.size());

        if (!reporter.running()) {
            return OperationResult.failed(NAME, List.of(), "Could not record running status");
        }
        if (methods.isEmpty()) {
            log.warn("No downsampling methods configured for policy {}", context.getPolicyId().orElse("-"));
        }

        Set<Path> rewritten = new LinkedHashSet<>();
        Map<Path, String> failures = new LinkedHashMap<>();
        try {
            for (String directory : context.getFilePaths()) {
                for (String dataType : context.getDataTypes()) {
                    List<Path> files = new ArrayList<>();
                    for (Path file : FileRetention.getDirectoriesFiles(Path.of(directory), dataType, context.isRecursive())) {
                        if (!Hdf5Downsampler.isTempFile(file)) {
                            files.add(file);
                        }
                    }
                    log.info("Found {} .{} files in {}", files.size(), FileRetention.cleanExtension(dataType), directory);
                    for (DownsamplingMethod method : methods) {
                        files.removeAll(failures.keySet());
                        applyMethod(method, files, failures);
                        files.stream().filter(f -> !failures.containsKey(f)).forEach(rewritten::add);
                    }
                }
            }
        } catch (IOException | RuntimeException e) {
            String error = e.getClass().getSimpleName() + ": " + e.getMessage();
            log.error("Error executing downsampling on {}: {}", context.getFilePaths(), error, e);
            reporter.failed(error);
            return OperationResult.failed(NAME, new ArrayList<>(rewritten), error);
        }

        if (!failures.isEmpty()) {
            String error = failures.entrySet().stream()
                    .map(entry -> entry.getKey() + ": " + entry.getValue())
                    .collect(Collectors.joining("; "));
            log.error("Downsampling failed for {} file(s): {}", failures.size(), error);
            reporter.failed(error);
            return OperationResult.failed(NAME, new ArrayList<>(rewritten), error);
        }

        String message = "Downsampled " + rewritten.size() + " file(s)";
        log.info("Downsampling on {} finished: {}", context.getFilePaths(), message);
        if (!reporter.success()) {
            return OperationResult.failed(NAME, new ArrayList<>(rewritten), "Could not record success status");
        }
        return OperationResult.success(NAME, new ArrayList<>(rewritten), message);
    }

    private void applyMethod(DownsamplingMethod method, List<Path> files, Map<Path, String> failures) {
        ReductionMethod reduction = ReductionMethod.fromName(method.algorithm());
        Integer temporalFactor;
        Integer spatialFactor;
        if (method.isTemporal()) {
            temporalFactor = method.factor();
            spatialFactor = null;
        } else if (method.isSpatial()) {
            temporalFactor = null;
            spatialFactor = method.factor();
        } else {
            throw new IllegalArgumentException("Unknown downsampling dimension: " + method.dimension());
        }
        log.info("Applying {} downsampling, factor {}, method {} to datasets {}",
                method.dimension(), method.factor(), reduction.label(), method.datasets());
        failures.putAll(hdf5Downsampler.downsampleHdf5Files(files, method.datasets(),
                temporalFactor, spatialFactor, reduction));
    }
}
