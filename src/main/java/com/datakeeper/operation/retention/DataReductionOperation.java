package com.datakeeper.operation.retention;

import com.datakeeper.exception.OperationException;
import com.datakeeper.operation.JobStatusReporter;
import com.datakeeper.operation.Operation;
import com.datakeeper.operation.OperationResult;
import com.datakeeper.plugin.PluginRegistry;
import com.datakeeper.policy.PolicyContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Deletes files older than the effective retention time from every selector path,
 * for every selector data type (used as file extension).
 * <p>
 * Context values read: file paths, data types, retention time, time unit, recursive, dry-run.
 * A negative retention time disables the sweep.
 */
public class DataReductionOperation implements Operation {

    private static final Logger log = LoggerFactory.getLogger(DataReductionOperation.class);

    public static final String NAME = "datareduction";

    private final FileRetention fileRetention;

    public DataReductionOperation() {
        this(new FileRetention());
    }

    public DataReductionOperation(FileRetention fileRetention) {
        this.fileRetention = fileRetention;
    }

    public static void register(PluginRegistry registry) {
        registry.registerOperation(DataReductionOperation.class, DataReductionOperation::new);
    }

    @Override
    public OperationResult execute(PolicyContext context) {
        JobStatusReporter reporter = JobStatusReporter.forContext(context);
        log.info("Executing data reduction: policy={}, paths={}, types={}, retention={} {}",
                context.getPolicyId().orElse("-"), context.getFilePaths(), context.getDataTypes(),
                context.getRetentionTime().orElse(null), context.getTimeUnit().orElse(null));

        if (!reporter.running()) {
            return OperationResult.failed(NAME, List.of(), "Could not record running status");
        }

        List<Path> deleted = new ArrayList<>();
        try {
            long retentionTime = context.getRetentionTime()
                    .orElseThrow(() -> new OperationException("No retention time in context"));
            RetentionUnit unit = RetentionUnit.fromName(context.getTimeUnit().orElse("day"));

            if (retentionTime < 0) {
                log.info("Retention time {} is negative, files of policy {} are kept",
                        retentionTime, context.getPolicyId().orElse("-"));
            } else {
                for (String directory : context.getFilePaths()) {
                    for (String dataType : context.getDataTypes()) {
                        deleted.addAll(fileRetention.deleteFilesByExtension(Path.of(directory), dataType,
                                retentionTime, unit, context.isRecursive(), context.isDryRun()));
                    }
                }
            }
        } catch (IOException | RuntimeException e) {
            String error = e.getClass().getSimpleName() + ": " + e.getMessage();
            log.error("Error executing data reduction on {}: {}", context.getFilePaths(), error, e);
            reporter.failed(error);
            return OperationResult.failed(NAME, deleted, error);
        }

        String message = (context.isDryRun() ? "Would delete " : "Deleted ") + deleted.size() + " file(s)";
        log.info("Data reduction on {} finished: {}", context.getFilePaths(), message);
        if (!reporter.success()) {
            return OperationResult.failed(NAME, deleted, "Could not record success status");
        }
        return OperationResult.success(NAME, deleted, message);
    }
}
