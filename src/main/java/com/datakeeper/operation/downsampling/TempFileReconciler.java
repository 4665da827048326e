package com.datakeeper.operation.downsampling;

import com.datakeeper.operation.retention.FileRetention;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Cleans up after rewrites interrupted by a crash.
 * <p>
 * A temporary rewrite file next to its original is incomplete and is deleted. A temporary
 * file whose original is gone was fully written before the crash and is moved into place.
 */
public class TempFileReconciler {

    private static final Logger log = LoggerFactory.getLogger(TempFileReconciler.class);

    /**
     * Outcome of a reconciliation pass.
     *
     * @param deleted  Stray temporary files removed
     * @param restored Temporary files moved into the place of a missing original
     * @param failed   Temporary files that could not be handled
     */
    public record Report(int deleted, int restored, int failed) {
    }

    /**
     * Reconcile the temporary files with the given extensions under every directory.
     * Missing directories are skipped.
     */
    public Report reconcile(List<String> directories, List<String> extensions) {
        int deleted = 0;
        int restored = 0;
        int failed = 0;
        for (String directory : directories) {
            Path root = Path.of(directory);
            if (!Files.isDirectory(root)) {
                log.debug("Skipping reconciliation of missing directory {}", root);
                continue;
            }
            for (String extension : extensions) {
                List<Path> files;
                try {
                    files = FileRetention.getDirectoriesFiles(root, extension, true);
                } catch (IOException e) {
                    log.error("Cannot list {} for reconciliation: {}", root, e.getMessage());
                    continue;
                }
                for (Path file : files) {
                    if (!Hdf5Downsampler.isTempFile(file)) {
                        continue;
                    }
                    Path original = Hdf5Downsampler.originalFileFor(file);
                    try {
                        if (Files.exists(original)) {
                            Files.delete(file);
                            log.warn("Deleted stray temporary file {}", file);
                            deleted++;
                        } else {
                            Hdf5Downsampler.replace(file, original);
                            log.warn("Restored {} from temporary file {}", original, file);
                            restored++;
                        }
                    } catch (IOException e) {
                        log.error("Failed to reconcile {}: {}", file, e.getMessage());
                        failed++;
                    }
                }
            }
        }
        Report report = new Report(deleted, restored, failed);
        if (deleted + restored + failed > 0) {
            log.info("Temporary file reconciliation: {}", report);
        }
        return report;
    }
}
