package com.datakeeper.operation.retention;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileVisitOption;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.NotDirectoryException;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;

/**
 * Age-based file deletion and file enumeration by extension.
 */
public class FileRetention {

    private static final Logger log = LoggerFactory.getLogger(FileRetention.class);

    private final Clock clock;
    private final FileDeleter deleter;

    public FileRetention() {
        this(Clock.systemUTC(), Files::delete);
    }

    public FileRetention(Clock clock, FileDeleter deleter) {
        this.clock = clock;
        this.deleter = deleter;
    }

    /**
     * Delete the files with the given extension whose age reaches the retention time.
     * A file whose age is exactly the retention time is deleted.
     *
     * @param directory     Root directory
     * @param extension     Extension to match, with or without the leading dot
     * @param retentionTime Minimum age, in {@code unit}, of a deleted file
     * @param unit          Unit of the retention time
     * @param recursive     Whether to descend into subdirectories
     * @param dryRun        Only report the files that would be deleted
     * @return Deleted (or, in dry-run, would-be deleted) files
     * @throws NoSuchFileException   if the directory does not exist
     * @throws NotDirectoryException if the path is not a directory
     * @throws IOException           if the directory cannot be listed
     */
    public List<Path> deleteFilesByExtension(Path directory, String extension, long retentionTime,
                                             RetentionUnit unit, boolean recursive, boolean dryRun)
            throws IOException {
        List<Path> matchingFiles = getDirectoriesFiles(directory, extension, recursive);
        log.info("Found {} files with extension .{} in {}", matchingFiles.size(), cleanExtension(extension), directory);

        Instant now = clock.instant();
        List<Path> deleted = new ArrayList<>();
        for (Path file : matchingFiles) {
            try {
                Instant modified = Files.getLastModifiedTime(file).toInstant();
                double age = calculateFileAge(modified, now, unit);
                if (age < retentionTime) {
                    log.debug("Skipping {}: age {} {}s below threshold {}",
                            file, String.format("%.2f", age), unit.label(), retentionTime);
                    continue;
                }
                if (dryRun) {
                    log.info("Would delete: {}, age: {} {}s", file, String.format("%.2f", age), unit.label());
                } else {
                    deleter.delete(file);
                    log.info("Deleted: {}, age: {} {}s", file, String.format("%.2f", age), unit.label());
                }
                deleted.add(file);
            } catch (IOException | SecurityException e) {
                log.error("Failed to delete {}: {}", file, e.getMessage());
            }
        }
        return deleted;
    }

    /**
     * Age of a file in the given unit, fractional.
     */
    public static double calculateFileAge(Instant modified, Instant now, RetentionUnit unit) {
        double ageSeconds = Duration.between(modified, now).toMillis() / 1000.0;
        return ageSeconds / unit.getSeconds();
    }

    /**
     * List the regular files under {@code directory} whose name ends with {@code .extension}, sorted.
     * Subdirectories that cannot be read are logged and skipped.
     *
     * @throws NoSuchFileException   if the directory does not exist
     * @throws NotDirectoryException if the path is not a directory
     */
    public static List<Path> getDirectoriesFiles(Path directory, String extension, boolean recursive)
            throws IOException {
        if (!Files.exists(directory)) {
            throw new NoSuchFileException(directory.toString(), null, "Directory does not exist");
        }
        if (!Files.isDirectory(directory)) {
            throw new NotDirectoryException(directory.toString());
        }

        String suffix = "." + cleanExtension(extension);
        List<Path> files = new ArrayList<>();
        Files.walkFileTree(directory, EnumSet.noneOf(FileVisitOption.class), recursive ? Integer.MAX_VALUE : 1,
                new SimpleFileVisitor<>() {
                    @Override
                    public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                        if (attrs.isRegularFile() && file.getFileName().toString().endsWith(suffix)) {
                            files.add(file);
                        }
                        return FileVisitResult.CONTINUE;
                    }

                    @Override
                    public FileVisitResult visitFileFailed(Path file, IOException e) throws IOException {
                        if (file.equals(directory)) {
                            throw e;
                        }
                        log.warn("Cannot read {}: {}", file, e.getMessage());
                        return FileVisitResult.CONTINUE;
                    }
                });
        Collections.sort(files);
        return files;
    }

    /**
     * Strip a leading dot from an extension.
     */
    public static String cleanExtension(String extension) {
        return extension.startsWith(".") ? extension.substring(1) : extension;
    }
}
