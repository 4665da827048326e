package com.datakeeper.operation.retention;

import com.datakeeper.testutil.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.NotDirectoryException;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for FileRetention.
 */
class FileRetentionTest {

    private static final Instant NOW = Instant.parse("2025-04-12T02:00:00Z");

    @TempDir
    Path tempDir;

    private MutableClock clock;
    private FileRetention retention;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(NOW, ZoneOffset.UTC);
        retention = new FileRetention(clock, Files::delete);
    }

    private Path file(String name, Duration age) throws IOException {
        Path file = tempDir.resolve(name);
        Files.createDirectories(file.getParent());
        Files.writeString(file, name);
        Files.setLastModifiedTime(file, FileTime.from(NOW.minus(age)));
        return file;
    }

    /**
     * A file "aged N days" was written a minute short of N whole days ago.
     */
    private static Duration agedDays(int days) {
        return Duration.ofDays(days).minusMinutes(1);
    }

    @Test
    @DisplayName("Should delete only the files older than seven days with a seven day retention")
    void shouldDeleteOldFiles() throws IOException {
        int[] ages = {6, 7, 8, 6, 7, 8};
        for (int i = 0; i < ages.length; i++) {
            file("file" + i + ".csv", agedDays(ages[i]));
        }

        List<Path> deleted = retention.deleteFilesByExtension(tempDir, "csv", 7, RetentionUnit.DAY, true, false);

        assertEquals(List.of(tempDir.resolve("file2.csv"), tempDir.resolve("file5.csv")), deleted);
        assertFalse(Files.exists(tempDir.resolve("file2.csv")));
        assertTrue(Files.exists(tempDir.resolve("file1.csv")));
        try (var remaining = Files.list(tempDir)) {
            assertEquals(4, remaining.count());
        }
    }

    @Test
    @DisplayName("Should delete a file whose age equals the retention time")
    void shouldDeleteAtExactBoundary() throws IOException {
        Path exact = file("exact.hdf5", Duration.ofMinutes(2));
        Path younger = file("younger.hdf5", Duration.ofMinutes(2).minusSeconds(1));

        List<Path> deleted = retention.deleteFilesByExtension(tempDir, "hdf5", 2, RetentionUnit.MINUTE, true, false);

        assertEquals(List.of(exact), deleted);
        assertTrue(Files.exists(younger));
    }

    @Test
    @DisplayName("Should only report files in dry-run mode")
    void shouldNotDeleteInDryRun() throws IOException {
        Path old = file("old.csv", Duration.ofDays(40));

        List<Path> deleted = retention.deleteFilesByExtension(tempDir, ".csv", 30, RetentionUnit.DAY, true, true);

        assertEquals(List.of(old), deleted);
        assertTrue(Files.exists(old));
    }

    @Test
    @DisplayName("Should match the extension exactly")
    void shouldMatchExtension() throws IOException {
        file("data.csv", Duration.ofDays(40));
        Path other = file("data.csv.bak", Duration.ofDays(40));
        Path hdf5 = file("data.hdf5", Duration.ofDays(40));

        List<Path> deleted = retention.deleteFilesByExtension(tempDir, "csv", 30, RetentionUnit.DAY, true, false);

        assertEquals(1, deleted.size());
        assertTrue(Files.exists(other));
        assertTrue(Files.exists(hdf5));
    }

    @Test
    @DisplayName("Should descend into subdirectories only when recursive")
    void shouldHonorRecursiveFlag() throws IOException {
        Path top = file("top.csv", Duration.ofDays(40));
        Path nested = file("sub/dir/nested.csv", Duration.ofDays(40));

        assertEquals(List.of(top), FileRetention.getDirectoriesFiles(tempDir, "csv", false));
        assertEquals(List.of(nested, top), FileRetention.getDirectoriesFiles(tempDir, "csv", true));
    }

    @Test
    @DisplayName("Should continue after a file fails to delete")
    void shouldContinueAfterFailure() throws IOException {
        Path locked = file("a-locked.csv", Duration.ofDays(40));
        Path free = file("b-free.csv", Duration.ofDays(40));
        FileRetention failing = new FileRetention(clock, path -> {
            if (path.equals(locked)) {
                throw new IOException("Permission denied");
            }
            Files.delete(path);
        });

        List<Path> deleted = failing.deleteFilesByExtension(tempDir, "csv", 30, RetentionUnit.DAY, true, false);

        assertEquals(List.of(free), deleted);
        assertTrue(Files.exists(locked));
    }

    @Test
    @DisplayName("Should fail for a missing root directory or a regular file")
    void shouldFailForInvalidRoot() throws IOException {
        Path plain = file("plain.csv", Duration.ZERO);

        assertThrows(NoSuchFileException.class, () ->
                retention.deleteFilesByExtension(tempDir.resolve("missing"), "csv", 1, RetentionUnit.DAY, true, false));
        assertThrows(NotDirectoryException.class, () ->
                retention.deleteFilesByExtension(plain, "csv", 1, RetentionUnit.DAY, true, false));
    }

    @ParameterizedTest
    @CsvSource({
            "90, SECOND, 90.0",
            "90, MINUTE, 1.5",
            "5400, HOUR, 1.5",
            "43200, DAY, 0.5"
    })
    @DisplayName("Should compute fractional ages in the requested unit")
    void shouldComputeAge(long seconds, RetentionUnit unit, double expected) {
        assertEquals(expected, FileRetention.calculateFileAge(NOW.minusSeconds(seconds), NOW, unit), 1e-9);
    }

    @Test
    @DisplayName("Should parse unit names")
    void shouldParseUnits() {
        assertEquals(RetentionUnit.DAY, RetentionUnit.fromName("Days"));
        assertEquals(RetentionUnit.MINUTE, RetentionUnit.fromName("minute"));
        assertThrows(IllegalArgumentException.class, () -> RetentionUnit.fromName("week"));
        assertEquals("csv", FileRetention.cleanExtension(".csv"));
    }
}
