package com.datakeeper.operation.downsampling;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TempFileReconcilerTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("Should delete a temporary file next to its original")
    void shouldDeleteStrayTempFile() throws Exception {
        Path original = Files.writeString(tempDir.resolve("run.hdf5"), "original");
        Path temp = Files.writeString(tempDir.resolve("run_temp.hdf5"), "partial");

        TempFileReconciler.Report report = new TempFileReconciler()
                .reconcile(List.of(tempDir.toString()), List.of("hdf5"));

        assertEquals(new TempFileReconciler.Report(1, 0, 0), report);
        assertFalse(Files.exists(temp));
        assertEquals("original", Files.readString(original));
    }

    @Test
    @DisplayName("Should move a temporary file into the place of a missing original")
    void shouldRestoreMissingOriginal() throws Exception {
        Files.createDirectories(tempDir.resolve("nested"));
        Files.writeString(tempDir.resolve("nested/run_temp.hdf5"), "rewritten");

        TempFileReconciler.Report report = new TempFileReconciler()
                .reconcile(List.of(tempDir.toString()), List.of("hdf5"));

        assertEquals(1, report.restored());
        assertEquals("rewritten", Files.readString(tempDir.resolve("nested/run.hdf5")));
        assertFalse(Files.exists(tempDir.resolve("nested/run_temp.hdf5")));
    }

    @Test
    @DisplayName("Should ignore other extensions and missing directories")
    void shouldIgnoreUnrelatedFiles() throws Exception {
        Path csvTemp = Files.writeString(tempDir.resolve("table_temp.csv"), "x");

        TempFileReconciler.Report report = new TempFileReconciler()
                .reconcile(List.of(tempDir.toString(), tempDir.resolve("missing").toString()), List.of("hdf5"));

        assertEquals(new TempFileReconciler.Report(0, 0, 0), report);
        assertTrue(Files.exists(csvTemp));
    }
}
