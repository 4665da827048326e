package com.datakeeper.operation.retention;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Removes a single file.
 */
@FunctionalInterface
public interface FileDeleter {

    void delete(Path file) throws IOException;
}
