package com.codereview.orchestrator.storage;

/**
 * Loads the text of an uploaded source file by the path recorded on its task.
 */
@FunctionalInterface
public interface SourceReader {

    /** @throws SourceStorageException if the file cannot be read */
    String read(String filePath);
}
