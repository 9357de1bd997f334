package org.learningjava.assessrec.domain.error;

import java.nio.file.Path;

/**
 * Index artifacts are missing or unreadable. The operator has to rebuild the index.
 */
public class IndexNotFoundException extends RecommenderException {

    public IndexNotFoundException(String message) {
        super(message);
    }

    public IndexNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }

    public static IndexNotFoundException missing(Path vectors, Path meta) {
        return new IndexNotFoundException(
                "Index files not found. Build the index first. Expected: " + vectors + ", " + meta);
    }
}
