/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoregraph.exceptions;

/**
 * Thrown if a graph document can't be read into nodes
 */
public class GraphDocumentException extends RuntimeException {
    public GraphDocumentException(String message) {
        super(message);
    }

    public GraphDocumentException(String message, String nodeId) {
        super(message + " for node ["+nodeId+"]");
    }

    public GraphDocumentException(String message, Throwable cause) {
        super(message, cause);
    }
}
