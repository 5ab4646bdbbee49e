/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoregraph.exceptions;

/**
 * Thrown if a score lacks a container every pass depends on (a part, or any measure in it). The affected pass
 * is aborted before it writes any node
 */
public class MissingStructureException extends RuntimeException {
    public MissingStructureException(String source, String message) {
        super(source + ": " + message);
    }
}
