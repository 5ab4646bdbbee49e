/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoregraph.exceptions;

public class ConfigurationLoadException extends RuntimeException {
    public ConfigurationLoadException(String location, Throwable cause) {
        super("Failed to load configuration from " + location, cause);
    }
}
