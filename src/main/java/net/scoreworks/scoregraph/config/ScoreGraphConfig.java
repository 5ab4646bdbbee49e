/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoregraph.config;

import net.scoreworks.scoregraph.complexity.ComplexityMetric;
import net.scoreworks.scoregraph.exceptions.ConfigurationLoadException;
import net.scoreworks.scoregraph.identity.PositionalIds;
import org.apache.commons.configuration2.PropertiesConfiguration;
import org.apache.commons.configuration2.ex.ConfigurationException;
import org.apache.commons.lang3.StringUtils;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;


/**
 * Settings of a run. Defaults come from the classpath resource {@value #DEFAULT_RESOURCE}; a user file can
 * overlay single keys. Every getter falls back to a built-in value, so a missing resource only costs the
 * ability to change them.
 */
public final class ScoreGraphConfig {
    private static final Logger LOG = LoggerFactory.getLogger(ScoreGraphConfig.class);

    public static final String DEFAULT_RESOURCE = "scoregraph.properties";

    public static final String EVENT_ORDINAL_WIDTH = "identity.eventOrdinalWidth";
    public static final String LABEL_FILLER = "identity.labelFiller";
    public static final String MOVEMENT_START_LABEL = "structure.movementStartLabel";
    public static final String DEFAULT_STAFF_COUNT = "structure.defaultStaffCount";
    public static final String DEFAULT_BEAT_DENOMINATOR = "complexity.defaultBeatDenominator";
    public static final String DECIMAL_PLACES = "complexity.decimalPlaces";
    public static final String WEIGHT_PREFIX = "complexity.weight.";
    public static final String PRETTY_PRINT = "output.prettyPrint";

    private final PropertiesConfiguration properties;

    private ScoreGraphConfig(PropertiesConfiguration properties) {
        this.properties = properties;
    }

    /**
     * @return the bundled defaults
     */
    public static ScoreGraphConfig defaults() {
        PropertiesConfiguration properties = new PropertiesConfiguration();
        InputStream in = ScoreGraphConfig.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE);
        if (in == null) {
            LOG.warn("Resource {} not found, using built-in defaults", DEFAULT_RESOURCE);
            return new ScoreGraphConfig(properties);
        }
        try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
            properties.read(reader);
        } catch (ConfigurationException | IOException e) {
            throw new ConfigurationLoadException("classpath:" + DEFAULT_RESOURCE, e);
        }
        return new ScoreGraphConfig(properties);
    }

    /**
     * @param overlay properties file whose keys replace the defaults, may be null
     */
    public static ScoreGraphConfig load(@Nullable Path overlay) {
        ScoreGraphConfig config = defaults();
        if (overlay == null)
            return config;
        PropertiesConfiguration user = new PropertiesConfiguration();
        try (Reader reader = Files.newBufferedReader(overlay, StandardCharsets.UTF_8)) {
            user.read(reader);
        } catch (ConfigurationException | IOException e) {
            throw new ConfigurationLoadException(overlay.toString(), e);
        }
        Iterator<String> keys = user.getKeys();
        while (keys.hasNext()) {
            String key = keys.next();
            config.properties.setProperty(key, user.getProperty(key));
        }
        LOG.info("Loaded configuration overlay {}", overlay);
        return config;
    }

    /**
     * Replace a single value
     */
    public ScoreGraphConfig set(String key, Object value) {
        properties.setProperty(key, value);
        return this;
    }

    public int getEventOrdinalWidth() {
        return properties.getInt(EVENT_ORDINAL_WIDTH, PositionalIds.DEFAULT_ORDINAL_WIDTH);
    }

    public char getLabelFiller() {
        String filler = properties.getString(LABEL_FILLER);
        return StringUtils.isEmpty(filler) ? PositionalIds.DEFAULT_LABEL_FILLER : filler.charAt(0);
    }

    public String getMovementStartLabel() {
        return properties.getString(MOVEMENT_START_LABEL, "1");
    }

    public int getDefaultStaffCount() {
        return properties.getInt(DEFAULT_STAFF_COUNT, 2);
    }

    public int getDefaultBeatDenominator() {
        return properties.getInt(DEFAULT_BEAT_DENOMINATOR, 4);
    }

    public int getDecimalPlaces() {
        return properties.getInt(DECIMAL_PLACES, 4);
    }

    /**
     * @return the configured raw weight of the metric, before normalization
     */
    public double getWeight(ComplexityMetric metric) {
        return properties.getDouble(WEIGHT_PREFIX + metric.getKey(), metric.getDefaultWeight());
    }

    public boolean isPrettyPrint() {
        return properties.getBoolean(PRETTY_PRINT, true);
    }
}
