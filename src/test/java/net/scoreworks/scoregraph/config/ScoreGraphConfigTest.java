package net.scoreworks.scoregraph.config;

import net.scoreworks.scoregraph.complexity.ComplexityMetric;
import net.scoreworks.scoregraph.exceptions.ConfigurationLoadException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

public class ScoreGraphConfigTest {

    @TempDir
    Path tempDir;

    @Test
    public void testDefaults() {
        ScoreGraphConfig config = ScoreGraphConfig.defaults();
        Assertions.assertEquals(6, config.getEventOrdinalWidth());
        Assertions.assertEquals('_', config.getLabelFiller());
        Assertions.assertEquals("1", config.getMovementStartLabel());
        Assertions.assertEquals(2, config.getDefaultStaffCount());
        Assertions.assertEquals(4, config.getDefaultBeatDenominator());
        Assertions.assertEquals(4, config.getDecimalPlaces());
        Assertions.assertEquals(4.31, config.getWeight(ComplexityMetric.MEASURE_ACCIDENTAL_COUNT));
        Assertions.assertTrue(config.isPrettyPrint());
        Assertions.assertSame(ScoreGraphConfig.load(null).getClass(), config.getClass());
    }

    @Test
    public void testOverlayReplacesSingleKeys() throws IOException {
        Path overlay = tempDir.resolve("user.properties");
        Files.writeString(overlay, "complexity.decimalPlaces = 2\n"
                + "identity.labelFiller = -\n"
                + "complexity.weight.noteCount = 0\n"
                + "output.prettyPrint = false\n", StandardCharsets.UTF_8);
        ScoreGraphConfig config = ScoreGraphConfig.load(overlay);
        Assertions.assertEquals(2, config.getDecimalPlaces());
        Assertions.assertEquals('-', config.getLabelFiller());
        Assertions.assertEquals(0.0, config.getWeight(ComplexityMetric.NOTE_COUNT));
        Assertions.assertFalse(config.isPrettyPrint());
        //untouched keys keep their defaults
        Assertions.assertEquals(6, config.getEventOrdinalWidth());
        Assertions.assertEquals(4.43, config.getWeight(ComplexityMetric.ARTICULATION_COUNT));
    }

    @Test
    public void testMissingOverlay() {
        Assertions.assertThrows(ConfigurationLoadException.class,
                () -> ScoreGraphConfig.load(tempDir.resolve("absent.properties")));
    }

    @Test
    public void testSetValue() {
        ScoreGraphConfig config = ScoreGraphConfig.defaults().set(ScoreGraphConfig.MOVEMENT_START_LABEL, "0");
        Assertions.assertEquals("0", config.getMovementStartLabel());
        Assertions.assertEquals("1", ScoreGraphConfig.defaults().getMovementStartLabel());
    }
}
