package net.scoreworks.scoregraph;

import net.scoreworks.scoregraph.config.ScoreGraphConfig;
import net.scoreworks.scoregraph.score.Measure;
import net.scoreworks.scoregraph.score.MeasureElement;
import net.scoreworks.scoregraph.score.MusicXmlReader;
import net.scoreworks.scoregraph.score.Part;
import net.scoreworks.scoregraph.score.ScorePartwise;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.List;

/**
 * Scores shared by the tests
 */
public final class Fixtures {
    public static final String SONATA = "sonata.xml";

    private Fixtures() {}

    /**
     * Two movements (measures 1, 2, 1, 2) on two staves with key, tempo, clefs, dynamics, accidentals,
     * staccato and a slur
     */
    public static ScorePartwise sonata() {
        try (InputStream in = Fixtures.class.getClassLoader().getResourceAsStream("fixtures/" + SONATA)) {
            if (in == null)
                throw new IllegalStateException("fixture " + SONATA + " missing");
            return new MusicXmlReader().read(in, SONATA);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static ScoreContext sonataContext() {
        return new ScoreContext(sonata(), ScoreGraphConfig.defaults());
    }

    public static Measure measure(String number, MeasureElement... elements) {
        return new Measure(number, List.of(elements));
    }

    public static ScorePartwise score(String source, Measure... measures) {
        return new ScorePartwise(source, null, null, null, List.of(new Part("P1", List.of(measures))));
    }

    public static ScoreContext context(String source, Measure... measures) {
        return new ScoreContext(score(source, measures), ScoreGraphConfig.defaults());
    }
}
