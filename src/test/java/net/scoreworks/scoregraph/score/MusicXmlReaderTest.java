package net.scoreworks.scoregraph.score;

import net.scoreworks.scoregraph.Fixtures;
import net.scoreworks.scoregraph.exceptions.MissingStructureException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

public class MusicXmlReaderTest {
    ScorePartwise score;

    @BeforeEach
    public void readFixture() {
        score = Fixtures.sonata();
    }

    private static ScorePartwise read(String xml) throws IOException {
        return new MusicXmlReader().read(new ByteArrayInputStream(xml.getBytes(StandardCharsets.UTF_8)), "inline.xml");
    }

    @Test
    public void testHeader() {
        Assertions.assertEquals(Fixtures.SONATA, score.getSource());
        Assertions.assertEquals("Little Sonata", score.getTitle());
        Assertions.assertEquals("Jane Doe", score.getComposer());
        Assertions.assertEquals("Piano", score.getInstrumentName());
        Assertions.assertEquals(-4, score.getFirstKey().getFifths());
        Assertions.assertEquals("minor", score.getFirstKey().getMode());
    }

    @Test
    public void testMeasuresAndChildOrder() {
        List<Measure> measures = score.getFirstPart().getMeasures();
        Assertions.assertEquals(4, measures.size());
        Assertions.assertEquals("1", measures.get(2).getNumber());

        //backup is dropped, everything else keeps document order
        List<MeasureElement> elements = measures.get(0).getElements();
        Assertions.assertEquals(7, elements.size());
        Assertions.assertTrue(elements.get(0) instanceof Attributes);
        Assertions.assertTrue(elements.get(1) instanceof Direction);
        Assertions.assertTrue(elements.get(2) instanceof Direction);
        Assertions.assertTrue(elements.get(3) instanceof Note);
        Assertions.assertEquals("3", ((Note) elements.get(6)).getOctave());
    }

    @Test
    public void testAttributes() {
        Attributes attributes = (Attributes) score.getFirstPart().getMeasures().get(0).getElements().get(0);
        Assertions.assertEquals(2, attributes.getStaves());
        Assertions.assertEquals("3", attributes.getTime().getBeats());
        Assertions.assertEquals("4", attributes.getTime().getBeatType());
        Assertions.assertEquals(2, attributes.getClefs().size());
        Assertions.assertEquals("F", attributes.getClefs().get(1).getSign());
        Assertions.assertEquals(2, attributes.getClefs().get(1).getStaff());
    }

    @Test
    public void testDirectionsAndNotes() {
        Measure first = score.getFirstPart().getMeasures().get(0);
        Direction tempo = first.getDirections().get(0);
        Assertions.assertEquals("Allegro", tempo.getWords());
        Assertions.assertEquals("120", tempo.getMetronome().getPerMinute());
        Assertions.assertEquals("quarter", tempo.getMetronome().getBeatUnit());
        Assertions.assertEquals(List.of("p"), first.getDirections().get(1).getDynamics());

        List<Note> notes = first.getNotes();
        Assertions.assertEquals(List.of("staccato"), notes.get(0).getArticulations());
        Assertions.assertEquals("flat", notes.get(1).getAccidental());
        Assertions.assertEquals(List.of("start"), notes.get(2).getSlurTypes());
        Assertions.assertEquals(1, notes.get(3).getDots());
        Assertions.assertEquals(2, notes.get(3).getStaff());

        Note rest = score.getFirstPart().getMeasures().get(1).getNotes().get(0);
        Assertions.assertTrue(rest.isRest());
        Assertions.assertEquals(List.of("f"), score.getFirstPart().getMeasures().get(3).getNotes().get(0).getDynamics());
    }

    @Test
    public void testSoundAndChordAreRead() throws IOException {
        ScorePartwise inline = read("<score-partwise><part id=\"P1\"><measure number=\"1\">"
                + "<sound tempo=\"96\"/>"
                + "<note><pitch><step>C</step><octave>4</octave></pitch><type>quarter</type></note>"
                + "<note><chord/><pitch><step>E</step><octave>4</octave></pitch><type>quarter</type></note>"
                + "</measure></part></score-partwise>");
        Measure measure = inline.getFirstPart().getMeasures().get(0);
        Assertions.assertEquals("96", measure.getSounds().get(0).getTempo());
        Assertions.assertTrue(measure.getNotes().get(1).isChord());
        Assertions.assertNull(inline.getTitle());
        Assertions.assertNull(inline.getFirstKey());
    }

    @Test
    public void testOtherRootIsRejected() {
        Assertions.assertThrows(MissingStructureException.class, () -> read("<score-timewise/>"));
    }

    @Test
    public void testMalformedXmlIsIoError() {
        Assertions.assertThrows(IOException.class, () -> read("<score-partwise><part>"));
    }

    @Test
    public void testMissingMeasuresAreReported() throws IOException {
        ScorePartwise empty = read("<score-partwise><part id=\"P1\"/></score-partwise>");
        Assertions.assertThrows(MissingStructureException.class, empty::getFirstPart);
        ScorePartwise noPart = read("<score-partwise/>");
        Assertions.assertThrows(MissingStructureException.class, noPart::getFirstPart);
    }
}
