package net.scoreworks.scoregraph.notation;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class DurationClassTest {

    @Test
    public void testPlainValues() {
        Assertions.assertEquals(DurationClass.WHOLE_NOTE, DurationClass.classify("whole", 0));
        Assertions.assertEquals(DurationClass.SIXTEENTH_NOTE, DurationClass.classify("16th", 0));
        Assertions.assertEquals(DurationClass.SIXTY_FOURTH_NOTE, DurationClass.classify("64th", 0));
        Assertions.assertEquals("so:QuarterNote", DurationClass.classify("quarter", 0).getType().toString());
    }

    @Test
    public void testOnlyHalfQuarterAndEighthHaveDottedClass() {
        Assertions.assertEquals(DurationClass.DOTTED_QUARTER, DurationClass.classify("quarter", 1));
        Assertions.assertEquals(DurationClass.DOTTED_HALF, DurationClass.classify("half", 1));
        Assertions.assertEquals(DurationClass.DOTTED_EIGHTH, DurationClass.classify("eighth", 1));
        Assertions.assertNull(DurationClass.classify("whole", 1));
        Assertions.assertNull(DurationClass.classify("16th", 1));
        Assertions.assertNull(DurationClass.classify("quarter", 2));
    }

    @Test
    public void testUnknownTypes() {
        Assertions.assertNull(DurationClass.classify(null, 0));
        Assertions.assertNull(DurationClass.classify("128th", 0));
        Assertions.assertNull(DurationClass.classify("crotchet", 0));
    }

    @Test
    public void testBaseDenominators() {
        Assertions.assertEquals(0, NoteType.fromText("breve").getBaseDenominator());
        Assertions.assertEquals(1, NoteType.fromText("whole").getBaseDenominator());
        Assertions.assertEquals(32, NoteType.fromText("32nd").getBaseDenominator());
        Assertions.assertEquals(256, NoteType.fromText("256th").getBaseDenominator());
        Assertions.assertNull(NoteType.fromText(""));
    }
}
