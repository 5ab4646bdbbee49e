/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoregraph.notation;

import net.scoreworks.scoregraph.ExtractionPass;
import net.scoreworks.scoregraph.PassReport;
import net.scoreworks.scoregraph.ScoreContext;
import net.scoreworks.scoregraph.graph.Node;
import net.scoreworks.scoregraph.graph.NodeStore;
import net.scoreworks.scoregraph.graph.NodeType;
import net.scoreworks.scoregraph.graph.Vocabulary;
import net.scoreworks.scoregraph.identity.EventCounter;
import net.scoreworks.scoregraph.identity.NodeId;
import net.scoreworks.scoregraph.identity.PositionalIds;
import net.scoreworks.scoregraph.identity.SubFeature;
import net.scoreworks.scoregraph.score.Attributes;
import net.scoreworks.scoregraph.score.Direction;
import net.scoreworks.scoregraph.score.MeasureElement;
import net.scoreworks.scoregraph.score.Note;
import net.scoreworks.scoregraph.score.Sound;
import net.scoreworks.scoregraph.structure.PositionedMeasure;
import org.apache.commons.lang3.StringUtils;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;


/**
 * Adds the notated content of every measure: time signatures, clefs, tempi and one symbolic event per note or
 * rest with its duration, pitch and accidental.
 * <p>
 * Event ordinals come from one {@link EventCounter} for the whole work. Movements are visited in ascending
 * order, measures and their notes in document order, chord members included.
 */
public class NotationBuilder implements ExtractionPass {
    private static final Logger LOG = LoggerFactory.getLogger(NotationBuilder.class);

    private static final String PITCH_STEPS = "ABCDEFG";

    @Override
    public String getName() {
        return "notation";
    }

    @Override
    public PassReport run(ScoreContext context, NodeStore store) {
        List<PositionedMeasure> measures = context.getPositionedMeasures();
        Traversal traversal = new Traversal(context.getIds(), store);
        for (PositionedMeasure measure : measures)
            traversal.visit(measure);
        LOG.debug("{} symbolic event(s) in {} measure(s)", traversal.counter.issued(), measures.size());
        return PassReport.of(getName(), store, traversal.skipped);
    }


    /**
     * State of one run over the measures
     */
    private static class Traversal {
        final PositionalIds ids;
        final NodeStore store;
        final EventCounter counter = new EventCounter();

        /** staff index to the clef in effect on that staff. Cleared when a new movement starts */
        final Map<Integer, NodeId> activeClefs = new HashMap<>();
        int movementIndex;
        int skipped;

        Traversal(PositionalIds ids, NodeStore store) {
            this.ids = ids;
            this.store = store;
        }

        void visit(PositionedMeasure positioned) {
            if (positioned.getMovementIndex() != movementIndex) {
                movementIndex = positioned.getMovementIndex();
                activeClefs.clear();
            }
            Node measure = store.getOrCreate(positioned.getMeasureId(), NodeType.MEASURE);
            if (!measure.has(Vocabulary.NUMBER))
                measure.set(Vocabulary.NUMBER, positioned.getNumberValue());
            if (!measure.has(Vocabulary.POSITION))
                measure.set(Vocabulary.POSITION, positioned.getPosition());

            addTimeSignature(positioned, measure);
            addTempi(positioned, measure);
            for (MeasureElement element : positioned.getMeasure().getElements()) {
                if (element instanceof Attributes)
                    addClefs((Attributes) element, measure);
                else if (element instanceof Note)
                    addEvent((Note) element, measure);
            }
        }


        //==========MEASURE LEVEL====================================================

        private void addTimeSignature(PositionedMeasure positioned, Node measure) {
            Attributes.TimeSignature time = null;
            for (Attributes attributes : positioned.getMeasure().getAttributeBlocks()) {
                if (attributes.getTime() != null) {
                    time = attributes.getTime();
                    break;
                }
            }
            if (time == null || time.getBeats() == null || time.getBeatType() == null)
                return;

            NodeId timeSignatureId = SubFeature.TIME_SIGNATURE.of(measure.getId());
            Node timeSignature = store.getOrCreate(timeSignatureId,
                    NodeType.TIME_SIGNATURE, NodeType.MUSIC_NOTATION_ELEMENT, NodeType.SIGNATURE);
            Object numerator = integerOrText(time.getBeats());
            Object denominator = integerOrText(time.getBeatType());
            timeSignature.set(Vocabulary.NUMERATOR, numerator);
            timeSignature.set(Vocabulary.DENOMINATOR, denominator);
            if (time.getSymbol() != null)
                timeSignature.set(Vocabulary.SYMBOL, time.getSymbol());
            //compound signatures like 3+2/8 keep their text but get no class
            if (numerator instanceof Integer && denominator instanceof Integer)
                timeSignature.addType(NodeType.timeSignatureClass((Integer) numerator, (Integer) denominator));
            measure.link(Vocabulary.HAS_TIME_SIGNATURE, timeSignatureId);
            timeSignature.link(Vocabulary.TIME_SIGNATURE_OF, measure.getId());
        }

        /**
         * Tempo attributes of measure level sounds first, then one tempo per direction: its sound tempo if
         * present, else its metronome mark
         */
        private void addTempi(PositionedMeasure positioned, Node measure) {
            int tempoIndex = 1;
            for (Sound sound : positioned.getMeasure().getSounds()) {
                if (StringUtils.isNotBlank(sound.getTempo()))
                    addTempo(measure, tempoIndex++, sound.getTempo(), null, null);
            }
            for (Direction direction : positioned.getMeasure().getDirections()) {
                Sound sound = direction.getSound();
                if (sound != null && StringUtils.isNotBlank(sound.getTempo())) {
                    addTempo(measure, tempoIndex++, sound.getTempo(), direction.getWords(), null);
                    continue;
                }
                Direction.Metronome metronome = direction.getMetronome();
                if (metronome != null && metronome.getPerMinute() != null)
                    addTempo(measure, tempoIndex++, metronome.getPerMinute(), direction.getWords(), metronome.getBeatUnit());
            }
        }

        private void addTempo(Node measure, int tempoIndex, String bpm, @Nullable String text, @Nullable String beatUnit) {
            NodeId tempoId = SubFeature.TEMPO.of(measure.getId(), tempoIndex);
            Node tempo = store.getOrCreate(tempoId, NodeType.TEMPO, NodeType.MUSIC_NOTATION_ELEMENT);
            tempo.set(Vocabulary.BPM, integerOrText(bpm));
            if (text != null)
                tempo.set(Vocabulary.TEMPO_TEXT, text);
            if (beatUnit != null)
                tempo.set(Vocabulary.BEAT_UNIT, beatUnit);
            measure.appendLink(Vocabulary.HAS_TEMPO, tempoId);
            tempo.link(Vocabulary.IS_TEMPO_OF, measure.getId());
        }

        /**
         * There is one clef node per staff and movement. A clef change within the movement updates that node
         */
        private void addClefs(Attributes attributes, Node measure) {
            for (Attributes.ClefDeclaration declaration : attributes.getClefs()) {
                int staffIndex = declaration.getStaff() != null ? declaration.getStaff() : 1;
                NodeId clefId = ids.staffClef(movementIndex, staffIndex);
                Node clef = store.getOrCreate(clefId, NodeType.CLEF, NodeType.MUSIC_NOTATION_ELEMENT);
                if (declaration.getSign() != null)
                    clef.set(Vocabulary.SIGN, declaration.getSign());
                if (declaration.getLine() != null)
                    clef.set(Vocabulary.LINE, integerOrText(declaration.getLine()));
                activeClefs.put(staffIndex, clefId);

                //no staff node is forced into existence for a clef on an undeclared staff
                Node staff = store.get(ids.staff(movementIndex, staffIndex));
                if (staff != null)
                    staff.appendLink(Vocabulary.STAFF_HAS_CLEF, clefId);
                else
                    LOG.debug("No staff {} in movement {} for clef {}", staffIndex, movementIndex, clefId);
                measure.appendLink(Vocabulary.HAS_CLEF, clefId);
            }
        }


        //==========EVENT LEVEL====================================================

        private void addEvent(Note note, Node measure) {
            NodeId eventId = ids.event(measure.getId(), counter.next());
            int staffIndex = note.getStaff() != null ? note.getStaff() : 1;

            List<NodeType> types = new ArrayList<>(List.of(NodeType.SYMBOLIC_EVENT, NodeType.MUSIC_NOTATION_ELEMENT));
            if (note.isRest())
                types.add(NodeType.REST);
            else if (note.isPitched() || note.isUnpitched())
                types.add(NodeType.NOTE);
            //the event keeps its ordinal and its node, only the subtype is missing
            else
                LOG.debug("Event {} is neither note nor rest", eventId);
            Node event = store.getOrCreate(eventId, types);
            event.link(Vocabulary.IS_IN_MEASURE, measure.getId());
            event.set(Vocabulary.STAFF_INDEX, staffIndex);
            measure.appendLink(Vocabulary.HAS_SYMBOLIC_EVENT, eventId);

            addDuration(note, event);
            NodeId clefId = activeClefs.get(staffIndex);
            if (clefId != null)
                event.link(Vocabulary.HAS_CLEF, clefId);
            if (!note.isRest() && note.isPitched())
                addPitch(note, event);
        }

        /**
         * The duration node exists for every event, even if its type and dots have no class
         */
        private void addDuration(Note note, Node event) {
            NodeId durationId = SubFeature.DURATION.of(event.getId());
            Node duration = store.getOrCreate(durationId, NodeType.DURATION, NodeType.MUSIC_NOTATION_ELEMENT);
            if (note.getType() != null)
                duration.set(Vocabulary.NOTE_TYPE, note.getType());
            duration.set(Vocabulary.DOTS, note.getDots());
            DurationClass durationClass = DurationClass.classify(note.getType(), note.getDots());
            if (durationClass != null)
                duration.addType(durationClass.getType());
            event.link(Vocabulary.HAS_DURATION, durationId);
        }

        private void addPitch(Note note, Node event) {
            String step = StringUtils.upperCase(StringUtils.trimToNull(note.getStep()));
            Object octave = note.getOctave() == null ? null : integerOrText(note.getOctave());
            if (step == null || step.length() != 1 || !PITCH_STEPS.contains(step) || octave == null) {
                LOG.debug("Incomplete pitch step={} octave={} at {}", step, octave, event.getId());
                skipped++;
                return;
            }
            NodeId pitchId = SubFeature.PITCH.of(event.getId());
            Node pitch = store.getOrCreate(pitchId, NodeType.PITCH, NodeType.MELODIC_ELEMENT, NodeType.pitchClass(step.charAt(0)));
            pitch.set(Vocabulary.OCTAVE, octave);
            event.link(Vocabulary.HAS_PITCH, pitchId);

            if (StringUtils.isBlank(note.getAccidental()))
                return;
            NodeId accidentalId = SubFeature.ACCIDENTAL.of(event.getId());
            Node accidental = store.getOrCreate(accidentalId, NodeType.ACCIDENTAL, NodeType.MELODIC_ELEMENT);
            AccidentalClass accidentalClass = AccidentalClass.fromText(note.getAccidental());
            if (accidentalClass != null) {
                accidental.addType(accidentalClass.getType());
                accidental.set(Vocabulary.SEMITONE_SHIFT, accidentalClass.getSemitoneShift());
            }
            pitch.link(Vocabulary.HAS_ACCIDENTAL, accidentalId);
        }
    }

    /**
     * @return the text as integer if it is one, else the trimmed text
     */
    static Object integerOrText(String text) {
        String trimmed = text.trim();
        try {
            return Integer.parseInt(trimmed);
        } catch (NumberFormatException e) {
            return trimmed;
        }
    }
}
