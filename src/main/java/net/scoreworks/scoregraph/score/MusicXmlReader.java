/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.scoregraph.score;

import net.scoreworks.scoregraph.exceptions.MissingStructureException;
import org.apache.commons.lang3.StringUtils;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.SAXException;

import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;


/**
 * Reads a {@code score-partwise} MusicXML document into a {@link ScorePartwise}. Only the elements the extraction
 * passes use are kept; the children of each measure stay in document order. The DOCTYPE of MusicXML files is
 * ignored, external DTDs are never fetched.
 */
public final class MusicXmlReader {
    private static final Logger LOG = LoggerFactory.getLogger(MusicXmlReader.class);

    public ScorePartwise read(Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            return read(in, path.getFileName().toString());
        }
    }

    /**
     * @param sourceName name of the document, used to derive the work id
     */
    public ScorePartwise read(InputStream in, String sourceName) throws IOException {
        Document doc;
        try {
            doc = newDocumentBuilder().parse(in);
        } catch (SAXException e) {
            throw new IOException("Malformed MusicXML in " + sourceName + ": " + e.getMessage(), e);
        }
        Element root = doc.getDocumentElement();
        if (!"score-partwise".equals(localName(root)))
            throw new MissingStructureException(sourceName, "expected <score-partwise> but found <" + localName(root) + ">");

        List<Part> parts = new ArrayList<>();
        for (Element partEl : children(root, "part")) {
            List<Measure> measures = new ArrayList<>();
            for (Element measureEl : children(partEl, "measure")) {
                measures.add(readMeasure(measureEl));
            }
            parts.add(new Part(partEl.getAttribute("id"), measures));
        }
        LOG.debug("Read {} part(s) from {}", parts.size(), sourceName);
        return new ScorePartwise(sourceName, readTitle(root), readComposer(root), readInstrumentName(root), parts);
    }

    private static DocumentBuilder newDocumentBuilder() throws IOException {
        DocumentBuilderFactory dbf = DocumentBuilderFactory.newInstance();
        try {
            dbf.setFeature("http://apache.org/xml/features/nonvalidating/load-external-dtd", false);
            dbf.setFeature("http://xml.org/sax/features/external-general-entities", false);
            dbf.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
            dbf.setExpandEntityReferences(false);
            dbf.setIgnoringComments(true);
            return dbf.newDocumentBuilder();
        } catch (ParserConfigurationException e) {
            throw new IOException("XML parser does not support the required features", e);
        }
    }


    //==========HEADER====================================================

    private static @Nullable String readTitle(Element root) {
        Element work = child(root, "work");
        String title = work == null ? null : normalizedText(child(work, "work-title"));
        return title != null ? title : creditWords(root, "title");
    }

    private static @Nullable String readComposer(Element root) {
        Element identification = child(root, "identification");
        if (identification != null) {
            for (Element creator : children(identification, "creator")) {
                if ("composer".equals(creator.getAttribute("type"))) {
                    String composer = normalizedText(creator);
                    if (composer != null)
                        return composer;
                }
            }
        }
        return creditWords(root, "composer");
    }

    private static @Nullable String creditWords(Element root, String creditType) {
        for (Element credit : children(root, "credit")) {
            if (creditType.equals(text(child(credit, "credit-type")))) {
                String words = normalizedText(child(credit, "credit-words"));
                if (words != null)
                    return words;
            }
        }
        return null;
    }

    private static @Nullable String readInstrumentName(Element root) {
        Element partList = child(root, "part-list");
        Element scorePart = partList == null ? null : child(partList, "score-part");
        if (scorePart == null)
            return null;
        String name = normalizedText(child(scorePart, "part-name"));
        if (name != null)
            return name;
        Element instrument = child(scorePart, "score-instrument");
        return instrument == null ? null : normalizedText(child(instrument, "instrument-name"));
    }


    //==========MEASURE CONTENT====================================================

    private static Measure readMeasure(Element measureEl) {
        List<MeasureElement> elements = new ArrayList<>();
        for (Element el : children(measureEl, null)) {
            switch (localName(el)) {
                case "attributes":
                    elements.add(readAttributes(el));
                    break;
                case "direction":
                    elements.add(readDirection(el));
                    break;
                case "sound":
                    elements.add(readSound(el));
                    break;
                case "note":
                    elements.add(readNote(el));
                    break;
                default:
                    //backup, forward, barline, print, harmony... are not needed
            }
        }
        String number = measureEl.hasAttribute("number") ? measureEl.getAttribute("number") : null;
        return new Measure(number, elements);
    }

    private static Attributes readAttributes(Element el) {
        Attributes.TimeSignature time = null;
        Element timeEl = child(el, "time");
        if (timeEl != null) {
            String symbol = timeEl.hasAttribute("symbol") ? timeEl.getAttribute("symbol") : text(child(timeEl, "symbol"));
            time = new Attributes.TimeSignature(text(child(timeEl, "beats")), text(child(timeEl, "beat-type")), symbol);
        }
        List<Attributes.ClefDeclaration> clefs = new ArrayList<>();
        for (Element clefEl : children(el, "clef")) {
            String staff = clefEl.hasAttribute("number") ? clefEl.getAttribute("number") : text(child(clefEl, "staff"));
            clefs.add(new Attributes.ClefDeclaration(text(child(clefEl, "sign")), text(child(clefEl, "line")), parseInteger(staff)));
        }
        Attributes.KeyDeclaration key = null;
        Element keyEl = child(el, "key");
        if (keyEl != null)
            key = new Attributes.KeyDeclaration(parseInteger(text(child(keyEl, "fifths"))), text(child(keyEl, "mode")));
        return new Attributes(parseInteger(text(child(el, "staves"))), time, clefs, key);
    }

    private static Direction readDirection(Element el) {
        String words = null;
        List<String> dynamics = new ArrayList<>();
        Direction.Metronome metronome = null;
        for (Element directionType : children(el, "direction-type")) {
            if (words == null)
                words = text(child(directionType, "words"));
            Element dynamicsEl = child(directionType, "dynamics");
            if (dynamicsEl != null) {
                for (Element dynamic : children(dynamicsEl, null))
                    dynamics.add(localName(dynamic).toLowerCase());
            }
            Element metronomeEl = child(directionType, "metronome");
            if (metronome == null && metronomeEl != null)
                metronome = new Direction.Metronome(text(child(metronomeEl, "beat-unit")), text(child(metronomeEl, "per-minute")));
        }
        Element soundEl = child(el, "sound");
        Sound sound = soundEl == null ? null : readSound(soundEl);
        return new Direction(parseInteger(text(child(el, "staff"))), words, dynamics, metronome, sound);
    }

    private static Sound readSound(Element el) {
        return new Sound(el.hasAttribute("tempo") ? el.getAttribute("tempo") : null);
    }

    private static Note readNote(Element el) {
        Note.Builder builder = Note.builder()
                .staff(parseInteger(text(child(el, "staff"))))
                .duration(text(child(el, "duration")))
                .type(text(child(el, "type")))
                .dots(children(el, "dot").size())
                .accidental(text(child(el, "accidental")));
        if (child(el, "rest") != null)
            builder.rest();
        if (child(el, "chord") != null)
            builder.chord();
        if (child(el, "unpitched") != null)
            builder.unpitched();
        Element pitch = child(el, "pitch");
        if (pitch != null)
            builder.pitch(text(child(pitch, "step")), text(child(pitch, "octave")));

        for (Element notations : children(el, "notations")) {
            for (Element dynamicsEl : children(notations, "dynamics")) {
                for (Element dynamic : children(dynamicsEl, null))
                    builder.dynamic(localName(dynamic).toLowerCase());
            }
            for (Element articulations : children(notations, "articulations")) {
                for (Element articulation : children(articulations, null))
                    builder.articulation(localName(articulation).toLowerCase());
            }
            for (Element slur : children(notations, "slur"))
                builder.slur(slur.getAttribute("type").toLowerCase());
        }
        return builder.build();
    }


    //==========DOM HELPERS====================================================

    /**
     * @param name local name to filter for, or null for all child elements
     */
    private static List<Element> children(Element parent, @Nullable String name) {
        List<Element> result = new ArrayList<>();
        NodeList nodes = parent.getChildNodes();
        for (int i = 0; i < nodes.getLength(); i++) {
            Node node = nodes.item(i);
            if (node.getNodeType() == Node.ELEMENT_NODE && (name == null || name.equals(localName(node))))
                result.add((Element) node);
        }
        return result;
    }

    private static @Nullable Element child(Element parent, String name) {
        NodeList nodes = parent.getChildNodes();
        for (int i = 0; i < nodes.getLength(); i++) {
            Node node = nodes.item(i);
            if (node.getNodeType() == Node.ELEMENT_NODE && name.equals(localName(node)))
                return (Element) node;
        }
        return null;
    }

    private static String localName(Node node) {
        String name = node.getLocalName() != null ? node.getLocalName() : node.getNodeName();
        int colon = name.indexOf(':');
        return colon >= 0 ? name.substring(colon + 1) : name;
    }

    /**
     * @return trimmed text content or null if the element is absent or empty
     */
    private static @Nullable String text(@Nullable Element el) {
        return el == null ? null : StringUtils.trimToNull(el.getTextContent());
    }

    private static @Nullable String normalizedText(@Nullable Element el) {
        return el == null ? null : StringUtils.trimToNull(StringUtils.normalizeSpace(el.getTextContent()));
    }

    private static @Nullable Integer parseInteger(@Nullable String value) {
        if (value == null)
            return null;
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
