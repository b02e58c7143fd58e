package net.littleredcomputer.petri;

import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.helpers.DefaultHandler;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

/**
 * Reads place/transition nets in PNML. Elements are matched by local name, so the
 * namespace of the document (if any) does not matter, nor does page nesting.
 */
public class PnmlReader {
    private PnmlReader() {}

    public static PetriNet read(Path path) throws IOException {
        try (Reader r = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return read(r);
        } catch (NoSuchFileException e) {
            throw new InvalidNetException("File not found: " + path, e);
        }
    }

    public static PetriNet parse(String pnml) {
        try {
            return read(new StringReader(pnml));
        } catch (IOException e) {
            throw new IllegalStateException("I/O error reading from a string", e);
        }
    }

    public static PetriNet read(Reader r) throws IOException {
        Document doc;
        try {
            doc = documentBuilder().parse(new InputSource(r));
        } catch (SAXException e) {
            throw new InvalidNetException("Invalid PNML file: " + e.getMessage(), e);
        }
        PetriNet.Builder b = PetriNet.builder();
        NodeList places = doc.getElementsByTagNameNS("*", "place");
        for (int i = 0; i < places.getLength(); ++i) {
            Element e = (Element) places.item(i);
            String id = attribute(e, "id");
            if (id == null) {
                b.reportError("A place is missing the 'id' attribute.");
                continue;
            }
            int marking = 0;
            String text = childText(e, "initialMarking");
            if (text != null) {
                try {
                    marking = Integer.parseInt(text);
                } catch (NumberFormatException ex) {
                    b.reportError(String.format("initialMarking of place %s is not an integer: '%s'", id, text));
                }
            }
            b.addPlace(id, childText(e, "name"), marking);
        }
        NodeList transitions = doc.getElementsByTagNameNS("*", "transition");
        for (int i = 0; i < transitions.getLength(); ++i) {
            Element e = (Element) transitions.item(i);
            String id = attribute(e, "id");
            if (id == null) {
                b.reportError("A transition is missing the 'id' attribute.");
                continue;
            }
            b.addTransition(id, childText(e, "name"));
        }
        NodeList arcs = doc.getElementsByTagNameNS("*", "arc");
        for (int i = 0; i < arcs.getLength(); ++i) {
            Element e = (Element) arcs.item(i);
            String id = attribute(e, "id");
            String source = attribute(e, "source");
            String target = attribute(e, "target");
            if (id == null || source == null || target == null) {
                b.reportError("An arc is missing one of the attributes: id / source / target.");
                continue;
            }
            b.addArc(id, source, target);
        }
        return b.build();
    }

    private static DocumentBuilder documentBuilder() {
        DocumentBuilderFactory f = DocumentBuilderFactory.newInstance();
        f.setNamespaceAware(true);
        f.setExpandEntityReferences(false);
        try {
            f.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            f.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            DocumentBuilder db = f.newDocumentBuilder();
            // The JDK default handler echoes fatal errors to stderr before they are thrown.
            db.setErrorHandler(new DefaultHandler());
            return db;
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML parser does not support secure processing", e);
        }
    }

    private static String attribute(Element e, String name) {
        return e.hasAttribute(name) ? e.getAttribute(name) : null;
    }

    /**
     * The trimmed content of the {@code <text>} element inside the first direct child of e
     * with the given local name, or null.
     */
    private static String childText(Element e, String childName) {
        for (Node c = e.getFirstChild(); c != null; c = c.getNextSibling()) {
            if (c.getNodeType() != Node.ELEMENT_NODE || !childName.equals(c.getLocalName())) continue;
            for (Node t = c.getFirstChild(); t != null; t = t.getNextSibling()) {
                if (t.getNodeType() == Node.ELEMENT_NODE && "text".equals(t.getLocalName())) {
                    String s = t.getTextContent();
                    return s == null ? null : s.trim();
                }
            }
        }
        return null;
    }
}
