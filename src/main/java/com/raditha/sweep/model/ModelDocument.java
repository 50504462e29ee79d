package com.raditha.sweep.model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.DocumentType;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.ErrorHandler;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.transform.OutputKeys;
import javax.xml.transform.Transformer;
import javax.xml.transform.TransformerException;
import javax.xml.transform.TransformerFactory;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamResult;
import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * An XML timed-automata model (flat NTA format) held as text.
 * <p>
 * Instances are immutable; every DOM handed out is a fresh parse, so concurrent
 * workers never share a mutable tree. Declarations live in three kinds of
 * containers:
 * <ul>
 *   <li>the root-level {@code <declaration>}, section {@value #PROJECT}</li>
 *   <li>each {@code <template>}'s {@code <declaration>}, section = the template's {@code <name>}</li>
 *   <li>the root-level {@code <system>}, section {@value #SYSTEM}</li>
 * </ul>
 */
public final class ModelDocument {

    public static final String PROJECT = "project";
    public static final String SYSTEM = "system";

    private static final Logger logger = LoggerFactory.getLogger(ModelDocument.class);

    private static final String LOAD_EXTERNAL_DTD = "http://apache.org/xml/features/nonvalidating/load-external-dtd";

    private final String xml;

    private ModelDocument(String xml) {
        this.xml = xml;
    }

    /**
     * Wrap XML text, checking that it parses.
     *
     * @throws IllegalArgumentException if the text is not well-formed XML
     */
    public static ModelDocument of(String xml) {
        Objects.requireNonNull(xml, "xml cannot be null");
        ModelDocument document = new ModelDocument(xml);
        document.dom();
        return document;
    }

    /**
     * Read a model from disk. The file is only read.
     */
    public static ModelDocument load(Path path) throws IOException {
        return of(Files.readString(path, StandardCharsets.UTF_8));
    }

    /**
     * Serialize a DOM, keeping its document type declaration.
     */
    public static ModelDocument of(Document dom) {
        try {
            Transformer transformer = TransformerFactory.newInstance().newTransformer();
            transformer.setOutputProperty(OutputKeys.ENCODING, "utf-8");
            transformer.setOutputProperty(OutputKeys.INDENT, "no");
            DocumentType doctype = dom.getDoctype();
            if (doctype != null) {
                if (doctype.getPublicId() != null) {
                    transformer.setOutputProperty(OutputKeys.DOCTYPE_PUBLIC, doctype.getPublicId());
                }
                if (doctype.getSystemId() != null) {
                    transformer.setOutputProperty(OutputKeys.DOCTYPE_SYSTEM, doctype.getSystemId());
                }
            }
            StringWriter out = new StringWriter();
            transformer.transform(new DOMSource(dom), new StreamResult(out));
            return new ModelDocument(out.toString());
        } catch (TransformerException e) {
            throw new IllegalStateException("Cannot serialize model document", e);
        }
    }

    /**
     * A fresh, private DOM of this document.
     */
    public Document dom() {
        try {
            DocumentBuilder builder = newFactory().newDocumentBuilder();
            builder.setErrorHandler(new FailingErrorHandler());
            return builder.parse(new InputSource(new StringReader(xml)));
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML parser unavailable", e);
        } catch (SAXException | IOException e) {
            throw new IllegalArgumentException("Malformed model document: " + e.getMessage(), e);
        }
    }

    public String toXml() {
        return xml;
    }

    /**
     * Declaration texts by section: project first, then templates in document
     * order, then system. Containers that are absent are skipped.
     */
    public Map<String, String> declarations() {
        Document dom = dom();
        Element root = dom.getDocumentElement();
        Map<String, String> sections = new LinkedHashMap<>();

        Element project = child(root, "declaration");
        if (project != null) {
            sections.put(PROJECT, project.getTextContent());
        }
        for (Element template : children(root, "template")) {
            Element name = child(template, "name");
            Element declaration = child(template, "declaration");
            if (name != null && declaration != null) {
                sections.put(name.getTextContent().trim(), declaration.getTextContent());
            }
        }
        Element system = child(root, "system");
        if (system != null) {
            sections.put(SYSTEM, system.getTextContent());
        }
        return Collections.unmodifiableMap(sections);
    }

    /**
     * Declaration text of one section, or null when the document has no such section.
     */
    public String declarationText(String section) {
        Element element = declarationElement(dom(), section);
        return element == null ? null : element.getTextContent();
    }

    /**
     * A copy of this document with one section's declaration text replaced.
     *
     * @throws IllegalArgumentException when the document has no such section
     */
    public ModelDocument withDeclaration(String section, String text) {
        Document copy = dom();
        Element element = declarationElement(copy, section);
        if (element == null) {
            throw new IllegalArgumentException("No declaration section named " + section);
        }
        element.setTextContent(text);
        return of(copy);
    }

    /**
     * Locate the declaration container of a section inside a DOM of this format.
     *
     * @return the element, or null when no container matches
     */
    public static Element declarationElement(Document dom, String section) {
        Element root = dom.getDocumentElement();
        if (PROJECT.equals(section)) {
            return child(root, "declaration");
        }
        if (SYSTEM.equals(section)) {
            return child(root, SYSTEM);
        }
        for (Element template : children(root, "template")) {
            Element name = child(template, "name");
            Element declaration = child(template, "declaration");
            if (name != null && declaration != null && section.equals(name.getTextContent().trim())) {
                return declaration;
            }
        }
        return null;
    }

    private static DocumentBuilderFactory newFactory() throws ParserConfigurationException {
        DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
        factory.setNamespaceAware(false);
        factory.setValidating(false);
        factory.setCoalescing(true);
        // Model files reference the vendor DTD by URL; never fetch it.
        factory.setFeature(LOAD_EXTERNAL_DTD, false);
        return factory;
    }

    private static Element child(Element parent, String tag) {
        NodeList nodes = parent.getChildNodes();
        for (int i = 0; i < nodes.getLength(); i++) {
            Node n = nodes.item(i);
            if (n instanceof Element el && tag.equals(el.getTagName())) {
                return el;
            }
        }
        return null;
    }

    private static List<Element> children(Element parent, String tag) {
        List<Element> out = new ArrayList<>();
        NodeList nodes = parent.getChildNodes();
        for (int i = 0; i < nodes.getLength(); i++) {
            Node n = nodes.item(i);
            if (n instanceof Element el && tag.equals(el.getTagName())) {
                out.add(el);
            }
        }
        return out;
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof ModelDocument other && xml.equals(other.xml));
    }

    @Override
    public int hashCode() {
        return xml.hashCode();
    }

    private static final class FailingErrorHandler implements ErrorHandler {
        @Override
        public void warning(SAXParseException e) {
            logger.debug("XML warning at line {}: {}", e.getLineNumber(), e.getMessage());
        }

        @Override
        public void error(SAXParseException e) throws SAXException {
            throw e;
        }

        @Override
        public void fatalError(SAXParseException e) throws SAXException {
            throw e;
        }
    }
}
