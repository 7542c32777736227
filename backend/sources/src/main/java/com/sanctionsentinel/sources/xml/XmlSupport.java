package com.sanctionsentinel.sources.xml;

import com.sanctionsentinel.sources.api.ParseException;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.ErrorHandler;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * DOM helpers shared by the XML adapters. Parsing refuses DOCTYPEs and external entities;
 * element lookups go by local name so publications with or without a default namespace
 * read the same way.
 */
public final class XmlSupport {
    private static final Logger LOGGER = Logger.getLogger(XmlSupport.class.getName());

    private XmlSupport() {
    }

    public static Document parse(byte[] raw) throws ParseException {
        if (raw == null || raw.length == 0) {
            throw ParseException.format("empty payload");
        }
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setNamespaceAware(true);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            factory.setFeature("http://xml.org/sax/features/external-general-entities", false);
            factory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setExpandEntityReferences(false);

            DocumentBuilder builder = factory.newDocumentBuilder();
            builder.setErrorHandler(new ErrorHandler() {
                @Override
                public void warning(SAXParseException exception) {
                    LOGGER.fine(() -> "XML warning at line " + exception.getLineNumber() + ": " + exception.getMessage());
                }

                @Override
                public void error(SAXParseException exception) throws SAXParseException {
                    throw exception;
                }

                @Override
                public void fatalError(SAXParseException exception) throws SAXParseException {
                    throw exception;
                }
            });
            return builder.parse(new ByteArrayInputStream(raw));
        } catch (SAXException e) {
            throw ParseException.format("payload is not well-formed XML: " + e.getMessage(), e);
        } catch (ParserConfigurationException | IOException e) {
            throw ParseException.format("XML parser unavailable: " + e.getMessage(), e);
        }
    }

    public static Element requireRoot(Document document, String expectedLocalName) throws ParseException {
        Element root = document.getDocumentElement();
        if (root == null || !expectedLocalName.equals(localName(root))) {
            throw ParseException.format("unexpected root element " + (root == null ? "(none)" : localName(root))
                    + ", expected " + expectedLocalName);
        }
        return root;
    }

    public static String localName(Node node) {
        String local = node.getLocalName();
        if (local != null) {
            return local;
        }
        String name = node.getNodeName();
        int colon = name.indexOf(':');
        return colon >= 0 ? name.substring(colon + 1) : name;
    }

    /** Direct child elements with the given local name, in document order. */
    public static List<Element> children(Element parent, String name) {
        List<Element> out = new ArrayList<>();
        if (parent == null) {
            return out;
        }
        NodeList nodes = parent.getChildNodes();
        for (int i = 0; i < nodes.getLength(); i++) {
            Node node = nodes.item(i);
            if (node instanceof Element element && name.equals(localName(element))) {
                out.add(element);
            }
        }
        return out;
    }

    public static Optional<Element> child(Element parent, String name) {
        List<Element> matches = children(parent, name);
        return matches.isEmpty() ? Optional.empty() : Optional.of(matches.get(0));
    }

    /** Children of {@code listName}'s children named {@code itemName}, e.g. programList/program. */
    public static List<Element> nested(Element parent, String listName, String itemName) {
        List<Element> out = new ArrayList<>();
        for (Element list : children(parent, listName)) {
            out.addAll(children(list, itemName));
        }
        return out;
    }

    /** Trimmed text of the first direct child, empty when missing or blank. */
    public static Optional<String> childText(Element parent, String name) {
        return child(parent, name).flatMap(XmlSupport::text);
    }

    public static Optional<String> text(Element element) {
        if (element == null) {
            return Optional.empty();
        }
        String value = element.getTextContent();
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(value.trim());
    }

    public static List<String> childTexts(Element parent, String name) {
        List<String> out = new ArrayList<>();
        for (Element element : children(parent, name)) {
            text(element).ifPresent(out::add);
        }
        return out;
    }
}
