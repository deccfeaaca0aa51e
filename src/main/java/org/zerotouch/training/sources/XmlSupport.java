package org.zerotouch.training.sources;

import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.SAXException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * DOM helpers shared by the BPMN and Tosca parsers.
 * Lookups compare namespace URI and local name; a {@code null} namespace matches unqualified elements only.
 */
public final class XmlSupport {

    private XmlSupport() {
    }

    /**
     * Parses an XML file with a namespace-aware builder. Documents declaring a DOCTYPE are rejected.
     *
     * @param xmlFilePath path to the XML file
     * @return the parsed document
     * @throws MalformedSourceException if the file cannot be read or is not well-formed XML
     */
    public static Document parseXmlFile(String xmlFilePath) {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setNamespaceAware(true);
            // no DOCTYPE, no external entities
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            factory.setXIncludeAware(false);
            factory.setExpandEntityReferences(false);
            DocumentBuilder builder = factory.newDocumentBuilder();
            return builder.parse(new File(xmlFilePath));
        } catch (SAXException e) {
            throw new MalformedSourceException("Malformed XML in " + xmlFilePath + ": " + e.getMessage(), xmlFilePath, e);
        } catch (IOException e) {
            throw new MalformedSourceException("Failed to read " + xmlFilePath, xmlFilePath, e);
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML parser is not available", e);
        }
    }

    public static Element firstChild(Element parent, String namespace, String localName) {
        if (parent == null) {
            return null;
        }
        NodeList children = parent.getChildNodes();
        for (int i = 0; i < children.getLength(); i++) {
            Node node = children.item(i);
            if (node.getNodeType() == Node.ELEMENT_NODE && matches((Element) node, namespace, localName)) {
                return (Element) node;
            }
        }
        return null;
    }

    public static List<Element> children(Element parent, String namespace, String localName) {
        List<Element> result = new ArrayList<>();
        if (parent == null) {
            return result;
        }
        NodeList children = parent.getChildNodes();
        for (int i = 0; i < children.getLength(); i++) {
            Node node = children.item(i);
            if (node.getNodeType() == Node.ELEMENT_NODE && matches((Element) node, namespace, localName)) {
                result.add((Element) node);
            }
        }
        return result;
    }

    /**
     * Collects matching descendants of {@code root} in document order, excluding {@code root} itself.
     */
    public static List<Element> descendants(Element root, String namespace, String localName) {
        List<Element> result = new ArrayList<>();
        collectDescendants(root, namespace, localName, result);
        return result;
    }

    public static Element firstDescendant(Element root, String namespace, String localName) {
        List<Element> found = descendants(root, namespace, localName);
        return found.isEmpty() ? null : found.get(0);
    }

    /**
     * Returns the text directly under an element, ignoring the text of nested elements.
     */
    public static String directText(Element element) {
        if (element == null) {
            return "";
        }
        StringBuilder text = new StringBuilder();
        NodeList children = element.getChildNodes();
        for (int i = 0; i < children.getLength(); i++) {
            Node node = children.item(i);
            if (node.getNodeType() == Node.TEXT_NODE || node.getNodeType() == Node.CDATA_SECTION_NODE) {
                text.append(node.getNodeValue());
            }
        }
        return text.toString();
    }

    /**
     * Trimmed text content of the first matching child, or an empty string when there is none.
     */
    public static String childText(Element parent, String namespace, String localName) {
        Element child = firstChild(parent, namespace, localName);
        if (child == null) {
            return "";
        }
        String text = child.getTextContent();
        return text == null ? "" : text.trim();
    }

    private static void collectDescendants(Element parent, String namespace, String localName, List<Element> result) {
        if (parent == null) {
            return;
        }
        NodeList children = parent.getChildNodes();
        for (int i = 0; i < children.getLength(); i++) {
            Node node = children.item(i);
            if (node.getNodeType() != Node.ELEMENT_NODE) {
                continue;
            }
            Element element = (Element) node;
            if (matches(element, namespace, localName)) {
                result.add(element);
            }
            collectDescendants(element, namespace, localName, result);
        }
    }

    private static boolean matches(Element element, String namespace, String localName) {
        return Objects.equals(element.getNamespaceURI(), namespace) && localName.equals(element.getLocalName());
    }
}
