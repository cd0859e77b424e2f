package ai.svgtranslate.svg;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.transform.OutputKeys;
import javax.xml.transform.Transformer;
import javax.xml.transform.TransformerException;
import javax.xml.transform.TransformerFactory;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamResult;
import org.w3c.dom.Document;
import org.w3c.dom.DocumentType;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.ErrorHandler;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

/**
 * Parsing, serialization and traversal helpers for SVG DOM trees.
 */
public final class SvgDocuments {

    private static final String XML_DECLARATION = "<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n";

    private SvgDocuments() {
    }

    public static Document read(Path path) {
        return parse(readBytes(path));
    }

    public static byte[] readBytes(Path path) {
        try {
            return Files.readAllBytes(path);
        } catch (NoSuchFileException ex) {
            throw new SvgParseException(SvgParseException.FILE_NOT_FOUND, "SVG file not found: " + path, ex);
        } catch (IOException ex) {
            throw new SvgParseException(SvgParseException.PARSE_ERROR, "Failed to read SVG file: " + path, ex);
        }
    }

    /**
     * Parses SVG bytes without resolving external DTDs or entities. Whitespace-only text
     * between elements is dropped.
     */
    public static Document parse(byte[] content) {
        try {
            Document document = newBuilder().parse(new ByteArrayInputStream(content));
            removeBlankText(document);
            return document;
        } catch (SAXException | IOException ex) {
            throw new SvgParseException(SvgParseException.PARSE_ERROR, "Malformed SVG: " + ex.getMessage(), ex);
        }
    }

    public static Document parse(String content) {
        return parse(content.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Deep copy of a document, including its doctype when present.
     */
    public static Document copy(Document source) {
        Document target = newBuilder().newDocument();
        for (Node child = source.getFirstChild(); child != null; child = child.getNextSibling()) {
            if (child.getNodeType() == Node.DOCUMENT_TYPE_NODE) {
                continue;
            }
            target.appendChild(target.importNode(child, true));
        }
        DocumentType doctype = source.getDoctype();
        if (doctype != null) {
            target.setUserData(DoctypeHolder.KEY, DoctypeHolder.of(doctype), null);
        } else if (source.getUserData(DoctypeHolder.KEY) != null) {
            target.setUserData(DoctypeHolder.KEY, source.getUserData(DoctypeHolder.KEY), null);
        }
        return target;
    }

    public static String toXml(Document document) {
        StringBuilder builder = new StringBuilder(XML_DECLARATION).append(doctypeDeclaration(document));
        for (Node child = document.getFirstChild(); child != null; child = child.getNextSibling()) {
            if (child.getNodeType() != Node.DOCUMENT_TYPE_NODE) {
                builder.append(serialize(child));
            }
        }
        return builder.toString();
    }

    private static String serialize(Node node) {
        try {
            Transformer transformer = TransformerFactory.newInstance().newTransformer();
            transformer.setOutputProperty(OutputKeys.METHOD, "xml");
            transformer.setOutputProperty(OutputKeys.ENCODING, "UTF-8");
            transformer.setOutputProperty(OutputKeys.OMIT_XML_DECLARATION, "yes");
            transformer.setOutputProperty(OutputKeys.INDENT, "no");
            StringWriter writer = new StringWriter();
            transformer.transform(new DOMSource(node), new StreamResult(writer));
            return writer.toString();
        } catch (TransformerException ex) {
            throw new IllegalStateException("Failed to serialize SVG document", ex);
        }
    }

    /**
     * SVG-namespace descendants of {@code root} with the given local name, in document order.
     * The returned list is a snapshot and stays valid while the tree is edited.
     */
    public static List<Element> descendants(Node root, String localName) {
        NodeList nodes = root instanceof Document document
                ? document.getElementsByTagNameNS(SvgNames.SVG_NAMESPACE, localName)
                : ((Element) root).getElementsByTagNameNS(SvgNames.SVG_NAMESPACE, localName);
        List<Element> result = new ArrayList<>(nodes.getLength());
        for (int i = 0; i < nodes.getLength(); i++) {
            result.add((Element) nodes.item(i));
        }
        return result;
    }

    public static List<Element> childElements(Element parent) {
        List<Element> result = new ArrayList<>();
        for (Node child = parent.getFirstChild(); child != null; child = child.getNextSibling()) {
            if (child.getNodeType() == Node.ELEMENT_NODE) {
                result.add((Element) child);
            }
        }
        return result;
    }

    public static List<Element> childElements(Element parent, String localName) {
        List<Element> result = new ArrayList<>();
        for (Element child : childElements(parent)) {
            if (is(child, localName)) {
                result.add(child);
            }
        }
        return result;
    }

    public static boolean is(Node node, String localName) {
        return node != null
                && node.getNodeType() == Node.ELEMENT_NODE
                && SvgNames.SVG_NAMESPACE.equals(node.getNamespaceURI())
                && localName.equals(node.getLocalName());
    }

    public static boolean hasElementChildren(Element element) {
        for (Node child = element.getFirstChild(); child != null; child = child.getNextSibling()) {
            if (child.getNodeType() == Node.ELEMENT_NODE) {
                return true;
            }
        }
        return false;
    }

    public static boolean isTextNode(Node node) {
        return node.getNodeType() == Node.TEXT_NODE || node.getNodeType() == Node.CDATA_SECTION_NODE;
    }

    /**
     * Attribute value, or {@code null} when the attribute is absent.
     */
    public static String attribute(Element element, String name) {
        return element.hasAttribute(name) ? element.getAttribute(name) : null;
    }

    public static Element createElement(Document document, String localName) {
        return document.createElementNS(SvgNames.SVG_NAMESPACE, localName);
    }

    private static void removeBlankText(Node node) {
        Node child = node.getFirstChild();
        boolean hasElementChild = node.getNodeType() == Node.ELEMENT_NODE && hasElementChildren((Element) node);
        while (child != null) {
            Node next = child.getNextSibling();
            if (child.getNodeType() == Node.TEXT_NODE && hasElementChild && child.getNodeValue().isBlank()) {
                node.removeChild(child);
            } else if (child.getNodeType() == Node.ELEMENT_NODE) {
                removeBlankText(child);
            }
            child = next;
        }
    }

    private static String doctypeDeclaration(Document document) {
        DoctypeHolder holder;
        DocumentType doctype = document.getDoctype();
        if (doctype != null) {
            holder = DoctypeHolder.of(doctype);
        } else {
            holder = (DoctypeHolder) document.getUserData(DoctypeHolder.KEY);
        }
        if (holder == null || document.getDocumentElement() == null) {
            return "";
        }
        return holder.declaration(document.getDocumentElement().getTagName());
    }

    private static DocumentBuilder newBuilder() {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setNamespaceAware(true);
            factory.setFeature("http://apache.org/xml/features/nonvalidating/load-external-dtd", false);
            factory.setFeature("http://xml.org/sax/features/external-general-entities", false);
            factory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
            factory.setAttribute(XMLConstants.ACCESS_EXTERNAL_DTD, "");
            DocumentBuilder builder = factory.newDocumentBuilder();
            builder.setErrorHandler(new StrictErrorHandler());
            return builder;
        } catch (ParserConfigurationException ex) {
            throw new IllegalStateException("XML parser unavailable", ex);
        }
    }

    private static final class StrictErrorHandler implements ErrorHandler {

        @Override
        public void warning(SAXParseException exception) {
            // warnings do not affect the parsed tree
        }

        @Override
        public void error(SAXParseException exception) throws SAXException {
            throw exception;
        }

        @Override
        public void fatalError(SAXParseException exception) throws SAXException {
            throw exception;
        }
    }

    private record DoctypeHolder(String publicId, String systemId, String internalSubset) {

        private static final String KEY = "svgtranslate.doctype";

        static DoctypeHolder of(DocumentType doctype) {
            return new DoctypeHolder(doctype.getPublicId(), doctype.getSystemId(), doctype.getInternalSubset());
        }

        String declaration(String rootName) {
            StringBuilder builder = new StringBuilder("<!DOCTYPE ").append(rootName);
            if (publicId != null) {
                builder.append(" PUBLIC \"").append(publicId).append('"');
                if (systemId != null) {
                    builder.append(" \"").append(systemId).append('"');
                }
            } else if (systemId != null) {
                builder.append(" SYSTEM \"").append(systemId).append('"');
            }
            if (internalSubset != null && !internalSubset.isBlank()) {
                builder.append(" [").append(internalSubset).append(']');
            }
            return builder.append(">\n").toString();
        }
    }
}
