package ai.svgtranslate.prepare;

import static ai.svgtranslate.svg.SvgDocuments.attribute;
import static ai.svgtranslate.svg.SvgDocuments.childElements;
import static ai.svgtranslate.svg.SvgDocuments.descendants;

import ai.svgtranslate.svg.SvgDocuments;
import ai.svgtranslate.svg.SvgNames;
import ai.svgtranslate.text.LanguageTags;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;
import javax.xml.XMLConstants;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

/**
 * Validates an SVG document and rewrites it into the canonical translatable shape: every
 * {@code <text>} sits in a {@code <switch>}, holds only {@code <tspan>} children, and every
 * translatable node carries a unique id.
 *
 * <p>The input document is never modified. Passes run on a copy which is returned only when all
 * of them succeed; the first violation aborts with an {@link SvgStructureException}.
 */
public class TranslationPreparer {

    private static final Logger LOGGER = LoggerFactory.getLogger(TranslationPreparer.class);

    private static final Pattern ENTITY_NAMESPACE = Pattern.compile("^(&[^;]+;)+$");
    private static final Pattern SIMPLE_CSS = Pattern.compile("^([^{]+\\{[^}]*\\})*[^{]+$");
    private static final Pattern CSS_DECLARATION_BLOCK = Pattern.compile("\\{[^}]*\\}");
    private static final Pattern DOLLAR_PLACEHOLDER = Pattern.compile("\\$[0-9]+");
    private static final Pattern NUMERIC_ID = Pattern.compile("^[0-9]+$");

    public Document prepare(Document source) {
        Objects.requireNonNull(source, "source");
        Document document = SvgDocuments.copy(source);
        Element root = document.getDocumentElement();
        if (root == null) {
            throw new SvgStructureException(StructureError.NO_DOC_ELEMENT);
        }
        ensureSvgNamespace(document, root);

        if (descendants(document, SvgNames.TEXT).isEmpty()) {
            LOGGER.warn("Document has nothing to translate");
            return document;
        }

        rejectTextReferences(document);
        checkStyleSheets(document);
        checkSpansAreLeaves(document);
        wrapRawText(document);
        pruneEmptyNodes(document);
        assignIds(document);
        checkTextContent(document);
        canonicalizeLanguages(document);
        wrapInSwitches(document);
        hoistStyles(document);
        validateSwitchChildren(document);
        expandLanguageLists(document);
        checkDuplicateLanguages(document);
        for (Element switchElement : descendants(document, SvgNames.SWITCH)) {
            SwitchOrdering.reorder(switchElement);
        }
        return document;
    }

    private void ensureSvgNamespace(Document document, Element root) {
        String namespace = root.getNamespaceURI();
        if (namespace != null && !ENTITY_NAMESPACE.matcher(namespace).matches()) {
            return;
        }
        LOGGER.debug("Declaring default SVG namespace (found {})", namespace);
        moveToSvgNamespace(document, root, namespace);
        document.getDocumentElement()
                .setAttributeNS(XMLConstants.XMLNS_ATTRIBUTE_NS_URI, XMLConstants.XMLNS_ATTRIBUTE, SvgNames.SVG_NAMESPACE);
    }

    private void moveToSvgNamespace(Document document, Element element, String namespace) {
        Element target = element;
        if (Objects.equals(element.getNamespaceURI(), namespace)) {
            String localName = element.getLocalName() == null ? element.getNodeName() : element.getLocalName();
            target = (Element) document.renameNode(element, SvgNames.SVG_NAMESPACE, localName);
        }
        for (Element child : childElements(target)) {
            moveToSvgNamespace(document, child, namespace);
        }
    }

    private void rejectTextReferences(Document document) {
        List<Element> references = descendants(document, SvgNames.TREF);
        if (!references.isEmpty()) {
            throw new SvgStructureException(StructureError.CONTAINS_TREF, references.get(0));
        }
    }

    // Translation clones and renames ids, so id selectors cannot be kept stable.
    private void checkStyleSheets(Document document) {
        for (Element style : descendants(document, SvgNames.STYLE)) {
            String css = style.getTextContent();
            if (css == null || css.indexOf('#') < 0) {
                continue;
            }
            if (!SIMPLE_CSS.matcher(css).matches()) {
                throw new SvgStructureException(StructureError.CSS_TOO_COMPLEX, style);
            }
            for (String selector : CSS_DECLARATION_BLOCK.split(css)) {
                if (selector.indexOf('#') >= 0) {
                    throw new SvgStructureException(StructureError.CSS_HAS_IDS, style);
                }
            }
        }
    }

    private void checkSpansAreLeaves(Document document) {
        for (Element span : descendants(document, SvgNames.TSPAN)) {
            if (SvgDocuments.hasElementChildren(span)) {
                String id = attribute(span, SvgNames.ATTR_ID);
                throw new SvgStructureException(StructureError.NESTED_TSPANS_NOT_SUPPORTED, span,
                        List.of(id == null ? "" : id));
            }
        }
    }

    private void wrapRawText(Document document) {
        for (Element text : descendants(document, SvgNames.TEXT)) {
            text.normalize();
            for (Node child : snapshot(text.getChildNodes())) {
                if (SvgDocuments.isTextNode(child) && !child.getNodeValue().isBlank()) {
                    Element span = SvgDocuments.createElement(document, SvgNames.TSPAN);
                    span.setTextContent(child.getNodeValue());
                    text.replaceChild(span, child);
                }
            }
            for (Element child : childElements(text)) {
                if (!SvgDocuments.is(child, SvgNames.TSPAN)) {
                    throw new SvgStructureException(StructureError.NON_TSPAN_INSIDE_TEXT, child,
                            List.of(child.getNodeName()));
                }
            }
        }
    }

    private void pruneEmptyNodes(Document document) {
        for (Element span : descendants(document, SvgNames.TSPAN)) {
            removeIfEmpty(span);
        }
        for (Element text : descendants(document, SvgNames.TEXT)) {
            removeIfEmpty(text);
        }
    }

    private void removeIfEmpty(Element element) {
        if (SvgDocuments.hasElementChildren(element) || !element.getTextContent().isBlank()) {
            return;
        }
        Node parent = element.getParentNode();
        if (parent != null) {
            parent.removeChild(element);
        }
    }

    private void assignIds(Document document) {
        IdAllocator allocator = new IdAllocator();
        NodeList all = document.getElementsByTagName("*");
        for (int i = 0; i < all.getLength(); i++) {
            String id = attribute((Element) all.item(i), SvgNames.ATTR_ID);
            if (id != null) {
                allocator.observe(id.strip());
            }
        }

        List<Element> nodes = translatableNodes(document);
        Set<String> seen = new HashSet<>();
        for (Element node : nodes) {
            String id = attribute(node, SvgNames.ATTR_ID);
            if (id == null) {
                continue;
            }
            String trimmed = id.strip();
            if (trimmed.indexOf('|') >= 0 || trimmed.indexOf('/') >= 0) {
                throw new SvgStructureException(StructureError.INVALID_NODE_ID, node, List.of(trimmed));
            }
            if (trimmed.isEmpty() || NUMERIC_ID.matcher(trimmed).matches()) {
                // numeric ids are reserved for allocation
                node.removeAttribute(SvgNames.ATTR_ID);
            } else if (!seen.add(trimmed)) {
                LOGGER.debug("Reallocating duplicate id {}", trimmed);
                node.removeAttribute(SvgNames.ATTR_ID);
            } else if (!trimmed.equals(id)) {
                node.setAttribute(SvgNames.ATTR_ID, trimmed);
            }
        }
        for (Element node : nodes) {
            if (!node.hasAttribute(SvgNames.ATTR_ID)) {
                node.setAttribute(SvgNames.ATTR_ID, allocator.next());
            }
        }
    }

    private List<Element> translatableNodes(Document document) {
        List<Element> nodes = new ArrayList<>(descendants(document, SvgNames.TSPAN));
        nodes.addAll(descendants(document, SvgNames.TEXT));
        return nodes;
    }

    private void checkTextContent(Document document) {
        for (Element text : descendants(document, SvgNames.TEXT)) {
            String content = text.getTextContent();
            if (DOLLAR_PLACEHOLDER.matcher(content).find()) {
                throw new SvgStructureException(StructureError.TEXT_CONTAINS_DOLLAR, text, List.of(content));
            }
        }
    }

    private void canonicalizeLanguages(Document document) {
        for (Element text : descendants(document, SvgNames.TEXT)) {
            String lang = attribute(text, SvgNames.ATTR_SYSTEM_LANGUAGE);
            if (lang != null && !lang.isBlank()) {
                text.setAttribute(SvgNames.ATTR_SYSTEM_LANGUAGE, LanguageTags.normalizeList(lang));
            }
        }
    }

    private void wrapInSwitches(Document document) {
        for (Element text : descendants(document, SvgNames.TEXT)) {
            Node parent = text.getParentNode();
            if (parent == null || parent.getNodeType() != Node.ELEMENT_NODE) {
                throw new SvgStructureException(StructureError.NO_PARENT_FOR_TEXT, text);
            }
            if (SvgDocuments.is(parent, SvgNames.SWITCH)) {
                continue;
            }
            Element switchElement = SvgDocuments.createElement(document, SvgNames.SWITCH);
            parent.insertBefore(switchElement, text);
            switchElement.appendChild(text);
        }
    }

    private void hoistStyles(Document document) {
        for (Element text : descendants(document, SvgNames.TEXT)) {
            String style = attribute(text, SvgNames.ATTR_STYLE);
            if (style == null || style.isEmpty()) {
                continue;
            }
            ((Element) text.getParentNode()).setAttribute(SvgNames.ATTR_STYLE, style);
            text.removeAttribute(SvgNames.ATTR_STYLE);
        }
    }

    private void validateSwitchChildren(Document document) {
        for (Element switchElement : descendants(document, SvgNames.SWITCH)) {
            for (Node child = switchElement.getFirstChild(); child != null; child = child.getNextSibling()) {
                if (child.getNodeType() == Node.ELEMENT_NODE) {
                    if (!SvgDocuments.is(child, SvgNames.TEXT)) {
                        throw new SvgStructureException(StructureError.SWITCH_CHILD_NOT_TEXT, (Element) child,
                                List.of(child.getNodeName()));
                    }
                } else if (SvgDocuments.isTextNode(child) && !child.getNodeValue().isBlank()) {
                    throw new SvgStructureException(StructureError.SWITCH_TEXT_CONTENT_OUTSIDE_TEXT, switchElement,
                            List.of(child.getNodeValue().strip()));
                }
            }
        }
    }

    private void expandLanguageLists(Document document) {
        UniqueIdGenerator ids = UniqueIdGenerator.forDocument(document);
        for (Element switchElement : descendants(document, SvgNames.SWITCH)) {
            for (Element text : childElements(switchElement, SvgNames.TEXT)) {
                String lang = attribute(text, SvgNames.ATTR_SYSTEM_LANGUAGE);
                if (lang == null || lang.indexOf(',') < 0) {
                    continue;
                }
                Set<String> tags = new LinkedHashSet<>();
                for (String tag : LanguageTags.split(lang)) {
                    if (!tags.add(tag)) {
                        throw new SvgStructureException(StructureError.MULTIPLE_LANG_IN_TEXT, text, List.of(tag));
                    }
                }
                if (tags.size() == 1) {
                    text.setAttribute(SvgNames.ATTR_SYSTEM_LANGUAGE, tags.iterator().next());
                    continue;
                }
                for (String tag : tags) {
                    Element clone = (Element) text.cloneNode(true);
                    clone.setAttribute(SvgNames.ATTR_SYSTEM_LANGUAGE, tag);
                    clone.setAttribute(SvgNames.ATTR_ID, ids.generate(clone.getAttribute(SvgNames.ATTR_ID), tag));
                    for (Element span : childElements(clone, SvgNames.TSPAN)) {
                        span.setAttribute(SvgNames.ATTR_ID, ids.generate(span.getAttribute(SvgNames.ATTR_ID), tag));
                    }
                    switchElement.appendChild(clone);
                }
                switchElement.removeChild(text);
            }
        }
    }

    private void checkDuplicateLanguages(Document document) {
        for (Element switchElement : descendants(document, SvgNames.SWITCH)) {
            Set<String> tags = new HashSet<>();
            for (Element text : childElements(switchElement, SvgNames.TEXT)) {
                String tag = SwitchOrdering.tag(text);
                if (!tags.add(tag)) {
                    throw new SvgStructureException(StructureError.MULTIPLE_TEXT_SAME_LANG, switchElement, List.of(tag));
                }
            }
        }
    }

    private static List<Node> snapshot(NodeList nodes) {
        List<Node> result = new ArrayList<>(nodes.getLength());
        for (int i = 0; i < nodes.getLength(); i++) {
            result.add(nodes.item(i));
        }
        return result;
    }
}
