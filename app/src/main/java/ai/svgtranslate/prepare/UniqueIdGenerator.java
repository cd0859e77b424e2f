package ai.svgtranslate.prepare;

import ai.svgtranslate.svg.SvgDocuments;
import java.util.HashSet;
import java.util.Objects;
import java.util.Set;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;

/**
 * Derives per-language ids of the form {@code <base>-<lang>} that do not collide with any id in use.
 */
public final class UniqueIdGenerator {

    private final Set<String> idsInUse;

    public UniqueIdGenerator(Set<String> idsInUse) {
        this.idsInUse = new HashSet<>(Objects.requireNonNull(idsInUse, "idsInUse"));
    }

    public static UniqueIdGenerator forDocument(Document document) {
        Set<String> ids = new HashSet<>();
        collectIds(document.getDocumentElement(), ids);
        return new UniqueIdGenerator(ids);
    }

    /**
     * Returns {@code base-lang}, or {@code base-lang-2}, {@code base-lang-3}, ... on collision,
     * and reserves the result.
     */
    public String generate(String base, String lang) {
        String candidate = (base == null ? "" : base) + "-" + lang;
        String unique = candidate;
        int counter = 2;
        while (idsInUse.contains(unique)) {
            unique = candidate + "-" + counter;
            counter++;
        }
        idsInUse.add(unique);
        return unique;
    }

    public boolean inUse(String id) {
        return idsInUse.contains(id);
    }

    private static void collectIds(Element element, Set<String> ids) {
        if (element == null) {
            return;
        }
        String id = SvgDocuments.attribute(element, "id");
        if (id != null) {
            ids.add(id);
        }
        for (Node child = element.getFirstChild(); child != null; child = child.getNextSibling()) {
            if (child.getNodeType() == Node.ELEMENT_NODE) {
                collectIds((Element) child, ids);
            }
        }
    }
}
