package ai.svgtranslate.prepare;

import ai.svgtranslate.svg.SvgDocuments;
import ai.svgtranslate.svg.SvgNames;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.w3c.dom.Element;

/**
 * Deterministic order of the {@code <text>} children of a switch: tagged variants sorted by the
 * number of their reserved id and then by tag, the fallback always last.
 */
public final class SwitchOrdering {

    static final long MISSING_NUMBER = 1_000_000_000L;

    private static final Pattern RESERVED_NUMBER = Pattern.compile(IdAllocator.RESERVED_PREFIX + "(\\d+)");

    private static final Comparator<Element> ORDER = Comparator
            .comparingInt(SwitchOrdering::fallbackRank)
            .thenComparingLong(SwitchOrdering::idNumber)
            .thenComparing(SwitchOrdering::tag);

    private SwitchOrdering() {
    }

    public static void reorder(Element switchElement) {
        List<Element> texts = SvgDocuments.childElements(switchElement, SvgNames.TEXT);
        if (texts.size() < 2) {
            return;
        }
        List<Element> sorted = new ArrayList<>(texts);
        sorted.sort(ORDER);
        for (Element text : sorted) {
            switchElement.removeChild(text);
        }
        for (Element text : sorted) {
            switchElement.appendChild(text);
        }
    }

    public static String tag(Element text) {
        String lang = SvgDocuments.attribute(text, SvgNames.ATTR_SYSTEM_LANGUAGE);
        return lang == null || lang.isEmpty() ? "fallback" : lang;
    }

    public static boolean isFallback(Element text) {
        String lang = SvgDocuments.attribute(text, SvgNames.ATTR_SYSTEM_LANGUAGE);
        return lang == null || lang.isEmpty();
    }

    private static int fallbackRank(Element text) {
        return isFallback(text) ? 1 : 0;
    }

    private static long idNumber(Element text) {
        String id = SvgDocuments.attribute(text, SvgNames.ATTR_ID);
        if (id == null) {
            return MISSING_NUMBER;
        }
        Matcher matcher = RESERVED_NUMBER.matcher(id);
        if (!matcher.find()) {
            return MISSING_NUMBER;
        }
        try {
            return Long.parseLong(matcher.group(1));
        } catch (NumberFormatException ex) {
            return MISSING_NUMBER;
        }
    }
}
