package ai.svgtranslate.prepare;

import static ai.svgtranslate.svg.SvgTestSupport.parseSvg;
import static ai.svgtranslate.svg.SvgTestSupport.spans;
import static ai.svgtranslate.svg.SvgTestSupport.switches;
import static ai.svgtranslate.svg.SvgTestSupport.tags;
import static ai.svgtranslate.svg.SvgTestSupport.texts;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

import ai.svgtranslate.svg.SvgDocuments;
import ai.svgtranslate.svg.SvgNames;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

class TranslationPreparerTest {

    private final TranslationPreparer preparer = new TranslationPreparer();

    @Test
    void wrapsLooseTextInSwitchAndSpan() {
        Document prepared = preparer.prepare(parseSvg("<text>lang none</text>"));

        List<Element> switches = switches(prepared);
        assertThat(switches).hasSize(1);
        Element text = texts(switches.get(0)).get(0);
        assertThat(text.getAttribute("id")).isEqualTo("trsvg2");
        assertThat(spans(text)).singleElement().satisfies(span -> {
            assertThat(span.getAttribute("id")).isEqualTo("trsvg1");
            assertThat(span.getTextContent()).isEqualTo("lang none");
        });
    }

    @Test
    void allocatesIdsBeyondLargestReservedId() {
        Document prepared = preparer.prepare(parseSvg("<rect id=\"trsvg5\"/><text>a</text>"));

        Element text = texts(switches(prepared).get(0)).get(0);
        assertThat(spans(text).get(0).getAttribute("id")).isEqualTo("trsvg6");
        assertThat(text.getAttribute("id")).isEqualTo("trsvg7");
    }

    @Test
    void allocatesBeyondReservedIdsLargerThanLong() {
        Document prepared = preparer.prepare(parseSvg("<text id=\"trsvg99999999999999999999\">a</text>"));

        Element text = texts(switches(prepared).get(0)).get(0);
        assertThat(text.getAttribute("id")).isEqualTo("trsvg99999999999999999999");
        assertThat(spans(text).get(0).getAttribute("id")).isEqualTo("trsvg100000000000000000000");
    }

    @Test
    void reallocatesRepeatedCustomIds() {
        Document prepared = preparer.prepare(parseSvg(
                "<text><tspan id=\"a\">x</tspan></text><text><tspan id=\"a\">y</tspan></text>"));

        List<Element> spans = SvgDocuments.descendants(prepared, SvgNames.TSPAN);
        assertThat(spans).extracting(span -> span.getAttribute("id")).containsExactly("a", "trsvg1");
    }

    @Test
    void replacesNumericIdsAndTrimsCustomOnes() {
        Document prepared = preparer.prepare(parseSvg(
                "<text id=\"12\"><tspan id=\" 7 \">a</tspan><tspan id=\" label \">b</tspan></text>"));

        Element text = texts(switches(prepared).get(0)).get(0);
        assertThat(spans(text)).extracting(span -> span.getAttribute("id")).containsExactly("trsvg1", "label");
        assertThat(text.getAttribute("id")).isEqualTo("trsvg2");
    }

    @Test
    void givesEveryTranslatableNodeAUniqueId() {
        Document prepared = preparer.prepare(parseSvg(
                "<text>a</text><g><text><tspan>b</tspan><tspan id=\"x\">c</tspan></text></g>"
                        + "<switch><text systemLanguage=\"fr\">d</text><text>e</text></switch>"));

        Set<String> ids = new HashSet<>();
        List<Element> nodes = SvgDocuments.descendants(prepared, SvgNames.TSPAN);
        nodes.addAll(SvgDocuments.descendants(prepared, SvgNames.TEXT));
        for (Element node : nodes) {
            String id = node.getAttribute("id");
            assertThat(id).isNotEmpty().doesNotContain("|", "/");
            assertThat(ids.add(id)).as("duplicate id %s", id).isTrue();
        }
    }

    @Test
    void dropsEmptySpansAndTexts() {
        Document prepared = preparer.prepare(parseSvg("<text> </text><text><tspan/><tspan>a</tspan></text>"));

        assertThat(switches(prepared)).hasSize(1);
        assertThat(spans(texts(switches(prepared).get(0)).get(0))).hasSize(1);
    }

    @Test
    void returnsDocumentWithoutTextUntouched() {
        Document source = parseSvg("<g><rect width=\"1\"/></g>");

        Document prepared = preparer.prepare(source);

        assertThat(SvgDocuments.toXml(prepared)).isEqualTo(SvgDocuments.toXml(source));
    }

    @Test
    void declaresSvgNamespaceWhenMissing() {
        Document prepared = preparer.prepare(SvgDocuments.parse("<svg><text>a</text></svg>"));

        assertThat(prepared.getDocumentElement().getNamespaceURI()).isEqualTo(SvgNames.SVG_NAMESPACE);
        assertThat(switches(prepared)).hasSize(1);
        assertThat(SvgDocuments.toXml(prepared)).contains("<svg xmlns=\"http://www.w3.org/2000/svg\">");
    }

    @Test
    void canonicalizesLanguageTags() {
        Document prepared = preparer.prepare(parseSvg(
                "<switch><text systemLanguage=\"EN_us\">a</text><text>b</text></switch>"));

        assertThat(tags(switches(prepared).get(0))).containsExactly("en-US", "fallback");
    }

    @Test
    void movesTextStyleToSwitch() {
        Document prepared = preparer.prepare(parseSvg("<text style=\"font-size:12px\">a</text>"));

        Element switchElement = switches(prepared).get(0);
        assertThat(switchElement.getAttribute("style")).isEqualTo("font-size:12px");
        assertThat(texts(switchElement).get(0).hasAttribute("style")).isFalse();
    }

    @Test
    void splitsLanguageListsIntoOneTextPerLanguage() {
        Document prepared = preparer.prepare(parseSvg("<switch>"
                + "<text id=\"t\" systemLanguage=\"en, FR\"><tspan id=\"s\">Hi</tspan></text>"
                + "<text id=\"f\"><tspan id=\"fs\">Hi</tspan></text>"
                + "</switch>"));

        Element switchElement = switches(prepared).get(0);
        assertThat(tags(switchElement)).containsExactly("en", "fr", "fallback");
        assertThat(texts(switchElement)).extracting(text -> text.getAttribute("id")).containsExactly("t-en", "t-fr", "f");
        assertThat(spans(texts(switchElement).get(1)).get(0).getAttribute("id")).isEqualTo("s-fr");
    }

    @Test
    void ordersTaggedTextsByIdNumberWithFallbackLast() {
        Document prepared = preparer.prepare(parseSvg("<switch>"
                + "<text>fallback</text><text systemLanguage=\"fr\">fr</text><text systemLanguage=\"ar\">ar</text>"
                + "</switch>"));

        assertThat(tags(switches(prepared).get(0))).containsExactly("fr", "ar", "fallback");
    }

    @Test
    void isIdempotent() {
        Document once = preparer.prepare(parseSvg("<g><text x=\"1\" style=\"fill:red\">Population 2020</text></g>"
                + "<switch><text systemLanguage=\"fr,de\">Bonjour</text><text>Hello</text></switch>"
                + "<text><tspan id=\"custom\">a</tspan> <tspan>b</tspan></text>"));

        Document twice = preparer.prepare(once);

        assertThat(SvgDocuments.toXml(twice)).isEqualTo(SvgDocuments.toXml(once));
    }

    @Test
    void leavesInputDocumentUntouched() {
        Document source = parseSvg("<text>a</text>");
        String before = SvgDocuments.toXml(source);

        preparer.prepare(source);

        assertThat(SvgDocuments.toXml(source)).isEqualTo(before);
    }

    @Test
    void leavesInputDocumentUntouchedWhenPreparationFails() {
        Document source = parseSvg("<switch><text systemLanguage=\"fr,de\">a</text>"
                + "<text systemLanguage=\"de\">b</text><text>c</text></switch>");
        String before = SvgDocuments.toXml(source);

        SvgStructureException error = catchThrowableOfType(() -> preparer.prepare(source),
                SvgStructureException.class);

        assertThat(error.error()).isEqualTo(StructureError.MULTIPLE_TEXT_SAME_LANG);
        assertThat(SvgDocuments.toXml(source)).isEqualTo(before);
    }

    @Test
    void rejectsTref() {
        assertThat(failure("<text><tref href=\"#x\"/></text>").error()).isEqualTo(StructureError.CONTAINS_TREF);
    }

    @Test
    void rejectsComplexStyleSheetsWithIds() {
        assertThat(failure("<style>#foo{fill:red} .bar{fill:blue}</style><text>a</text>").error())
                .isEqualTo(StructureError.CSS_TOO_COMPLEX);
        assertThat(failure("<style>#foo{fill:red} </style><text>a</text>").error())
                .isEqualTo(StructureError.CSS_HAS_IDS);
    }

    @Test
    void acceptsStyleSheetsWithoutIdSelectors() {
        Document prepared = preparer.prepare(parseSvg("<style>.a{fill:red} .b{fill:blue}</style><text>a</text>"));

        assertThat(switches(prepared)).hasSize(1);
    }

    @Test
    void rejectsNestedSpans() {
        assertThat(failure("<text><tspan><tspan>a</tspan></tspan></text>").error())
                .isEqualTo(StructureError.NESTED_TSPANS_NOT_SUPPORTED);
    }

    @Test
    void rejectsOtherElementsInsideText() {
        assertThat(failure("<text><a>x</a></text>").error()).isEqualTo(StructureError.NON_TSPAN_INSIDE_TEXT);
    }

    @Test
    void rejectsIdsWithSeparators() {
        SvgStructureException error = failure("<text><tspan id=\"x|\">a</tspan></text>");

        assertThat(error.error()).isEqualTo(StructureError.INVALID_NODE_ID);
        assertThat(error.getMessage()).isEqualTo("structure-error-invalid-node-id: [x|]");
    }

    @Test
    void rejectsDollarPlaceholders() {
        assertThat(failure("<text>costs $1</text>").error()).isEqualTo(StructureError.TEXT_CONTAINS_DOLLAR);
    }

    @Test
    void rejectsIllegalSwitchChildren() {
        assertThat(failure("<switch><rect/><text>a</text></switch>").error())
                .isEqualTo(StructureError.SWITCH_CHILD_NOT_TEXT);
        assertThat(failure("<switch>stray<text>a</text></switch>").error())
                .isEqualTo(StructureError.SWITCH_TEXT_CONTENT_OUTSIDE_TEXT);
    }

    @Test
    void rejectsRepeatedLanguageInOneList() {
        SvgStructureException error = failure("<switch><text systemLanguage=\"en,EN\">a</text></switch>");

        assertThat(error.error()).isEqualTo(StructureError.MULTIPLE_LANG_IN_TEXT);
        assertThat(error.extra()).containsExactly("en");
    }

    @Test
    void rejectsSiblingsWithSameLanguage() {
        SvgStructureException error = failure("<switch><text systemLanguage=\"la\">a</text>"
                + "<text systemLanguage=\"la\">b</text><text>c</text></switch>");

        assertThat(error.getMessage()).isEqualTo("structure-error-multiple-text-same-lang: [la]");
    }

    private SvgStructureException failure(String body) {
        Document source = parseSvg(body);
        return catchThrowableOfType(() -> preparer.prepare(source), SvgStructureException.class);
    }
}
