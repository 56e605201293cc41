package com.example.bankletter;

import org.apache.poi.xwpf.usermodel.BreakType;
import org.apache.poi.xwpf.usermodel.UnderlinePatterns;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.apache.poi.xwpf.usermodel.XWPFRun;
import org.apache.xmlbeans.XmlCursor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.STBrType;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class RunSpanReplacerTest {

    private XWPFDocument doc;

    @BeforeEach
    void setUp() {
        doc = new XWPFDocument();
    }

    @AfterEach
    void tearDown() throws IOException {
        doc.close();
    }

    @Test
    @DisplayName("token inside one run: only that run changes")
    void singleRunContainment() {
        XWPFParagraph p = paragraph("Dear ", "Mr {{NAME}},", " thanks");
        p.getRuns().get(0).setItalic(true);
        p.getRuns().get(2).setBold(true);
        List<String> before = runXml(p);

        boolean replaced = RunSpanReplacer.replaceOnce(p, Map.of("{{NAME}}", "Smith"));

        assertThat(replaced).isTrue();
        assertThat(runTexts(p)).containsExactly("Dear ", "Mr Smith,", " thanks");
        List<String> after = runXml(p);
        assertThat(after.get(0)).isEqualTo(before.get(0));
        assertThat(after.get(2)).isEqualTo(before.get(2));
    }

    @Test
    @DisplayName("token split across runs: concatenation fixed, run count unchanged")
    void crossRunSpan() {
        XWPFParagraph p = paragraph("Hello {{", "NAME", "}} world");

        boolean replaced = RunSpanReplacer.replaceOnce(p, Map.of("{{NAME}}", "Olena"));

        assertThat(replaced).isTrue();
        assertThat(RunSpanReplacer.paragraphText(p)).isEqualTo("Hello Olena world");
        assertThat(p.getRuns()).hasSize(3);
        assertThat(runTexts(p)).containsExactly("Hello Olena", "", " world");
    }

    @Test
    @DisplayName("token split char by char over many runs")
    void tokenSplitIntoSingleCharacters() {
        XWPFParagraph p = paragraph("№", "{", "{", "C", "ASE_NUM", "}", "}", " від");

        RunSpanReplacer.replaceOnce(p, Map.of("{{CASE_NUM}}", "12345"));

        assertThat(RunSpanReplacer.paragraphText(p)).isEqualTo("№12345 від");
        assertThat(runTexts(p)).containsExactly("№", "12345", "", "", "", "", "", " від");
    }

    @Test
    @DisplayName("run properties of every run survive a cross-run replacement")
    void formattingPreserved() {
        XWPFParagraph p = paragraph("a{{", "X", "}}b");
        p.getRuns().get(0).setBold(true);
        p.getRuns().get(1).setItalic(true);
        p.getRuns().get(2).setUnderline(UnderlinePatterns.SINGLE);
        List<String> rPrBefore = rPrXml(p);

        RunSpanReplacer.replaceOnce(p, Map.of("{{X}}", "value"));

        assertThat(rPrXml(p)).isEqualTo(rPrBefore);
        assertThat(p.getRuns().get(0).isBold()).isTrue();
        assertThat(runTexts(p)).containsExactly("avalue", "", "b");
    }

    @Test
    @DisplayName("fixed point: two tokens need exactly two successful calls")
    void fixedPointTermination() {
        XWPFParagraph p = paragraph("{{A}} and ", "{{B}}");
        Map<String, String> tokens = ordered("{{A}}", "1", "{{B}}", "2");

        assertThat(RunSpanReplacer.replaceOnce(p, tokens)).isTrue();
        assertThat(RunSpanReplacer.replaceOnce(p, tokens)).isTrue();
        assertThat(RunSpanReplacer.replaceOnce(p, tokens)).isFalse();
        assertThat(RunSpanReplacer.paragraphText(p)).isEqualTo("1 and 2");
    }

    @Test
    @DisplayName("no token: returns false and nothing is written")
    void noOccurrence() {
        XWPFParagraph p = paragraph("plain ", "text {", "{NAME}");
        p.getRuns().get(1).setBold(true);
        List<String> before = runXml(p);

        boolean replaced = RunSpanReplacer.replaceOnce(p, Map.of("{{NAME}}", "x", "{{DATE}}", "y"));

        assertThat(replaced).isFalse();
        assertThat(runXml(p)).isEqualTo(before);
    }

    @Test
    @DisplayName("earliest occurrence wins regardless of map order")
    void earliestOffsetWins() {
        XWPFParagraph p = paragraph("{{A}}{{B}}");

        RunSpanReplacer.replaceOnce(p, ordered("{{B}}", "2", "{{A}}", "1"));

        assertThat(RunSpanReplacer.paragraphText(p)).isEqualTo("1{{B}}");
    }

    @Test
    @DisplayName("same start offset: first key in map order wins")
    void tieBrokenByMapOrder() {
        XWPFParagraph first = paragraph("{{X}}Y");
        XWPFParagraph second = paragraph("{{X}}Y");

        RunSpanReplacer.replaceOnce(first, ordered("{{X}}Y", "long", "{{X}}", "short"));
        RunSpanReplacer.replaceOnce(second, ordered("{{X}}", "short", "{{X}}Y", "long"));

        assertThat(RunSpanReplacer.paragraphText(first)).isEqualTo("long");
        assertThat(RunSpanReplacer.paragraphText(second)).isEqualTo("shortY");
    }

    @Test
    @DisplayName("tabs around a token are kept as w:tab")
    void tabsPreserved() {
        XWPFParagraph p = doc.createParagraph();
        XWPFRun r = p.createRun();
        r.setText("Name:");
        r.addTab();
        r.setText("{{NAME}}");

        RunSpanReplacer.replaceOnce(p, Map.of("{{NAME}}", "Bob"));

        assertThat(RunSpanReplacer.paragraphText(p)).isEqualTo("Name:\tBob");
        assertThat(r.getCTR().sizeOfTabArray()).isEqualTo(1);
    }

    @Test
    @DisplayName("page break in a rewritten run keeps its type")
    void pageBreakPreserved() {
        XWPFParagraph p = doc.createParagraph();
        XWPFRun r = p.createRun();
        r.setText("{{DATE}}");
        r.addBreak(BreakType.PAGE);

        RunSpanReplacer.replaceOnce(p, Map.of("{{DATE}}", "d"));

        assertThat(RunSpanReplacer.paragraphText(p)).isEqualTo("d\n");
        assertThat(r.getCTR().sizeOfBrArray()).isEqualTo(1);
        assertThat(r.getCTR().getBrArray(0).getType()).isEqualTo(STBrType.PAGE);
        assertThat(childNames(r)).containsExactly("t", "br");
    }

    @Test
    @DisplayName("non-text child of a rewritten run stays in place")
    void nonTextChildKeepsOrder() {
        XWPFParagraph p = doc.createParagraph();
        XWPFRun r = p.createRun();
        r.setText("A");
        r.getCTR().addNewDrawing();
        r.setText("{{X}}");

        RunSpanReplacer.replaceOnce(p, Map.of("{{X}}", "v"));

        assertThat(childNames(r)).containsExactly("t", "drawing", "t");
        assertThat(r.getCTR().getTArray(0).getStringValue()).isEqualTo("A");
        assertThat(r.getCTR().getTArray(1).getStringValue()).isEqualTo("v");
        assertThat(r.getCTR().sizeOfDrawingArray()).isEqualTo(1);
    }

    @Test
    @DisplayName("value containing another token is expanded on the next pass")
    void valueReExpanded() {
        XWPFParagraph p = paragraph("[", "{{A}}", "]");

        int count = RunSpanReplacer.replaceAll(p, ordered("{{A}}", "{{B}}", "{{B}}", "x"));

        assertThat(count).isEqualTo(2);
        assertThat(RunSpanReplacer.paragraphText(p)).isEqualTo("[x]");
    }

    @Test
    @DisplayName("empty replacement value removes the token")
    void emptyValue() {
        XWPFParagraph p = paragraph("Purpose: {{CASE_DESCR}}.");

        RunSpanReplacer.replaceOnce(p, Map.of("{{CASE_DESCR}}", ""));

        assertThat(RunSpanReplacer.paragraphText(p)).isEqualTo("Purpose: .");
    }

    @Test
    @DisplayName("empty key is ignored")
    void emptyKeyIgnored() {
        XWPFParagraph p = paragraph("text");

        assertThat(RunSpanReplacer.replaceOnce(p, Map.of("", "x"))).isFalse();
        assertThat(RunSpanReplacer.paragraphText(p)).isEqualTo("text");
    }

    @Test
    @DisplayName("replaceAll counts replacements of repeated tokens")
    void replaceAllCounts() {
        XWPFParagraph p = paragraph("{{DATE}} / ", "{{DATE}} / {{DATE_MM_ONLY}}");

        int count = RunSpanReplacer.replaceAll(p, ordered("{{DATE}}", "d", "{{DATE_MM_ONLY}}", "03"));

        assertThat(count).isEqualTo(3);
        assertThat(RunSpanReplacer.paragraphText(p)).isEqualTo("d / d / 03");
    }

    @Test
    @DisplayName("paragraph without runs is left alone")
    void paragraphWithoutRuns() {
        XWPFParagraph p = doc.createParagraph();

        assertThat(RunSpanReplacer.replaceOnce(p, Map.of("{{A}}", "1"))).isFalse();
        assertThat(p.getRuns()).isEmpty();
    }

    private XWPFParagraph paragraph(String... fragments) {
        XWPFParagraph p = doc.createParagraph();
        for (String f : fragments) p.createRun().setText(f);
        return p;
    }

    private static Map<String, String> ordered(String... kv) {
        Map<String, String> m = new LinkedHashMap<>();
        for (int i = 0; i < kv.length; i += 2) m.put(kv[i], kv[i + 1]);
        return m;
    }

    private static List<String> runTexts(XWPFParagraph p) {
        List<String> out = new ArrayList<>();
        for (XWPFRun r : p.getRuns()) out.add(RunText.read(r));
        return out;
    }

    private static List<String> runXml(XWPFParagraph p) {
        List<String> out = new ArrayList<>();
        for (XWPFRun r : p.getRuns()) out.add(r.getCTR().xmlText());
        return out;
    }

    private static List<String> childNames(XWPFRun r) {
        List<String> out = new ArrayList<>();
        try (XmlCursor c = r.getCTR().newCursor()) {
            if (c.toFirstChild()) {
                do {
                    if (!"rPr".equals(c.getName().getLocalPart())) out.add(c.getName().getLocalPart());
                } while (c.toNextSibling());
            }
        }
        return out;
    }

    private static List<String> rPrXml(XWPFParagraph p) {
        List<String> out = new ArrayList<>();
        for (XWPFRun r : p.getRuns()) out.add(r.getCTR().isSetRPr() ? r.getCTR().getRPr().xmlText() : "");
        return out;
    }
}
