// File: src/main/java/com/example/bankletter/PdfAgreementTextSource.java
package com.example.bankletter;

import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.text.PDFTextStripper;
import org.apache.pdfbox.text.PDFTextStripperByArea;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.awt.geom.Rectangle2D;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * PDFBox 实现。案号只在首页顶部一条区域内查找（默认 100pt 高），比全页搜索更可靠；
 * 其余字段使用首页、末页与全文文本。
 */
@Slf4j
@Component
public class PdfAgreementTextSource implements AgreementTextSource {

    private static final String CASE_NUMBER_REGION = "caseNumberArea";

    private final float caseNumberAreaHeight;

    public PdfAgreementTextSource(
            @Value("${letter.extraction.case-number-area-height:100}") float caseNumberAreaHeight) {
        this.caseNumberAreaHeight = caseNumberAreaHeight;
    }

    @Override
    public AgreementText read(Path pdf) throws IOException {
        try (PDDocument doc = Loader.loadPDF(pdf.toFile())) {
            return read(doc);
        }
    }

    @Override
    public AgreementText read(byte[] pdf) throws IOException {
        try (PDDocument doc = Loader.loadPDF(pdf)) {
            return read(doc);
        }
    }

    private AgreementText read(PDDocument doc) throws IOException {
        int pages = doc.getNumberOfPages();
        if (pages == 0) {
            log.warn("PDF has no pages");
            return AgreementText.empty();
        }

        List<String> pageTexts = new ArrayList<>(pages);
        for (int i = 1; i <= pages; i++) pageTexts.add(pageText(doc, i));

        String area = areaText(doc.getPage(0));
        log.debug("pages={}, caseNumberArea='{}'", pages, area.strip());
        return new AgreementText(area, pageTexts.get(0), pageTexts.get(pages - 1), String.join("\n", pageTexts));
    }

    private static String pageText(PDDocument doc, int page) throws IOException {
        PDFTextStripper stripper = new PDFTextStripper();
        stripper.setStartPage(page);
        stripper.setEndPage(page);
        return stripper.getText(doc);
    }

    private String areaText(PDPage page) throws IOException {
        PDRectangle box = page.getCropBox();
        float height = Math.min(caseNumberAreaHeight, box.getHeight());
        PDFTextStripperByArea stripper = new PDFTextStripperByArea();
        stripper.addRegion(CASE_NUMBER_REGION, new Rectangle2D.Float(0, 0, box.getWidth(), height));
        stripper.extractRegions(page);
        return stripper.getTextForRegion(CASE_NUMBER_REGION);
    }
}
