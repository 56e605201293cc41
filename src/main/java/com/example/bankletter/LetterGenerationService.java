// File: src/main/java/com/example/bankletter/LetterGenerationService.java
package com.example.bankletter;

import lombok.extern.slf4j.Slf4j;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.springframework.stereotype.Service;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.Map;

/**
 * 单个协议 → 信函。已存在的输出目录、信函文件与 PDF 一律跳过，不覆盖。
 */
@Slf4j
@Service
public class LetterGenerationService {

    private final AgreementTextSource textSource;
    private final AgreementFieldExtractor extractor;

    public LetterGenerationService(AgreementTextSource textSource, AgreementFieldExtractor extractor) {
        this.textSource = textSource;
        this.extractor = extractor;
    }

    /**
     * Generates the letter for one agreement PDF next to it: creates the output folder,
     * writes the filled template into it and moves the PDF there.
     */
    public LetterOutcome process(Path pdf, Path template) throws IOException {
        String name = pdf.getFileName().toString();
        log.info("processing {}", name);

        AgreementFields fields = extractor.extract(textSource.read(pdf));
        if (fields.getPurpose() == null) {
            log.warn("{}: CASE_DESCR not found, placeholder will be left empty", name);
        }
        List<String> missing = fields.missingRequired();
        if (!missing.isEmpty()) {
            log.warn("{}: missing {}, skipped", name, missing);
            return LetterOutcome.missingFields(name, missing);
        }

        LetterValues values = LetterValues.from(fields);
        String folderName = values.folderName();
        Path outDir = pdf.toAbsolutePath().getParent().resolve(folderName);
        if (Files.exists(outDir)) {
            log.warn("{}: folder already exists: {}, skipped", name, folderName);
            return LetterOutcome.folderExists(name, folderName);
        }
        // 先在内存中生成信函，模板出错时不留下空文件夹
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (InputStream in = Files.newInputStream(template)) {
            fill(in, values.placeholders(), out);
        }
        Files.createDirectories(outDir);

        boolean letterWritten = false;
        Path letter = outDir.resolve(values.letterFileName());
        if (Files.exists(letter)) {
            log.info("{}: letter already exists: {}, skipped", name, letter.getFileName());
        } else {
            Files.write(letter, out.toByteArray(), StandardOpenOption.CREATE_NEW);
            letterWritten = true;
            log.info("{}: letter generated: {}", name, letter.getFileName());
        }

        boolean pdfMoved = false;
        Path movedPdf = outDir.resolve(name);
        if (Files.exists(movedPdf)) {
            log.info("{}: PDF already in place, not moved", name);
        } else {
            Files.move(pdf, movedPdf);
            pdfMoved = true;
            log.info("{}: PDF moved to {}", name, folderName);
        }
        return LetterOutcome.generated(name, folderName, letterWritten, pdfMoved);
    }

    /** 内存版本：PDF 字节 + 模板流 → 信函字节；缺少必需字段时抛出 {@link MissingFieldsException} */
    public GeneratedLetter render(byte[] pdf, InputStream template) throws IOException {
        AgreementFields fields = extractor.extract(textSource.read(pdf));
        LetterValues values = LetterValues.from(fields);
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        fill(template, values.placeholders(), out);
        return new GeneratedLetter(values.letterFileName(), out.toByteArray());
    }

    private static void fill(InputStream template, Map<String, String> placeholders, OutputStream out) throws IOException {
        try (XWPFDocument doc = new XWPFDocument(template)) {
            int replaced = TemplateFiller.replaceAll(doc, placeholders);
            log.debug("{} placeholder(s) replaced", replaced);
            doc.write(out);
        }
    }
}
