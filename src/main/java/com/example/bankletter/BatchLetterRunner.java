// File: src/main/java/com/example/bankletter/BatchLetterRunner.java
package com.example.bankletter;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * 目录批处理：逐个处理 {@code Grant Agreement*.pdf}，单个文件失败不影响其它文件，不重试。
 * 启动时运行需设置 {@code letter.batch.enabled=true}。
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "letter.batch", name = "enabled", havingValue = "true")
public class BatchLetterRunner implements CommandLineRunner {

    static final Pattern GRANT_AGREEMENT = Pattern.compile("Grant Agreement.*\\.pdf", Pattern.CASE_INSENSITIVE);

    private final LetterGenerationService letterService;
    private final String directory;
    private final String templatePath;

    public BatchLetterRunner(LetterGenerationService letterService,
                             @Value("${letter.batch.directory:.}") String directory,
                             @Value("${letter.template-path}") String templatePath) {
        this.letterService = letterService;
        this.directory = directory;
        this.templatePath = templatePath;
    }

    @Override
    public void run(String... args) throws IOException {
        Path dir = Paths.get(directory).toAbsolutePath();
        // 相对路径的模板与 PDF 放在同一目录
        run(dir, dir.resolve(templatePath));
    }

    public BatchReport run(Path dir, Path template) throws IOException {
        if (!Files.isRegularFile(template)) {
            log.error("template not found: {}", template);
            return BatchReport.missingTemplate();
        }

        List<Path> files;
        try (Stream<Path> s = Files.list(dir)) {
            files = s.filter(Files::isRegularFile)
                    .filter(p -> GRANT_AGREEMENT.matcher(p.getFileName().toString()).matches())
                    .sorted()
                    .collect(Collectors.toList());
        }
        if (files.isEmpty()) {
            log.info("no files matching 'Grant Agreement*.pdf' in {}", dir);
            return BatchReport.of(List.of());
        }

        log.info("found {} PDF(s) in {}", files.size(), dir);
        List<LetterOutcome> outcomes = new ArrayList<>(files.size());
        for (Path pdf : files) {
            try {
                outcomes.add(letterService.process(pdf, template));
            } catch (Exception e) {
                log.error("{}: processing failed, moving on to the next file", pdf.getFileName(), e);
                outcomes.add(LetterOutcome.failed(pdf.getFileName().toString(), e));
            }
        }

        BatchReport report = BatchReport.of(outcomes);
        log.info("batch finished: {}", report.summary());
        for (LetterOutcome o : report.problems()) log.warn("  {}", o);
        return report;
    }
}
