package com.example.bankletter;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api")
public class LetterController {

    static final MediaType DOCX =
            MediaType.parseMediaType("application/vnd.openxmlformats-officedocument.wordprocessingml.document");

    private final LetterGenerationService letterService;
    private final Path defaultTemplate;

    public LetterController(LetterGenerationService letterService,
                            @Value("${letter.template-path}") String templatePath) {
        this.letterService = letterService;
        this.defaultTemplate = Paths.get(templatePath);
    }

    @GetMapping("/")
    public String home() {
        return "Bank letter generator is running";
    }

    // 上传协议 PDF（可选上传模板），返回生成的信函
    @PostMapping("/letters")
    public ResponseEntity<byte[]> generate(
            @RequestParam("file") MultipartFile file,
            @RequestParam(value = "template", required = false) MultipartFile template
    ) throws IOException {
        log.info("generating letter for {}", file.getOriginalFilename());

        GeneratedLetter letter;
        if (template != null && !template.isEmpty()) {
            try (InputStream in = template.getInputStream()) {
                letter = letterService.render(file.getBytes(), in);
            }
        } else {
            try (InputStream in = Files.newInputStream(defaultTemplate)) {
                letter = letterService.render(file.getBytes(), in);
            }
        }

        ContentDisposition disposition = ContentDisposition.attachment()
                .filename(letter.fileName, StandardCharsets.UTF_8)
                .build();
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, disposition.toString())
                .contentType(DOCX)
                .body(letter.content);
    }

    @ExceptionHandler(MissingFieldsException.class)
    public ResponseEntity<Map<String, Object>> handleMissingFields(MissingFieldsException e) {
        log.warn("letter not generated: {}", e.getMessage());
        Map<String, Object> body = new HashMap<>();
        body.put("status", HttpStatus.UNPROCESSABLE_ENTITY.value());
        body.put("error", "Missing fields");
        body.put("missing", e.getMissingFields());
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(body);
    }
}
