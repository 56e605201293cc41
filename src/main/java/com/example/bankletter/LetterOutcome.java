package com.example.bankletter;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;

/** 单个协议文件的处理结果 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class LetterOutcome {

    public enum Status { GENERATED, SKIPPED_MISSING_FIELDS, SKIPPED_FOLDER_EXISTS, FAILED }

    private final String fileName;
    private final Status status;
    private final String detail;
    private final boolean letterWritten;
    private final boolean pdfMoved;

    public static LetterOutcome generated(String fileName, String folderName, boolean letterWritten, boolean pdfMoved) {
        return new LetterOutcome(fileName, Status.GENERATED, folderName, letterWritten, pdfMoved);
    }

    public static LetterOutcome missingFields(String fileName, List<String> missing) {
        return new LetterOutcome(fileName, Status.SKIPPED_MISSING_FIELDS, "missing " + String.join(", ", missing), false, false);
    }

    public static LetterOutcome folderExists(String fileName, String folderName) {
        return new LetterOutcome(fileName, Status.SKIPPED_FOLDER_EXISTS, folderName, false, false);
    }

    public static LetterOutcome failed(String fileName, Throwable error) {
        String msg = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        return new LetterOutcome(fileName, Status.FAILED, msg, false, false);
    }

    @Override
    public String toString() {
        return fileName + ": " + status + (detail == null || detail.isEmpty() ? "" : " (" + detail + ")");
    }
}
