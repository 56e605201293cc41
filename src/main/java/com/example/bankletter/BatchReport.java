package com.example.bankletter;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** 一次批处理的汇总，所有跳过与失败在此一次性报告 */
@Getter
public class BatchReport {
    private final boolean templateMissing;
    private final List<LetterOutcome> outcomes;

    private BatchReport(boolean templateMissing, List<LetterOutcome> outcomes) {
        this.templateMissing = templateMissing;
        this.outcomes = Collections.unmodifiableList(new ArrayList<>(outcomes));
    }

    public static BatchReport of(List<LetterOutcome> outcomes) {
        return new BatchReport(false, outcomes);
    }

    public static BatchReport missingTemplate() {
        return new BatchReport(true, List.of());
    }

    public long count(LetterOutcome.Status status) {
        return outcomes.stream().filter(o -> o.getStatus() == status).count();
    }

    public List<LetterOutcome> problems() {
        List<LetterOutcome> out = new ArrayList<>();
        for (LetterOutcome o : outcomes) if (o.getStatus() != LetterOutcome.Status.GENERATED) out.add(o);
        return out;
    }

    public String summary() {
        if (templateMissing) return "template not found, nothing processed";
        if (outcomes.isEmpty()) return "no agreement PDFs found";
        return String.format("%d file(s): %d generated, %d skipped (missing fields), %d skipped (folder exists), %d failed",
                outcomes.size(),
                count(LetterOutcome.Status.GENERATED),
                count(LetterOutcome.Status.SKIPPED_MISSING_FIELDS),
                count(LetterOutcome.Status.SKIPPED_FOLDER_EXISTS),
                count(LetterOutcome.Status.FAILED));
    }
}
