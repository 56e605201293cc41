package com.example.bankletter;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/** 抽取结果；未找到的字段为 null */
@Getter
@AllArgsConstructor
public class AgreementFields {
    private final String caseNumber;
    private final BigDecimal amount;
    private final LocalDate date;
    private final String purpose;

    /** Names of the fields a letter cannot be generated without. */
    public List<String> missingRequired() {
        List<String> missing = new ArrayList<>();
        if (caseNumber == null || caseNumber.isEmpty()) missing.add("CASE_NUM");
        if (amount == null) missing.add("FULL_AMOUNT");
        if (date == null) missing.add("DATE");
        return missing;
    }

    public boolean isComplete() {
        return missingRequired().isEmpty();
    }
}
