// File: src/main/java/com/example/bankletter/LetterValues.java
package com.example.bankletter;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/** 由抽取字段计算出的模板取值、输出目录名与文件名 */
public final class LetterValues {

    private static final String[] UA_MONTHS_GEN = {
            "січня", "лютого", "березня", "квітня", "травня", "червня",
            "липня", "серпня", "вересня", "жовтня", "листопада", "грудня"
    };

    public final String caseNumber;
    public final String yearMonth;
    public final String amountWhole;
    public final String amountFormatted;
    public final String date;
    public final String datePlus2;
    public final String datePlus3;
    public final String monthOnly;
    public final String purpose;

    private LetterValues(String caseNumber, BigDecimal amount, LocalDate date, String purpose) {
        this.caseNumber = caseNumber;
        this.yearMonth = String.format(Locale.ROOT, "%02d-%02d", date.getYear() % 100, date.getMonthValue());
        this.amountWhole = amount.setScale(0, RoundingMode.DOWN).toPlainString();
        this.amountFormatted = groupedAmount(amount);
        this.date = uaDate(date);
        this.datePlus2 = uaDate(date.plusDays(2));
        this.datePlus3 = uaDate(date.plusDays(3));
        this.monthOnly = String.format(Locale.ROOT, "%02d", date.getMonthValue());
        this.purpose = purpose == null ? "" : purpose;
    }

    /** Requires case number, amount and date to be present. */
    public static LetterValues from(AgreementFields fields) {
        if (!fields.isComplete()) {
            throw new MissingFieldsException(fields.missingRequired());
        }
        return new LetterValues(fields.getCaseNumber(), fields.getAmount(), fields.getDate(), fields.getPurpose());
    }

    /** 占位符 → 取值，顺序即替换优先级 */
    public Map<String, String> placeholders() {
        Map<String, String> m = new LinkedHashMap<>();
        m.put("{{CASE_NUM}}", caseNumber);
        m.put("{{FULL_AMOUNT_DEC}}", amountWhole);
        m.put("{{FULL_AMOUNT}}", amountFormatted);
        m.put("{{DATE}}", date);
        m.put("{{DATE+2}}", datePlus2);
        m.put("{{DATE + 2}}", datePlus2);
        m.put("{{DATE+3}}", datePlus3);
        m.put("{{DATE + 3}}", datePlus3);
        m.put("{{DATE_MM_ONLY}}", monthOnly);
        m.put("{{CASE_DESCR}}", purpose);
        return m;
    }

    public String folderName() {
        return yearMonth + " Нова ХХХ " + amountWhole + " №" + caseNumber + " Хелп";
    }

    public String letterFileName() {
        return "Письмо_в_банк_№" + caseNumber + ".docx";
    }

    /** «05» березня 2024 року */
    static String uaDate(LocalDate d) {
        Objects.requireNonNull(d, "date");
        return String.format(Locale.ROOT, "«%02d» %s %d року", d.getDayOfMonth(), UA_MONTHS_GEN[d.getMonthValue() - 1], d.getYear());
    }

    /** 两位小数，千位以空格分组：1 234 567.80 */
    static String groupedAmount(BigDecimal amount) {
        DecimalFormatSymbols symbols = DecimalFormatSymbols.getInstance(Locale.ROOT);
        symbols.setGroupingSeparator(' ');
        symbols.setDecimalSeparator('.');
        DecimalFormat fmt = new DecimalFormat("#,##0.00", symbols);
        fmt.setRoundingMode(RoundingMode.HALF_EVEN);
        return fmt.format(amount);
    }
}
