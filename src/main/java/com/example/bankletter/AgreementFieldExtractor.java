// File: src/main/java/com/example/bankletter/AgreementFieldExtractor.java
package com.example.bankletter;

import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** 用正则从协议文本中抽取案号、金额、日期与用途 */
@Component
public class AgreementFieldExtractor {

    private static final Pattern CASE_NUM = Pattern.compile("\\b0+(\\d{5,})\\b");
    private static final Pattern CASE_NUM_FALLBACK = Pattern.compile("\\b\\d{6,9}\\b");
    private static final List<Pattern> AMOUNT_PATTERNS = List.of(
            Pattern.compile("(?:amount of|USD|\\$)\\s*([0-9][0-9 ,.]*)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("USD\\s*\\$?\\s*([0-9][0-9 ,.]*)", Pattern.CASE_INSENSITIVE)
    );
    private static final Pattern NON_DIGITS = Pattern.compile("[^\\d.]");
    private static final Pattern DECIMAL = Pattern.compile("\\d+\\.?\\d*|\\.\\d+");
    private static final Pattern UA_PURPOSE =
            Pattern.compile("у вигляді\\s+([^.]+)\\.", Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    private static final Pattern DATE_US = Pattern.compile("\\b(\\d{1,2})/(\\d{1,2})/(\\d{4})\\b");

    private static final String PURPOSE_PREFIX = "у вигляді ";

    public AgreementFields extract(AgreementText text) {
        return new AgreementFields(
                findCaseNumber(text.caseNumberArea).orElse(null),
                findAmount(text.firstPage).orElse(null),
                findLatestDate(text.lastPage).orElse(null),
                findPurpose(text.fullText).orElse(null));
    }

    /** 优先取带前导零的编号（去掉前导零）；否则取 6–9 位数字 */
    public Optional<String> findCaseNumber(String text) {
        Matcher m = CASE_NUM.matcher(text);
        if (m.find()) return Optional.of(m.group(1));
        Matcher m2 = CASE_NUM_FALLBACK.matcher(text);
        if (m2.find()) return Optional.of(new BigInteger(m2.group()).toString());
        return Optional.empty();
    }

    /** 按模式顺序、匹配顺序，第一个可解析的数字即为金额 */
    public Optional<BigDecimal> findAmount(String text) {
        for (Pattern p : AMOUNT_PATTERNS) {
            Matcher m = p.matcher(text);
            while (m.find()) {
                String digits = NON_DIGITS.matcher(m.group(1)).replaceAll("");
                // "1.2.3" 之类不可解析的跳过，继续下一个匹配
                if (DECIMAL.matcher(digits).matches()) return Optional.of(new BigDecimal(digits));
            }
        }
        return Optional.empty();
    }

    /** Latest valid M/D/YYYY date in the text. */
    public Optional<LocalDate> findLatestDate(String text) {
        LocalDate latest = null;
        Matcher m = DATE_US.matcher(text);
        while (m.find()) {
            int year = Integer.parseInt(m.group(3));
            if (year < 1) continue; // 0000 不是公历年份
            LocalDate d;
            try {
                d = LocalDate.of(year, Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)));
            } catch (DateTimeException e) {
                continue;
            }
            if (latest == null || d.isAfter(latest)) latest = d;
        }
        return Optional.ofNullable(latest);
    }

    public Optional<String> findPurpose(String text) {
        Matcher m = UA_PURPOSE.matcher(text);
        return m.find() ? Optional.of(PURPOSE_PREFIX + m.group(1).strip()) : Optional.empty();
    }
}
