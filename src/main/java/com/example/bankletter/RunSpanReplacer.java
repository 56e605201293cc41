// File: src/main/java/com/example/bankletter/RunSpanReplacer.java
package com.example.bankletter;

import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.apache.poi.xwpf.usermodel.XWPFRun;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 段内占位符替换。占位符的字符可以被任意拆分到相邻的 run 中；
 * 搜索基于各 run 文本的拼接，只改写覆盖到该占位符的 w:t，格式（rPr）、run 的数量顺序以及 tab/换行元素保持不变。
 */
public final class RunSpanReplacer {
    private RunSpanReplacer() {}

    /** 一次匹配：起始偏移 + 命中的 key */
    private static final class Match {
        final int start;
        final String key;
        final String value;

        Match(int start, String key, String value) {
            this.start = start; this.key = key; this.value = value;
        }
    }

    /**
     * Replaces the earliest token occurrence in the paragraph.
     * Among tokens starting at the same offset the one that comes first in {@code tokens} wins.
     *
     * @return {@code false} if no token occurs in the paragraph; nothing is written in that case
     */
    public static boolean replaceOnce(XWPFParagraph paragraph, Map<String, String> tokens) {
        Objects.requireNonNull(paragraph, "paragraph");
        Objects.requireNonNull(tokens, "tokens");

        List<XWPFRun> runs = paragraph.getRuns();
        int n = runs.size();
        String[] texts = new String[n];
        int[] starts = new int[n + 1];
        StringBuilder full = new StringBuilder();
        for (int i = 0; i < n; i++) {
            texts[i] = RunText.read(runs.get(i));
            starts[i] = full.length();
            full.append(texts[i]);
        }
        starts[n] = full.length();

        Match m = findFirst(full.toString(), tokens);
        if (m == null) return false;

        int occStart = m.start;
        int occEnd = m.start + m.key.length();
        int first = -1, last = -1;
        for (int i = 0; i < n; i++) {
            if (starts[i] < occEnd && occStart < starts[i + 1]) {
                if (first < 0) first = i;
                last = i;
            }
        }

        // 首个 run 写入新值，其余 run 只删去占位符覆盖的字符
        int firstEnd = Math.min(occEnd, starts[first + 1]) - starts[first];
        RunText.replace(runs.get(first), occStart - starts[first], firstEnd, m.value);
        for (int i = first + 1; i < last; i++) RunText.replace(runs.get(i), 0, texts[i].length(), "");
        if (last != first) RunText.replace(runs.get(last), 0, occEnd - starts[last], "");
        return true;
    }

    /** 同一段落反复替换直到不再命中；返回成功替换的次数 */
    public static int replaceAll(XWPFParagraph paragraph, Map<String, String> tokens) {
        int count = 0;
        while (replaceOnce(paragraph, tokens)) count++;
        return count;
    }

    /** Concatenated text of all runs of the paragraph. */
    public static String paragraphText(XWPFParagraph paragraph) {
        StringBuilder sb = new StringBuilder();
        for (XWPFRun r : paragraph.getRuns()) sb.append(RunText.read(r));
        return sb.toString();
    }

    private static Match findFirst(String text, Map<String, String> tokens) {
        Match best = null;
        for (Map.Entry<String, String> e : tokens.entrySet()) {
            String key = e.getKey();
            if (key == null || key.isEmpty()) continue; // 空 key 处处命中，忽略
            int idx = text.indexOf(key);
            if (idx < 0) continue;
            if (best == null || idx < best.start) {
                best = new Match(idx, key, Objects.toString(e.getValue(), ""));
            }
        }
        return best;
    }

}
