// File: src/main/java/com/example/bankletter/RunText.java
package com.example.bankletter;

import org.apache.poi.xwpf.usermodel.XWPFRun;
import org.apache.xmlbeans.XmlCursor;
import org.apache.xmlbeans.XmlObject;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTR;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTText;

import javax.xml.namespace.QName;
import java.util.ArrayList;
import java.util.List;

/**
 * run 的可见文本：w:t 原文，w:tab 记为 \t，w:br / w:cr 记为 \n。
 * 修改时原地改写 w:t 的字符；区间外的 w:tab/w:br/w:cr、rPr 及其它子元素（w:sym、w:drawing、w:fldChar…）保持原样与原顺序。
 */
final class RunText {
    private RunText() {}
    private static final String NS_W = "http://schemas.openxmlformats.org/wordprocessingml/2006/main";
    private static final QName QN_W_T   = new QName(NS_W, "t");
    private static final QName QN_W_TAB = new QName(NS_W, "tab");
    private static final QName QN_W_BR  = new QName(NS_W, "br");
    private static final QName QN_W_CR  = new QName(NS_W, "cr");
    private static final QName QN_XML_SPACE = new QName("http://www.w3.org/XML/1998/namespace", "space", "xml");

    /** Reads the run's children in document order. */
    static String read(XWPFRun r) {
        CTR ctr = r.getCTR();
        if (ctr == null) return "";
        StringBuilder sb = new StringBuilder();
        try (XmlCursor c = ctr.newCursor()) {
            if (!c.toFirstChild()) return "";
            do {
                QName name = c.getName();
                if (QN_W_T.equals(name)) sb.append(c.getTextValue());
                else if (QN_W_TAB.equals(name)) sb.append('\t');
                else if (isBreak(name)) sb.append('\n');
            } while (c.toNextSibling());
        }
        return sb.toString();
    }

    /**
     * Replaces the characters {@code [from, to)} of the run's text with {@code value}.
     * The value goes into the first w:t that touches {@code from}; a tab or break inside the range is removed.
     */
    static void replace(XWPFRun r, int from, int to, String value) {
        CTR ctr = r.getCTR();
        if (ctr == null) return;

        List<CTText> edited = new ArrayList<>();
        List<String> editedText = new ArrayList<>();
        List<XmlObject> dropped = new ArrayList<>();
        boolean inserted = value.isEmpty();
        int pos = 0;

        try (XmlCursor c = ctr.newCursor()) {
            if (c.toFirstChild()) {
                do {
                    QName name = c.getName();
                    if (QN_W_T.equals(name)) {
                        CTText t = (CTText) c.getObject();
                        String s = t.getStringValue() == null ? "" : t.getStringValue();
                        int start = pos, end = pos + s.length();
                        int a = Math.max(0, Math.min(from - start, s.length()));
                        int b = Math.max(0, Math.min(to - start, s.length()));
                        boolean target = !inserted && start <= from && from <= end;
                        if (a < b || target) {
                            edited.add(t);
                            editedText.add(s.substring(0, a) + (target ? value : "") + s.substring(b));
                            if (target) inserted = true;
                        }
                        pos = end;
                    } else if (QN_W_TAB.equals(name) || isBreak(name)) {
                        if (pos >= from && pos < to) dropped.add(c.getObject());
                        pos++;
                    }
                } while (c.toNextSibling());
            }
        }

        for (int i = 0; i < edited.size(); i++) {
            edited.get(i).setStringValue(editedText.get(i));
            preserveSpaces(edited.get(i));
        }
        if (!inserted) {
            // 起点落在 tab/br 上且前面没有相邻的 w:t：在它前面新建一个
            if (dropped.isEmpty()) {
                r.setText(value);
            } else {
                try (XmlCursor c = dropped.get(0).newCursor()) {
                    c.beginElement(QN_W_T);
                    c.insertAttributeWithValue(QN_XML_SPACE, "preserve");
                    c.insertChars(value);
                }
            }
        }
        for (XmlObject o : dropped) {
            try (XmlCursor c = o.newCursor()) {
                c.removeXml();
            }
        }
    }

    private static boolean isBreak(QName name) {
        return QN_W_BR.equals(name) || QN_W_CR.equals(name);
    }

    private static void preserveSpaces(CTText t) {
        String s = t.getStringValue();
        if (s == null || s.equals(s.strip())) return;
        try (XmlCursor c = t.newCursor()) {
            if (c.getAttributeText(QN_XML_SPACE) != null) return;
            c.toNextToken();
            c.insertAttributeWithValue(QN_XML_SPACE, "preserve");
        }
    }
}
