// File: src/main/java/com/example/bankletter/TemplateFiller.java
package com.example.bankletter;

import lombok.extern.slf4j.Slf4j;
import org.apache.poi.xwpf.model.XWPFHeaderFooterPolicy;
import org.apache.poi.xwpf.usermodel.IBody;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFFooter;
import org.apache.poi.xwpf.usermodel.XWPFHeader;
import org.apache.poi.xwpf.usermodel.XWPFHeaderFooter;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.apache.poi.xwpf.usermodel.XWPFTable;
import org.apache.poi.xwpf.usermodel.XWPFTableCell;
import org.apache.poi.xwpf.usermodel.XWPFTableRow;
import org.apache.xmlbeans.XmlCursor;
import org.apache.xmlbeans.XmlObject;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTP;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTPPr;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTTbl;

import javax.xml.namespace.QName;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/** 遍历文档各容器（正文、表格单元格任意嵌套、页眉、页脚、块级内容控件），对每个段落做占位符替换直至不动点 */
@Slf4j
public final class TemplateFiller {
    private TemplateFiller() {}
    private static final String NS_W = "http://schemas.openxmlformats.org/wordprocessingml/2006/main";
    private static final QName QN_W_SDT        = new QName(NS_W, "sdt");
    private static final QName QN_W_SDTCONTENT = new QName(NS_W, "sdtContent");

    /**
     * Fills the document body and every header and footer part of the document.
     *
     * @return number of replacements made
     */
    public static int replaceAll(XWPFDocument doc, Map<String, String> tokens) {
        Objects.requireNonNull(doc, "doc");
        Objects.requireNonNull(tokens, "tokens");

        int count = fillBody(doc, tokens);
        List<XWPFHeaderFooter> parts = headersAndFooters(doc);
        for (XWPFHeaderFooter part : parts) count += fillBody(part, tokens);
        log.debug("template filled: {} replacement(s), {} header/footer part(s)", count, parts.size());
        return count;
    }

    /**
     * 页眉页脚：文档已加载的部件 + 每个节（正文末尾 sectPr 与段落内 sectPr）引用的部件。
     * 内存中新建的页眉页脚只登记在节的 policy 上，不在 getHeaderList()/getFooterList() 中。
     */
    static List<XWPFHeaderFooter> headersAndFooters(XWPFDocument doc) {
        List<XWPFHeaderFooter> parts = new ArrayList<>();
        for (XWPFHeader h : doc.getHeaderList()) addOnce(parts, h);
        for (XWPFFooter f : doc.getFooterList()) addOnce(parts, f);

        List<XWPFHeaderFooterPolicy> policies = new ArrayList<>();
        if (doc.getHeaderFooterPolicy() != null) policies.add(doc.getHeaderFooterPolicy());
        for (XWPFParagraph p : doc.getParagraphs()) {
            CTPPr pPr = p.getCTP().getPPr();
            if (pPr != null && pPr.isSetSectPr()) policies.add(new XWPFHeaderFooterPolicy(doc, pPr.getSectPr()));
        }
        for (XWPFHeaderFooterPolicy policy : policies) {
            addOnce(parts, policy.getDefaultHeader());
            addOnce(parts, policy.getFirstPageHeader());
            addOnce(parts, policy.getEvenPageHeader());
            addOnce(parts, policy.getDefaultFooter());
            addOnce(parts, policy.getFirstPageFooter());
            addOnce(parts, policy.getEvenPageFooter());
        }
        return parts;
    }

    // 同一部件可被多个节引用，按引用去重
    private static void addOnce(List<XWPFHeaderFooter> parts, XWPFHeaderFooter part) {
        if (part == null) return;
        for (XWPFHeaderFooter p : parts) if (p == part) return;
        parts.add(part);
    }

    /** Fills a single container (table cell, header, footer) and everything nested in it. */
    public static int replaceAll(IBody body, Map<String, String> tokens) {
        Objects.requireNonNull(body, "body");
        Objects.requireNonNull(tokens, "tokens");
        return fillBody(body, tokens);
    }

    private static int fillBody(IBody body, Map<String, String> tokens) {
        int count = 0;
        for (XWPFParagraph p : body.getParagraphs()) {
            count += RunSpanReplacer.replaceAll(p, tokens);
        }
        for (XWPFTable t : body.getTables()) count += fillTable(t, tokens);
        XmlObject xml = bodyXml(body);
        if (xml != null) count += fillContentControls(xml, body, tokens);
        return count;
    }

    private static int fillTable(XWPFTable t, Map<String, String> tokens) {
        int count = 0;
        for (XWPFTableRow row : t.getRows())
            for (XWPFTableCell cell : row.getTableCells())
                count += fillBody(cell, tokens);
        return count;
    }

    private static XmlObject bodyXml(IBody body) {
        if (body instanceof XWPFDocument) return ((XWPFDocument) body).getDocument().getBody();
        if (body instanceof XWPFHeaderFooter) return ((XWPFHeaderFooter) body)._getHdrFtr();
        if (body instanceof XWPFTableCell) return ((XWPFTableCell) body).getCTTc();
        return null;
    }

    /**
     * 块级内容控件（w:sdt）：POI 只读地暴露其内容，这里直接按 XML 找到 sdtContent 下的 w:p / w:tbl，
     * 用临时的 XWPFParagraph / XWPFTable 包装后替换；改动直接落在底层 XML 上。
     */
    private static int fillContentControls(XmlObject container, IBody owner, Map<String, String> tokens) {
        List<XmlObject> contents = new ArrayList<>();
        try (XmlCursor c = container.newCursor()) {
            if (c.toFirstChild()) {
                do {
                    if (QN_W_SDT.equals(c.getName())) {
                        try (XmlCursor sc = c.getObject().newCursor()) {
                            if (sc.toChild(QN_W_SDTCONTENT)) contents.add(sc.getObject());
                        }
                    }
                } while (c.toNextSibling());
            }
        }

        int count = 0;
        for (XmlObject content : contents) {
            List<XmlObject> children = new ArrayList<>();
            try (XmlCursor c = content.newCursor()) {
                if (c.toFirstChild()) {
                    do { children.add(c.getObject()); } while (c.toNextSibling());
                }
            }
            for (XmlObject child : children) {
                if (child instanceof CTP) {
                    count += RunSpanReplacer.replaceAll(new XWPFParagraph((CTP) child, owner), tokens);
                } else if (child instanceof CTTbl) {
                    count += fillTable(new XWPFTable((CTTbl) child, owner), tokens);
                }
            }
            // 嵌套的内容控件
            count += fillContentControls(content, owner, tokens);
        }
        return count;
    }
}
