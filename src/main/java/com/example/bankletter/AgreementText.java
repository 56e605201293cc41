package com.example.bankletter;

/** 从协议 PDF 读出的原始文本：案号区域、首页、末页、全文 */
public final class AgreementText {
    public final String caseNumberArea;
    public final String firstPage;
    public final String lastPage;
    public final String fullText;

    public AgreementText(String caseNumberArea, String firstPage, String lastPage, String fullText) {
        this.caseNumberArea = nz(caseNumberArea);
        this.firstPage = nz(firstPage);
        this.lastPage = nz(lastPage);
        this.fullText = nz(fullText);
    }

    public static AgreementText empty() {
        return new AgreementText("", "", "", "");
    }

    private static String nz(String s) { return s == null ? "" : s; }
}
