package com.example.bankletter;

/** 内存中生成的信函 */
public final class GeneratedLetter {
    public final String fileName;
    public final byte[] content;

    public GeneratedLetter(String fileName, byte[] content) {
        this.fileName = fileName; this.content = content;
    }
}
