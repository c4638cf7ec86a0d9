package com.example.docxdiff;

/** 分词粒度 */
public enum Granularity {
    WORD, CHAR;

    /** 接受 "word" / "char"（大小写不敏感）；空值取 WORD */
    public static Granularity parse(String v) {
        if (v == null || v.isBlank()) return WORD;
        switch (v.trim().toLowerCase(java.util.Locale.ROOT)) {
            case "word": return WORD;
            case "char": return CHAR;
            default: throw new IllegalArgumentException("Unsupported granularity: " + v);
        }
    }
}
