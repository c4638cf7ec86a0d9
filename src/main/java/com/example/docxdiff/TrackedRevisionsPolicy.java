package com.example.docxdiff;

/** 修订稿已含修订标记时的处理方式 */
public enum TrackedRevisionsPolicy {
    IGNORE, FAIL;

    /** 接受 "ignore" / "fail"（大小写不敏感）；空值取 IGNORE */
    public static TrackedRevisionsPolicy parse(String v) {
        if (v == null || v.isBlank()) return IGNORE;
        switch (v.trim().toLowerCase(java.util.Locale.ROOT)) {
            case "ignore": return IGNORE;
            case "fail": return FAIL;
            default: throw new IllegalArgumentException("Unsupported existingTrackedRevisions policy: " + v);
        }
    }
}
