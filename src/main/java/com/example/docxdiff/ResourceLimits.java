package com.example.docxdiff;

/** 解压与分词的资源上限（可用 ENV 覆盖默认值） */
public final class ResourceLimits {
    public final long maxTotalUnzippedBytes;   // 解压总量上限
    public final int maxEntries;               // zip 条目数上限
    public final long maxEntrySize;            // 单条目解压上限
    public final int maxTokensPerParagraph;    // 单段 token 上限，超出则整段替换

    private ResourceLimits(Builder b) {
        this.maxTotalUnzippedBytes = b.maxTotalUnzippedBytes;
        this.maxEntries = b.maxEntries;
        this.maxEntrySize = b.maxEntrySize;
        this.maxTokensPerParagraph = b.maxTokensPerParagraph;
    }

    /** 默认上限：50MB / 2000 条目 / 5MB / 4000 tokens */
    public static ResourceLimits defaults() {
        return new Builder().build();
    }

    public Builder toBuilder() {
        return new Builder()
            .maxTotalUnzippedBytes(maxTotalUnzippedBytes)
            .maxEntries(maxEntries)
            .maxEntrySize(maxEntrySize)
            .maxTokensPerParagraph(maxTokensPerParagraph);
    }

    static int getEnvInt(String k, int d){ try { return Integer.parseInt(System.getenv().getOrDefault(k, String.valueOf(d))); } catch(Exception e){ return d; } }
    static long getEnvLong(String k, long d){ try { return Long.parseLong(System.getenv().getOrDefault(k, String.valueOf(d))); } catch(Exception e){ return d; } }

    @Override
    public String toString() {
        return "ResourceLimits{maxTotalUnzippedBytes=" + maxTotalUnzippedBytes + ", maxEntries=" + maxEntries
            + ", maxEntrySize=" + maxEntrySize + ", maxTokensPerParagraph=" + maxTokensPerParagraph + "}";
    }

    public static final class Builder {
        private long maxTotalUnzippedBytes = getEnvLong("DOCXDIFF_MAX_TOTAL_UNZIPPED_BYTES", 50L * 1024 * 1024);
        private int maxEntries = getEnvInt("DOCXDIFF_MAX_ENTRIES", 2000);
        private long maxEntrySize = getEnvLong("DOCXDIFF_MAX_ENTRY_SIZE", 5L * 1024 * 1024);
        private int maxTokensPerParagraph = getEnvInt("DOCXDIFF_MAX_TOKENS_PER_PARAGRAPH", 4000);

        public Builder maxTotalUnzippedBytes(long v){ this.maxTotalUnzippedBytes=v; return this; }
        public Builder maxEntries(int v){ this.maxEntries=v; return this; }
        public Builder maxEntrySize(long v){ this.maxEntrySize=v; return this; }
        public Builder maxTokensPerParagraph(int v){ this.maxTokensPerParagraph=v; return this; }
        public ResourceLimits build(){ return new ResourceLimits(this); }
    }
}
