package com.example.docxdiff;

/** 一次比对的参数；默认值与 HTTP 接口的缺省值一致 */
public final class DiffOptions {
    public final Granularity granularity;             // 比对粒度
    public final boolean suppressWhitespaceOnly;      // 仅空白差异时不标修订
    public final boolean includeLists;                // 带编号的段落是否参与
    public final boolean includeTables;               // 表格内段落是否参与
    public final boolean includeTextBoxes;            // 文本框内段落是否参与
    public final boolean includeHeadersFooters;       // 页眉页脚（输出包不含，只给警告）
    public final TrackedRevisionsPolicy existingTrackedRevisions;
    public final ResourceLimits limits;

    private DiffOptions(Builder b) {
        this.granularity = b.granularity;
        this.suppressWhitespaceOnly = b.suppressWhitespaceOnly;
        this.includeLists = b.includeLists;
        this.includeTables = b.includeTables;
        this.includeTextBoxes = b.includeTextBoxes;
        this.includeHeadersFooters = b.includeHeadersFooters;
        this.existingTrackedRevisions = b.existingTrackedRevisions;
        this.limits = b.limits;
    }

    public static DiffOptions defaults() {
        return new Builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Granularity granularity = Granularity.WORD;
        private boolean suppressWhitespaceOnly = true;
        private boolean includeLists = true;
        private boolean includeTables = true;
        private boolean includeTextBoxes = true;
        private boolean includeHeadersFooters = false;
        private TrackedRevisionsPolicy existingTrackedRevisions = TrackedRevisionsPolicy.IGNORE;
        private ResourceLimits limits = ResourceLimits.defaults();

        public Builder granularity(Granularity v){ this.granularity = v == null ? Granularity.WORD : v; return this; }
        public Builder suppressWhitespaceOnly(boolean v){ this.suppressWhitespaceOnly=v; return this; }
        public Builder includeLists(boolean v){ this.includeLists=v; return this; }
        public Builder includeTables(boolean v){ this.includeTables=v; return this; }
        public Builder includeTextBoxes(boolean v){ this.includeTextBoxes=v; return this; }
        public Builder includeHeadersFooters(boolean v){ this.includeHeadersFooters=v; return this; }
        public Builder existingTrackedRevisions(TrackedRevisionsPolicy v){ this.existingTrackedRevisions = v == null ? TrackedRevisionsPolicy.IGNORE : v; return this; }
        public Builder limits(ResourceLimits v){ this.limits = v == null ? ResourceLimits.defaults() : v; return this; }
        public DiffOptions build(){ return new DiffOptions(this); }
    }
}
