package com.example.docxdiff;

import lombok.Getter;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;

/**
 * 一份输出文档内共享的修订戳：作者、时间、全文单调递增的 w:id（从 1 开始）。
 * 单线程使用。
 */
@Getter
public final class RevisionContext {
    private final String author;
    private final String date;
    private int lastId;

    public RevisionContext(String author, Clock clock) {
        this.author = (author == null || author.isBlank()) ? "AutoDiff" : author;
        Instant now = (clock == null ? Clock.systemUTC() : clock).instant().truncatedTo(ChronoUnit.SECONDS);
        this.date = now.toString();
    }

    public RevisionContext(String author) {
        this(author, Clock.systemUTC());
    }

    public String nextId() {
        return String.valueOf(++lastId);
    }

    /** 给 ins / del 包装盖上 id、作者、时间 */
    public XmlElement stamp(XmlElement wrapper) {
        wrapper.setAttribute("id", nextId());
        wrapper.setAttribute("author", author);
        wrapper.setAttribute("date", date);
        return wrapper;
    }
}
