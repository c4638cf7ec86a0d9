package com.example.docxdiff;

import lombok.extern.slf4j.Slf4j;
import org.apache.xmlbeans.XmlException;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * 两份 DOCX → 一份带修订标记的 DOCX。
 * 打开（限额）→ 解析 → 去旧修订 → 收集段落 → 按下标对齐并逐段比对 → 以修订稿 body 为骨架重建正文 → 序列化 → 打包。
 */
@Slf4j
@Service
public class TrackedDiffService {

    private static final Pattern HEADER_FOOTER_PART = Pattern.compile("word/(header|footer)\\d*\\.xml", Pattern.CASE_INSENSITIVE);

    private final Clock clock;

    public TrackedDiffService() {
        this(Clock.systemUTC());
    }

    TrackedDiffService(Clock clock) {
        this.clock = clock;
    }

    public DiffResult diff(byte[] base, byte[] revised, String author, DiffOptions options) throws DocxDiffException {
        final DiffOptions opts = options == null ? DiffOptions.defaults() : options;
        final List<String> warnings = new ArrayList<>();
        long t0 = System.currentTimeMillis();
        log.info("diff: base={} bytes, revised={} bytes, granularity={}, limits={}",
                base == null ? 0 : base.length, revised == null ? 0 : revised.length, opts.granularity, opts.limits);

        XmlElement baseDoc;
        XmlElement revDoc;
        try (DocxArchive baseZip = DocxArchive.open(base, opts.limits);
             DocxArchive revZip = DocxArchive.open(revised, opts.limits)) {
            baseDoc = loadDocument(baseZip, "base", warnings);
            revDoc = loadDocument(revZip, "revised", warnings);
            if (opts.includeHeadersFooters && (hasHeaderFooter(baseZip) || hasHeaderFooter(revZip))) {
                warnings.add("Header/footer parts are not carried into the output package; includeHeadersFooters has no effect");
            }
        } catch (IOException e) {
            throw new ArchiveException("Failed to read DOCX: " + e.getMessage(), e);
        }

        if (opts.existingTrackedRevisions == TrackedRevisionsPolicy.FAIL && RevisionStripper.hasTrackedChanges(revDoc)) {
            throw new PolicyViolationException("Revised document contains tracked revisions");
        }

        XmlElement cleanBase = RevisionStripper.strip(baseDoc);
        XmlElement cleanRev = RevisionStripper.strip(revDoc);

        List<XmlElement> baseParas = ParagraphModel.paragraphsOf(cleanBase, opts);
        List<XmlElement> revParas = ParagraphModel.paragraphsOf(cleanRev, opts);

        ParagraphAligner.Alignment alignment = ParagraphAligner.align(baseParas, revParas, opts, warnings);
        RevisionContext ctx = new RevisionContext(author, clock);
        XmlElement body = BodyRebuilder.rebuild(cleanRev.child("body"), alignment, ctx);
        XmlElement docOut = PackageAssembler.document(body);
        PackageAssembler.detachRelationships(docOut);

        byte[] bytes;
        try {
            bytes = PackageAssembler.assemble(docOut);
        } catch (IOException e) {
            throw new DocxDiffException("Failed to write output DOCX: " + e.getMessage(), e);
        }

        log.info("diff done in {} ms: paragraphs base={}, revised={}, unchanged={}, revisions={}, warnings={}",
                System.currentTimeMillis() - t0, baseParas.size(), revParas.size(), alignment.unchangedCount(),
                ctx.getLastId(), warnings.size());
        return new DiffResult(bytes, warnings);
    }

    /** document.xml 缺失是致命错误；无法解析则用空 body 兜底并记警告 */
    private XmlElement loadDocument(DocxArchive zip, String label, List<String> warnings) throws DocxDiffException {
        byte[] xml = zip.readPart(PackageAssembler.DOCUMENT);
        if (xml == null) {
            throw new MissingPartException("Missing " + PackageAssembler.DOCUMENT + " in " + label + " DOCX");
        }
        try {
            return PartCodec.parse(xml);
        } catch (XmlException e) {
            log.warn("malformed {} in {}: {}", PackageAssembler.DOCUMENT, label, e.getMessage());
            warnings.add("Malformed " + PackageAssembler.DOCUMENT + " in " + label + "; used empty fallback");
            return XmlElement.w("document").addChild(XmlElement.w("body"));
        }
    }

    private static boolean hasHeaderFooter(DocxArchive zip) {
        for (String name : zip.partNames()) {
            if (HEADER_FOOTER_PART.matcher(name).matches()) return true;
        }
        return false;
    }
}
