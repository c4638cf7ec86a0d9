package com.example.docxdiff;

import java.util.ArrayList;
import java.util.List;

/**
 * 以修订稿的 body 为骨架生成输出正文。表格、内容控件、文本框、书签等结构原样复制；
 * 参与比对的段落在原位置替换为比对结果；只在原稿中存在的段落作为整段删除追加到正文末尾（sectPr 之前）。
 * w:id 按文档顺序分配，因此必须串行调用。
 */
public final class BodyRebuilder {

    private final ParagraphAligner.Alignment alignment;
    private final RevisionContext ctx;

    private BodyRebuilder(ParagraphAligner.Alignment alignment, RevisionContext ctx) {
        this.alignment = alignment;
        this.ctx = ctx;
    }

    public static XmlElement rebuild(XmlElement revisedBody, ParagraphAligner.Alignment alignment, RevisionContext ctx) {
        BodyRebuilder b = new BodyRebuilder(alignment, ctx);
        XmlElement body = revisedBody == null ? XmlElement.w("body") : b.copy(revisedBody);

        List<XmlElement> removed = new ArrayList<>();
        for (int i = 0; i < alignment.size(); i++) {
            if (alignment.kind(i) == ParagraphAligner.Kind.BASE_ONLY) {
                XmlElement bp = alignment.base.get(i);
                removed.add(b.wholeDeletion(bp, ParagraphModel.textOf(bp)));
            }
        }
        List<XmlElement> cs = body.getChildren();
        int at = !cs.isEmpty() && cs.get(cs.size() - 1).is("sectPr") ? cs.size() - 1 : cs.size();
        cs.addAll(at, removed);
        return body;
    }

    /** 递归复制；遇到参与比对的段落换成比对结果 */
    private XmlElement copy(XmlElement e) {
        Integer i = alignment.revisedIndex.get(e);
        if (i != null) return paragraph(e, i);
        XmlElement out = e.shallowCopy();
        copyChildren(e, out);
        return out;
    }

    private void copyChildren(XmlElement from, XmlElement to) {
        for (XmlElement c : from.getChildren()) {
            if (!isStaleDeletion(c)) to.addChild(copy(c));
        }
    }

    /** 去掉修订包装后残留的已删除 run（只有 delText / delInstrText），接受修订后它们不再存在 */
    static boolean isStaleDeletion(XmlElement e) {
        return e.is("r") && (e.child("delText") != null || e.child("delInstrText") != null);
    }

    private XmlElement paragraph(XmlElement rp, int i) {
        switch (alignment.kind(i)) {
            case UNCHANGED: {
                XmlElement out = rp.shallowCopy();
                copyChildren(rp, out);
                return out;
            }
            case REVISED_ONLY: {
                XmlElement mark = ctx.stamp(XmlElement.w("ins"));
                List<XmlElement> runs = RunSynthesizer.synthesize(alignment.scripts[i], ctx, ParagraphModel.firstRunProperties(rp), null);
                XmlElement out = withRuns(rp, runs);
                markParagraph(out, mark);
                return out;
            }
            default: {
                List<XmlElement> runs = RunSynthesizer.synthesize(alignment.scripts[i], ctx,
                        ParagraphModel.firstRunProperties(rp), ParagraphModel.firstRunProperties(alignment.base.get(i)));
                return withRuns(rp, runs);
            }
        }
    }

    /**
     * 带文本的 run 和行内容器（超链接等）由合成的 run 取代，合成结果放在第一个带文本子元素的位置；
     * 其余子元素（pPr、书签、图片 run …）原位保留。run 里除文本外的内容（如 drawing）留在一个去掉文本的 run 里。
     */
    private XmlElement withRuns(XmlElement rp, List<XmlElement> runs) {
        XmlElement out = rp.shallowCopy();
        boolean placed = false;
        for (XmlElement c : rp.getChildren()) {
            if (isStaleDeletion(c)) continue;
            if (ParagraphModel.carriesText(c)) {
                if (!placed) { out.addChildren(runs); placed = true; }
                XmlElement rest = c.is("r") ? withoutText(c) : null;
                if (rest != null) out.addChild(rest);
            } else {
                out.addChild(copy(c));
            }
        }
        if (!placed) out.addChildren(runs);
        return out;
    }

    private XmlElement withoutText(XmlElement r) {
        XmlElement out = r.shallowCopy();
        boolean kept = false;
        for (XmlElement c : r.getChildren()) {
            if (c.is("rPr")) {
                out.addChild(c.deepCopy());
            } else if (!ParagraphModel.TEXT_PARTS.contains(c.getName())) {
                out.addChild(copy(c));
                kept = true;
            }
        }
        return kept ? out : null;
    }

    /** 整段删除：原稿 pPr + 一个 del；段落标记记为删除 */
    private XmlElement wholeDeletion(XmlElement source, String text) {
        XmlElement p = XmlElement.w("p");
        XmlElement pPr = source.child("pPr");
        p.addChild(pPr == null ? XmlElement.w("pPr") : pPr.deepCopy());
        markParagraph(p, ctx.stamp(XmlElement.w("del")));
        if (!text.isEmpty()) {
            p.addChild(RunSynthesizer.deletion(text, ctx, ParagraphModel.firstRunProperties(source)));
        }
        return p;
    }

    /** 段落标记修订放在 pPr/rPr 的第一个位置；pPr/rPr 需排在 sectPr、pPrChange 之前 */
    static void markParagraph(XmlElement p, XmlElement mark) {
        XmlElement pPr = p.child("pPr");
        if (pPr == null) {
            pPr = XmlElement.w("pPr");
            p.getChildren().add(0, pPr);
        }
        XmlElement rPr = pPr.child("rPr");
        if (rPr == null) {
            rPr = XmlElement.w("rPr");
            List<XmlElement> cs = pPr.getChildren();
            int at = cs.size();
            for (int k = 0; k < cs.size(); k++) {
                if (cs.get(k).is("sectPr") || cs.get(k).is("pPrChange")) { at = k; break; }
            }
            cs.add(at, rPr);
        }
        rPr.getChildren().add(0, mark);
    }
}
