package com.example.docxdiff;

import java.util.ArrayList;
import java.util.List;

/**
 * 编辑脚本 → run 序列。连续 EQUAL 合成一个普通 run；两段 EQUAL 之间的 DELETE / INSERT
 * 各合成一个 w:del、一个 w:ins，且删除在前。
 */
public final class RunSynthesizer {
    private RunSynthesizer() {}

    public static List<XmlElement> synthesize(List<EditOperation> script, RevisionContext ctx) {
        return synthesize(script, ctx, null, null);
    }

    /**
     * @param plainRPr   普通 run 与插入 run 的格式模板（修订稿首个 run 的 rPr），可为 null
     * @param deletedRPr 删除 run 的格式模板（原稿首个 run 的 rPr），可为 null
     */
    public static List<XmlElement> synthesize(List<EditOperation> script, RevisionContext ctx,
                                              XmlElement plainRPr, XmlElement deletedRPr) {
        List<XmlElement> out = new ArrayList<>();
        StringBuilder eq = new StringBuilder();
        StringBuilder del = new StringBuilder();
        StringBuilder ins = new StringBuilder();

        for (EditOperation op : script) {
            switch (op.getType()) {
                case EQUAL:
                    flushChanges(out, del, ins, ctx, plainRPr, deletedRPr);
                    eq.append(op.getToken());
                    break;
                case DELETE:
                    flushEqual(out, eq, plainRPr);
                    del.append(op.getToken());
                    break;
                case INSERT:
                    flushEqual(out, eq, plainRPr);
                    ins.append(op.getToken());
                    break;
            }
        }
        flushEqual(out, eq, plainRPr);
        flushChanges(out, del, ins, ctx, plainRPr, deletedRPr);
        return out;
    }

    private static void flushEqual(List<XmlElement> out, StringBuilder eq, XmlElement rPr) {
        if (eq.length() == 0) return;
        out.add(plainRun(eq.toString(), rPr));
        eq.setLength(0);
    }

    private static void flushChanges(List<XmlElement> out, StringBuilder del, StringBuilder ins, RevisionContext ctx,
                                     XmlElement plainRPr, XmlElement deletedRPr) {
        if (del.length() > 0) { out.add(deletion(del.toString(), ctx, deletedRPr)); del.setLength(0); }
        if (ins.length() > 0) { out.add(insertion(ins.toString(), ctx, plainRPr)); ins.setLength(0); }
    }

    public static XmlElement plainRun(String text, XmlElement rPr) {
        return run(text, rPr, "t");
    }

    public static XmlElement insertion(String text, RevisionContext ctx, XmlElement rPr) {
        return ctx.stamp(XmlElement.w("ins")).addChild(run(text, rPr, "t"));
    }

    public static XmlElement deletion(String text, RevisionContext ctx, XmlElement rPr) {
        return ctx.stamp(XmlElement.w("del")).addChild(run(text, rPr, "delText"));
    }

    /** 文本按 \t、\n 切开：\t 写成 w:tab，\n 写成 w:br，其余写进 w:t / w:delText（xml:space=preserve） */
    static XmlElement run(String text, XmlElement rPr, String textElement) {
        XmlElement r = XmlElement.w("r");
        if (rPr != null) r.addChild(rPr.deepCopy());
        String s = text == null ? "" : text;
        StringBuilder seg = new StringBuilder();
        for (int i = 0; i < s.length(); i++) {
            char ch = s.charAt(i);
            if (ch == '\t' || ch == '\n') {
                appendText(r, seg, textElement);
                r.addChild(XmlElement.w(ch == '\t' ? "tab" : "br"));
            } else {
                seg.append(ch);
            }
        }
        appendText(r, seg, textElement);
        return r;
    }

    private static void appendText(XmlElement r, StringBuilder seg, String textElement) {
        if (seg.length() == 0) return;
        XmlElement t = XmlElement.w(textElement);
        t.setAttribute(XmlElement.NS_XML, "space", "preserve");
        t.setText(seg.toString());
        r.addChild(t);
        seg.setLength(0);
    }
}
