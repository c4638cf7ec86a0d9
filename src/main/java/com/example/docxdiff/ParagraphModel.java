package com.example.docxdiff;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/** 正文段落的收集与文本抽取 */
public final class ParagraphModel {
    private ParagraphModel() {}

    /** 按文档顺序收集 body 下的段落；表格、文本框、编号段落是否参与由 options 决定 */
    public static List<XmlElement> paragraphsOf(XmlElement documentRoot, DiffOptions options) {
        List<XmlElement> out = new ArrayList<>();
        if (documentRoot == null) return out;
        XmlElement body = documentRoot.is("body") ? documentRoot : documentRoot.child("body");
        if (body == null) return out;
        collect(body, options == null ? DiffOptions.defaults() : options, out);
        return out;
    }

    public static List<XmlElement> paragraphsOf(XmlElement documentRoot) {
        return paragraphsOf(documentRoot, DiffOptions.defaults());
    }

    private static void collect(XmlElement container, DiffOptions options, List<XmlElement> out) {
        for (XmlElement c : container.getChildren()) {
            if (c.is("p")) {
                collectParagraph(c, options, out);
            } else if (c.is("tbl")) {
                if (!options.includeTables) continue;
                for (XmlElement tr : c.children("tr"))
                    for (XmlElement tc : tr.children("tc"))
                        collect(tc, options, out);
            } else if (c.is("sdt")) {
                XmlElement content = c.child("sdtContent");
                if (content != null) collect(content, options, out);
            }
        }
    }

    private static void collectParagraph(XmlElement p, DiffOptions options, List<XmlElement> out) {
        if (!options.includeLists && isListItem(p)) return;
        out.add(p);
        if (options.includeTextBoxes) {
            List<XmlElement> boxes = new ArrayList<>();
            findTextBoxes(p, boxes);
            for (XmlElement box : boxes) collect(box, options, out);
        }
    }

    /** 找到最外层的 txbxContent；AlternateContent 只看第一个 Choice，Fallback 是同一文本框的 VML 副本 */
    private static void findTextBoxes(XmlElement node, List<XmlElement> out) {
        for (XmlElement c : node.getChildren()) {
            if (c.is("txbxContent")) {
                out.add(c);
            } else if (c.is("AlternateContent")) {
                XmlElement choice = c.child("Choice");
                if (choice != null) findTextBoxes(choice, out);
            } else {
                findTextBoxes(c, out);
            }
        }
    }

    public static boolean isListItem(XmlElement p) {
        XmlElement pPr = p.child("pPr");
        return pPr != null && pPr.child("numPr") != null;
    }

    /** 承载 run 的行内容器：超链接、智能标记、简单域、行内内容控件等 */
    static final Set<String> INLINE_CONTAINERS =
            Set.of("hyperlink", "smartTag", "fldSimple", "customXml", "sdt", "sdtContent", "bdo", "dir");

    /** run 中计入段落文本的子元素 */
    static final Set<String> TEXT_PARTS = Set.of("t", "tab", "br", "cr", "softHyphen", "noBreakHyphen");

    public static boolean isInlineContainer(XmlElement e) {
        return e != null && INLINE_CONTAINERS.contains(e.getName());
    }

    /** 段落内按文档顺序的 run，包括行内容器里的 run；不进入 run 内部（文本框段落单独收集） */
    public static List<XmlElement> runsOf(XmlElement p) {
        List<XmlElement> out = new ArrayList<>();
        if (p != null) collectRuns(p, out);
        return out;
    }

    private static void collectRuns(XmlElement container, List<XmlElement> out) {
        for (XmlElement c : container.getChildren()) {
            if (c.is("r")) out.add(c);
            else if (isInlineContainer(c)) collectRuns(c, out);
        }
    }

    /** run 或行内容器里是否有计入文本的内容 */
    public static boolean carriesText(XmlElement e) {
        if (e == null) return false;
        if (e.is("r")) {
            for (XmlElement c : e.getChildren()) if (TEXT_PARTS.contains(c.getName())) return true;
            return false;
        }
        if (isInlineContainer(e)) {
            for (XmlElement c : e.getChildren()) if (carriesText(c)) return true;
        }
        return false;
    }

    /** 段落的纯文本：按文档顺序拼接所有 run 的文本 */
    public static String textOf(XmlElement p) {
        StringBuilder sb = new StringBuilder();
        for (XmlElement r : runsOf(p)) appendRunText(r, sb);
        return sb.toString();
    }

    static void appendRunText(XmlElement r, StringBuilder sb) {
        for (XmlElement c : r.getChildren()) {
            String ln = c.getName();
            if ("t".equals(ln)) {
                if (c.getText() != null) sb.append(c.getText());
            } else if ("tab".equals(ln)) {
                sb.append('\t');
            } else if ("br".equals(ln) || "cr".equals(ln)) {
                sb.append('\n');
            } else if ("softHyphen".equals(ln)) {
                sb.append('\u00AD');
            } else if ("noBreakHyphen".equals(ln)) {
                sb.append('\u2011');
            }
        }
    }

    /** 第一个 run 的 rPr，作为合成 run 的格式模板 */
    public static XmlElement firstRunProperties(XmlElement p) {
        List<XmlElement> runs = runsOf(p);
        return runs.isEmpty() ? null : runs.get(0).child("rPr");
    }
}
