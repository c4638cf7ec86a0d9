package com.example.docxdiff;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * 去掉已有修订包装：ins / del / moveFrom / moveTo 被其子元素原位替换。
 * 被删除的 run 里是 delText 而不是 t，文本抽取只读 t，所以差异计算看到的是“全部接受”后的正文。
 */
public final class RevisionStripper {
    private RevisionStripper() {}

    static final Set<String> WRAPPERS = Set.of("ins", "del", "moveFrom", "moveTo");

    public static boolean isWrapper(XmlElement e) {
        return e != null && WRAPPERS.contains(e.getName());
    }

    /** 纯函数：返回新树，不改动入参；根元素本身不做替换（没有父节点可提升） */
    public static XmlElement strip(XmlElement root) {
        if (root == null) return null;
        XmlElement out = root.shallowCopy();
        out.addChildren(stripChildren(root));
        return out;
    }

    private static List<XmlElement> stripChildren(XmlElement parent) {
        List<XmlElement> out = new ArrayList<>();
        for (XmlElement c : parent.getChildren()) {
            if (isWrapper(c)) {
                out.addAll(stripChildren(c));
            } else {
                XmlElement copy = c.shallowCopy();
                copy.addChildren(stripChildren(c));
                out.add(copy);
            }
        }
        return out;
    }

    /** 结构化检测：任意层级出现修订包装即为 true */
    public static boolean hasTrackedChanges(XmlElement root) {
        if (root == null) return false;
        if (isWrapper(root)) return true;
        for (XmlElement c : root.getChildren()) {
            if (hasTrackedChanges(c)) return true;
        }
        return false;
    }
}
