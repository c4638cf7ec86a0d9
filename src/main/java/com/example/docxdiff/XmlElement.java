package com.example.docxdiff;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.*;

/**
 * XML part 的元素树节点。名字只保存本地名（前缀丢弃），命名空间 URI 仅用于序列化。
 * 子元素一律按出现顺序存为列表，同名只出现一次也是单元素列表；
 * 文本只存在于叶子元素的 text 槽里，与属性、子元素分开。
 */
@Getter
@EqualsAndHashCode
@ToString
public final class XmlElement {

    public static final String NS_W = "http://schemas.openxmlformats.org/wordprocessingml/2006/main";
    public static final String NS_XML = "http://www.w3.org/XML/1998/namespace";

    private final String name;
    private final String namespace;
    private final Map<String, String> attributes = new LinkedHashMap<>();
    private final Map<String, String> attributeNamespaces = new LinkedHashMap<>();
    private final List<XmlElement> children = new ArrayList<>();
    private String text;

    public XmlElement(String namespace, String name) {
        if (name == null || name.isEmpty()) throw new IllegalArgumentException("element name is empty");
        this.namespace = namespace == null ? "" : namespace;
        this.name = name;
    }

    /** WordprocessingML 命名空间下的元素 */
    public static XmlElement w(String name) {
        return new XmlElement(NS_W, name);
    }

    public boolean is(String localName) {
        return name.equals(localName);
    }

    public String attr(String localName) {
        return attributes.get(localName);
    }

    /** 属性默认与元素同命名空间（w:id、w:author …） */
    public XmlElement setAttribute(String localName, String value) {
        return setAttribute(namespace, localName, value);
    }

    public XmlElement setAttribute(String ns, String localName, String value) {
        attributes.put(localName, value == null ? "" : value);
        attributeNamespaces.put(localName, ns == null ? "" : ns);
        return this;
    }

    public String attributeNamespace(String localName) {
        return attributeNamespaces.getOrDefault(localName, namespace);
    }

    public XmlElement addChild(XmlElement child) {
        if (text != null) throw new IllegalStateException("<" + name + "> already carries text");
        children.add(Objects.requireNonNull(child));
        return this;
    }

    public XmlElement addChildren(Collection<XmlElement> cs) {
        for (XmlElement c : cs) addChild(c);
        return this;
    }

    /** 第一个同名子元素，没有则 null */
    public XmlElement child(String localName) {
        for (XmlElement c : children) if (c.is(localName)) return c;
        return null;
    }

    public List<XmlElement> children(String localName) {
        List<XmlElement> out = new ArrayList<>();
        for (XmlElement c : children) if (c.is(localName)) out.add(c);
        return out;
    }

    public XmlElement setText(String value) {
        if (value != null && !value.isEmpty() && !children.isEmpty()) {
            throw new IllegalStateException("<" + name + "> has child elements; text is only stored on leaves");
        }
        this.text = (value == null || value.isEmpty()) ? null : value;
        return this;
    }

    public boolean isLeaf() {
        return children.isEmpty();
    }

    /** 复制名字、属性和文本，不含子元素 */
    public XmlElement shallowCopy() {
        XmlElement e = new XmlElement(namespace, name);
        for (Map.Entry<String, String> a : attributes.entrySet()) {
            e.setAttribute(attributeNamespace(a.getKey()), a.getKey(), a.getValue());
        }
        e.text = text;
        return e;
    }

    public XmlElement deepCopy() {
        XmlElement e = shallowCopy();
        for (XmlElement c : children) e.children.add(c.deepCopy());
        return e;
    }
}
