package com.example.docxdiff;

import org.apache.xmlbeans.XmlCursor;
import org.apache.xmlbeans.XmlException;
import org.apache.xmlbeans.XmlObject;
import org.apache.xmlbeans.XmlOptions;

import javax.xml.namespace.QName;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

/** XML part ⇄ {@link XmlElement}；读写都走 XmlBeans 的 XmlCursor */
public final class PartCodec {
    private PartCodec() {}

    public static final String XML_DECL = "<?xml version=\"1.0\" encoding=\"UTF-8\" standalone=\"yes\"?>\n";

    private static final String NS_XMLNS = "http://www.w3.org/2000/xmlns/";

    private static final Map<String, String> PREFIXES = new LinkedHashMap<>();
    static {
        PREFIXES.put(XmlElement.NS_W, "w");
        PREFIXES.put("http://schemas.openxmlformats.org/officeDocument/2006/relationships", "r");
        PREFIXES.put("http://schemas.openxmlformats.org/drawingml/2006/wordprocessingDrawing", "wp");
        PREFIXES.put("http://schemas.openxmlformats.org/drawingml/2006/main", "a");
        PREFIXES.put("http://schemas.openxmlformats.org/drawingml/2006/picture", "pic");
        PREFIXES.put("http://schemas.openxmlformats.org/markup-compatibility/2006", "mc");
        PREFIXES.put("http://schemas.microsoft.com/office/word/2010/wordml", "w14");
        PREFIXES.put("http://schemas.microsoft.com/office/word/2010/wordprocessingShape", "wps");
        PREFIXES.put("urn:schemas-microsoft-com:vml", "v");
        PREFIXES.put("urn:schemas-microsoft-com:office:office", "o");
        PREFIXES.put("http://schemas.openxmlformats.org/officeDocument/2006/math", "m");
    }

    public static XmlElement parse(byte[] xml) throws XmlException {
        if (xml == null || xml.length == 0) throw new XmlException("empty part");
        try {
            return fromDocument(XmlObject.Factory.parse(new ByteArrayInputStream(xml), loadOptions()));
        } catch (IOException e) {
            throw new XmlException(e.getMessage(), e);
        }
    }

    public static XmlElement parse(String xml) throws XmlException {
        if (xml == null || xml.trim().isEmpty()) throw new XmlException("empty part");
        return fromDocument(XmlObject.Factory.parse(xml, loadOptions()));
    }

    /** 序列化为带 XML 声明的文本；元素之间不保留格式空白 */
    public static String serialize(XmlElement root) {
        XmlObject doc = XmlObject.Factory.newInstance();
        try (XmlCursor c = doc.newCursor()) {
            c.toNextToken();
            write(c, root);
        }
        XmlOptions o = new XmlOptions();
        o.setSaveSuggestedPrefixes(PREFIXES);
        o.setSaveAggressiveNamespaces();
        return XML_DECL + doc.xmlText(o);
    }

    private static XmlOptions loadOptions() {
        XmlOptions o = new XmlOptions();
        o.setDisallowDocTypeDeclaration(true);
        return o;
    }

    private static XmlElement fromDocument(XmlObject doc) throws XmlException {
        try (XmlCursor cur = doc.newCursor()) {
            if (!cur.toFirstChild()) throw new XmlException("part has no root element");
            return read(cur);
        }
    }

    /** 游标停在元素 START 上；返回时游标仍在该元素 */
    private static XmlElement read(XmlCursor cur) {
        QName qn = cur.getName();
        XmlElement e = new XmlElement(qn.getNamespaceURI(), qn.getLocalPart());

        if (cur.toFirstAttribute()) {
            do {
                QName an = cur.getName();
                if (NS_XMLNS.equals(an.getNamespaceURI()) || "xmlns".equals(an.getLocalPart())) continue;
                e.setAttribute(an.getNamespaceURI(), an.getLocalPart(), cur.getTextValue());
            } while (cur.toNextAttribute());
            cur.toParent();
        }

        if (cur.toFirstChild()) {
            do { e.addChild(read(cur)); } while (cur.toNextSibling());
            cur.toParent();
        } else {
            e.setText(cur.getTextValue());
        }
        return e;
    }

    /** beginElement 之后游标在新元素内部；写完内容用 toNextToken 跳出 END */
    private static void write(XmlCursor c, XmlElement e) {
        c.beginElement(new QName(e.getNamespace(), e.getName()));
        for (Map.Entry<String, String> a : e.getAttributes().entrySet()) {
            String ns = e.attributeNamespace(a.getKey());
            QName an = XmlElement.NS_XML.equals(ns) ? new QName(ns, a.getKey(), "xml") : new QName(ns, a.getKey());
            c.insertAttributeWithValue(an, a.getValue());
        }
        for (XmlElement child : e.getChildren()) write(c, child);
        if (e.getText() != null) c.insertChars(e.getText());
        c.toNextToken();
    }
}
