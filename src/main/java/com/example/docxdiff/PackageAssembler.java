package com.example.docxdiff;

import org.apache.commons.compress.archivers.zip.ZipArchiveEntry;
import org.apache.commons.compress.archivers.zip.ZipArchiveOutputStream;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** 输出包：固定四个 part，不复制输入包里的其他内容 */
public final class PackageAssembler {
    private PackageAssembler() {}

    public static final String CONTENT_TYPES = "[Content_Types].xml";
    public static final String ROOT_RELS = "_rels/.rels";
    public static final String DOCUMENT = "word/document.xml";
    public static final String SETTINGS = "word/settings.xml";

    static final String NS_R = "http://schemas.openxmlformats.org/officeDocument/2006/relationships";

    public static final List<String> PART_ORDER = List.of(CONTENT_TYPES, ROOT_RELS, DOCUMENT, SETTINGS);

    static final String CONTENT_TYPES_XML = PartCodec.XML_DECL
        + "<Types xmlns=\"http://schemas.openxmlformats.org/package/2006/content-types\">"
        + "<Default Extension=\"rels\" ContentType=\"application/vnd.openxmlformats-package.relationships+xml\"/>"
        + "<Default Extension=\"xml\" ContentType=\"application/xml\"/>"
        + "<Override PartName=\"/word/document.xml\" ContentType=\"application/vnd.openxmlformats-officedocument.wordprocessingml.document.main+xml\"/>"
        + "<Override PartName=\"/word/settings.xml\" ContentType=\"application/vnd.openxmlformats-officedocument.wordprocessingml.settings+xml\"/>"
        + "</Types>";

    static final String ROOT_RELS_XML = PartCodec.XML_DECL
        + "<Relationships xmlns=\"http://schemas.openxmlformats.org/package/2006/relationships\">"
        + "<Relationship Id=\"rId1\" Type=\"http://schemas.openxmlformats.org/officeDocument/2006/relationships/officeDocument\" Target=\"word/document.xml\"/>"
        + "</Relationships>";

    /** settings：打开修订显示 */
    static XmlElement settings() {
        return XmlElement.w("settings").addChild(XmlElement.w("trackRevisions"));
    }

    /** body → w:document；body 没有节属性时补一个空 sectPr */
    public static XmlElement document(XmlElement body) {
        XmlElement b = body == null ? XmlElement.w("body") : body;
        if (b.child("sectPr") == null) b.addChild(XmlElement.w("sectPr"));
        return XmlElement.w("document").addChild(b);
    }

    /**
     * 输出包里没有 document.xml.rels：去掉 headerReference / footerReference，
     * 以及所有 r: 命名空间的属性（超链接、图片等的关系引用），否则是悬空引用。原地修改。
     */
    public static XmlElement detachRelationships(XmlElement e) {
        e.getChildren().removeIf(c -> c.is("headerReference") || c.is("footerReference"));
        for (String name : List.copyOf(e.getAttributes().keySet())) {
            if (NS_R.equals(e.attributeNamespace(name))) {
                e.getAttributes().remove(name);
                e.getAttributeNamespaces().remove(name);
            }
        }
        for (XmlElement c : e.getChildren()) detachRelationships(c);
        return e;
    }

    public static byte[] assemble(XmlElement documentRoot) throws IOException {
        Map<String, String> parts = new LinkedHashMap<>();
        parts.put(CONTENT_TYPES, CONTENT_TYPES_XML);
        parts.put(ROOT_RELS, ROOT_RELS_XML);
        parts.put(DOCUMENT, PartCodec.serialize(documentRoot));
        parts.put(SETTINGS, PartCodec.serialize(settings()));

        ByteArrayOutputStream bos = new ByteArrayOutputStream();
        try (ZipArchiveOutputStream zos = new ZipArchiveOutputStream(bos)) {
            for (Map.Entry<String, String> e : parts.entrySet()) {
                zos.putArchiveEntry(new ZipArchiveEntry(e.getKey()));
                zos.write(e.getValue().getBytes(StandardCharsets.UTF_8));
                zos.closeArchiveEntry();
            }
            zos.finish();
        }
        return bos.toByteArray();
    }
}
