package com.example.docxdiff;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RevisionStripperTest {

    private static XmlElement parse(String bodyInner) throws Exception {
        return PartCodec.parse(DocxFixtures.documentXml(bodyInner));
    }

    @Test
    void promotesWrapperChildrenInPlaceOfTheWrapper() throws Exception {
        XmlElement doc = parse("<w:p>"
                + "<w:r><w:t>a</w:t></w:r>"
                + "<w:ins w:id=\"7\"><w:r><w:t>b</w:t></w:r><w:r><w:t>c</w:t></w:r></w:ins>"
                + "<w:del w:id=\"8\"><w:r><w:delText>d</w:delText></w:r></w:del>"
                + "<w:r><w:t>e</w:t></w:r>"
                + "</w:p>");

        XmlElement p = RevisionStripper.strip(doc).child("body").child("p");

        assertEquals(List.of("r", "r", "r", "r", "r"), DocxFixtures.childNames(p));
        assertEquals("abce", ParagraphModel.textOf(p));
        assertEquals("d", p.getChildren().get(3).child("delText").getText());
    }

    @Test
    void nestedWrappersAreFlattened() throws Exception {
        XmlElement doc = parse("<w:p><w:moveTo><w:ins><w:r><w:t>x</w:t></w:r></w:ins></w:moveTo>"
                + "<w:moveFrom><w:r><w:t>y</w:t></w:r></w:moveFrom></w:p>");

        XmlElement stripped = RevisionStripper.strip(doc);

        assertFalse(RevisionStripper.hasTrackedChanges(stripped));
        assertEquals("xy", ParagraphModel.textOf(stripped.child("body").child("p")));
    }

    @Test
    void inputIsNotMutated() throws Exception {
        XmlElement doc = parse("<w:p><w:ins><w:r><w:t>x</w:t></w:r></w:ins></w:p>");
        XmlElement copy = doc.deepCopy();

        RevisionStripper.strip(doc);

        assertEquals(copy, doc);
        assertTrue(RevisionStripper.hasTrackedChanges(doc));
    }

    @Test
    void detectionIsStructuralNotTextual() throws Exception {
        XmlElement doc = parse(DocxFixtures.para("ins del moveTo"));
        assertFalse(RevisionStripper.hasTrackedChanges(doc));
    }
}
