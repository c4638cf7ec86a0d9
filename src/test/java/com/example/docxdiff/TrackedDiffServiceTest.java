package com.example.docxdiff;

import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TrackedDiffServiceTest {

    private TrackedDiffService service;

    @BeforeEach
    void setUp() {
        service = new TrackedDiffService(Clock.fixed(Instant.parse("2026-10-19T08:30:00Z"), ZoneOffset.UTC));
    }

    private DiffResult diff(byte[] base, byte[] revised) throws DocxDiffException {
        return service.diff(base, revised, "Reviewer", DiffOptions.defaults());
    }

    /** 段落子元素名，去掉 pPr */
    private static List<String> contentNames(XmlElement p) {
        List<String> out = new ArrayList<>(DocxFixtures.childNames(p));
        out.remove("pPr");
        return out;
    }

    @Nested
    @DisplayName("Paragraph diffs")
    class ParagraphDiffs {

        @Test
        void identicalDocumentsCarryNoRevisions() throws Exception {
            byte[] doc = DocxFixtures.docx("Hello world", "Second paragraph");

            DiffResult result = diff(doc, doc);

            XmlElement out = DocxFixtures.outputDocument(result.getBytes());
            assertTrue(DocxFixtures.revisionIds(out).isEmpty());
            assertTrue(result.getWarnings().isEmpty());
            List<XmlElement> paras = out.child("body").children("p");
            assertEquals(2, paras.size());
            assertEquals("Hello world", ParagraphModel.textOf(paras.get(0)));
            assertEquals(List.of("r"), contentNames(paras.get(0)));
            assertEquals(DocxFixtures.outputParagraphs(doc).get(0), paras.get(0));
        }

        @Test
        void replacedWordBecomesDeleteThenInsert() throws Exception {
            DiffResult result = diff(DocxFixtures.docx("The cat sat"), DocxFixtures.docx("The dog sat"));

            XmlElement p = DocxFixtures.outputParagraphs(result.getBytes()).get(0);
            assertEquals(List.of("r", "del", "ins", "r"), contentNames(p));
            assertEquals("cat", DocxFixtures.deletedText(p));
            assertEquals("dog", DocxFixtures.insertedText(p));
            assertEquals("The  sat", ParagraphModel.textOf(p));

            XmlElement del = p.child("del");
            assertEquals("Reviewer", del.attr("author"));
            assertEquals("2026-10-19T08:30:00Z", del.attr("date"));
        }

        @Test
        void appendedParagraphIsInsertedWithItsMark() throws Exception {
            DiffResult result = diff(DocxFixtures.docx("A"), DocxFixtures.docx("A", "B"));

            List<XmlElement> paras = DocxFixtures.outputParagraphs(result.getBytes());
            assertEquals(2, paras.size());
            XmlElement added = paras.get(1);
            assertEquals("B", DocxFixtures.insertedText(added));
            assertNotNull(added.child("pPr").child("rPr").child("ins"));
        }

        @Test
        void removedParagraphIsDeletedWithItsMark() throws Exception {
            DiffResult result = diff(DocxFixtures.docx("A", "B"), DocxFixtures.docx("A"));

            List<XmlElement> paras = DocxFixtures.outputParagraphs(result.getBytes());
            assertEquals(2, paras.size());
            assertEquals("B", DocxFixtures.deletedText(paras.get(1)));
            assertNotNull(paras.get(1).child("pPr").child("rPr").child("del"));
        }

        @Test
        void emptyParagraphOnlyGetsTheMark() throws Exception {
            DiffResult result = diff(DocxFixtures.docx("A"), DocxFixtures.docx("A", ""));

            XmlElement added = DocxFixtures.outputParagraphs(result.getBytes()).get(1);
            assertEquals(List.of("pPr"), DocxFixtures.childNames(added));
            assertNotNull(added.child("pPr").child("rPr").child("ins"));
        }

        @Test
        @DisplayName("Revision ids run 1..N across the whole document")
        void revisionIdsAreDocumentWide() throws Exception {
            DiffResult result = diff(DocxFixtures.docx("one two", "gone"), DocxFixtures.docx("one three"));

            assertEquals(List.of("1", "2", "3", "4"), DocxFixtures.revisionIds(DocxFixtures.outputDocument(result.getBytes())));
        }

        @Test
        void whitespaceOnlyChangesAreSuppressedByDefault() throws Exception {
            byte[] base = DocxFixtures.docx("Hello  world");
            byte[] revised = DocxFixtures.docx(" Hello world ");

            XmlElement quiet = DocxFixtures.outputDocument(diff(base, revised).getBytes());
            assertTrue(DocxFixtures.revisionIds(quiet).isEmpty());
            assertEquals(" Hello world ", ParagraphModel.textOf(quiet.child("body").child("p")));

            DiffOptions strict = DiffOptions.builder().suppressWhitespaceOnly(false).build();
            XmlElement loud = DocxFixtures.outputDocument(service.diff(base, revised, "Reviewer", strict).getBytes());
            assertFalse(DocxFixtures.revisionIds(loud).isEmpty());
        }

        @Test
        void characterGranularityMarksSingleLetters() throws Exception {
            DiffOptions options = DiffOptions.builder().granularity(Granularity.CHAR).build();
            DiffResult result = service.diff(DocxFixtures.docx("cat"), DocxFixtures.docx("cut"), "Reviewer", options);

            XmlElement p = DocxFixtures.outputParagraphs(result.getBytes()).get(0);
            assertEquals(List.of("r", "del", "ins", "r"), contentNames(p));
            assertEquals("a", DocxFixtures.deletedText(p));
            assertEquals("u", DocxFixtures.insertedText(p));
        }

        @Test
        void paragraphOverTokenCapIsReplacedWholesale() throws Exception {
            DiffOptions options = DiffOptions.builder()
                    .limits(ResourceLimits.defaults().toBuilder().maxTokensPerParagraph(3).build())
                    .build();
            DiffResult result = service.diff(DocxFixtures.docx("a b c d"), DocxFixtures.docx("a b c e"), "Reviewer", options);

            assertEquals(List.of("Paragraph 1 exceeds 3 tokens; diffed as a whole"), result.getWarnings());
            XmlElement p = DocxFixtures.outputParagraphs(result.getBytes()).get(0);
            assertEquals(List.of("del", "ins"), contentNames(p));
            assertEquals("a b c d", DocxFixtures.deletedText(p));
            assertEquals("a b c e", DocxFixtures.insertedText(p));
        }

        @Test
        void blankAuthorFallsBackToDefault() throws Exception {
            DiffResult result = service.diff(DocxFixtures.docx("x"), DocxFixtures.docx("y"), "  ", null);
            XmlElement p = DocxFixtures.outputParagraphs(result.getBytes()).get(0);
            assertEquals("AutoDiff", p.child("ins").attr("author"));
        }
    }

    @Nested
    @DisplayName("Document structure")
    class DocumentStructure {

        private final String hyperlinked = "<w:p><w:r><w:t xml:space=\"preserve\">See </w:t></w:r>"
                + "<w:hyperlink w:anchor=\"docs\"><w:r><w:rPr><w:rStyle w:val=\"Hyperlink\"/></w:rPr><w:t>%s</w:t></w:r></w:hyperlink>"
                + "<w:r><w:t xml:space=\"preserve\"> for more</w:t></w:r></w:p>";

        private String table(String left, String right) {
            return "<w:tbl><w:tblPr/><w:tblGrid><w:gridCol w:w=\"2000\"/><w:gridCol w:w=\"2000\"/></w:tblGrid>"
                    + "<w:tr><w:tc>" + DocxFixtures.para(left) + "</w:tc><w:tc>" + DocxFixtures.para(right) + "</w:tc></w:tr></w:tbl>";
        }

        private String textBoxHost(String boxed) {
            return "<w:p><w:r><w:t>host</w:t></w:r><w:r><w:pict><v:shape xmlns:v=\"urn:schemas-microsoft-com:vml\"><v:textbox>"
                    + "<w:txbxContent>" + DocxFixtures.para(boxed) + "</w:txbxContent></v:textbox></v:shape></w:pict></w:r></w:p>";
        }

        private XmlElement body(String baseBody, String revisedBody) throws Exception {
            byte[] base = DocxFixtures.rawDocx(DocxFixtures.documentXml(baseBody));
            byte[] revised = DocxFixtures.rawDocx(DocxFixtures.documentXml(revisedBody));
            return DocxFixtures.outputDocument(diff(base, revised).getBytes()).child("body");
        }

        @Test
        void unchangedTableKeepsItsStructure() throws Exception {
            String doc = DocxFixtures.para("intro") + table("left", "right");

            XmlElement body = body(doc, doc);

            assertEquals(List.of("p", "tbl", "sectPr"), DocxFixtures.childNames(body));
            List<XmlElement> cells = body.child("tbl").child("tr").children("tc");
            assertEquals(2, cells.size());
            assertEquals("right", ParagraphModel.textOf(cells.get(1).child("p")));
            assertNotNull(body.child("tbl").child("tblGrid"));
            assertTrue(DocxFixtures.revisionIds(body).isEmpty());
        }

        @Test
        void editInsideTableCellIsTrackedInPlace() throws Exception {
            XmlElement body = body(DocxFixtures.para("intro") + table("left", "right"),
                    DocxFixtures.para("intro") + table("left", "wrong"));

            assertEquals(List.of("p", "tbl", "sectPr"), DocxFixtures.childNames(body));
            XmlElement cell = body.child("tbl").child("tr").children("tc").get(1).child("p");
            assertEquals("right", DocxFixtures.deletedText(cell));
            assertEquals("wrong", DocxFixtures.insertedText(cell));
            assertEquals(List.of("1", "2"), DocxFixtures.revisionIds(body));
        }

        @Test
        void textBoxStaysInsideItsHostParagraph() throws Exception {
            XmlElement body = body(textBoxHost("boxed old"), textBoxHost("boxed new"));

            assertEquals(List.of("p", "sectPr"), DocxFixtures.childNames(body));
            XmlElement host = body.child("p");
            assertEquals("host", ParagraphModel.textOf(host));
            XmlElement drawingRun = host.children("r").get(1);
            XmlElement boxed = drawingRun.child("pict").child("shape").child("textbox").child("txbxContent").child("p");
            assertEquals("old", DocxFixtures.deletedText(boxed));
            assertEquals("new", DocxFixtures.insertedText(boxed));
        }

        @Test
        void editedHostParagraphKeepsItsDrawingRun() throws Exception {
            XmlElement body = body(textBoxHost("boxed"), textBoxHost("boxed").replace(">host<", ">guest<"));

            XmlElement host = body.child("p");
            assertEquals("host", DocxFixtures.deletedText(host));
            assertEquals("guest", DocxFixtures.insertedText(host));
            XmlElement drawingRun = host.children("r").stream().filter(r -> r.child("pict") != null).findFirst().orElseThrow();
            assertNotNull(drawingRun.child("pict").child("shape").child("textbox").child("txbxContent").child("p"));
        }

        @Test
        void unchangedHyperlinkKeepsTextOrder() throws Exception {
            String doc = String.format(hyperlinked, "the docs");

            XmlElement p = body(doc, doc).child("p");

            assertEquals(List.of("r", "hyperlink", "r"), DocxFixtures.childNames(p));
            assertEquals("See the docs for more", ParagraphModel.textOf(p));
        }

        @Test
        void editInsideHyperlinkIsTracked() throws Exception {
            XmlElement body = body(String.format(hyperlinked, "old"), String.format(hyperlinked, "new"));

            XmlElement p = body.child("p");
            assertEquals(List.of("r", "del", "ins", "r"), DocxFixtures.childNames(p));
            assertEquals("old", DocxFixtures.deletedText(p));
            assertEquals("new", DocxFixtures.insertedText(p));
            assertEquals(List.of("1", "2"), DocxFixtures.revisionIds(body));
        }

        @Test
        void unchangedParagraphKeepsRunFormatting() throws Exception {
            String doc = "<w:p><w:r><w:t xml:space=\"preserve\">plain </w:t></w:r>"
                    + "<w:r><w:rPr><w:b/></w:rPr><w:t>bold</w:t></w:r></w:p>";
            byte[] docx = DocxFixtures.rawDocx(DocxFixtures.documentXml(doc));

            for (boolean suppress : new boolean[]{true, false}) {
                DiffOptions options = DiffOptions.builder().suppressWhitespaceOnly(suppress).build();
                XmlElement p = DocxFixtures.outputParagraphs(service.diff(docx, docx, "Reviewer", options).getBytes()).get(0);

                List<XmlElement> runs = p.children("r");
                assertEquals(2, runs.size(), "suppressWhitespaceOnly=" + suppress);
                assertNull(runs.get(0).child("rPr"));
                assertNotNull(runs.get(1).child("rPr").child("b"));
            }
        }

        @Test
        void leftoverDeletedRunsAreDropped() throws Exception {
            String tracked = "<w:p><w:del w:id=\"3\" w:author=\"x\"><w:r><w:delText>gone</w:delText></w:r></w:del>"
                    + "<w:r><w:t>kept</w:t></w:r></w:p>";

            XmlElement body = body(DocxFixtures.para("kept"), tracked);

            XmlElement p = body.child("p");
            assertEquals(List.of("r"), DocxFixtures.childNames(p));
            assertEquals("kept", ParagraphModel.textOf(p));
            assertTrue(DocxFixtures.revisionIds(body).isEmpty());
        }

        @Test
        void removedParagraphsGoBeforeSectionProperties() throws Exception {
            String sectPr = "<w:sectPr><w:pgSz w:w=\"11906\"/></w:sectPr>";

            XmlElement body = body(DocxFixtures.para("a") + DocxFixtures.para("b") + sectPr, DocxFixtures.para("a") + sectPr);

            assertEquals(List.of("p", "p", "sectPr"), DocxFixtures.childNames(body));
            assertEquals("b", DocxFixtures.deletedText(body.children("p").get(1)));
        }
    }

    @Nested
    @DisplayName("Existing revisions")
    class ExistingRevisions {

        private final String trackedBody = "<w:p><w:r><w:t xml:space=\"preserve\">Hi </w:t></w:r>"
                + "<w:ins w:id=\"41\" w:author=\"Someone\" w:date=\"2020-01-01T00:00:00Z\"><w:r><w:t>there</w:t></w:r></w:ins></w:p>";

        @Test
        void failPolicyRejectsTrackedRevised() throws Exception {
            DiffOptions options = DiffOptions.builder().existingTrackedRevisions(TrackedRevisionsPolicy.FAIL).build();
            byte[] revised = DocxFixtures.rawDocx(DocxFixtures.documentXml(trackedBody));

            PolicyViolationException e = assertThrows(PolicyViolationException.class,
                    () -> service.diff(DocxFixtures.docx("Hi"), revised, "Reviewer", options));
            assertEquals("Revised document contains tracked revisions", e.getMessage());
        }

        @Test
        void ignorePolicyDiffsTheAcceptedText() throws Exception {
            byte[] base = DocxFixtures.rawDocx(DocxFixtures.documentXml(DocxFixtures.para("Hi ")));
            byte[] revised = DocxFixtures.rawDocx(DocxFixtures.documentXml(trackedBody));

            DiffResult result = diff(base, revised);

            XmlElement out = DocxFixtures.outputDocument(result.getBytes());
            XmlElement p = out.child("body").child("p");
            assertEquals("there", DocxFixtures.insertedText(p));
            assertEquals(List.of("1"), DocxFixtures.revisionIds(out));
            assertEquals("Reviewer", p.child("ins").attr("author"));
        }
    }

    @Nested
    @DisplayName("Package handling")
    class PackageHandling {

        @Test
        void missingDocumentPartIsFatal() throws Exception {
            byte[] noDocument = DocxFixtures.rawDocx(null);

            MissingPartException e = assertThrows(MissingPartException.class, () -> diff(noDocument, DocxFixtures.docx("x")));
            assertEquals("Missing word/document.xml in base DOCX", e.getMessage());
        }

        @Test
        void malformedDocumentFallsBackToEmptyBody() throws Exception {
            byte[] broken = DocxFixtures.rawDocx("<w:document xmlns:w=\"" + XmlElement.NS_W + "\"><w:body>");

            DiffResult result = diff(broken, DocxFixtures.docx("new text"));

            assertEquals(List.of("Malformed word/document.xml in base; used empty fallback"), result.getWarnings());
            XmlElement p = DocxFixtures.outputParagraphs(result.getBytes()).get(0);
            assertEquals("new text", DocxFixtures.insertedText(p));
        }

        @Test
        void corruptArchiveIsRejected() {
            byte[] garbage = "PK not really".getBytes(StandardCharsets.UTF_8);
            assertThrows(ArchiveException.class, () -> diff(garbage, garbage));
        }

        @Test
        void headerFooterFlagOnlyWarns() throws Exception {
            byte[] withHeader = DocxFixtures.rawDocx(DocxFixtures.documentXml(DocxFixtures.para("x")), "word/header1.xml");

            assertTrue(diff(withHeader, withHeader).getWarnings().isEmpty());

            DiffOptions options = DiffOptions.builder().includeHeadersFooters(true).build();
            DiffResult result = service.diff(withHeader, withHeader, "Reviewer", options);
            assertEquals(1, result.getWarnings().size());
            assertTrue(result.getWarnings().get(0).startsWith("Header/footer parts"));
        }

        @Test
        void sectionPropertiesComeFromRevisedWithoutReferences() throws Exception {
            String sectPr = "<w:sectPr xmlns:r=\"" + PackageAssembler.NS_R + "\">"
                    + "<w:headerReference w:type=\"default\" r:id=\"rId7\"/><w:pgSz w:w=\"11906\" w:h=\"16838\"/></w:sectPr>";
            byte[] revised = DocxFixtures.rawDocx(DocxFixtures.documentXml(DocxFixtures.para("x") + sectPr));

            XmlElement body = DocxFixtures.outputDocument(diff(DocxFixtures.docx("x"), revised).getBytes()).child("body");

            XmlElement out = body.child("sectPr");
            assertEquals(List.of("pgSz"), DocxFixtures.childNames(out));
            assertEquals("11906", out.child("pgSz").attr("w"));
            assertEquals("sectPr", body.getChildren().get(body.getChildren().size() - 1).getName());
        }

        @Test
        void outputOpensInPoi() throws Exception {
            DiffResult result = diff(DocxFixtures.docx("The cat sat", "gone"), DocxFixtures.docx("The dog sat"));

            try (XWPFDocument doc = new XWPFDocument(new ByteArrayInputStream(result.getBytes()))) {
                assertEquals(2, doc.getParagraphs().size());
            }
        }
    }
}
