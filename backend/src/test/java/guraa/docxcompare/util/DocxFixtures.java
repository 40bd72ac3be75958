package guraa.docxcompare.util;

import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.w3c.dom.Document;

import java.io.ByteArrayOutputStream;
import java.io.IOException;

/**
 * Builds WordprocessingML fragments and DOCX packages for tests.
 */
public final class DocxFixtures {

    private DocxFixtures() {
    }

    public static String paragraph(String text) {
        return "<w:p>" + run(text) + "</w:p>";
    }

    public static String boldParagraph(String text) {
        return "<w:p>" + run("<w:rPr><w:b/></w:rPr>", text) + "</w:p>";
    }

    public static String run(String text) {
        return run("", text);
    }

    public static String run(String runProperties, String text) {
        return "<w:r>" + runProperties + "<w:t xml:space=\"preserve\">" + escape(text) + "</w:t></w:r>";
    }

    public static String body(String... paragraphs) {
        return String.join("", paragraphs);
    }

    public static Document document(String... paragraphs) {
        return WmlXml.fromBodyXml(body(paragraphs));
    }

    /**
     * A real DOCX package whose main part body is {@code bodyXml}.
     */
    public static byte[] docx(String bodyXml) throws IOException {
        byte[] blank;
        try (XWPFDocument document = new XWPFDocument(); ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            document.createParagraph();
            document.write(out);
            blank = out.toByteArray();
        }
        return DocxPackage.replaceMainDocument(blank, WmlXml.fromBodyXml(bodyXml));
    }

    public static byte[] docxOf(String... paragraphs) throws IOException {
        return docx(body(paragraphs));
    }

    private static String escape(String text) {
        return text.replace("&", "&amp;").replace("<", "&lt;").replace(">", "&gt;");
    }
}
