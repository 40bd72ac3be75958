package guraa.docxcompare.util;

import guraa.docxcompare.exception.MalformedDocumentException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.w3c.dom.Document;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("DocxPackage Tests")
class DocxPackageTest {

    @Test
    @DisplayName("Should read back a replaced main document part")
    void shouldReadBackReplacedMainDocument_whenPartIsReplaced() throws Exception {
        byte[] docx = DocxFixtures.docxOf(DocxFixtures.paragraph("First"), DocxFixtures.paragraph("Second"));

        Document document = DocxPackage.readMainDocument(docx);

        assertThat(WmlNodes.findBody(document)).isNotNull();
        assertThat(WmlNodes.findAll(document.getDocumentElement(), WmlNodes.P)).hasSize(2);
        assertThat(document.getDocumentElement().getTextContent()).isEqualTo("FirstSecond");
    }

    @Test
    @DisplayName("Should reject bytes that are not a package")
    void shouldThrowMalformed_whenBytesAreNotAZipPackage() {
        byte[] notDocx = "plain text, not a package".getBytes(StandardCharsets.UTF_8);

        assertThatThrownBy(() -> DocxPackage.readMainDocument(notDocx))
                .isInstanceOf(MalformedDocumentException.class);
    }

    @Test
    @DisplayName("Should reject main part XML that does not parse")
    void shouldThrowMalformed_whenXmlIsNotWellFormed() {
        assertThatThrownBy(() -> WmlXml.parse("<w:document><w:body>"))
                .isInstanceOf(MalformedDocumentException.class);
    }
}
