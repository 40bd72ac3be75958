package guraa.docxcompare.core;

import guraa.docxcompare.util.WmlNodes;
import guraa.docxcompare.util.WmlXml;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("AtomFingerprint Tests")
class AtomFingerprintTest {

    private static Element firstText(String bodyXml) {
        Document document = WmlXml.fromBodyXml(bodyXml);
        return WmlNodes.findAll(document.getDocumentElement(), WmlNodes.T).get(0);
    }

    @Test
    @DisplayName("Should give equal fingerprints for equal content in different documents")
    void shouldBeDeterministic_whenContentIsEqual() {
        Element a = firstText("<w:p><w:r><w:t>Hello</w:t></w:r></w:p>");
        Element b = firstText("<w:p><w:r><w:rPr><w:b/></w:rPr><w:t>Hello</w:t></w:r></w:p>");

        assertThat(AtomFingerprint.compute(a)).isEqualTo(AtomFingerprint.compute(b));
        assertThat(AtomFingerprint.compute(a)).hasSize(40);
    }

    @Test
    @DisplayName("Should ignore the xml:space hint")
    void shouldIgnoreSpacePreserve_whenComputingFingerprint() {
        Element plain = firstText("<w:p><w:r><w:t>Hello</w:t></w:r></w:p>");
        Element preserved = firstText("<w:p><w:r><w:t xml:space=\"preserve\">Hello</w:t></w:r></w:p>");

        assertThat(AtomFingerprint.compute(plain)).isEqualTo(AtomFingerprint.compute(preserved));
    }

    @Test
    @DisplayName("Should distinguish different text")
    void shouldDiffer_whenTextDiffers() {
        Element hello = firstText("<w:p><w:r><w:t>Hello</w:t></w:r></w:p>");
        Element help = firstText("<w:p><w:r><w:t>Help</w:t></w:r></w:p>");

        assertThat(AtomFingerprint.compute(hello)).isNotEqualTo(AtomFingerprint.compute(help));
    }

    @Test
    @DisplayName("Should compare property subtrees structurally")
    void shouldDeepCompare_whenPropertiesHaveSameStructure() {
        Document document = WmlXml.fromBodyXml(
                "<w:p><w:r><w:rPr><w:b/><w:sz w:val=\"24\"/></w:rPr><w:t>a</w:t></w:r>"
                        + "<w:r><w:rPr><w:b/><w:sz w:val=\"24\"/></w:rPr><w:t>b</w:t></w:r>"
                        + "<w:r><w:rPr><w:b/><w:sz w:val=\"28\"/></w:rPr><w:t>c</w:t></w:r></w:p>");
        List<Element> rPrs = WmlNodes.findAll(document.getDocumentElement(), WmlNodes.RPR);

        assertThat(AtomFingerprint.deepEquals(rPrs.get(0), rPrs.get(1))).isTrue();
        assertThat(AtomFingerprint.deepEquals(rPrs.get(0), rPrs.get(2))).isFalse();
        assertThat(AtomFingerprint.deepEquals(null, null)).isTrue();
        assertThat(AtomFingerprint.deepEquals(rPrs.get(0), null)).isFalse();
    }
}
