package guraa.docxcompare.util;

import guraa.docxcompare.exception.MalformedDocumentException;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.UnsupportedFileFormatException;
import org.apache.commons.io.IOUtils;
import org.apache.poi.openxml4j.exceptions.InvalidFormatException;
import org.apache.poi.openxml4j.exceptions.InvalidOperationException;
import org.apache.poi.openxml4j.opc.OPCPackage;
import org.apache.poi.openxml4j.opc.PackagePart;
import org.apache.poi.openxml4j.opc.PackageRelationship;
import org.apache.poi.openxml4j.opc.PackageRelationshipCollection;
import org.apache.poi.openxml4j.opc.PackageRelationshipTypes;
import org.w3c.dom.Document;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;

/**
 * Reads the main document part out of a DOCX container and writes a replacement
 * main part into a copy of a container. Everything else in the package is left untouched.
 */
@Slf4j
public final class DocxPackage {

    private DocxPackage() {
    }

    /**
     * Load and parse the main document part.
     *
     * @param docx package bytes
     * @return parsed main part
     * @throws IOException if the container cannot be read
     */
    public static Document readMainDocument(byte[] docx) throws IOException {
        OPCPackage pkg = open(docx);
        try {
            PackagePart part = mainPart(pkg);
            byte[] xml;
            try (InputStream in = part.getInputStream()) {
                xml = IOUtils.toByteArray(in);
            }
            log.debug("Read main document part {} ({} bytes)", part.getPartName().getName(), xml.length);
            return WmlXml.parse(xml);
        } finally {
            pkg.revert();
        }
    }

    /**
     * Produce a new package equal to {@code docx} with its main document part replaced.
     *
     * @param docx     source package bytes
     * @param document new main part content
     * @return new package bytes
     * @throws IOException if the container cannot be read or written
     */
    public static byte[] replaceMainDocument(byte[] docx, Document document) throws IOException {
        byte[] xml = WmlXml.serialize(document);
        OPCPackage pkg = open(docx);
        try {
            PackagePart part = mainPart(pkg);
            try (OutputStream out = part.getOutputStream()) {
                out.write(xml);
            }
            ByteArrayOutputStream result = new ByteArrayOutputStream();
            pkg.save(result);
            return result.toByteArray();
        } finally {
            pkg.revert();
        }
    }

    private static OPCPackage open(byte[] docx) throws IOException {
        try {
            return OPCPackage.open(new ByteArrayInputStream(docx));
        } catch (InvalidFormatException | InvalidOperationException | UnsupportedFileFormatException e) {
            throw new MalformedDocumentException("Not a valid DOCX package: " + e.getMessage(), e);
        }
    }

    private static PackagePart mainPart(OPCPackage pkg) {
        PackageRelationshipCollection relationships =
                pkg.getRelationshipsByType(PackageRelationshipTypes.CORE_DOCUMENT);
        if (relationships == null || relationships.size() == 0) {
            throw new MalformedDocumentException("Package has no main document part");
        }
        PackageRelationship relationship = relationships.getRelationship(0);
        PackagePart part = pkg.getPart(relationship);
        if (part == null) {
            throw new MalformedDocumentException("Main document part is missing: " + relationship.getTargetURI());
        }
        return part;
    }
}
