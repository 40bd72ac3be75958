package guraa.docxcompare.util;

import guraa.docxcompare.exception.MalformedDocumentException;
import org.w3c.dom.Document;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.transform.OutputKeys;
import javax.xml.transform.Transformer;
import javax.xml.transform.TransformerException;
import javax.xml.transform.TransformerFactory;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamResult;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;

/**
 * Parsing and serialization of WordprocessingML part content.
 */
public final class WmlXml {

    private WmlXml() {
    }

    public static Document parse(byte[] xml) {
        try {
            return newBuilder().parse(new ByteArrayInputStream(xml));
        } catch (SAXException | IOException e) {
            throw new MalformedDocumentException("Main document part is not well-formed XML: " + e.getMessage(), e);
        }
    }

    public static Document parse(String xml) {
        try {
            return newBuilder().parse(new InputSource(new StringReader(xml)));
        } catch (SAXException | IOException e) {
            throw new MalformedDocumentException("Main document part is not well-formed XML: " + e.getMessage(), e);
        }
    }

    public static byte[] serialize(Document document) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try {
            document.setXmlStandalone(true);
            Transformer transformer = TransformerFactory.newInstance().newTransformer();
            transformer.setOutputProperty(OutputKeys.ENCODING, StandardCharsets.UTF_8.name());
            transformer.setOutputProperty(OutputKeys.INDENT, "no");
            transformer.transform(new DOMSource(document), new StreamResult(out));
        } catch (TransformerException e) {
            throw new IllegalStateException("Failed to serialize document XML", e);
        }
        return out.toByteArray();
    }

    /**
     * Deep copy of a document, used where a tree must be mutated without touching the source.
     */
    public static Document copy(Document document) {
        Document copy = newBuilder().newDocument();
        copy.appendChild(copy.importNode(document.getDocumentElement(), true));
        return copy;
    }

    /**
     * Wrap body content in a minimal w:document, mostly for building documents in memory.
     */
    public static Document fromBodyXml(String bodyInnerXml) {
        return parse("<?xml version=\"1.0\" encoding=\"UTF-8\" standalone=\"yes\"?>"
                + "<w:document xmlns:w=\"" + WmlNodes.W_NS + "\"><w:body>"
                + bodyInnerXml
                + "</w:body></w:document>");
    }

    private static DocumentBuilder newBuilder() {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setNamespaceAware(true);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setExpandEntityReferences(false);
            return factory.newDocumentBuilder();
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML parser is not available", e);
        }
    }
}
