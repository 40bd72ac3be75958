package guraa.docxcompare.core;

import guraa.docxcompare.util.WmlNodes;
import org.w3c.dom.Attr;
import org.w3c.dom.Element;
import org.w3c.dom.NamedNodeMap;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * SHA-1 fingerprints for atoms and for whole element subtrees.
 */
public final class AtomFingerprint {

    private AtomFingerprint() {
    }

    /**
     * Fingerprint of a content element: tag, sorted significant attributes and leaf text.
     * The xml:space hint and namespace declarations are not significant.
     */
    public static String compute(Element element) {
        StringBuilder input = new StringBuilder(element.getTagName());
        input.append('|');
        input.append(String.join(",", significantAttributes(element)));
        input.append('|');
        String text = WmlNodes.getLeafText(element);
        if (text != null) {
            input.append(text);
        }
        return sha1(input.toString());
    }

    /**
     * Fingerprint of a synthetic empty-paragraph atom.
     */
    public static String emptyParagraph(String lastContentHash, int emptyParagraphCount, Element paragraphProperties) {
        String context = lastContentHash != null ? lastContentHash : "document-start";
        String pPrHash = paragraphProperties != null ? deep(paragraphProperties) : "no-pPr";
        return sha1("empty-paragraph:" + context + ":" + emptyParagraphCount + ":" + pPrHash);
    }

    /**
     * Structural fingerprint of a subtree, used to compare run properties.
     */
    public static String deep(Element element) {
        StringBuilder input = new StringBuilder(element.getTagName());
        input.append('|');
        input.append(String.join(",", significantAttributes(element)));
        input.append('|');
        String text = WmlNodes.getLeafText(element);
        if (text != null) {
            input.append(text);
        }
        for (Element child : WmlNodes.childElements(element)) {
            input.append('[').append(deep(child)).append(']');
        }
        return sha1(input.toString());
    }

    public static boolean deepEquals(Element a, Element b) {
        if (a == null || b == null) {
            return a == b;
        }
        return deep(a).equals(deep(b));
    }

    public static String sha1(String input) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-1");
            byte[] hash = digest.digest(input.getBytes(StandardCharsets.UTF_8));

            StringBuilder hexString = new StringBuilder();
            for (byte b : hash) {
                String hex = Integer.toHexString(0xff & b);
                if (hex.length() == 1) {
                    hexString.append('0');
                }
                hexString.append(hex);
            }
            return hexString.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-1 is not available", e);
        }
    }

    private static List<String> significantAttributes(Element element) {
        List<String> result = new ArrayList<>();
        NamedNodeMap attributes = element.getAttributes();
        for (int i = 0; i < attributes.getLength(); i++) {
            Attr attr = (Attr) attributes.item(i);
            if (WmlNodes.XML_SPACE.equals(attr.getName()) || WmlNodes.isNamespaceDeclaration(attr)) {
                continue;
            }
            result.add(attr.getName() + "=" + attr.getValue());
        }
        Collections.sort(result);
        return result;
    }
}
