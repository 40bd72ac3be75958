package guraa.docxcompare.util;

import org.w3c.dom.Attr;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NamedNodeMap;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

import java.util.ArrayList;
import java.util.List;

/**
 * Helpers for working with WordprocessingML elements through the DOM.
 * Elements are identified by their qualified tag name ("w:t", "w:r", ...).
 */
public final class WmlNodes {

    public static final String W_NS = "http://schemas.openxmlformats.org/wordprocessingml/2006/main";
    public static final String XML_NS = "http://www.w3.org/XML/1998/namespace";

    public static final String BODY = "w:body";
    public static final String P = "w:p";
    public static final String PPR = "w:pPr";
    public static final String R = "w:r";
    public static final String RPR = "w:rPr";
    public static final String T = "w:t";
    public static final String DEL_TEXT = "w:delText";
    public static final String INSTR_TEXT = "w:instrText";
    public static final String DEL_INSTR_TEXT = "w:delInstrText";
    public static final String BR = "w:br";
    public static final String CR = "w:cr";
    public static final String TAB = "w:tab";
    public static final String FLD_CHAR = "w:fldChar";
    public static final String INS = "w:ins";
    public static final String DEL = "w:del";
    public static final String MOVE_FROM = "w:moveFrom";
    public static final String MOVE_TO = "w:moveTo";
    public static final String MOVE_FROM_RANGE_START = "w:moveFromRangeStart";
    public static final String MOVE_FROM_RANGE_END = "w:moveFromRangeEnd";
    public static final String MOVE_TO_RANGE_START = "w:moveToRangeStart";
    public static final String MOVE_TO_RANGE_END = "w:moveToRangeEnd";
    public static final String RPR_CHANGE = "w:rPrChange";
    public static final String PPR_CHANGE = "w:pPrChange";
    public static final String BOOKMARK_START = "w:bookmarkStart";
    public static final String BOOKMARK_END = "w:bookmarkEnd";
    public static final String SECT_PR = "w:sectPr";

    public static final String ATTR_ID = "w:id";
    public static final String ATTR_NAME = "w:name";
    public static final String ATTR_AUTHOR = "w:author";
    public static final String ATTR_DATE = "w:date";
    public static final String XML_SPACE = "xml:space";

    private WmlNodes() {
    }

    public static String tag(Element element) {
        return element.getTagName();
    }

    public static boolean hasTag(Node node, String tagName) {
        return node instanceof Element && tagName.equals(((Element) node).getTagName());
    }

    public static List<Element> childElements(Element parent) {
        List<Element> result = new ArrayList<>();
        for (Node child = parent.getFirstChild(); child != null; child = child.getNextSibling()) {
            if (child.getNodeType() == Node.ELEMENT_NODE) {
                result.add((Element) child);
            }
        }
        return result;
    }

    public static Element findChild(Element parent, String tagName) {
        for (Node child = parent.getFirstChild(); child != null; child = child.getNextSibling()) {
            if (hasTag(child, tagName)) {
                return (Element) child;
            }
        }
        return null;
    }

    /**
     * Collect all descendants with the given tag in document order.
     * The returned list is a snapshot, safe to use while the tree is mutated.
     */
    public static List<Element> findAll(Element root, String tagName) {
        NodeList nodes = root.getElementsByTagName(tagName);
        List<Element> result = new ArrayList<>(nodes.getLength());
        for (int i = 0; i < nodes.getLength(); i++) {
            result.add((Element) nodes.item(i));
        }
        return result;
    }

    public static Element parentElement(Node node) {
        Node parent = node.getParentNode();
        return parent != null && parent.getNodeType() == Node.ELEMENT_NODE ? (Element) parent : null;
    }

    public static Element findAncestor(Node node, String tagName) {
        Element current = node instanceof Element ? (Element) node : parentElement(node);
        while (current != null) {
            if (tagName.equals(current.getTagName())) {
                return current;
            }
            current = parentElement(current);
        }
        return null;
    }

    public static boolean hasAncestor(Node node, String... tagNames) {
        Element current = parentElement(node);
        while (current != null) {
            for (String tagName : tagNames) {
                if (tagName.equals(current.getTagName())) {
                    return true;
                }
            }
            current = parentElement(current);
        }
        return false;
    }

    /**
     * Text of a text-bearing leaf (w:t, w:delText, w:instrText), or null for any other element.
     */
    public static String getLeafText(Element element) {
        String tagName = element.getTagName();
        if (T.equals(tagName) || DEL_TEXT.equals(tagName) || INSTR_TEXT.equals(tagName)) {
            return element.getTextContent();
        }
        return null;
    }

    public static void setLeafText(Element element, String text) {
        element.setTextContent(text);
    }

    public static Element createElement(Document document, String tagName) {
        if (tagName.startsWith("w:")) {
            return document.createElementNS(W_NS, tagName);
        }
        return document.createElement(tagName);
    }

    public static Element createRevisionElement(Document document, String tagName, int id, String author, String date) {
        Element element = createElement(document, tagName);
        setAttribute(element, ATTR_ID, String.valueOf(id));
        setAttribute(element, ATTR_AUTHOR, author);
        setAttribute(element, ATTR_DATE, date);
        return element;
    }

    public static void setAttribute(Element element, String qualifiedName, String value) {
        if (qualifiedName.startsWith("w:")) {
            element.setAttributeNS(W_NS, qualifiedName, value);
        } else if (qualifiedName.startsWith("xml:")) {
            element.setAttributeNS(XML_NS, qualifiedName, value);
        } else {
            element.setAttribute(qualifiedName, value);
        }
    }

    public static Element createTextElement(Document document, String tagName, String text) {
        Element element = createElement(document, tagName);
        if (needsSpacePreserve(text)) {
            element.setAttributeNS(XML_NS, XML_SPACE, "preserve");
        }
        element.setTextContent(text);
        return element;
    }

    public static boolean needsSpacePreserve(String text) {
        return !text.isEmpty()
                && (Character.isWhitespace(text.charAt(0))
                || Character.isWhitespace(text.charAt(text.length() - 1))
                || text.contains("  "));
    }

    public static boolean isNamespaceDeclaration(Attr attr) {
        String name = attr.getName();
        return "xmlns".equals(name) || name.startsWith("xmlns:");
    }

    public static void copyAttributes(Element from, Element to) {
        NamedNodeMap attributes = from.getAttributes();
        for (int i = 0; i < attributes.getLength(); i++) {
            Attr attr = (Attr) attributes.item(i);
            if (attr.getNamespaceURI() != null) {
                to.setAttributeNS(attr.getNamespaceURI(), attr.getName(), attr.getValue());
            } else {
                to.setAttribute(attr.getName(), attr.getValue());
            }
        }
    }

    public static void insertAfter(Node anchor, Node node) {
        Node parent = anchor.getParentNode();
        Node next = anchor.getNextSibling();
        if (next == null) {
            parent.appendChild(node);
        } else {
            parent.insertBefore(node, next);
        }
    }

    /**
     * Insert {@code node} as the first child after any leading w:pPr.
     */
    public static void insertAtContentStart(Element paragraph, Node node) {
        Element pPr = findChild(paragraph, PPR);
        if (pPr != null) {
            insertAfter(pPr, node);
        } else {
            paragraph.insertBefore(node, paragraph.getFirstChild());
        }
    }

    public static void wrap(Element target, Element wrapper) {
        target.getParentNode().replaceChild(wrapper, target);
        wrapper.appendChild(target);
    }

    public static void unwrap(Element element) {
        Node parent = element.getParentNode();
        if (parent == null) {
            return;
        }
        while (element.getFirstChild() != null) {
            parent.insertBefore(element.getFirstChild(), element);
        }
        parent.removeChild(element);
    }

    public static void remove(Node node) {
        Node parent = node.getParentNode();
        if (parent != null) {
            parent.removeChild(node);
        }
    }

    public static void removeAll(Element root, String tagName) {
        for (Element element : findAll(root, tagName)) {
            remove(element);
        }
    }

    public static void unwrapAll(Element root, String tagName) {
        for (Element element : findAll(root, tagName)) {
            unwrap(element);
        }
    }

    /**
     * Replace {@code element} with a new element of another tag, keeping attributes and children.
     */
    public static Element rename(Element element, String newTagName) {
        Element renamed = createElement(element.getOwnerDocument(), newTagName);
        copyAttributes(element, renamed);
        while (element.getFirstChild() != null) {
            renamed.appendChild(element.getFirstChild());
        }
        if (element.getParentNode() != null) {
            element.getParentNode().replaceChild(renamed, element);
        }
        return renamed;
    }

    /**
     * Convert every w:t under {@code root} (including root itself) into w:delText
     * and every w:instrText into w:delInstrText.
     */
    public static Element convertToDelText(Element root) {
        if (T.equals(root.getTagName())) {
            return rename(root, DEL_TEXT);
        }
        if (INSTR_TEXT.equals(root.getTagName())) {
            return rename(root, DEL_INSTR_TEXT);
        }
        for (Element text : findAll(root, T)) {
            rename(text, DEL_TEXT);
        }
        for (Element instruction : findAll(root, INSTR_TEXT)) {
            rename(instruction, DEL_INSTR_TEXT);
        }
        return root;
    }

    public static Element findBody(Document document) {
        List<Element> bodies = findAll(document.getDocumentElement(), BODY);
        return bodies.isEmpty() ? null : bodies.get(0);
    }
}
