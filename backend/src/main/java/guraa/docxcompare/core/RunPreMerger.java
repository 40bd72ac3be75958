package guraa.docxcompare.core;

import guraa.docxcompare.util.WmlNodes;
import org.w3c.dom.Attr;
import org.w3c.dom.Element;
import org.w3c.dom.NamedNodeMap;

import java.util.List;
import java.util.Set;

/**
 * Merges adjacent w:r siblings that carry identical attributes and run properties.
 * Only simple runs qualify: their children must be run properties or childless
 * text, tab, break or deleted-text elements.
 */
public class RunPreMerger {

    private static final Set<String> SAFE_RUN_CHILDREN = Set.of(
            WmlNodes.RPR, WmlNodes.T, WmlNodes.TAB, WmlNodes.BR, WmlNodes.CR, WmlNodes.DEL_TEXT);

    /**
     * Merge runs throughout the subtree of {@code root}, in place.
     *
     * @return number of merges performed
     */
    public int premerge(Element root) {
        int merges = mergeChildren(root);
        for (Element child : WmlNodes.childElements(root)) {
            merges += premerge(child);
        }
        return merges;
    }

    private int mergeChildren(Element parent) {
        int merges = 0;
        boolean merged = true;
        while (merged) {
            merged = false;
            List<Element> children = WmlNodes.childElements(parent);
            for (int i = 0; i + 1 < children.size(); i++) {
                Element a = children.get(i);
                Element b = children.get(i + 1);
                if (canMerge(a, b)) {
                    for (Element child : WmlNodes.childElements(b)) {
                        if (!WmlNodes.RPR.equals(child.getTagName())) {
                            a.appendChild(child);
                        }
                    }
                    parent.removeChild(b);
                    merges++;
                    merged = true;
                    break;
                }
            }
        }
        return merges;
    }

    private static boolean canMerge(Element a, Element b) {
        return isSimpleRun(a)
                && isSimpleRun(b)
                && sameAttributes(a, b)
                && AtomFingerprint.deepEquals(WmlNodes.findChild(a, WmlNodes.RPR), WmlNodes.findChild(b, WmlNodes.RPR));
    }

    private static boolean isSimpleRun(Element run) {
        if (!WmlNodes.R.equals(run.getTagName())) {
            return false;
        }
        for (Element child : WmlNodes.childElements(run)) {
            if (!SAFE_RUN_CHILDREN.contains(child.getTagName())) {
                return false;
            }
            if (!WmlNodes.RPR.equals(child.getTagName()) && !WmlNodes.childElements(child).isEmpty()) {
                return false;
            }
        }
        return true;
    }

    private static boolean sameAttributes(Element a, Element b) {
        NamedNodeMap aAttributes = a.getAttributes();
        if (aAttributes.getLength() != b.getAttributes().getLength()) {
            return false;
        }
        for (int i = 0; i < aAttributes.getLength(); i++) {
            Attr attr = (Attr) aAttributes.item(i);
            if (!attr.getValue().equals(b.getAttribute(attr.getName()))) {
                return false;
            }
        }
        return true;
    }
}
