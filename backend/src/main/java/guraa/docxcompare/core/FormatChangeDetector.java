package guraa.docxcompare.core;

import guraa.docxcompare.util.WmlNodes;
import lombok.extern.slf4j.Slf4j;
import org.w3c.dom.Attr;
import org.w3c.dom.Element;
import org.w3c.dom.NamedNodeMap;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import java.util.function.Function;

/**
 * Finds equal atoms whose text matches but whose run formatting differs.
 */
@Slf4j
public class FormatChangeDetector {

    /**
     * Reclassify EQUAL revised atoms with different run properties as FORMAT_CHANGED.
     * Atoms already classified are left alone, so a second run changes nothing.
     *
     * @return number of atoms reclassified
     */
    public int detectFormatChanges(List<ComparisonUnitAtom> revisedAtoms) {
        int changes = 0;
        for (ComparisonUnitAtom atom : revisedAtoms) {
            if (atom.getCorrelationStatus() != CorrelationStatus.EQUAL || atom.getAtomBefore() == null) {
                continue;
            }
            Element oldRPr = atom.getAtomBefore().getRunProperties();
            Element newRPr = atom.getRunProperties();
            if (propertiesEqual(oldRPr, newRPr)) {
                continue;
            }
            atom.transitionTo(CorrelationStatus.FORMAT_CHANGED);
            atom.setFormatChange(describe(oldRPr, newRPr));
            changes++;
        }
        log.debug("Format change detection reclassified {} atoms", changes);
        return changes;
    }

    /**
     * Compare two property containers (w:rPr or w:pPr) after normalization.
     * A missing container equals an empty one.
     */
    public static boolean propertiesEqual(Element oldProperties, Element newProperties) {
        return serialize(normalize(oldProperties)).equals(serialize(normalize(newProperties)));
    }

    public static FormatChangeInfo describe(Element oldRPr, Element newRPr) {
        Map<String, String> oldProps = normalize(oldRPr);
        Map<String, String> newProps = normalize(newRPr);

        List<String> added = new ArrayList<>();
        List<String> removed = new ArrayList<>();
        List<String> modified = new ArrayList<>();
        for (String tag : newProps.keySet()) {
            if (!oldProps.containsKey(tag)) {
                added.add(RunProperty.nameOf(tag));
            }
        }
        for (Map.Entry<String, String> entry : oldProps.entrySet()) {
            if (!newProps.containsKey(entry.getKey())) {
                removed.add(RunProperty.nameOf(entry.getKey()));
            } else if (!entry.getValue().equals(newProps.get(entry.getKey()))) {
                modified.add(RunProperty.nameOf(entry.getKey()));
            }
        }
        Collections.sort(added);
        Collections.sort(removed);
        Collections.sort(modified);

        return FormatChangeInfo.builder()
                .oldRunProperties(oldRPr)
                .newRunProperties(newRPr)
                .changedProperties(changedNames(oldProps, newProps, RunProperty::nameOf))
                .addedProperties(added)
                .removedProperties(removed)
                .modifiedProperties(modified)
                .build();
    }

    /**
     * Friendly names of the paragraph properties that differ, sorted.
     */
    public static List<String> changedParagraphProperties(Element oldPPr, Element newPPr) {
        return changedNames(normalize(oldPPr), normalize(newPPr), ParagraphProperty::nameOf);
    }

    private static List<String> changedNames(Map<String, String> oldProps, Map<String, String> newProps,
                                             Function<String, String> naming) {
        TreeSet<String> tags = new TreeSet<>(oldProps.keySet());
        tags.addAll(newProps.keySet());
        List<String> changed = new ArrayList<>();
        for (String tag : tags) {
            String oldValue = oldProps.get(tag);
            String newValue = newProps.get(tag);
            if (oldValue == null ? newValue != null : !oldValue.equals(newValue)) {
                changed.add(naming.apply(tag));
            }
        }
        Collections.sort(changed);
        return changed;
    }

    /**
     * Property tag to its serialized form, sorted by tag. Revision records and the
     * paragraph-mark run properties are not formatting and are dropped.
     */
    private static Map<String, String> normalize(Element properties) {
        Map<String, String> result = new LinkedHashMap<>();
        if (properties == null) {
            return result;
        }
        List<Element> children = new ArrayList<>();
        for (Element child : WmlNodes.childElements(properties)) {
            String tag = child.getTagName();
            if (WmlNodes.RPR_CHANGE.equals(tag) || WmlNodes.PPR_CHANGE.equals(tag)
                    || (WmlNodes.PPR.equals(properties.getTagName()) && (WmlNodes.RPR.equals(tag) || WmlNodes.SECT_PR.equals(tag)))) {
                continue;
            }
            children.add(child);
        }
        children.sort((a, b) -> a.getTagName().compareTo(b.getTagName()));
        for (Element child : children) {
            result.merge(child.getTagName(), serializeProperty(child), String::concat);
        }
        return result;
    }

    private static String serializeProperty(Element property) {
        List<String> attributes = new ArrayList<>();
        NamedNodeMap attrs = property.getAttributes();
        for (int i = 0; i < attrs.getLength(); i++) {
            Attr attr = (Attr) attrs.item(i);
            if (!WmlNodes.isNamespaceDeclaration(attr)) {
                attributes.add(attr.getName() + "=\"" + attr.getValue() + "\"");
            }
        }
        Collections.sort(attributes);
        StringBuilder builder = new StringBuilder("<").append(property.getTagName());
        for (String attribute : attributes) {
            builder.append(' ').append(attribute);
        }
        for (Element nested : WmlNodes.childElements(property)) {
            builder.append(serializeProperty(nested));
        }
        String text = property.getTextContent();
        if (WmlNodes.childElements(property).isEmpty() && text != null && !text.isEmpty()) {
            builder.append('|').append(text);
        }
        return builder.append("/>").toString();
    }

    private static String serialize(Map<String, String> normalized) {
        return String.join("", normalized.values());
    }
}
