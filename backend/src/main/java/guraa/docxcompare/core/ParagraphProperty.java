package guraa.docxcompare.core;

import java.util.HashMap;
import java.util.Map;

/**
 * Paragraph property elements with the names reported for paragraph formatting changes.
 */
public enum ParagraphProperty {
    ALIGNMENT("w:jc", "alignment"),
    INDENTATION("w:ind", "indentation"),
    SPACING("w:spacing", "spacing"),
    STYLE("w:pStyle", "style"),
    NUMBERING("w:numPr", "numbering"),
    BORDERS("w:pBdr", "borders"),
    SHADING("w:shd", "shading"),
    TABS("w:tabs", "tabs"),
    KEEP_WITH_NEXT("w:keepNext", "keepWithNext"),
    KEEP_LINES_TOGETHER("w:keepLines", "keepLinesTogether"),
    PAGE_BREAK_BEFORE("w:pageBreakBefore", "pageBreakBefore"),
    WIDOW_CONTROL("w:widowControl", "widowControl"),
    OUTLINE_LEVEL("w:outlineLvl", "outlineLevel");

    private static final Map<String, ParagraphProperty> BY_TAG = new HashMap<>();

    static {
        for (ParagraphProperty property : values()) {
            BY_TAG.put(property.tag, property);
        }
    }

    private final String tag;
    private final String friendlyName;

    ParagraphProperty(String tag, String friendlyName) {
        this.tag = tag;
        this.friendlyName = friendlyName;
    }

    public String getTag() {
        return tag;
    }

    public String getFriendlyName() {
        return friendlyName;
    }

    public static String nameOf(String tag) {
        ParagraphProperty property = BY_TAG.get(tag);
        return property != null ? property.friendlyName : tag;
    }
}
