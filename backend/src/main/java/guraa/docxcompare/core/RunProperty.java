package guraa.docxcompare.core;

import java.util.HashMap;
import java.util.Map;

/**
 * Run property elements with the names reported for format changes.
 */
public enum RunProperty {
    BOLD("w:b", "bold"),
    BOLD_COMPLEX("w:bCs", "boldComplex"),
    ITALIC("w:i", "italic"),
    ITALIC_COMPLEX("w:iCs", "italicComplex"),
    UNDERLINE("w:u", "underline"),
    STRIKETHROUGH("w:strike", "strikethrough"),
    DOUBLE_STRIKETHROUGH("w:dstrike", "doubleStrikethrough"),
    FONT_SIZE("w:sz", "fontSize"),
    FONT_SIZE_COMPLEX("w:szCs", "fontSizeComplex"),
    FONT("w:rFonts", "font"),
    COLOR("w:color", "color"),
    HIGHLIGHT("w:highlight", "highlight"),
    SHADING("w:shd", "shading"),
    VERTICAL_ALIGN("w:vertAlign", "verticalAlign"),
    ALL_CAPS("w:caps", "allCaps"),
    SMALL_CAPS("w:smallCaps", "smallCaps"),
    HIDDEN("w:vanish", "hidden"),
    EMBOSS("w:emboss", "emboss"),
    IMPRINT("w:imprint", "imprint"),
    OUTLINE("w:outline", "outline"),
    SHADOW("w:shadow", "shadow"),
    SPACING("w:spacing", "spacing"),
    WIDTH("w:w", "width"),
    KERNING("w:kern", "kerning"),
    POSITION("w:position", "position");

    private static final Map<String, RunProperty> BY_TAG = new HashMap<>();

    static {
        for (RunProperty property : values()) {
            BY_TAG.put(property.tag, property);
        }
    }

    private final String tag;
    private final String friendlyName;

    RunProperty(String tag, String friendlyName) {
        this.tag = tag;
        this.friendlyName = friendlyName;
    }

    public String getTag() {
        return tag;
    }

    public String getFriendlyName() {
        return friendlyName;
    }

    /**
     * Friendly name for a property tag, or the tag itself when it is not in the table.
     */
    public static String nameOf(String tag) {
        RunProperty property = BY_TAG.get(tag);
        return property != null ? property.friendlyName : tag;
    }
}
