package guraa.docxcompare.core;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.List;

/**
 * Formatting difference between an atom and its counterpart in the original document.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FormatChangeInfo {

    /**
     * Run properties of the original atom, or null when it had none.
     */
    private Element oldRunProperties;

    /**
     * Run properties of the revised atom, or null when it had none.
     */
    private Element newRunProperties;

    /**
     * Friendly names of every property that differs, sorted.
     */
    @Builder.Default
    private List<String> changedProperties = new ArrayList<>();

    @Builder.Default
    private List<String> addedProperties = new ArrayList<>();

    @Builder.Default
    private List<String> removedProperties = new ArrayList<>();

    @Builder.Default
    private List<String> modifiedProperties = new ArrayList<>();
}
