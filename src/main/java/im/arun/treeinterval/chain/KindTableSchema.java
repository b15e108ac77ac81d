package im.arun.treeinterval.chain;

import com.fasterxml.jackson.annotation.JsonProperty;
import im.arun.treeinterval.model.NodeLabel;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * {@link LabelSchema} backed by a table of label kinds. Kinds missing from the table are
 * neither statements nor chain links.
 */
@Data
@NoArgsConstructor
public class KindTableSchema implements LabelSchema {

    @JsonProperty("name")
    private String name;

    @JsonProperty("kinds")
    private Map<String, KindTraits> kinds = new LinkedHashMap<>();

    public KindTableSchema(String name, Map<String, KindTraits> kinds) {
        this.name = name;
        this.kinds = new LinkedHashMap<>(kinds);
    }

    public KindTableSchema define(String kind, boolean statement, boolean assignment, boolean attribute) {
        kinds.put(kind, new KindTraits(null, statement, assignment, attribute));
        return this;
    }

    @Override
    public boolean isStatement(NodeLabel label) {
        KindTraits traits = traitsOf(label);
        return traits != null && traits.isStatement();
    }

    @Override
    public boolean isAssignmentLike(NodeLabel label) {
        KindTraits traits = traitsOf(label);
        return traits != null && traits.isAssignment();
    }

    @Override
    public boolean isAttributeChainLink(NodeLabel label) {
        KindTraits traits = traitsOf(label);
        return traits != null && traits.isAttribute();
    }

    @Override
    public int targetChildCount(NodeLabel label, int childCount) {
        KindTraits traits = traitsOf(label);
        if (traits == null || !traits.isAssignment()) {
            return 0;
        }
        if (traits.getTargets() == null) {
            return Math.max(childCount - 1, 0);
        }
        return Math.min(traits.getTargets(), childCount);
    }

    /**
     * Declares an assignment-like kind whose first {@code targets} children are targets.
     */
    public KindTableSchema defineAssignment(String kind, boolean statement, int targets) {
        kinds.put(kind, new KindTraits(null, statement, true, false, targets));
        return this;
    }

    private KindTraits traitsOf(NodeLabel label) {
        if (label == null || label.getKind() == null) {
            return null;
        }
        return kinds.get(label.getKind());
    }
}
