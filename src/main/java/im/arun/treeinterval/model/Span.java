package im.arun.treeinterval.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A flat {@code (start, end, label)} triple as produced by a position source.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Span {

    @JsonProperty("start")
    private int start;

    @JsonProperty("end")
    private int end;

    @JsonProperty("label")
    private NodeLabel label;

    public static Span of(int start, int end, String kind) {
        return new Span(start, end, NodeLabel.of(kind));
    }

    public int size() {
        return end - start;
    }

    public TreeNode toNode() {
        return new TreeNode(new Position(start, end), label);
    }
}
