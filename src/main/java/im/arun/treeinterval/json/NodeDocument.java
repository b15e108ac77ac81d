package im.arun.treeinterval.json;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import im.arun.treeinterval.model.NodeLabel;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Wire form of one node. Siblings, next and previous are derived and not written.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class NodeDocument {

    @JsonProperty("start")
    private Integer start;

    @JsonProperty("end")
    private Integer end;

    @JsonProperty("line_start")
    private Integer lineStart;

    @JsonProperty("col_start")
    private Integer colStart;

    @JsonProperty("line_end")
    private Integer lineEnd;

    @JsonProperty("col_end")
    private Integer colEnd;

    @JsonProperty("selected")
    private Boolean selected;

    @JsonProperty("label")
    private NodeLabel label;

    @JsonProperty("group")
    private List<NodeDocument> group;

    @JsonProperty("children")
    private List<NodeDocument> children;
}
