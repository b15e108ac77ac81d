package im.arun.treeinterval.json;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Wire form of a whole tree.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TreeDocument {

    @JsonProperty("source")
    private String source;

    @JsonProperty("start_lineno")
    private Integer startLineno;

    @JsonProperty("indent_size")
    private Integer indentSize;

    @JsonProperty("root")
    private NodeDocument root;
}
