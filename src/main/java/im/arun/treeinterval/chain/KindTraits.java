package im.arun.treeinterval.chain;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Classification flags for one label kind.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class KindTraits {

    @JsonProperty("description")
    private String description;

    @JsonProperty("statement")
    private boolean statement;

    @JsonProperty("assignment")
    private boolean assignment;

    @JsonProperty("attribute")
    private boolean attribute;

    /**
     * Leading children that are assignment targets. Unset means all children but the last.
     */
    @JsonProperty("targets")
    private Integer targets;

    public KindTraits(String description, boolean statement, boolean assignment, boolean attribute) {
        this(description, statement, assignment, attribute, null);
    }
}
