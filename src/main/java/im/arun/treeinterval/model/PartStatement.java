package im.arun.treeinterval.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Text of the enclosing statement on either side of an attribute chain.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PartStatement {
    private String before = "";
    private String after = "";
}
