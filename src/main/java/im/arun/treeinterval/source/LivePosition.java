package im.arun.treeinterval.source;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Location currently executing, as reported by a {@link LivePositionResolver}. The line is
 * 1-based; the optional column range is 0-based and end-exclusive.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class LivePosition {
    private int line;
    private Integer colStart;
    private Integer colEnd;

    public static LivePosition ofLine(int line) {
        return new LivePosition(line, null, null);
    }

    public boolean hasColumns() {
        return colStart != null && colEnd != null;
    }
}
