package im.arun.treeinterval.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.Setter;

/**
 * Half-open interval {@code [start, end)} over source-text offsets.
 *
 * <p>The interval itself is immutable. The line/column shadow coordinates and the
 * {@code selected} marker are informational only and never take part in containment.
 */
@Getter
@EqualsAndHashCode
public class Position {

    private final int start;

    private final int end;

    @Setter
    private Integer lineStart;

    @Setter
    private Integer colStart;

    @Setter
    private Integer lineEnd;

    @Setter
    private Integer colEnd;

    @Setter
    @EqualsAndHashCode.Exclude
    private boolean selected;

    public Position(int start, int end) {
        if (start > end) {
            throw new IllegalArgumentException("Position start " + start + " is after end " + end);
        }
        this.start = start;
        this.end = end;
    }

    /**
     * Creates a position carrying line/column shadow coordinates.
     */
    public Position(int start, int end, Integer lineStart, Integer colStart, Integer lineEnd, Integer colEnd) {
        this(start, end);
        this.lineStart = lineStart;
        this.colStart = colStart;
        this.lineEnd = lineEnd;
        this.colEnd = colEnd;
    }

    public int size() {
        return end - start;
    }

    public int absoluteStart() {
        return Math.max(start, 0);
    }

    public int absoluteEnd() {
        return Math.max(end, 0);
    }

    public boolean contains(Position other) {
        return contains(other.start, other.end);
    }

    public boolean contains(int otherStart, int otherEnd) {
        return start <= otherStart && otherEnd <= end;
    }

    public boolean sameSpan(Position other) {
        return start == other.start && end == other.end;
    }

    public boolean isDisjoint(Position other) {
        return end <= other.start || other.end <= start;
    }

    /**
     * True when the two intervals intersect without either containing the other.
     */
    public boolean partiallyOverlaps(Position other) {
        return !isDisjoint(other) && !contains(other) && !other.contains(this);
    }

    /**
     * Manhattan distance between this interval's endpoints and the target's.
     */
    public int distanceTo(int targetStart, int targetEnd) {
        return Math.abs(start - targetStart) + Math.abs(end - targetEnd);
    }

    public Position copy() {
        Position copy = new Position(start, end, lineStart, colStart, lineEnd, colEnd);
        copy.setSelected(selected);
        return copy;
    }

    public String positionAs(PositionFormat format) {
        switch (format) {
            case POSITION:
                return String.format("Position(start=%d, end=%d, lineno=%s, end_lineno=%s, col_offset=%s, end_col_offset=%s)",
                    start, end, lineStart, lineEnd, colStart, colEnd);
            case TUPLE:
                return String.format("(%d, %d, %s, %s, %s, %s)",
                    start, end, lineStart, lineEnd, colStart, colEnd);
            default:
                return String.format("Position(start=%d, end=%d)", start, end);
        }
    }

    @Override
    public String toString() {
        return positionAs(PositionFormat.DEFAULT);
    }
}
