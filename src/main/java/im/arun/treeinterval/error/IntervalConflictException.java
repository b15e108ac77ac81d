package im.arun.treeinterval.error;

import im.arun.treeinterval.model.Position;
import lombok.Getter;

/**
 * Raised when an inserted span partially overlaps an existing node, so the producer's
 * spans do not form a hierarchy.
 */
@Getter
public class IntervalConflictException extends TreeIntervalException {

    private final Position inserted;

    private final Position conflicting;

    public IntervalConflictException(Position inserted, Position conflicting) {
        super(String.format("Span [%d, %d) partially overlaps existing node [%d, %d)",
            inserted.getStart(), inserted.getEnd(), conflicting.getStart(), conflicting.getEnd()));
        this.inserted = inserted;
        this.conflicting = conflicting;
    }
}
