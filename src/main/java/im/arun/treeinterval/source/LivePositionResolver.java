package im.arun.treeinterval.source;

import java.util.Optional;

/**
 * Supplies the position currently executing in the source a tree was built from, for
 * example from a debugger or a runtime stack frame.
 */
@FunctionalInterface
public interface LivePositionResolver {

    /**
     * @return the live position, or empty when nothing is executing
     */
    Optional<LivePosition> currentPosition();
}
