package im.arun.treeinterval.chain;

import im.arun.treeinterval.model.NodeLabel;

/**
 * Classifies node labels for statement and attribute-chain navigation.
 */
public interface LabelSchema {

    boolean isStatement(NodeLabel label);

    boolean isAssignmentLike(NodeLabel label);

    boolean isAttributeChainLink(NodeLabel label);

    /**
     * Number of leading children of an assignment-like statement that are assignment
     * targets. Children from that index on (annotation, assigned value) are not targets.
     * By default every child but the last, which holds the value, is a target.
     *
     * @param childCount number of structural children the statement has
     */
    default int targetChildCount(NodeLabel label, int childCount) {
        if (!isAssignmentLike(label)) {
            return 0;
        }
        return Math.max(childCount - 1, 0);
    }
}
