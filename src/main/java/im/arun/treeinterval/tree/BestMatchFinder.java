package im.arun.treeinterval.tree;

import im.arun.treeinterval.model.IntervalTree;
import im.arun.treeinterval.model.TreeNode;

import java.util.Optional;

/**
 * Finds the node that most tightly encloses a target span.
 *
 * <p>Distance is {@code |start - targetStart| + |end - targetEnd|}. The search only
 * descends into children that contain the target, and on equal distance the node found
 * first (the shallower or leftmost one) is kept.
 */
public final class BestMatchFinder {

    private BestMatchFinder() {}

    public static Optional<TreeNode> findBestMatch(IntervalTree tree, int targetStart, int targetEnd) {
        if (tree == null || tree.isEmpty()) {
            return Optional.empty();
        }
        return findBestMatch(tree.getRoot(), targetStart, targetEnd);
    }

    /**
     * Searches the subtree rooted at {@code node}. Empty when the target lies outside
     * {@code node}'s span.
     */
    public static Optional<TreeNode> findBestMatch(TreeNode node, int targetStart, int targetEnd) {
        if (node == null || targetStart > targetEnd || !node.getPosition().contains(targetStart, targetEnd)) {
            return Optional.empty();
        }
        return Optional.of(search(node, targetStart, targetEnd));
    }

    private static TreeNode search(TreeNode node, int targetStart, int targetEnd) {
        TreeNode best = node;
        int bestDistance = node.getPosition().distanceTo(targetStart, targetEnd);

        for (TreeNode child : node.getChildren()) {
            if (!child.getPosition().contains(targetStart, targetEnd)) {
                continue;
            }
            TreeNode candidate = search(child, targetStart, targetEnd);
            int distance = candidate.getPosition().distanceTo(targetStart, targetEnd);
            if (distance < bestDistance) {
                best = candidate;
                bestDistance = distance;
            }
        }
        return best;
    }
}
