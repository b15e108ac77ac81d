package im.arun.treeinterval.tree;

import im.arun.treeinterval.error.IntervalConflictException;
import im.arun.treeinterval.model.IntervalTree;
import im.arun.treeinterval.model.Span;
import im.arun.treeinterval.model.TreeNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * Places spans into an {@link IntervalTree} by interval containment.
 *
 * <p>A new node goes under the deepest existing node that contains it. Existing children
 * of that host which fall inside the new node move underneath it, so the resulting shape
 * does not depend on insertion order. A node whose span equals an existing node's span
 * joins that node's group instead of nesting.
 */
public final class TreeBuilder {
    private static final Logger logger = LoggerFactory.getLogger(TreeBuilder.class);

    /**
     * Larger spans first, then left to right.
     */
    public static final Comparator<Span> INSERTION_ORDER =
        Comparator.comparingInt(Span::size).reversed().thenComparingInt(Span::getStart);

    private static final Comparator<TreeNode> NODE_INSERTION_ORDER =
        Comparator.comparingInt(TreeNode::size).reversed().thenComparingInt(TreeNode::getStart);

    private TreeBuilder() {}

    public static void insert(IntervalTree tree, TreeNode node) {
        if (node.getParent() != null || !node.isStructural()) {
            throw new IllegalArgumentException("Node is already attached to a tree: " + node);
        }
        if (!node.getChildren().isEmpty() || !node.getGroupMates().isEmpty()) {
            throw new IllegalArgumentException("Node already has children or group-mates: " + node);
        }

        TreeNode root = tree.getRoot();
        if (root == null) {
            tree.setRoot(node);
            logger.debug("Root set to {}", node);
            return;
        }

        if (root.getPosition().sameSpan(node.getPosition())) {
            root.addGroupMate(node);
            logger.debug("Grouped {} with root", node);
            return;
        }

        if (node.contains(root)) {
            tree.setRoot(node);
            node.addChild(root);
            logger.debug("Root replaced by enclosing node {}", node);
            return;
        }

        if (!root.contains(node)) {
            logger.warn("Rejected {}: not inside root {}", node.getPosition(), root.getPosition());
            throw new IntervalConflictException(node.getPosition(), root.getPosition());
        }

        TreeNode host = findHost(root, node);
        if (host.getPosition().sameSpan(node.getPosition())) {
            host.addGroupMate(node);
            logger.debug("Grouped {} with {}", node, host);
            return;
        }
        attach(host, node);
    }

    /**
     * Inserts every span, larger and earlier spans first. The resulting containment
     * structure is the same for any permutation of {@code spans}.
     *
     * @return the created nodes, in insertion order
     */
    public static List<TreeNode> insertMany(IntervalTree tree, Collection<Span> spans) {
        List<Span> ordered = new ArrayList<>(spans);
        ordered.sort(INSERTION_ORDER);

        List<TreeNode> created = new ArrayList<>(ordered.size());
        for (Span span : ordered) {
            TreeNode node = span.toNode();
            insert(tree, node);
            created.add(node);
        }
        logger.debug("Inserted {} spans", created.size());
        return created;
    }

    /**
     * Same as {@link #insertMany(IntervalTree, Collection)} for nodes that were built by
     * the caller.
     */
    public static void insertNodes(IntervalTree tree, Collection<TreeNode> nodes) {
        List<TreeNode> ordered = new ArrayList<>(nodes);
        ordered.sort(NODE_INSERTION_ORDER);
        for (TreeNode node : ordered) {
            insert(tree, node);
        }
    }

    /**
     * Deepest node under {@code host} that owns {@code node}, see {@link #owns}.
     */
    static TreeNode findHost(TreeNode host, TreeNode node) {
        TreeNode current = host;
        boolean descended = true;
        while (descended) {
            descended = false;
            for (TreeNode child : current.getChildren()) {
                if (owns(child, node)) {
                    current = child;
                    descended = true;
                    break;
                }
            }
        }
        return current;
    }

    /**
     * True when {@code node} belongs under {@code container}. Containment decides, except that
     * an empty span sitting on {@code container}'s end belongs to whatever starts there: with
     * half-open intervals offset {@code p} lies in {@code [p, q)}, not in {@code [o, p)}.
     */
    static boolean owns(TreeNode container, TreeNode node) {
        if (!container.contains(node)) {
            return false;
        }
        return node.size() > 0
            || node.getStart() < container.getEnd()
            || container.getPosition().sameSpan(node.getPosition());
    }

    private static void attach(TreeNode host, TreeNode node) {
        List<TreeNode> moved = new ArrayList<>();
        for (TreeNode child : host.getChildren()) {
            if (owns(node, child)) {
                moved.add(child);
            } else if (child.getPosition().partiallyOverlaps(node.getPosition())) {
                logger.warn("Rejected {}: overlaps {} under {}", node.getPosition(), child.getPosition(), host.getPosition());
                throw new IntervalConflictException(node.getPosition(), child.getPosition());
            }
        }

        for (TreeNode child : moved) {
            host.removeChild(child);
            node.addChild(child);
        }
        host.addChild(node);

        if (!moved.isEmpty()) {
            logger.debug("Reparented {} children of {} under {}", moved.size(), host.getPosition(), node.getPosition());
        }
    }
}
