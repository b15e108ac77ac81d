package im.arun.treeinterval.util;

import im.arun.treeinterval.model.TreeNode;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Utility methods for walking and searching a node hierarchy.
 */
public class TreeUtils {

    /**
     * Pre-order list of the structural nodes under {@code root}, root first.
     */
    public static List<TreeNode> flatten(TreeNode root) {
        return flatten(root, false);
    }

    /**
     * Pre-order list where every structural node is directly followed by its group-mates.
     */
    public static List<TreeNode> flattenWithGroupMates(TreeNode root) {
        return flatten(root, true);
    }

    private static List<TreeNode> flatten(TreeNode root, boolean includeGroupMates) {
        List<TreeNode> result = new ArrayList<>();
        if (root == null) {
            return result;
        }

        Deque<TreeNode> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            TreeNode node = stack.pop();
            result.add(node);
            if (includeGroupMates) {
                result.addAll(node.getGroupMates());
            }
            List<TreeNode> children = node.getChildren();
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
        }
        return result;
    }

    /**
     * Ancestors of {@code node}, nearest first. The node itself is not included.
     */
    public static List<TreeNode> ancestors(TreeNode node) {
        List<TreeNode> result = new ArrayList<>();
        TreeNode current = node == null ? null : node.getParent();
        while (current != null) {
            result.add(current);
            current = current.getParent();
        }
        return result;
    }

    public static int depth(TreeNode node) {
        return ancestors(node).size();
    }

    /**
     * First node matching {@code criteria} walking from {@code node} (inclusive) to the root.
     */
    public static Optional<TreeNode> findParent(TreeNode node, Predicate<TreeNode> criteria) {
        TreeNode current = node;
        while (current != null) {
            if (criteria.test(current)) {
                return Optional.of(current);
            }
            current = current.getParent();
        }
        return Optional.empty();
    }

    /**
     * Breadth-first search of the subtree rooted at {@code node} (inclusive).
     */
    public static Optional<TreeNode> findChild(TreeNode node, Predicate<TreeNode> criteria) {
        List<TreeNode> found = breadthFirst(node, criteria, true);
        return found.isEmpty() ? Optional.empty() : Optional.of(found.get(0));
    }

    /**
     * First sibling, in source order, matching {@code criteria}. Never returns the node itself.
     */
    public static Optional<TreeNode> findSibling(TreeNode node, Predicate<TreeNode> criteria) {
        return findAllSiblings(node, criteria).stream().findFirst();
    }

    public static List<TreeNode> findAllParents(TreeNode node, Predicate<TreeNode> criteria) {
        List<TreeNode> result = new ArrayList<>();
        TreeNode current = node;
        while (current != null) {
            if (criteria.test(current)) {
                result.add(current);
            }
            current = current.getParent();
        }
        return result;
    }

    public static List<TreeNode> findAllChildren(TreeNode node, Predicate<TreeNode> criteria) {
        return breadthFirst(node, criteria, false);
    }

    public static List<TreeNode> findAllSiblings(TreeNode node, Predicate<TreeNode> criteria) {
        List<TreeNode> result = new ArrayList<>();
        if (node == null) {
            return result;
        }
        for (TreeNode sibling : node.getSiblings()) {
            if (criteria.test(sibling)) {
                result.add(sibling);
            }
        }
        return result;
    }

    private static List<TreeNode> breadthFirst(TreeNode node, Predicate<TreeNode> criteria, boolean firstOnly) {
        List<TreeNode> result = new ArrayList<>();
        if (node == null) {
            return result;
        }

        Deque<TreeNode> queue = new ArrayDeque<>();
        queue.add(node);
        while (!queue.isEmpty()) {
            TreeNode current = queue.poll();
            if (criteria.test(current)) {
                result.add(current);
                if (firstOnly) {
                    return result;
                }
            }
            queue.addAll(current.getChildren());
        }
        return result;
    }
}
