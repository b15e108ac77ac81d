package im.arun.treeinterval.verification;

import im.arun.treeinterval.model.IntervalTree;
import im.arun.treeinterval.model.TreeNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Checks the structural invariants of a tree: every child lies inside its parent, siblings
 * are sorted and pairwise disjoint, parent links agree with children lists, and group-mates
 * share their structural node's span.
 */
public class TreeValidator {
    private static final Logger logger = LoggerFactory.getLogger(TreeValidator.class);

    /**
     * Result of a validation pass.
     */
    public static class ValidationResult {
        public final int checkedNodes;
        public final List<String> violations;

        public ValidationResult(int checkedNodes, List<String> violations) {
            this.checkedNodes = checkedNodes;
            this.violations = Collections.unmodifiableList(violations);
        }

        public boolean isValid() {
            return violations.isEmpty();
        }
    }

    public ValidationResult validate(IntervalTree tree) {
        List<String> violations = new ArrayList<>();
        if (tree == null || tree.isEmpty()) {
            return new ValidationResult(0, violations);
        }

        TreeNode root = tree.getRoot();
        if (root.getParent() != null) {
            violations.add("Root " + root.getPosition() + " has a parent");
        }

        Map<TreeNode, Boolean> seen = new IdentityHashMap<>();
        int checked = check(root, seen, violations);

        if (!violations.isEmpty()) {
            logger.warn("Tree validation found {} violations in {} nodes", violations.size(), checked);
        }
        return new ValidationResult(checked, violations);
    }

    private int check(TreeNode node, Map<TreeNode, Boolean> seen, List<String> violations) {
        if (seen.put(node, Boolean.TRUE) != null) {
            violations.add("Node " + node.getPosition() + " appears more than once");
            return 0;
        }

        for (TreeNode mate : node.getGroupMates()) {
            if (!mate.getPosition().sameSpan(node.getPosition())) {
                violations.add("Group-mate " + mate.getPosition() + " differs from " + node.getPosition());
            }
            if (!mate.getChildren().isEmpty()) {
                violations.add("Group-mate " + mate.getPosition() + " owns children");
            }
        }

        int count = 1;
        TreeNode previous = null;
        for (TreeNode child : node.getChildren()) {
            if (child.getParent() != node) {
                violations.add("Child " + child.getPosition() + " does not point back to " + node.getPosition());
            }
            if (!node.contains(child)) {
                violations.add("Child " + child.getPosition() + " is not contained in " + node.getPosition());
            }
            if (child.getPosition().sameSpan(node.getPosition())) {
                violations.add("Child " + child.getPosition() + " repeats its parent's span");
            }
            if (previous != null) {
                if (TreeNode.SOURCE_ORDER.compare(previous, child) >= 0) {
                    violations.add("Children " + previous.getPosition() + " and " + child.getPosition() + " are out of order");
                } else if (!previous.getPosition().isDisjoint(child.getPosition())) {
                    violations.add("Siblings " + previous.getPosition() + " and " + child.getPosition() + " overlap");
                }
            }
            previous = child;
            count += check(child, seen, violations);
        }
        return count;
    }
}
