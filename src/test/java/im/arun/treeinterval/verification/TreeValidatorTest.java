package im.arun.treeinterval.verification;

import static org.assertj.core.api.Assertions.assertThat;

import im.arun.treeinterval.SampleTrees;
import im.arun.treeinterval.model.IntervalTree;
import im.arun.treeinterval.model.TreeNode;
import org.junit.jupiter.api.Test;

class TreeValidatorTest {

    private final TreeValidator validator = new TreeValidator();

    private static IntervalTree treeOf(TreeNode root) {
        IntervalTree tree = new IntervalTree("");
        tree.setRoot(root);
        return tree;
    }

    @Test
    void builtTreeIsValid() {
        IntervalTree tree = SampleTrees.build(SampleTrees.CHAIN_WITH_CALL, SampleTrees.chainWithCall());

        TreeValidator.ValidationResult result = validator.validate(tree);

        assertThat(result.isValid()).isTrue();
        assertThat(result.checkedNodes).isEqualTo(7);
    }

    @Test
    void emptyTreeIsValid() {
        TreeValidator.ValidationResult result = validator.validate(new IntervalTree(""));

        assertThat(result.isValid()).isTrue();
        assertThat(result.checkedNodes).isZero();
    }

    @Test
    void childOutsideParent() {
        TreeNode root = new TreeNode(0, 10, "Root");
        root.addChild(new TreeNode(5, 15, "Stray"));

        assertThat(validator.validate(treeOf(root)).violations)
            .anyMatch(message -> message.contains("is not contained in"));
    }

    @Test
    void childRepeatingParentSpan() {
        TreeNode root = new TreeNode(0, 10, "Root");
        root.addChild(new TreeNode(0, 10, "Copy"));

        assertThat(validator.validate(treeOf(root)).violations)
            .anyMatch(message -> message.contains("repeats its parent's span"));
    }

    @Test
    void overlappingSiblings() {
        TreeNode root = new TreeNode(0, 10, "Root");
        root.addChild(new TreeNode(0, 6, "Left"));
        root.addChild(new TreeNode(4, 10, "Right"));

        assertThat(validator.validate(treeOf(root)).violations)
            .anyMatch(message -> message.contains("overlap"));
    }

    @Test
    void mateWithChildren() {
        TreeNode root = new TreeNode(0, 10, "Root");
        TreeNode node = new TreeNode(2, 8, "Node");
        TreeNode mate = new TreeNode(2, 8, "Mate");
        root.addChild(node);
        node.addGroupMate(mate);
        mate.addChild(new TreeNode(3, 4, "Hidden"));

        assertThat(validator.validate(treeOf(root)).violations)
            .anyMatch(message -> message.contains("owns children"));
    }

    @Test
    void mateWithDifferentSpan() {
        TreeNode root = new TreeNode(0, 10, "Root");
        TreeNode node = new TreeNode(2, 8, "Node");
        root.addChild(node);
        node.addGroupMate(new TreeNode(2, 9, "Wider"));

        assertThat(validator.validate(treeOf(root)).violations)
            .anyMatch(message -> message.contains("differs from"));
    }

    @Test
    void sharedChildIsReported() {
        TreeNode root = new TreeNode(0, 20, "Root");
        TreeNode left = new TreeNode(0, 10, "Left");
        TreeNode right = new TreeNode(10, 20, "Right");
        TreeNode shared = new TreeNode(12, 14, "Shared");
        root.addChild(left);
        root.addChild(right);
        left.addChild(shared);
        right.addChild(shared);

        TreeValidator.ValidationResult result = validator.validate(treeOf(root));

        assertThat(result.isValid()).isFalse();
        assertThat(result.violations)
            .anyMatch(message -> message.contains("does not point back"))
            .anyMatch(message -> message.contains("appears more than once"));
    }
}
