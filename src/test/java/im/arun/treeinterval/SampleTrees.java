package im.arun.treeinterval;

import im.arun.treeinterval.model.IntervalTree;
import im.arun.treeinterval.model.NodeLabel;
import im.arun.treeinterval.model.Span;
import im.arun.treeinterval.model.TreeNode;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Hand-positioned span sets for small Python snippets, as a parser would report them.
 */
public final class SampleTrees {

    // 0123456789
    // x = a.b.c
    public static final String ASSIGN_FROM_CHAIN = "x = a.b.c\n";

    // 0123456789
    // a.b.c = x
    public static final String ASSIGN_TO_CHAIN = "a.b.c = x\n";

    // 012345678901
    // y = a.b().c
    public static final String CHAIN_WITH_CALL = "y = a.b().c\n";

    // line 1: 0..11, line 2: 12..30
    public static final String FUNCTION_RETURN = "def f(obj):\n    return obj.a.b\n";

    private SampleTrees() {}

    public static List<Span> assignFromChain() {
        return List.of(
            Span.of(0, 10, "Module"),
            Span.of(0, 9, "Assign"),
            new Span(0, 1, NodeLabel.of("Name").with("id", "x")),
            new Span(4, 9, NodeLabel.of("Attribute").with("attr", "c")),
            new Span(4, 7, NodeLabel.of("Attribute").with("attr", "b")),
            new Span(4, 5, NodeLabel.of("Name").with("id", "a")));
    }

    public static List<Span> assignToChain() {
        return List.of(
            Span.of(0, 10, "Module"),
            Span.of(0, 9, "Assign"),
            Span.of(0, 5, "Attribute"),
            Span.of(0, 3, "Attribute"),
            Span.of(0, 1, "Name"),
            Span.of(8, 9, "Name"));
    }

    public static List<Span> chainWithCall() {
        return List.of(
            Span.of(0, 12, "Module"),
            Span.of(0, 11, "Assign"),
            Span.of(0, 1, "Name"),
            Span.of(4, 11, "Attribute"),
            Span.of(4, 9, "Call"),
            Span.of(4, 7, "Attribute"),
            Span.of(4, 5, "Name"));
    }

    public static List<Span> functionReturn() {
        return List.of(
            Span.of(0, 31, "Module"),
            Span.of(0, 30, "FunctionDef"),
            Span.of(6, 9, "arguments"),
            Span.of(16, 30, "Return"),
            Span.of(23, 30, "Attribute"),
            Span.of(23, 28, "Attribute"),
            Span.of(23, 26, "Name"));
    }

    public static IntervalTree build(String source, List<Span> spans) {
        IntervalTree tree = new IntervalTree(source);
        tree.insertMany(spans);
        return tree;
    }

    public static TreeNode nodeAt(IntervalTree tree, int start, int end) {
        return tree.flattenWithGroupMates().stream()
            .filter(node -> node.getStart() == start && node.getEnd() == end)
            .findFirst()
            .orElseThrow(() -> new AssertionError("No node at [" + start + ", " + end + ")"));
    }

    /**
     * Nested rendering of spans and group sizes, e.g. {@code [0,100[10,40[15,35]]]}.
     */
    public static String shape(TreeNode node) {
        if (node == null) {
            return "";
        }
        String group = node.getGroupMates().isEmpty() ? "" : "x" + (node.getGroupMates().size() + 1);
        String children = node.getChildren().stream().map(SampleTrees::shape).collect(Collectors.joining());
        return "[" + node.getStart() + "," + node.getEnd() + group + children + "]";
    }
}
