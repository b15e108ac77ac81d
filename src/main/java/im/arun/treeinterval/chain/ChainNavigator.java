package im.arun.treeinterval.chain;

import im.arun.treeinterval.error.MalformedStatementException;
import im.arun.treeinterval.model.PartStatement;
import im.arun.treeinterval.model.Statement;
import im.arun.treeinterval.model.TreeNode;

import java.util.LinkedList;
import java.util.List;
import java.util.Optional;

/**
 * Read-only queries over a built tree: the statement enclosing a node, the neighbouring
 * links of its attribute chain, and the statement text split around the node.
 *
 * <p>An attribute chain such as {@code a.b().c} nests leftmost-first: each link's accessed
 * object is its first child. Moving to the next link means climbing to the parent while the
 * current node is that parent's first child; moving to the previous link means stepping to
 * the first child.
 */
public class ChainNavigator {

    private final LabelSchema schema;

    public ChainNavigator(LabelSchema schema) {
        this.schema = schema;
    }

    /**
     * Nearest node classified as a statement, walking from {@code node} (inclusive) towards
     * the root. Group-mates are considered together with their structural node.
     */
    public Optional<TreeNode> topStatement(TreeNode node) {
        TreeNode current = node;
        while (current != null) {
            for (TreeNode member : current.withGroupMates()) {
                if (schema.isStatement(member.getLabel())) {
                    return Optional.of(member);
                }
            }
            current = current.getParent();
        }
        return Optional.empty();
    }

    /**
     * The chain link that continues to the right of {@code node}, bounded by its statement.
     * Empty when the node has no enclosing statement or the chain ends at the node.
     */
    public Optional<TreeNode> nextAttribute(TreeNode node) {
        Optional<TreeNode> top = topStatement(node);
        if (top.isEmpty()) {
            return Optional.empty();
        }
        TreeNode boundary = structuralOf(top.get());

        TreeNode current = structuralOf(node);
        while (current != boundary && current.getParent() != null) {
            TreeNode parent = current.getParent();
            if (parent == boundary) {
                return Optional.empty();
            }
            List<TreeNode> siblings = parent.getChildren();
            if (siblings.isEmpty() || siblings.get(0) != current) {
                return Optional.empty();
            }
            Optional<TreeNode> link = chainLinkIn(parent);
            if (link.isPresent()) {
                return link;
            }
            current = parent;
        }
        return Optional.empty();
    }

    /**
     * The object accessed by the attribute link {@code node}: its first child. Empty when
     * {@code node} is not a chain link or has no children.
     */
    public Optional<TreeNode> previousAttribute(TreeNode node) {
        if (chainLinkIn(node).isEmpty()) {
            return Optional.empty();
        }
        List<TreeNode> children = structuralOf(node).getChildren();
        return children.isEmpty() ? Optional.empty() : Optional.of(children.get(0));
    }

    /**
     * The attribute chain passing through {@code node}, from its head (the innermost,
     * leftmost expression) to its outermost link inside the statement. Intermediate
     * non-link nodes such as calls are skipped.
     */
    public List<TreeNode> chainLinks(TreeNode node) {
        TreeNode outermost = node;
        Optional<TreeNode> next = nextAttribute(outermost);
        while (next.isPresent()) {
            outermost = next.get();
            next = nextAttribute(outermost);
        }

        if (chainLinkIn(outermost).isEmpty()) {
            return List.of(node);
        }

        LinkedList<TreeNode> links = new LinkedList<>();
        TreeNode current = structuralOf(outermost);
        while (current != null) {
            List<TreeNode> children = current.getChildren();
            Optional<TreeNode> link = chainLinkIn(current);
            if (link.isPresent()) {
                links.addFirst(link.get());
            } else if (children.isEmpty()) {
                links.addFirst(current);
            }
            current = children.isEmpty() ? null : children.get(0);
        }
        return links;
    }

    /**
     * True when {@code node} lies on the target side of an assignment-like statement, that
     * is inside one of the statement's leading target children as counted by
     * {@link LabelSchema#targetChildCount}. Annotations and assigned values are not targets.
     */
    public boolean isAssignmentTarget(TreeNode node) {
        Optional<TreeNode> top = topStatement(node);
        if (top.isEmpty() || !schema.isAssignmentLike(top.get().getLabel())) {
            return false;
        }
        TreeNode statement = structuralOf(top.get());
        List<TreeNode> parts = statement.getChildren();
        int targets = schema.targetChildCount(top.get().getLabel(), parts.size());
        if (targets <= 0) {
            return false;
        }

        TreeNode current = structuralOf(node);
        while (current != null && current.getParent() != statement) {
            current = current.getParent();
        }
        return current != null && parts.indexOf(current) < targets;
    }

    /**
     * Splits the text of {@code node}'s statement into the surrounding statement, the chain
     * links before and after the node, and the node's own contribution.
     *
     * @throws MalformedStatementException when the source is missing, the node has no
     *         enclosing statement, or the offsets do not fit the source
     */
    public Statement statement(TreeNode node, String source) {
        if (source == null) {
            throw new MalformedStatementException("No source text available for " + node);
        }
        TreeNode top = topStatement(node)
            .orElseThrow(() -> new MalformedStatementException("No enclosing statement for " + node));

        int topStart = top.getStart();
        int topEnd = top.getEnd();
        int nodeStart = node.getStart();
        int nodeEnd = node.getEnd();
        int currentStart = previousAttribute(node).map(TreeNode::getEnd).orElse(nodeStart);
        int chainEnd = nextAttribute(node).map(TreeNode::getEnd).orElse(nodeEnd);

        if (topStart < 0 || topEnd > source.length()) {
            throw new MalformedStatementException(String.format(
                "Statement [%d, %d) lies outside source of length %d", topStart, topEnd, source.length()));
        }
        if (!(topStart <= nodeStart && nodeStart <= currentStart && currentStart <= nodeEnd
            && nodeEnd <= chainEnd && chainEnd <= topEnd)) {
            throw new MalformedStatementException(String.format(
                "Inconsistent offsets: statement [%d, %d), node [%d, %d), current from %d, chain to %d",
                topStart, topEnd, nodeStart, nodeEnd, currentStart, chainEnd));
        }

        return new Statement(
            new PartStatement(source.substring(topStart, nodeStart), source.substring(chainEnd, topEnd)),
            source.substring(nodeStart, currentStart),
            source.substring(currentStart, nodeEnd),
            source.substring(nodeEnd, chainEnd));
    }

    private Optional<TreeNode> chainLinkIn(TreeNode node) {
        for (TreeNode member : node.withGroupMates()) {
            if (schema.isAttributeChainLink(member.getLabel())) {
                return Optional.of(member);
            }
        }
        return Optional.empty();
    }

    /**
     * The node that holds the structure for {@code node}'s span group.
     */
    static TreeNode structuralOf(TreeNode node) {
        if (node.isStructural()) {
            return node;
        }
        for (TreeNode mate : node.getGroupMates()) {
            if (mate.isStructural()) {
                return mate;
            }
        }
        return node;
    }
}
