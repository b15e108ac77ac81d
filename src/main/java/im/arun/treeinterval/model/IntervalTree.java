package im.arun.treeinterval.model;

import im.arun.treeinterval.source.LineIndex;
import im.arun.treeinterval.tree.BestMatchFinder;
import im.arun.treeinterval.tree.TreeBuilder;
import im.arun.treeinterval.util.TreeUtils;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Containment hierarchy of node spans over one source snapshot.
 *
 * <p>Build the tree completely before sharing it; insertion must not run concurrently
 * with lookups on the same instance.
 */
@Getter
@Setter
public class IntervalTree {

    public static final int DEFAULT_INDENT_SIZE = 4;

    private String source;

    private Integer startLineno;

    private int indentSize = DEFAULT_INDENT_SIZE;

    private TreeNode root;

    /**
     * Line table of {@link #source}, rebuilt whenever the source is replaced. Null without
     * a source.
     */
    @Setter(AccessLevel.NONE)
    private LineIndex lineIndex;

    public IntervalTree() {
    }

    public IntervalTree(String source) {
        setSource(source);
    }

    public IntervalTree(String source, Integer startLineno, int indentSize) {
        setSource(source);
        this.startLineno = startLineno;
        this.indentSize = indentSize;
    }

    public void setSource(String source) {
        this.source = source;
        this.lineIndex = source == null ? null : new LineIndex(source);
    }

    public boolean isEmpty() {
        return root == null;
    }

    public Optional<TreeNode> root() {
        return Optional.ofNullable(root);
    }

    public void insert(TreeNode node) {
        TreeBuilder.insert(this, node);
    }

    public void insertMany(Collection<Span> spans) {
        TreeBuilder.insertMany(this, spans);
    }

    public Optional<TreeNode> findBestMatch(int targetStart, int targetEnd) {
        return BestMatchFinder.findBestMatch(this, targetStart, targetEnd);
    }

    /**
     * Pre-order list of structural nodes. Group-mates are not enumerated.
     */
    public List<TreeNode> flatten() {
        return TreeUtils.flatten(root);
    }

    /**
     * Pre-order list in which each structural node is followed by its group-mates.
     */
    public List<TreeNode> flattenWithGroupMates() {
        return TreeUtils.flattenWithGroupMates(root);
    }
}
