package im.arun.treeinterval.model;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Element of an {@link IntervalTree}: a position, an opaque label, owned children and a
 * non-owning back-reference to the parent.
 *
 * <p>Nodes compare by identity. Two nodes with the same position and label are distinct.
 * Children are kept in source order, sorted by {@code (start, end)}.
 */
@Getter
public class TreeNode {

    public static final Comparator<TreeNode> SOURCE_ORDER =
        Comparator.comparingInt(TreeNode::getStart).thenComparingInt(TreeNode::getEnd);

    private final Position position;

    private final NodeLabel label;

    private TreeNode parent;

    private final List<TreeNode> children = new ArrayList<>();

    private final List<TreeNode> groupMates = new ArrayList<>();

    private boolean groupMember;

    public TreeNode(Position position, NodeLabel label) {
        this.position = position;
        this.label = label;
    }

    public TreeNode(int start, int end, String kind) {
        this(new Position(start, end), NodeLabel.of(kind));
    }

    public int getStart() {
        return position.getStart();
    }

    public int getEnd() {
        return position.getEnd();
    }

    public int size() {
        return position.size();
    }

    public String getKind() {
        return label != null ? label.getKind() : null;
    }

    public boolean isSelected() {
        return position.isSelected();
    }

    public void setSelected(boolean selected) {
        position.setSelected(selected);
    }

    public List<TreeNode> getChildren() {
        return Collections.unmodifiableList(children);
    }

    public List<TreeNode> getGroupMates() {
        return Collections.unmodifiableList(groupMates);
    }

    public Optional<TreeNode> parent() {
        return Optional.ofNullable(parent);
    }

    public boolean isRoot() {
        return parent == null && !groupMember;
    }

    /**
     * True unless this node was folded into another node's span group on insertion.
     * Group-mates share the structural node's parent reference but never appear in a
     * children list.
     */
    public boolean isStructural() {
        return !groupMember;
    }

    public boolean contains(TreeNode other) {
        return position.contains(other.position);
    }

    /**
     * Parent's children minus this node. Empty for the root and for group-mates.
     */
    public List<TreeNode> getSiblings() {
        if (parent == null) {
            return Collections.emptyList();
        }
        List<TreeNode> siblings = new ArrayList<>(parent.children);
        if (!siblings.remove(this)) {
            return Collections.emptyList();
        }
        return siblings;
    }

    public Optional<TreeNode> getNext() {
        return adjacent(1);
    }

    public Optional<TreeNode> getPrevious() {
        return adjacent(-1);
    }

    private Optional<TreeNode> adjacent(int step) {
        if (parent == null) {
            return Optional.empty();
        }
        int index = parent.children.indexOf(this);
        int target = index + step;
        if (index < 0 || target < 0 || target >= parent.children.size()) {
            return Optional.empty();
        }
        return Optional.of(parent.children.get(target));
    }

    /**
     * Attaches {@code child} at its source-order slot and points its parent here.
     * Containment is not checked; tree construction goes through the builder.
     */
    public void addChild(TreeNode child) {
        int index = Collections.binarySearch(children, child, SOURCE_ORDER);
        if (index < 0) {
            index = -index - 1;
        } else {
            // equal keys only arise from hand-built trees; keep them in arrival order
            while (index < children.size() && SOURCE_ORDER.compare(children.get(index), child) == 0) {
                index++;
            }
        }
        children.add(index, child);
        child.linkParent(this);
    }

    public boolean removeChild(TreeNode child) {
        if (children.remove(child)) {
            child.linkParent(null);
            return true;
        }
        return false;
    }

    /**
     * Records {@code mate} as sharing this node's span. The relation is symmetric and
     * spans every member already in the group.
     */
    public void addGroupMate(TreeNode mate) {
        if (mate == this || groupMates.contains(mate)) {
            return;
        }
        for (TreeNode existing : groupMates) {
            existing.groupMates.add(mate);
            mate.groupMates.add(existing);
        }
        groupMates.add(mate);
        mate.groupMates.add(this);
        mate.groupMember = true;
        mate.parent = parent;
    }

    /**
     * This node followed by its group-mates.
     */
    public List<TreeNode> withGroupMates() {
        List<TreeNode> group = new ArrayList<>(groupMates.size() + 1);
        group.add(this);
        group.addAll(groupMates);
        return group;
    }

    private void linkParent(TreeNode newParent) {
        parent = newParent;
        for (TreeNode mate : groupMates) {
            mate.parent = newParent;
        }
    }

    @Override
    public String toString() {
        return "TreeNode(" + position + ", " + label + ")";
    }
}
