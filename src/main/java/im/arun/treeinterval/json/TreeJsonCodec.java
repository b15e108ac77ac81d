package im.arun.treeinterval.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import im.arun.treeinterval.error.DeserializationException;
import im.arun.treeinterval.model.IntervalTree;
import im.arun.treeinterval.model.Position;
import im.arun.treeinterval.model.TreeNode;
import im.arun.treeinterval.verification.TreeValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts trees to and from nested JSON documents.
 *
 * <p>Decoded trees are re-validated; any containment or grouping violation rejects the whole
 * document. Children are written in source order and re-sorted on load.
 */
public class TreeJsonCodec {
    private static final Logger logger = LoggerFactory.getLogger(TreeJsonCodec.class);

    private final ObjectMapper objectMapper;
    private final TreeValidator validator;

    public TreeJsonCodec() {
        this(false);
    }

    public TreeJsonCodec(boolean prettyPrint) {
        this.objectMapper = new ObjectMapper();
        if (prettyPrint) {
            this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
        }
        this.validator = new TreeValidator();
    }

    public String toJson(IntervalTree tree) {
        try {
            return objectMapper.writeValueAsString(toDocument(tree));
        } catch (JsonProcessingException e) {
            // only reachable through label attributes Jackson cannot serialize
            throw new IllegalStateException("Failed to serialize tree: " + e.getOriginalMessage(), e);
        }
    }

    public IntervalTree fromJson(String json) {
        if (json == null || json.trim().isEmpty()) {
            throw new DeserializationException("Empty tree document");
        }

        TreeDocument document;
        try {
            document = objectMapper.readValue(json, TreeDocument.class);
        } catch (JsonProcessingException e) {
            throw new DeserializationException("Malformed tree document: " + e.getOriginalMessage(), e);
        }
        return fromDocument(document);
    }

    public TreeDocument toDocument(IntervalTree tree) {
        TreeDocument document = new TreeDocument();
        document.setSource(tree.getSource());
        document.setStartLineno(tree.getStartLineno());
        document.setIndentSize(tree.getIndentSize());
        if (tree.getRoot() != null) {
            document.setRoot(toNodeDocument(tree.getRoot(), true));
        }
        return document;
    }

    public IntervalTree fromDocument(TreeDocument document) {
        if (document == null) {
            throw new DeserializationException("Empty tree document");
        }

        IntervalTree tree = new IntervalTree(
            document.getSource(),
            document.getStartLineno(),
            document.getIndentSize() != null ? document.getIndentSize() : IntervalTree.DEFAULT_INDENT_SIZE);
        if (document.getRoot() != null) {
            tree.setRoot(toNode(document.getRoot(), "root"));
        }

        TreeValidator.ValidationResult result = validator.validate(tree);
        if (!result.isValid()) {
            throw new DeserializationException("Tree document violates containment: " + String.join("; ", result.violations));
        }
        logger.debug("Decoded tree with {} nodes", result.checkedNodes);
        return tree;
    }

    private NodeDocument toNodeDocument(TreeNode node, boolean structural) {
        Position position = node.getPosition();
        NodeDocument document = new NodeDocument();
        document.setStart(position.getStart());
        document.setEnd(position.getEnd());
        document.setLineStart(position.getLineStart());
        document.setColStart(position.getColStart());
        document.setLineEnd(position.getLineEnd());
        document.setColEnd(position.getColEnd());
        document.setSelected(position.isSelected() ? Boolean.TRUE : null);
        document.setLabel(node.getLabel());

        if (structural) {
            if (!node.getGroupMates().isEmpty()) {
                List<NodeDocument> group = new ArrayList<>();
                for (TreeNode mate : node.getGroupMates()) {
                    group.add(toNodeDocument(mate, false));
                }
                document.setGroup(group);
            }
            List<NodeDocument> children = new ArrayList<>();
            for (TreeNode child : node.getChildren()) {
                children.add(toNodeDocument(child, true));
            }
            document.setChildren(children);
        }
        return document;
    }

    private TreeNode toNode(NodeDocument document, String path) {
        if (document.getStart() == null || document.getEnd() == null) {
            throw new DeserializationException("Node at " + path + " is missing start or end");
        }

        Position position;
        try {
            position = new Position(document.getStart(), document.getEnd(),
                document.getLineStart(), document.getColStart(), document.getLineEnd(), document.getColEnd());
        } catch (IllegalArgumentException e) {
            throw new DeserializationException("Node at " + path + ": " + e.getMessage(), e);
        }
        position.setSelected(Boolean.TRUE.equals(document.getSelected()));

        TreeNode node = new TreeNode(position, document.getLabel());

        List<NodeDocument> children = document.getChildren();
        if (children != null) {
            for (int i = 0; i < children.size(); i++) {
                node.addChild(toNode(children.get(i), path + ".children[" + i + "]"));
            }
        }

        List<NodeDocument> group = document.getGroup();
        if (group != null) {
            for (int i = 0; i < group.size(); i++) {
                NodeDocument mateDocument = group.get(i);
                String matePath = path + ".group[" + i + "]";
                if (mateDocument.getChildren() != null && !mateDocument.getChildren().isEmpty()) {
                    throw new DeserializationException("Group-mate at " + matePath + " must not have children");
                }
                if (mateDocument.getGroup() != null && !mateDocument.getGroup().isEmpty()) {
                    throw new DeserializationException("Group-mate at " + matePath + " must not carry a group");
                }
                node.addGroupMate(toNode(mateDocument, matePath));
            }
        }
        return node;
    }
}
