package im.arun.treeinterval.service;

import im.arun.treeinterval.chain.ChainNavigator;
import im.arun.treeinterval.chain.LabelSchema;
import im.arun.treeinterval.chain.LabelSchemaLoader;
import im.arun.treeinterval.config.ConfigLoader;
import im.arun.treeinterval.config.TreeIntervalConfig;
import im.arun.treeinterval.error.MalformedStatementException;
import im.arun.treeinterval.json.TreeJsonCodec;
import im.arun.treeinterval.model.IntervalTree;
import im.arun.treeinterval.model.Position;
import im.arun.treeinterval.model.Span;
import im.arun.treeinterval.model.Statement;
import im.arun.treeinterval.model.TreeNode;
import im.arun.treeinterval.source.LineIndex;
import im.arun.treeinterval.source.LivePosition;
import im.arun.treeinterval.source.LivePositionResolver;
import im.arun.treeinterval.tree.BestMatchFinder;
import im.arun.treeinterval.tree.TreeBuilder;
import im.arun.treeinterval.verification.TreeValidator;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Entry point tying together tree construction, lookups, statement navigation and the
 * JSON codec under one configuration.
 */
public class TreeIntervalService {
    private static final Logger logger = LoggerFactory.getLogger(TreeIntervalService.class);

    @Getter
    private final TreeIntervalConfig config;
    @Getter
    private final ChainNavigator navigator;
    private final TreeJsonCodec codec;
    private final TreeValidator validator;

    public TreeIntervalService() {
        this(new ConfigLoader().load());
    }

    public TreeIntervalService(TreeIntervalConfig config) {
        this(config, new LabelSchemaLoader().load(config.getLabelSchema()));
    }

    public TreeIntervalService(TreeIntervalConfig config, LabelSchema schema) {
        this.config = config;
        this.navigator = new ChainNavigator(schema);
        this.codec = new TreeJsonCodec(config.isPrettyPrint());
        this.validator = new TreeValidator();
    }

    /**
     * Builds a tree over {@code source} from a position source's spans.
     */
    public IntervalTree buildTree(String source, Collection<Span> spans) {
        IntervalTree tree = new IntervalTree(source, null, config.getIndentSize());
        List<TreeNode> nodes = TreeBuilder.insertMany(tree, spans);
        logger.info("Built tree with {} structural nodes from {} spans", tree.flatten().size(), nodes.size());
        return tree;
    }

    public Optional<TreeNode> findBestMatch(IntervalTree tree, int targetStart, int targetEnd) {
        return BestMatchFinder.findBestMatch(tree, targetStart, targetEnd);
    }

    /**
     * Most specific node covering the position the resolver reports as executing.
     */
    public Optional<TreeNode> findCurrentNode(IntervalTree tree, LivePositionResolver resolver) {
        return resolver.currentPosition().flatMap(position -> findNodeAt(tree, position));
    }

    /**
     * Most specific node covering a live position. Line numbers are taken relative to the
     * tree's {@code startLineno} when it is set. Without columns the line's text, minus
     * indentation and trailing whitespace, is the target.
     */
    public Optional<TreeNode> findNodeAt(IntervalTree tree, LivePosition position) {
        if (tree.isEmpty() || tree.getSource() == null) {
            return Optional.empty();
        }

        LineIndex index = tree.getLineIndex();
        int line = tree.getStartLineno() != null
            ? position.getLine() - tree.getStartLineno() + 1
            : position.getLine();
        if (line < 1 || line > index.lineCount()) {
            logger.debug("Live line {} falls outside the {} source lines", position.getLine(), index.lineCount());
            return Optional.empty();
        }

        Position target;
        if (position.hasColumns()) {
            try {
                target = new Position(index.offsetOf(line, position.getColStart()), index.offsetOf(line, position.getColEnd()));
            } catch (IndexOutOfBoundsException | IllegalArgumentException e) {
                logger.debug("Ignoring columns of live position {}: {}", position, e.getMessage());
                target = index.contentSpan(line);
            }
        } else {
            target = index.contentSpan(line);
        }
        return BestMatchFinder.findBestMatch(tree, target.getStart(), target.getEnd());
    }

    public Optional<TreeNode> topStatement(TreeNode node) {
        return navigator.topStatement(node);
    }

    public Optional<TreeNode> nextAttribute(TreeNode node) {
        return navigator.nextAttribute(node);
    }

    public Optional<TreeNode> previousAttribute(TreeNode node) {
        return navigator.previousAttribute(node);
    }

    public boolean isAssignmentTarget(TreeNode node) {
        return navigator.isAssignmentTarget(node);
    }

    public Statement statement(IntervalTree tree, TreeNode node) {
        if (tree.getSource() == null) {
            throw new MalformedStatementException("Tree has no source text");
        }
        return navigator.statement(node, tree.getSource());
    }

    /**
     * Statement around {@code node} rendered line by line with the configured markers.
     */
    public String renderStatement(IntervalTree tree, TreeNode node) {
        return statement(tree, node).asText(config.getTopMarker(), config.getChainMarker(), config.getCurrentMarker());
    }

    public TreeValidator.ValidationResult validate(IntervalTree tree) {
        return validator.validate(tree);
    }

    public String toJson(IntervalTree tree) {
        return codec.toJson(tree);
    }

    public IntervalTree fromJson(String json) {
        IntervalTree tree = codec.fromJson(json);
        logger.info("Loaded tree with {} structural nodes", tree.flatten().size());
        return tree;
    }
}
