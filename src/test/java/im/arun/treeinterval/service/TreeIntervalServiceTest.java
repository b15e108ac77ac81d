package im.arun.treeinterval.service;

import static im.arun.treeinterval.SampleTrees.nodeAt;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import im.arun.treeinterval.SampleTrees;
import im.arun.treeinterval.config.TreeIntervalConfig;
import im.arun.treeinterval.error.MalformedStatementException;
import im.arun.treeinterval.model.IntervalTree;
import im.arun.treeinterval.model.Statement;
import im.arun.treeinterval.model.TreeNode;
import im.arun.treeinterval.source.LineIndex;
import im.arun.treeinterval.source.LivePosition;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class TreeIntervalServiceTest {

    private TreeIntervalService service;
    private IntervalTree tree;

    @BeforeEach
    void setUp() {
        service = new TreeIntervalService();
        tree = service.buildTree(SampleTrees.FUNCTION_RETURN, SampleTrees.functionReturn());
    }

    @Test
    void buildTreeUsesConfiguredIndent() {
        TreeIntervalConfig config = new TreeIntervalConfig();
        config.setIndentSize(2);

        IntervalTree built = new TreeIntervalService(config)
            .buildTree(SampleTrees.FUNCTION_RETURN, SampleTrees.functionReturn());

        assertThat(built.getIndentSize()).isEqualTo(2);
        assertThat(SampleTrees.shape(built.getRoot()))
            .isEqualTo("[0,31[0,30[6,9][16,30[23,30[23,28[23,26]]]]]]");
    }

    @Nested
    @DisplayName("live positions")
    class LivePositions {

        @Test
        @DisplayName("a whole line resolves to the statement spanning its text")
        void wholeLine() {
            Optional<TreeNode> node = service.findNodeAt(tree, LivePosition.ofLine(2));

            assertThat(node.map(TreeNode::getKind)).contains("Return");
        }

        @Test
        void firstLineResolvesToFunction() {
            assertThat(service.findNodeAt(tree, LivePosition.ofLine(1)).map(TreeNode::getKind))
                .contains("FunctionDef");
        }

        @Test
        @DisplayName("a column range narrows the target")
        void columnRange() {
            Optional<TreeNode> node = service.findNodeAt(tree, new LivePosition(2, 11, 14));

            assertThat(node).containsSame(nodeAt(tree, 23, 26));
        }

        @Test
        @DisplayName("columns past the line end fall back to the line text")
        void invalidColumns() {
            Optional<TreeNode> node = service.findNodeAt(tree, new LivePosition(2, 11, 50));

            assertThat(node.map(TreeNode::getKind)).contains("Return");
        }

        @Test
        @DisplayName("line numbers are taken relative to the start line")
        void startLineOffset() {
            tree.setStartLineno(10);

            assertThat(service.findNodeAt(tree, LivePosition.ofLine(11)).map(TreeNode::getKind)).contains("Return");
            assertThat(service.findNodeAt(tree, LivePosition.ofLine(2))).isEmpty();
        }

        @Test
        void linesOutsideTheSource() {
            assertThat(service.findNodeAt(tree, LivePosition.ofLine(0))).isEmpty();
            assertThat(service.findNodeAt(tree, LivePosition.ofLine(3))).isEmpty();
        }

        @Test
        void treeWithoutSource() {
            tree.setSource(null);

            assertThat(service.findNodeAt(tree, LivePosition.ofLine(1))).isEmpty();
        }

        @Test
        @DisplayName("the current node follows the resolver")
        void currentNode() {
            assertThat(service.findCurrentNode(tree, () -> Optional.of(LivePosition.ofLine(2))).map(TreeNode::getKind))
                .contains("Return");
            assertThat(service.findCurrentNode(tree, Optional::empty)).isEmpty();
        }

        @Test
        @DisplayName("lookups reuse the tree's line index until the source changes")
        void lineIndexReuse() {
            LineIndex index = tree.getLineIndex();

            service.findNodeAt(tree, LivePosition.ofLine(2));
            service.findNodeAt(tree, LivePosition.ofLine(1));

            assertThat(tree.getLineIndex()).isSameAs(index);

            tree.setSource("def f(obj):\n");

            assertThat(tree.getLineIndex()).isNotSameAs(index);
            assertThat(tree.getLineIndex().lineCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("a shared service answers concurrent lookups on a built tree")
        void concurrentLookups() throws Exception {
            ExecutorService executor = Executors.newFixedThreadPool(8);
            try {
                List<Future<Optional<TreeNode>>> results = new ArrayList<>();
                for (int i = 0; i < 200; i++) {
                    int line = 1 + i % 2;
                    results.add(executor.submit(() -> service.findNodeAt(tree, LivePosition.ofLine(line))));
                }
                for (int i = 0; i < results.size(); i++) {
                    String expected = i % 2 == 0 ? "FunctionDef" : "Return";
                    assertThat(results.get(i).get().map(TreeNode::getKind)).contains(expected);
                }
            } finally {
                executor.shutdownNow();
            }
        }

        @Test
        @DisplayName("a replaced source is re-indexed")
        void sourceChange() {
            assertThat(service.findNodeAt(tree, LivePosition.ofLine(2))).isPresent();

            tree.setSource("def f(obj):\n");

            assertThat(service.findNodeAt(tree, LivePosition.ofLine(2))).isEmpty();
        }
    }

    @Nested
    @DisplayName("statements")
    class Statements {

        @Test
        void navigation() {
            TreeNode middle = nodeAt(tree, 23, 28);

            assertThat(service.topStatement(middle).map(TreeNode::getKind)).contains("Return");
            assertThat(service.nextAttribute(middle)).containsSame(nodeAt(tree, 23, 30));
            assertThat(service.previousAttribute(middle)).containsSame(nodeAt(tree, 23, 26));
            assertThat(service.isAssignmentTarget(middle)).isFalse();
        }

        @Test
        void statementParts() {
            Statement statement = service.statement(tree, nodeAt(tree, 23, 28));

            assertThat(statement.getTop().getBefore()).isEqualTo("return ");
            assertThat(statement.getBefore()).isEqualTo("obj");
            assertThat(statement.getCurrent()).isEqualTo(".a");
            assertThat(statement.getAfter()).isEqualTo(".b");
        }

        @Test
        @DisplayName("rendering uses the configured markers")
        void renderWithConfiguredMarkers() {
            assertThat(service.renderStatement(tree, nodeAt(tree, 23, 28)))
                .isEqualTo("return obj.a.b\n^^^^^^ ~~~**~~");

            TreeIntervalConfig config = new TreeIntervalConfig();
            config.setTopMarker('-');
            config.setChainMarker('=');
            config.setCurrentMarker('#');
            TreeIntervalService custom = new TreeIntervalService(config);

            assertThat(custom.renderStatement(tree, nodeAt(tree, 23, 28)))
                .isEqualTo("return obj.a.b\n------ ===##==");
        }

        @Test
        void missingSource() {
            tree.setSource(null);

            assertThatThrownBy(() -> service.statement(tree, nodeAt(tree, 23, 28)))
                .isInstanceOf(MalformedStatementException.class);
        }
    }

    @Test
    void jsonRoundTrip() {
        IntervalTree decoded = service.fromJson(service.toJson(tree));

        assertThat(SampleTrees.shape(decoded.getRoot())).isEqualTo(SampleTrees.shape(tree.getRoot()));
        assertThat(service.validate(decoded).isValid()).isTrue();
        assertThat(service.findNodeAt(decoded, new LivePosition(2, 11, 14)).map(TreeNode::getKind)).contains("Name");
    }
}
