package im.arun.treeinterval.cli;

import im.arun.treeinterval.config.ConfigLoader;
import im.arun.treeinterval.config.TreeIntervalConfig;
import im.arun.treeinterval.error.TreeIntervalException;
import im.arun.treeinterval.model.IntervalTree;
import im.arun.treeinterval.model.PositionFormat;
import im.arun.treeinterval.model.TreeNode;
import im.arun.treeinterval.service.TreeIntervalService;
import im.arun.treeinterval.source.LivePosition;
import im.arun.treeinterval.verification.TreeValidator;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.stream.Collectors;

/**
 * Command-line interface for querying a serialized interval tree.
 */
@Command(
    name = "tree-interval",
    description = "Look up the syntax node enclosing a source range or line in a serialized interval tree",
    mixinStandardHelpOptions = true,
    version = "Tree Interval 1.0"
)
public class TreeIntervalCLI implements Callable<Integer> {

    @Option(names = {"--tree"}, description = "Path to the tree JSON document", required = true)
    private String treePath;

    @Option(names = {"--source"}, description = "Source text file, replaces the source embedded in the tree")
    private String sourcePath;

    @Option(names = {"--range"}, description = "Target offsets as start:end")
    private String range;

    @Option(names = {"--line"}, description = "Target line (1-based)")
    private Integer line;

    @Option(names = {"--columns"}, description = "Column range on --line as start:end")
    private String columns;

    @Option(names = {"--statement"}, description = "Print the enclosing statement with markers")
    private boolean printStatement;

    @Option(names = {"--config"}, description = "Path to a configuration YAML file")
    private String configPath;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() throws Exception {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        Path treeFile = Paths.get(treePath);
        if (!Files.exists(treeFile)) {
            err.println("Error: tree file not found: " + treePath);
            return 1;
        }
        if (range != null && line != null) {
            err.println("Error: use either --range or --line, not both");
            return 1;
        }

        TreeIntervalConfig config = new ConfigLoader(configPath).load();
        TreeIntervalService service = new TreeIntervalService(config);

        IntervalTree tree;
        Optional<TreeNode> match;
        try {
            tree = service.fromJson(Files.readString(treeFile));
            if (sourcePath != null) {
                tree.setSource(Files.readString(Paths.get(sourcePath)));
            }

            if (range != null) {
                int[] bounds = parsePair(range, "--range");
                match = service.findBestMatch(tree, bounds[0], bounds[1]);
            } else if (line != null) {
                LivePosition position = LivePosition.ofLine(line);
                if (columns != null) {
                    int[] bounds = parsePair(columns, "--columns");
                    position.setColStart(bounds[0]);
                    position.setColEnd(bounds[1]);
                }
                match = service.findNodeAt(tree, position);
            } else {
                TreeValidator.ValidationResult result = service.validate(tree);
                out.println("Nodes: " + result.checkedNodes);
                out.println("Valid: " + result.isValid());
                return 0;
            }
        } catch (TreeIntervalException | IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            return 1;
        }

        if (match.isEmpty()) {
            out.println("No matching node");
            return 0;
        }

        TreeNode node = match.get();
        out.println("Match: " + node.getPosition().positionAs(PositionFormat.POSITION));
        out.println("Label: " + node.getLabel());
        service.topStatement(node).ifPresent(top ->
            out.println("Statement: " + top.getLabel() + " " + top.getPosition()));
        out.println("Chain: " + service.getNavigator().chainLinks(node).stream()
            .map(TreeNode::getKind)
            .collect(Collectors.joining(" -> ")));
        out.println("Assignment target: " + service.isAssignmentTarget(node));

        if (printStatement) {
            try {
                out.println();
                out.println(service.renderStatement(tree, node));
            } catch (TreeIntervalException e) {
                err.println("Error: " + e.getMessage());
                return 1;
            }
        }
        return 0;
    }

    static int[] parsePair(String value, String option) {
        String[] parts = value.split(":");
        if (parts.length != 2) {
            throw new IllegalArgumentException(option + " must be start:end, got " + value);
        }
        try {
            return new int[]{Integer.parseInt(parts[0].trim()), Integer.parseInt(parts[1].trim())};
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(option + " must be start:end, got " + value);
        }
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new TreeIntervalCLI()).execute(args);
        System.exit(exitCode);
    }
}
