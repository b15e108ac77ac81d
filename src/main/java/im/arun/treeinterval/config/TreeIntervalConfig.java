package im.arun.treeinterval.config;

import im.arun.treeinterval.chain.LabelSchemaLoader;
import im.arun.treeinterval.model.IntervalTree;
import im.arun.treeinterval.model.Statement;
import lombok.Data;

@Data
public class TreeIntervalConfig {
    private char topMarker = Statement.DEFAULT_TOP_MARKER;
    private char chainMarker = Statement.DEFAULT_CHAIN_MARKER;
    private char currentMarker = Statement.DEFAULT_CURRENT_MARKER;
    private String labelSchema = LabelSchemaLoader.PYTHON_SCHEMA;
    private int indentSize = IntervalTree.DEFAULT_INDENT_SIZE;
    private boolean prettyPrint = false;
}
