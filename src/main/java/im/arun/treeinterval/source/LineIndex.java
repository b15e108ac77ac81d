package im.arun.treeinterval.source;

import im.arun.treeinterval.model.Position;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Line-to-offset table for one source text, built once. Lines are 1-based, columns and
 * offsets 0-based. A line ends at {@code \n}, {@code \r\n} or a lone {@code \r}.
 */
public class LineIndex {

    private final String source;

    // start offset of every line, plus the source length as a sentinel
    private final int[] lineStarts;

    // offset just past each line's content, before its terminator
    private final int[] contentEnds;

    public LineIndex(String source) {
        this.source = source == null ? "" : source;

        List<Integer> starts = new ArrayList<>();
        List<Integer> ends = new ArrayList<>();
        int lineStart = 0;
        int i = 0;
        while (i < this.source.length()) {
            char c = this.source.charAt(i);
            if (c == '\n' || c == '\r') {
                starts.add(lineStart);
                ends.add(i);
                if (c == '\r' && i + 1 < this.source.length() && this.source.charAt(i + 1) == '\n') {
                    i++;
                }
                lineStart = i + 1;
            }
            i++;
        }
        if (lineStart < this.source.length()) {
            starts.add(lineStart);
            ends.add(this.source.length());
        }

        this.lineStarts = new int[starts.size() + 1];
        this.contentEnds = new int[ends.size()];
        for (int line = 0; line < starts.size(); line++) {
            lineStarts[line] = starts.get(line);
            contentEnds[line] = ends.get(line);
        }
        lineStarts[starts.size()] = this.source.length();
    }

    public String getSource() {
        return source;
    }

    public int lineCount() {
        return contentEnds.length;
    }

    /**
     * Offset range of the line including its terminator.
     */
    public Position lineSpan(int line) {
        checkLine(line);
        return new Position(lineStarts[line - 1], lineStarts[line], line, 0, line, contentEnds[line - 1] - lineStarts[line - 1]);
    }

    /**
     * Offset range of the line's text with surrounding whitespace and the terminator removed.
     * A blank line yields an empty span at its start.
     */
    public Position contentSpan(int line) {
        checkLine(line);
        int start = lineStarts[line - 1];
        int end = contentEnds[line - 1];
        while (start < end && Character.isWhitespace(source.charAt(start))) {
            start++;
        }
        while (end > start && Character.isWhitespace(source.charAt(end - 1))) {
            end--;
        }
        int lineStart = lineStarts[line - 1];
        return new Position(start, end, line, start - lineStart, line, end - lineStart);
    }

    public int offsetOf(int line, int column) {
        checkLine(line);
        int lineLength = contentEnds[line - 1] - lineStarts[line - 1];
        if (column < 0 || column > lineLength) {
            throw new IndexOutOfBoundsException("Column " + column + " outside line " + line + " of length " + lineLength);
        }
        return lineStarts[line - 1] + column;
    }

    /**
     * 1-based line holding {@code offset}. The source length maps to the last line.
     */
    public int lineOf(int offset) {
        if (offset < 0 || offset > source.length() || lineCount() == 0) {
            throw new IndexOutOfBoundsException("Offset " + offset + " outside source of length " + source.length());
        }
        int index = Arrays.binarySearch(lineStarts, 0, lineCount(), offset);
        if (index < 0) {
            index = -index - 2;
        }
        return Math.min(index, lineCount() - 1) + 1;
    }

    public int columnOf(int offset) {
        return offset - lineStarts[lineOf(offset) - 1];
    }

    private void checkLine(int line) {
        if (line < 1 || line > lineCount()) {
            throw new IndexOutOfBoundsException("Line " + line + " outside 1.." + lineCount());
        }
    }
}
