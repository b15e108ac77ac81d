package im.arun.treeinterval.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * A statement cut into five consecutive slices:
 * {@code top.before + before + current + after + top.after}.
 *
 * <p>{@code top} is the statement text outside the attribute chain, {@code before} and
 * {@code after} are the chain links around the current node and {@code current} is the
 * part contributed by the node itself.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Statement {

    public static final char DEFAULT_TOP_MARKER = '^';
    public static final char DEFAULT_CHAIN_MARKER = '~';
    public static final char DEFAULT_CURRENT_MARKER = '*';

    private static final Pattern LINE_BREAK = Pattern.compile("\r\n|\r|\n");

    private PartStatement top = new PartStatement();
    private String before = "";
    private String current = "";
    private String after = "";

    public String getText() {
        return top.getBefore() + before + current + after + top.getAfter();
    }

    public String getMarkers() {
        return getMarkers(DEFAULT_TOP_MARKER, DEFAULT_CHAIN_MARKER, DEFAULT_CURRENT_MARKER);
    }

    /**
     * Marker string of the same length as {@link #getText()}. Each non-blank character is
     * replaced by its zone's marker; line breaks are kept and other whitespace becomes a space.
     */
    public String getMarkers(char topMarker, char chainMarker, char currentMarker) {
        StringBuilder markers = new StringBuilder();
        mark(markers, top.getBefore(), topMarker);
        mark(markers, before, chainMarker);
        mark(markers, current, currentMarker);
        mark(markers, after, chainMarker);
        mark(markers, top.getAfter(), topMarker);
        return markers.toString();
    }

    private static void mark(StringBuilder markers, String text, char marker) {
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\n' || c == '\r') {
                markers.append(c);
            } else if (Character.isWhitespace(c)) {
                markers.append(' ');
            } else {
                markers.append(marker);
            }
        }
    }

    public String asText() {
        return asText(DEFAULT_TOP_MARKER, DEFAULT_CHAIN_MARKER, DEFAULT_CURRENT_MARKER);
    }

    /**
     * Each non-empty source line followed by its marker line. Lines end at {@code \n},
     * {@code \r\n} or a lone {@code \r}, as in {@link im.arun.treeinterval.source.LineIndex}.
     */
    public String asText(char topMarker, char chainMarker, char currentMarker) {
        String[] lines = LINE_BREAK.split(getText(), -1);
        String[] markerLines = LINE_BREAK.split(getMarkers(topMarker, chainMarker, currentMarker), -1);

        List<String> result = new ArrayList<>();
        for (int i = 0; i < lines.length; i++) {
            if (lines[i].isEmpty()) {
                continue;
            }
            result.add(lines[i]);
            result.add(markerLines[i]);
        }
        return String.join("\n", result);
    }
}
