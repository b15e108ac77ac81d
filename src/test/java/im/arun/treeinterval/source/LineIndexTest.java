package im.arun.treeinterval.source;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import im.arun.treeinterval.model.Position;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class LineIndexTest {

    // ab\n  cd\r\n  ef
    private static final String MIXED = "ab\ncd\r\nef";

    @Test
    @DisplayName("recognises \\n, \\r\\n and a lone \\r as terminators")
    void lineTerminators() {
        assertThat(new LineIndex(MIXED).lineCount()).isEqualTo(3);
        assertThat(new LineIndex("a\rb").lineCount()).isEqualTo(2);
        assertThat(new LineIndex("a\n").lineCount()).isEqualTo(1);
        assertThat(new LineIndex("").lineCount()).isZero();
        assertThat(new LineIndex(null).lineCount()).isZero();
    }

    @Test
    void lineSpanIncludesTerminator() {
        LineIndex index = new LineIndex(MIXED);

        Position second = index.lineSpan(2);

        assertThat(second.getStart()).isEqualTo(3);
        assertThat(second.getEnd()).isEqualTo(7);
        assertThat(second.getLineStart()).isEqualTo(2);
        assertThat(second.getColEnd()).isEqualTo(2);
        assertThat(index.lineSpan(3).getEnd()).isEqualTo(MIXED.length());
    }

    @Test
    @DisplayName("content span trims indentation and trailing blanks")
    void contentSpanTrims() {
        LineIndex index = new LineIndex("if a:\n    x = 1  \n");

        Position content = index.contentSpan(2);

        assertThat(content.getStart()).isEqualTo(10);
        assertThat(content.getEnd()).isEqualTo(15);
        assertThat(content.getColStart()).isEqualTo(4);
        assertThat(content.getColEnd()).isEqualTo(9);
    }

    @Test
    void blankLineHasEmptyContent() {
        LineIndex index = new LineIndex("a\n   \nb\n");

        assertThat(index.contentSpan(2).size()).isZero();
    }

    @Test
    void offsetsAndColumns() {
        LineIndex index = new LineIndex(MIXED);

        assertThat(index.offsetOf(1, 0)).isZero();
        assertThat(index.offsetOf(3, 1)).isEqualTo(8);
        assertThat(index.offsetOf(2, 2)).isEqualTo(5);
        assertThat(index.columnOf(8)).isEqualTo(1);
    }

    @Test
    void lineOfOffset() {
        LineIndex index = new LineIndex(MIXED);

        assertThat(index.lineOf(0)).isEqualTo(1);
        assertThat(index.lineOf(2)).isEqualTo(1);
        assertThat(index.lineOf(3)).isEqualTo(2);
        assertThat(index.lineOf(6)).isEqualTo(2);
        assertThat(index.lineOf(7)).isEqualTo(3);
        assertThat(index.lineOf(MIXED.length())).isEqualTo(3);
    }

    @Test
    @DisplayName("out-of-range lines, columns and offsets are rejected")
    void outOfRange() {
        LineIndex index = new LineIndex(MIXED);

        assertThatThrownBy(() -> index.lineSpan(0)).isInstanceOf(IndexOutOfBoundsException.class);
        assertThatThrownBy(() -> index.contentSpan(4)).isInstanceOf(IndexOutOfBoundsException.class);
        assertThatThrownBy(() -> index.offsetOf(1, 3)).isInstanceOf(IndexOutOfBoundsException.class);
        assertThatThrownBy(() -> index.offsetOf(1, -1)).isInstanceOf(IndexOutOfBoundsException.class);
        assertThatThrownBy(() -> index.lineOf(-1)).isInstanceOf(IndexOutOfBoundsException.class);
        assertThatThrownBy(() -> index.lineOf(MIXED.length() + 1)).isInstanceOf(IndexOutOfBoundsException.class);
        assertThatThrownBy(() -> new LineIndex("").lineOf(0)).isInstanceOf(IndexOutOfBoundsException.class);
    }
}
