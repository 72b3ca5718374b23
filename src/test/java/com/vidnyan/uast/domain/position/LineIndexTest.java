package com.vidnyan.uast.domain.position;

import com.vidnyan.uast.domain.node.Position;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LineIndexTest {

    @Test
    void trailingNewline_ShouldNotOpenAnotherLine() {
        LineIndex index = LineIndex.of("a=1\n");

        assertEquals(1, index.lineCount());
        assertEquals(3, index.lineLength(1));
        assertFalse(index.hasLine(2));
    }

    @Test
    void emptySource_ShouldHaveOneEmptyLine() {
        LineIndex index = LineIndex.of("");

        assertEquals(1, index.lineCount());
        assertEquals(new Position(0, 1, 0), index.position(1, 0));
    }

    @Test
    void allTerminators_ShouldSplitLines() {
        LineIndex index = LineIndex.of("a\r\nbb\rccc\nd");

        assertEquals(4, index.lineCount());
        assertEquals(0, index.lineStart(1));
        assertEquals(3, index.lineStart(2));
        assertEquals(6, index.lineStart(3));
        assertEquals(10, index.lineStart(4));
        assertEquals(2, index.lineLength(2));
    }

    @Test
    void offsets_ShouldCountUtf8Bytes() {
        LineIndex index = LineIndex.of("é = 'ü'\nx");

        assertEquals(10, index.lineStart(2));
        assertEquals(11, index.size());
    }

    @Test
    void position_ShouldClampColumnToLineEnd() {
        LineIndex index = LineIndex.of("ab\ncdef\n");

        assertEquals(new Position(2, 1, 2), index.position(1, 40));
        assertEquals(new Position(5, 2, 2), index.position(2, 2));
    }

    @Test
    void position_ShouldRejectUnknownLine() {
        LineIndex index = LineIndex.of("ab\n");

        assertThrows(IllegalArgumentException.class, () -> index.position(0, 0));
        assertThrows(IllegalArgumentException.class, () -> index.position(2, 0));
        assertThrows(IllegalArgumentException.class, () -> index.position(1, -1));
    }

    @Test
    void manyLines_ShouldGrowIndex() {
        String source = "x\n".repeat(100);

        LineIndex index = LineIndex.of(source);

        assertEquals(100, index.lineCount());
        assertEquals(198, index.lineStart(100));
    }
}
