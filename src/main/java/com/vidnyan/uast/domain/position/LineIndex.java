package com.vidnyan.uast.domain.position;

import com.vidnyan.uast.domain.node.Position;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Byte offsets of the line starts of a source text, built in one pass.
 * <p>
 * {@code \n}, {@code \r\n} and a lone {@code \r} end a line. A terminator at the very end
 * of the text does not open another line, so {@code "a=1\n"} has one line.
 * Offsets count UTF-8 bytes.
 */
public final class LineIndex {

    private final int[] starts;
    private final int[] lengths;
    private final int size;

    private LineIndex(int[] starts, int[] lengths, int size) {
        this.starts = starts;
        this.lengths = lengths;
        this.size = size;
    }

    public static LineIndex of(String source) {
        byte[] bytes = source.getBytes(StandardCharsets.UTF_8);
        int[] starts = new int[16];
        int[] lengths = new int[16];
        int lines = 0;
        int start = 0;
        int i = 0;
        while (i < bytes.length) {
            byte b = bytes[i];
            if (b == '\n' || b == '\r') {
                int terminator = (b == '\r' && i + 1 < bytes.length && bytes[i + 1] == '\n') ? 2 : 1;
                if (lines == starts.length) {
                    starts = Arrays.copyOf(starts, lines * 2);
                    lengths = Arrays.copyOf(lengths, lines * 2);
                }
                starts[lines] = start;
                lengths[lines] = i - start;
                lines++;
                i += terminator;
                start = i;
            } else {
                i++;
            }
        }
        if (start < bytes.length || lines == 0) {
            if (lines == starts.length) {
                starts = Arrays.copyOf(starts, lines + 1);
                lengths = Arrays.copyOf(lengths, lines + 1);
            }
            starts[lines] = start;
            lengths[lines] = bytes.length - start;
            lines++;
        }
        return new LineIndex(Arrays.copyOf(starts, lines), Arrays.copyOf(lengths, lines), bytes.length);
    }

    public int lineCount() {
        return starts.length;
    }

    /**
     * Source length in bytes.
     */
    public int size() {
        return size;
    }

    public boolean hasLine(int line) {
        return line >= 1 && line <= starts.length;
    }

    public int lineStart(int line) {
        checkLine(line);
        return starts[line - 1];
    }

    /**
     * Length of {@code line} in bytes, terminator excluded.
     */
    public int lineLength(int line) {
        checkLine(line);
        return lengths[line - 1];
    }

    /**
     * Position of {@code column} on {@code line}; columns past the line end are clamped to it.
     */
    public Position position(int line, int column) {
        checkLine(line);
        if (column < 0) {
            throw new IllegalArgumentException("Negative column: " + column);
        }
        int clamped = Math.min(column, lengths[line - 1]);
        return new Position(starts[line - 1] + clamped, line, clamped);
    }

    private void checkLine(int line) {
        if (!hasLine(line)) {
            throw new IllegalArgumentException("Line " + line + " outside 1.." + starts.length);
        }
    }
}
