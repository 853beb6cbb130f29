package io.github.byzatic.cronengine.output;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

class OutputFormatterTest {

    private static int fenceCount(String chunk) {
        int n = 0;
        for (int i = chunk.indexOf("```"); i >= 0; i = chunk.indexOf("```", i + 3)) n++;
        return n;
    }

    private static String lines(String prefix, int count) {
        return IntStream.rangeClosed(1, count).mapToObj(i -> prefix + i).collect(Collectors.joining("\n"));
    }

    @Test
    void shortText_isOneChunk() {
        assertEquals(List.of("Summary: all good"), OutputFormatter.split("Summary: all good"));
    }

    @Test
    void longPlainText_splitsOnLineBoundaries_withinLimit() {
        String text = lines("line number ", 400);

        List<String> chunks = OutputFormatter.split(text, 200);

        assertTrue(chunks.size() > 1);
        chunks.forEach(c -> assertTrue(c.length() <= 200, c));
        assertEquals(text, String.join("\n", chunks));
    }

    @Test
    void codeFence_isClosedAndReopenedAcrossChunks() {
        String text = "Report:\n```java\n" + lines("int x = ", 120) + "\n```\nDone.";

        List<String> chunks = OutputFormatter.split(text, 300);

        assertTrue(chunks.size() > 2);
        for (String c : chunks) {
            assertTrue(c.length() <= 300, c);
            assertEquals(0, fenceCount(c) % 2, "unbalanced fence in chunk:\n" + c);
        }
        assertTrue(chunks.get(1).startsWith("```java\n"), chunks.get(1));
        assertTrue(chunks.get(chunks.size() - 1).endsWith("Done."));
    }

    @Test
    void fenceLinesNearTheLimit_stillLeaveRoomForClosingFence() {
        // lines sized so a fenced chunk would otherwise end within three characters of the limit
        String text = "```\n" + IntStream.range(0, 40).mapToObj(i -> "y".repeat(47)).collect(Collectors.joining("\n")) + "\n```";

        for (String c : OutputFormatter.split(text, 100)) {
            assertTrue(c.length() <= 100, c);
            assertEquals(0, fenceCount(c) % 2, c);
        }
    }

    @Test
    void overlongLine_isHardWrapped() {
        String line = "z".repeat(950);

        List<String> chunks = OutputFormatter.split(line, 200);

        chunks.forEach(c -> assertTrue(c.length() <= 200));
        assertEquals(line, String.join("", chunks));
    }

    @Test
    void windowsLineEndings_areNormalized() {
        assertEquals(List.of("a\nb"), OutputFormatter.split("a\r\nb", 100));
    }

    @Test
    void longCodeBlock_keepsHeadAndTail() {
        String text = "before\n```\n" + lines("l", 30) + "\n```\nafter";

        String out = OutputFormatter.truncateCodeBlocks(text, 20);

        assertTrue(out.startsWith("before\n```\nl1\n"));
        assertTrue(out.contains("\nl10\n... (10 lines omitted)\nl21\n"), out);
        assertTrue(out.endsWith("l30\n```\nafter"), out);
        assertFalse(out.contains("\nl15\n"));
    }

    @Test
    void shortCodeBlock_andProse_areUntouched() {
        String text = "intro\n```python\nprint(1)\nprint(2)\n```\n" + lines("prose ", 50);
        assertEquals(text, OutputFormatter.truncateCodeBlocks(text));
    }

    @Test
    void everyBlockIsTruncatedIndependently() {
        String block = "```\n" + lines("x", 25) + "\n```";
        String out = OutputFormatter.truncateCodeBlocks(block + "\n\n" + block, 10);

        assertEquals(2, out.split("\\.\\.\\. \\(15 lines omitted\\)", -1).length - 1);
    }
}
