package io.github.byzatic.cronengine.output;

import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Shapes runtime output for a chat platform with a per-message size limit.
 */
public final class OutputFormatter {
    public static final int DEFAULT_CHUNK_LIMIT = 2000;
    public static final int DEFAULT_CODE_BLOCK_LINES = 20;

    private static final String FENCE = "```";
    private static final Pattern CODE_BLOCK = Pattern.compile(
            "^([ \\t]*```[^\\n]*\\n)([\\s\\S]*?)(^[ \\t]*```[ \\t]*$)", Pattern.MULTILINE);

    private OutputFormatter() {
    }

    /**
     * Splits {@code text} into chunks of at most {@code limit} characters along line boundaries.
     * <p>
     * A chunk that ends inside a fenced code block is closed with a fence and the next chunk re-opens it with
     * the same header ({@code ```lang}), so no chunk leaves a fence dangling. Lines longer than the limit are
     * hard-wrapped. Blank chunks are dropped.
     */
    public static @NotNull List<String> split(@NotNull String text, int limit) {
        String normalized = text.replace("\r\n", "\n").replace('\r', '\n');
        if (normalized.length() <= limit) return List.of(normalized);
        return new FenceAwareSplitter(limit).split(normalized.split("\n", -1));
    }

    public static @NotNull List<String> split(@NotNull String text) {
        return split(text, DEFAULT_CHUNK_LIMIT);
    }

    /**
     * Shortens fenced code blocks longer than {@code maxLines}, keeping the first and last lines and
     * replacing the middle with {@code "... (N lines omitted)"}.
     */
    public static @NotNull String truncateCodeBlocks(@NotNull String text, int maxLines) {
        Matcher m = CODE_BLOCK.matcher(text);
        StringBuilder out = new StringBuilder();
        while (m.find()) {
            String open = m.group(1);
            String body = m.group(2);
            String close = m.group(3);
            List<String> lines = new ArrayList<>(Arrays.asList(body.split("\n", -1)));
            if (!lines.isEmpty() && lines.get(lines.size() - 1).isEmpty()) lines.remove(lines.size() - 1);

            String replacement;
            if (lines.size() <= maxLines) {
                replacement = open + body + close;
            } else {
                int keepTop = (maxLines + 1) / 2;
                int keepBottom = maxLines / 2;
                int omitted = lines.size() - keepTop - keepBottom;
                replacement = open
                        + String.join("\n", lines.subList(0, keepTop)) + "\n"
                        + "... (" + omitted + " lines omitted)\n"
                        + String.join("\n", lines.subList(lines.size() - keepBottom, lines.size())) + "\n"
                        + close;
            }
            m.appendReplacement(out, Matcher.quoteReplacement(replacement));
        }
        m.appendTail(out);
        return out.toString();
    }

    public static @NotNull String truncateCodeBlocks(@NotNull String text) {
        return truncateCodeBlocks(text, DEFAULT_CODE_BLOCK_LINES);
    }

    private static final class FenceAwareSplitter {
        private static final String CLOSE = "\n" + FENCE;

        private final int limit;
        private final List<String> chunks = new ArrayList<>();
        private final StringBuilder cur = new StringBuilder();
        private boolean inFence = false;
        private String fenceHeader = FENCE;

        private FenceAwareSplitter(int limit) {
            this.limit = limit;
        }

        List<String> split(String[] lines) {
            for (String line : lines) {
                String trimmed = line.stripLeading();
                boolean fenceLine = trimmed.startsWith(FENCE);
                // a chunk that will be left inside a fence keeps room for the closing fence
                int cap = inFence != fenceLine ? limit - CLOSE.length() : limit;

                int curLen = effectiveCurLen();
                int nextLen = (curLen > 0 ? curLen + 1 : 0) + line.length();
                if (nextLen > cap && cur.length() > 0) flush();

                if (line.length() > remainingRoom(cap)) {
                    String rest = line;
                    while (!rest.isEmpty()) {
                        int room = Math.max(1, remainingRoom(cap));
                        String take = rest.substring(0, Math.min(room, rest.length()));
                        appendLine(take);
                        rest = rest.substring(take.length());
                        if (!rest.isEmpty()) flush();
                    }
                } else {
                    appendLine(line);
                }

                if (fenceLine) {
                    if (!inFence) {
                        inFence = true;
                        fenceHeader = trimmed.stripTrailing();
                    } else {
                        inFence = false;
                        fenceHeader = FENCE;
                    }
                }
            }
            flush();

            List<String> out = new ArrayList<>();
            for (String c : chunks) {
                if (!c.isBlank()) out.add(c);
            }
            return out;
        }

        private int effectiveCurLen() {
            if (cur.length() > 0) return cur.length();
            return inFence ? fenceHeader.length() : 0;
        }

        private int remainingRoom(int cap) {
            int base = effectiveCurLen();
            int sep = base > 0 ? 1 : 0;
            return Math.max(0, cap - base - sep);
        }

        private void appendLine(String line) {
            if (cur.length() == 0 && inFence) cur.append(fenceHeader);
            if (cur.length() > 0) cur.append('\n');
            cur.append(line);
        }

        private void flush() {
            if (cur.length() == 0) return;
            if (inFence) cur.append(CLOSE);
            chunks.add(cur.toString());
            cur.setLength(0);
        }
    }
}
