package com.hybridrag.ingest;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Default chunker. Accumulates paragraphs until the next one would overflow {@code maxTokens}.
 *
 * <p>Two situations need more than paragraph granularity:
 * <ul>
 * <li>A paragraph larger than {@code maxTokens} on its own is force-split into overlapping
 * fixed-size windows.</li>
 * <li>A buffer still under {@code minTokens} when the next paragraph would overflow it is topped up
 * with that paragraph's leading tokens, so flushed chunks never fall under the minimum.</li>
 * </ul>
 * A trailing remainder under {@code minTokens} is appended to the previous chunk.
 */
public class ParagraphChunker implements Chunker {
    private static final Pattern PARAGRAPH_BREAK = Pattern.compile("\\n\\s*\\n");
    private static final String PARAGRAPH_SEPARATOR = "\n\n";

    private final int forceSplitOverlapTokens;

    public ParagraphChunker(int forceSplitOverlapTokens) {
        this.forceSplitOverlapTokens = forceSplitOverlapTokens;
    }

    @Override
    public List<ChunkDraft> chunk(String text, int minTokens, int maxTokens) {
        if (minTokens < 0 || maxTokens <= 0 || minTokens > maxTokens) {
            throw new IllegalArgumentException("Invalid token bounds min=" + minTokens + " max=" + maxTokens);
        }
        if (text == null || text.isBlank()) {
            return List.of();
        }

        Deque<String> pending = new ArrayDeque<>();
        Arrays.stream(PARAGRAPH_BREAK.split(text.strip()))
                .map(String::strip)
                .filter(paragraph -> !paragraph.isEmpty())
                .forEach(pending::addLast);

        List<String> emitted = new ArrayList<>();
        StringBuilder buffer = new StringBuilder();
        int bufferTokens = 0;

        while (!pending.isEmpty()) {
            String paragraph = pending.pollFirst();
            int paragraphTokens = Tokens.count(paragraph);

            if (bufferTokens > 0 && bufferTokens + paragraphTokens > maxTokens) {
                if (bufferTokens < minTokens) {
                    String[] parts = Tokens.splitAfter(paragraph, maxTokens - bufferTokens);
                    buffer.append(PARAGRAPH_SEPARATOR).append(parts[0]);
                    emitted.add(buffer.toString());
                    buffer.setLength(0);
                    bufferTokens = 0;
                    if (!parts[1].isEmpty()) {
                        pending.addFirst(parts[1]);
                    }
                    continue;
                }
                emitted.add(buffer.toString());
                buffer.setLength(0);
                bufferTokens = 0;
            }

            if (paragraphTokens > maxTokens) {
                emitted.addAll(FixedWindowChunker.fullWindows(paragraph, maxTokens, forceSplitOverlapTokens));
                continue;
            }

            if (bufferTokens > 0) {
                buffer.append(PARAGRAPH_SEPARATOR);
            }
            buffer.append(paragraph);
            bufferTokens += paragraphTokens;
        }

        if (bufferTokens > 0) {
            if (bufferTokens < minTokens && !emitted.isEmpty()) {
                int last = emitted.size() - 1;
                emitted.set(last, emitted.get(last) + PARAGRAPH_SEPARATOR + buffer);
            } else {
                emitted.add(buffer.toString());
            }
        }

        List<ChunkDraft> chunks = new ArrayList<>(emitted.size());
        for (String content : emitted) {
            chunks.add(new ChunkDraft(chunks.size(), content, Tokens.count(content)));
        }
        return chunks;
    }
}
