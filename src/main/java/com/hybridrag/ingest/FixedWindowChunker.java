package com.hybridrag.ingest;

import java.util.ArrayList;
import java.util.List;

public class FixedWindowChunker implements Chunker {
    private final int overlapTokens;

    public FixedWindowChunker(int overlapTokens) {
        if (overlapTokens < 0) {
            throw new IllegalArgumentException("overlapTokens must be >= 0");
        }
        this.overlapTokens = overlapTokens;
    }

    @Override
    public List<ChunkDraft> chunk(String text, int minTokens, int maxTokens) {
        if (maxTokens <= overlapTokens) {
            throw new IllegalArgumentException("maxTokens must exceed overlapTokens (" + overlapTokens + ")");
        }
        List<int[]> spans = Tokens.spans(text);
        List<int[]> ranges = new ArrayList<>();

        int start = 0;
        while (start < spans.size()) {
            int endExclusive = Math.min(spans.size(), start + maxTokens);
            ranges.add(new int[] { start, endExclusive });
            if (endExclusive == spans.size()) {
                break;
            }
            start = Math.max(endExclusive - overlapTokens, start + 1);
        }

        // a short tail is absorbed by the window before it
        if (ranges.size() > 1) {
            int[] last = ranges.get(ranges.size() - 1);
            int[] previous = ranges.get(ranges.size() - 2);
            int freshTokens = last[1] - previous[1];
            if (freshTokens < minTokens) {
                ranges.remove(ranges.size() - 1);
                previous[1] = last[1];
            }
        }

        List<ChunkDraft> chunks = new ArrayList<>(ranges.size());
        for (int[] range : ranges) {
            chunks.add(new ChunkDraft(chunks.size(), Tokens.slice(text, spans, range[0], range[1]), range[1] - range[0]));
        }
        return chunks;
    }

    static List<String> fullWindows(String text, int windowTokens, int overlapTokens) {
        List<int[]> spans = Tokens.spans(text);
        List<String> windows = new ArrayList<>();
        if (spans.size() <= windowTokens) {
            windows.add(text.strip());
            return windows;
        }
        int step = Math.max(1, windowTokens - overlapTokens);
        int start = 0;
        while (true) {
            int endExclusive = start + windowTokens;
            if (endExclusive >= spans.size()) {
                int alignedStart = spans.size() - windowTokens;
                windows.add(Tokens.slice(text, spans, alignedStart, spans.size()));
                break;
            }
            windows.add(Tokens.slice(text, spans, start, endExclusive));
            start += step;
        }
        return windows;
    }
}
