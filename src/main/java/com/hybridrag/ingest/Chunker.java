package com.hybridrag.ingest;

import java.util.List;

public interface Chunker {
    List<ChunkDraft> chunk(String text, int minTokens, int maxTokens);
}
