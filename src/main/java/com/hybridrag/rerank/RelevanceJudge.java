package com.hybridrag.rerank;

import java.io.IOException;

public interface RelevanceJudge {
    double score(String query, String document) throws IOException;
}
