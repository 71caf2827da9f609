package com.hybridrag.rerank;

import java.io.IOException;
import java.util.List;

public interface BatchRelevanceJudge {
    String judge(String query, List<String> documents) throws IOException;
}
