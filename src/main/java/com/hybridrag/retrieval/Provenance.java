package com.hybridrag.retrieval;

public enum Provenance {
    VECTOR,
    LEXICAL,
    BOTH;

    static Provenance of(boolean inVector, boolean inLexical) {
        if (inVector && inLexical) {
            return BOTH;
        }
        return inVector ? VECTOR : LEXICAL;
    }
}
