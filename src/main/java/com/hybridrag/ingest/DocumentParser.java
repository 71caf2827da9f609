package com.hybridrag.ingest;

import java.nio.file.Path;

public interface DocumentParser {
    boolean supports(Path path);

    ParsedDocument parse(String sourceUri) throws ParseException;
}
