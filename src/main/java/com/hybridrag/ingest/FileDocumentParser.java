package com.hybridrag.ingest;

import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public class FileDocumentParser implements DocumentParser {
    private static final Pattern HEADING = Pattern.compile("^#+\\s+(.+)$", Pattern.MULTILINE);

    private final List<String> extensions;

    public FileDocumentParser(List<String> extensions) {
        this.extensions = extensions.stream()
                .map(extension -> extension.toLowerCase(Locale.ROOT))
                .toList();
    }

    @Override
    public boolean supports(Path path) {
        String fileName = path.getFileName().toString().toLowerCase(Locale.ROOT);
        return extensions.stream().anyMatch(fileName::endsWith);
    }

    @Override
    public ParsedDocument parse(String sourceUri) throws ParseException {
        Path path = resolve(sourceUri);
        if (!supports(path)) {
            throw new ParseException(sourceUri, "Unsupported file type: " + path.getFileName());
        }
        String content;
        try {
            content = new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ParseException(sourceUri, "Unable to read " + path, e);
        }
        String normalized = content.replace("\r\n", "\n").replace('\r', '\n').strip();
        return new ParsedDocument(sourceUri, title(path, normalized), normalized);
    }

    static String title(Path path, String text) {
        Matcher matcher = HEADING.matcher(text);
        if (matcher.find()) {
            return matcher.group(1).strip();
        }
        String fileName = path.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }

    private static Path resolve(String sourceUri) throws ParseException {
        if (sourceUri == null || sourceUri.isBlank()) {
            throw new ParseException(sourceUri, "Source URI is blank");
        }
        try {
            if (sourceUri.startsWith("file:")) {
                return Path.of(URI.create(sourceUri));
            }
            if (sourceUri.contains("://")) {
                throw new ParseException(sourceUri, "Unsupported source scheme: " + sourceUri);
            }
            return Path.of(sourceUri);
        } catch (IllegalArgumentException e) {
            throw new ParseException(sourceUri, "Malformed source URI: " + sourceUri, e);
        }
    }
}
