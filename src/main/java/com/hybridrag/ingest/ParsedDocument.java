package com.hybridrag.ingest;

public record ParsedDocument(String sourceUri, String title, String text) {
}
