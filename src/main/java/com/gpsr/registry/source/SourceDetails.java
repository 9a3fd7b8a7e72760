package com.gpsr.registry.source;

/**
 * Administrative edit of a source's descriptive fields. Null fields are left unchanged.
 */
public record SourceDetails(String sourceName, String description, String sourceUrl, String trustNote) {
}
