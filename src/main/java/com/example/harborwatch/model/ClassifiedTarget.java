package com.example.harborwatch.model;

/**
 * Correlation outcome paired with its presentation classification, as handed
 * to map renderers, image annotators and persistence writers.
 */
public record ClassifiedTarget(MatchResult result, Classification classification) {
}
