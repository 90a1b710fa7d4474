package uk.gegc.adaptivequiz.features.oracle.domain.model;

public record PerformanceInsights(String summary, String recommendations) {
}
