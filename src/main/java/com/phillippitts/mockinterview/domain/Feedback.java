package com.phillippitts.mockinterview.domain;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Raw scoring produced asynchronously by the backend after completion.
 *
 * @param overallScore    overall score on the raw 0-10 scale
 * @param subscores       per-dimension raw scores (missing dimensions count as 0)
 * @param strengths       strengths identified
 * @param weaknesses      areas to improve
 * @param recommendations follow-up suggestions
 */
public record Feedback(
        double overallScore,
        Map<ScoreDimension, Double> subscores,
        List<String> strengths,
        List<String> weaknesses,
        List<String> recommendations
) {

    public Feedback {
        Map<ScoreDimension, Double> copy = new EnumMap<>(ScoreDimension.class);
        if (subscores != null) {
            subscores.forEach((k, v) -> {
                if (k != null && v != null) {
                    copy.put(k, v);
                }
            });
        }
        subscores = Map.copyOf(copy);
        strengths = strengths == null ? List.of() : List.copyOf(strengths);
        weaknesses = weaknesses == null ? List.of() : List.copyOf(weaknesses);
        recommendations = recommendations == null ? List.of() : List.copyOf(recommendations);
    }

    public double subscore(ScoreDimension dimension) {
        return subscores.getOrDefault(dimension, 0.0);
    }
}
