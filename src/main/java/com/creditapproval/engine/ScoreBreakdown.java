package com.creditapproval.engine;

import java.util.List;

/**
 * Credit score with the components it was built from.
 *
 * @param components    the four weighted components, one per {@link ScoreComponentType}
 * @param weightedScore weighted sum of the components, clamped to [0, 100]
 * @param overLimit     active principal exceeds the approved limit
 * @param score         final score: 0 when over limit, otherwise the weighted score
 */
public record ScoreBreakdown(
    List<ScoreComponent> components,
    int weightedScore,
    boolean overLimit,
    int score
) {
    public ScoreBreakdown {
        components = List.copyOf(components);
    }

    public ScoreComponent component(ScoreComponentType type) {
        return components.stream()
                .filter(component -> component.type() == type)
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("No component of type " + type));
    }
}
