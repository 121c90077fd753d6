package com.creditapproval.engine;

import java.math.BigDecimal;

/**
 * One input of the credit score before weighting.
 *
 * @param type       which component
 * @param rawValue   measured quantity (a ratio or a count)
 * @param normalized the quantity mapped onto [0, 100], higher is better
 * @param weight     percentage weight in the final score
 */
public record ScoreComponent(
    ScoreComponentType type,
    BigDecimal rawValue,
    int normalized,
    int weight
) {
    public ScoreComponent {
        if (type == null) {
            throw new IllegalArgumentException("Component type cannot be null");
        }
        if (normalized < 0 || normalized > 100) {
            throw new IllegalArgumentException("Normalized value must be within [0, 100]: " + normalized);
        }
    }
}
