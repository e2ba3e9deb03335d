package org.carball.dbbench.analyzer;

/**
 * One line of the score breakdown. Penalties carry negative points, bonuses positive ones.
 */
public record ScoreAdjustment(String reason, int points) {
}
