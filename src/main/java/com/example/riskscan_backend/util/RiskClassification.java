package com.example.riskscan_backend.util;

/**
 * Fixed score bands. The classification never depends on the label proposed by the reasoning step.
 */
public enum RiskClassification {
    LOW(0, 33),
    MEDIUM(34, 66),
    HIGH(67, 100);

    private final int minScore;
    private final int maxScore;

    RiskClassification(int minScore, int maxScore) {
        this.minScore = minScore;
        this.maxScore = maxScore;
    }

    public int minScore() {
        return minScore;
    }

    public int maxScore() {
        return maxScore;
    }

    /**
     * Maps a risk score to its band.
     *
     * @param score integer risk score.
     * @return the band containing {@code score}.
     * @throws IllegalArgumentException when {@code score} is outside {@code [0, 100]}.
     */
    public static RiskClassification fromScore(int score) {
        for (RiskClassification c : values()) {
            if (score >= c.minScore && score <= c.maxScore) {
                return c;
            }
        }
        throw new IllegalArgumentException("score out of range: " + score);
    }
}
