package org.carball.dbbench.analyzer;

import lombok.Getter;

@Getter
public enum ScoreGrade {
    A(90, "Excellent", "green", "🏆"),
    B(80, "Good", "green", "✅"),
    C(70, "Acceptable", "yellow", "⚠️"),
    D(60, "Needs Work", "yellow", "🔧"),
    E(50, "Poor", "red", "❌"),
    F(0, "Critical", "red", "🔴");

    private final int minScore;
    private final String label;
    private final String color;
    private final String emoji;

    ScoreGrade(int minScore, String label, String color, String emoji) {
        this.minScore = minScore;
        this.label = label;
        this.color = color;
        this.emoji = emoji;
    }

    public static ScoreGrade fromScore(int score) {
        for (ScoreGrade grade : values()) {
            if (score >= grade.minScore) {
                return grade;
            }
        }
        return F;
    }
}
