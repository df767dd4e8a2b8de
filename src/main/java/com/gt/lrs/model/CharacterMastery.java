package com.gt.lrs.model;

/**
 * Mastery of one character for one user: a score in [0,1] for each script and skill. Scores outside the range are
 * clamped on construction. A character without a stored record is treated as {@link #empty(long, int)}.
 */
public record CharacterMastery(long userId,
                               int characterId,
                               double hiraganaReading,
                               double hiraganaWriting,
                               double hiraganaListening,
                               double katakanaReading,
                               double katakanaWriting,
                               double katakanaListening) {

    public static final double MIN_SCORE = 0;
    public static final double MAX_SCORE = 1;

    public CharacterMastery {
        hiraganaReading = clamp(hiraganaReading);
        hiraganaWriting = clamp(hiraganaWriting);
        hiraganaListening = clamp(hiraganaListening);
        katakanaReading = clamp(katakanaReading);
        katakanaWriting = clamp(katakanaWriting);
        katakanaListening = clamp(katakanaListening);
    }

    public static CharacterMastery empty(long userId, int characterId) {
        return new CharacterMastery(userId, characterId, 0, 0, 0, 0, 0, 0);
    }

    public double getScore(Script script, Skill skill) {
        if (script == Script.Hiragana) {
            return switch (skill) {
                case Reading -> hiraganaReading;
                case Writing -> hiraganaWriting;
                case Listening -> hiraganaListening;
            };
        }

        return switch (skill) {
            case Reading -> katakanaReading;
            case Writing -> katakanaWriting;
            case Listening -> katakanaListening;
        };
    }

    public CharacterMastery withScore(Script script, Skill skill, double score) {
        double hr = hiraganaReading, hw = hiraganaWriting, hl = hiraganaListening;
        double kr = katakanaReading, kw = katakanaWriting, kl = katakanaListening;

        if (script == Script.Hiragana) {
            switch (skill) {
                case Reading -> hr = score;
                case Writing -> hw = score;
                case Listening -> hl = score;
            }
        } else {
            switch (skill) {
                case Reading -> kr = score;
                case Writing -> kw = score;
                case Listening -> kl = score;
            }
        }

        return new CharacterMastery(userId, characterId, hr, hw, hl, kr, kw, kl);
    }

    private static double clamp(double score) {
        if (Double.isNaN(score)) {
            return MIN_SCORE;
        }
        return Math.max(MIN_SCORE, Math.min(MAX_SCORE, score));
    }
}
