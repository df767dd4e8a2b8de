package com.gt.lrs.model;

public record UserMasteryHistory(int characterId,
                                 String characterHiragana,
                                 String characterKatakana,
                                 double hiraganaReading,
                                 double hiraganaWriting,
                                 double hiraganaListening,
                                 double katakanaReading,
                                 double katakanaWriting,
                                 double katakanaListening) {

    public double getTotalScore() {
        return hiraganaReading + hiraganaWriting + hiraganaListening + katakanaReading + katakanaWriting + katakanaListening;
    }
}
