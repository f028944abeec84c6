package com.codeheadsystems.locker.vault.password;

/**
 * Display label for a {@link PasswordStrengthEstimator} score.
 */
public enum StrengthLevel {
  VERY_WEAK("Very Weak"),
  WEAK("Weak"),
  GOOD("Good"),
  STRONG("Strong");

  private final String label;

  StrengthLevel(String label) {
    this.label = label;
  }

  /**
   * Maps a 0..4 score to its level.
   *
   * @param score the score
   * @return the level
   */
  public static StrengthLevel fromScore(int score) {
    if (score >= 4) {
      return STRONG;
    }
    if (score == 3) {
      return GOOD;
    }
    if (score == 2) {
      return WEAK;
    }
    return VERY_WEAK;
  }

  public String label() {
    return label;
  }
}
