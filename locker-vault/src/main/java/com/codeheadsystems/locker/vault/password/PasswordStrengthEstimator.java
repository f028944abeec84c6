package com.codeheadsystems.locker.vault.password;

import java.util.Locale;
import javax.inject.Singleton;

/**
 * Advisory 0..4 strength score for UI feedback. Carries no security guarantee.
 * <p>
 * One point each for length of at least 8, length of at least 12, mixed case, a digit, and a
 * symbol. Minus two for containing "password", minus one each for "123" and "abc". Clamped to
 * 0..4.
 */
@Singleton
public class PasswordStrengthEstimator {

  public static final int MAX_SCORE = 4;

  /**
   * Scores a password.
   *
   * @param password the candidate, may be null
   * @return the score in 0..4
   */
  public int score(String password) {
    if (password == null || password.isEmpty()) {
      return 0;
    }
    int score = 0;
    if (password.length() >= 8) {
      score++;
    }
    if (password.length() >= 12) {
      score++;
    }
    if (has(password, CharacterClass.LOWER) && has(password, CharacterClass.UPPER)) {
      score++;
    }
    if (has(password, CharacterClass.DIGITS)) {
      score++;
    }
    if (has(password, CharacterClass.SYMBOLS)) {
      score++;
    }

    String lower = password.toLowerCase(Locale.ROOT);
    if (lower.contains("password")) {
      score -= 2;
    }
    if (lower.contains("123")) {
      score--;
    }
    if (lower.contains("abc")) {
      score--;
    }
    return Math.max(0, Math.min(MAX_SCORE, score));
  }

  /**
   * Scores a password and maps it to a display level.
   *
   * @param password the candidate
   * @return the level
   */
  public StrengthLevel level(String password) {
    return StrengthLevel.fromScore(score(password));
  }

  private static boolean has(String password, CharacterClass characterClass) {
    for (int i = 0; i < password.length(); i++) {
      if (characterClass.contains(password.charAt(i))) {
        return true;
      }
    }
    return false;
  }
}
