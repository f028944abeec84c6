package com.codeheadsystems.locker.vault.password;

import com.codeheadsystems.locker.crypto.common.RandomProvider;
import java.util.EnumSet;
import java.util.Set;
import javax.inject.Inject;
import javax.inject.Singleton;

/**
 * Generates random passwords from a chosen set of character classes.
 * <p>
 * Each character is drawn uniformly from the concatenation of the enabled alphabets. Classes
 * are not balanced, so a short password may miss one of the enabled classes.
 */
@Singleton
public class PasswordGenerator {

  /**
   * Characters that are easy to confuse when read back.
   */
  static final String SIMILAR = "il1Lo0O";

  private final RandomProvider randomProvider;

  @Inject
  public PasswordGenerator(final RandomProvider randomProvider) {
    this.randomProvider = randomProvider;
  }

  /**
   * Generates a password.
   *
   * @param length  number of characters, at least 1
   * @param classes the enabled character classes, at least one
   * @return the password
   */
  public String generate(int length, Set<CharacterClass> classes) {
    return generate(length, classes, false);
  }

  /**
   * Generates a password, optionally leaving out look-alike characters ({@code il1Lo0O}).
   *
   * @param length         number of characters, at least 1
   * @param classes        the enabled character classes, at least one
   * @param excludeSimilar drop look-alike characters from the pool
   * @return the password
   * @throws IllegalArgumentException if the length is not positive or no characters are available
   */
  public String generate(int length, Set<CharacterClass> classes, boolean excludeSimilar) {
    if (length < 1) {
      throw new IllegalArgumentException("Length must be positive: " + length);
    }
    String pool = pool(classes, excludeSimilar);
    if (pool.isEmpty()) {
      throw new IllegalArgumentException("At least one character class must be enabled");
    }
    StringBuilder sb = new StringBuilder(length);
    for (int i = 0; i < length; i++) {
      sb.append(pool.charAt(randomProvider.nextIndex(pool.length())));
    }
    return sb.toString();
  }

  private static String pool(Set<CharacterClass> classes, boolean excludeSimilar) {
    if (classes == null || classes.isEmpty()) {
      return "";
    }
    StringBuilder pool = new StringBuilder();
    // enum order keeps the pool stable regardless of the caller's set implementation
    for (CharacterClass characterClass : EnumSet.copyOf(classes)) {
      for (char c : characterClass.alphabet().toCharArray()) {
        if (!excludeSimilar || SIMILAR.indexOf(c) < 0) {
          pool.append(c);
        }
      }
    }
    return pool.toString();
  }
}
