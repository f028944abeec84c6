package com.codeheadsystems.locker.vault.password;

/**
 * Character classes a generated password can draw from.
 */
public enum CharacterClass {
  UPPER("ABCDEFGHIJKLMNOPQRSTUVWXYZ"),
  LOWER("abcdefghijklmnopqrstuvwxyz"),
  DIGITS("0123456789"),
  SYMBOLS("!@#$%^&*()_+-=[]{}|;:,.<>?");

  private final String alphabet;

  CharacterClass(String alphabet) {
    this.alphabet = alphabet;
  }

  public String alphabet() {
    return alphabet;
  }

  /**
   * True if the character belongs to this class.
   *
   * @param c the character
   * @return true if present in the alphabet
   */
  public boolean contains(char c) {
    return alphabet.indexOf(c) >= 0;
  }
}
