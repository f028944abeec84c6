package com.codeheadsystems.locker.crypto.exceptions;

/**
 * The type Vault exception. Carries a {@link VaultErrorKind} so callers branch on the kind
 * rather than on the message.
 */
public class VaultException extends RuntimeException {

  private final VaultErrorKind kind;

  /**
   * Instantiates a new Vault exception.
   *
   * @param kind    the failure kind
   * @param message the message
   */
  public VaultException(final VaultErrorKind kind, final String message) {
    super(message);
    this.kind = kind;
  }

  /**
   * Instantiates a new Vault exception.
   *
   * @param kind    the failure kind
   * @param message the message
   * @param cause   the cause
   */
  public VaultException(final VaultErrorKind kind, final String message, final Throwable cause) {
    super(message, cause);
    this.kind = kind;
  }

  /**
   * The failure kind.
   *
   * @return the kind
   */
  public VaultErrorKind kind() {
    return kind;
  }
}
