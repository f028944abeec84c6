package com.codeheadsystems.locker.vault.store;

/**
 * Raised when a stored document cannot be written or read back.
 */
public class DocumentStoreException extends RuntimeException {

  /**
   * Instantiates a new Document store exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public DocumentStoreException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
