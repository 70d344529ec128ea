package tech.yump.sealmail.crypto;

/**
 * Base class of the exceptions raised by the sealing and secure e-mail services. The
 * {@link CryptoErrorKind} lets callers branch on the failure category without matching on
 * concrete exception types.
 */
public abstract class SealMailCryptoException extends RuntimeException {

  private final CryptoErrorKind kind;

  protected SealMailCryptoException(CryptoErrorKind kind, String message) {
    super(message);
    this.kind = kind;
  }

  protected SealMailCryptoException(CryptoErrorKind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = kind;
  }

  public CryptoErrorKind kind() {
    return kind;
  }
}
