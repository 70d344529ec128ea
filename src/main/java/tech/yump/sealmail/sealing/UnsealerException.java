package tech.yump.sealmail.sealing;

import tech.yump.sealmail.crypto.CryptoErrorKind;
import tech.yump.sealmail.crypto.SealMailCryptoException;

/**
 * Failures detected by the {@link Unsealer} itself. Key store failures are not wrapped and reach
 * the caller as {@link tech.yump.sealmail.keys.KeyStoreException}.
 */
public abstract class UnsealerException extends SealMailCryptoException {

  protected UnsealerException(CryptoErrorKind kind, String message) {
    super(kind, message);
  }

  protected UnsealerException(CryptoErrorKind kind, String message, Throwable cause) {
    super(kind, message, cause);
  }

  /** Asymmetric sealed data shorter than the wrapped key zone. */
  public static class SealedDataTooShortException extends UnsealerException {
    public SealedDataTooShortException(String message) {
      super(CryptoErrorKind.FRAMING, message);
    }
  }

  /** Sealed data that is not valid base64. */
  public static class SealedDataMalformedException extends UnsealerException {
    public SealedDataMalformedException(String message, Throwable cause) {
      super(CryptoErrorKind.FRAMING, message, cause);
    }
  }

  public static class UnsupportedAlgorithmException extends UnsealerException {
    public UnsupportedAlgorithmException(String message) {
      super(CryptoErrorKind.POLICY, message);
    }
  }
}
