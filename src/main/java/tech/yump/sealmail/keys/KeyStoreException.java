package tech.yump.sealmail.keys;

/**
 * Runtime exception raised by a {@link KeyStore} implementation when a key operation fails
 * (missing key, cipher failure, malformed key material).
 */
public class KeyStoreException extends RuntimeException {

  public KeyStoreException(String message) {
    super(message);
  }

  public KeyStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
