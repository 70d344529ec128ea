package tech.yump.sealmail.entity.message;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class Rfc822ContentEncodingTest {

  @Test
  @DisplayName("Encodings should be undone in reverse order of application")
  void decodingOrder_Reversed() {
    assertThat(Rfc822ContentEncoding.decodingOrder("sudoplatform-compression, sudoplatform-crypto"))
            .containsExactly(Rfc822ContentEncoding.CRYPTO, Rfc822ContentEncoding.COMPRESSION);
  }

  @Test
  @DisplayName("Missing Content-Encoding should mean sealed binary data")
  void decodingOrder_Default() {
    assertThat(Rfc822ContentEncoding.decodingOrder(null))
            .containsExactly(Rfc822ContentEncoding.BINARY_DATA, Rfc822ContentEncoding.CRYPTO);
  }

  @Test
  @DisplayName("Values should be matched ignoring case and surrounding whitespace")
  void fromHeaderValue_Lenient() {
    assertEquals(Rfc822ContentEncoding.CRYPTO, Rfc822ContentEncoding.fromHeaderValue("  SudoPlatform-Crypto "));
    assertThrows(EmailMessageUnsealException.class, () -> Rfc822ContentEncoding.fromHeaderValue("gzip"));
  }
}
