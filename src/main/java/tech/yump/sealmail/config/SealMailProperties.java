package tech.yump.sealmail.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.util.Set;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the sealed e-mail crypto services under the 'sealmail' prefix.
 * Every property has a default, so the services work without any configuration.
 */
@ConfigurationProperties(prefix = "sealmail")
@Validated
public record SealMailProperties(

        @Valid
        @NotNull
        KeyStoreProperties keyStore
) {

    public SealMailProperties {
        if (keyStore == null) {
            keyStore = new KeyStoreProperties(null, null, null);
        }
    }

    // --- KeyStoreProperties ---
    /**
     * Settings of the built-in key store.
     *
     * <p>{@code rsaKeySize} applies to every generated key pair. Sealed values in the
     * single-recipient envelope layout reserve exactly 256 bytes for the wrapped key, so only
     * 2048-bit key pairs can seal or unseal them. Larger keys work for multi-recipient secure
     * e-mail only, whose wrapped keys travel in their own attachment.
     */
    @Validated
    public record KeyStoreProperties(

            @NotNull
            KeyStoreType type,

            @NotNull
            @Min(value = 2048, message = "RSA key size (sealmail.key-store.rsa-key-size) must be at least 2048 bits.")
            @Max(value = 4096, message = "RSA key size (sealmail.key-store.rsa-key-size) must be at most 4096 bits.")
            Integer rsaKeySize,

            @NotNull
            Integer symmetricKeySize
    ) {
        public static final int DEFAULT_RSA_KEY_SIZE = 2048;
        /** Largest key whose wrapped key fits {@link tech.yump.sealmail.sealing.SealedEnvelope}. */
        public static final int ENVELOPE_RSA_KEY_SIZE = 2048;
        public static final int DEFAULT_SYMMETRIC_KEY_SIZE = 256;
        private static final Set<Integer> SUPPORTED_SYMMETRIC_KEY_SIZES = Set.of(128, 192, 256);

        public KeyStoreProperties {
            if (type == null) {
                type = KeyStoreType.IN_MEMORY;
            }
            if (rsaKeySize == null) {
                rsaKeySize = DEFAULT_RSA_KEY_SIZE;
            }
            if (symmetricKeySize == null) {
                symmetricKeySize = DEFAULT_SYMMETRIC_KEY_SIZE;
            }
        }

        public boolean supportsSealedEnvelope() {
            return rsaKeySize != null && rsaKeySize <= ENVELOPE_RSA_KEY_SIZE;
        }

        @AssertTrue(message = "Symmetric key size (sealmail.key-store.symmetric-key-size) must be 128, 192 or 256 bits.")
        public boolean isSymmetricKeySizeSupported() {
            return symmetricKeySize != null && SUPPORTED_SYMMETRIC_KEY_SIZES.contains(symmetricKeySize);
        }
    }

    public enum KeyStoreType {
        /** Keys live in process memory and are lost on restart. */
        IN_MEMORY,
        /** The host application declares its own {@code KeyStore} bean. */
        EXTERNAL
    }
}
