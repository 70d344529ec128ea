package tech.yump.sealmail.keys;

import java.util.Objects;

/**
 * Identifies the key store entry and cipher used to unseal a value.
 *
 * @param keyId         Identifier of the key pair or symmetric key in the {@link KeyStore}.
 * @param keyKind       Whether the sealed value embeds a wrapped key or is encrypted directly.
 * @param algorithmName Algorithm name recorded alongside the sealed value.
 */
public record KeyDescriptor(String keyId, KeyKind keyKind, String algorithmName) {

    public KeyDescriptor {
        Objects.requireNonNull(keyId, "keyId");
        Objects.requireNonNull(keyKind, "keyKind");
        Objects.requireNonNull(algorithmName, "algorithmName");
    }
}
