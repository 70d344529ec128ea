package tech.yump.sealmail.keys;

import java.security.KeyFactory;
import java.security.NoSuchAlgorithmException;
import java.security.spec.InvalidKeySpecException;
import java.security.spec.X509EncodedKeySpec;
import java.util.Base64;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.bouncycastle.asn1.pkcs.RSAPublicKey;

/**
 * Determines the {@link PublicKeyFormat} of RSA public key material.
 */
@Slf4j
public final class PublicKeyFormatDetector {

    private static final String SPKI_PEM_HEADER = "-----BEGIN PUBLIC KEY-----";
    private static final String RSA_PEM_HEADER = "-----BEGIN RSA PUBLIC KEY-----";

    private PublicKeyFormatDetector() {
    }

    /**
     * Detects the format of DER encoded key bytes. SPKI is tried first since a PKCS#1 structure
     * never parses as SubjectPublicKeyInfo.
     *
     * @param keyBytes DER encoded public key.
     * @return The detected format, or empty if the bytes are neither SPKI nor PKCS#1.
     */
    public static Optional<PublicKeyFormat> detect(byte[] keyBytes) {
        if (keyBytes == null || keyBytes.length == 0) {
            return Optional.empty();
        }
        if (isSpki(keyBytes)) {
            return Optional.of(PublicKeyFormat.SPKI);
        }
        if (isRsaPublicKey(keyBytes)) {
            return Optional.of(PublicKeyFormat.RSA_PUBLIC_KEY);
        }
        log.debug("Unable to determine format of {} bytes of public key data.", keyBytes.length);
        return Optional.empty();
    }

    /**
     * Detects the format of base64 encoded DER key bytes.
     */
    public static Optional<PublicKeyFormat> detectBase64(String base64Key) {
        try {
            return detect(Base64.getDecoder().decode(base64Key));
        } catch (IllegalArgumentException e) {
            log.debug("Public key is not valid base64: {}", e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Detects the format from the PEM armour header, if present.
     */
    public static Optional<PublicKeyFormat> detectPem(String pemKey) {
        if (pemKey == null) {
            return Optional.empty();
        }
        if (pemKey.contains(SPKI_PEM_HEADER)) {
            return Optional.of(PublicKeyFormat.SPKI);
        }
        if (pemKey.contains(RSA_PEM_HEADER)) {
            return Optional.of(PublicKeyFormat.RSA_PUBLIC_KEY);
        }
        return Optional.empty();
    }

    private static boolean isSpki(byte[] keyBytes) {
        try {
            KeyFactory.getInstance("RSA").generatePublic(new X509EncodedKeySpec(keyBytes));
            return true;
        } catch (InvalidKeySpecException | NoSuchAlgorithmException e) {
            return false;
        }
    }

    private static boolean isRsaPublicKey(byte[] keyBytes) {
        try {
            RSAPublicKey.getInstance(keyBytes);
            return true;
        } catch (IllegalArgumentException | IllegalStateException e) {
            // BC reports malformed ASN.1 through unchecked exceptions
            return false;
        }
    }
}
