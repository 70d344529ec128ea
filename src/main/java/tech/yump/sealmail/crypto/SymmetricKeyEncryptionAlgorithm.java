package tech.yump.sealmail.crypto;

import java.util.Arrays;
import java.util.Optional;

/**
 * Symmetric algorithms a sealed value may declare. A sealed value naming anything else is
 * rejected rather than decrypted with a guessed algorithm.
 */
public enum SymmetricKeyEncryptionAlgorithm {

    AES_CBC_PKCS7PADDING("AES/CBC/PKCS7Padding");

    private final String algorithmName;

    SymmetricKeyEncryptionAlgorithm(String algorithmName) {
        this.algorithmName = algorithmName;
    }

    /**
     * @return The algorithm name as written to sealed values, which is also the JCE transformation.
     */
    public String algorithmName() {
        return algorithmName;
    }

    public static boolean isAlgorithmSupported(String algorithmName) {
        return fromName(algorithmName).isPresent();
    }

    public static Optional<SymmetricKeyEncryptionAlgorithm> fromName(String algorithmName) {
        return Arrays.stream(values())
                .filter(algorithm -> algorithm.algorithmName.equals(algorithmName))
                .findFirst();
    }

    @Override
    public String toString() {
        return algorithmName;
    }
}
