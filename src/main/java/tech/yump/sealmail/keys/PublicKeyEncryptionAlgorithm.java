package tech.yump.sealmail.keys;

/**
 * RSA paddings used to wrap symmetric keys. The enum name is the canonical name written to
 * sealed key records.
 */
public enum PublicKeyEncryptionAlgorithm {

    RSA_ECB_OAEPSHA1("RSA/ECB/OAEPWithSHA-1AndMGF1Padding"),
    RSA_ECB_PKCS1("RSA/ECB/PKCS1Padding");

    /** Key algorithm name that selects OAEP padding for single-recipient envelopes. */
    public static final String DEFAULT_PUBLIC_KEY_ALGORITHM = "RSAEncryptionOAEPAESCBC";

    private final String transformation;

    PublicKeyEncryptionAlgorithm(String transformation) {
        this.transformation = transformation;
    }

    /**
     * @return The JCE cipher transformation for this padding.
     */
    public String transformation() {
        return transformation;
    }

    /**
     * Resolves the RSA padding for a key algorithm name. This is a two-way switch: the default
     * public key algorithm selects OAEP-SHA1, every other name selects PKCS#1 v1.5.
     *
     * @param keyAlgorithmName The algorithm name from a {@link KeyDescriptor}.
     * @return The padding to unwrap the embedded symmetric key with.
     */
    public static PublicKeyEncryptionAlgorithm forKeyAlgorithmName(String keyAlgorithmName) {
        if (DEFAULT_PUBLIC_KEY_ALGORITHM.equals(keyAlgorithmName)) {
            return RSA_ECB_OAEPSHA1;
        }
        return RSA_ECB_PKCS1;
    }
}
