package com.project.chc.crypto;

import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.generators.HKDFBytesGenerator;
import org.bouncycastle.crypto.params.HKDFParameters;

/**
 * HKDF-SHA256 key derivation.
 */
public final class HKDFUtil {
    private HKDFUtil() {
    }

    /**
     * Derive a key using HKDF-SHA256.
     *
     * @param inputKeyMaterial The input key material
     * @param salt Optional salt (can be null)
     * @param info Optional context/application specific information (can be null)
     * @param outputLength Desired output length in bytes
     * @return Derived key
     */
    public static byte[] deriveKey(byte[] inputKeyMaterial, byte[] salt, byte[] info, int outputLength) {
        if (inputKeyMaterial == null || inputKeyMaterial.length == 0) {
            throw new CryptoException("HKDF input key material must not be empty");
        }
        HKDFBytesGenerator hkdf = new HKDFBytesGenerator(new SHA256Digest());
        hkdf.init(new HKDFParameters(inputKeyMaterial, salt, info));

        byte[] output = new byte[outputLength];
        hkdf.generateBytes(output, 0, outputLength);
        return output;
    }
}
