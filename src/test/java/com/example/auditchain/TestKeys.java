package com.example.auditchain;

import com.example.auditchain.keys.KeyMaterial;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import javax.crypto.spec.SecretKeySpec;

/**
 * One RSA pair per test JVM; generating 2048-bit keys per test is needlessly slow.
 */
public final class TestKeys {

    private static final KeyMaterial MATERIAL = generate();

    private TestKeys() { }

    public static KeyMaterial material() {
        return MATERIAL;
    }

    public static KeyMaterial generate() {
        try {
            KeyPairGenerator generator = KeyPairGenerator.getInstance("RSA");
            generator.initialize(2048);
            KeyPair pair = generator.generateKeyPair();
            byte[] aes = new byte[32];
            new SecureRandom().nextBytes(aes);
            return new KeyMaterial(new SecretKeySpec(aes, "AES"), pair);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(e);
        }
    }
}
