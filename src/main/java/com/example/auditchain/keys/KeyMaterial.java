package com.example.auditchain.keys;

import java.security.KeyPair;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.util.Objects;
import javax.crypto.SecretKey;

/**
 * Process-lifetime key material: the AES-256 evidence key and the RSA audit signing pair.
 * Never serialized; {@link #toString()} only reveals algorithms.
 */
public final class KeyMaterial {

    private final SecretKey symmetricKey;
    private final KeyPair signingKeyPair;

    public KeyMaterial(SecretKey symmetricKey, KeyPair signingKeyPair) {
        this.symmetricKey = Objects.requireNonNull(symmetricKey, "symmetricKey");
        this.signingKeyPair = Objects.requireNonNull(signingKeyPair, "signingKeyPair");
    }

    public SecretKey symmetricKey() {
        return symmetricKey;
    }

    public PrivateKey signingKey() {
        return signingKeyPair.getPrivate();
    }

    public PublicKey verificationKey() {
        return signingKeyPair.getPublic();
    }

    @Override
    public String toString() {
        return "KeyMaterial[symmetric=" + symmetricKey.getAlgorithm()
                + ", signing=" + signingKeyPair.getPrivate().getAlgorithm() + "]";
    }
}
