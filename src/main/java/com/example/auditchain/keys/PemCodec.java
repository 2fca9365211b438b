package com.example.auditchain.keys;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

/**
 * Minimal PEM armour for PKCS#8 private keys and X.509 SubjectPublicKeyInfo public keys.
 */
final class PemCodec {

    static final String PRIVATE_KEY = "PRIVATE KEY";
    static final String PUBLIC_KEY = "PUBLIC KEY";

    private static final Base64.Encoder ENCODER =
            Base64.getMimeEncoder(64, "\n".getBytes(StandardCharsets.US_ASCII));

    private PemCodec() { }

    static byte[] encode(String type, byte[] der) {
        String pem = "-----BEGIN " + type + "-----\n"
                + ENCODER.encodeToString(der) + "\n"
                + "-----END " + type + "-----\n";
        return pem.getBytes(StandardCharsets.US_ASCII);
    }

    /**
     * @throws IllegalArgumentException if the armour for {@code type} is missing or the body is
     *                                  not valid base64
     */
    static byte[] decode(String type, byte[] pem) {
        String text = new String(pem, StandardCharsets.US_ASCII);
        String begin = "-----BEGIN " + type + "-----";
        String end = "-----END " + type + "-----";
        int start = text.indexOf(begin);
        int stop = text.indexOf(end);
        if (start < 0 || stop < start) {
            throw new IllegalArgumentException("missing " + type + " PEM armour");
        }
        String body = text.substring(start + begin.length(), stop).replaceAll("\\s", "");
        if (body.isEmpty()) {
            throw new IllegalArgumentException("empty " + type + " PEM body");
        }
        return Base64.getDecoder().decode(body);
    }
}
