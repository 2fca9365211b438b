package com.example.auditchain.keys;

import com.example.auditchain.config.KeyMaterialProperties;
import com.example.auditchain.service.AuditChainException;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.PosixFilePermission;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.SecureRandom;
import java.security.interfaces.RSAPrivateCrtKey;
import java.security.interfaces.RSAPublicKey;
import java.security.spec.PKCS8EncodedKeySpec;
import java.security.spec.RSAPublicKeySpec;
import java.security.spec.X509EncodedKeySpec;
import java.util.EnumSet;
import java.util.Set;
import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Loads or generates the persistent key material under {@code audit.keys.directory}.
 *
 * <p>A key file that exists is always loaded as-is; fresh material is generated only when the
 * file is absent. There is no rotation: replacing the files out of band is the only way to change
 * keys, and artifacts encrypted under the old symmetric key stay unreadable afterwards.
 */
@Component
@Slf4j
public class KeyMaterialManager {

    static final int SYMMETRIC_KEY_BYTES = 32;
    static final int MIN_RSA_KEY_BITS = 2048;

    private static final Set<PosixFilePermission> OWNER_ONLY = EnumSet.of(
            PosixFilePermission.OWNER_READ,
            PosixFilePermission.OWNER_WRITE
    );

    private final KeyMaterialProperties properties;
    private final SecureRandom random = new SecureRandom();

    public KeyMaterialManager(KeyMaterialProperties properties) {
        if (properties.getRsaKeySize() < MIN_RSA_KEY_BITS) {
            throw new IllegalArgumentException(
                    "audit.keys.rsa-key-size must be at least " + MIN_RSA_KEY_BITS);
        }
        this.properties = properties;
    }

    public KeyMaterial load() {
        KeyMaterial material = new KeyMaterial(obtainSymmetricKey(), obtainKeyPair());
        log.info("Key material ready in {} ({})", directory(), material);
        return material;
    }

    public synchronized SecretKey obtainSymmetricKey() {
        Path path = directory().resolve(properties.getSymmetricKeyFile());
        if (Files.exists(path)) {
            byte[] raw = read(path);
            if (raw.length != SYMMETRIC_KEY_BYTES) {
                throw AuditChainException.keyFormatInvalid(path.toString(),
                        "expected " + SYMMETRIC_KEY_BYTES + " bytes but found " + raw.length, null);
            }
            return new SecretKeySpec(raw, "AES");
        }

        byte[] raw = new byte[SYMMETRIC_KEY_BYTES];
        random.nextBytes(raw);
        write(path, raw);
        log.info("Generated evidence encryption key: {}", path);
        return new SecretKeySpec(raw, "AES");
    }

    public synchronized KeyPair obtainKeyPair() {
        Path privatePath = directory().resolve(properties.getPrivateKeyFile());
        Path publicPath = directory().resolve(properties.getPublicKeyFile());

        if (Files.exists(privatePath)) {
            PrivateKey privateKey = readPrivateKey(privatePath);
            PublicKey publicKey;
            if (Files.exists(publicPath)) {
                publicKey = readPublicKey(publicPath);
            } else {
                publicKey = derivePublicKey(privatePath, privateKey);
                write(publicPath, PemCodec.encode(PemCodec.PUBLIC_KEY, publicKey.getEncoded()));
                log.warn("Public key was missing; re-derived it from {}", privatePath);
            }
            return new KeyPair(publicKey, privateKey);
        }

        KeyPair pair = generateKeyPair();
        write(privatePath, PemCodec.encode(PemCodec.PRIVATE_KEY, pair.getPrivate().getEncoded()));
        write(publicPath, PemCodec.encode(PemCodec.PUBLIC_KEY, pair.getPublic().getEncoded()));
        log.info("Generated RSA-{} signing key pair in {}", properties.getRsaKeySize(), directory());
        return pair;
    }

    private KeyPair generateKeyPair() {
        try {
            KeyPairGenerator generator = KeyPairGenerator.getInstance("RSA");
            generator.initialize(properties.getRsaKeySize(), random);
            return generator.generateKeyPair();
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("RSA key generation is not available", e);
        }
    }

    private PrivateKey readPrivateKey(Path path) {
        try {
            byte[] der = PemCodec.decode(PemCodec.PRIVATE_KEY, read(path));
            PrivateKey key = KeyFactory.getInstance("RSA").generatePrivate(new PKCS8EncodedKeySpec(der));
            if (key instanceof RSAPrivateCrtKey crt && crt.getModulus().bitLength() < MIN_RSA_KEY_BITS) {
                throw AuditChainException.keyFormatInvalid(path.toString(),
                        "RSA modulus shorter than " + MIN_RSA_KEY_BITS + " bits", null);
            }
            return key;
        } catch (IllegalArgumentException | GeneralSecurityException e) {
            throw AuditChainException.keyFormatInvalid(path.toString(), "unparsable private key", e);
        }
    }

    private PublicKey readPublicKey(Path path) {
        try {
            byte[] der = PemCodec.decode(PemCodec.PUBLIC_KEY, read(path));
            PublicKey key = KeyFactory.getInstance("RSA").generatePublic(new X509EncodedKeySpec(der));
            if (key instanceof RSAPublicKey rsa && rsa.getModulus().bitLength() < MIN_RSA_KEY_BITS) {
                throw AuditChainException.keyFormatInvalid(path.toString(),
                        "RSA modulus shorter than " + MIN_RSA_KEY_BITS + " bits", null);
            }
            return key;
        } catch (IllegalArgumentException | GeneralSecurityException e) {
            throw AuditChainException.keyFormatInvalid(path.toString(), "unparsable public key", e);
        }
    }

    private PublicKey derivePublicKey(Path privatePath, PrivateKey privateKey) {
        if (!(privateKey instanceof RSAPrivateCrtKey crt)) {
            throw AuditChainException.keyFormatInvalid(privatePath.toString(),
                    "public key missing and private key carries no public exponent", null);
        }
        try {
            return KeyFactory.getInstance("RSA")
                    .generatePublic(new RSAPublicKeySpec(crt.getModulus(), crt.getPublicExponent()));
        } catch (GeneralSecurityException e) {
            throw AuditChainException.keyFormatInvalid(privatePath.toString(), "cannot derive public key", e);
        }
    }

    private Path directory() {
        Path dir = Paths.get(properties.getDirectory()).toAbsolutePath();
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw AuditChainException.keyStorageFailed(dir.toString(), e);
        }
        return dir;
    }

    private static byte[] read(Path path) {
        try {
            return Files.readAllBytes(path);
        } catch (IOException e) {
            throw AuditChainException.keyFormatInvalid(path.toString(), "unreadable", e);
        }
    }

    private static void write(Path path, byte[] content) {
        Path temp = path.resolveSibling(path.getFileName() + ".tmp");
        try {
            Files.write(temp, content);
            restrictToOwner(temp);
            try {
                Files.move(temp, path, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw AuditChainException.keyStorageFailed(path.toString(), e);
        }
    }

    private static void restrictToOwner(Path path) throws IOException {
        if (FileSystems.getDefault().supportedFileAttributeViews().contains("posix")) {
            Files.setPosixFilePermissions(path, OWNER_ONLY);
        }
    }
}
