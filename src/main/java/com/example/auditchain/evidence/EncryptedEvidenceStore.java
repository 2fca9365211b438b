package com.example.auditchain.evidence;

import com.example.auditchain.config.EvidenceStoreProperties;
import com.example.auditchain.keys.KeyMaterial;
import com.example.auditchain.models.EvidenceRecord;
import com.example.auditchain.service.AuditChainException;
import com.example.auditchain.util.Digests;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileSystems;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.nio.file.attribute.FileTime;
import java.nio.file.attribute.PosixFilePermission;
import java.security.DigestInputStream;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import javax.crypto.Cipher;
import javax.crypto.CipherOutputStream;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Content-addressed, encrypted-at-rest storage for interaction attachments.
 *
 * <p>Each artifact lives at {@code {root}/{hash[0:8]}/{hash}.enc} and holds
 * {@code nonce(12) || tag(16) || ciphertext} under AES-256-GCM with a fresh nonce per write.
 * Plaintext is streamed through the digest and the cipher, so only the ciphertext and a copy
 * buffer touch disk and memory. Artifacts expire {@code ttlDays} after their last write and are
 * removed by {@link #sweepExpired(Instant)}.
 *
 * <p>Concurrent {@link #store} calls are safe: every write goes to its own temp file and is
 * renamed into place, so identical content only ever replaces one complete artifact with another.
 */
@Service
@Slf4j
public class EncryptedEvidenceStore {

    static final int NONCE_BYTES = 12;
    static final int TAG_BYTES = 16;
    static final String ARTIFACT_SUFFIX = ".enc";

    private static final String TRANSFORMATION = "AES/GCM/NoPadding";
    private static final int SHARD_PREFIX_LENGTH = 8;

    private final Path root;
    private final int ttlDays;
    private final SecretKey key;
    private final Clock clock;
    private final SecureRandom random = new SecureRandom();

    public EncryptedEvidenceStore(EvidenceStoreProperties properties, KeyMaterial keyMaterial, Clock clock) {
        if (properties.getTtlDays() < 1) {
            throw new IllegalArgumentException("evidence.store.ttl-days must be positive");
        }
        this.root = Paths.get(properties.getRoot()).toAbsolutePath();
        this.ttlDays = properties.getTtlDays();
        this.key = keyMaterial.symmetricKey();
        this.clock = clock;
    }

    public EvidenceRecord store(byte[] content) {
        return store(new ByteArrayInputStream(content));
    }

    public EvidenceRecord store(InputStream content) {
        Path body = null;
        String contentHash = null;
        try {
            Files.createDirectories(root);
            byte[] nonce = new byte[NONCE_BYTES];
            random.nextBytes(nonce);
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(TAG_BYTES * 8, nonce));

            // JCE emits ciphertext || tag; the artifact wants the tag up front.
            body = Files.createTempFile(root, "evidence-", ".part");
            MessageDigest digest = Digests.sha256();
            try (InputStream in = new DigestInputStream(content, digest);
                 OutputStream out = new CipherOutputStream(Files.newOutputStream(body), cipher)) {
                in.transferTo(out);
            }
            contentHash = Digests.toHex(digest.digest());

            Instant createdAt = clock.instant();
            Path target = pathFor(contentHash);
            writeArtifact(body, target, nonce, createdAt);

            log.info("Stored evidence artifact {} ({} bytes on disk)", contentHash, Files.size(target));
            return EvidenceRecord.builder()
                    .contentHash(contentHash)
                    .storagePath(target.toString())
                    .encryptionAlgorithm(EvidenceRecord.AES_256_GCM)
                    .createdAt(createdAt)
                    .expiresAt(createdAt.plus(Duration.ofDays(ttlDays)))
                    .build();
        } catch (IOException | GeneralSecurityException e) {
            throw AuditChainException.evidenceStorageFailed(contentHash, e);
        } finally {
            deleteQuietly(body);
        }
    }

    /**
     * Decrypts and authenticates an artifact.
     *
     * @throws AuditChainException {@code EVIDENCE_NOT_FOUND} when the artifact is gone,
     *                             {@code EVIDENCE_INTEGRITY_FAILED} when it fails authentication or
     *                             does not hash to the record's content hash
     */
    public byte[] retrieve(EvidenceRecord record) {
        String contentHash = record.getContentHash();
        if (!Digests.isSha256Hex(contentHash)) {
            throw AuditChainException.evidenceNotFound(record.getStoragePath());
        }
        Path path = pathFor(contentHash);
        byte[] artifact;
        try {
            artifact = Files.readAllBytes(path);
        } catch (NoSuchFileException e) {
            throw AuditChainException.evidenceNotFound(path.toString());
        } catch (IOException e) {
            throw AuditChainException.evidenceStorageFailed(contentHash, e);
        }
        if (artifact.length < NONCE_BYTES + TAG_BYTES) {
            throw AuditChainException.evidenceIntegrityFailed(contentHash, null);
        }

        // Reassemble ciphertext || tag, the layout the JCE expects on decrypt.
        int headerLength = NONCE_BYTES + TAG_BYTES;
        byte[] sealed = new byte[artifact.length - NONCE_BYTES];
        System.arraycopy(artifact, headerLength, sealed, 0, artifact.length - headerLength);
        System.arraycopy(artifact, NONCE_BYTES, sealed, artifact.length - headerLength, TAG_BYTES);

        byte[] plaintext;
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.DECRYPT_MODE, key,
                    new GCMParameterSpec(TAG_BYTES * 8, artifact, 0, NONCE_BYTES));
            plaintext = cipher.doFinal(sealed);
        } catch (GeneralSecurityException e) {
            throw AuditChainException.evidenceIntegrityFailed(contentHash, e);
        }

        if (!Digests.sha256Hex(plaintext).equals(contentHash.toLowerCase())) {
            throw AuditChainException.evidenceIntegrityFailed(contentHash, null);
        }
        return plaintext;
    }

    /**
     * Deletes every artifact whose age in whole days (floor) has reached the TTL. Deletion
     * failures are logged and counted; the walk always continues.
     */
    public SweepResult sweepExpired(Instant now) {
        if (Files.notExists(root)) {
            return new SweepResult(0, 0, 0);
        }
        int[] totals = new int[3]; // scanned, deleted, failed
        try {
            Files.walkFileTree(root, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    if (!file.getFileName().toString().endsWith(ARTIFACT_SUFFIX)) {
                        return FileVisitResult.CONTINUE;
                    }
                    totals[0]++;
                    Instant createdAt = attrs.lastModifiedTime().toInstant();
                    long ageDays = Duration.between(createdAt, now).toDays();
                    if (ageDays < ttlDays) {
                        return FileVisitResult.CONTINUE;
                    }
                    try {
                        if (Files.deleteIfExists(file)) {
                            totals[1]++;
                            log.info("Deleted expired evidence artifact {} (age {} days)", file, ageDays);
                        }
                    } catch (IOException e) {
                        totals[2]++;
                        log.warn("Failed to delete expired evidence artifact {}: {}", file, e.toString());
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException e) {
                    // Vanished between listing and visiting: someone else already removed it.
                    if (!(e instanceof NoSuchFileException)) {
                        log.warn("Skipping unreadable path {} during sweep: {}", file, e.toString());
                    }
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            log.error("Evidence sweep of {} aborted: {}", root, e.getMessage(), e);
        }
        return new SweepResult(totals[0], totals[1], totals[2]);
    }

    Path pathFor(String contentHash) {
        String hash = contentHash.toLowerCase();
        return root.resolve(hash.substring(0, SHARD_PREFIX_LENGTH)).resolve(hash + ARTIFACT_SUFFIX);
    }

    private static void writeArtifact(Path body, Path target, byte[] nonce, Instant createdAt) throws IOException {
        Path shard = target.getParent();
        Files.createDirectories(shard);
        Path staged = Files.createTempFile(shard, target.getFileName().toString(), ".tmp");
        try {
            try (FileChannel in = FileChannel.open(body, StandardOpenOption.READ);
                 FileChannel out = FileChannel.open(staged, StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING)) {
                long ciphertextLength = in.size() - TAG_BYTES;
                ByteBuffer tag = ByteBuffer.allocate(TAG_BYTES);
                while (tag.hasRemaining()) {
                    if (in.read(tag, ciphertextLength + tag.position()) < 0) {
                        throw new IOException("Truncated cipher output");
                    }
                }
                tag.flip();
                writeFully(out, ByteBuffer.wrap(nonce));
                writeFully(out, tag);
                long copied = 0;
                while (copied < ciphertextLength) {
                    copied += in.transferTo(copied, ciphertextLength - copied, out);
                }
                out.force(true);
            }
            restrictToOwner(staged);
            Files.setLastModifiedTime(staged, FileTime.from(createdAt));
            try {
                Files.move(staged, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(staged, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            deleteQuietly(staged);
        }
    }

    private static void writeFully(FileChannel channel, ByteBuffer buffer) throws IOException {
        while (buffer.hasRemaining()) {
            channel.write(buffer);
        }
    }

    private static void restrictToOwner(Path file) throws IOException {
        if (FileSystems.getDefault().supportedFileAttributeViews().contains("posix")) {
            Files.setPosixFilePermissions(file, EnumSet.of(
                    PosixFilePermission.OWNER_READ,
                    PosixFilePermission.OWNER_WRITE));
        }
    }

    private static void deleteQuietly(Path path) {
        if (path == null) {
            return;
        }
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            log.warn("Could not remove temporary file {}: {}", path, e.toString());
        }
    }
}
