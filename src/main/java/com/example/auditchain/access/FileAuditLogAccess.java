package com.example.auditchain.access;

import com.example.auditchain.config.AuditChainProperties;
import com.example.auditchain.models.AuditLogItem;
import com.example.auditchain.util.CanonicalJson;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.PosixFilePermission;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Keeps each chain in a JSON Lines file, {@code {logDirectory}/{chainId}.jsonl}, one finalized
 * link per line. Lines are forced to disk before {@link #put} returns.
 */
@Component
@ConditionalOnProperty(value = "audit.chain.store", havingValue = "file", matchIfMissing = true)
@Slf4j
public class FileAuditLogAccess implements AuditLogAccess {

    private static final ObjectMapper MAPPER = CanonicalJson.mapper();

    private final Path directory;

    @Autowired
    public FileAuditLogAccess(AuditChainProperties properties) {
        this(Paths.get(properties.getLogDirectory()));
    }

    public FileAuditLogAccess(Path directory) {
        this.directory = directory.toAbsolutePath();
    }

    @Override
    public synchronized void put(AuditLogItem item) {
        Path file = chainFile(item.getChainId());
        byte[] line;
        try {
            line = (MAPPER.writeValueAsString(item) + "\n").getBytes(StandardCharsets.UTF_8);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize audit log item", e);
        }

        try {
            Files.createDirectories(directory);
            boolean created = Files.notExists(file);
            try (FileChannel channel = FileChannel.open(file,
                    StandardOpenOption.CREATE, StandardOpenOption.WRITE)) {
                long committedSize = channel.size();
                try {
                    channel.position(committedSize);
                    writeFully(channel, ByteBuffer.wrap(line));
                    channel.force(true);
                } catch (IOException e) {
                    // Drop any fragment so the next link starts on a clean line.
                    try {
                        channel.truncate(committedSize);
                        channel.force(true);
                    } catch (IOException rollback) {
                        e.addSuppressed(rollback);
                    }
                    throw e;
                }
            }
            if (created) {
                restrictToOwner(file);
                log.info("Started audit chain file {}", file);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to append to " + file, e);
        }
    }

    @Override
    public synchronized Optional<AuditLogItem> findLatest(String chainId) {
        List<AuditLogItem> items = findAllByChainId(chainId);
        return items.isEmpty() ? Optional.empty() : Optional.of(items.get(items.size() - 1));
    }

    @Override
    public synchronized List<AuditLogItem> findAllByChainId(String chainId) {
        Path file = chainFile(chainId);
        if (Files.notExists(file)) {
            return List.of();
        }
        List<AuditLogItem> items = new ArrayList<>();
        try {
            int lineNumber = 0;
            for (String line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
                lineNumber++;
                if (line.isBlank()) {
                    continue;
                }
                try {
                    items.add(MAPPER.readValue(line, AuditLogItem.class));
                } catch (JsonProcessingException e) {
                    throw new IllegalStateException("Corrupt audit log line " + lineNumber + " in " + file, e);
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + file, e);
        }
        return items;
    }

    void writeFully(FileChannel channel, ByteBuffer buffer) throws IOException {
        while (buffer.hasRemaining()) {
            channel.write(buffer);
        }
    }

    private Path chainFile(String chainId) {
        if (chainId.isBlank() || chainId.contains("/") || chainId.contains("\\") || chainId.contains("..")) {
            throw new IllegalArgumentException("Illegal chain id: " + chainId);
        }
        return directory.resolve(chainId + ".jsonl");
    }

    private static void restrictToOwner(Path file) throws IOException {
        if (FileSystems.getDefault().supportedFileAttributeViews().contains("posix")) {
            Files.setPosixFilePermissions(file, EnumSet.of(
                    PosixFilePermission.OWNER_READ,
                    PosixFilePermission.OWNER_WRITE));
        }
    }
}
