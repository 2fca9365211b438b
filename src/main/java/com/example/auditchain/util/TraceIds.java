package com.example.auditchain.util;

import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.UUID;

/**
 * Trace identifiers of the form {@code <uuid-v4>:<yyyy-MM-ddTHH:mm:ssZ>}.
 */
public final class TraceIds {

    private static final DateTimeFormatter TIMESTAMP_FORMATTER =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss'Z'").withZone(ZoneOffset.UTC);

    private static final int UUID_LENGTH = 36;

    private TraceIds() { }

    public static String generate(Clock clock) {
        return UUID.randomUUID() + ":" + TIMESTAMP_FORMATTER.format(clock.instant().truncatedTo(ChronoUnit.SECONDS));
    }

    /**
     * The timestamp part itself contains colons, so only the first one separates it from the UUID.
     */
    public static boolean isValid(String traceId) {
        if (traceId == null) {
            return false;
        }
        int sep = traceId.indexOf(':');
        if (sep != UUID_LENGTH) {
            return false;
        }
        String uuidPart = traceId.substring(0, sep);
        String timestampPart = traceId.substring(sep + 1);
        try {
            UUID.fromString(uuidPart);
        } catch (IllegalArgumentException e) {
            return false;
        }
        return timestampPart.contains("T") && timestampPart.endsWith("Z");
    }
}
