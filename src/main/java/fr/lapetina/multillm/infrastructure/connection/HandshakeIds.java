package fr.lapetina.multillm.infrastructure.connection;

import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.UUID;

/**
 * Generates handshake identifiers of the form {@code <prefix><yyyyMMddHHmmss>_<uuid>}.
 */
public final class HandshakeIds {

    private static final DateTimeFormatter TIMESTAMP =
            DateTimeFormatter.ofPattern("yyyyMMddHHmmss").withZone(ZoneOffset.UTC);

    private HandshakeIds() {
        // Utility class
    }

    public static String next(String prefix, Clock clock) {
        return prefix + TIMESTAMP.format(clock.instant()) + "_" + UUID.randomUUID().toString().replace("-", "");
    }
}
