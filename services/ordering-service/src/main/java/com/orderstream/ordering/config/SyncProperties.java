package com.orderstream.ordering.config;

import jakarta.validation.constraints.NotBlank;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Change stream transport, bound from {@code orderstream.sync.*}.
 *
 * @param websocketPath path of the WebSocket endpoint, {@code /ws} when unset.
 * @param allowedOrigins origin patterns accepted for the WebSocket handshake and REST CORS;
 *     every origin when unset.
 */
@ConfigurationProperties(prefix = "orderstream.sync")
@Validated
public record SyncProperties(@NotBlank String websocketPath, List<String> allowedOrigins) {

    public static final String DEFAULT_WEBSOCKET_PATH = "/ws";

    public SyncProperties {
        if (websocketPath == null || websocketPath.isBlank()) {
            websocketPath = DEFAULT_WEBSOCKET_PATH;
        }
        allowedOrigins = allowedOrigins == null || allowedOrigins.isEmpty() ? List.of("*") : List.copyOf(allowedOrigins);
    }
}
