package com.orderstream.observability;

/**
 * Immutable correlation context that flows through a request.
 * <p>
 * Every incoming HTTP request or WebSocket session establishes a {@code CorrelationContext}.
 * The values are echoed back to the caller and injected into SLF4J MDC so every log line
 * written while handling the request carries them.
 *
 * @param correlationId unique ID for the business flow (e.g. a cashier adding items to one order)
 * @param userId        caller performing the action (nullable for system work)
 * @param requestId     unique ID for this specific request
 */
public record CorrelationContext(
        String correlationId,
        String userId,
        String requestId
) {

    /** MDC key for correlation ID. */
    public static final String MDC_CORRELATION_ID = "correlationId";

    /** MDC key for user ID. */
    public static final String MDC_USER_ID = "userId";

    /** MDC key for request ID. */
    public static final String MDC_REQUEST_ID = "requestId";

    public CorrelationContext {
        if (correlationId == null || correlationId.isBlank()) {
            throw new IllegalArgumentException("correlationId must not be null or blank");
        }
    }
}
