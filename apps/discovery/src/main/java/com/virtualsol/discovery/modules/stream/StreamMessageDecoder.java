package com.virtualsol.discovery.modules.stream;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.virtualsol.discovery.config.DiscoveryProperties;
import com.virtualsol.discovery.modules.stream.event.MigrationEvent;
import com.virtualsol.discovery.modules.stream.event.NewTokenEvent;
import com.virtualsol.discovery.modules.stream.event.StreamEvent;
import com.virtualsol.discovery.modules.stream.event.SwapEvent;
import com.virtualsol.discovery.util.TimestampUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.Locale;
import java.util.Optional;

/**
 * Decodes raw PumpPortal frames into {@link StreamEvent}s.
 *
 * <p>Recognized shapes:
 * <ul>
 *     <li>{@code type=newToken} or {@code txType=create}: {@link NewTokenEvent}, fields at top level or under {@code token}</li>
 *     <li>{@code type=migration} or {@code txType=migrate}: {@link MigrationEvent}, fields at top level or under {@code data}</li>
 *     <li>{@code txType=buy|sell}: {@link SwapEvent}</li>
 * </ul>
 * Anything else, including subscription acknowledgements, decodes to empty, as does a frame
 * whose timestamp is outside the accepted years. Never throws.
 */
@Component
public class StreamMessageDecoder {

    private static final Logger logger = LoggerFactory.getLogger(StreamMessageDecoder.class);

    private static final BigDecimal LAMPORTS_PER_SOL = new BigDecimal("1000000000");

    private final ObjectMapper objectMapper;
    private final DiscoveryProperties.Validation validation;
    private final Clock clock;

    public StreamMessageDecoder(ObjectMapper objectMapper, DiscoveryProperties properties, Clock clock) {
        this.objectMapper = objectMapper;
        this.validation = properties.getValidation();
        this.clock = clock;
    }

    public Optional<StreamEvent> decode(String raw) {
        JsonNode message;
        try {
            message = objectMapper.readTree(raw);
        } catch (JsonProcessingException e) {
            logger.warn("Dropping malformed stream message: {}", e.getOriginalMessage());
            return Optional.empty();
        }
        if (message == null || !message.isObject()) {
            logger.debug("Dropping non-object stream message");
            return Optional.empty();
        }

        try {
            String type = lower(text(message, "type"));
            String txType = lower(text(message, "txType"));

            if ("newtoken".equals(type) || "create".equals(txType)) {
                return decodeNewToken(message);
            }
            if ("migration".equals(type) || "migrate".equals(txType)) {
                return decodeMigration(message);
            }
            if ("buy".equals(txType) || "sell".equals(txType)) {
                return decodeSwap(message, txType);
            }
            if (message.has("message")) {
                logger.debug("Stream notice: {}", message.get("message").asText());
            } else {
                logger.debug("Ignoring unrecognized stream message shape");
            }
            return Optional.empty();
        } catch (RuntimeException e) {
            logger.warn("Failed to decode stream message: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private Optional<StreamEvent> decodeNewToken(JsonNode message) {
        String mint = field(message, "token", "mint");
        if (mint == null) {
            logger.debug("newToken message without mint");
            return Optional.empty();
        }
        Optional<Instant> timestamp = timestamp(message);
        if (timestamp.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(NewTokenEvent.builder()
                .mint(mint)
                .name(field(message, "token", "name"))
                .symbol(field(message, "token", "symbol"))
                .uri(field(message, "token", "uri"))
                .creator(firstNonNull(field(message, "token", "creator"), text(message, "traderPublicKey")))
                .bondingCurve(firstNonNull(field(message, "token", "bondingCurve"), text(message, "bondingCurveKey")))
                .vSolInBondingCurve(decimal(message, "vSolInBondingCurve"))
                .marketCapSol(decimal(message, "marketCapSol"))
                .timestamp(timestamp.get())
                .build());
    }

    private Optional<StreamEvent> decodeMigration(JsonNode message) {
        String mint = field(message, "data", "mint");
        if (mint == null) {
            logger.debug("migration message without mint");
            return Optional.empty();
        }
        String rawStatus = lower(field(message, "data", "status"));
        MigrationEvent.Status status;
        if (rawStatus == null || "completed".equals(rawStatus)) {
            status = MigrationEvent.Status.COMPLETED;
        } else if ("initiated".equals(rawStatus)) {
            status = MigrationEvent.Status.INITIATED;
        } else {
            logger.debug("Unknown migration status '{}'", rawStatus);
            return Optional.empty();
        }
        Optional<Instant> timestamp = timestamp(message);
        if (timestamp.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(MigrationEvent.builder()
                .mint(mint)
                .poolAddress(firstNonNull(field(message, "data", "poolAddress"), text(message, "pool")))
                .poolType(field(message, "data", "poolType"))
                .status(status)
                .timestamp(timestamp.get())
                .build());
    }

    private Optional<StreamEvent> decodeSwap(JsonNode message, String txType) {
        String mint = text(message, "mint");
        String signature = text(message, "signature");
        if (mint == null || signature == null) {
            logger.debug("trade message without mint or signature");
            return Optional.empty();
        }
        Optional<Instant> timestamp = timestamp(message);
        if (timestamp.isEmpty()) {
            return Optional.empty();
        }

        BigDecimal vSol = decimal(message, "vSolInBondingCurve");
        if (vSol == null) {
            BigDecimal lamports = decimal(message, "virtualSolReserves");
            vSol = lamports == null ? null : lamports.divide(LAMPORTS_PER_SOL);
        }
        BigDecimal vTokens = firstNonNull(decimal(message, "vTokensInBondingCurve"),
                decimal(message, "virtualTokenReserves"));

        return Optional.of(SwapEvent.builder()
                .mint(mint)
                .signature(signature)
                .side("buy".equals(txType) ? SwapEvent.Side.BUY : SwapEvent.Side.SELL)
                .traderPublicKey(text(message, "traderPublicKey"))
                .solAmount(decimal(message, "solAmount"))
                .tokenAmount(decimal(message, "tokenAmount"))
                .vSolInBondingCurve(vSol)
                .vTokensInBondingCurve(vTokens)
                .marketCapSol(decimal(message, "marketCapSol"))
                .timestamp(timestamp.get())
                .build());
    }

    /**
     * Event time from the frame, or the receive time when the frame carries none. Empty when
     * the frame carries a timestamp outside the accepted window.
     */
    private Optional<Instant> timestamp(JsonNode message) {
        JsonNode node = message.get("timestamp");
        if (node == null || node.isNull()) {
            return Optional.of(clock.instant());
        }
        Optional<Instant> normalized = node.canConvertToLong()
                ? TimestampUtils.normalize(node.asLong(),
                        validation.getTimestampEpochThreshold(),
                        validation.getMinTimestampYear(),
                        validation.getMaxTimestampYear())
                : Optional.empty();
        if (normalized.isEmpty()) {
            logger.debug("Dropping stream message with out-of-range timestamp {}", node.asText());
        }
        return normalized;
    }

    /**
     * Value at the top level, falling back to the same key inside {@code container}.
     */
    private static String field(JsonNode message, String container, String key) {
        String top = text(message, key);
        if (top != null) {
            return top;
        }
        JsonNode nested = message.get(container);
        return nested != null && nested.isObject() ? text(nested, key) : null;
    }

    private static String text(JsonNode node, String key) {
        JsonNode value = node.get(key);
        if (value == null || value.isNull() || !value.isValueNode()) {
            return null;
        }
        String text = value.asText();
        return text.isBlank() ? null : text;
    }

    private static BigDecimal decimal(JsonNode node, String key) {
        JsonNode value = node.get(key);
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isNumber()) {
            return value.decimalValue();
        }
        String text = value.asText();
        if (text.isBlank()) {
            return null;
        }
        try {
            return new BigDecimal(text.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static String lower(String value) {
        return value == null ? null : value.toLowerCase(Locale.ROOT);
    }

    private static <T> T firstNonNull(T first, T second) {
        return first != null ? first : second;
    }
}
