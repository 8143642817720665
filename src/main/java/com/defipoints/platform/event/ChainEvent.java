package com.defipoints.platform.event;

import com.defipoints.platform.exception.InvalidRequestException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One decoded on-chain log. {@code params} is kept untyped until the handler for
 * {@code eventName} binds it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChainEvent {
    @NotNull(message = "Block number cannot be null")
    @Min(value = 0, message = "Block number cannot be negative")
    private Long blockNumber;

    @NotNull(message = "Timestamp cannot be null")
    @Min(value = 0, message = "Timestamp cannot be negative")
    private Long timestamp;

    @NotNull(message = "Log index cannot be null")
    @Min(value = 0, message = "Log index cannot be negative")
    private Integer logIndex;

    @NotBlank(message = "Transaction hash cannot be empty")
    private String transactionHash;

    private String sourceAddress;

    @NotNull(message = "Event name cannot be null")
    private EventType eventName;

    private JsonNode params;

    /**
     * The timestamp carried in the params when present, the block timestamp otherwise.
     */
    public long resolveTimestamp(Long paramTimestamp) {
        if (paramTimestamp != null && paramTimestamp > 0) {
            return paramTimestamp;
        }
        return timestamp;
    }

    public <T> T paramsAs(ObjectMapper objectMapper, Class<T> type) {
        if (params == null || params.isNull()) {
            throw new InvalidRequestException("Missing params for " + eventName);
        }
        try {
            return objectMapper.convertValue(params, type);
        } catch (IllegalArgumentException e) {
            throw new InvalidRequestException("Malformed params for " + eventName + ": " + e.getMessage(), e);
        }
    }
}
