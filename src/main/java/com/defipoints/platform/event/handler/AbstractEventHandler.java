package com.defipoints.platform.event.handler;

import com.defipoints.platform.event.ChainEvent;
import com.defipoints.platform.exception.InvalidRequestException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Locale;

/**
 * Param binding and validation shared by the event handlers.
 */
public abstract class AbstractEventHandler {

    public static final String ZERO_ADDRESS = "0x0000000000000000000000000000000000000000";

    protected final ObjectMapper objectMapper;

    protected AbstractEventHandler(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    protected <T> T bind(ChainEvent event, Class<T> type) {
        return event.paramsAs(objectMapper, type);
    }

    protected static <T> T require(T value, String field, ChainEvent event) {
        if (value == null) {
            throw new InvalidRequestException("Missing param '" + field + "' for " + event.getEventName());
        }
        return value;
    }

    /**
     * Lower-cased address, or null when blank.
     */
    protected static String normalizeAddress(String address) {
        if (address == null || address.isBlank()) {
            return null;
        }
        return address.trim().toLowerCase(Locale.ROOT);
    }

    protected static String requireAddress(String address, String field, ChainEvent event) {
        return require(normalizeAddress(address), field, event);
    }

    protected static boolean isZeroAddress(String address) {
        return address == null || ZERO_ADDRESS.equals(address);
    }
}
