package com.defipoints.platform.dto;

import com.defipoints.platform.event.ChainEvent;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Events in stream order. They are applied one by one; the first failure stops the batch.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EventBatchRequest {
    @NotEmpty(message = "Events cannot be empty")
    @Valid
    private List<ChainEvent> events;
}
