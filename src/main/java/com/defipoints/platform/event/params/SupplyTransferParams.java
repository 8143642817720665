package com.defipoints.platform.event.params;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;

/**
 * Transfer of interest-bearing supply tokens. {@code value} is already scaled.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SupplyTransferParams {
    private String reserve;
    private String from;
    private String to;
    private BigInteger value;
    private BigInteger index;
}
