package com.defipoints.platform.event.params;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;

/**
 * Aave-style mint or burn. {@code value} includes {@code balanceIncrease}, the interest accrued
 * since the user's previous action; {@code index} is the ray index the amount was scaled with.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BalanceParams {
    private String user;
    private String reserve;
    private BigInteger value;
    private BigInteger balanceIncrease;
    private BigInteger index;
}
