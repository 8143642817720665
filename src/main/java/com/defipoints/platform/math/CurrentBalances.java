package com.defipoints.platform.math;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.math.BigInteger;

@Data
@AllArgsConstructor
public class CurrentBalances {
    private BigInteger supply;
    private BigInteger variableDebt;

    public boolean isEmpty() {
        return supply.signum() <= 0 && variableDebt.signum() <= 0;
    }
}
