package com.defipoints.platform.event.params;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReserveParams {
    private String reserve;
    private Integer decimals;
    private BigInteger liquidityIndex;
    private BigInteger liquidityRate;
    private BigInteger variableBorrowIndex;
    private BigInteger variableBorrowRate;
    private BigInteger priceUsdE8;
}
