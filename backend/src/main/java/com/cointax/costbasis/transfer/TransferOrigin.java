package com.cointax.costbasis.transfer;

import com.cointax.domain.ConsumedLot;

import java.math.BigDecimal;

/**
 * Original acquisition behind coins that travelled through one or more transfers, and the
 * transfer fee (in the transferred coin) attributable to them.
 */
public record TransferOrigin(ConsumedLot lot, BigDecimal transferFee) {

    TransferOrigin plusFee(BigDecimal fee) {
        return new TransferOrigin(lot, transferFee.add(fee));
    }
}
