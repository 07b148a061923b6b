package com.cointax.domain;

import lombok.Builder;
import lombok.Getter;

import java.math.BigDecimal;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * One validated ledger event. Immutable; identity equality, so two identical rows in an export
 * stay two operations.
 * <p>
 * Deposits and withdrawals may carry a {@code link} to the operation on the counterpart platform
 * that belongs to the same transfer. The lots a withdrawal consumed are tracked by the transfer
 * linker, not on the operation.
 */
@Getter
public final class Operation implements CoinAmount {

    private final OperationType type;
    private final String platform;
    private final String coin;
    private final BigDecimal change;
    private final Instant utcTime;
    private final List<Fee> fees;
    private final Operation link;
    /** Provenance of the row, for diagnostics only. */
    private final Path filePath;
    private final int line;
    private final String remark;

    @Builder
    private Operation(OperationType type, String platform, String coin, BigDecimal change, Instant utcTime,
                      List<Fee> fees, Operation link, Path filePath, Integer line, String remark) {
        this.type = Objects.requireNonNull(type, "operation type must not be null");
        this.platform = Objects.requireNonNull(platform, "platform must not be null");
        this.coin = Objects.requireNonNull(coin, "coin must not be null");
        this.change = Objects.requireNonNull(change, "change must not be null");
        this.utcTime = Objects.requireNonNull(utcTime, "utcTime must not be null");
        if (change.signum() <= 0) {
            throw new IllegalArgumentException("Operation change must be positive, got: " + change);
        }
        if (link != null) {
            if (!type.isLinkable() || !link.getType().isLinkable()) {
                throw new IllegalArgumentException("Only deposits and withdrawals can be linked, got " + type);
            }
            if (!coin.equals(link.getCoin())) {
                throw new IllegalArgumentException(
                        "Linked operations must move the same coin: " + coin + " vs " + link.getCoin());
            }
        }
        this.fees = fees == null ? List.of() : List.copyOf(fees);
        this.link = link;
        this.filePath = filePath == null ? Path.of("") : filePath;
        this.line = line == null ? -1 : line;
        this.remark = remark == null ? "" : remark;
    }

    public Optional<Operation> getLink() {
        return Optional.ofNullable(link);
    }

    public boolean hasFees() {
        return !fees.isEmpty();
    }

    /** Human readable provenance, e.g. "export/kraken.csv:12". */
    public String describeSource() {
        return filePath + ":" + line;
    }

    @Override
    public String toString() {
        return type + " " + change.toPlainString() + " " + coin + " on " + platform + " at " + utcTime;
    }
}
