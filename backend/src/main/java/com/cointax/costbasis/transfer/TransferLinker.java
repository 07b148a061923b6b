package com.cointax.costbasis.transfer;

import com.cointax.common.Decimals;
import com.cointax.costbasis.EvaluationWarnings;
import com.cointax.domain.ConsumedLot;
import com.cointax.domain.Operation;
import com.cointax.domain.OperationType;
import com.cointax.domain.WarningCode;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Tracks which lots each withdrawal consumed and traces coins sold after a transfer back to
 * their original acquisition.
 * <p>
 * A withdrawal of W coins linked to a deposit of D coins (W &gt;= D) moved W coins out of the
 * source lots; W − D is the implicit transfer fee. Selling s of the deposited coins maps to
 * s / W of every withdrawn lot, so origin amounts always add up to s. The fee share is
 * (W − D) · s / D, spread over the origins by their amounts.
 * <p>
 * A deposit booked before its own withdrawal can end up among the lots that withdrawal consumed.
 * Such a piece is its own origin, so resolution always terminates.
 */
public class TransferLinker {

    private final Map<Operation, List<ConsumedLot>> withdrawnLots = new IdentityHashMap<>();
    private final Set<Operation> unlinkedDepositsReported = Collections.newSetFromMap(new IdentityHashMap<>());
    private final EvaluationWarnings warnings;

    public TransferLinker(EvaluationWarnings warnings) {
        this.warnings = warnings;
    }

    public void recordWithdrawal(Operation withdrawal, List<ConsumedLot> consumed) {
        if (withdrawal.getType() != OperationType.WITHDRAWAL) {
            throw new IllegalArgumentException("Not a withdrawal: " + withdrawal);
        }
        withdrawnLots.put(withdrawal, List.copyOf(consumed));
    }

    public Optional<List<ConsumedLot>> withdrawnLots(Operation withdrawal) {
        return Optional.ofNullable(withdrawnLots.get(withdrawal));
    }

    /**
     * Implicit fee of the transfer a deposit belongs to: withdrawn minus deposited amount.
     */
    public static BigDecimal transferFee(Operation deposit, Operation withdrawal) {
        if (withdrawal.getChange().compareTo(deposit.getChange()) < 0) {
            throw new IllegalStateException("Withdrawal must be equal or greater than the deposited amount: "
                    + withdrawal + " -> " + deposit);
        }
        return withdrawal.getChange().subtract(deposit.getChange());
    }

    /**
     * Original lots behind a consumed lot. Lots that did not come from a linked deposit are their
     * own origin.
     */
    public List<TransferOrigin> resolve(ConsumedLot sold) {
        return resolve(sold, Collections.newSetFromMap(new IdentityHashMap<>()));
    }

    private List<TransferOrigin> resolve(ConsumedLot sold, Set<Operation> depositsOnPath) {
        Operation op = sold.op();
        if (op.getType() != OperationType.DEPOSIT) {
            return List.of(new TransferOrigin(sold, BigDecimal.ZERO));
        }
        if (depositsOnPath.contains(op)) {
            warnings.add(WarningCode.UNLINKED_WITHDRAWAL_LOTS, "The withdrawal linked to " + op + " consumed coins of"
                    + " this very deposit, which was booked before it; the deposit time is used as acquisition time.", op);
            return List.of(new TransferOrigin(sold, BigDecimal.ZERO));
        }
        Optional<Operation> link = op.getLink();
        if (link.isEmpty()) {
            if (!unlinkedDepositsReported.add(op)) {
                return List.of(new TransferOrigin(sold, BigDecimal.ZERO));
            }
            warnings.add(WarningCode.MISSING_DEPOSIT_LINK, "You sold " + sold.amount().toPlainString() + " "
                    + op.getCoin() + " which were deposited from somewhere unknown onto " + op.getPlatform()
                    + ". A correct tax evaluation is not possible; the deposit time is used as acquisition time.", op);
            return List.of(new TransferOrigin(sold, BigDecimal.ZERO));
        }
        Operation withdrawal = link.get();
        if (withdrawal.getType() != OperationType.WITHDRAWAL) {
            throw new IllegalStateException("Deposit must be linked to a withdrawal: " + op + " -> " + withdrawal);
        }
        BigDecimal depositFee = transferFee(op, withdrawal);
        List<ConsumedLot> withdrawn = withdrawnLots.get(withdrawal);
        if (withdrawn == null || withdrawn.isEmpty()) {
            warnings.add(WarningCode.UNLINKED_WITHDRAWAL_LOTS, "No lots are recorded for the withdrawal "
                    + withdrawal + " linked to this deposit; the deposit time is used as acquisition time.", op);
            return List.of(new TransferOrigin(sold, BigDecimal.ZERO));
        }

        BigDecimal soldShare = Decimals.proportion(sold.amount(), withdrawal.getChange());
        BigDecimal soldFee = depositFee.multiply(Decimals.proportion(sold.amount(), op.getChange()));

        depositsOnPath.add(op);
        List<TransferOrigin> origins = new ArrayList<>();
        BigDecimal assigned = BigDecimal.ZERO;
        for (int i = 0; i < withdrawn.size(); i++) {
            ConsumedLot wc = withdrawn.get(i);
            ConsumedLot piece = i == withdrawn.size() - 1
                    ? new ConsumedLot(wc.op(), sold.amount().subtract(assigned))
                    : wc.partial(soldShare);
            assigned = assigned.add(piece.amount());
            if (piece.amount().signum() == 0) {
                continue;
            }
            BigDecimal pieceFee = soldFee.multiply(Decimals.proportion(wc.amount(), withdrawal.getChange()));
            for (TransferOrigin origin : resolve(piece, depositsOnPath)) {
                BigDecimal feeShare = pieceFee.multiply(Decimals.proportion(origin.lot().amount(), piece.amount()));
                origins.add(origin.plusFee(feeShare));
            }
        }
        depositsOnPath.remove(op);
        return origins;
    }
}
