package com.cointax.costbasis.engine;

import com.cointax.common.Decimals;
import com.cointax.costbasis.EvaluationWarnings;
import com.cointax.costbasis.exception.PostDeadlineOperationException;
import com.cointax.costbasis.exception.UnsupportedOperationTypeException;
import com.cointax.costbasis.fee.FeeAllocator;
import com.cointax.costbasis.queue.BalanceQueue;
import com.cointax.costbasis.queue.BalanceQueues;
import com.cointax.costbasis.rule.TaxationRule;
import com.cointax.costbasis.transfer.TransferLinker;
import com.cointax.costbasis.transfer.TransferOrigin;
import com.cointax.domain.ConsumedLot;
import com.cointax.domain.Fee;
import com.cointax.domain.Operation;
import com.cointax.domain.OperationType;
import com.cointax.domain.PortfolioSnapshot;
import com.cointax.domain.WarningCode;
import com.cointax.domain.report.AirdropReportEntry;
import com.cointax.domain.report.AllocatedFee;
import com.cointax.domain.report.CommissionReportEntry;
import com.cointax.domain.report.InterestReportEntry;
import com.cointax.domain.report.ReportEntryType;
import com.cointax.domain.report.TaxReportEntry;
import com.cointax.domain.report.TransferReportEntry;
import com.cointax.pricing.CostBasisLookup;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Taxation state machine for one tax year. Replays the ledger in time order, keeps the balance
 * queues, emits tax report entries and finally liquidates all remaining lots at the deadline to
 * value unrealized gains.
 * <p>
 * One instance evaluates exactly one ledger; it is not thread-safe.
 */
@Slf4j
public class Taxman {

    private final TaxmanSettings settings;
    private final TaxationRule taxationRule;
    private final CostBasisLookup costBasisLookup;

    private final EvaluationWarnings warnings = new EvaluationWarnings();
    private final BalanceQueues balances;
    private final TransferLinker transferLinker;
    private final SellEvaluator sellEvaluator;
    private final List<TaxReportEntry> reportEntries = new ArrayList<>();
    private final PortfolioSnapshot portfolioAtDeadline = new PortfolioSnapshot();
    private boolean evaluated;

    public Taxman(TaxmanSettings settings, TaxationRule taxationRule, CostBasisLookup costBasisLookup) {
        this.settings = settings;
        this.taxationRule = taxationRule;
        this.costBasisLookup = costBasisLookup;
        this.balances = new BalanceQueues(settings.principle(), settings.multiDepot());
        this.transferLinker = new TransferLinker(warnings);
        this.sellEvaluator = new SellEvaluator(costBasisLookup, new FeeAllocator(costBasisLookup), taxationRule, warnings);
    }

    /**
     * Evaluates the ledger. Any fatal condition aborts with an exception and no result.
     *
     * @throws PostDeadlineOperationException if an operation lies after the tax year
     */
    public EvaluationResult evaluate(List<Operation> operations) {
        if (evaluated) {
            throw new IllegalStateException("Taxman instances evaluate a single ledger");
        }
        evaluated = true;
        TaxPeriod period = settings.period();
        log.debug("Starting evaluation of {} operations for {}", operations.size(), period.year());

        for (Operation op : operations) {
            if (period.isAfterPeriod(op.getUtcTime())) {
                throw new PostDeadlineOperationException("For tax evaluation, no operation should happen after the tax year "
                        + period.year() + ": " + op + " (" + op.describeSource() + ")");
            }
        }

        List<Operation> sorted = new ArrayList<>(operations);
        sorted.sort(Comparator.comparing(Operation::getUtcTime));
        for (Operation op : sorted) {
            evaluate(op);
        }

        liquidateAtDeadline();
        return new EvaluationResult(period, reportEntries, portfolioAtDeadline, warnings.list());
    }

    void evaluate(Operation op) {
        switch (op.getType()) {
            case BUY -> balances.add(op);
            case SELL -> sell(op);
            case COIN_LEND -> warnings.addOnce(WarningCode.LENDING_NOT_TRACKED, "Lent coins stay in your balance and can"
                    + " be sold while lent; lending does not extend the holding period.", op);
            case STAKING -> warnings.addOnce(WarningCode.STAKING_NOT_TRACKED, "Staked coins stay in your balance and can"
                    + " be sold while staked; staking does not extend the holding period.", op);
            case COIN_LEND_END, STAKING_END -> {
                // lent and staked coins never leave the balance
            }
            case COIN_LEND_INTEREST, STAKING_INTEREST -> interest(op);
            case AIRDROP -> airdrop(op);
            case COMMISSION -> commission(op);
            case DEPOSIT -> deposit(op);
            case WITHDRAWAL -> transferLinker.recordWithdrawal(op, balances.remove(op));
            default -> throw new UnsupportedOperationTypeException("Unable to evaluate " + op.getType()
                    + " (" + op.describeSource() + ")");
        }
    }

    private void sell(Operation op) {
        List<ConsumedLot> sold = balances.remove(op);
        balances.removeFees(op.getFees());

        if (settings.fiatRegistry().isReportingFiat(op.getCoin()) || !settings.period().contains(op.getUtcTime())) {
            return;
        }
        BigDecimal soldTotal = Decimals.sum(sold, ConsumedLot::amount);
        if (soldTotal.compareTo(op.getChange()) != 0) {
            throw new IllegalStateException("Consumed lots of " + op + " add up to " + soldTotal.toPlainString());
        }
        for (ConsumedLot lot : sold) {
            for (TransferOrigin origin : transferLinker.resolve(lot)) {
                if (origin.transferFee().signum() > 0) {
                    warnings.addOnce(WarningCode.TRANSFER_FEE_EXCLUDED, "You paid fees for withdrawal and deposit of coins."
                            + " It is unclear whether they reduce the taxed gain; for now they are listed but not"
                            + " deducted.", op);
                }
                reportEntries.add(sellEvaluator.evaluate(op, origin.lot(), BigDecimal.ZERO, origin.transferFee()));
            }
        }
    }

    private void interest(Operation op) {
        balances.add(op);
        if (!settings.period().contains(op.getUtcTime())) {
            return;
        }
        boolean fiat = settings.fiatRegistry().isFiat(op.getCoin());
        ReportEntryType kind;
        if (op.getType() == OperationType.COIN_LEND_INTEREST) {
            kind = fiat ? ReportEntryType.INTEREST : ReportEntryType.LENDING_INTEREST;
        } else {
            kind = ReportEntryType.STAKING_INTEREST;
        }
        reportEntries.add(InterestReportEntry.builder()
                .kind(kind)
                .platform(op.getPlatform())
                .coin(op.getCoin())
                .amount(op.getChange())
                .utcTime(op.getUtcTime())
                .interestInFiat(costBasisLookup.cost(op))
                .taxable(true)
                .taxationType(taxationRule.interestTaxationType(fiat && kind == ReportEntryType.INTEREST))
                .remark(op.getRemark())
                .build());
    }

    private void airdrop(Operation op) {
        balances.add(op);
        if (!settings.period().contains(op.getUtcTime())) {
            return;
        }
        boolean gift = settings.allAirdropsAreGifts();
        reportEntries.add(AirdropReportEntry.builder()
                .platform(op.getPlatform())
                .coin(op.getCoin())
                .amount(op.getChange())
                .utcTime(op.getUtcTime())
                .inFiat(costBasisLookup.cost(op))
                .taxable(taxationRule.isAirdropTaxable(gift))
                .taxationType(taxationRule.airdropTaxationType(gift))
                .remark(op.getRemark())
                .build());
    }

    private void commission(Operation op) {
        balances.add(op);
        if (!settings.period().contains(op.getUtcTime())) {
            return;
        }
        reportEntries.add(CommissionReportEntry.builder()
                .platform(op.getPlatform())
                .coin(op.getCoin())
                .amount(op.getChange())
                .utcTime(op.getUtcTime())
                .inFiat(costBasisLookup.cost(op))
                .taxable(true)
                .taxationType(taxationRule.commissionTaxationType())
                .remark(op.getRemark())
                .build());
    }

    private void deposit(Operation op) {
        balances.add(op);
        op.getLink().ifPresent(withdrawal -> {
            BigDecimal fee = TransferLinker.transferFee(op, withdrawal);
            BigDecimal feeInFiat = fee.signum() == 0
                    ? BigDecimal.ZERO
                    : costBasisLookup.cost(Fee.of(op.getPlatform(), op.getCoin(), fee, op.getUtcTime()));
            reportEntries.add(TransferReportEntry.builder()
                    .depositPlatform(op.getPlatform())
                    .withdrawalPlatform(withdrawal.getPlatform())
                    .coin(op.getCoin())
                    .amount(op.getChange())
                    .depositUtcTime(op.getUtcTime())
                    .withdrawalUtcTime(withdrawal.getUtcTime())
                    .fee(new AllocatedFee(fee, op.getCoin(), feeInFiat))
                    .remark(op.getRemark())
                    .build());
        });
    }

    private void liquidateAtDeadline() {
        for (BalanceQueue balance : balances.all()) {
            balance.sanityCheck();

            for (ConsumedLot lot : balance.removeAll()) {
                Operation acquisition = lot.op();
                portfolioAtDeadline.add(acquisition.getPlatform(), acquisition.getCoin(), lot.amount());

                Operation unrealizedSell = Operation.builder()
                        .type(OperationType.SELL)
                        .platform(acquisition.getPlatform())
                        .coin(acquisition.getCoin())
                        .change(lot.amount())
                        .utcTime(settings.period().deadline())
                        .build();
                reportEntries.add(sellEvaluator.evaluateUnrealized(unrealizedSell, lot));
            }
        }
    }

    BalanceQueues balances() {
        return balances;
    }

    TransferLinker transferLinker() {
        return transferLinker;
    }
}
