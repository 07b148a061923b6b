package com.cointax.costbasis.engine;

import com.cointax.common.FiatRegistry;
import com.cointax.costbasis.exception.InsufficientBalanceException;
import com.cointax.costbasis.exception.PostDeadlineOperationException;
import com.cointax.costbasis.rule.GermanTaxationRule;
import com.cointax.domain.AccountingPrinciple;
import com.cointax.domain.EvaluationWarning;
import com.cointax.domain.Operation;
import com.cointax.domain.OperationType;
import com.cointax.domain.WarningCode;
import com.cointax.domain.report.AirdropReportEntry;
import com.cointax.domain.report.InterestReportEntry;
import com.cointax.domain.report.ReportEntryType;
import com.cointax.domain.report.SellReportEntry;
import com.cointax.domain.report.TaxReportEntry;
import com.cointax.domain.report.TransferReportEntry;
import com.cointax.pricing.PriceUnavailableException;
import com.cointax.testsupport.FixedPriceLookup;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Set;

import static com.cointax.testsupport.Ops.buy;
import static com.cointax.testsupport.Ops.linkedDeposit;
import static com.cointax.testsupport.Ops.op;
import static com.cointax.testsupport.Ops.sell;
import static com.cointax.testsupport.Ops.withFees;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TaxmanTest {

    private static final ZoneId BERLIN = ZoneId.of("Europe/Berlin");
    private static final Instant DEADLINE = Instant.parse("2024-12-31T22:59:59Z");

    private FixedPriceLookup prices;

    @BeforeEach
    void setUp() {
        prices = new FixedPriceLookup()
                .price("BTC", Instant.parse("2023-01-01T00:00:00Z"), "80")
                .price("BTC", Instant.parse("2024-01-01T00:00:00Z"), "100")
                .price("BTC", Instant.parse("2024-01-20T00:00:00Z"), "120")
                .price("BTC", Instant.parse("2024-03-01T00:00:00Z"), "150")
                .price("BTC", Instant.parse("2024-12-01T00:00:00Z"), "200")
                .price("ETH", Instant.parse("2023-12-01T00:00:00Z"), "10");
    }

    private Taxman taxman() {
        return taxman(AccountingPrinciple.FIFO, false, false);
    }

    private Taxman taxman(AccountingPrinciple principle, boolean multiDepot, boolean airdropsAreGifts) {
        Clock clock = Clock.fixed(Instant.parse("2025-03-01T00:00:00Z"), ZoneOffset.UTC);
        TaxmanSettings settings = TaxmanSettings.builder()
                .period(TaxPeriod.of(2024, BERLIN, clock))
                .principle(principle)
                .multiDepot(multiDepot)
                .fiatRegistry(new FiatRegistry("EUR", Set.of("EUR", "USD")))
                .allAirdropsAreGifts(airdropsAreGifts)
                .build();
        return new Taxman(settings, new GermanTaxationRule(), prices);
    }

    private static List<SellReportEntry> sells(EvaluationResult result) {
        return result.entriesOf(ReportEntryType.SELL).stream().map(SellReportEntry.class::cast).toList();
    }

    private static BigDecimal feeAmount(List<SellReportEntry> entries) {
        return entries.stream()
                .map(e -> e.getFees().first().amount().add(e.getFees().second().amount()))
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    private static BigDecimal feeInFiat(List<SellReportEntry> entries) {
        return entries.stream().map(e -> e.getFees().totalInFiat()).reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    @Nested
    @DisplayName("selling")
    class Selling {

        @Test
        @DisplayName("buy then sell within a year realizes a taxable gain")
        void buyThenSell() {
            EvaluationResult result = taxman().evaluate(List.of(
                    buy("BTC", "1", "2024-01-10T00:00:00Z"),
                    sell("BTC", "1", "2024-06-01T00:00:00Z")));

            assertThat(result.entries()).singleElement().isInstanceOf(SellReportEntry.class);
            SellReportEntry entry = sells(result).get(0);
            assertThat(entry.getAmount()).isEqualByComparingTo("1");
            assertThat(entry.getBuyValueInFiat()).isEqualByComparingTo("100");
            assertThat(entry.getSellValueInFiat()).isEqualByComparingTo("150");
            assertThat(entry.getGainInFiat()).isEqualByComparingTo("50");
            assertThat(entry.isTaxable()).isTrue();
            assertThat(entry.getTaxableGainInFiat()).isEqualByComparingTo("50");
            assertThat(entry.getTaxationType()).isEqualTo("Sonstige Einkünfte");
            assertThat(result.portfolio().isEmpty()).isTrue();
            assertThat(result.warnings()).isEmpty();
        }

        @Test
        @DisplayName("coins held longer than a year are sold tax free")
        void holdingPeriodElapsed() {
            EvaluationResult result = taxman().evaluate(List.of(
                    buy("BTC", "1", "2023-01-10T00:00:00Z"),
                    sell("BTC", "1", "2024-06-01T00:00:00Z")));

            SellReportEntry entry = sells(result).get(0);
            assertThat(entry.getGainInFiat()).isEqualByComparingTo("70");
            assertThat(entry.isTaxable()).isFalse();
            assertThat(entry.getTaxableGainInFiat()).isEqualByComparingTo("0");
        }

        @Test
        @DisplayName("a sell over two lots is split and the fee prorated")
        void feeProration() {
            Operation sellWithFee = withFees(OperationType.SELL, "kraken", "BTC", "2", "2024-06-01T00:00:00Z", "EUR", "10");

            EvaluationResult result = taxman().evaluate(List.of(
                    buy("EUR", "50", "2024-01-01T12:00:00Z"),
                    buy("BTC", "1", "2024-01-10T00:00:00Z"),
                    buy("BTC", "1", "2024-02-01T00:00:00Z"),
                    sellWithFee));

            List<SellReportEntry> entries = sells(result);
            assertThat(entries).hasSize(2);
            assertThat(entries.get(0).getBuyValueInFiat()).isEqualByComparingTo("100");
            assertThat(entries.get(0).getFees().first().inFiat()).isEqualByComparingTo("5");
            assertThat(entries.get(0).getGainInFiat()).isEqualByComparingTo("45");
            assertThat(entries.get(1).getBuyValueInFiat()).isEqualByComparingTo("120");
            assertThat(entries.get(1).getGainInFiat()).isEqualByComparingTo("25");
            BigDecimal total = entries.stream().map(TaxReportEntry::getGainInFiat).reduce(BigDecimal.ZERO, BigDecimal::add);
            assertThat(total).isEqualByComparingTo("70");
            // the fee left the EUR balance
            assertThat(result.portfolio().amount("kraken", "EUR")).isEqualByComparingTo("40");
        }

        @Test
        @DisplayName("fees of a sell split over two lots add up to the fees of one full lot")
        void feeProrationIsIdempotent() {
            List<SellReportEntry> split = sells(taxman().evaluate(List.of(
                    buy("EUR", "50", "2024-01-01T12:00:00Z"),
                    buy("BTC", "1", "2024-01-10T00:00:00Z"),
                    buy("BTC", "1", "2024-01-11T00:00:00Z"),
                    buy("BTC", "0.001", "2024-01-12T00:00:00Z"),
                    withFees(OperationType.SELL, "kraken", "BTC", "2", "2024-06-01T00:00:00Z", "EUR", "10", "BTC", "0.001"))));
            List<SellReportEntry> whole = sells(taxman().evaluate(List.of(
                    buy("EUR", "50", "2024-01-01T12:00:00Z"),
                    buy("BTC", "2.001", "2024-01-10T00:00:00Z"),
                    withFees(OperationType.SELL, "kraken", "BTC", "2", "2024-06-01T00:00:00Z", "EUR", "10", "BTC", "0.001"))));

            assertThat(split).hasSize(2);
            assertThat(whole).hasSize(1);
            assertThat(feeAmount(split)).isEqualByComparingTo(feeAmount(whole));
            assertThat(feeInFiat(split)).isEqualByComparingTo(feeInFiat(whole));
            assertThat(feeInFiat(whole)).isEqualByComparingTo("10.15");
        }

        @Test
        @DisplayName("LIFO sells the newest lot first")
        void lifo() {
            EvaluationResult result = taxman(AccountingPrinciple.LIFO, false, false).evaluate(List.of(
                    buy("BTC", "1", "2024-01-10T00:00:00Z"),
                    buy("BTC", "1", "2024-02-01T00:00:00Z"),
                    sell("BTC", "1", "2024-06-01T00:00:00Z")));

            SellReportEntry entry = sells(result).get(0);
            assertThat(entry.getBuyUtcTime()).isEqualTo(Instant.parse("2024-02-01T00:00:00Z"));
            assertThat(entry.getGainInFiat()).isEqualByComparingTo("30");
        }

        @Test
        @DisplayName("acquisition fees raise the cost basis")
        void acquisitionFee() {
            EvaluationResult result = taxman().evaluate(List.of(
                    withFees(OperationType.BUY, "kraken", "BTC", "1", "2024-01-10T00:00:00Z", "EUR", "2"),
                    sell("BTC", "1", "2024-06-01T00:00:00Z")));

            assertThat(sells(result).get(0).getBuyValueInFiat()).isEqualByComparingTo("102");
        }

        @Test
        @DisplayName("operations are replayed in time order")
        void sortsOperations() {
            EvaluationResult result = taxman().evaluate(List.of(
                    sell("BTC", "1", "2024-06-01T00:00:00Z"),
                    buy("BTC", "1", "2024-01-10T00:00:00Z")));

            assertThat(sells(result)).hasSize(1);
        }

        @Test
        @DisplayName("selling the reporting fiat is not a tax event")
        void fiatSellSkipped() {
            EvaluationResult result = taxman().evaluate(List.of(
                    buy("EUR", "100", "2024-01-10T00:00:00Z"),
                    sell("EUR", "60", "2024-02-01T00:00:00Z")));

            assertThat(result.realizedEntries()).isEmpty();
            assertThat(result.portfolio().amount("kraken", "EUR")).isEqualByComparingTo("40");
        }

        @Test
        @DisplayName("sells before the tax year consume lots without a report entry")
        void sellBeforePeriod() {
            EvaluationResult result = taxman().evaluate(List.of(
                    buy("BTC", "2", "2023-01-10T00:00:00Z"),
                    sell("BTC", "1", "2023-06-01T00:00:00Z")));

            assertThat(result.realizedEntries()).isEmpty();
            assertThat(result.portfolio().total("BTC")).isEqualByComparingTo("1");
        }

        @Test
        @DisplayName("selling more than held aborts the evaluation")
        void insufficientBalance() {
            assertThatThrownBy(() -> taxman().evaluate(List.of(
                    buy("BTC", "1", "2024-01-10T00:00:00Z"),
                    sell("BTC", "1.5", "2024-06-01T00:00:00Z"))))
                    .isInstanceOf(InsufficientBalanceException.class);
        }

        @Test
        @DisplayName("a missing price for a realized sell aborts the evaluation")
        void missingSellPrice() {
            prices.noPriceFrom("BTC", Instant.parse("2024-05-01T00:00:00Z"));

            assertThatThrownBy(() -> taxman().evaluate(List.of(
                    buy("BTC", "1", "2024-01-10T00:00:00Z"),
                    sell("BTC", "1", "2024-06-01T00:00:00Z"))))
                    .isInstanceOf(PriceUnavailableException.class)
                    .extracting("errorCode").isEqualTo("PRICE_UNAVAILABLE");
        }
    }

    @Nested
    @DisplayName("deadline liquidation")
    class Liquidation {

        @Test
        @DisplayName("remaining coins are valued at the deadline")
        void unrealizedGain() {
            EvaluationResult result = taxman().evaluate(List.of(buy("BTC", "1", "2024-01-10T00:00:00Z")));

            assertThat(result.realizedEntries()).isEmpty();
            assertThat(result.unrealizedEntries()).singleElement().satisfies(e -> {
                SellReportEntry entry = (SellReportEntry) e;
                assertThat(entry.getSellUtcTime()).isEqualTo(DEADLINE);
                assertThat(entry.getSellValueInFiat()).isEqualByComparingTo("200");
                assertThat(entry.getGainInFiat()).isEqualByComparingTo("100");
                assertThat(entry.isTaxable()).isTrue();
            });
            assertThat(result.portfolio().amount("kraken", "BTC")).isEqualByComparingTo("1");
        }

        @Test
        @DisplayName("a missing deadline price values the holdings at zero and warns")
        void missingDeadlinePrice() {
            prices.noPriceFrom("BTC", Instant.parse("2024-12-15T00:00:00Z"));

            EvaluationResult result = taxman().evaluate(List.of(buy("BTC", "1", "2024-01-10T00:00:00Z")));

            SellReportEntry entry = (SellReportEntry) result.unrealizedEntries().get(0);
            assertThat(entry.getSellValueInFiat()).isEqualByComparingTo("0");
            assertThat(entry.getGainInFiat()).isEqualByComparingTo("-100");
            assertThat(result.warnings()).extracting(EvaluationWarning::code).containsExactly(WarningCode.UNREALIZED_PRICE_UNKNOWN);
        }

        @Test
        @DisplayName("the deadline is now while the year is still running")
        void deadlineIsNow() {
            Instant now = Instant.parse("2024-08-01T00:00:00Z");
            TaxmanSettings settings = TaxmanSettings.builder()
                    .period(TaxPeriod.of(2024, BERLIN, Clock.fixed(now, ZoneOffset.UTC)))
                    .principle(AccountingPrinciple.FIFO)
                    .fiatRegistry(new FiatRegistry("EUR", Set.of("EUR")))
                    .build();

            EvaluationResult result = new Taxman(settings, new GermanTaxationRule(), prices)
                    .evaluate(List.of(buy("BTC", "1", "2024-01-10T00:00:00Z")));

            SellReportEntry entry = (SellReportEntry) result.unrealizedEntries().get(0);
            assertThat(entry.getSellUtcTime()).isEqualTo(now);
            assertThat(entry.getSellValueInFiat()).isEqualByComparingTo("150");
        }

        @Test
        @DisplayName("operations after the tax year are rejected before anything is evaluated")
        void postDeadlineOperation() {
            assertThatThrownBy(() -> taxman().evaluate(List.of(
                    buy("BTC", "1", "2024-01-10T00:00:00Z"),
                    buy("BTC", "1", "2025-01-02T00:00:00Z"))))
                    .isInstanceOf(PostDeadlineOperationException.class)
                    .hasMessageContaining("2024");
        }
    }

    @Nested
    @DisplayName("income")
    class Income {

        @Test
        @DisplayName("interest is categorized by payout coin and operation")
        void interest() {
            EvaluationResult result = taxman().evaluate(List.of(
                    op(OperationType.COIN_LEND_INTEREST, "kraken", "EUR", "5", "2024-02-01T00:00:00Z"),
                    op(OperationType.COIN_LEND_INTEREST, "kraken", "BTC", "0.1", "2024-02-01T00:00:00Z"),
                    op(OperationType.STAKING_INTEREST, "kraken", "ETH", "2", "2024-02-01T00:00:00Z")));

            List<InterestReportEntry> interest = result.realizedEntries().stream()
                    .map(InterestReportEntry.class::cast).toList();
            assertThat(interest).extracting(InterestReportEntry::getEventType).containsExactly(
                    ReportEntryType.INTEREST, ReportEntryType.LENDING_INTEREST, ReportEntryType.STAKING_INTEREST);
            assertThat(interest).extracting(TaxReportEntry::getTaxationType).containsExactly(
                    "Einkünfte aus Kapitalvermögen", "Einkünfte aus sonstigen Leistungen",
                    "Einkünfte aus sonstigen Leistungen");
            assertThat(interest.get(0).getInterestInFiat()).isEqualByComparingTo("5");
            assertThat(interest.get(1).getInterestInFiat()).isEqualByComparingTo("12");
            assertThat(interest.get(2).getInterestInFiat()).isEqualByComparingTo("20");
            assertThat(result.portfolio().amount("kraken", "ETH")).isEqualByComparingTo("2");
        }

        @Test
        @DisplayName("airdrops are taxable income by default")
        void airdropIncome() {
            EvaluationResult result = taxman().evaluate(List.of(
                    op(OperationType.AIRDROP, "kraken", "ETH", "3", "2024-02-01T00:00:00Z")));

            AirdropReportEntry entry = (AirdropReportEntry) result.entriesOf(ReportEntryType.AIRDROP).get(0);
            assertThat(entry.getInFiat()).isEqualByComparingTo("30");
            assertThat(entry.isTaxable()).isTrue();
            assertThat(entry.getTaxationType()).isEqualTo("Einkünfte aus sonstigen Leistungen");
        }

        @Test
        @DisplayName("airdrops configured as gifts are not taxable")
        void airdropGift() {
            EvaluationResult result = taxman(AccountingPrinciple.FIFO, false, true).evaluate(List.of(
                    op(OperationType.AIRDROP, "kraken", "ETH", "3", "2024-02-01T00:00:00Z")));

            TaxReportEntry entry = result.entriesOf(ReportEntryType.AIRDROP).get(0);
            assertThat(entry.getTaxationType()).isEqualTo("Schenkung");
            assertThat(entry.getTaxableGainInFiat()).isEqualByComparingTo("0");
        }

        @Test
        @DisplayName("commissions are taxable income")
        void commission() {
            EvaluationResult result = taxman().evaluate(List.of(
                    op(OperationType.COMMISSION, "kraken", "BTC", "0.01", "2024-02-01T00:00:00Z")));

            TaxReportEntry entry = result.entriesOf(ReportEntryType.COMMISSION).get(0);
            assertThat(entry.getGainInFiat()).isEqualByComparingTo("1.2");
            assertThat(entry.isTaxable()).isTrue();
        }

        @Test
        @DisplayName("income before the tax year is added to the balance only")
        void incomeBeforePeriod() {
            EvaluationResult result = taxman().evaluate(List.of(
                    op(OperationType.STAKING_INTEREST, "kraken", "ETH", "2", "2023-12-01T00:00:00Z")));

            assertThat(result.realizedEntries()).isEmpty();
            assertThat(result.portfolio().total("ETH")).isEqualByComparingTo("2");
        }
    }

    @Nested
    @DisplayName("transfers")
    class Transfers {

        @Test
        @DisplayName("coins sold after a transfer keep their original acquisition")
        void sellAfterTransfer() {
            Operation withdrawal = op(OperationType.WITHDRAWAL, "kraken", "BTC", "1", "2024-02-01T00:00:00Z");
            Operation deposit = linkedDeposit(withdrawal, "binance", "0.99", "2024-02-01T01:00:00Z");
            Operation sale = op(OperationType.SELL, "binance", "BTC", "0.99", "2024-06-01T00:00:00Z");

            EvaluationResult result = taxman(AccountingPrinciple.FIFO, true, false).evaluate(List.of(
                    buy("BTC", "1", "2024-01-10T00:00:00Z"), withdrawal, deposit, sale));

            TransferReportEntry transfer = (TransferReportEntry) result.entriesOf(ReportEntryType.TRANSFER).get(0);
            assertThat(transfer.getWithdrawalPlatform()).isEqualTo("kraken");
            assertThat(transfer.getDepositPlatform()).isEqualTo("binance");
            assertThat(transfer.getFee().amount()).isEqualByComparingTo("0.01");
            assertThat(transfer.getFee().inFiat()).isEqualByComparingTo("1.2");
            assertThat(transfer.isTaxable()).isFalse();

            SellReportEntry entry = sells(result).get(0);
            assertThat(entry.getBuyPlatform()).isEqualTo("kraken");
            assertThat(entry.getSellPlatform()).isEqualTo("binance");
            assertThat(entry.getBuyUtcTime()).isEqualTo(Instant.parse("2024-01-10T00:00:00Z"));
            assertThat(entry.getAmount()).isEqualByComparingTo("0.99");
            assertThat(entry.getBuyValueInFiat()).isEqualByComparingTo("99");
            assertThat(entry.getGainInFiat()).isEqualByComparingTo("49.5");
            assertThat(entry.getExcludedTransferFee()).isEqualByComparingTo("0.01");
            assertThat(result.warnings()).extracting(EvaluationWarning::code).containsExactly(WarningCode.TRANSFER_FEE_EXCLUDED);
            assertThat(result.portfolio().isEmpty()).isTrue();
        }

        @Test
        @DisplayName("multi depot keeps platforms apart")
        void multiDepotBalances() {
            assertThatThrownBy(() -> taxman(AccountingPrinciple.FIFO, true, false).evaluate(List.of(
                    buy("BTC", "1", "2024-01-10T00:00:00Z"),
                    op(OperationType.SELL, "binance", "BTC", "1", "2024-06-01T00:00:00Z"))))
                    .isInstanceOf(InsufficientBalanceException.class);
        }

        @Test
        @DisplayName("selling an unlinked deposit warns and uses the deposit as acquisition")
        void unlinkedDeposit() {
            EvaluationResult result = taxman().evaluate(List.of(
                    op(OperationType.DEPOSIT, "kraken", "BTC", "1", "2024-02-01T00:00:00Z"),
                    sell("BTC", "1", "2024-06-01T00:00:00Z")));

            SellReportEntry entry = sells(result).get(0);
            assertThat(entry.getBuyUtcTime()).isEqualTo(Instant.parse("2024-02-01T00:00:00Z"));
            assertThat(entry.getBuyValueInFiat()).isEqualByComparingTo("120");
            assertThat(result.warnings()).extracting(EvaluationWarning::code).containsExactly(WarningCode.MISSING_DEPOSIT_LINK);
        }

        @Test
        @DisplayName("a withdrawal consuming its own earlier booked deposit resolves to that deposit")
        void withdrawalConsumesItsOwnDeposit() {
            Operation withdrawal = op(OperationType.WITHDRAWAL, "kraken", "BTC", "1", "2024-02-01T00:05:00Z");
            Operation deposit = linkedDeposit(withdrawal, "kraken", "1", "2024-02-01T00:00:00Z");

            EvaluationResult result = taxman().evaluate(List.of(
                    buy("BTC", "0.5", "2024-01-10T00:00:00Z"), withdrawal, deposit,
                    sell("BTC", "0.5", "2024-06-01T00:00:00Z")));

            List<SellReportEntry> entries = sells(result);
            assertThat(entries).hasSize(2);
            assertThat(entries.get(0).getBuyUtcTime()).isEqualTo(Instant.parse("2024-01-10T00:00:00Z"));
            assertThat(entries.get(0).getAmount()).isEqualByComparingTo("0.25");
            assertThat(entries.get(0).getGainInFiat()).isEqualByComparingTo("12.5");
            assertThat(entries.get(1).getBuyUtcTime()).isEqualTo(Instant.parse("2024-02-01T00:00:00Z"));
            assertThat(entries.get(1).getAmount()).isEqualByComparingTo("0.25");
            assertThat(entries.get(1).getGainInFiat()).isEqualByComparingTo("7.5");
            assertThat(result.warnings()).extracting(EvaluationWarning::code)
                    .containsExactly(WarningCode.UNLINKED_WITHDRAWAL_LOTS);
            assertThat(result.portfolio().isEmpty()).isTrue();
        }
    }

    @Test
    @DisplayName("lending and staking are reported once as not tracked")
    void lendingAndStakingWarnings() {
        EvaluationResult result = taxman().evaluate(List.of(
                op(OperationType.COIN_LEND, "kraken", "BTC", "1", "2024-02-01T00:00:00Z"),
                op(OperationType.COIN_LEND, "kraken", "BTC", "1", "2024-03-01T00:00:00Z"),
                op(OperationType.COIN_LEND_END, "kraken", "BTC", "1", "2024-04-01T00:00:00Z"),
                op(OperationType.STAKING, "kraken", "ETH", "1", "2024-02-01T00:00:00Z"),
                op(OperationType.STAKING_END, "kraken", "ETH", "1", "2024-04-01T00:00:00Z")));

        assertThat(result.entries()).isEmpty();
        assertThat(result.warnings()).extracting(EvaluationWarning::code)
                .containsExactly(WarningCode.LENDING_NOT_TRACKED, WarningCode.STAKING_NOT_TRACKED);
    }

    @Test
    @DisplayName("an instance evaluates one ledger only")
    void singleUse() {
        Taxman taxman = taxman();
        taxman.evaluate(List.of());

        assertThatThrownBy(() -> taxman.evaluate(List.of())).isInstanceOf(IllegalStateException.class);
    }
}
