package com.coinledger.ingestion.csv;

import com.coinledger.domain.SourceLocation;
import com.coinledger.domain.TradeDetails;
import com.coinledger.domain.Transaction;
import com.coinledger.domain.TransactionKind;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Reads the Binance account statement export, one balance change per row. Rows sharing a remark (or, without
 * one, a timestamp) form a group; the incoming and outgoing legs of a group are paired into trades and fee rows
 * are spread over those trades. Deposits, withdrawals and airdrops become transfers.
 */
@Slf4j
class BinanceAccountStatementParser {

    static final String USER_ID = "User_ID";
    static final String UTC_TIME = "UTC_Time";
    static final String ACCOUNT = "Account";
    static final String OPERATION = "Operation";
    static final String COIN = "Coin";
    static final String CHANGE = "Change";
    static final String REMARK = "Remark";
    static final List<String> EXPECTED_HEADERS = List.of(USER_ID, UTC_TIME, ACCOUNT, OPERATION, COIN, CHANGE, REMARK);

    private static final Set<String> TRANSFER_OPERATIONS = Set.of("deposit", "withdraw", "airdrop assets");
    private static final DateTimeFormatter EXPORT_DATE = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    private static final int SCALE = 18;

    private final Set<String> fiatAssets;

    BinanceAccountStatementParser(Collection<String> fiatAssets) {
        this.fiatAssets = fiatAssets.stream()
                .map(a -> a.strip().toUpperCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }

    /**
     * @param rows    data rows, header excluded
     * @param columns header name to column index
     * @return transfers followed by rebuilt trades; empty when there are no data rows
     */
    List<Transaction> parse(List<List<String>> rows, Map<String, Integer> columns, String currency,
                            SourceLocation location) {
        List<Group> groups = new ArrayList<>();
        List<Transaction> transactions = new ArrayList<>();
        int rowNumber = 0;
        for (List<String> cells : rows) {
            if (cells.stream().allMatch(c -> c == null || c.isBlank())) {
                continue;
            }
            rowNumber++;
            Entry entry = readEntry(rowNumber, cells, columns);
            if (entry == null) {
                continue;
            }
            if (TRANSFER_OPERATIONS.contains(entry.normalizedOperation())) {
                if (entry.change().signum() != 0) {
                    transactions.add(toTransfer(entry, location));
                }
                continue;
            }
            String key = entry.remark().isEmpty() ? "time::" + entry.time() : "remark::" + entry.remark();
            if (groups.isEmpty() || !groups.get(groups.size() - 1).key().equals(key)) {
                groups.add(new Group(key, new ArrayList<>()));
            }
            groups.get(groups.size() - 1).entries().add(entry);
        }

        if (rowNumber == 0) {
            return List.of();
        }
        int trades = 0;
        for (List<Entry> entries : mergeComplementary(groups)) {
            for (Trade trade : pair(entries)) {
                transactions.add(trade.toTransaction(currency, location));
                trades++;
            }
        }
        if (transactions.isEmpty()) {
            throw new MalformedInputException("Account statement contains no trades, deposits or withdrawals");
        }
        log.info("Rebuilt {} trades and {} transfers from account statement", trades, transactions.size() - trades);
        return transactions;
    }

    private static Entry readEntry(int number, List<String> cells, Map<String, Integer> columns) {
        String time = cell(cells, columns, UTC_TIME);
        if (time.isEmpty()) {
            return null;
        }
        Instant timestamp;
        try {
            timestamp = LocalDateTime.parse(time, EXPORT_DATE).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            throw new MalformedInputException("Row " + number + ": invalid " + UTC_TIME + " '" + time + "'", e);
        }
        String coin = cell(cells, columns, COIN).toUpperCase(Locale.ROOT);
        String changeText = cell(cells, columns, CHANGE);
        if (coin.isEmpty() || changeText.isEmpty()) {
            return null;
        }
        BigDecimal change;
        try {
            change = new BigDecimal(changeText);
        } catch (NumberFormatException e) {
            throw new MalformedInputException("Row " + number + ": " + CHANGE + " is not a number: '" + changeText + "'", e);
        }
        return new Entry(number, cells, time, timestamp, cell(cells, columns, OPERATION), coin, change,
                cell(cells, columns, REMARK));
    }

    private static String cell(List<String> cells, Map<String, Integer> columns, String column) {
        int i = columns.get(column);
        if (i >= cells.size() || cells.get(i) == null) {
            return "";
        }
        return cells.get(i).strip();
    }

    private static Transaction toTransfer(Entry entry, SourceLocation location) {
        return Transaction.builder()
                .id(BinanceTradeCsvNormalizer.stableId(entry.row(), entry.cells()))
                .timestamp(entry.timestamp())
                .asset(entry.coin())
                .kind(entry.change().signum() > 0 ? TransactionKind.DEPOSIT : TransactionKind.WITHDRAWAL)
                .amount(entry.change().abs())
                .feeAsset(entry.coin())
                .location(location)
                .rawPayload(Map.of(OPERATION, entry.operation()))
                .build();
    }

    /**
     * A one-sided group followed by a one-sided group of the opposite direction with the same operations is the
     * other half of the same trade. Groups holding only fees are dropped.
     */
    private static List<List<Entry>> mergeComplementary(List<Group> groups) {
        List<List<Entry>> merged = new ArrayList<>();
        int i = 0;
        while (i < groups.size()) {
            Group group = groups.get(i);
            if (group.feeOnly()) {
                i++;
                continue;
            }
            int partner = group.singleSided() ? partnerOf(groups, i) : -1;
            if (partner >= 0) {
                List<Entry> combined = new ArrayList<>(group.entries());
                combined.addAll(groups.get(partner).entries());
                combined.sort((a, b) -> Integer.compare(a.row(), b.row()));
                merged.add(combined);
                i = partner + 1;
                continue;
            }
            merged.add(group.entries());
            i++;
        }
        return merged;
    }

    private static int partnerOf(List<Group> groups, int index) {
        Group current = groups.get(index);
        Set<String> signature = current.signature();
        if (signature.isEmpty()) {
            return -1;
        }
        for (int next = index + 1; next < groups.size(); next++) {
            Group candidate = groups.get(next);
            if (candidate.feeOnly()) {
                continue;
            }
            boolean matches = candidate.signature().equals(signature)
                    && candidate.hasIncoming() != current.hasIncoming()
                    && candidate.singleSided();
            return matches ? next : -1;
        }
        return -1;
    }

    private List<Trade> pair(List<Entry> entries) {
        List<Entry> incoming = new ArrayList<>();
        List<Entry> outgoing = new ArrayList<>();
        Map<String, BigDecimal> fees = new LinkedHashMap<>();
        for (Entry entry : entries) {
            if (entry.isFee()) {
                fees.merge(entry.coin(), entry.change().abs(), BigDecimal::add);
            } else if (entry.change().signum() > 0) {
                incoming.add(entry);
            } else if (entry.change().signum() < 0) {
                outgoing.add(entry);
            }
        }
        if (incoming.isEmpty() || outgoing.isEmpty()) {
            log.debug("Skipping one-sided movement group at row {}", entries.get(0).row());
            return List.of();
        }
        if (incoming.size() != outgoing.size()) {
            throw new MalformedInputException("Row " + entries.get(0).row() + ": unbalanced movements, "
                    + incoming.size() + " incoming and " + outgoing.size() + " outgoing");
        }
        List<Trade> trades = new ArrayList<>();
        for (int i = 0; i < incoming.size(); i++) {
            trades.add(trade(incoming.get(i), outgoing.get(i)));
        }
        fees.forEach((asset, total) -> allocateFee(trades, asset, total));
        return trades;
    }

    /** Receiving fiat for a non-fiat asset is a sale of that asset; everything else buys what came in. */
    private Trade trade(Entry in, Entry out) {
        BigDecimal received = in.change();
        BigDecimal spent = out.change().abs();
        if (isFiat(in.coin()) && !isFiat(out.coin())) {
            return new Trade(in, out, TransactionKind.SELL, out.coin(), spent, in.coin(), received);
        }
        return new Trade(in, out, TransactionKind.BUY, in.coin(), received, out.coin(), spent);
    }

    /** Spreads a fee over the trades touching its asset, weighted by the amount of that asset each one moved. */
    private static void allocateFee(List<Trade> trades, String asset, BigDecimal total) {
        Map<Trade, BigDecimal> weights = new LinkedHashMap<>();
        for (Trade trade : trades) {
            if (trade.base.equals(asset)) {
                weights.put(trade, trade.baseAmount);
            } else if (trade.quote.equals(asset)) {
                weights.put(trade, trade.quoteAmount);
            }
        }
        BigDecimal weightSum = weights.values().stream().reduce(BigDecimal.ZERO, BigDecimal::add);
        if (weightSum.signum() == 0) {
            log.debug("Fee of {} {} matches no trade leg, ignored", total.toPlainString(), asset);
            return;
        }
        weights.forEach((trade, weight) -> {
            BigDecimal share = total.multiply(weight).divide(weightSum, SCALE, RoundingMode.HALF_UP);
            if (share.signum() == 0) {
                return;
            }
            if (trade.feeAsset != null && !trade.feeAsset.equals(asset)) {
                throw new MalformedInputException("Row " + trade.firstRow() + ": fees in more than one asset for one trade");
            }
            trade.feeAsset = asset;
            trade.fee = trade.fee.add(share);
        });
    }

    private boolean isFiat(String coin) {
        return fiatAssets.contains(coin);
    }

    private static boolean isFeeOperation(String operation) {
        String op = operation.toLowerCase(Locale.ROOT);
        return op.contains("fee") || op.contains("commission");
    }

    private record Entry(int row, List<String> cells, String time, Instant timestamp, String operation, String coin,
                         BigDecimal change, String remark) {

        String normalizedOperation() {
            return operation.toLowerCase(Locale.ROOT);
        }

        boolean isFee() {
            return isFeeOperation(operation);
        }
    }

    private record Group(String key, List<Entry> entries) {

        boolean feeOnly() {
            return entries.stream().allMatch(Entry::isFee);
        }

        boolean hasIncoming() {
            return entries.stream().anyMatch(e -> !e.isFee() && e.change().signum() > 0);
        }

        boolean hasOutgoing() {
            return entries.stream().anyMatch(e -> !e.isFee() && e.change().signum() < 0);
        }

        boolean singleSided() {
            return hasIncoming() != hasOutgoing();
        }

        Set<String> signature() {
            return entries.stream()
                    .filter(e -> !e.isFee())
                    .map(Entry::normalizedOperation)
                    .collect(Collectors.toSet());
        }
    }

    /** One rebuilt trade; fee fields fill in while fees are allocated. */
    private static final class Trade {

        private final Entry in;
        private final Entry out;
        private final TransactionKind kind;
        private final String base;
        private final BigDecimal baseAmount;
        private final String quote;
        private final BigDecimal quoteAmount;
        private String feeAsset;
        private BigDecimal fee = BigDecimal.ZERO;

        Trade(Entry in, Entry out, TransactionKind kind, String base, BigDecimal baseAmount, String quote,
              BigDecimal quoteAmount) {
            this.in = in;
            this.out = out;
            this.kind = kind;
            this.base = base;
            this.baseAmount = baseAmount;
            this.quote = quote;
            this.quoteAmount = quoteAmount;
        }

        int firstRow() {
            return Math.min(in.row(), out.row());
        }

        Transaction toTransaction(String currency, SourceLocation location) {
            BigDecimal price = quoteAmount.divide(baseAmount, SCALE, RoundingMode.HALF_UP);
            List<String> cells = new ArrayList<>(in.cells());
            cells.addAll(out.cells());
            Map<String, String> raw = new LinkedHashMap<>();
            raw.put(OPERATION, in.operation());
            if (!in.remark().isEmpty()) {
                raw.put(REMARK, in.remark());
            }
            raw.put("Rows", in.row() + "," + out.row());
            return Transaction.builder()
                    .id(BinanceTradeCsvNormalizer.stableId(firstRow(), cells))
                    .timestamp(in.timestamp())
                    .asset(base)
                    .kind(kind)
                    .amount(baseAmount)
                    .unitPrice(quote.equals(currency) ? price : null)
                    .fee(fee)
                    .feeAsset(feeAsset)
                    .location(location)
                    .trade(new TradeDetails(quote, price, quoteAmount))
                    .rawPayload(raw)
                    .build();
        }
    }
}
