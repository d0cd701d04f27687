package com.coinledger.ingestion.csv;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.RuntimeJsonMappingException;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.coinledger.domain.SourceLocation;
import com.coinledger.domain.TradeDetails;
import com.coinledger.domain.Transaction;
import com.coinledger.domain.TransactionKind;
import com.coinledger.ingestion.config.CsvImportProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Normalizes a Binance export into ledger transactions. The header picks the format: the trade-history export
 * maps one row to one BUY/SELL, the account statement goes through {@link BinanceAccountStatementParser}.
 * All-or-nothing: the first bad row aborts the upload with a {@link MalformedInputException} naming the row.
 */
@Component
@Slf4j
public class BinanceTradeCsvNormalizer {

    static final String DATE = "Date(UTC)";
    static final String PAIR = "Pair";
    static final String SIDE = "Side";
    static final String PRICE = "Price";
    static final String EXECUTED = "Executed";
    static final String AMOUNT = "Amount";
    static final String FEE = "Fee";
    static final String FEE_ASSET = "Fee Asset";
    static final List<String> EXPECTED_HEADERS = List.of(DATE, PAIR, SIDE, PRICE, EXECUTED, AMOUNT, FEE, FEE_ASSET);

    private static final DateTimeFormatter EXPORT_DATE = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    private static final Pattern OFFSET_SUFFIX = Pattern.compile("(Z|[+-]\\d{2}:?\\d{2})$");
    /**
     * Number with an optional trailing asset symbol, e.g. {@code 0.0105BTC}. Commas are only accepted as
     * thousands separators in groups of three.
     */
    private static final Pattern NUMBER_WITH_SUFFIX = Pattern.compile(
            "^([-+]?(?:\\d{1,3}(?:,\\d{3})+(?:\\.\\d+)?|\\d*\\.?\\d+)(?:[eE][-+]?\\d+)?)\\s*([A-Za-z]*)$");

    private final CsvMapper csvMapper;
    private final CsvImportProperties properties;
    private final TradingPairParser pairParser;
    private final BinanceAccountStatementParser statementParser;

    public BinanceTradeCsvNormalizer(CsvImportProperties properties) {
        this.properties = properties;
        this.pairParser = new TradingPairParser(properties.getQuoteAssets());
        this.statementParser = new BinanceAccountStatementParser(properties.getFiatAssets());
        this.csvMapper = new CsvMapper();
        this.csvMapper.enable(CsvParser.Feature.WRAP_AS_ARRAY);
        this.csvMapper.enable(CsvParser.Feature.SKIP_EMPTY_LINES);
        this.csvMapper.enable(CsvParser.Feature.TRIM_SPACES);
    }

    /**
     * @param content           CSV text including the header line
     * @param reportingCurrency trades quoted in this currency carry their price as unit price
     * @return transactions in file order; empty for blank content
     */
    public List<Transaction> normalize(String content, String reportingCurrency) {
        if (content == null || content.isBlank()) {
            return List.of();
        }
        String text = content.charAt(0) == '\uFEFF' ? content.substring(1) : content;
        List<List<String>> rows = readRows(text);
        if (rows.isEmpty()) {
            return List.of();
        }
        Map<String, Integer> columns = headerIndex(rows.get(0));
        String currency = reportingCurrency.strip().toUpperCase(Locale.ROOT);
        SourceLocation location = SourceLocation.exchange(properties.getExchangeName());
        List<List<String>> data = rows.subList(1, rows.size());
        if (!columns.keySet().containsAll(EXPECTED_HEADERS)) {
            List<Transaction> transactions = statementParser.parse(data, columns, currency, location);
            log.info("Normalized {} transactions from {} account statement", transactions.size(), properties.getExchangeName());
            return transactions;
        }
        List<Transaction> transactions = new ArrayList<>();
        int rowNumber = 0;
        for (List<String> row : data) {
            if (row.stream().allMatch(c -> c == null || c.isBlank())) {
                continue;
            }
            rowNumber++;
            transactions.add(toTransaction(new Row(rowNumber, row, columns), currency, location));
        }
        log.info("Normalized {} trades from {} export", transactions.size(), properties.getExchangeName());
        return transactions;
    }

    private List<List<String>> readRows(String text) {
        try (MappingIterator<List<String>> it = csvMapper.readerForListOf(String.class).readValues(text)) {
            return it.readAll();
        } catch (IOException | RuntimeJsonMappingException e) {
            throw new MalformedInputException("CSV content could not be parsed: " + e.getMessage(), e);
        }
    }

    private static Map<String, Integer> headerIndex(List<String> header) {
        Map<String, Integer> index = new HashMap<>();
        for (int i = 0; i < header.size(); i++) {
            String name = header.get(i) == null ? "" : header.get(i).strip();
            index.putIfAbsent(name, i);
        }
        if (index.keySet().containsAll(EXPECTED_HEADERS)
                || index.keySet().containsAll(BinanceAccountStatementParser.EXPECTED_HEADERS)) {
            return index;
        }
        List<String> missing = EXPECTED_HEADERS.stream().filter(h -> !index.containsKey(h)).toList();
        throw new MalformedInputException("CSV headers do not match supported Binance export formats, trade history is missing: "
                + String.join(", ", missing));
    }

    private Transaction toTransaction(Row row, String currency, SourceLocation location) {
        Instant timestamp = parseDate(row);
        String pairText = row.required(PAIR);
        TradingPairParser.TradingPair pair = pairParser.parse(pairText)
                .orElseThrow(() -> new UnparsablePairException(row.number(), pairText));
        TransactionKind kind = parseSide(row);
        BigDecimal price = row.requiredDecimal(PRICE);
        BigDecimal executed = row.requiredDecimal(EXECUTED);
        if (executed.signum() <= 0) {
            throw new MalformedInputException("Row " + row.number() + ": Executed must be positive, got " + executed.toPlainString());
        }
        if (price.signum() < 0) {
            throw new MalformedInputException("Row " + row.number() + ": Price must not be negative");
        }
        BigDecimal amount = row.optionalDecimal(AMOUNT);
        if (amount == null) {
            amount = price.multiply(executed);
        }
        BigDecimal fee = row.optionalDecimal(FEE);
        if (fee != null && fee.signum() < 0) {
            throw new MalformedInputException("Row " + row.number() + ": Fee must not be negative");
        }
        String feeAsset = row.optional(FEE_ASSET);
        boolean quotedInReportingCurrency = pair.quote().equals(currency);

        return Transaction.builder()
                .id(stableId(row.number(), row.cells()))
                .timestamp(timestamp)
                .asset(pair.base())
                .kind(kind)
                .amount(executed)
                .unitPrice(quotedInReportingCurrency ? price : null)
                .fee(fee)
                .feeAsset(feeAsset)
                .location(location)
                .trade(new TradeDetails(pair.quote(), price, amount.abs()))
                .rawPayload(row.asMap())
                .build();
    }

    private static Instant parseDate(Row row) {
        String value = row.required(DATE);
        try {
            if (value.indexOf('T') < 0) {
                return LocalDateTime.parse(value, EXPORT_DATE).toInstant(ZoneOffset.UTC);
            }
            if (OFFSET_SUFFIX.matcher(value).find()) {
                return OffsetDateTime.parse(value).toInstant();
            }
            return LocalDateTime.parse(value).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            throw new MalformedInputException("Row " + row.number() + ": invalid " + DATE + " '" + value + "'", e);
        }
    }

    private static TransactionKind parseSide(Row row) {
        String side = row.optional(SIDE);
        String normalized = side == null ? "" : side.toUpperCase(Locale.ROOT);
        return switch (normalized) {
            case "BUY" -> TransactionKind.BUY;
            case "SELL" -> TransactionKind.SELL;
            default -> throw new InvalidSideException(row.number(), side == null ? "" : side);
        };
    }

    /**
     * Row number zero-padded so ids of same-second rows sort in file order, plus a hash of the row content.
     */
    static String stableId(int rowNumber, List<String> cells) {
        String content = String.join("\u001f", cells);
        UUID hash = UUID.nameUUIDFromBytes(content.getBytes(StandardCharsets.UTF_8));
        return String.format(Locale.ROOT, "binance-%08d-%s", rowNumber, hash);
    }

    static BigDecimal parseDecimal(String value) {
        Matcher m = NUMBER_WITH_SUFFIX.matcher(value.strip());
        if (!m.matches()) {
            throw new NumberFormatException(value);
        }
        return new BigDecimal(m.group(1).replace(",", ""));
    }

    private record Row(int number, List<String> cells, Map<String, Integer> columns) {

        String optional(String column) {
            int i = columns.get(column);
            if (i >= cells.size() || cells.get(i) == null) {
                return null;
            }
            String v = cells.get(i).strip();
            return v.isEmpty() ? null : v;
        }

        String required(String column) {
            String v = optional(column);
            if (v == null) {
                throw new MalformedInputException("Row " + number + ": " + column + " is required");
            }
            return v;
        }

        BigDecimal requiredDecimal(String column) {
            return decimal(column, required(column));
        }

        BigDecimal optionalDecimal(String column) {
            String v = optional(column);
            return v == null ? null : decimal(column, v);
        }

        private BigDecimal decimal(String column, String v) {
            try {
                return parseDecimal(v);
            } catch (NumberFormatException e) {
                throw new MalformedInputException("Row " + number + ": " + column + " is not a number: '" + v + "'", e);
            }
        }

        Map<String, String> asMap() {
            Map<String, String> map = new LinkedHashMap<>();
            for (String header : EXPECTED_HEADERS) {
                String v = optional(header);
                if (v != null) {
                    map.put(header, v);
                }
            }
            return map;
        }
    }
}
