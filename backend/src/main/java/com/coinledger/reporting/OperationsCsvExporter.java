package com.coinledger.reporting;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.coinledger.domain.OperationView;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * Operations table as CSV: {@code date,asset,type,amount,price,fee,total} with plain decimal strings.
 */
@Component
public class OperationsCsvExporter {

    private final CsvMapper csvMapper = new CsvMapper();
    private final CsvSchema schema = csvMapper.schemaFor(Row.class).withHeader();

    public String write(List<OperationView> operations) {
        List<Row> rows = operations.stream().map(Row::of).toList();
        try {
            return csvMapper.writer(schema).writeValueAsString(rows);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not write operations CSV", e);
        }
    }

    /**
     * Parses an export back into rows; ids and sources are not part of the export and come back null.
     */
    public List<OperationView> read(String csv) {
        try (MappingIterator<Row> it = csvMapper.readerFor(Row.class).with(schema).readValues(csv)) {
            return it.readAll().stream().map(Row::toView).toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read operations CSV", e);
        }
    }

    @JsonPropertyOrder({"date", "asset", "type", "amount", "price", "fee", "total"})
    record Row(String date, String asset, String type, String amount, String price, String fee, String total) {

        static Row of(OperationView op) {
            return new Row(op.date().toString(), op.asset(), op.type(), plain(op.amount()), plain(op.price()),
                    plain(op.fee()), plain(op.total()));
        }

        OperationView toView() {
            return new OperationView(null, Instant.parse(date), asset, type, new BigDecimal(amount),
                    new BigDecimal(price), new BigDecimal(fee), new BigDecimal(total), null);
        }

        private static String plain(BigDecimal value) {
            return value == null ? "0" : value.stripTrailingZeros().toPlainString();
        }
    }
}
