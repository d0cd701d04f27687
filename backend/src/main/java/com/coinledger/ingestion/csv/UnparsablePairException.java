package com.coinledger.ingestion.csv;

/**
 * Trading pair matches no known quote asset.
 */
public class UnparsablePairException extends MalformedInputException {

    public UnparsablePairException(int row, String pair) {
        super("UNPARSABLE_PAIR", "Row " + row + ": cannot split trading pair '" + pair + "' into base and quote", null);
    }
}
