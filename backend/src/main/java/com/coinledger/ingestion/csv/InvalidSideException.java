package com.coinledger.ingestion.csv;

/**
 * Side column is neither BUY nor SELL.
 */
public class InvalidSideException extends MalformedInputException {

    public InvalidSideException(int row, String side) {
        super("INVALID_SIDE", "Row " + row + ": side must be BUY or SELL, got '" + side + "'", null);
    }
}
