package com.flagship.client_ledger.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.flagship.client_ledger.ledger.TransactionRecord;
import com.flagship.client_ledger.ledger.TransactionType;
import com.flagship.client_ledger.processing.exception.ErrorCode;
import com.flagship.client_ledger.processing.exception.TransactionProcessingException;

import java.io.Closeable;
import java.io.IOException;
import java.io.Reader;
import java.math.BigDecimal;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Locale;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * Lazy record source over CSV input with the header {@code type, client, tx, amount}.
 * Input with no header row yields no records.
 *
 * Rows are parsed one at a time as the iterator advances. Dispute, resolve and
 * chargeback rows may omit the amount column or leave it empty.
 *
 * Parse failures are thrown from {@link #hasNext()} or {@link #next()} as
 * {@link TransactionProcessingException}, so records before the bad row are
 * still delivered.
 */
public class CsvTransactionSource implements Iterator<TransactionRecord>, Closeable {

    static final String TYPE_COLUMN = "type";
    static final String CLIENT_COLUMN = "client";
    static final String TX_COLUMN = "tx";
    static final String AMOUNT_COLUMN = "amount";

    static final int MAX_AMOUNT_INTEGER_DIGITS = 20;
    static final int MAX_AMOUNT_SCALE = 100;

    private final MappingIterator<String[]> rows;
    private final Map<String, Integer> columns;
    private long rowNumber;

    /**
     * Reads the header row; input without one is an empty source.
     */
    public CsvTransactionSource(CsvMapper mapper, Reader input) {
        try {
            this.rows = mapper.readerFor(String[].class).readValues(input);
        } catch (IOException e) {
            throw readFailure(e);
        }
        this.columns = readHeader();
    }

    @Override
    public boolean hasNext() {
        if (columns == null) {
            return false;
        }
        try {
            return rows.hasNextValue();
        } catch (IOException e) {
            throw readFailure(e);
        }
    }

    @Override
    public TransactionRecord next() {
        if (!hasNext()) {
            throw new NoSuchElementException("No more transaction rows");
        }
        String[] row;
        try {
            row = rows.nextValue();
        } catch (IOException e) {
            throw readFailure(e);
        }
        rowNumber++;
        return toRecord(row);
    }

    @Override
    public void close() throws IOException {
        rows.close();
    }

    private Map<String, Integer> readHeader() {
        String[] header;
        try {
            if (!rows.hasNextValue()) {
                return null;
            }
            header = rows.nextValue();
        } catch (IOException e) {
            throw readFailure(e);
        }

        Map<String, Integer> indexes = new HashMap<>();
        for (int i = 0; i < header.length; i++) {
            indexes.putIfAbsent(header[i].trim().toLowerCase(Locale.ROOT), i);
        }
        for (String required : new String[] {TYPE_COLUMN, CLIENT_COLUMN, TX_COLUMN}) {
            if (!indexes.containsKey(required)) {
                throw new TransactionProcessingException(ErrorCode.MALFORMED_RECORD,
                    String.format("Header is missing the \"%s\" column", required));
            }
        }
        return indexes;
    }

    private TransactionRecord toRecord(String[] row) {
        String typeCode = field(row, TYPE_COLUMN);
        if (typeCode == null) {
            throw malformed("Missing \"type\" value", null);
        }
        TransactionType type = TransactionType.fromCode(typeCode);
        int clientId = (int) parseId(row, CLIENT_COLUMN, TransactionRecord.MAX_CLIENT_ID);
        long transactionId = parseId(row, TX_COLUMN, TransactionRecord.MAX_TRANSACTION_ID);
        BigDecimal amount = parseAmount(row);

        try {
            return new TransactionRecord(type, clientId, transactionId, amount);
        } catch (IllegalArgumentException e) {
            throw malformed(e.getMessage(), e);
        }
    }

    private long parseId(String[] row, String column, long max) {
        String value = field(row, column);
        if (value == null) {
            throw malformed(String.format("Missing \"%s\" value", column), null);
        }
        try {
            long id = Long.parseLong(value);
            if (id < 0 || id > max) {
                throw malformed(String.format("\"%s\" value %d is out of range", column, id), null);
            }
            return id;
        } catch (NumberFormatException e) {
            throw malformed(String.format("\"%s\" value \"%s\" is not a number", column, value), e);
        }
    }

    private BigDecimal parseAmount(String[] row) {
        String value = field(row, AMOUNT_COLUMN);
        if (value == null) {
            return null;
        }
        BigDecimal amount;
        try {
            amount = new BigDecimal(value);
        } catch (NumberFormatException e) {
            throw malformed(String.format("Amount \"%s\" is not a decimal number", value), e);
        }
        // Bounded so that rounding to ledger precision stays cheap and cannot overflow
        if (amount.precision() - amount.scale() > MAX_AMOUNT_INTEGER_DIGITS
                || amount.scale() > MAX_AMOUNT_SCALE) {
            throw malformed(String.format("Amount \"%s\" is out of range", value), null);
        }
        return amount;
    }

    /**
     * Trimmed value of the column, or null when the row is too short or the value is empty.
     */
    private String field(String[] row, String column) {
        Integer index = columns.get(column);
        if (index == null || index >= row.length || row[index] == null) {
            return null;
        }
        String value = row[index].trim();
        return value.isEmpty() ? null : value;
    }

    private TransactionProcessingException malformed(String message, Throwable cause) {
        return new TransactionProcessingException(ErrorCode.MALFORMED_RECORD,
            String.format("Row %d: %s", rowNumber, message), cause);
    }

    private TransactionProcessingException readFailure(IOException e) {
        if (e instanceof JsonProcessingException) {
            String reason = ((JsonProcessingException) e).getOriginalMessage();
            return new TransactionProcessingException(ErrorCode.MALFORMED_RECORD,
                String.format("Row %d: unparsable CSV: %s", rowNumber + 1, reason), e);
        }
        return new TransactionProcessingException(ErrorCode.READ_FAILURE,
            "Failed to read transactions: " + e.getMessage(), e);
    }
}
