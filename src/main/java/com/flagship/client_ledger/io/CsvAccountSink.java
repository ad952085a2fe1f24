package com.flagship.client_ledger.io;

import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.flagship.client_ledger.processing.AccountSnapshot;

import java.io.IOException;
import java.io.Writer;
import java.util.Iterator;
import java.util.stream.Stream;

/**
 * Writes account snapshots as CSV with the header {@code client,available,held,total,locked}.
 * The target writer is flushed but left open. With no snapshots nothing is written, header included.
 */
public class CsvAccountSink {

    private final CsvMapper mapper;
    private final CsvSchema schema;

    public CsvAccountSink(CsvMapper mapper) {
        this.mapper = mapper;
        this.schema = mapper.schemaFor(AccountSnapshot.class).withHeader();
    }

    /**
     * Writes the header followed by one row per snapshot.
     *
     * @return number of rows written, header excluded
     */
    public int write(Stream<AccountSnapshot> snapshots, Writer target) throws IOException {
        Iterator<AccountSnapshot> iterator = snapshots.iterator();
        if (!iterator.hasNext()) {
            return 0;
        }
        int written = 0;
        try (SequenceWriter rows = mapper.writer(schema).writeValues(target)) {
            while (iterator.hasNext()) {
                rows.write(iterator.next());
                written++;
            }
            rows.flush();
        }
        target.flush();
        return written;
    }
}
