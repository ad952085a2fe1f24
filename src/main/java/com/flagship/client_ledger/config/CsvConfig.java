package com.flagship.client_ledger.config;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Jackson configuration for the CSV input and output.
 *
 * Key features:
 * - Surrounding whitespace of every field is trimmed
 * - Blank lines in the input are skipped
 * - Amounts are written in plain notation, never scientific
 * - Writers never close the stream they write to (stdout stays open)
 */
@Configuration
public class CsvConfig {

    @Bean
    public CsvMapper csvMapper() {
        return createCsvMapper();
    }

    public static CsvMapper createCsvMapper() {
        CsvMapper mapper = new CsvMapper();

        mapper.enable(CsvParser.Feature.TRIM_SPACES);
        mapper.enable(CsvParser.Feature.SKIP_EMPTY_LINES);
        mapper.enable(CsvParser.Feature.WRAP_AS_ARRAY);

        mapper.enable(JsonGenerator.Feature.WRITE_BIGDECIMAL_AS_PLAIN);
        mapper.disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);

        return mapper;
    }
}
