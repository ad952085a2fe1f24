package com.flagship.client_ledger.cli;

import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.flagship.client_ledger.io.CsvAccountSink;
import com.flagship.client_ledger.io.CsvTransactionSource;
import com.flagship.client_ledger.processing.LedgerReplayService;
import com.flagship.client_ledger.processing.ReplayResult;
import com.flagship.client_ledger.processing.exception.TransactionProcessingException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.StringWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Command-line entry point: {@code ledger <input-file>}.
 *
 * Replays the CSV file and prints the final accounts as CSV on stdout.
 * Diagnostics go to the log (stderr). Exit status is 0 on success and 1 on
 * a usage error, an unreadable file or a fatal replay error.
 *
 * Output is buffered until the replay completes, so a failed run prints no CSV.
 */
@Component
@ConditionalOnProperty(name = "ledger.runner.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class LedgerCommandLineRunner implements ApplicationRunner, ExitCodeGenerator {

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;

    private final CsvMapper csvMapper;
    private final LedgerReplayService replayService;
    private int exitCode = EXIT_OK;

    @Override
    public void run(ApplicationArguments args) {
        List<String> files = args.getNonOptionArgs();
        if (files.size() != 1) {
            log.error("Usage: ledger <input-file>");
            exitCode = EXIT_FAILURE;
            return;
        }
        exitCode = execute(Path.of(files.get(0)),
            new OutputStreamWriter(System.out, StandardCharsets.UTF_8));
    }

    /**
     * Replays the input file and writes the accounts to the given writer.
     *
     * @return process exit status
     */
    public int execute(Path input, Writer out) {
        StringWriter buffer = new StringWriter();

        try (BufferedReader reader = Files.newBufferedReader(input, StandardCharsets.UTF_8);
             CsvTransactionSource source = new CsvTransactionSource(csvMapper, reader)) {

            ReplayResult result = replayService.process(source, input.getFileName().toString());
            new CsvAccountSink(csvMapper).write(replayService.snapshot(result.getLedger()), buffer);

        } catch (TransactionProcessingException e) {
            log.error("Failed to process transactions from {}: {}", input, e.getMessage());
            return EXIT_FAILURE;
        } catch (IOException e) {
            log.error("Failed to open the input file {}: {}", input, e.getMessage());
            return EXIT_FAILURE;
        }

        try {
            out.write(buffer.toString());
            out.flush();
        } catch (IOException e) {
            log.error("Failed to print the ledger: {}", e.getMessage(), e);
            return EXIT_FAILURE;
        }
        return EXIT_OK;
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
