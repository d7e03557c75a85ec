package com.di.userflow.staging;

import com.di.userflow.model.CanonicalRecord;
import com.univocity.parsers.csv.CsvParser;
import com.univocity.parsers.csv.CsvParserSettings;
import com.univocity.parsers.csv.CsvWriter;
import com.univocity.parsers.csv.CsvWriterSettings;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

/**
 * Delimited-row encoding shared by the staging writer and the loader.
 *
 * <pre>
 * username,first_name,last_name,country,password
 * jdoe,Jane,Doe,US,x
 * </pre>
 *
 * Exactly one header line and one data row. Values containing the delimiter, quotes or
 * line breaks are quoted, so any field content round-trips.
 */
@Component
@Slf4j
public class StagingRowCodec {

    public static final List<String> HEADER =
            List.of("username", "first_name", "last_name", "country", "password");

    public void write(CanonicalRecord record, Path target) throws IOException {
        try (Writer out = Files.newBufferedWriter(target, StandardCharsets.UTF_8)) {
            CsvWriter writer = new CsvWriter(out, writerSettings());
            writer.writeHeaders(HEADER);
            writer.writeRow(
                    record.username(),
                    record.firstName(),
                    record.lastName(),
                    record.country(),
                    record.password());
            writer.close();
        }
    }

    /**
     * Reads the single row of a staging file.
     *
     * @throws IOException              when the file cannot be read
     * @throws IllegalArgumentException when the header or row count is wrong, or a field is blank
     */
    public CanonicalRecord read(Path source) throws IOException {
        List<String[]> rows;
        try (Reader in = Files.newBufferedReader(source, StandardCharsets.UTF_8)) {
            CsvParser parser = new CsvParser(parserSettings());
            rows = parser.parseAll(in);
        }

        if (rows.isEmpty()) {
            throw new IllegalArgumentException("Staging file " + source + " is empty");
        }
        List<String> header = Arrays.asList(rows.get(0));
        if (!HEADER.equals(header)) {
            throw new IllegalArgumentException("Unexpected staging header " + header + " in " + source);
        }
        if (rows.size() != 2) {
            throw new IllegalArgumentException(
                    "Staging file " + source + " holds " + (rows.size() - 1) + " data rows, expected 1");
        }
        String[] row = rows.get(1);
        if (row.length != HEADER.size()) {
            throw new IllegalArgumentException(
                    "Staging row has " + row.length + " columns, expected " + HEADER.size());
        }
        return new CanonicalRecord(row[1], row[2], row[3], row[0], row[4]);
    }

    private static CsvWriterSettings writerSettings() {
        CsvWriterSettings settings = new CsvWriterSettings();
        settings.getFormat().setLineSeparator("\n");
        settings.setQuoteEscapingEnabled(true);
        settings.setIgnoreLeadingWhitespaces(false);
        settings.setIgnoreTrailingWhitespaces(false);
        return settings;
    }

    private static CsvParserSettings parserSettings() {
        CsvParserSettings settings = new CsvParserSettings();
        settings.getFormat().setLineSeparator("\n");
        settings.setHeaderExtractionEnabled(false);
        settings.setSkipEmptyLines(true);
        settings.setIgnoreLeadingWhitespaces(false);
        settings.setIgnoreTrailingWhitespaces(false);
        settings.setNullValue("");
        settings.setEmptyValue("");
        settings.setMaxCharsPerColumn(64 * 1024);
        return settings;
    }
}
