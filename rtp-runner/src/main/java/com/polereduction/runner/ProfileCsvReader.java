package com.polereduction.runner;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.polereduction.core.exceptions.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Reads a header-first comma-separated file into a {@link ProfileTable}.
 *
 * <p>
 * Blank lines are skipped and cells are trimmed. The first record supplies
 * the column names, minus any leading byte-order mark.
 * </p>
 *
 * @since 1.0.0
 */
public class ProfileCsvReader {

    private static final Logger LOG = LoggerFactory.getLogger(ProfileCsvReader.class);

    private static final String BYTE_ORDER_MARK = "\uFEFF";

    private final CsvMapper mapper;

    public ProfileCsvReader() {
        this.mapper = new CsvMapper();
        mapper.enable(CsvParser.Feature.WRAP_AS_ARRAY);
        mapper.enable(CsvParser.Feature.SKIP_EMPTY_LINES);
        mapper.enable(CsvParser.Feature.TRIM_SPACES);
        // callers own the source
        mapper.getFactory().disable(JsonParser.Feature.AUTO_CLOSE_SOURCE);
    }

    /**
     * @param path CSV file; must not be {@code null}
     * @return the parsed table
     * @throws IllegalArgumentException if the file does not exist
     * @throws IllegalStateException    if reading fails
     * @throws ValidationException      if the file has no header or ragged rows
     */
    public ProfileTable read(Path path) {
        Objects.requireNonNull(path, "CSV path must not be null");
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            ProfileTable table = parse(reader);
            LOG.info("Read {} from {}", table, path);
            return table;
        } catch (NoSuchFileException | FileNotFoundException e) {
            throw new IllegalArgumentException("CSV file not found: " + path, e);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read CSV file: " + path, e);
        }
    }

    /**
     * @param in CSV content in UTF-8; not closed by this method
     * @return the parsed table
     * @throws IllegalStateException if reading fails
     * @throws ValidationException   if the content has no header or ragged rows
     */
    public ProfileTable read(InputStream in) {
        Objects.requireNonNull(in, "CSV stream must not be null");
        try {
            return parse(new InputStreamReader(in, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read CSV stream", e);
        }
    }

    private ProfileTable parse(Reader reader) throws IOException {
        List<String[]> records;
        try (MappingIterator<String[]> it = mapper.readerFor(String[].class).readValues(reader)) {
            records = it.readAll();
        }
        if (records.isEmpty()) {
            throw new ValidationException("CSV content has no header row");
        }

        String[] headerRecord = records.get(0);
        if (headerRecord.length > 0 && headerRecord[0].startsWith(BYTE_ORDER_MARK)) {
            headerRecord[0] = headerRecord[0].substring(1).trim();
        }
        List<String> headers = Arrays.asList(headerRecord);
        List<List<String>> rows = new ArrayList<>(records.size() - 1);
        for (int i = 1; i < records.size(); i++) {
            rows.add(Arrays.asList(records.get(i)));
        }
        return new ProfileTable(headers, rows);
    }
}
