package com.polereduction.runner;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.polereduction.core.exceptions.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Writes a {@link ProfileTable} as comma-separated text, header first.
 *
 * @since 1.0.0
 */
public class ProfileCsvWriter {

    private static final Logger LOG = LoggerFactory.getLogger(ProfileCsvWriter.class);

    private final CsvMapper mapper;

    public ProfileCsvWriter() {
        this.mapper = new CsvMapper();
        // callers own the target writer
        mapper.getFactory().disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
    }

    /**
     * Write {@code table} with {@code result} in column {@code resultColumn},
     * replacing that column if the table already has it.
     *
     * @param path         destination file; parent directories are created
     * @param table        the source table
     * @param resultColumn name of the result column
     * @param result       one value per row
     * @throws IllegalStateException if writing fails
     * @throws ValidationException   if {@code result} does not match the row count
     */
    public void write(Path path, ProfileTable table, String resultColumn, double[] result) {
        write(path, table.withColumn(resultColumn, result));
    }

    /**
     * @param path  destination file; parent directories are created
     * @param table the table to write
     * @throws IllegalStateException if writing fails
     */
    public void write(Path path, ProfileTable table) {
        Objects.requireNonNull(path, "CSV path must not be null");
        Objects.requireNonNull(table, "Table must not be null");
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
                writeTo(writer, table);
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write CSV file: " + path, e);
        }
        LOG.info("Wrote {} to {}", table, path);
    }

    /**
     * @param out   target stream; flushed, not closed
     * @param table the table to write
     * @throws IllegalStateException if writing fails
     */
    public void write(OutputStream out, ProfileTable table) {
        Objects.requireNonNull(out, "CSV stream must not be null");
        Objects.requireNonNull(table, "Table must not be null");
        try {
            Writer writer = new OutputStreamWriter(out, StandardCharsets.UTF_8);
            writeTo(writer, table);
            writer.flush();
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write CSV stream", e);
        }
    }

    private void writeTo(Writer writer, ProfileTable table) throws IOException {
        SequenceWriter rows = mapper.writerFor(String[].class).writeValues(writer);
        rows.write(table.getHeaders().toArray(new String[0]));
        for (List<String> row : table.getRows()) {
            rows.write(row.toArray(new String[0]));
        }
        rows.flush();
    }
}
