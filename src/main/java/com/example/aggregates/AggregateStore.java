package com.example.aggregates;

import com.opencsv.CSVParser;
import com.opencsv.CSVParserBuilder;
import com.opencsv.CSVReader;
import com.opencsv.CSVReaderBuilder;
import com.opencsv.CSVWriter;
import com.opencsv.ICSVParser;
import com.opencsv.ICSVWriter;
import com.opencsv.exceptions.CsvValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Reads and writes protected aggregate files: a header line, then one
 * {@code comboString<TAB>count} line per reported combo.
 */
public class AggregateStore {

    private static final Logger LOG = LoggerFactory.getLogger(AggregateStore.class);

    public static final char FIELD_SEPARATOR = '\t';
    public static final String DEFAULT_HEADER = "selections\tprotected_count";

    public static int write(Path path, CountTable protectedTable) throws IOException {
        return write(path, protectedTable, DEFAULT_HEADER);
    }

    /**
     * Writes every combo of {@code protectedTable} with a nonzero count, lengths ascending.
     *
     * @param header the first line of the file, written verbatim
     * @return the number of combo lines written
     */
    public static int write(Path path, CountTable protectedTable, String header) throws IOException {
        int written = 0;
        try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8);
             ICSVWriter csvWriter = new CSVWriter(writer, FIELD_SEPARATOR, ICSVWriter.NO_QUOTE_CHARACTER,
                     ICSVWriter.NO_ESCAPE_CHARACTER, "\n")) {
            writer.write(header);
            writer.write("\n");
            for (int length : protectedTable.getLengths()) {
                for (Map.Entry<Combo, Integer> entry : protectedTable.getCounts(length).entrySet()) {
                    if (entry.getValue() == 0) {
                        continue;
                    }
                    csvWriter.writeNext(new String[]{AggregateCodec.encode(entry.getKey()),
                            String.valueOf(entry.getValue())}, false);
                    written++;
                }
            }
            csvWriter.flush();
            if (csvWriter.checkError()) {
                throw new IOException("Failed writing aggregates to " + path);
            }
        }
        LOG.info("Wrote {} protected aggregates to {}", written, path);
        return written;
    }

    /**
     * Loads a previously written aggregate file. The header is skipped, as are lines with
     * an empty combo string. Lines with fewer than two fields or a non-numeric count are
     * skipped with a warning.
     *
     * @throws IOException if the file cannot be read
     */
    public static CountTable load(Path path) throws IOException {
        CSVParser parser = new CSVParserBuilder()
                .withSeparator(FIELD_SEPARATOR)
                .withQuoteChar(ICSVParser.NULL_CHARACTER)
                .withEscapeChar(ICSVParser.NULL_CHARACTER)
                .build();

        CountTable table = new CountTable();
        int skipped = 0;
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8);
             CSVReader csvReader = new CSVReaderBuilder(reader)
                     .withCSVParser(parser)
                     .withSkipLines(1)
                     .build()) {
            String[] fields;
            while ((fields = csvReader.readNext()) != null) {
                String comboString = fields[0].trim();
                if (comboString.isEmpty()) {
                    continue;
                }
                if (fields.length < 2) {
                    LOG.warn("Skipping line {} of {}: no count for '{}'", csvReader.getLinesRead(), path, comboString);
                    skipped++;
                    continue;
                }
                int count;
                try {
                    count = Integer.parseInt(fields[1].trim());
                } catch (NumberFormatException e) {
                    LOG.warn("Skipping line {} of {}: count '{}' is not an integer", csvReader.getLinesRead(), path, fields[1]);
                    skipped++;
                    continue;
                }
                if (count < 0) {
                    LOG.warn("Skipping line {} of {}: negative count {}", csvReader.getLinesRead(), path, count);
                    skipped++;
                    continue;
                }
                DecodedCombo decoded = AggregateCodec.decode(comboString);
                if (decoded.isLossy()) {
                    LOG.warn("Line {} of {}: combo '{}' declares {} pairs but only {} are well formed",
                            csvReader.getLinesRead(), path, comboString, decoded.getLength(), decoded.getCombo().length());
                }
                table.put(decoded.getLength(), decoded.getCombo(), count);
            }
        } catch (CsvValidationException e) {
            throw new IOException("Invalid aggregate data in " + path + ": " + e.getMessage(), e);
        }
        LOG.info("Loaded {} protected aggregates from {} ({} malformed lines skipped)", table.size(), path, skipped);
        return table;
    }
}
