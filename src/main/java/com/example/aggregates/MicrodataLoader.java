package com.example.aggregates;

import com.opencsv.CSVParser;
import com.opencsv.CSVParserBuilder;
import com.opencsv.CSVReader;
import com.opencsv.CSVReaderBuilder;
import com.opencsv.ICSVParser;
import com.opencsv.exceptions.CsvValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Loads delimited microdata files into a {@link SimpleDataFrame} and cleans cell values
 * so they can be safely encoded as combos.
 */
public class MicrodataLoader {

    private static final Logger LOG = LoggerFactory.getLogger(MicrodataLoader.class);

    private static final Pattern TRAILING_ZERO_DECIMAL = Pattern.compile("\\.0$");

    /** Cell texts read as missing values, matched exactly. */
    public static final Set<String> MISSING_VALUE_TOKENS = Set.of(
            "#N/A", "#N/A N/A", "#NA", "-1.#IND", "-1.#QNAN", "-NaN", "-nan", "1.#IND", "1.#QNAN",
            "<NA>", "N/A", "NA", "NULL", "NaN", "None", "n/a", "nan", "null");

    /**
     * Reads a delimited file with a header row.
     *
     * @param path        the microdata file
     * @param delimiter   the column delimiter, e.g. {@code '\t'} or {@code ','}
     * @param recordLimit how many rows to keep; {@code -1} (or any value below 1) keeps all rows
     * @param useColumns  which columns to keep, in order; empty or null keeps all columns
     * @return the cleaned data frame
     * @throws IOException if the file cannot be read, is not valid delimited text, or has no header
     */
    public static SimpleDataFrame load(Path path, char delimiter, int recordLimit, List<String> useColumns)
            throws IOException {
        CSVParser parser = new CSVParserBuilder()
                .withSeparator(delimiter)
                .withEscapeChar(ICSVParser.NULL_CHARACTER)
                .build();

        SimpleDataFrame raw;
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8);
             CSVReader csvReader = new CSVReaderBuilder(reader).withCSVParser(parser).build()) {

            String[] headers = csvReader.readNext();
            if (headers == null) {
                throw new IOException("Microdata file is empty: " + path);
            }
            raw = new SimpleDataFrame(Arrays.asList(headers));

            String[] row;
            while ((row = csvReader.readNext()) != null) {
                if (row.length == 1 && row[0].isEmpty()) {
                    continue; // blank line
                }
                if (row.length > headers.length) {
                    LOG.warn("Row {} of {} has {} fields but the header has {}; extra fields dropped",
                            csvReader.getLinesRead(), path, row.length, headers.length);
                }
                List<String> values = new ArrayList<>(headers.length);
                for (int i = 0; i < headers.length; i++) {
                    values.add(i < row.length ? row[i] : "");
                }
                raw.addRow(values);
            }
        } catch (CsvValidationException e) {
            throw new IOException("Invalid delimited data in " + path + ": " + e.getMessage(), e);
        }

        LOG.info("Loaded {} rows x {} columns from {}", raw.getRowCount(), raw.getColumnCount(), path);
        return prepare(raw, recordLimit, useColumns);
    }

    /**
     * Cleans every cell of {@code df} and applies the column projection and row limit.
     *
     * @throws IllegalArgumentException if {@code useColumns} names an unknown column
     */
    public static SimpleDataFrame prepare(SimpleDataFrame df, int recordLimit, List<String> useColumns) {
        SimpleDataFrame selected = (useColumns == null || useColumns.isEmpty()) ? df : df.subset(useColumns);
        if (recordLimit > 0 && recordLimit < selected.getRowCount()) {
            selected = selected.head(recordLimit);
        }

        SimpleDataFrame cleaned = new SimpleDataFrame(selected.getColumnHeaders());
        for (int i = 0; i < selected.getRowCount(); i++) {
            List<String> values = new ArrayList<>(selected.getColumnCount());
            for (String value : selected.getRow(i).values()) {
                values.add(cleanValue(value));
            }
            cleaned.addRow(values);
        }
        return cleaned;
    }

    /**
     * Normalizes one raw cell: missing values ({@code null}, any casing of {@code nan}, or one
     * of {@link #MISSING_VALUE_TOKENS}) become empty, a trailing {@code .0}
     * is dropped, and the reserved combo delimiters are remapped ({@code ;} to {@code .,}
     * and {@code :} to {@code ..}).
     */
    public static String cleanValue(String value) {
        if (value == null || value.equalsIgnoreCase("nan") || MISSING_VALUE_TOKENS.contains(value)) {
            return "";
        }
        String cleaned = TRAILING_ZERO_DECIMAL.matcher(value).replaceFirst("");
        cleaned = cleaned.replace(AggregateCodec.COMBO_SEPARATOR, ".,");
        return cleaned.replace(AggregateCodec.PAIR_SEPARATOR, "..");
    }
}
