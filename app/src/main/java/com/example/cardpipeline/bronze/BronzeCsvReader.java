package com.example.cardpipeline.bronze;

import com.example.cardpipeline.config.PipelineProperties;
import com.example.cardpipeline.exception.SchemaException;
import com.example.cardpipeline.model.BronzeRecord;
import com.example.cardpipeline.model.BronzeTable;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.apache.commons.csv.DuplicateHeaderMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Lands a raw transactions CSV as a Bronze table. Source headers are renamed to logical column names; values are
 * kept as text.
 */
@Component
public class BronzeCsvReader {

    private static final Logger log = LoggerFactory.getLogger(BronzeCsvReader.class);

    private static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder()
            .setHeader()
            .setSkipHeaderRecord(true)
            .setTrim(true)
            .setIgnoreEmptyLines(true)
            .setAllowMissingColumnNames(true)
            .setDuplicateHeaderMode(DuplicateHeaderMode.ALLOW_ALL)
            .build();

    private final PipelineProperties properties;
    private final Clock clock;

    public BronzeCsvReader(PipelineProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * @param source the raw CSV file
     * @return the Bronze table, one record per data line
     * @throws IOException if the file cannot be read or is not valid CSV
     * @throws SchemaException if two headers resolve to the same logical column
     */
    public BronzeTable read(Path source) throws IOException {
        log.info("[BRONZE] Starting ingestion from {}", source);
        Instant ingestedAt = clock.instant();
        Map<String, String> renames = properties.getColumns().sourceToLogical();

        try (Reader reader = Files.newBufferedReader(source, StandardCharsets.UTF_8);
             CSVParser csvParser = new CSVParser(reader, FORMAT)) {

            // unnamed columns (such as a leading index column) are dropped
            List<String> headerNames = csvParser.getHeaderNames();
            List<Integer> sourceIndexes = new ArrayList<>();
            List<String> columns = new ArrayList<>();
            for (int i = 0; i < headerNames.size(); i++) {
                String header = headerNames.get(i);
                if (header != null && !header.isBlank()) {
                    sourceIndexes.add(i);
                    columns.add(renames.getOrDefault(header, header));
                }
            }
            requireDistinctColumns(source, columns);

            List<BronzeRecord> records = new ArrayList<>();
            for (CSVRecord csvRecord : csvParser) {
                Map<String, String> values = new LinkedHashMap<>();
                for (int i = 0; i < columns.size(); i++) {
                    int index = sourceIndexes.get(i);
                    values.put(columns.get(i), index < csvRecord.size() ? csvRecord.get(index) : null);
                }
                records.add(new BronzeRecord(csvRecord.getRecordNumber(), values));
            }

            BronzeTable table = new BronzeTable(columns, records, source.getFileName().toString(),
                    properties.getSourceSystem(), ingestedAt);
            log.info("[BRONZE] Ingestion complete: {} rows, {} columns", table.size(), columns.size());
            return table;
        } catch (UncheckedIOException e) {
            log.error("[BRONZE] Malformed CSV in {}: {}", source, e.getMessage(), e);
            throw e.getCause();
        } catch (IOException e) {
            log.error("[BRONZE] IO error reading {}: {}", source, e.getMessage(), e);
            throw e;
        }
    }

    private static void requireDistinctColumns(Path source, List<String> columns) {
        Set<String> seen = new HashSet<>();
        Set<String> duplicates = new TreeSet<>();
        for (String column : columns) {
            if (!seen.add(column)) {
                duplicates.add(column);
            }
        }
        if (!duplicates.isEmpty()) {
            log.error("[BRONZE] {} has more than one header for columns {}", source, duplicates);
            throw SchemaException.duplicateColumns(source.getFileName().toString(), List.copyOf(duplicates));
        }
    }
}
