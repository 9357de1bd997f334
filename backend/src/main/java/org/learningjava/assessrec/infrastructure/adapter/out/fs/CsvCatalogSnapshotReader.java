package org.learningjava.assessrec.infrastructure.adapter.out.fs;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import org.learningjava.assessrec.application.port.CatalogSnapshotPort;
import org.learningjava.assessrec.domain.model.catalog.CatalogItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Reads the crawler's catalog snapshot:
 * {@code name,url,test_type,duration_minutes,category,description,tags,text_blob}.
 * Blank cells are absent values; tags are pipe-joined.
 */
public class CsvCatalogSnapshotReader implements CatalogSnapshotPort {

    private static final Logger log = LoggerFactory.getLogger(CsvCatalogSnapshotReader.class);

    private final CsvMapper csv = new CsvMapper();

    public CsvCatalogSnapshotReader() {
        csv.enable(CsvParser.Feature.TRIM_SPACES);
        csv.enable(CsvParser.Feature.SKIP_EMPTY_LINES);
    }

    @Override
    public List<CatalogItem> read(Path snapshot) {
        if (!Files.isRegularFile(snapshot)) {
            throw new IllegalArgumentException("Catalog snapshot not found: " + snapshot);
        }

        CsvSchema schema = CsvSchema.emptySchema().withHeader();
        List<CatalogItem> out = new ArrayList<>();
        try (Reader reader = Files.newBufferedReader(snapshot, StandardCharsets.UTF_8);
             MappingIterator<Map<String, String>> it = csv.readerForMapOf(String.class).with(schema).readValues(reader)) {
            int line = 1;
            while (it.hasNext()) {
                line++;
                out.add(toItem(it.next(), line));
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read catalog snapshot " + snapshot, e);
        }

        log.info("Read {} catalog rows from {}", out.size(), snapshot);
        return out;
    }

    private CatalogItem toItem(Map<String, String> row, int line) {
        return new CatalogItem(
                blankToNull(row.get("name")),
                blankToNull(row.get("url")),
                blankToNull(row.get("test_type")),
                parseDuration(row.get("duration_minutes"), line),
                blankToNull(row.get("category")),
                blankToNull(row.get("description")),
                CatalogItem.splitTags(row.get("tags")),
                row.get("text_blob")
        );
    }

    static Integer parseDuration(String raw, int line) {
        String v = blankToNull(raw);
        if (v == null) return null;
        try {
            return (int) Double.parseDouble(v); // e.g. "30.0"
        } catch (NumberFormatException e) {
            log.debug("Line {}: non-numeric duration '{}' treated as absent", line, v);
            return null;
        }
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s.trim();
    }
}
