package org.learningjava.assessrec.infrastructure.adapter.out.fs;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import org.learningjava.assessrec.application.port.LabeledQueryPort;
import org.learningjava.assessrec.domain.model.evaluation.LabeledQuery;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Labeled set as {@code Query,Assessment_url} rows; rows sharing a query are grouped.
 */
public class CsvLabeledQueryReader implements LabeledQueryPort {

    private static final Logger log = LoggerFactory.getLogger(CsvLabeledQueryReader.class);

    private final CsvMapper csv = new CsvMapper();

    @Override
    public List<LabeledQuery> read(Path labeledSet) {
        if (!Files.isRegularFile(labeledSet)) {
            throw new IllegalArgumentException("Labeled set not found: " + labeledSet);
        }

        Map<String, Set<String>> byQuery = new LinkedHashMap<>();
        try (Reader reader = Files.newBufferedReader(labeledSet, StandardCharsets.UTF_8);
             MappingIterator<Map<String, String>> it = csv.readerForMapOf(String.class)
                     .with(CsvSchema.emptySchema().withHeader())
                     .readValues(reader)) {
            while (it.hasNext()) {
                Map<String, String> row = it.next();
                String query = trim(row.get("Query"));
                String url = trim(row.get("Assessment_url"));
                if (query.isEmpty()) continue;
                Set<String> urls = byQuery.computeIfAbsent(query, q -> new LinkedHashSet<>());
                if (!url.isEmpty()) urls.add(url);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read labeled set " + labeledSet, e);
        }

        List<LabeledQuery> out = new ArrayList<>(byQuery.size());
        byQuery.forEach((q, urls) -> out.add(new LabeledQuery(q, urls)));
        log.info("Found {} unique queries in {}", out.size(), labeledSet);
        return out;
    }

    private static String trim(String s) {
        return s == null ? "" : s.trim();
    }
}
