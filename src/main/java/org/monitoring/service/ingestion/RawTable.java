package org.monitoring.service.ingestion;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.monitoring.exceptions.IngestException;
import org.monitoring.models.enums.IngestErrorCode;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * An open, forward-only view over a stored dataset file. Must be closed by the caller.
 */
@Slf4j
public class RawTable implements Iterable<RawRow>, AutoCloseable {

    private final CSVParser parser;
    private final Iterator<CSVRecord> records;
    private final List<String> headers;
    private boolean iterated;

    RawTable(CSVParser parser, Iterator<CSVRecord> records, List<String> headers) {
        this.parser = parser;
        this.records = records;
        this.headers = Collections.unmodifiableList(headers);
    }

    public List<String> headers() {
        return headers;
    }

    @Override
    public Iterator<RawRow> iterator() {
        if (iterated) {
            throw new IllegalStateException("Raw table can only be iterated once");
        }
        iterated = true;
        return new Iterator<>() {
            private long rowNumber;

            @Override
            public boolean hasNext() {
                try {
                    return records.hasNext();
                } catch (UncheckedIOException | IllegalStateException e) {
                    throw malformed(rowNumber + 1, e);
                }
            }

            @Override
            public RawRow next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                CSVRecord record;
                try {
                    record = records.next();
                } catch (UncheckedIOException | IllegalStateException e) {
                    throw malformed(rowNumber + 1, e);
                }
                rowNumber++;
                return toRow(rowNumber, record);
            }
        };
    }

    private RawRow toRow(long rowNumber, CSVRecord record) {
        if (record.size() > headers.size()) {
            log.debug("[ingest] Row {} has {} cells for {} headers, extra cells ignored", rowNumber, record.size(), headers.size());
        }
        Map<String, String> values = new LinkedHashMap<>();
        for (int idx = 0; idx < headers.size(); idx++) {
            String cell = idx < record.size() ? record.get(idx) : null;
            if (cell != null) {
                cell = cell.trim();
                if (cell.isEmpty()) {
                    cell = null;
                }
            }
            values.put(headers.get(idx), cell);
        }
        return new RawRow(rowNumber, values);
    }

    private IngestException malformed(long rowNumber, RuntimeException cause) {
        return new IngestException(IngestErrorCode.MALFORMED_SOURCE,
                "Malformed source near data row " + rowNumber + ": " + cause.getMessage(), cause);
    }

    @Override
    public void close() {
        try {
            parser.close();
        } catch (IOException e) {
            log.warn("[ingest] Failed to close raw table: {}", e.getMessage());
        }
    }
}
