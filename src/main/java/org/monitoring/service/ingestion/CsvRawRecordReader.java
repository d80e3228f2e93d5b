package org.monitoring.service.ingestion;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.monitoring.exceptions.IngestException;
import org.monitoring.models.enums.IngestErrorCode;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Set;

@Component
public class CsvRawRecordReader implements RawRecordReader {

    private static final char BYTE_ORDER_MARK = '\uFEFF';

    @Override
    public boolean supports(String format) {
        return "csv".equalsIgnoreCase(format) || "tsv".equalsIgnoreCase(format);
    }

    @Override
    public RawTable open(Path path, String format) {
        String fileName = path.getFileName().toString();
        char delimiter = "tsv".equalsIgnoreCase(format) ? '\t' : ',';

        CSVFormat csvFormat = CSVFormat.DEFAULT.builder()
                .setDelimiter(delimiter)
                .setIgnoreEmptyLines(true)
                .setAllowMissingColumnNames(true)
                .build();

        Reader reader = null;
        CSVParser parser = null;
        try {
            reader = Files.newBufferedReader(path, StandardCharsets.UTF_8);
            parser = CSVParser.parse(reader, csvFormat);
            Iterator<CSVRecord> records = parser.iterator();
            if (!records.hasNext()) {
                throw new IngestException(IngestErrorCode.MALFORMED_SOURCE, "Source file has no header row: " + fileName);
            }
            List<String> headers = normalizeHeaders(records.next());
            return new RawTable(parser, records, headers);
        } catch (IOException | UncheckedIOException | IllegalStateException exception) {
            IngestException failure = new IngestException(IngestErrorCode.MALFORMED_SOURCE,
                    "Failed to read source file " + fileName + ": " + exception.getMessage(), exception);
            closeQuietly(parser, reader, failure);
            throw failure;
        } catch (IngestException exception) {
            closeQuietly(parser, reader, exception);
            throw exception;
        }
    }

    private List<String> normalizeHeaders(CSVRecord headerRecord) {
        List<String> headers = new ArrayList<>(headerRecord.size());
        Set<String> seen = new HashSet<>();
        for (int idx = 0; idx < headerRecord.size(); idx++) {
            String header = headerRecord.get(idx);
            if (idx == 0 && header != null && !header.isEmpty() && header.charAt(0) == BYTE_ORDER_MARK) {
                header = header.substring(1);
            }
            header = header == null ? "" : header.trim();
            if (!StringUtils.hasText(header)) {
                header = "column_" + (idx + 1);
            }
            String candidate = header;
            int counter = 1;
            while (seen.contains(candidate)) {
                counter++;
                candidate = header + "_" + counter;
            }
            seen.add(candidate);
            headers.add(candidate);
        }
        return headers;
    }

    private void closeQuietly(CSVParser parser, Reader reader, RuntimeException failure) {
        try {
            if (parser != null) {
                parser.close();
            } else if (reader != null) {
                reader.close();
            }
        } catch (IOException closeFailure) {
            failure.addSuppressed(closeFailure);
        }
    }
}
