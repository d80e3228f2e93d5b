package org.monitoring.service.ingestion;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.monitoring.exceptions.IngestException;
import org.monitoring.models.entity.Dataset;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Entry point to stored dataset files: upload, header detection, sampling and lazy row access.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RawRecordStore {

    private final FileStorageService fileStorageService;
    private final List<RawRecordReader> readers;

    public StoredDataset store(MultipartFile file) {
        FileStorageService.StoredFileMetadata metadata;
        try {
            metadata = fileStorageService.storeDatasetFile(file);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to store dataset file: " + e.getMessage(), e);
        }
        RawRecordReader reader = readerFor(metadata.format());

        List<String> headers;
        long rowCount = 0;
        try (RawTable table = reader.open(fileStorageService.resolve(metadata.handle()), metadata.format())) {
            headers = new ArrayList<>(table.headers());
            try {
                for (RawRow ignored : table) {
                    rowCount++;
                }
            } catch (IngestException e) {
                log.warn("[upload] {} is malformed after {} rows: {}", metadata.originalFilename(), rowCount, e.getMessage());
            }
        } catch (IngestException e) {
            throw new IllegalArgumentException("Uploaded file has no readable header row: " + e.getMessage(), e);
        }
        return new StoredDataset(metadata, headers, rowCount);
    }

    public RawTable open(Dataset dataset) {
        return readerFor(dataset.getFormat()).open(fileStorageService.resolve(dataset.getStorageHandle()), dataset.getFormat());
    }

    public List<String> readHeaders(Dataset dataset) {
        try (RawTable table = open(dataset)) {
            return new ArrayList<>(table.headers());
        }
    }

    /**
     * Reads at most {@code limit} data rows. Never reads further into the file.
     */
    public List<Map<String, String>> sample(Dataset dataset, int limit) {
        List<Map<String, String>> rows = new ArrayList<>();
        if (limit <= 0) {
            return rows;
        }
        try (RawTable table = open(dataset)) {
            for (RawRow row : table) {
                rows.add(row.values());
                if (rows.size() >= limit) {
                    break;
                }
            }
        }
        return rows;
    }

    private RawRecordReader readerFor(String format) {
        return readers.stream()
                .filter(reader -> reader.supports(format))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unsupported dataset format: " + format));
    }

    public record StoredDataset(FileStorageService.StoredFileMetadata file, List<String> headers, long rowCount) {
    }
}
