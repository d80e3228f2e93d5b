package org.monitoring.service.ingestion;

import java.nio.file.Path;

public interface RawRecordReader {

    boolean supports(String format);

    /**
     * Opens the file lazily. Only the header record is read before returning.
     *
     * @throws org.monitoring.exceptions.IngestException with {@code MALFORMED_SOURCE} when no header can be read
     */
    RawTable open(Path path, String format);
}
