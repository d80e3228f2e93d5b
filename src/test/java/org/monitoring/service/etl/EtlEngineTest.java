package org.monitoring.service.etl;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.monitoring.exceptions.IngestException;
import org.monitoring.models.dto.ProjectRequest;
import org.monitoring.models.entity.Dataset;
import org.monitoring.models.entity.Project;
import org.monitoring.models.entity.UnifiedObject;
import org.monitoring.models.enums.CanonicalRole;
import org.monitoring.models.enums.IngestErrorCode;
import org.monitoring.models.enums.IngestionMode;
import org.monitoring.models.enums.RejectionCode;
import org.monitoring.models.mapping.ColumnMapping;
import org.monitoring.models.mapping.RowRejection;
import org.monitoring.repository.UnifiedObjectRepository;
import org.monitoring.repository.UnifiedTimeSeriesRepository;
import org.monitoring.service.ProjectService;
import org.monitoring.service.ingestion.RawRecordStore;
import org.monitoring.service.ingestion.RawTable;
import org.monitoring.service.lifecycle.DatasetLifecycleService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.mock.web.MockMultipartFile;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test cases for EtlEngine against an in-memory database.
 */
@SpringBootTest
@DisplayName("EtlEngine Tests")
class EtlEngineTest {

    private static final String WELLS = "Well_ID,Lat_N,Long_E,Depth_M,Status\nW1,12.9,77.5,10,active\n";

    @Autowired
    private EtlEngine etlEngine;

    @Autowired
    private RawRecordStore rawRecordStore;

    @Autowired
    private DatasetLifecycleService lifecycleService;

    @Autowired
    private ProjectService projectService;

    @Autowired
    private UnifiedObjectRepository unifiedObjectRepository;

    @Autowired
    private UnifiedTimeSeriesRepository unifiedTimeSeriesRepository;

    private Project project;

    @BeforeEach
    void setUp() {
        project = projectService.create(new ProjectRequest("etl-tests", "ETL project", null, false, null));
    }

    private Dataset upload(String name, String content) {
        MockMultipartFile file = new MockMultipartFile("file", name, "text/csv", content.getBytes(StandardCharsets.UTF_8));
        return lifecycleService.upload(project.getId(), file);
    }

    private IngestResult ingest(Dataset dataset, ColumnMapping mapping) {
        return ingest(dataset, mapping, () -> false);
    }

    private IngestResult ingest(Dataset dataset, ColumnMapping mapping, BooleanSupplier cancelled) {
        try (RawTable table = rawRecordStore.open(dataset)) {
            return etlEngine.ingest(dataset, mapping, table, cancelled);
        }
    }

    private static ColumnMapping wellMapping() {
        return new ColumnMapping()
                .assign(CanonicalRole.ENTITY_ID, "Well_ID")
                .assign(CanonicalRole.LATITUDE, "Lat_N")
                .assign(CanonicalRole.LONGITUDE, "Long_E");
    }

    private static ColumnMapping readingMapping() {
        return new ColumnMapping()
                .assign(CanonicalRole.ENTITY_ID, "site")
                .assign(CanonicalRole.TIMESTAMP, "ts")
                .assign(CanonicalRole.METRIC_VALUE, "level");
    }

    private static String readings(int rows, int badRow) {
        StringBuilder csv = new StringBuilder("site,ts,level\n");
        for (int idx = 1; idx <= rows; idx++) {
            String ts = idx == badRow ? "31/31/2024" : String.format("2024-01-01T%02d:%02d:00Z", idx / 60, idx % 60);
            csv.append("S").append(idx % 3).append(',').append(ts).append(',').append(idx * 0.5).append('\n');
        }
        return csv.toString();
    }

    @Test
    @DisplayName("Should create one well object with typed extras")
    void testIngest_WellRegister() {
        Dataset dataset = upload("wells.csv", WELLS);

        IngestResult result = ingest(dataset, wellMapping());

        assertEquals(IngestionMode.ENTITY_ONLY, result.mode());
        assertEquals(1, result.entitiesWritten());
        assertEquals(0, result.readingsWritten());
        assertEquals(0, result.errorCount());

        UnifiedObject well = unifiedObjectRepository.findByProject_IdAndExternalId(project.getId(), "W1").orElseThrow();
        assertEquals(12.9, well.getLatitude());
        assertEquals(77.5, well.getLongitude());
        Map<String, Object> extra = well.getExtra();
        assertEquals(2, extra.size());
        assertEquals(10, ((Number) extra.get("Depth_M")).intValue());
        assertEquals("active", extra.get("Status"));
        assertEquals(dataset.getId(), well.getLastDatasetId());
    }

    @Test
    @DisplayName("Should still write entities when a numeric column is mapped as timestamp")
    void testIngest_MisassignedTimestamp() {
        Dataset dataset = upload("wells.csv", WELLS);

        IngestResult result = ingest(dataset, wellMapping().assign(CanonicalRole.TIMESTAMP, "Depth_M"));

        assertEquals(0, result.readingsWritten());
        assertEquals(1, result.errorCount());
        assertEquals(0, result.rowsRejected());
        assertEquals(1, result.entitiesWritten());
        assertEquals(RejectionCode.INVALID_TIMESTAMP, result.rejections().get(0).code());
    }

    @Test
    @DisplayName("Should ingest 99 of 100 readings and report the bad row")
    void testIngest_RowIsolation() {
        Dataset dataset = upload("levels.csv", readings(100, 42));

        IngestResult result = ingest(dataset, readingMapping());

        assertEquals(IngestionMode.BOTH, result.mode());
        assertEquals(100, result.rowsRead());
        assertEquals(99, result.readingsWritten());
        assertEquals(1, result.rowsRejected());
        assertEquals(1, result.rejections().size());
        RowRejection rejection = result.rejections().get(0);
        assertEquals(42, rejection.rowNumber());
        assertEquals(RejectionCode.INVALID_TIMESTAMP, rejection.code());
        assertEquals(99, unifiedTimeSeriesRepository.countByProject_Id(project.getId()));
        assertEquals(3, unifiedObjectRepository.countByProject_Id(project.getId()));
    }

    @Test
    @DisplayName("Should reject only the row whose identifier does not fit the store")
    void testIngest_OverlongIdentity() {
        StringBuilder csv = new StringBuilder("site,ts,level\n");
        for (int idx = 1; idx <= 20; idx++) {
            String site = idx == 7 ? "S".repeat(150) : "S" + idx;
            csv.append(site).append(",2024-01-01T00:00:00Z,").append(idx).append('\n');
        }
        Dataset dataset = upload("long-ids.csv", csv.toString());

        IngestResult result = ingest(dataset, readingMapping());

        assertEquals(19, result.entitiesWritten());
        assertEquals(19, result.readingsWritten());
        assertEquals(1, result.rowsRejected());
        RowRejection rejection = result.rejections().get(0);
        assertEquals(7, rejection.rowNumber());
        assertEquals(RejectionCode.INVALID_IDENTITY, rejection.code());
        assertEquals(19, unifiedObjectRepository.countByProject_Id(project.getId()));
    }

    @Test
    @DisplayName("Should keep readings of different non-ASCII metrics at the same timestamp")
    void testIngest_NonAsciiMetricNames() {
        String csv = "site,ts,metric,value\nW1,2024-01-01,水位,12.5\nW1,2024-01-01,温度,30.1\n";
        Dataset dataset = upload("metrics.csv", csv);
        ColumnMapping mapping = new ColumnMapping()
                .assign(CanonicalRole.ENTITY_ID, "site")
                .assign(CanonicalRole.TIMESTAMP, "ts")
                .assign(CanonicalRole.METRIC_NAME, "metric")
                .assign(CanonicalRole.METRIC_VALUE, "value");

        IngestResult result = ingest(dataset, mapping);

        assertEquals(2, result.readingsWritten());
        assertEquals(0, result.errorCount());
        assertEquals(2, unifiedTimeSeriesRepository.countByProject_Id(project.getId()));
    }

    @Test
    @DisplayName("Should leave the store unchanged when the same dataset is ingested twice")
    void testIngest_Idempotent() {
        Dataset dataset = upload("levels-twice.csv", readings(30, -1));

        IngestResult first = ingest(dataset, readingMapping());
        IngestResult second = ingest(dataset, readingMapping());

        assertEquals(30, first.readingsWritten());
        assertEquals(30, second.readingsWritten());
        assertEquals(30, unifiedTimeSeriesRepository.countByProject_Id(project.getId()));
        assertEquals(3, unifiedObjectRepository.countByProject_Id(project.getId()));
    }

    @Test
    @DisplayName("Should fail with MAPPING_DRIFT when a mapped column is missing from the file")
    void testIngest_MappingDrift() {
        Dataset dataset = upload("wells.csv", WELLS);
        ColumnMapping stale = wellMapping().assign(CanonicalRole.ENTITY_ID, "Well_Code");

        IngestException error = assertThrows(IngestException.class, () -> ingest(dataset, stale));

        assertEquals(IngestErrorCode.MAPPING_DRIFT, error.getCode());
        assertTrue(error.isRetryable());
        assertEquals(0, unifiedObjectRepository.countByProject_Id(project.getId()));
    }

    @Test
    @DisplayName("Should roll back everything when rejections reach the threshold")
    void testIngest_RejectionThreshold() {
        String csv = "site,ts,level\nS1,2024-01-01,1\nS2,bad,2\nS3,worse,3\nS4,2024-01-02,oops\n";
        Dataset dataset = upload("mostly-bad.csv", csv);

        IngestException error = assertThrows(IngestException.class, () -> ingest(dataset, readingMapping()));

        assertEquals(IngestErrorCode.REJECTION_THRESHOLD_EXCEEDED, error.getCode());
        assertEquals(3, error.getRejections().size());
        assertEquals(0, unifiedTimeSeriesRepository.countByProject_Id(project.getId()));
        assertEquals(0, unifiedObjectRepository.countByProject_Id(project.getId()));
    }

    @Test
    @DisplayName("Should roll back a cancelled run")
    void testIngest_Cancelled() {
        Dataset dataset = upload("levels-cancel.csv", readings(60, -1));

        IngestException error = assertThrows(IngestException.class, () -> ingest(dataset, readingMapping(), () -> true));

        assertEquals(IngestErrorCode.CANCELLED, error.getCode());
        assertEquals(0, unifiedTimeSeriesRepository.countByProject_Id(project.getId()));
    }
}
