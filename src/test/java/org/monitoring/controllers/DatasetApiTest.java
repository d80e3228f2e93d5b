package org.monitoring.controllers;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;

import java.nio.charset.StandardCharsets;

import static org.hamcrest.Matchers.hasSize;
import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Test cases for the project, dataset and monitoring data endpoints.
 */
@SpringBootTest
@AutoConfigureMockMvc
@DisplayName("Dataset API Tests")
class DatasetApiTest {

    private static final String READINGS = """
            site,lat,lon,date,parameter,value
            S1,12.90,77.50,2024-01-15,pH,7.1
            S1,12.90,77.50,2024-01-16,pH,7.3
            S2,13.10,77.60,2024-01-15,pH,6.8
            """;

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    private long createProject() throws Exception {
        String response = mockMvc.perform(post("/api/projects")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"ownerRef\": \"api-tests\", \"name\": \"River sites\"}"))
                .andExpect(status().isCreated())
                .andReturn().getResponse().getContentAsString();
        return objectMapper.readTree(response).get("id").asLong();
    }

    private JsonNode uploadReadings(long projectId) throws Exception {
        MockMultipartFile file = new MockMultipartFile("file", "river.csv", "text/csv",
                READINGS.getBytes(StandardCharsets.UTF_8));
        String response = mockMvc.perform(multipart("/api/projects/{projectId}/datasets", projectId).file(file))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.status").value("UPLOADED"))
                .andExpect(jsonPath("$.rowCount").value(3))
                .andExpect(jsonPath("$.columns", hasSize(6)))
                .andReturn().getResponse().getContentAsString();
        return objectMapper.readTree(response);
    }

    @Test
    @DisplayName("Should ingest a reading table through the API and serve the normalized data")
    void testIngestAndQuery() throws Exception {
        long projectId = createProject();
        long datasetId = uploadReadings(projectId).get("id").asLong();

        mockMvc.perform(post("/api/datasets/{datasetId}/analyze", datasetId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("ANALYZED"))
                .andExpect(jsonPath("$.mapping.roles.ENTITY_ID").value("site"))
                .andExpect(jsonPath("$.mapping.roles.TIMESTAMP").value("date"))
                .andExpect(jsonPath("$.mapping.roles.METRIC_VALUE").value("value"));

        mockMvc.perform(post("/api/datasets/{datasetId}/confirm", datasetId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("INGESTED"));

        mockMvc.perform(get("/api/projects/{projectId}/objects", projectId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.content", hasSize(2)))
                .andExpect(jsonPath("$.content[0].externalId").value("S1"))
                .andExpect(jsonPath("$.content[0].latitude").value(12.9));

        mockMvc.perform(get("/api/projects/{projectId}/readings", projectId)
                        .param("entity", "S1")
                        .param("from", "2024-01-15T00:00:00Z")
                        .param("to", "2024-01-16T00:00:00Z"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].metric").value("ph"))
                .andExpect(jsonPath("$[0].value").value(7.1));

        mockMvc.perform(put("/api/projects/{projectId}/metrics/{metricKey}", projectId, "ph")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"label\": \"Acidity\", \"unit\": \"pH\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.label").value("Acidity"));

        mockMvc.perform(get("/api/datasets/{datasetId}/runs", datasetId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].status").value("SUCCESS"));
    }

    @Test
    @DisplayName("Should answer 400 with violations for an invalid mapping")
    void testConfirm_InvalidMapping() throws Exception {
        long datasetId = uploadReadings(createProject()).get("id").asLong();
        mockMvc.perform(post("/api/datasets/{datasetId}/analyze", datasetId)).andExpect(status().isOk());

        String body = """
                {"mapping": {"roles": {"ENTITY_ID": "site", "LATITUDE": "elevation"}}}
                """;
        mockMvc.perform(post("/api/datasets/{datasetId}/confirm", datasetId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("MAPPING_INVALID"))
                .andExpect(jsonPath("$.violations[0].code").value("UNKNOWN_COLUMN"))
                .andExpect(jsonPath("$.violations[0].column").value("elevation"))
                .andExpect(jsonPath("$.datasetStatus").value("ANALYZED"));
    }

    @Test
    @DisplayName("Should answer 409 when confirming a dataset that is not analyzed")
    void testConfirm_Stale() throws Exception {
        long datasetId = uploadReadings(createProject()).get("id").asLong();

        mockMvc.perform(post("/api/datasets/{datasetId}/confirm", datasetId))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("STALE_TRANSITION"))
                .andExpect(jsonPath("$.datasetStatus").value("UPLOADED"));
    }

    @Test
    @DisplayName("Should answer 404 for unknown resources and 400 for invalid bodies")
    void testErrors() throws Exception {
        mockMvc.perform(get("/api/datasets/{datasetId}", 987654))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("NOT_FOUND"));

        mockMvc.perform(post("/api/projects")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"ownerRef\": \"\", \"name\": \"x\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.fields[0].field").value("ownerRef"));

        String response = mockMvc.perform(get("/api/projects/{projectId}/readings", createProject())
                        .param("from", "2024-02-01T00:00:00Z")
                        .param("to", "2024-01-01T00:00:00Z"))
                .andExpect(status().isBadRequest())
                .andReturn().getResponse().getContentAsString();
        assertTrue(objectMapper.readTree(response).get("message").asText().length() > 0);
    }
}
