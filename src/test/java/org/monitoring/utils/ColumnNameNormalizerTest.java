package org.monitoring.utils;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.monitoring.models.mapping.ColumnDescriptor;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test cases for ColumnNameNormalizer.
 */
@DisplayName("ColumnNameNormalizer Tests")
class ColumnNameNormalizerTest {

    @ParameterizedTest
    @DisplayName("Should slugify header names")
    @CsvSource({
            "Well_ID, well_id",
            "'  Lat (N) ', lat_n",
            "Depth--M, depth_m",
            "__Status__, status",
            "Température °C, temp_rature_c"
    })
    void testSlugify(String raw, String expected) {
        assertEquals(expected, ColumnNameNormalizer.slugify(raw));
    }

    @Test
    @DisplayName("Should return empty slug for null or symbol-only names")
    void testSlugify_Empty() {
        assertEquals("", ColumnNameNormalizer.slugify(null));
        assertEquals("", ColumnNameNormalizer.slugify("#%!"));
    }

    @Test
    @DisplayName("Should number empty slugs by position and suffix duplicates")
    void testDescribe() {
        List<ColumnDescriptor> descriptors = ColumnNameNormalizer.describe(Arrays.asList("Site ID", "site-id", "???", "Value"));

        assertEquals(4, descriptors.size());
        assertEquals("site_id", descriptors.get(0).variable());
        assertEquals("site_id_2", descriptors.get(1).variable());
        assertEquals("column_3", descriptors.get(2).variable());
        assertEquals("value", descriptors.get(3).variable());
        assertEquals("site-id", descriptors.get(1).original());
    }
}
