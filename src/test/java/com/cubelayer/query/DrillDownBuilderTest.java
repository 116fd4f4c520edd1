package com.cubelayer.query;

import com.cubelayer.CubeFixtures;
import com.cubelayer.model.CubeDefinition;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DrillDownBuilderTest {
    private final DrillDownBuilder builder = new DrillDownBuilder();
    private final CubeDefinition radiology = CubeFixtures.radiologyAudits();

    private static QueryRequest original() {
        QueryRequest request = new QueryRequest();
        request.setCube("RadiologyAudits");
        request.setMeasures(List.of("RadiologyAudits.cat5Count", "RadiologyAudits.count"));
        request.setDimensions(List.of("RadiologyAudits.modality"));
        request.setSegments(List.of("RadiologyAudits.neuroStudies"));
        request.setFilters(List.of(new QueryRequest.Filter("RadiologyAudits.gender", "equals", List.of("F"))));
        return request;
    }

    @Test
    void drillsIntoRowWithMeasureFilter() throws QueryException {
        QueryRequest drill = builder.build(radiology, original(), "RadiologyAudits.cat5Count",
            Map.of("RadiologyAudits.modality", "CT", "RadiologyAudits.cat5Count", 12));

        assertEquals("RadiologyAudits", drill.getCube());
        assertTrue(drill.getMeasures().isEmpty());
        assertEquals(List.of("RadiologyAudits.caseId", "RadiologyAudits.modality",
            "RadiologyAudits.subSpecialty", "RadiologyAudits.originalRadiologist"), drill.getDimensions());
        assertEquals(List.of("RadiologyAudits.neuroStudies"), drill.getSegments());

        List<QueryRequest.Filter> filters = drill.getFilters();
        assertEquals(3, filters.size());
        assertEquals("RadiologyAudits.gender", filters.get(0).getMember());
        assertEquals("RadiologyAudits.modality", filters.get(1).getMember());
        assertEquals("equals", filters.get(1).getOperator());
        assertEquals(List.of("CT"), filters.get(1).getValues());
        assertEquals("RadiologyAudits.cat5Count", filters.get(2).getMember());
        assertEquals("measureFilter", filters.get(2).getOperator());
        assertNull(drill.getLimit());
    }

    @Test
    void unfilteredMeasureAddsNoMeasureFilter() throws QueryException {
        QueryRequest drill = builder.build(radiology, original(), "count", Map.of("modality", "MRI"));

        assertEquals(List.of("RadiologyAudits.caseId", "RadiologyAudits.modality",
            "RadiologyAudits.subSpecialty", "RadiologyAudits.finalOutput"), drill.getDimensions());
        assertEquals(2, drill.getFilters().size());
        assertTrue(drill.getFilters().stream().noneMatch(f -> "measureFilter".equals(f.getOperator())));
    }

    @Test
    void nullGroupValueBecomesNotSet() throws QueryException {
        Map<String, Object> row = new HashMap<>();
        row.put("modality", null);

        QueryRequest drill = builder.build(radiology, original(), "count", row);
        QueryRequest.Filter filter = drill.getFilters().get(1);
        assertEquals("RadiologyAudits.modality", filter.getMember());
        assertEquals("notSet", filter.getOperator());
        assertNull(filter.getValues());
    }

    @Test
    void timeBucketBecomesHalfOpenRange() throws QueryException {
        QueryRequest original = new QueryRequest();
        original.setMeasures(List.of("RadiologyAudits.count"));
        original.setTimeDimensions(List.of(new QueryRequest.TimeDimension(
            "RadiologyAudits.scanDateTime", "month", List.of("2024-01-01", "2024-04-01"))));

        QueryRequest drill = builder.build(radiology, original, "count",
            Map.of("scanDateTime__month", "2024-02-01T00:00:00.000"));

        assertEquals(1, drill.getTimeDimensions().size());
        QueryRequest.TimeDimension kept = drill.getTimeDimensions().get(0);
        assertNull(kept.getGranularity());
        assertEquals(List.of("2024-01-01", "2024-04-01"), kept.getDateRange());

        QueryRequest.Filter bucket = drill.getFilters().get(0);
        assertEquals("RadiologyAudits.scanDateTime", bucket.getMember());
        assertEquals("inDateRange", bucket.getOperator());
        assertEquals(List.of("2024-02-01T00:00:00", "2024-03-01T00:00:00"), bucket.getValues());
    }

    @Test
    void weekBucketAcceptsQualifiedGrainKey() throws QueryException {
        QueryRequest original = new QueryRequest();
        original.setMeasures(List.of("RadiologyAudits.count"));
        original.setTimeDimensions(List.of(new QueryRequest.TimeDimension("RadiologyAudits.scanDateTime", "week", null)));

        QueryRequest drill = builder.build(radiology, original, "count",
            Map.of("RadiologyAudits.scanDateTime.week", "2024-01-17T13:45:00"));

        assertTrue(drill.getTimeDimensions().isEmpty());
        assertEquals(List.of("2024-01-15T00:00:00", "2024-01-22T00:00:00"), drill.getFilters().get(0).getValues());
    }

    @Test
    void originalRequestIsNotModified() throws QueryException {
        QueryRequest original = original();
        builder.build(radiology, original, "cat5Count", Map.of("modality", "CT"));

        assertEquals(1, original.getFilters().size());
        assertEquals(List.of("RadiologyAudits.modality"), original.getDimensions());
    }

    @Test
    void rejectsMeasuresThatCannotBeDrilled() {
        QueryException unknown = assertThrows(QueryException.class,
            () -> builder.build(radiology, original(), "cat6Count", Map.of("modality", "CT")));
        assertEquals(QueryException.Kind.UNKNOWN_FIELD, unknown.getKind());

        QueryException noDrillMembers = assertThrows(QueryException.class,
            () -> builder.build(radiology, original(), "avgQualityScore", Map.of("modality", "CT")));
        assertEquals(QueryException.Kind.INVALID_REQUEST, noDrillMembers.getKind());

        QueryException missingValue = assertThrows(QueryException.class,
            () -> builder.build(radiology, original(), "count", Map.of("gender", "F")));
        assertEquals(QueryException.Kind.INVALID_REQUEST, missingValue.getKind());
    }
}
