package com.cubelayer.query;

import com.cubelayer.CubeFixtures;
import com.cubelayer.meta.SchemaModel;
import com.cubelayer.model.CubeDefinition;
import com.cubelayer.sql.SqlDialectAdapter;
import org.apache.calcite.sql.SqlNode;
import org.apache.calcite.sql.parser.SqlParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class QueryAssemblerTest {
    private QueryAssembler assembler;
    private SchemaModel schema;
    private CubeDefinition radiology;

    @BeforeEach
    void setUp() {
        assembler = new QueryAssembler(new SqlDialectAdapter(SqlDialectAdapter.DatabaseType.POSTGRESQL));
        schema = CubeFixtures.loadFile(CubeFixtures.DECLARATIONS_DIR);
        radiology = schema.getCube("RadiologyAudits");
    }

    private static QueryRequest request(String... measures) {
        QueryRequest request = new QueryRequest();
        request.setCube("RadiologyAudits");
        request.setMeasures(List.of(measures));
        return request;
    }

    private static QueryRequest.Filter filter(String member, String operator, Object... values) {
        return new QueryRequest.Filter(member, operator, values.length > 0 ? List.of(values) : null);
    }

    private QueryException.Kind failure(QueryRequest request) {
        return assertThrows(QueryException.class, () -> assembler.assemble(schema, request)).getKind();
    }

    @Test
    void compilesModalityBreakdownForCtScans() throws QueryException {
        QueryRequest request = request("RadiologyAudits.count", "RadiologyAudits.cat5Count");
        request.setDimensions(List.of("RadiologyAudits.modality"));
        request.setSegments(List.of("RadiologyAudits.ctScans"));

        CompiledQuery compiled = assembler.assemble(schema, request);

        assertEquals("SELECT\n"
            + "  radiology_audits.modality AS \"modality\",\n"
            + "  COUNT(*) AS \"count\",\n"
            + "  COUNT(CASE WHEN (radiology_audits.final_output = 'CAT5') THEN radiology_audits.case_id END) AS \"cat5Count\"\n"
            + "FROM (SELECT * FROM medical.radiology_audits) AS radiology_audits\n"
            + "WHERE (radiology_audits.modality = 'CT')\n"
            + "GROUP BY radiology_audits.modality\n"
            + "ORDER BY \"count\" DESC\n"
            + "LIMIT 10000", compiled.getSql());
        assertTrue(compiled.getParameters().isEmpty());

        assertEquals(3, compiled.getColumns().size());
        ColumnManifest cat5 = compiled.getColumn("cat5Count");
        assertEquals(ColumnManifest.Kind.MEASURE, cat5.getKind());
        assertEquals("RadiologyAudits.cat5Count", cat5.getMember());
        assertEquals("count", cat5.getSemanticType());
        assertEquals("CAT 5 Cases (Excellent)", cat5.getTitle());
        assertEquals(ColumnManifest.Kind.DIMENSION, compiled.getColumn("modality").getKind());
    }

    @Test
    void compilationIsDeterministicAndLeavesRequestUntouched() throws QueryException {
        QueryRequest request = request("avgQualityScore");
        request.setDimensions(List.of("subSpecialty"));
        request.setFilters(List.of(filter("modality", "equals", "CT", "MRI")));
        QueryRequest before = request.copy();

        CompiledQuery first = assembler.assemble(schema, request);
        CompiledQuery second = assembler.assemble(schema, request);

        assertEquals(first.getSql(), second.getSql());
        assertEquals(first.getParameters(), second.getParameters());
        assertEquals(before.getDimensions(), request.getDimensions());
        assertEquals(1, request.getFilters().size());
        assertEquals(List.of("CT", "MRI"), request.getFilters().get(0).getValues());
    }

    @Test
    void timeDimensionsAreTruncatedGroupedAndRangeFiltered() throws QueryException {
        QueryRequest request = request("count");
        request.setTimeDimensions(List.of(
            new QueryRequest.TimeDimension("RadiologyAudits.scanDateTime", "day", List.of("2024-01-01", "2024-01-31"))));

        CompiledQuery compiled = assembler.assemble(schema, request);
        String truncated = "DATE_TRUNC('day', radiology_audits.scan_date_and_time)";

        assertTrue(compiled.getSql().contains(truncated + " AS \"scanDateTime__day\""));
        assertTrue(compiled.getSql().contains("\nWHERE (radiology_audits.scan_date_and_time >= ?"
            + " AND radiology_audits.scan_date_and_time < ?)\n"));
        assertTrue(compiled.getSql().contains("\nGROUP BY " + truncated + "\n"));
        assertTrue(compiled.getSql().contains("\nORDER BY \"scanDateTime__day\" ASC\n"));
        assertEquals(List.of(LocalDateTime.of(2024, 1, 1, 0, 0), LocalDateTime.of(2024, 1, 31, 0, 0)),
            compiled.getParameters());

        ColumnManifest column = compiled.getColumn("scanDateTime__day");
        assertEquals(ColumnManifest.Kind.TIME_DIMENSION, column.getKind());
        assertEquals("day", column.getGranularity());
        assertEquals("RadiologyAudits.scanDateTime", column.getMember());
    }

    @Test
    void dateRangeWithoutGranularityOnlyFilters() throws QueryException {
        QueryRequest request = request("count");
        request.setTimeDimensions(List.of(
            new QueryRequest.TimeDimension("scanDateTime", null, List.of("2024-01-01", "2024-02-01"))));

        CompiledQuery compiled = assembler.assemble(schema, request);
        assertFalse(compiled.getSql().contains("GROUP BY"));
        assertFalse(compiled.getSql().contains("DATE_TRUNC"));
        assertEquals(1, compiled.getColumns().size());
    }

    @Test
    void measureFiltersGoToHavingAfterWhereParameters() throws QueryException {
        QueryRequest request = request("count");
        request.setDimensions(List.of("originalRadiologist"));
        request.setFilters(List.of(
            filter("count", "gt", 10),
            filter("age", "gte", "40"),
            filter("gender", "notEquals", "Unknown")));

        CompiledQuery compiled = assembler.assemble(schema, request);

        assertTrue(compiled.getSql().contains("\nWHERE radiology_audits.age >= ?\n"
            + "  AND (radiology_audits.gender <> ? OR radiology_audits.gender IS NULL)\n"));
        assertTrue(compiled.getSql().contains("\nHAVING COUNT(*) > ?\n"));
        assertEquals(List.of(new BigDecimal("40"), "Unknown", new BigDecimal("10")), compiled.getParameters());
    }

    @Test
    void measureFilterOperatorAppliesTheMeasureOwnPredicate() throws QueryException {
        QueryRequest request = request("count");
        request.setDimensions(List.of("caseId"));
        request.setFilters(List.of(filter("RadiologyAudits.cat5Count", "measureFilter")));

        CompiledQuery compiled = assembler.assemble(schema, request);
        assertTrue(compiled.getSql().contains("\nWHERE (radiology_audits.final_output = 'CAT5')\n"));
        assertFalse(compiled.getSql().contains("HAVING"));
    }

    @Test
    void numberMeasuresExpandReferencedMeasures() throws QueryException {
        QueryRequest request = new QueryRequest();
        request.setMeasures(List.of("ProductionQuality.passRate"));
        request.setDimensions(List.of("ProductionQuality.lineId"));

        CompiledQuery compiled = assembler.assemble(schema, request);
        assertEquals("ProductionQuality", compiled.getCube());
        assertTrue(compiled.getSql().contains("(CAST(SUM(production_quality.passed_units) AS DOUBLE PRECISION) * 100.0"
            + " / NULLIF(CAST(SUM(production_quality.total_units) AS DOUBLE PRECISION), 0)) AS \"passRate\""));
        assertTrue(compiled.getSql().contains("FROM (SELECT * FROM staging_marts.fact_production_quality) AS production_quality"));
        assertEquals("percent", compiled.getColumn("passRate").getFormat());
    }

    @Test
    void explicitOrderAndPaging() throws QueryException {
        QueryRequest request = request("count");
        request.setDimensions(List.of("modality"));
        request.getOrder().put("RadiologyAudits.modality", "asc");
        request.getOrder().put("count", "DESC");
        request.setLimit(20);
        request.setOffset(40);

        String sql = assembler.assemble(schema, request).getSql();
        assertTrue(sql.endsWith("\nORDER BY \"modality\" ASC, \"count\" DESC\nLIMIT 20 OFFSET 40"));

        QueryAssembler ansi = new QueryAssembler(new SqlDialectAdapter(SqlDialectAdapter.DatabaseType.ANSI));
        assertTrue(ansi.assemble(schema, request).getSql().endsWith("\nOFFSET 40 ROWS FETCH NEXT 20 ROWS ONLY"));
    }

    @Test
    void dimensionOnlyQueriesOrderByFirstDimension() throws QueryException {
        QueryRequest request = request();
        request.setDimensions(List.of("gender", "modality"));

        String sql = assembler.assemble(radiology, request).getSql();
        assertTrue(sql.contains("\nGROUP BY radiology_audits.gender, radiology_audits.modality\n"));
        assertTrue(sql.contains("\nORDER BY \"gender\" ASC\n"));
    }

    @Test
    void invalidPagingAndOrderingAreRejected() {
        QueryRequest zero = request("count");
        zero.setLimit(0);
        assertEquals(QueryException.Kind.INVALID_REQUEST, failure(zero));

        QueryRequest huge = request("count");
        huge.setLimit(QueryAssembler.MAX_LIMIT + 1);
        assertEquals(QueryException.Kind.INVALID_REQUEST, failure(huge));

        QueryRequest negative = request("count");
        negative.setOffset(-1);
        assertEquals(QueryException.Kind.INVALID_REQUEST, failure(negative));

        QueryRequest notSelected = request("count");
        notSelected.getOrder().put("modality", "asc");
        assertEquals(QueryException.Kind.INVALID_REQUEST, failure(notSelected));

        QueryRequest sideways = request("count");
        sideways.getOrder().put("count", "sideways");
        assertEquals(QueryException.Kind.INVALID_REQUEST, failure(sideways));
    }

    @Test
    void unknownMembersAreReported() {
        QueryRequest unknownDimension = request("count");
        unknownDimension.setDimensions(List.of("scannerSerial"));
        assertEquals(QueryException.Kind.UNKNOWN_FIELD, failure(unknownDimension));

        QueryRequest measureAsDimension = request();
        measureAsDimension.setDimensions(List.of("count"));
        assertEquals(QueryException.Kind.UNKNOWN_FIELD, failure(measureAsDimension));

        QueryRequest unknownSegment = request("count");
        unknownSegment.setSegments(List.of("petScans"));
        assertEquals(QueryException.Kind.UNKNOWN_SEGMENT, failure(unknownSegment));

        QueryRequest unknownCube = new QueryRequest();
        unknownCube.setMeasures(List.of("Invoices.count"));
        assertEquals(QueryException.Kind.UNKNOWN_CUBE, failure(unknownCube));

        QueryRequest rejectedCube = new QueryRequest();
        rejectedCube.setMeasures(List.of("BrokenDrill.count"));
        assertEquals(QueryException.Kind.UNKNOWN_CUBE, failure(rejectedCube));
    }

    @Test
    void typeMismatchesAreReported() {
        QueryRequest textOnNumber = request("count");
        textOnNumber.setFilters(List.of(filter("age", "contains", "4")));
        assertEquals(QueryException.Kind.TYPE_MISMATCH, failure(textOnNumber));

        QueryRequest grainOnString = request("count");
        grainOnString.setTimeDimensions(List.of(new QueryRequest.TimeDimension("modality", "day", null)));
        assertEquals(QueryException.Kind.TYPE_MISMATCH, failure(grainOnString));

        QueryRequest rangeOnMeasure = request("count");
        rangeOnMeasure.setFilters(List.of(filter("avgAge", "inDateRange", "2024-01-01", "2024-02-01")));
        assertEquals(QueryException.Kind.TYPE_MISMATCH, failure(rangeOnMeasure));
    }

    @Test
    void malformedRequestsAreRejected() {
        assertEquals(QueryException.Kind.INVALID_REQUEST, failure(request()));

        QueryRequest twice = request("count", "RadiologyAudits.count");
        assertEquals(QueryException.Kind.INVALID_REQUEST, failure(twice));

        QueryRequest unknownOperator = request("count");
        unknownOperator.setFilters(List.of(filter("modality", "like", "CT")));
        assertEquals(QueryException.Kind.INVALID_REQUEST, failure(unknownOperator));

        QueryRequest unknownGrain = request("count");
        unknownGrain.setTimeDimensions(List.of(new QueryRequest.TimeDimension("scanDateTime", "fortnight", null)));
        assertEquals(QueryException.Kind.INVALID_REQUEST, failure(unknownGrain));

        QueryRequest noCube = new QueryRequest();
        noCube.setMeasures(List.of("count"));
        assertEquals(QueryException.Kind.INVALID_REQUEST, failure(noCube));

        QueryRequest wrongCube = request("count");
        wrongCube.setCube("ProductionQuality");
        assertThrows(QueryException.class, () -> assembler.assemble(radiology, wrongCube));
    }

    @Test
    void nullFilterAndTimeDimensionEntriesAreInvalid() {
        QueryRequest nullFilter = request("count");
        nullFilter.setFilters(Arrays.asList(filter("modality", "equals", "CT"), null));
        assertEquals(QueryException.Kind.INVALID_REQUEST, failure(nullFilter));
        assertEquals(QueryException.Kind.INVALID_REQUEST,
            assertThrows(QueryException.class, () -> assembler.assemble(radiology, nullFilter)).getKind());

        QueryRequest nullTimeDimension = new QueryRequest();
        nullTimeDimension.setMeasures(List.of("RadiologyAudits.count"));
        nullTimeDimension.setTimeDimensions(Arrays.asList((QueryRequest.TimeDimension) null));
        assertEquals(QueryException.Kind.INVALID_REQUEST, failure(nullTimeDimension));
    }

    @Test
    void crossCubeReferencesAreUnsupported() {
        SchemaModel joined = CubeFixtures.schema(""
            + "cubes:\n"
            + "  - name: Audits\n"
            + "    sql_table: medical.audits\n"
            + "    joins:\n"
            + "      - {name: Reviewers, relationship: belongsTo, sql: \"${CUBE}.reviewer_id = ${Reviewers}.id\"}\n"
            + "    measures:\n"
            + "      - {name: count, type: count}\n"
            + "    dimensions:\n"
            + "      - {name: id, sql: id, type: number, primaryKey: true}\n"
            + "      - {name: reviewerName, sql: \"${Reviewers.name}\", type: string}\n"
            + "      - {name: reviewerLabel, sql: \"UPPER(${reviewerName})\", type: string}\n"
            + "  - name: Reviewers\n"
            + "    sql_table: medical.reviewers\n"
            + "    dimensions:\n"
            + "      - {name: id, sql: id, type: number, primaryKey: true}\n"
            + "      - {name: name, sql: name, type: string}\n");
        assertTrue(joined.contains("Audits"));

        QueryRequest direct = new QueryRequest();
        direct.setMeasures(List.of("Audits.count"));
        direct.setDimensions(List.of("Reviewers.name"));
        assertEquals(QueryException.Kind.UNSUPPORTED,
            assertThrows(QueryException.class, () -> assembler.assemble(joined, direct)).getKind());

        QueryRequest indirect = new QueryRequest();
        indirect.setMeasures(List.of("Audits.count"));
        indirect.setDimensions(List.of("Audits.reviewerLabel"));
        QueryException e = assertThrows(QueryException.class, () -> assembler.assemble(joined, indirect));
        assertEquals(QueryException.Kind.UNSUPPORTED, e.getKind());
        assertTrue(e.getMessage().contains("Reviewers.name"));
    }

    @Test
    void compiledSqlParsesAsStandardSql() throws Exception {
        QueryAssembler ansi = new QueryAssembler(new SqlDialectAdapter(SqlDialectAdapter.DatabaseType.ANSI));
        QueryRequest request = request("count", "cat1Count", "avgQualityScore", "highQualityRate");
        request.setDimensions(List.of("modality", "subSpecialty"));
        request.setSegments(List.of("highQuality", "neuroStudies"));
        request.setFilters(List.of(
            filter("gender", "notEquals", "Unknown"),
            filter("studyDescription", "contains", "brain"),
            filter("avgQualityScore", "lt", 0.8)));
        request.setLimit(50);
        request.setOffset(100);

        CompiledQuery compiled = ansi.assemble(schema, request);
        SqlNode parsed = SqlParser.create(compiled.getSql(), SqlParser.config()).parseQuery();
        assertNotNull(parsed);
        assertEquals(List.of("Unknown", "%brain%", new BigDecimal("0.8")), compiled.getParameters());
    }
}
