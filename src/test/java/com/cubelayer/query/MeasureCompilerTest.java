package com.cubelayer.query;

import com.cubelayer.CubeFixtures;
import com.cubelayer.model.CubeDefinition;
import com.cubelayer.sql.SqlDialectAdapter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MeasureCompilerTest {
    private final MeasureCompiler measureCompiler = new MeasureCompiler();
    private CompileContext radiology;
    private CompileContext production;

    @BeforeEach
    void setUp() {
        SqlDialectAdapter dialect = new SqlDialectAdapter(SqlDialectAdapter.DatabaseType.POSTGRESQL);
        radiology = new CompileContext(CubeFixtures.radiologyAudits(), dialect, measureCompiler, new DimensionCompiler());
        production = new CompileContext(CubeFixtures.productionQuality(), dialect, measureCompiler, new DimensionCompiler());
    }

    private String aggregate(CompileContext ctx, String measure) {
        return measureCompiler.aggregate(ctx.getCube().getMeasure(measure), ctx);
    }

    @Test
    void countWithoutSqlCountsRows() {
        assertEquals("COUNT(*)", aggregate(radiology, "count"));
        assertEquals("COUNT(*) AS \"count\"",
            measureCompiler.compile(radiology.getCube().getMeasure("count"), radiology).getSql());
    }

    @Test
    void plainAggregatesQualifyTheColumn() {
        assertEquals("AVG(radiology_audits.quality_score)", aggregate(radiology, "avgQualityScore"));
        assertEquals("SUM(production_quality.total_units)", aggregate(production, "totalUnits"));
    }

    @Test
    void filteredMeasureWrapsArgumentInCase() {
        assertEquals("COUNT(CASE WHEN (radiology_audits.final_output = 'CAT5') THEN radiology_audits.case_id END)",
            aggregate(radiology, "cat5Count"));
        assertEquals("(radiology_audits.required_reaudit = 'Yes')",
            measureCompiler.filterPredicate(radiology.getCube().getMeasure("reauditCount"), radiology));
        assertNull(measureCompiler.filterPredicate(radiology.getCube().getMeasure("count"), radiology));
    }

    @Test
    void numberMeasureIsEmittedVerbatimWithMacrosExpanded() {
        assertEquals("(ROUND(COUNT(CASE WHEN radiology_audits.final_output IN ('CAT4', 'CAT5') THEN 1 END)"
                + " * 100.0 / NULLIF(COUNT(*), 0), 2))",
            aggregate(radiology, "highQualityRate"));
    }

    @Test
    void numberMeasureExpandsReferencedMeasures() {
        assertEquals("(CAST(SUM(production_quality.passed_units) AS DOUBLE PRECISION) * 100.0"
                + " / NULLIF(CAST(SUM(production_quality.total_units) AS DOUBLE PRECISION), 0))",
            aggregate(production, "passRate"));
    }

    @Test
    void filteredCountWithoutSqlCountsMatchingRows() {
        CubeDefinition cube = CubeFixtures.schema(""
            + "cubes:\n"
            + "  - name: Orders\n"
            + "    sql_table: public.orders\n"
            + "    measures:\n"
            + "      - name: shipped\n"
            + "        type: count\n"
            + "        filters:\n"
            + "          - sql: \"${CUBE}.status = 'shipped'\"\n"
            + "          - sql: \"${amount} > 0\"\n"
            + "      - {name: buyers, type: countDistinct, sql: customer_id}\n"
            + "    dimensions:\n"
            + "      - {name: id, sql: id, type: number, primaryKey: true}\n"
            + "      - {name: amount, sql: amount, type: number}\n").getCube("Orders");
        CompileContext ctx = new CompileContext(cube,
            new SqlDialectAdapter(SqlDialectAdapter.DatabaseType.ANSI), measureCompiler, new DimensionCompiler());

        assertEquals("COUNT(CASE WHEN (orders.status = 'shipped') AND (orders.amount > 0) THEN 1 END)",
            aggregate(ctx, "shipped"));
        assertEquals("COUNT(DISTINCT orders.customer_id)", aggregate(ctx, "buyers"));
    }

    @Test
    void numberMeasureDivisorsAreGuardedAgainstZero() {
        CubeDefinition cube = CubeFixtures.schema(""
            + "cubes:\n"
            + "  - name: Audits\n"
            + "    sql_table: medical.radiology_audits\n"
            + "    measures:\n"
            + "      - {name: count, type: count}\n"
            + "      - name: cat5Count\n"
            + "        type: count\n"
            + "        filters:\n"
            + "          - sql: \"${CUBE}.final_output = 'CAT5'\"\n"
            + "      - name: cat5Rate\n"
            + "        type: number\n"
            + "        sql: \"ROUND(${cat5Count} * 100 / ${count}, 2)\"\n"
            + "    dimensions:\n"
            + "      - {name: id, sql: id, type: number, primaryKey: true}\n").getCube("Audits");
        CompileContext ctx = new CompileContext(cube,
            new SqlDialectAdapter(SqlDialectAdapter.DatabaseType.ANSI), measureCompiler, new DimensionCompiler());

        assertEquals("(ROUND(COUNT(CASE WHEN (audits.final_output = 'CAT5') THEN 1 END) * 100"
                + " / NULLIF(COUNT(*), 0), 2))",
            aggregate(ctx, "cat5Rate"));
    }
}
