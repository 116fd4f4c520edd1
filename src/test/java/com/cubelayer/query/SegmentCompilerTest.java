package com.cubelayer.query;

import com.cubelayer.CubeFixtures;
import com.cubelayer.sql.SqlDialectAdapter;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SegmentCompilerTest {
    private final SegmentCompiler segmentCompiler = new SegmentCompiler();
    private final CompileContext ctx = new CompileContext(CubeFixtures.radiologyAudits(),
        new SqlDialectAdapter(SqlDialectAdapter.DatabaseType.POSTGRESQL), new MeasureCompiler(), new DimensionCompiler());

    @Test
    void segmentsAreParenthesizedAndJoinedWithAnd() throws QueryException {
        assertEquals("(radiology_audits.modality = 'CT') AND (radiology_audits.final_output IN ('CAT4', 'CAT5'))",
            segmentCompiler.compile(List.of("ctScans", "highQuality"), ctx).getSql());
        assertTrue(segmentCompiler.compile(List.of("neuroStudies"), ctx).getParameters().isEmpty());
    }

    @Test
    void unknownSegmentIsRejected() {
        QueryException e = assertThrows(QueryException.class,
            () -> segmentCompiler.compile(List.of("ctScans", "petScans"), ctx));
        assertEquals(QueryException.Kind.UNKNOWN_SEGMENT, e.getKind());
        assertTrue(e.getMessage().contains("petScans"));
    }
}
