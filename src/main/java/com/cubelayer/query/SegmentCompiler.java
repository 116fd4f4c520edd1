package com.cubelayer.query;

import com.cubelayer.model.SegmentDefinition;
import com.cubelayer.sql.SqlFragment;

import java.util.ArrayList;
import java.util.List;

/**
 * 分段编译：每个分段谓词加括号后用 AND 连接
 */
public class SegmentCompiler {

    public SqlFragment compile(List<String> segmentNames, CompileContext ctx) throws QueryException {
        List<String> predicates = new ArrayList<>();
        for (String segmentName : segmentNames) {
            predicates.add(predicate(segmentName, ctx));
        }
        return SqlFragment.of(String.join(" AND ", predicates));
    }

    public String predicate(String segmentName, CompileContext ctx) throws QueryException {
        SegmentDefinition segment = ctx.getCube().getSegment(segmentName);
        if (segment == null) {
            throw new QueryException(QueryException.Kind.UNKNOWN_SEGMENT,
                "segment '" + segmentName + "' not found in cube '" + ctx.getCube().getName() + "'");
        }
        return "(" + ctx.expand(segment.getPredicate()) + ")";
    }
}
