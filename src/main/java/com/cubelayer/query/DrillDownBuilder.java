package com.cubelayer.query;

import com.cubelayer.model.CubeDefinition;
import com.cubelayer.model.MeasureDefinition;
import com.cubelayer.sql.TimeGrain;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 下钻：根据聚合结果中的一行，派生出只看该行明细的新请求。
 * <p>
 * 新请求选择度量声明的 drillMembers，原请求的分段和过滤条件原样保留，
 * 每个分组维度按该行的值加等值过滤（值为 NULL 时用 notSet），
 * 带粒度的时间维度改为该行所在时间桶 [起点, 下一个起点) 的范围过滤，
 * 最后加上被下钻度量自身的过滤条件（measureFilter）。
 * 纯函数，不修改输入。
 */
public class DrillDownBuilder {

    /**
     * @param row 结果行，键可以是限定成员名（RadiologyAudits.modality）或列别名（modality、scanDateTime__day）
     */
    public QueryRequest build(CubeDefinition cube, QueryRequest original, String measureName,
                              Map<String, Object> row) throws QueryException {
        String measureMember = QueryAssembler.localName(cube, measureName, name -> false);
        MeasureDefinition measure = cube.getMeasure(measureMember);
        if (measure == null) {
            throw new QueryException(QueryException.Kind.UNKNOWN_FIELD,
                "measure '" + measureName + "' not found in cube '" + cube.getName() + "'");
        }
        if (measure.getDrillMembers().isEmpty()) {
            throw new QueryException(QueryException.Kind.INVALID_REQUEST,
                "measure '" + measureName + "' declares no drill members");
        }
        Map<String, Object> values = row != null ? row : Map.of();

        QueryRequest drill = new QueryRequest();
        drill.setCube(cube.getName());
        for (String drillMember : measure.getDrillMembers()) {
            String qualified = drillMember.indexOf('.') > 0 ? drillMember : qualified(cube, drillMember);
            if (cube.getMeasure(drillMember) != null) {
                drill.getMeasures().add(qualified);
            } else {
                drill.getDimensions().add(qualified);
            }
        }

        QueryRequest source = original.copy();
        drill.getSegments().addAll(source.getSegments());
        drill.getFilters().addAll(source.getFilters());

        for (String dimension : source.getDimensions()) {
            String member = QueryAssembler.localName(cube, dimension, name -> false);
            String qualified = qualified(cube, member);
            Object value = rowValue(values, qualified, qualified, member);
            drill.getFilters().add(value == null
                ? new QueryRequest.Filter(qualified, FilterOperator.NOT_SET.getDeclaredName(), null)
                : new QueryRequest.Filter(qualified, FilterOperator.EQUALS.getDeclaredName(), List.of(value)));
        }

        for (QueryRequest.TimeDimension timeDimension : source.getTimeDimensions()) {
            if (timeDimension.getDimension() == null) {
                continue;
            }
            String member = QueryAssembler.localName(cube, timeDimension.getDimension(), name -> false);
            String qualified = qualified(cube, member);
            if (timeDimension.getDateRange() != null) {
                drill.getTimeDimensions().add(
                    new QueryRequest.TimeDimension(qualified, null, timeDimension.getDateRange()));
            }
            if (timeDimension.getGranularity() == null) {
                continue;
            }
            TimeGrain grain = TimeGrain.fromDeclared(timeDimension.getGranularity());
            if (grain == null) {
                throw new QueryException(QueryException.Kind.INVALID_REQUEST,
                    "unknown granularity '" + timeDimension.getGranularity() + "'");
            }
            Object value = rowValue(values, qualified, qualified + "." + grain.getDeclaredName(),
                DimensionCompiler.grainAlias(member, grain), qualified, member);
            if (value == null) {
                drill.getFilters().add(new QueryRequest.Filter(qualified, FilterOperator.NOT_SET.getDeclaredName(), null));
                continue;
            }
            LocalDateTime bucket = FilterCompiler.time(qualified, value);
            List<Object> range = new ArrayList<>();
            range.add(grain.truncate(bucket).format(DateTimeFormatter.ISO_LOCAL_DATE_TIME));
            range.add(grain.next(bucket).format(DateTimeFormatter.ISO_LOCAL_DATE_TIME));
            drill.getFilters().add(new QueryRequest.Filter(qualified, FilterOperator.IN_DATE_RANGE.getDeclaredName(), range));
        }

        if (!measure.getFilters().isEmpty()) {
            drill.getFilters().add(new QueryRequest.Filter(qualified(cube, measureMember),
                FilterOperator.MEASURE_FILTER.getDeclaredName(), null));
        }
        return drill;
    }

    /**
     * 按候选键依次查找；键存在但值为 null 时返回 null，所有键都不存在时报错
     */
    private static Object rowValue(Map<String, Object> row, String member, String... keys) throws QueryException {
        for (String key : keys) {
            if (row.containsKey(key)) {
                return row.get(key);
            }
        }
        throw new QueryException(QueryException.Kind.INVALID_REQUEST,
            "row has no value for grouping member '" + member + "'");
    }

    private static String qualified(CubeDefinition cube, String member) {
        return cube.getName() + "." + member;
    }
}
