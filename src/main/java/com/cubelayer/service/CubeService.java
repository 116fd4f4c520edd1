package com.cubelayer.service;

import com.cubelayer.meta.Loader;
import com.cubelayer.meta.SchemaModel;
import com.cubelayer.meta.Validator;
import com.cubelayer.model.CubeDefinition;
import com.cubelayer.model.DimensionDefinition;
import com.cubelayer.model.DisplayFormat;
import com.cubelayer.model.JoinDefinition;
import com.cubelayer.model.MeasureDefinition;
import com.cubelayer.model.SegmentDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 立方体元数据，输出结构与 Cube.js 的 /meta 接口一致（成员名带立方体前缀）
 */
@Service
public class CubeService {
    private static final Logger logger = LoggerFactory.getLogger(CubeService.class);

    private final Loader loader;

    public CubeService(Loader loader) {
        this.loader = loader;
    }

    public List<Map<String, Object>> listCubes() {
        List<Map<String, Object>> cubes = new ArrayList<>();
        for (CubeDefinition cube : loader.listCubes()) {
            cubes.add(describe(cube));
        }
        return cubes;
    }

    public Map<String, Object> getCube(String name) throws Loader.NotFoundException {
        return describe(loader.getCube(name));
    }

    /**
     * 重新加载声明并原子替换快照，返回加载报告
     */
    public Map<String, Object> reload() throws IOException {
        SchemaModel schema = loader.reload();
        logger.info("Cube declarations reloaded at {}", schema.getLoadedAt());
        return loadReport(schema);
    }

    public Map<String, Object> loadReport() {
        return loadReport(loader.getSchema());
    }

    private Map<String, Object> loadReport(SchemaModel schema) {
        List<String> active = new ArrayList<>();
        for (CubeDefinition cube : schema.getCubes()) {
            active.add(cube.getName());
        }
        List<Map<String, Object>> rejected = new ArrayList<>();
        for (Validator.ValidationException e : schema.getRejected()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("cube", e.getCubeName());
            entry.put("kind", e.getKind().name());
            entry.put("message", e.getMessage());
            rejected.add(entry);
        }
        Map<String, Object> report = new LinkedHashMap<>();
        report.put("loadedAt", schema.getLoadedAt().toString());
        report.put("active", active);
        report.put("rejected", rejected);
        return report;
    }

    Map<String, Object> describe(CubeDefinition cube) {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("name", cube.getName());
        result.put("title", cube.getTitle());
        result.put("description", cube.getDescription());

        List<Map<String, Object>> measures = new ArrayList<>();
        for (MeasureDefinition measure : cube.getMeasures().values()) {
            Map<String, Object> item = new LinkedHashMap<>();
            item.put("name", cube.getName() + "." + measure.getName());
            item.put("title", measure.getTitle());
            item.put("description", measure.getDescription());
            item.put("type", "number");
            item.put("aggType", measure.getAggregationKind().getDeclaredName());
            item.put("format", formatName(measure.getFormat()));
            List<String> drillMembers = new ArrayList<>();
            for (String drillMember : measure.getDrillMembers()) {
                drillMembers.add(drillMember.indexOf('.') > 0 ? drillMember : cube.getName() + "." + drillMember);
            }
            item.put("drillMembers", drillMembers);
            item.put("filtered", !measure.getFilters().isEmpty());
            measures.add(item);
        }
        result.put("measures", measures);

        List<Map<String, Object>> dimensions = new ArrayList<>();
        for (DimensionDefinition dimension : cube.getDimensions().values()) {
            Map<String, Object> item = new LinkedHashMap<>();
            item.put("name", cube.getName() + "." + dimension.getName());
            item.put("title", dimension.getTitle());
            item.put("description", dimension.getDescription());
            item.put("type", dimension.getValueType().getDeclaredName());
            item.put("format", formatName(dimension.getFormat()));
            item.put("primaryKey", dimension.isPrimaryKey());
            dimensions.add(item);
        }
        result.put("dimensions", dimensions);

        List<Map<String, Object>> segments = new ArrayList<>();
        for (SegmentDefinition segment : cube.getSegments().values()) {
            Map<String, Object> item = new LinkedHashMap<>();
            item.put("name", cube.getName() + "." + segment.getName());
            item.put("title", segment.getTitle());
            segments.add(item);
        }
        result.put("segments", segments);

        List<Map<String, Object>> joins = new ArrayList<>();
        for (JoinDefinition join : cube.getJoins().values()) {
            Map<String, Object> item = new LinkedHashMap<>();
            item.put("name", join.getTargetCube());
            item.put("relationship", join.getRelationship().getDeclaredName());
            joins.add(item);
        }
        result.put("joins", joins);
        return result;
    }

    private static String formatName(DisplayFormat format) {
        return format != null ? format.getDeclaredName() : null;
    }
}
