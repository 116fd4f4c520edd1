package com.cubelayer.meta;

import com.cubelayer.model.AggregationKind;
import com.cubelayer.model.DisplayFormat;
import com.cubelayer.model.PrimaryKeyPolicy;
import com.cubelayer.model.Relationship;
import com.cubelayer.model.ValueType;
import com.cubelayer.sql.MacroResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 立方体声明校验：语法、引用、主键三个阶段针对单个立方体，
 * 关联（joins）阶段需要已通过校验的立方体集合，由 {@link SchemaModel} 单独调用。
 */
public class Validator {
    private static final Logger logger = LoggerFactory.getLogger(Validator.class);

    private static final Pattern NAME_PATTERN = Pattern.compile("^[\\p{L}][\\p{L}\\p{N}_]*$");

    private final PrimaryKeyPolicy primaryKeyPolicy;

    public Validator(PrimaryKeyPolicy primaryKeyPolicy) {
        this.primaryKeyPolicy = primaryKeyPolicy != null ? primaryKeyPolicy : PrimaryKeyPolicy.REQUIRED;
    }

    public void validate(CubeDeclaration cube) throws ValidationException {
        validateSyntax(cube);
        validateReferences(cube);
        validatePrimaryKey(cube);
    }

    private void validateSyntax(CubeDeclaration cube) throws ValidationException {
        String cubeName = cube.getName();
        if (cubeName == null || cubeName.isEmpty()) {
            throw new ValidationException(Kind.MISSING_REQUIRED_FIELD, null,
                "cube name is required" + sourceSuffix(cube));
        }
        if (!isValidName(cubeName)) {
            throw new ValidationException(Kind.INVALID_NAME, cubeName, "invalid cube name format '" + cubeName + "'");
        }

        boolean hasSql = !isBlank(cube.getSql());
        boolean hasTable = !isBlank(cube.getSqlTable());
        if (!hasSql && !hasTable) {
            throw new ValidationException(Kind.MISSING_REQUIRED_FIELD, cubeName,
                "cube '" + cubeName + "': sql or sql_table is required");
        }
        if (hasSql && hasTable) {
            throw new ValidationException(Kind.INVALID_SOURCE, cubeName,
                "cube '" + cubeName + "': only one of sql and sql_table may be declared");
        }

        // 度量与维度共享同一个命名空间
        Set<String> memberNames = new HashSet<>();
        List<MeasureDeclaration> measures = nullToEmpty(cube.getMeasures());
        for (int i = 0; i < measures.size(); i++) {
            MeasureDeclaration measure = measures.get(i);
            String path = "cube '" + cubeName + "'.measures[" + i + "]";
            requireEntry(cubeName, path, measure);
            checkMemberName(cubeName, path, measure.getName(), memberNames);
            path = "cube '" + cubeName + "'.measure '" + measure.getName() + "'";

            AggregationKind kind = AggregationKind.fromDeclared(measure.getType());
            if (kind == null) {
                throw new ValidationException(Kind.INVALID_AGGREGATION_KIND, cubeName,
                    path + ": invalid type '" + measure.getType() + "'");
            }
            if (kind != AggregationKind.COUNT && isBlank(measure.getSql())) {
                throw new ValidationException(Kind.MISSING_REQUIRED_FIELD, cubeName,
                    path + ": sql is required for type '" + kind.getDeclaredName() + "'");
            }
            List<FilterDeclaration> filters = nullToEmpty(measure.getFilters());
            if (kind == AggregationKind.NUMBER && !filters.isEmpty()) {
                throw new ValidationException(Kind.INVALID_AGGREGATION_KIND, cubeName,
                    path + ": filters are not supported on type 'number'");
            }
            for (int j = 0; j < filters.size(); j++) {
                if (filters.get(j) == null || isBlank(filters.get(j).getSql())) {
                    throw new ValidationException(Kind.MISSING_REQUIRED_FIELD, cubeName,
                        path + ".filters[" + j + "]: sql is required");
                }
            }
            checkFormat(cubeName, path, measure.getFormat(), true);
        }

        List<DimensionDeclaration> dimensions = nullToEmpty(cube.getDimensions());
        for (int i = 0; i < dimensions.size(); i++) {
            DimensionDeclaration dimension = dimensions.get(i);
            String path = "cube '" + cubeName + "'.dimensions[" + i + "]";
            requireEntry(cubeName, path, dimension);
            checkMemberName(cubeName, path, dimension.getName(), memberNames);
            path = "cube '" + cubeName + "'.dimension '" + dimension.getName() + "'";

            if (ValueType.fromDeclared(dimension.getType()) == null) {
                throw new ValidationException(Kind.INVALID_VALUE_TYPE, cubeName,
                    path + ": invalid type '" + dimension.getType() + "'");
            }
            if (isBlank(dimension.getSql())) {
                throw new ValidationException(Kind.MISSING_REQUIRED_FIELD, cubeName, path + ": sql is required");
            }
            checkFormat(cubeName, path, dimension.getFormat(), false);
        }

        Set<String> segmentNames = new HashSet<>();
        List<SegmentDeclaration> segments = nullToEmpty(cube.getSegments());
        for (int i = 0; i < segments.size(); i++) {
            SegmentDeclaration segment = segments.get(i);
            String path = "cube '" + cubeName + "'.segments[" + i + "]";
            requireEntry(cubeName, path, segment);
            checkMemberName(cubeName, path, segment.getName(), segmentNames);
            if (isBlank(segment.getSql())) {
                throw new ValidationException(Kind.MISSING_REQUIRED_FIELD, cubeName,
                    "cube '" + cubeName + "'.segment '" + segment.getName() + "': sql is required");
            }
        }

        Set<String> joinTargets = new HashSet<>();
        List<JoinDeclaration> joins = nullToEmpty(cube.getJoins());
        for (int i = 0; i < joins.size(); i++) {
            JoinDeclaration join = joins.get(i);
            String path = "cube '" + cubeName + "'.joins[" + i + "]";
            requireEntry(cubeName, path, join);
            if (isBlank(join.getName())) {
                throw new ValidationException(Kind.MISSING_REQUIRED_FIELD, cubeName, path + ": name is required");
            }
            if (join.getName().equals(cubeName)) {
                throw new ValidationException(Kind.INVALID_JOIN, cubeName, path + ": a cube cannot join itself");
            }
            if (!joinTargets.add(join.getName())) {
                throw new ValidationException(Kind.DUPLICATE_NAME, cubeName,
                    "duplicate join to '" + join.getName() + "' in cube '" + cubeName + "'");
            }
            if (Relationship.fromDeclared(join.getRelationship()) == null) {
                throw new ValidationException(Kind.INVALID_JOIN, cubeName,
                    path + ": invalid relationship '" + join.getRelationship() + "'");
            }
            if (isBlank(join.getSql())) {
                throw new ValidationException(Kind.INVALID_JOIN, cubeName, path + ": sql is required");
            }
        }
    }

    private void validateReferences(CubeDeclaration cube) throws ValidationException {
        String cubeName = cube.getName();
        Set<String> measureNames = new HashSet<>();
        for (MeasureDeclaration measure : nullToEmpty(cube.getMeasures())) {
            measureNames.add(measure.getName());
        }
        Set<String> dimensionNames = new HashSet<>();
        for (DimensionDeclaration dimension : nullToEmpty(cube.getDimensions())) {
            dimensionNames.add(dimension.getName());
        }
        Set<String> joined = joinTargets(cube);

        // 成员之间的引用图，用于检测循环
        Map<String, Set<String>> graph = new LinkedHashMap<>();

        for (MeasureDeclaration measure : nullToEmpty(cube.getMeasures())) {
            String owner = "measure '" + measure.getName() + "'";
            boolean numberMeasure = AggregationKind.fromDeclared(measure.getType()) == AggregationKind.NUMBER;
            Set<String> refs = new LinkedHashSet<>();
            checkTemplate(cubeName, owner, measure.getSql(), numberMeasure, measureNames, dimensionNames, joined, refs);
            for (FilterDeclaration filter : nullToEmpty(measure.getFilters())) {
                checkTemplate(cubeName, owner + " filter", filter.getSql(), false,
                    measureNames, dimensionNames, joined, refs);
            }
            graph.put(measure.getName(), refs);

            for (String drillMember : nullToEmpty(measure.getDrillMembers())) {
                checkDrillMember(cubeName, owner, drillMember, measureNames, dimensionNames, joined);
            }
        }

        for (DimensionDeclaration dimension : nullToEmpty(cube.getDimensions())) {
            Set<String> refs = new LinkedHashSet<>();
            checkTemplate(cubeName, "dimension '" + dimension.getName() + "'", dimension.getSql(), false,
                measureNames, dimensionNames, joined, refs);
            graph.put(dimension.getName(), refs);
        }

        for (SegmentDeclaration segment : nullToEmpty(cube.getSegments())) {
            checkTemplate(cubeName, "segment '" + segment.getName() + "'", segment.getSql(), false,
                measureNames, dimensionNames, joined, new LinkedHashSet<>());
        }

        checkCycles(cubeName, graph);
    }

    /**
     * 关联阶段：目标立方体必须存在于当前有效集合中，跨立方体的成员引用必须能在目标中找到
     */
    public void validateJoins(CubeDeclaration cube, Map<String, CubeDeclaration> activeCubes) throws ValidationException {
        String cubeName = cube.getName();
        for (JoinDeclaration join : nullToEmpty(cube.getJoins())) {
            if (!activeCubes.containsKey(join.getName())) {
                throw new ValidationException(Kind.DANGLING_REFERENCE, cubeName,
                    "cube '" + cubeName + "': join target '" + join.getName() + "' does not exist");
            }
            checkJoinedReferences(cube, "join '" + join.getName() + "'", join.getSql(), activeCubes);
        }

        for (MeasureDeclaration measure : nullToEmpty(cube.getMeasures())) {
            String owner = "measure '" + measure.getName() + "'";
            checkJoinedReferences(cube, owner, measure.getSql(), activeCubes);
            for (FilterDeclaration filter : nullToEmpty(measure.getFilters())) {
                checkJoinedReferences(cube, owner + " filter", filter.getSql(), activeCubes);
            }
            for (String drillMember : nullToEmpty(measure.getDrillMembers())) {
                int dot = drillMember.indexOf('.');
                if (dot > 0) {
                    checkJoinedMember(cube, owner + " drill member", drillMember.substring(0, dot),
                        drillMember.substring(dot + 1), activeCubes);
                }
            }
        }
        for (DimensionDeclaration dimension : nullToEmpty(cube.getDimensions())) {
            checkJoinedReferences(cube, "dimension '" + dimension.getName() + "'", dimension.getSql(), activeCubes);
        }
        for (SegmentDeclaration segment : nullToEmpty(cube.getSegments())) {
            checkJoinedReferences(cube, "segment '" + segment.getName() + "'", segment.getSql(), activeCubes);
        }
    }

    private void validatePrimaryKey(CubeDeclaration cube) throws ValidationException {
        long primaryKeys = nullToEmpty(cube.getDimensions()).stream()
            .filter(DimensionDeclaration::isPrimaryKey)
            .count();
        if (primaryKeys > 1) {
            throw new ValidationException(Kind.AMBIGUOUS_PRIMARY_KEY, cube.getName(),
                "cube '" + cube.getName() + "': " + primaryKeys + " dimensions are marked primaryKey, at most one is allowed");
        }
        if (primaryKeys == 0) {
            if (primaryKeyPolicy == PrimaryKeyPolicy.REQUIRED) {
                throw new ValidationException(Kind.MISSING_PRIMARY_KEY, cube.getName(),
                    "cube '" + cube.getName() + "': no dimension is marked primaryKey");
            }
            logger.warn("Cube '{}' declares no primary key dimension", cube.getName());
        }
    }

    private void checkTemplate(String cubeName, String owner, String template, boolean measuresAllowed,
                               Set<String> measureNames, Set<String> dimensionNames, Set<String> joined,
                               Set<String> memberRefs) throws ValidationException {
        if (template == null) {
            return;
        }
        Matcher matcher = MacroResolver.REFERENCE_PATTERN.matcher(template);
        while (matcher.find()) {
            String body = matcher.group(1).trim();
            Matcher bodyMatcher = MacroResolver.REFERENCE_BODY.matcher(body);
            if (!bodyMatcher.matches()) {
                throw new ValidationException(Kind.INVALID_REFERENCE, cubeName,
                    "cube '" + cubeName + "'." + owner + ": malformed reference '${" + body + "}'");
            }
            String head = bodyMatcher.group(1);
            String tail = bodyMatcher.group(2);
            boolean selfHead = MacroResolver.CUBE_TOKEN.equals(head) || cubeName.equals(head);

            String member;
            if (tail == null) {
                if (selfHead || joined.contains(head)) {
                    continue;
                }
                member = head;
            } else if (selfHead) {
                member = tail;
            } else if (joined.contains(head)) {
                // 在关联阶段校验
                continue;
            } else {
                throw new ValidationException(Kind.DANGLING_REFERENCE, cubeName,
                    "cube '" + cubeName + "'." + owner + ": reference '${" + body + "}' names an unknown cube");
            }

            if (measureNames.contains(member)) {
                if (!measuresAllowed) {
                    throw new ValidationException(Kind.INVALID_REFERENCE, cubeName,
                        "cube '" + cubeName + "'." + owner + ": measure '" + member
                            + "' can only be referenced from a number measure");
                }
                memberRefs.add(member);
            } else if (dimensionNames.contains(member)) {
                memberRefs.add(member);
            } else {
                throw new ValidationException(Kind.DANGLING_REFERENCE, cubeName,
                    "cube '" + cubeName + "'." + owner + ": reference '${" + body + "}' does not exist");
            }
        }
    }

    private void checkDrillMember(String cubeName, String owner, String drillMember,
                                  Set<String> measureNames, Set<String> dimensionNames,
                                  Set<String> joined) throws ValidationException {
        Matcher matcher = drillMember != null ? MacroResolver.REFERENCE_BODY.matcher(drillMember) : null;
        if (matcher == null || !matcher.matches()) {
            throw new ValidationException(Kind.INVALID_REFERENCE, cubeName,
                "cube '" + cubeName + "'." + owner + ": malformed drill member '" + drillMember + "'");
        }
        String head = matcher.group(1);
        String tail = matcher.group(2);
        String member;
        if (tail == null) {
            member = head;
        } else if (cubeName.equals(head)) {
            member = tail;
        } else if (joined.contains(head)) {
            return;
        } else {
            throw new ValidationException(Kind.DANGLING_REFERENCE, cubeName,
                "cube '" + cubeName + "'." + owner + ": drill member '" + drillMember + "' names an unknown cube");
        }
        if (!measureNames.contains(member) && !dimensionNames.contains(member)) {
            throw new ValidationException(Kind.DANGLING_REFERENCE, cubeName,
                "cube '" + cubeName + "'." + owner + ": drill member '" + drillMember + "' does not exist");
        }
    }

    private void checkJoinedReferences(CubeDeclaration cube, String owner, String template,
                                       Map<String, CubeDeclaration> activeCubes) throws ValidationException {
        if (template == null) {
            return;
        }
        Set<String> joined = joinTargets(cube);
        Matcher matcher = MacroResolver.REFERENCE_PATTERN.matcher(template);
        while (matcher.find()) {
            Matcher bodyMatcher = MacroResolver.REFERENCE_BODY.matcher(matcher.group(1).trim());
            if (bodyMatcher.matches() && bodyMatcher.group(2) != null && joined.contains(bodyMatcher.group(1))) {
                checkJoinedMember(cube, owner, bodyMatcher.group(1), bodyMatcher.group(2), activeCubes);
            }
        }
    }

    private void checkJoinedMember(CubeDeclaration cube, String owner, String targetCube, String member,
                                   Map<String, CubeDeclaration> activeCubes) throws ValidationException {
        if (targetCube.equals(cube.getName())) {
            return;
        }
        CubeDeclaration target = activeCubes.get(targetCube);
        if (target == null || !joinTargets(cube).contains(targetCube)) {
            throw new ValidationException(Kind.DANGLING_REFERENCE, cube.getName(),
                "cube '" + cube.getName() + "'." + owner + ": cube '" + targetCube + "' is not joined");
        }
        boolean exists = nullToEmpty(target.getMeasures()).stream().anyMatch(m -> member.equals(m.getName()))
            || nullToEmpty(target.getDimensions()).stream().anyMatch(d -> member.equals(d.getName()));
        if (!exists) {
            throw new ValidationException(Kind.DANGLING_REFERENCE, cube.getName(),
                "cube '" + cube.getName() + "'." + owner + ": member '" + targetCube + "." + member + "' does not exist");
        }
    }

    private void checkCycles(String cubeName, Map<String, Set<String>> graph) throws ValidationException {
        Map<String, Integer> state = new HashMap<>();
        for (String member : graph.keySet()) {
            visit(cubeName, member, graph, state, new ArrayDeque<>());
        }
    }

    private void visit(String cubeName, String member, Map<String, Set<String>> graph,
                       Map<String, Integer> state, Deque<String> path) throws ValidationException {
        Integer current = state.get(member);
        if (current != null && current == 2) {
            return;
        }
        path.addLast(member);
        if (current != null && current == 1) {
            throw new ValidationException(Kind.CIRCULAR_REFERENCE, cubeName,
                "cube '" + cubeName + "': circular reference " + String.join(" -> ", path));
        }
        state.put(member, 1);
        for (String next : graph.getOrDefault(member, Set.of())) {
            visit(cubeName, next, graph, state, path);
        }
        state.put(member, 2);
        path.removeLast();
    }

    private static void requireEntry(String cubeName, String path, Object entry) throws ValidationException {
        if (entry == null) {
            throw new ValidationException(Kind.MISSING_REQUIRED_FIELD, cubeName, path + ": entry is empty");
        }
    }

    private void checkMemberName(String cubeName, String path, String name, Set<String> seen)
            throws ValidationException {
        if (name == null || name.isEmpty()) {
            throw new ValidationException(Kind.MISSING_REQUIRED_FIELD, cubeName, path + ": name is required");
        }
        if (!isValidName(name)) {
            throw new ValidationException(Kind.INVALID_NAME, cubeName, path + ": invalid name format '" + name + "'");
        }
        if (!seen.add(name)) {
            throw new ValidationException(Kind.DUPLICATE_NAME, cubeName,
                "duplicate member name '" + name + "' in cube '" + cubeName + "'");
        }
    }

    private void checkFormat(String cubeName, String path, String format, boolean measure) throws ValidationException {
        if (format == null) {
            return;
        }
        DisplayFormat displayFormat = DisplayFormat.fromDeclared(format);
        if (displayFormat == null || (measure && !displayFormat.isAllowedOnMeasures())) {
            throw new ValidationException(Kind.INVALID_FORMAT, cubeName, path + ": invalid format '" + format + "'");
        }
    }

    private static Set<String> joinTargets(CubeDeclaration cube) {
        Set<String> joined = new HashSet<>();
        for (JoinDeclaration join : nullToEmpty(cube.getJoins())) {
            joined.add(join.getName());
        }
        return joined;
    }

    private static String sourceSuffix(CubeDeclaration cube) {
        return cube.getSource() != null ? " (" + cube.getSource() + ")" : "";
    }

    private static boolean isValidName(String name) {
        return name != null && NAME_PATTERN.matcher(name).matches();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static <T> List<T> nullToEmpty(List<T> list) {
        return list != null ? list : List.of();
    }

    public enum Kind {
        DUPLICATE_NAME,
        DANGLING_REFERENCE,
        MISSING_PRIMARY_KEY,
        AMBIGUOUS_PRIMARY_KEY,
        INVALID_AGGREGATION_KIND,
        INVALID_VALUE_TYPE,
        INVALID_FORMAT,
        INVALID_NAME,
        INVALID_SOURCE,
        MISSING_REQUIRED_FIELD,
        INVALID_JOIN,
        INVALID_REFERENCE,
        CIRCULAR_REFERENCE,
        UNREADABLE_DECLARATION
    }

    public static class ValidationException extends Exception {
        private final Kind kind;
        private final String cubeName;

        public ValidationException(Kind kind, String cubeName, String message) {
            super(message);
            this.kind = kind;
            this.cubeName = cubeName;
        }

        public ValidationException(Kind kind, String cubeName, String message, Throwable cause) {
            super(message, cause);
            this.kind = kind;
            this.cubeName = cubeName;
        }

        public Kind getKind() {
            return kind;
        }

        /**
         * 出错的立方体名称；声明无法读取或缺少名称时为 null
         */
        public String getCubeName() {
            return cubeName;
        }
    }
}
