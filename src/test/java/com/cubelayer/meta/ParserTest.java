package com.cubelayer.meta;

import com.cubelayer.CubeFixtures;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ParserTest {

    /**
     * 解析随项目发布的 model/cubes 声明
     */
    @Test
    void parsesShippedDeclarations() throws IOException {
        Parser parser = new Parser("./model/cubes");
        List<Path> files = parser.listFiles();
        assertEquals(2, files.size());
        assertTrue(files.get(0).getFileName().toString().startsWith("production_quality"));

        CubeSchema radiology = parser.parse(files.get(1));
        CubeDeclaration cube = radiology.getCubes().get(0);
        assertEquals("RadiologyAudits", cube.getName());
        assertEquals("SELECT * FROM medical.radiology_audits", cube.getSql());
        assertEquals(23, cube.getMeasures().size());
        assertEquals(26, cube.getDimensions().size());
        assertEquals(6, cube.getSegments().size());
        assertEquals(files.get(1).toString(), cube.getSource());
    }

    @Test
    void acceptsSnakeCaseSpellingsInJson() throws IOException {
        Path file = Paths.get(CubeFixtures.DECLARATIONS_DIR, "broken_drill.json");
        CubeDeclaration cube = new Parser(file).parse(file).getCubes().get(0);

        assertEquals("medical.radiology_audits", cube.getSqlTable());
        assertNull(cube.getSql());
        assertEquals(List.of("caseId", "missingMember"), cube.getMeasures().get(0).getDrillMembers());
        assertTrue(cube.getDimensions().get(0).isPrimaryKey());
    }

    @Test
    void singleFilePathListsOnlyThatFile() throws IOException {
        Parser parser = new Parser(CubeFixtures.PRODUCTION_FILE);
        assertEquals(List.of(Paths.get(CubeFixtures.PRODUCTION_FILE)), parser.listFiles());
    }

    @Test
    void missingPathIsAnIoError() {
        assertThrows(IOException.class, () -> new Parser("./model/nowhere").listFiles());
    }

    @Test
    void unknownDeclarationFieldsAreIgnored() throws IOException {
        CubeSchema schema = new Parser(".").parseYaml(""
            + "cubes:\n"
            + "  - name: Orders\n"
            + "    sql_table: public.orders\n"
            + "    preAggregations:\n"
            + "      main: {type: rollup}\n"
            + "    refreshKey: {every: 1 hour}\n");
        assertEquals("Orders", schema.getCubes().get(0).getName());
    }
}
