package com.cubelayer.sql;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.*;

class MacroResolverTest {
    private final Function<String, String> aliases =
        Map.of("RadiologyAudits", "radiology_audits", "Users", "users")::get;

    @Test
    void cubeTokenResolvesToCurrentCubeAlias() {
        String sql = MacroResolver.resolve("${CUBE}.final_output = 'CAT5'", aliases, "RadiologyAudits");
        assertEquals("radiology_audits.final_output = 'CAT5'", sql);
    }

    @Test
    void ownNameAndCubeTokenResolveToTheSameAlias() {
        String sql = MacroResolver.resolve("${CUBE}.a = ${RadiologyAudits}.b AND ${ CUBE }.c = 1",
            aliases, "RadiologyAudits");
        assertEquals("radiology_audits.a = radiology_audits.b AND radiology_audits.c = 1", sql);
    }

    @Test
    void otherCubeTokenUsesItsOwnAlias() {
        String sql = MacroResolver.resolve("${CUBE}.user_id = ${Users}.id", aliases, "RadiologyAudits");
        assertEquals("radiology_audits.user_id = users.id", sql);
    }

    @Test
    void missingAliasForCurrentCubeIsAContractViolation() {
        UnresolvedTokenException e = assertThrows(UnresolvedTokenException.class,
            () -> MacroResolver.resolve("${CUBE}.id", name -> null, "RadiologyAudits"));
        assertEquals("CUBE", e.getToken());
        assertTrue(e instanceof IllegalStateException);
    }

    @Test
    void templateWithoutTokensIsReturnedUnchanged() {
        assertEquals("COUNT(*)", MacroResolver.resolve("COUNT(*)", name -> null, "RadiologyAudits"));
        assertNull(MacroResolver.resolve(null, aliases, "RadiologyAudits"));
    }

    @Test
    void memberReferencesAreReplacedAndCubeTokensKept() {
        String sql = MacroResolver.resolveMembers("CAST(${passedUnits} AS DOUBLE PRECISION) / ${CUBE}.x",
            body -> body.equals("passedUnits") ? "SUM(pq.passed_units)" : null);
        assertEquals("CAST(SUM(pq.passed_units) AS DOUBLE PRECISION) / ${CUBE}.x", sql);
    }

    @Test
    void replacementTextWithDollarSignsIsInsertedLiterally() {
        String sql = MacroResolver.resolveMembers("${price}", body -> "'$1'");
        assertEquals("'$1'", sql);
    }

    @Test
    void bareColumnIsQualifiedWithAlias() {
        assertEquals("radiology_audits.quality_score", MacroResolver.qualify("quality_score", "radiology_audits"));
        assertEquals("${CUBE}.modality", MacroResolver.qualify("${CUBE}.modality", "radiology_audits"));
        assertEquals("CASE WHEN a THEN 1 END", MacroResolver.qualify("CASE WHEN a THEN 1 END", "radiology_audits"));
    }

    @Test
    void referenceBodyAcceptsMemberAndQualifiedMember() {
        Matcher qualified = MacroResolver.REFERENCE_BODY.matcher("RadiologyAudits.cat5Count");
        assertTrue(qualified.matches());
        assertEquals("RadiologyAudits", qualified.group(1));
        assertEquals("cat5Count", qualified.group(2));

        Matcher bare = MacroResolver.REFERENCE_BODY.matcher("count");
        assertTrue(bare.matches());
        assertNull(bare.group(2));

        assertFalse(MacroResolver.REFERENCE_BODY.matcher("a.b.c").matches());
        assertEquals(List.of("CUBE", "Users.id"), MacroResolver.tokens("${CUBE}.user_id = ${ Users.id }"));
    }
}
