package com.catalog.crawler;

import com.catalog.crawler.compiler.PrerequisiteCanonicalizer;
import com.catalog.crawler.compiler.PrerequisiteCompiler;
import com.catalog.crawler.domain.PrerequisiteModels.ClauseSet;
import com.catalog.crawler.domain.PrerequisiteModels.CourseClause;
import com.catalog.crawler.domain.PrerequisiteModels.Operator;
import com.catalog.crawler.domain.PrerequisiteModels.Prerequisites;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class PrerequisiteCompilerTest {
    @Autowired
    private PrerequisiteCompiler compiler;
    @Autowired
    private PrerequisiteCanonicalizer canonicalizer;

    private Prerequisites compile(String text) {
        return compiler.compile("CS 3600", text).prerequisites();
    }

    private static CourseClause course(String id) {
        return new CourseClause(id, null);
    }

    @Test
    void testScoreWithMinimumClauseCompilesCleanly() {
        var result = compiler.compile("MATH 1551", "MATH 1113 or SAT Mathematics 600 Minimum Score of 600");
        assertTrue(result.clean());
        assertEquals("and(MATH 1113)", result.prerequisites().render());
    }

    @Test
    void flattensNestedConjunctions() {
        Prerequisites chained = compile("CS 1331 and CS 1332 and CS 2110");
        Prerequisites grouped = compile("CS 1331 and (CS 1332 and CS 2110)");

        Prerequisites expected = Prerequisites.of(ClauseSet.of(Operator.AND, course("CS 1331"), course("CS 1332"), course("CS 2110")));
        assertEquals(expected, chained);
        assertEquals(expected, grouped);
    }

    @Test
    void andBindsTighterThanOr() {
        Prerequisites result = compile("CS 1331 and CS 1332 or CS 2110");
        assertEquals(Prerequisites.of(ClauseSet.of(Operator.OR,
                ClauseSet.of(Operator.AND, course("CS 1331"), course("CS 1332")),
                course("CS 2110"))), result);
        assertEquals("or(and(CS 1331,CS 1332),CS 2110)", result.render());
    }

    @Test
    void wrapsSingleCourseInConjunction() {
        Prerequisites result = compile("CS 1331");
        assertEquals(Prerequisites.of(ClauseSet.of(Operator.AND, course("CS 1331"))), result);
    }

    @Test
    void emptyAndTestOnlyTextHaveNoPrerequisites() {
        var empty = compiler.compile("CS 1100", "");
        assertTrue(empty.prerequisites().isEmpty());
        assertTrue(empty.errors().isEmpty());

        var testOnly = compiler.compile("MATH 1551", "SAT Mathematics 600");
        assertTrue(testOnly.prerequisites().isEmpty());
        assertTrue(testOnly.errors().isEmpty());

        assertTrue(compiler.compile("MATH 1551", null).prerequisites().isEmpty());
    }

    @Test
    void ignoredTestAlternativeLeavesCourse() {
        assertEquals("and(MATH 1113)", compile("MATH 1113 or Math Placement Test 70").render());
    }

    @Test
    void attachesMinimumGrade() {
        Prerequisites result = compile("MATH 1552 minimum grade of C");
        assertEquals(List.of(new CourseClause("MATH 1552", "C")), result.clause().children());
        assertEquals(Operator.AND, result.clause().operator());
    }

    @Test
    void compilesRegistrarPhrasing() {
        Prerequisites result = compile("Undergraduate Semester level CS 1331 Minimum Grade of C and "
                + "(Undergraduate Semester level CS 2340 Minimum Grade of C or Undergraduate Semester level CS 2110 Minimum Grade of D)");
        assertEquals("and(CS 1331[C],or(CS 2340[C],CS 2110[D]))", result.render());
    }

    @Test
    void compilesLeadingGradePhrase() {
        Prerequisites result = compile("CS 1331 and (CS 2340 or CS 2110) and minimum grade of C in MATH 1552");
        assertEquals("and(CS 1331,or(CS 2340,CS 2110),MATH 1552[C])", result.render());
    }

    @Test
    void recoversFromUnmatchedParenthesis() {
        var result = assertDoesNotThrow(() -> compiler.compile("CS 3510", "CS 1331 and (CS 2340 or CS 2110"));
        assertEquals("and(CS 1331,or(CS 2340,CS 2110))", result.prerequisites().render());
        assertEquals(1, result.errors().size());
        assertEquals("SYNTAX_ERROR", result.errors().get(0).code());
        assertFalse(result.clean());
    }

    @Test
    void garbageDegradesToNoPrerequisites() {
        var result = assertDoesNotThrow(() -> compiler.compile("CS 3510", "see department ) ( and or"));
        assertTrue(result.prerequisites().isEmpty());
        assertFalse(result.errors().isEmpty());
    }

    @Test
    void canonicalizingIsIdempotent() {
        for (String text : List.of("CS 1331", "CS 1331 and CS 1332 or CS 2110", "CS 1331 and (CS 2340 or (CS 2110 or CS 1332))", "")) {
            Prerequisites once = compile(text);
            assertEquals(once, canonicalizer.canonicalize(once), text);
        }
    }

    @Test
    void canonicalizerDropsEmptySetsAndCollapsesSingletons() {
        ClauseSet raw = new ClauseSet(Operator.AND, List.of(
                new ClauseSet(Operator.OR, List.of()),
                new ClauseSet(Operator.OR, List.of(course("CS 1331"))),
                new ClauseSet(Operator.AND, List.of(course("CS 1332"), course("CS 2110")))));
        assertEquals("and(CS 1331,CS 1332,CS 2110)", canonicalizer.canonicalize(raw).render());

        assertTrue(canonicalizer.canonicalize(new ClauseSet(Operator.OR, List.of())).isEmpty());
    }

    @Test
    void keepsSourceOrderAndDuplicates() {
        assertEquals("or(CS 2110,CS 1331,CS 2110)", compile("CS 2110 or CS 1331 or CS 2110").render());
    }
}
