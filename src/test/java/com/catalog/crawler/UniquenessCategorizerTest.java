package com.catalog.crawler;

import com.catalog.crawler.categorize.ClauseHasher;
import com.catalog.crawler.categorize.PrimaryInstructorPolicy;
import com.catalog.crawler.categorize.UniquenessCategorizer;
import com.catalog.crawler.domain.DomainModels.Course;
import com.catalog.crawler.domain.DomainModels.CourseCategory;
import com.catalog.crawler.domain.DomainModels.Section;
import com.catalog.crawler.domain.DomainModels.TermData;
import com.catalog.crawler.domain.PrerequisiteModels.ClauseSet;
import com.catalog.crawler.domain.PrerequisiteModels.CourseClause;
import com.catalog.crawler.domain.PrerequisiteModels.Operator;
import com.catalog.crawler.domain.PrerequisiteModels.Prerequisites;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class UniquenessCategorizerTest {
    private final ClauseHasher hasher = new ClauseHasher(new ObjectMapper());
    private final UniquenessCategorizer categorizer =
            new UniquenessCategorizer(hasher, new PrimaryInstructorPolicy("(P)", "TBA"));

    private static Prerequisites requires(String courseId) {
        return Prerequisites.of(ClauseSet.of(Operator.AND, new CourseClause(courseId, null)));
    }

    private static Section section(String crn, String instructor, Prerequisites prerequisites) {
        return new Section(crn, List.of(instructor), prerequisites);
    }

    private static TermData term(Section... sections) {
        Map<String, Section> byLabel = new LinkedHashMap<>();
        for (int i = 0; i < sections.length; i++) {
            byLabel.put("A" + (i + 1), sections[i]);
        }
        return new TermData("202308", Map.of("CS 2340", new Course("CS 2340", "Objects and Design", byLabel, List.of(), null)));
    }

    @Test
    void identicalSectionsAreUniform() {
        TermData data = term(
                section("10001", "Ann Lee", requires("CS 1331")),
                section("10002", "Ann Lee", requires("CS 1331")),
                section("10003", "Bo Park", requires("CS 1331")));
        assertEquals(Map.of("CS 2340", CourseCategory.UNIFORM), categorizer.categorize(data));
    }

    @Test
    void sectionsWithoutPrerequisitesAreUniform() {
        TermData data = term(
                section("10001", "Ann Lee", Prerequisites.NONE),
                section("10002", "Bo Park", Prerequisites.NONE));
        assertEquals(CourseCategory.UNIFORM, categorizer.categorize(data).get("CS 2340"));
    }

    @Test
    void differencesAcrossInstructorsOnlyAreTierOne() {
        TermData data = term(
                section("10001", "Ann Lee", requires("CS 1331")),
                section("10002", "Ann Lee", requires("CS 1331")),
                section("10003", "Bo Park", requires("CS 1332")));
        var report = categorizer.report(data);
        assertEquals(CourseCategory.INSTRUCTOR_CONSISTENT, report.categories().get("CS 2340"));
        assertEquals(1, report.categories().get("CS 2340").tier());
        assertTrue(report.conflicts().isEmpty());
    }

    @Test
    void instructorWithDifferingSectionsIsTierTwo() {
        TermData data = term(
                section("10001", "Ann Lee", requires("CS 1331")),
                section("10002", "Ann Lee", requires("CS 1332")),
                section("10003", "Bo Park", requires("CS 1332")));
        var report = categorizer.report(data);
        assertEquals(CourseCategory.INSTRUCTOR_INCONSISTENT, report.categories().get("CS 2340"));

        assertEquals(1, report.conflicts().size());
        var conflict = report.conflicts().get(0);
        assertEquals("CS 2340", conflict.courseId());
        assertEquals("Ann Lee", conflict.instructor());
        assertEquals(List.of("10001"), conflict.sectionsByHash().get(hasher.hash(requires("CS 1331"))));
        assertEquals(List.of("10002"), conflict.sectionsByHash().get(hasher.hash(requires("CS 1332"))));
    }

    @Test
    void multiInstructorSectionsAreAttributedToPrimary() {
        TermData data = term(
                new Section("10001", List.of("Bo Park", "Ann Lee (P)"), requires("CS 1331")),
                new Section("10002", List.of("Ann Lee (P)", "Cy Diaz"), requires("CS 1332")),
                section("10003", "Bo Park", requires("CS 1332")));
        assertEquals(CourseCategory.INSTRUCTOR_INCONSISTENT, categorizer.categorize(data).get("CS 2340"));
    }

    @Test
    void unflaggedCoTaughtSectionsFallBackToFirstListed() {
        TermData data = term(
                new Section("10001", List.of("Bo Park", "Ann Lee"), requires("CS 1331")),
                section("10002", "Ann Lee", requires("CS 1332")));
        assertEquals(CourseCategory.INSTRUCTOR_CONSISTENT, categorizer.categorize(data).get("CS 2340"));
    }

    @Test
    void annotateSetsCategoryOnCopy() {
        TermData data = term(
                section("10001", "Ann Lee", requires("CS 1331")),
                section("10002", "Bo Park", requires("CS 1332")));
        TermData annotated = categorizer.annotate(data);
        assertEquals(CourseCategory.INSTRUCTOR_CONSISTENT, annotated.courses().get("CS 2340").category());
        assertNull(data.courses().get("CS 2340").category());
    }

    @Test
    void failsLoudlyBeforeAttachment() {
        TermData data = term(
                section("10001", "Ann Lee", requires("CS 1331")),
                section("10002", "Bo Park", null));
        var error = assertThrows(IllegalStateException.class, () -> categorizer.categorize(data));
        assertTrue(error.getMessage().contains("10002"));
    }
}
