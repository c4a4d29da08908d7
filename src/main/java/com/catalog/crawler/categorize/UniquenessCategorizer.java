package com.catalog.crawler.categorize;

import com.catalog.crawler.categorize.CategoryModels.CategorizationReport;
import com.catalog.crawler.categorize.CategoryModels.InstructorConflict;
import com.catalog.crawler.domain.DomainModels.Course;
import com.catalog.crawler.domain.DomainModels.CourseCategory;
import com.catalog.crawler.domain.DomainModels.Section;
import com.catalog.crawler.domain.DomainModels.TermData;
import com.catalog.crawler.domain.PrerequisiteModels.Prerequisites;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.*;

@Component
public class UniquenessCategorizer {
    private static final Logger log = LoggerFactory.getLogger(UniquenessCategorizer.class);

    private final ClauseHasher hasher;
    private final PrimaryInstructorPolicy instructorPolicy;

    public UniquenessCategorizer(ClauseHasher hasher, PrimaryInstructorPolicy instructorPolicy) {
        this.hasher = hasher;
        this.instructorPolicy = instructorPolicy;
    }

    public Map<String, CourseCategory> categorize(TermData termData) {
        return report(termData).categories();
    }

    public CategorizationReport report(TermData termData) {
        requireAttached(termData);

        Map<String, CourseCategory> categories = new LinkedHashMap<>();
        List<InstructorConflict> conflicts = new ArrayList<>();
        termData.courses().forEach((courseId, course) -> categories.put(courseId, categorizeCourse(courseId, course, conflicts)));

        CategorizationReport report = new CategorizationReport(Collections.unmodifiableMap(categories), List.copyOf(conflicts));
        log.info("categorized prerequisites for term {}: uniform={}, instructorConsistent={}, instructorInconsistent={}",
                termData.term(),
                report.countOf(CourseCategory.UNIFORM),
                report.countOf(CourseCategory.INSTRUCTOR_CONSISTENT),
                report.countOf(CourseCategory.INSTRUCTOR_INCONSISTENT));
        return report;
    }

    public TermData annotate(TermData termData) {
        return annotate(termData, report(termData));
    }

    public TermData annotate(TermData termData, CategorizationReport report) {
        Map<String, CourseCategory> categories = report.categories();
        Map<String, Course> courses = new LinkedHashMap<>();
        termData.courses().forEach((courseId, course) -> courses.put(courseId, course.withCategory(categories.get(courseId))));
        return new TermData(termData.term(), courses);
    }

    private CourseCategory categorizeCourse(String courseId, Course course, List<InstructorConflict> conflicts) {
        List<Section> sections = List.copyOf(course.sections().values());
        if (sections.isEmpty()) return CourseCategory.UNIFORM;

        Prerequisites basis = sections.get(0).prerequisites();
        if (sections.stream().allMatch(s -> basis.equals(s.prerequisites()))) {
            return CourseCategory.UNIFORM;
        }

        Map<String, Map<String, List<String>>> hashesByInstructor = new LinkedHashMap<>();
        for (Section section : sections) {
            String instructor = instructorPolicy.responsibleInstructor(section.instructors());
            hashesByInstructor.computeIfAbsent(instructor, k -> new LinkedHashMap<>())
                    .computeIfAbsent(hasher.hash(section.prerequisites()), k -> new ArrayList<>())
                    .add(section.crn());
        }

        List<InstructorConflict> found = hashesByInstructor.entrySet().stream()
                .filter(e -> e.getValue().size() > 1)
                .map(e -> new InstructorConflict(courseId, e.getKey(), Collections.unmodifiableMap(e.getValue())))
                .toList();
        conflicts.addAll(found);
        return found.isEmpty() ? CourseCategory.INSTRUCTOR_CONSISTENT : CourseCategory.INSTRUCTOR_INCONSISTENT;
    }

    private void requireAttached(TermData termData) {
        if (termData == null) throw new IllegalArgumentException("Term data is required");
        termData.courses().forEach((courseId, course) -> course.sections().forEach((label, section) -> {
            if (section.prerequisites() == null) {
                throw new IllegalStateException("Section " + label + " (CRN " + section.crn() + ") of " + courseId
                        + " has no attached prerequisites; attach must run before categorize");
            }
        }));
    }
}
