package com.catalog.crawler.validation;

import com.catalog.crawler.domain.DomainModels.TermData;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

@Component
public class TermDataValidator {
    private static final Pattern COURSE_ID = Pattern.compile("[A-Z]+ \\d[0-9A-Z]*");

    public List<ValidationIssue> validate(TermData termData) {
        List<ValidationIssue> issues = new ArrayList<>();
        if (termData.term() == null || termData.term().isBlank()) {
            issues.add(new ValidationIssue("MISSING_TERM", "Term code is missing", null));
        }

        List<Row> crnRows = new ArrayList<>();
        termData.courses().forEach((courseId, course) -> {
            if (courseId == null || !COURSE_ID.matcher(courseId).matches()) {
                issues.add(new ValidationIssue("MALFORMED_COURSE_ID", "Course id is not 'SUBJECT NUMBER': " + courseId, courseId));
            }
            course.sections().forEach((label, section) -> {
                if (section.crn() == null || section.crn().isBlank()) {
                    issues.add(new ValidationIssue("MISSING_CRN", "Section " + label + " has no CRN", courseId));
                } else {
                    crnRows.add(new Row(section.crn(), courseId + " " + label));
                }
            });
        });

        Map<String, Long> counts = crnRows.stream().collect(Collectors.groupingBy(Row::crn, Collectors.counting()));
        crnRows.forEach(r -> {
            if (counts.getOrDefault(r.crn(), 0L) > 1) {
                issues.add(new ValidationIssue("DUPLICATE_CRN", "CRN " + r.crn() + " is used by more than one section", r.owner()));
            }
        });
        return issues;
    }

    public record ValidationIssue(String code, String message, String key) {}

    private record Row(String crn, String owner) {}
}
