package com.catalog.crawler.categorize;

import com.catalog.crawler.domain.DomainModels.CourseCategory;

import java.util.List;
import java.util.Map;

public class CategoryModels {
    public record CategorizationReport(Map<String, CourseCategory> categories, List<InstructorConflict> conflicts) {
        public long countOf(CourseCategory category) {
            return categories.values().stream().filter(c -> c == category).count();
        }
    }

    public record InstructorConflict(String courseId, String instructor, Map<String, List<String>> sectionsByHash) {}
}
