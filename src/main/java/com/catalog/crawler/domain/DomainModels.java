package com.catalog.crawler.domain;

import com.catalog.crawler.domain.PrerequisiteModels.Prerequisites;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.*;

public class DomainModels {
    public record TermData(String term, Map<String, Course> courses) {
        public TermData {
            courses = courses == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(courses));
        }
    }

    public record Course(String id, String title,
                         Map<String, Section> sections,
                         List<CourseRef> corequisites,
                         CourseCategory category) {
        public Course {
            sections = sections == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(sections));
            corequisites = corequisites == null ? List.of() : List.copyOf(corequisites);
        }

        public Course withSections(Map<String, Section> newSections) {
            return new Course(id, title, newSections, corequisites, category);
        }

        public Course withCorequisites(List<CourseRef> newCorequisites) {
            return new Course(id, title, sections, newCorequisites, category);
        }

        public Course withCategory(CourseCategory newCategory) {
            return new Course(id, title, sections, corequisites, newCategory);
        }
    }

    // prerequisites stay null until attached
    public record Section(String crn, List<String> instructors, Prerequisites prerequisites) {
        public Section {
            instructors = instructors == null ? List.of() : List.copyOf(instructors);
        }

        public Section withPrerequisites(Prerequisites newPrerequisites) {
            return new Section(crn, instructors, newPrerequisites);
        }
    }

    public record CourseRef(String id) {}

    public enum CourseCategory {
        UNIFORM(0),
        INSTRUCTOR_CONSISTENT(1),
        INSTRUCTOR_INCONSISTENT(2);

        private final int tier;

        CourseCategory(int tier) {
            this.tier = tier;
        }

        @JsonValue
        public int tier() {
            return tier;
        }

        @JsonCreator
        public static CourseCategory ofTier(int tier) {
            for (CourseCategory c : values()) {
                if (c.tier == tier) return c;
            }
            throw new IllegalArgumentException("Unknown course category tier: " + tier);
        }
    }
}
