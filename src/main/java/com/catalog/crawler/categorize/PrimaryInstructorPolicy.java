package com.catalog.crawler.categorize;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Picks the instructor a section is attributed to.
 * <p>
 * One listed instructor: that one. Several: the first whose display name ends with the primary
 * marker token, e.g. {@code "Jane Doe (P)"}; if none carries it, the first listed. No instructor:
 * the unassigned placeholder, so such sections still group together.
 */
@Component
public class PrimaryInstructorPolicy {
    private final String primaryMarker;
    private final String unassigned;

    public PrimaryInstructorPolicy(@Value("${catalog.instructor.primary-marker:(P)}") String primaryMarker,
                                   @Value("${catalog.instructor.unassigned:TBA}") String unassigned) {
        this.primaryMarker = primaryMarker;
        this.unassigned = unassigned;
    }

    public String responsibleInstructor(List<String> instructors) {
        if (instructors == null || instructors.isEmpty()) return unassigned;
        if (instructors.size() == 1) return instructors.get(0);

        return instructors.stream()
                .filter(this::isPrimary)
                .findFirst()
                .orElse(instructors.get(0));
    }

    boolean isPrimary(String instructor) {
        if (instructor == null) return false;
        String[] parts = instructor.split(" ");
        return parts.length > 0 && parts[parts.length - 1].equals(primaryMarker);
    }
}
