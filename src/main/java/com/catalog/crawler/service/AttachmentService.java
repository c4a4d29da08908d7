package com.catalog.crawler.service;

import com.catalog.crawler.domain.DomainModels.Course;
import com.catalog.crawler.domain.DomainModels.CourseRef;
import com.catalog.crawler.domain.DomainModels.Section;
import com.catalog.crawler.domain.DomainModels.TermData;
import com.catalog.crawler.domain.PrerequisiteModels.Prerequisites;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.*;

@Service
public class AttachmentService {
    private static final Logger log = LoggerFactory.getLogger(AttachmentService.class);

    public AttachResult attachPrerequisites(TermData termData, Map<String, Prerequisites> prerequisitesByCrn) {
        Map<String, Prerequisites> incoming = prerequisitesByCrn == null ? Map.of() : prerequisitesByCrn;
        Set<String> knownCrns = new HashSet<>();
        int attached = 0;
        int untouched = 0;

        Map<String, Course> courses = new LinkedHashMap<>();
        for (var courseEntry : termData.courses().entrySet()) {
            Map<String, Section> sections = new LinkedHashMap<>();
            for (var sectionEntry : courseEntry.getValue().sections().entrySet()) {
                Section section = sectionEntry.getValue();
                knownCrns.add(section.crn());
                if (incoming.containsKey(section.crn())) {
                    Prerequisites compiled = incoming.get(section.crn());
                    sections.put(sectionEntry.getKey(), section.withPrerequisites(compiled == null ? Prerequisites.NONE : compiled));
                    attached++;
                } else {
                    sections.put(sectionEntry.getKey(), section.prerequisites() == null ? section.withPrerequisites(Prerequisites.NONE) : section);
                    untouched++;
                }
            }
            courses.put(courseEntry.getKey(), courseEntry.getValue().withSections(sections));
        }

        List<String> unknown = incoming.keySet().stream().filter(crn -> !knownCrns.contains(crn)).sorted().toList();
        unknown.forEach(crn -> log.warn("received prerequisites for unknown CRN {} in term {}", crn, termData.term()));
        log.info("attached prerequisites for term {}: attached={}, untouched={}, unknownCrns={}",
                termData.term(), attached, untouched, unknown.size());

        return new AttachResult(new TermData(termData.term(), courses), attached, untouched, unknown);
    }

    public AttachResult attachCorequisites(TermData termData, Map<String, List<CourseRef>> corequisitesByCourse) {
        Map<String, List<CourseRef>> incoming = corequisitesByCourse == null ? Map.of() : corequisitesByCourse;
        Map<String, Course> courses = new LinkedHashMap<>(termData.courses());
        int attached = 0;

        List<String> unknown = new ArrayList<>();
        for (var entry : incoming.entrySet()) {
            Course course = courses.get(entry.getKey());
            if (course == null) {
                log.warn("received corequisite data for unknown course {} in term {}", entry.getKey(), termData.term());
                unknown.add(entry.getKey());
                continue;
            }
            courses.put(entry.getKey(), course.withCorequisites(entry.getValue()));
            attached++;
        }

        return new AttachResult(new TermData(termData.term(), courses), attached, courses.size() - attached, List.copyOf(unknown));
    }

    public record AttachResult(TermData termData, int attached, int untouched, List<String> unknownKeys) {}
}
