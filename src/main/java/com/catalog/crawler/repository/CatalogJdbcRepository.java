package com.catalog.crawler.repository;

import com.catalog.crawler.domain.DomainModels.CourseCategory;
import com.catalog.crawler.domain.PrerequisiteModels.Prerequisites;
import com.catalog.crawler.parser.ParserDtos.CompileError;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Repository
public class CatalogJdbcRepository {
    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    public CatalogJdbcRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
    }

    @Transactional
    public void replaceTerm(String term,
                            List<SectionPrerequisiteRow> rows,
                            Map<String, CourseCategory> categories,
                            List<CompileError> errors) {
        replaceSectionPrerequisites(term, rows);
        replaceCategories(term, categories);
        replaceCompileErrors(term, errors);
    }

    public void replaceSectionPrerequisites(String term, List<SectionPrerequisiteRow> rows) {
        jdbcTemplate.update("DELETE FROM section_prerequisites WHERE term = ?", term);
        rows.forEach(r -> jdbcTemplate.update(
                "MERGE INTO section_prerequisites(term, crn, course_id, prerequisites_json) KEY(term, crn) VALUES (?,?,?,?)",
                term, r.crn(), r.courseId(), toJson(r.prerequisites())));
    }

    public Optional<SectionPrerequisiteRow> loadSectionPrerequisites(String term, String crn) {
        return jdbcTemplate.query(
                "SELECT crn, course_id, prerequisites_json FROM section_prerequisites WHERE term = ? AND crn = ?",
                (rs, rowNum) -> new SectionPrerequisiteRow(rs.getString(1), rs.getString(2), fromJson(rs.getString(3))),
                term, crn).stream().findFirst();
    }

    public void replaceCategories(String term, Map<String, CourseCategory> categories) {
        jdbcTemplate.update("DELETE FROM course_categories WHERE term = ?", term);
        categories.forEach((courseId, category) -> jdbcTemplate.update(
                "INSERT INTO course_categories(term, course_id, tier) VALUES (?,?,?)",
                term, courseId, category.tier()));
    }

    public Map<String, CourseCategory> loadCategories(String term) {
        Map<String, CourseCategory> categories = new LinkedHashMap<>();
        jdbcTemplate.query(
                "SELECT course_id, tier FROM course_categories WHERE term = ? ORDER BY course_id",
                rs -> {
                    categories.put(rs.getString(1), CourseCategory.ofTier(rs.getInt(2)));
                },
                term);
        return categories;
    }

    public void replaceCompileErrors(String term, List<CompileError> errors) {
        jdbcTemplate.update("DELETE FROM compile_errors WHERE term = ?", term);
        errors.forEach(e -> jdbcTemplate.update(
                "INSERT INTO compile_errors(term, course_id, code, message, line_no, col_no, offending_text) VALUES (?,?,?,?,?,?,?)",
                term, e.courseId(), e.code(), e.message(), e.line(), e.column(), e.offendingText()));
    }

    public List<CompileError> loadCompileErrors(String term) {
        return jdbcTemplate.query(
                "SELECT code, course_id, message, line_no, col_no, offending_text FROM compile_errors WHERE term = ? ORDER BY id",
                (rs, rowNum) -> new CompileError(rs.getString(1), rs.getString(2), rs.getString(3), rs.getInt(4), rs.getInt(5), rs.getString(6)),
                term);
    }

    private String toJson(Prerequisites prerequisites) {
        try {
            return objectMapper.writeValueAsString(prerequisites == null ? Prerequisites.NONE : prerequisites);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize prerequisites " + prerequisites, e);
        }
    }

    private Prerequisites fromJson(String json) {
        try {
            return objectMapper.readValue(json, Prerequisites.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored prerequisites are not valid JSON: " + json, e);
        }
    }

    public record SectionPrerequisiteRow(String crn, String courseId, Prerequisites prerequisites) {}
}
