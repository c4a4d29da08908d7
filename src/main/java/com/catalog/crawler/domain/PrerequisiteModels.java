package com.catalog.crawler.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Compiled prerequisite trees.
 * <p>
 * Serialized form is prefix notation: {@code []} for no prerequisites, otherwise
 * {@code ["and", child, ...]} where a child is a nested array or {@code {"id": "CS 1331", "grade": "C"}}.
 */
public class PrerequisiteModels {

    public enum Operator {
        AND, OR;

        @JsonValue
        public String json() {
            return name().toLowerCase(Locale.ROOT);
        }

        public static Operator fromJson(String value) {
            if (value == null) throw new IllegalArgumentException("Missing prerequisite operator");
            return switch (value.toLowerCase(Locale.ROOT)) {
                case "and" -> AND;
                case "or" -> OR;
                default -> throw new IllegalArgumentException("Unknown prerequisite operator: " + value);
            };
        }
    }

    public interface PrerequisiteClause {
        String render();

        Object toJson();
    }

    public record CourseClause(String id, String grade) implements PrerequisiteClause {
        public CourseClause {
            Objects.requireNonNull(id, "course id");
        }

        public Optional<String> minimumGrade() {
            return Optional.ofNullable(grade);
        }

        @Override
        public String render() {
            return grade == null ? id : id + "[" + grade + "]";
        }

        @Override
        public Object toJson() {
            Map<String, String> json = new LinkedHashMap<>();
            json.put("id", id);
            if (grade != null) json.put("grade", grade);
            return json;
        }
    }

    public record ClauseSet(Operator operator, List<PrerequisiteClause> children) implements PrerequisiteClause {
        public ClauseSet {
            Objects.requireNonNull(operator, "operator");
            children = List.copyOf(children);
        }

        public static ClauseSet of(Operator operator, PrerequisiteClause... children) {
            return new ClauseSet(operator, List.of(children));
        }

        @Override
        public String render() {
            return operator.json() + children.stream().map(PrerequisiteClause::render).collect(Collectors.joining(",", "(", ")"));
        }

        @Override
        public List<Object> toJson() {
            List<Object> json = new ArrayList<>();
            json.add(operator.json());
            children.forEach(c -> json.add(c.toJson()));
            return json;
        }
    }

    public record Prerequisites(ClauseSet clause) {
        public static final Prerequisites NONE = new Prerequisites(null);

        public static Prerequisites of(ClauseSet clause) {
            return clause == null ? NONE : new Prerequisites(clause);
        }

        public boolean isEmpty() {
            return clause == null;
        }

        public String render() {
            return clause == null ? "none" : clause.render();
        }

        @JsonValue
        public List<Object> toJson() {
            return clause == null ? List.of() : clause.toJson();
        }

        @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
        public static Prerequisites fromJson(List<Object> json) {
            if (json == null || json.isEmpty()) return NONE;
            return new Prerequisites(setFromJson(json));
        }

        private static ClauseSet setFromJson(List<?> json) {
            if (json.isEmpty() || !(json.get(0) instanceof String op)) {
                throw new IllegalArgumentException("Prerequisite set must start with an operator: " + json);
            }
            List<PrerequisiteClause> children = new ArrayList<>();
            for (Object child : json.subList(1, json.size())) {
                children.add(clauseFromJson(child));
            }
            return new ClauseSet(Operator.fromJson(op), children);
        }

        private static PrerequisiteClause clauseFromJson(Object json) {
            if (json instanceof List<?> list) return setFromJson(list);
            if (json instanceof Map<?, ?> map) {
                Object id = map.get("id");
                if (!(id instanceof String courseId)) {
                    throw new IllegalArgumentException("Prerequisite course must have a string id: " + map);
                }
                Object grade = map.get("grade");
                return new CourseClause(courseId, grade == null ? null : grade.toString());
            }
            throw new IllegalArgumentException("Unsupported prerequisite clause: " + json);
        }
    }
}
