package com.catalog.crawler.parser;

import java.util.List;

public class ParserDtos {
    public enum TokenType {
        COURSE_SUBJECT, COURSE_NUMBER, GRADE_LETTER, AND, OR, LPAREN, RPAREN, TEST, EOF
    }

    public record Token(TokenType type, String text, int line, int column) {
        public boolean is(TokenType other) {
            return type == other;
        }
    }

    public interface AtomNode {}

    public record ExpressionNode(List<TermNode> terms) {
        public ExpressionNode {
            terms = List.copyOf(terms);
        }

        public static ExpressionNode empty() {
            return new ExpressionNode(List.of());
        }
    }

    public record TermNode(List<AtomNode> atoms) {
        public TermNode {
            atoms = List.copyOf(atoms);
        }
    }

    public record CourseNode(String subject, String number, String grade, int line, int column) implements AtomNode {
        public String courseId() {
            return subject + " " + number;
        }
    }

    public record TestNode(String text) implements AtomNode {}

    public record GroupNode(ExpressionNode expression) implements AtomNode {}

    public record CompileError(String code, String courseId, String message, int line, int column, String offendingText) {
        public static final String LEXICAL = "LEXICAL_ERROR";
        public static final String SYNTAX = "SYNTAX_ERROR";
    }
}
