package com.catalog.crawler.parser;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static com.catalog.crawler.parser.ParserDtos.*;

@Component
public class PrerequisiteTokenizer {
    private static final Pattern LEVEL_QUALIFIER = Pattern.compile(
            "(?:undergraduate|graduate)\\s+(?:(?:semester|quarter)\\s+)?level\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern GRADE_PHRASE = Pattern.compile(
            "(?:minimum\\s+)?grade\\s+of\\s+([a-z])\\b(?:\\s+in\\b)?", Pattern.CASE_INSENSITIVE);
    private static final Pattern PAREN_GRADE = Pattern.compile("\\(\\s*([A-Z])\\s*\\)");
    private static final Pattern TEST_PHRASE = Pattern.compile(
            "(?:converted\\s+)?(?:sat|act)\\b(?:\\s+(?!and\\b|or\\b)[a-z]+)*\\s+\\d+(?:\\s+minimum\\s+score\\s+of\\s+\\d+)?"
                    + "|(?:(?!and\\b|or\\b)[a-z]+\\s+){0,3}placement\\s+test\\b(?:\\s+score)?(?:\\s+minimum\\s+score\\s+of)?(?:\\s+\\d+)?",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern COURSE_NUMBER = Pattern.compile("\\d[0-9A-Z]*");
    private static final Pattern WORD = Pattern.compile("[A-Za-z]+");
    private static final Pattern SUBJECT = Pattern.compile("[A-Z]+");

    public LexResult tokenize(String courseId, String text) {
        String source = text == null ? "" : text;
        Positions at = new Positions(source);
        List<Token> tokens = new ArrayList<>();
        List<CompileError> errors = new ArrayList<>();

        int i = 0;
        while (i < source.length()) {
            char c = source.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
                continue;
            }

            Matcher m;
            if (c == '(') {
                if ((m = lookingAt(PAREN_GRADE, source, i)) != null) {
                    tokens.add(at.token(TokenType.GRADE_LETTER, m.group(1), i));
                    i = m.end();
                } else {
                    tokens.add(at.token(TokenType.LPAREN, "(", i));
                    i++;
                }
            } else if (c == ')') {
                tokens.add(at.token(TokenType.RPAREN, ")", i));
                i++;
            } else if (isAsciiDigit(c)) {
                m = lookingAt(COURSE_NUMBER, source, i);
                tokens.add(at.token(TokenType.COURSE_NUMBER, m.group(), i));
                i = m.end();
            } else if (isAsciiLetter(c)) {
                if ((m = lookingAt(LEVEL_QUALIFIER, source, i)) != null) {
                    i = m.end();
                } else if ((m = lookingAt(GRADE_PHRASE, source, i)) != null) {
                    tokens.add(at.token(TokenType.GRADE_LETTER, m.group(1), m.start(1)));
                    i = m.end();
                } else if ((m = lookingAt(TEST_PHRASE, source, i)) != null) {
                    tokens.add(at.token(TokenType.TEST, m.group(), i));
                    i = m.end();
                } else {
                    m = lookingAt(WORD, source, i);
                    String word = m.group();
                    if (word.equalsIgnoreCase("and")) {
                        tokens.add(at.token(TokenType.AND, word, i));
                    } else if (word.equalsIgnoreCase("or")) {
                        tokens.add(at.token(TokenType.OR, word, i));
                    } else if (SUBJECT.matcher(word).matches()) {
                        tokens.add(at.token(TokenType.COURSE_SUBJECT, word, i));
                    } else {
                        errors.add(at.lexicalError(courseId, i, word));
                    }
                    i = m.end();
                }
            } else {
                int end = i + 1;
                while (end < source.length() && isUnrecognized(source.charAt(end))) end++;
                errors.add(at.lexicalError(courseId, i, source.substring(i, end)));
                i = end;
            }
        }

        tokens.add(at.token(TokenType.EOF, "<EOF>", source.length()));
        return new LexResult(tokens, errors);
    }

    private Matcher lookingAt(Pattern pattern, String source, int from) {
        Matcher m = pattern.matcher(source);
        m.region(from, source.length());
        m.useTransparentBounds(true);
        return m.lookingAt() ? m : null;
    }

    private boolean isAsciiLetter(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    private boolean isAsciiDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private boolean isUnrecognized(char c) {
        return !Character.isWhitespace(c) && !isAsciiLetter(c) && !isAsciiDigit(c) && c != '(' && c != ')';
    }

    // Offsets must be requested in non-decreasing order.
    private static final class Positions {
        private final String source;
        private int scanned;
        private int line = 1;
        private int lineStart;

        private Positions(String source) {
            this.source = source;
        }

        Token token(TokenType type, String text, int offset) {
            moveTo(offset);
            return new Token(type, text, line, offset - lineStart);
        }

        CompileError lexicalError(String courseId, int offset, String segment) {
            moveTo(offset);
            return new CompileError(CompileError.LEXICAL, courseId, "token recognition error at: '" + segment + "'",
                    line, offset - lineStart, segment);
        }

        private void moveTo(int offset) {
            for (; scanned < offset && scanned < source.length(); scanned++) {
                if (source.charAt(scanned) == '\n') {
                    line++;
                    lineStart = scanned + 1;
                }
            }
        }
    }

    public record LexResult(List<Token> tokens, List<CompileError> errors) {}
}
