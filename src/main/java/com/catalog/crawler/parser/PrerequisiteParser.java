package com.catalog.crawler.parser;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static com.catalog.crawler.parser.ParserDtos.*;

/**
 * Recursive-descent parser with one token of lookahead:
 * <pre>
 * expression := term (OR term)*
 * term       := atom (AND atom)*
 * atom       := course | TEST | LPAREN expression RPAREN
 * course     := [GRADE_LETTER] COURSE_SUBJECT COURSE_NUMBER [GRADE_LETTER]
 * </pre>
 * Never throws on malformed input: errors are collected and tokens are discarded up to the
 * next {@code and}, {@code or}, {@code )} or end of input.
 */
@Component
public class PrerequisiteParser {

    public ParseResult parse(String courseId, List<Token> tokens) {
        if (tokens.isEmpty() || !tokens.get(tokens.size() - 1).is(TokenType.EOF)) {
            throw new IllegalArgumentException("Token stream must be terminated by EOF");
        }
        Descent descent = new Descent(courseId, tokens);
        ExpressionNode tree = descent.parseAll();
        return new ParseResult(tree, descent.errors);
    }

    public record ParseResult(ExpressionNode tree, List<CompileError> errors) {}

    private static final class Descent {
        private static final Set<TokenType> SYNC = Set.of(TokenType.AND, TokenType.OR, TokenType.RPAREN, TokenType.EOF);

        private final String courseId;
        private final List<Token> tokens;
        private final List<CompileError> errors = new ArrayList<>();
        private int pos;

        private Descent(String courseId, List<Token> tokens) {
            this.courseId = courseId;
            this.tokens = tokens;
        }

        ExpressionNode parseAll() {
            if (at(TokenType.EOF)) return ExpressionNode.empty();
            return recoveringExpression(TokenType.EOF);
        }

        private ExpressionNode recoveringExpression(TokenType closer) {
            ExpressionNode result = expression();
            while (!at(closer) && !at(TokenType.EOF)) {
                Token stray = advance();
                error(stray, "extraneous input '" + stray.text() + "' expecting {and, or, " + describe(closer) + "}");
                synchronize();
                if (at(TokenType.AND) || at(TokenType.OR)) {
                    TokenType operator = advance().type();
                    result = join(result, operator, expression());
                }
            }
            return result;
        }

        private ExpressionNode expression() {
            List<TermNode> terms = new ArrayList<>();
            terms.add(term());
            while (at(TokenType.OR)) {
                advance();
                terms.add(term());
            }
            return new ExpressionNode(terms);
        }

        private TermNode term() {
            List<AtomNode> atoms = new ArrayList<>();
            addIfPresent(atoms, atom());
            while (at(TokenType.AND)) {
                advance();
                addIfPresent(atoms, atom());
            }
            return new TermNode(atoms);
        }

        private AtomNode atom() {
            Token current = peek();
            switch (current.type()) {
                case GRADE_LETTER, COURSE_SUBJECT -> {
                    return course();
                }
                case TEST -> {
                    return new TestNode(advance().text());
                }
                case LPAREN -> {
                    Token open = advance();
                    ExpressionNode inner = recoveringExpression(TokenType.RPAREN);
                    if (at(TokenType.RPAREN)) {
                        advance();
                    } else {
                        error(peek(), "missing ')' to close '(' at " + open.line() + ":" + open.column());
                    }
                    return new GroupNode(inner);
                }
                default -> {
                    error(current, "mismatched input '" + current.text() + "' expecting {course, test, '('}");
                    synchronize();
                    return null;
                }
            }
        }

        private CourseNode course() {
            Token leadingGrade = at(TokenType.GRADE_LETTER) ? advance() : null;
            if (!at(TokenType.COURSE_SUBJECT)) {
                error(peek(), "missing course subject at '" + peek().text() + "'");
                synchronize();
                return null;
            }
            Token subject = advance();
            if (!at(TokenType.COURSE_NUMBER)) {
                error(peek(), "missing course number after '" + subject.text() + "'");
                synchronize();
                return null;
            }
            Token number = advance();
            Token grade = at(TokenType.GRADE_LETTER) ? advance() : leadingGrade;
            return new CourseNode(subject.text(), number.text(), grade == null ? null : grade.text(),
                    subject.line(), subject.column());
        }

        private ExpressionNode join(ExpressionNode left, TokenType operator, ExpressionNode right) {
            GroupNode l = new GroupNode(left);
            GroupNode r = new GroupNode(right);
            if (operator == TokenType.AND) {
                return new ExpressionNode(List.of(new TermNode(List.of(l, r))));
            }
            return new ExpressionNode(List.of(new TermNode(List.of(l)), new TermNode(List.of(r))));
        }

        private void synchronize() {
            while (!SYNC.contains(peek().type())) pos++;
        }

        private void addIfPresent(List<AtomNode> atoms, AtomNode atom) {
            if (atom != null) atoms.add(atom);
        }

        private boolean at(TokenType type) {
            return peek().is(type);
        }

        private Token peek() {
            return tokens.get(pos);
        }

        private Token advance() {
            Token t = tokens.get(pos);
            if (!t.is(TokenType.EOF)) pos++;
            return t;
        }

        private String describe(TokenType closer) {
            return closer == TokenType.RPAREN ? "')'" : "<EOF>";
        }

        private void error(Token token, String message) {
            errors.add(new CompileError(CompileError.SYNTAX, courseId, message, token.line(), token.column(), token.text()));
        }
    }
}
