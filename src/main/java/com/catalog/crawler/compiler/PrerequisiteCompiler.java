package com.catalog.crawler.compiler;

import com.catalog.crawler.domain.PrerequisiteModels.Prerequisites;
import com.catalog.crawler.parser.ParserDtos.CompileError;
import com.catalog.crawler.parser.PrerequisiteParser;
import com.catalog.crawler.parser.PrerequisiteTokenizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
public class PrerequisiteCompiler {
    private static final Logger log = LoggerFactory.getLogger(PrerequisiteCompiler.class);

    private final PrerequisiteTokenizer tokenizer;
    private final PrerequisiteParser parser;
    private final ClauseBuilder builder;
    private final PrerequisiteCanonicalizer canonicalizer;

    public PrerequisiteCompiler(PrerequisiteTokenizer tokenizer,
                                PrerequisiteParser parser,
                                ClauseBuilder builder,
                                PrerequisiteCanonicalizer canonicalizer) {
        this.tokenizer = tokenizer;
        this.parser = parser;
        this.builder = builder;
        this.canonicalizer = canonicalizer;
    }

    public CompileResult compile(String courseId, String text) {
        String cleaned = text == null ? "" : text.trim();
        if (cleaned.isEmpty()) {
            return new CompileResult(courseId, Prerequisites.NONE, List.of());
        }

        PrerequisiteTokenizer.LexResult lexed = tokenizer.tokenize(courseId, cleaned);
        PrerequisiteParser.ParseResult parsed = parser.parse(courseId, lexed.tokens());

        List<CompileError> errors = new ArrayList<>(lexed.errors());
        errors.addAll(parsed.errors());
        errors.forEach(e -> log.warn("an error occurred while parsing prerequisites: {} (courseId={}, line={}, column={}, text='{}')",
                e.message(), e.courseId(), e.line(), e.column(), cleaned));

        Prerequisites prerequisites = builder.fold(parsed.tree())
                .map(clause -> canonicalizer.canonicalize(clause))
                .orElse(Prerequisites.NONE);
        return new CompileResult(courseId, prerequisites, errors);
    }

    public record CompileResult(String courseId, Prerequisites prerequisites, List<CompileError> errors) {
        public boolean clean() {
            return errors.isEmpty();
        }
    }
}
