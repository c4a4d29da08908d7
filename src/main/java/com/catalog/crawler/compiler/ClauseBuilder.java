package com.catalog.crawler.compiler;

import com.catalog.crawler.domain.PrerequisiteModels.ClauseSet;
import com.catalog.crawler.domain.PrerequisiteModels.CourseClause;
import com.catalog.crawler.domain.PrerequisiteModels.Operator;
import com.catalog.crawler.domain.PrerequisiteModels.PrerequisiteClause;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

import static com.catalog.crawler.parser.ParserDtos.*;

@Component
public class ClauseBuilder {

    public Optional<PrerequisiteClause> fold(ExpressionNode expression) {
        List<PrerequisiteClause> children = expression.terms().stream()
                .map(this::foldTerm)
                .flatMap(Optional::stream)
                .toList();
        return children.isEmpty() ? Optional.empty() : Optional.of(new ClauseSet(Operator.OR, children));
    }

    Optional<PrerequisiteClause> foldTerm(TermNode term) {
        List<PrerequisiteClause> children = term.atoms().stream()
                .map(this::foldAtom)
                .flatMap(Optional::stream)
                .toList();
        return children.isEmpty() ? Optional.empty() : Optional.of(new ClauseSet(Operator.AND, children));
    }

    Optional<PrerequisiteClause> foldAtom(AtomNode atom) {
        if (atom instanceof CourseNode course) {
            return Optional.of(new CourseClause(course.courseId(), course.grade()));
        }
        if (atom instanceof GroupNode group) {
            return fold(group.expression());
        }
        if (atom instanceof TestNode) {
            return Optional.empty();
        }
        throw new IllegalArgumentException("Unsupported atom: " + atom);
    }
}
