package com.catalog.crawler.compiler;

import com.catalog.crawler.domain.PrerequisiteModels.ClauseSet;
import com.catalog.crawler.domain.PrerequisiteModels.CourseClause;
import com.catalog.crawler.domain.PrerequisiteModels.Operator;
import com.catalog.crawler.domain.PrerequisiteModels.PrerequisiteClause;
import com.catalog.crawler.domain.PrerequisiteModels.Prerequisites;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Flattens raw clauses into canonical form:
 * <ul>
 *   <li>empty sets are dropped;</li>
 *   <li>a child set with its parent's operator is spliced into the parent;</li>
 *   <li>single-child sets collapse into the child, except at the top, which is always a set;</li>
 *   <li>a lone course at the top becomes {@code and(course)}.</li>
 * </ul>
 * Child order is kept as written and equal children are not deduplicated.
 */
@Component
public class PrerequisiteCanonicalizer {

    public Prerequisites canonicalize(Prerequisites prerequisites) {
        return prerequisites == null || prerequisites.isEmpty() ? Prerequisites.NONE : canonicalize(prerequisites.clause());
    }

    public Prerequisites canonicalize(PrerequisiteClause raw) {
        if (raw == null) return Prerequisites.NONE;
        if (raw instanceof CourseClause course) {
            return Prerequisites.of(ClauseSet.of(Operator.AND, course));
        }

        ClauseSet root = (ClauseSet) raw;
        List<PrerequisiteClause> children = merge(root.operator(), root.children());
        if (children.isEmpty()) return Prerequisites.NONE;
        if (children.size() == 1) {
            PrerequisiteClause only = children.get(0);
            return only instanceof ClauseSet set
                    ? Prerequisites.of(set)
                    : Prerequisites.of(ClauseSet.of(Operator.AND, only));
        }
        return Prerequisites.of(new ClauseSet(root.operator(), children));
    }

    private Optional<PrerequisiteClause> flatten(PrerequisiteClause clause) {
        if (clause instanceof CourseClause) return Optional.of(clause);

        ClauseSet set = (ClauseSet) clause;
        List<PrerequisiteClause> children = merge(set.operator(), set.children());
        if (children.isEmpty()) return Optional.empty();
        if (children.size() == 1) return Optional.of(children.get(0));
        return Optional.of(new ClauseSet(set.operator(), children));
    }

    private List<PrerequisiteClause> merge(Operator operator, List<PrerequisiteClause> children) {
        List<PrerequisiteClause> merged = new ArrayList<>();
        for (PrerequisiteClause child : children) {
            flatten(child).ifPresent(flat -> {
                if (flat instanceof ClauseSet set && set.operator() == operator) {
                    merged.addAll(set.children());
                } else {
                    merged.add(flat);
                }
            });
        }
        return merged;
    }
}
