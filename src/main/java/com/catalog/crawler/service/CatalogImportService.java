package com.catalog.crawler.service;

import com.catalog.crawler.categorize.CategoryModels.CategorizationReport;
import com.catalog.crawler.categorize.CategoryModels.InstructorConflict;
import com.catalog.crawler.categorize.UniquenessCategorizer;
import com.catalog.crawler.compiler.PrerequisiteCompiler;
import com.catalog.crawler.compiler.PrerequisiteCompiler.CompileResult;
import com.catalog.crawler.domain.DomainModels.CourseCategory;
import com.catalog.crawler.domain.DomainModels.CourseRef;
import com.catalog.crawler.domain.DomainModels.TermData;
import com.catalog.crawler.domain.PrerequisiteModels.Prerequisites;
import com.catalog.crawler.parser.ParserDtos.CompileError;
import com.catalog.crawler.repository.CatalogJdbcRepository;
import com.catalog.crawler.repository.CatalogJdbcRepository.SectionPrerequisiteRow;
import com.catalog.crawler.validation.TermDataValidator;
import com.catalog.crawler.validation.TermDataValidator.ValidationIssue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.stream.Stream;

@Service
public class CatalogImportService {
    private static final Logger log = LoggerFactory.getLogger(CatalogImportService.class);

    private final PrerequisiteCompiler compiler;
    private final TermDataValidator validator;
    private final AttachmentService attachmentService;
    private final UniquenessCategorizer categorizer;
    private final CatalogJdbcRepository repository;
    private final boolean parallelCompile;

    public CatalogImportService(PrerequisiteCompiler compiler,
                                TermDataValidator validator,
                                AttachmentService attachmentService,
                                UniquenessCategorizer categorizer,
                                CatalogJdbcRepository repository,
                                @Value("${catalog.compile.parallel:false}") boolean parallelCompile) {
        this.compiler = compiler;
        this.validator = validator;
        this.attachmentService = attachmentService;
        this.categorizer = categorizer;
        this.repository = repository;
        this.parallelCompile = parallelCompile;
    }

    public CompileResult compile(String courseId, String text) {
        return compiler.compile(courseId, text);
    }

    public BatchCompileResult compileAll(Map<String, PrerequisiteSource> sourcesByCrn) {
        if (sourcesByCrn == null || sourcesByCrn.isEmpty()) return new BatchCompileResult(Map.of(), List.of());

        Stream<Map.Entry<String, PrerequisiteSource>> entries = parallelCompile
                ? sourcesByCrn.entrySet().parallelStream()
                : sourcesByCrn.entrySet().stream();
        List<Compiled> compiled = entries
                .map(e -> new Compiled(e.getKey(), compiler.compile(e.getValue().courseId(), e.getValue().text())))
                .toList();

        Map<String, Prerequisites> byCrn = new LinkedHashMap<>();
        List<CompileError> errors = new ArrayList<>();
        compiled.forEach(c -> {
            byCrn.put(c.crn(), c.result().prerequisites());
            errors.addAll(c.result().errors());
        });
        return new BatchCompileResult(byCrn, errors);
    }

    public ImportResult importTerm(TermImportRequest request) {
        if (request == null || request.termData() == null) {
            throw new IllegalArgumentException("termData is required");
        }
        TermData scraped = request.termData();
        if (!request.dryRun() && (scraped.term() == null || scraped.term().isBlank())) {
            throw new IllegalArgumentException("term is required");
        }
        List<ValidationIssue> warnings = validator.validate(scraped);
        warnings.forEach(w -> log.warn("term {} validation: {} {}", scraped.term(), w.code(), w.message()));

        BatchCompileResult batch = compileAll(request.prerequisites());
        AttachmentService.AttachResult withPrereqs = attachmentService.attachPrerequisites(scraped, batch.prerequisites());
        AttachmentService.AttachResult withCoreqs = attachmentService.attachCorequisites(withPrereqs.termData(), request.corequisites());

        List<String> unknown = new ArrayList<>(withPrereqs.unknownKeys());
        unknown.addAll(withCoreqs.unknownKeys());

        CategorizationReport report = categorizer.report(withCoreqs.termData());
        TermData annotated = categorizer.annotate(withCoreqs.termData(), report);

        if (!request.dryRun()) {
            persist(annotated, report.categories(), batch.errors());
        }

        return new ImportResult(request.dryRun(), annotated, report.categories(), batch.errors(), warnings,
                unknown, report.conflicts());
    }

    public Map<String, CourseCategory> categories(String term) {
        return repository.loadCategories(term);
    }

    public Optional<Prerequisites> sectionPrerequisites(String term, String crn) {
        return repository.loadSectionPrerequisites(term, crn).map(SectionPrerequisiteRow::prerequisites);
    }

    public List<CompileError> compileErrors(String term) {
        return repository.loadCompileErrors(term);
    }

    private void persist(TermData termData, Map<String, CourseCategory> categories, List<CompileError> errors) {
        List<SectionPrerequisiteRow> rows = new ArrayList<>();
        termData.courses().forEach((courseId, course) -> course.sections().values().stream()
                .filter(s -> s.crn() != null && !s.crn().isBlank())
                .forEach(s -> rows.add(new SectionPrerequisiteRow(s.crn(), courseId, s.prerequisites()))));

        repository.replaceTerm(termData.term(), rows, categories, errors);
        log.info("stored term {}: sections={}, courses={}, compileErrors={}", termData.term(), rows.size(), categories.size(), errors.size());
    }

    public record PrerequisiteSource(String courseId, String text) {}

    public record TermImportRequest(TermData termData,
                                    Map<String, PrerequisiteSource> prerequisites,
                                    Map<String, List<CourseRef>> corequisites,
                                    boolean dryRun) {}

    public record BatchCompileResult(Map<String, Prerequisites> prerequisites, List<CompileError> errors) {}

    public record ImportResult(boolean dryRun,
                               TermData termData,
                               Map<String, CourseCategory> categories,
                               List<CompileError> compileErrors,
                               List<ValidationIssue> warnings,
                               List<String> unknownKeys,
                               List<InstructorConflict> conflicts) {}

    private record Compiled(String crn, CompileResult result) {}
}
