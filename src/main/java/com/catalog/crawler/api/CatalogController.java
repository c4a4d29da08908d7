package com.catalog.crawler.api;

import com.catalog.crawler.compiler.PrerequisiteCompiler.CompileResult;
import com.catalog.crawler.domain.DomainModels.CourseCategory;
import com.catalog.crawler.domain.PrerequisiteModels.Prerequisites;
import com.catalog.crawler.parser.ParserDtos.CompileError;
import com.catalog.crawler.service.CatalogImportService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/catalog")
public class CatalogController {
    private final CatalogImportService importService;

    public CatalogController(CatalogImportService importService) {
        this.importService = importService;
    }

    @PostMapping("/prerequisites/compile")
    public ResponseEntity<CompileResult> compile(@RequestBody CompileRequest request) {
        return ResponseEntity.ok(importService.compile(request.courseId(), request.text()));
    }

    @PostMapping("/terms/import")
    public ResponseEntity<CatalogImportService.ImportResult> importTerm(@RequestBody CatalogImportService.TermImportRequest request) {
        return ResponseEntity.ok(importService.importTerm(request));
    }

    @GetMapping("/terms/{term}/categories")
    public ResponseEntity<Map<String, CourseCategory>> categories(@PathVariable String term) {
        return ResponseEntity.ok(importService.categories(term));
    }

    @GetMapping("/terms/{term}/sections/{crn}/prerequisites")
    public ResponseEntity<Prerequisites> sectionPrerequisites(@PathVariable String term, @PathVariable String crn) {
        return importService.sectionPrerequisites(term, crn)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping("/terms/{term}/errors")
    public ResponseEntity<List<CompileError>> compileErrors(@PathVariable String term) {
        return ResponseEntity.ok(importService.compileErrors(term));
    }

    public record CompileRequest(String courseId, String text) {}
}
