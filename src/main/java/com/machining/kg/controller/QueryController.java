package com.machining.kg.controller;

import com.machining.kg.dto.QueryRequest;
import com.machining.kg.dto.QueryResponse;
import com.machining.kg.resolver.QueryResolver;
import com.machining.kg.resolver.QueryState;
import com.machining.kg.resolver.RetrievalMode;
import com.machining.kg.service.InputValidationService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Question answering over the machining knowledge graph.
 * <p>
 * The response always carries an answer; {@code tier} and {@code descents} tell how
 * far the fallback chain had to go to produce it.
 */
@RestController
@RequestMapping("/api/query")
@Tag(name = "Query", description = "Graph-backed question answering with tiered fallback")
@RequiredArgsConstructor
@Slf4j
public class QueryController {

    private final QueryResolver queryResolver;
    private final InputValidationService inputValidationService;

    /**
     * Example questions:
     * - "feature类型都有哪些"
     * - "直径10mm的刀具有哪些"
     * - "圆柱通孔精加工用什么刀具"
     */
    @PostMapping
    @Operation(summary = "Ask a question",
            description = "Modes: naive, local, global, hybrid (default). Falls back to naive retrieval, "
                    + "a templated graph answer or a static message when services are down.")
    public ResponseEntity<QueryResponse> query(@Valid @RequestBody QueryRequest request) {
        // rejections surface through GlobalExceptionHandler as 400
        inputValidationService.validateQuestion(request.getQuestion());
        request.setQuestion(inputValidationService.sanitize(request.getQuestion()));
        RetrievalMode.fromValue(request.getMode(), RetrievalMode.HYBRID);
        log.debug("Query accepted: mode={}", request.getMode());

        QueryResponse response = queryResolver.resolve(request);
        if (response.getState() == QueryState.FAILED) {
            return ResponseEntity.internalServerError().body(response);
        }
        return ResponseEntity.ok(response);
    }
}
