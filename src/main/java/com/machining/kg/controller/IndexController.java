package com.machining.kg.controller;

import com.machining.kg.dto.IndexStatus;
import com.machining.kg.service.KnowledgeIndexService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/index")
@Tag(name = "Knowledge Index", description = "Build and inspect the retrieval index")
@RequiredArgsConstructor
@Slf4j
public class IndexController {

    private final KnowledgeIndexService knowledgeIndexService;

    @PostMapping("/rebuild")
    @Operation(summary = "Rebuild the retrieval index from the current graph",
            description = "Units whose text and embedding model are unchanged keep their embeddings")
    public ResponseEntity<IndexStatus> rebuild() {
        log.info("Index rebuild requested via API");
        return ResponseEntity.ok(knowledgeIndexService.build());
    }

    @GetMapping("/status")
    public IndexStatus status() {
        return knowledgeIndexService.status();
    }
}
