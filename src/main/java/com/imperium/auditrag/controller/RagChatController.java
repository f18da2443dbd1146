package com.imperium.auditrag.controller;

import com.imperium.auditrag.ai.orchestrator.RagPipelineOrchestrator;
import com.imperium.auditrag.model.dto.request.ChatRequest;
import com.imperium.auditrag.model.dto.response.SearchResponse;
import com.imperium.auditrag.model.rag.Hit;
import com.imperium.auditrag.model.rag.RagQuery;
import com.imperium.auditrag.model.rag.RagResult;
import com.imperium.auditrag.policy.ContextBudgetPolicy;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * 审计问答接口：RAG 问答与原始向量检索。
 */
@RestController
@RequestMapping("/api")
@Tag(name = "RAG", description = "审计记录问答与检索")
public class RagChatController {

    private static final Logger log = LoggerFactory.getLogger(RagChatController.class);

    private final RagPipelineOrchestrator orchestrator;

    @Value("${app.rag.default-top-k:" + ContextBudgetPolicy.DEFAULT_TOP_K + "}")
    private int defaultTopK;

    @Value("${app.rag.verify-numbers-default:true}")
    private boolean verifyNumbersDefault;

    public RagChatController(RagPipelineOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    /**
     * 检索 → 生成 → 数值校验。依赖不可用时仍返回 200，answer 中给出兜底说明。
     */
    @PostMapping(value = "/chat", consumes = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "RAG 问答", description = "基于已索引的审计记录回答问题，并返回引用的来源 id")
    public ResponseEntity<RagResult> chat(@Valid @RequestBody ChatRequest request) {
        int k = ContextBudgetPolicy.resolveTopK(request.getK(), defaultTopK);
        boolean verifyNumbers = request.getVerifyNumbers() != null ? request.getVerifyNumbers() : verifyNumbersDefault;
        RagQuery query = new RagQuery(request.getQuery(), k, request.getFilter(), verifyNumbers);

        log.info("Chat request k={} verifyNumbers={} filter={}", k, verifyNumbers, query.filter().keySet());
        return ResponseEntity.ok(orchestrator.answerQuery(query));
    }

    @GetMapping("/search")
    @Operation(summary = "原始检索", description = "只做向量检索，不调用 LLM")
    public ResponseEntity<SearchResponse> search(
            @Parameter(description = "问题文本", required = true)
            @RequestParam("query") String query,
            @Parameter(description = "检索条数，1~50，默认 6")
            @RequestParam(value = "k", required = false) Integer k) {
        if (query == null || query.isBlank()) {
            throw new IllegalArgumentException("Query cannot be empty");
        }
        if (k != null && (k < 1 || k > ContextBudgetPolicy.MAX_TOP_K)) {
            throw new IllegalArgumentException("k must be between 1 and " + ContextBudgetPolicy.MAX_TOP_K);
        }
        List<Hit> hits = orchestrator.search(query, ContextBudgetPolicy.resolveTopK(k, defaultTopK), null);
        return ResponseEntity.ok(SearchResponse.builder()
                .query(query)
                .results(hits)
                .count(hits.size())
                .build());
    }
}
