package com.imperium.auditrag.ai.orchestrator;

import com.imperium.auditrag.ai.provider.AnswerGenerator;
import com.imperium.auditrag.exception.GenerationTimeoutException;
import com.imperium.auditrag.exception.GenerationUnavailableException;
import com.imperium.auditrag.exception.PipelineFailureKind;
import com.imperium.auditrag.model.rag.Answer;
import com.imperium.auditrag.model.rag.Hit;
import com.imperium.auditrag.model.rag.RagPrompt;
import com.imperium.auditrag.model.rag.RagQuery;
import com.imperium.auditrag.model.rag.RagResult;
import com.imperium.auditrag.model.rag.StageOutcome;
import com.imperium.auditrag.model.rag.VerificationResult;
import com.imperium.auditrag.policy.GenerationLimitPolicy;
import com.imperium.auditrag.rag.ContextBuilder;
import com.imperium.auditrag.rag.NumericVerifier;
import com.imperium.auditrag.service.RetrievalService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * RAG 问答编排器。
 * <p>
 * 职责：检索 → 拼装证据与提示词 → LLM 生成 → 数值校验 → 组装结果。
 * <p>
 * 每个阶段的失败都以 {@link StageOutcome} 返回并就地替换为兜底值，请求本身不会失败；
 * 只有逃逸出所有阶段的异常才由最外层兜底，生成带 error 字段的结果。
 * 本类不持有可变状态，可被多个请求线程并发调用。
 */
@Service
public class RagPipelineOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(RagPipelineOrchestrator.class);

    static final String NO_INFORMATION_MESSAGE =
            "I couldn't find any relevant information in the database to answer your query. "
                    + "Please try rephrasing your question or check if the data has been ingested.";

    static final String EMPTY_RESPONSE_REASON = "the language model returned an empty response";

    private static final int LOG_QUERY_MAX = 100;

    private final RetrievalService retrievalService;
    private final ContextBuilder contextBuilder;
    private final AnswerGenerator answerGenerator;
    private final NumericVerifier numericVerifier;

    public RagPipelineOrchestrator(RetrievalService retrievalService,
            ContextBuilder contextBuilder,
            AnswerGenerator answerGenerator,
            NumericVerifier numericVerifier) {
        this.retrievalService = retrievalService;
        this.contextBuilder = contextBuilder;
        this.answerGenerator = answerGenerator;
        this.numericVerifier = numericVerifier;
    }

    // ==================== 公开入口 ====================

    public RagResult answerQuery(RagQuery query) {
        try {
            return runPipeline(query);
        } catch (Exception e) {
            log.error("Error in RAG pipeline for query: {}", abbreviate(query.text()), e);
            return RagResult.failed(
                    "I encountered an error while processing your query: " + describeFailure(e),
                    query.text(),
                    String.valueOf(e.getMessage()));
        }
    }

    /**
     * 只做检索，返回原始命中；与问答共用同一检索实现，失败时为空列表。
     */
    public List<Hit> search(String query, int k, Map<String, ?> filter) {
        return retrievalService.retrieve(query, k, filter);
    }

    // ==================== 流水线 ====================

    private RagResult runPipeline(RagQuery query) {
        // ---------- 1. 检索 ----------
        StageOutcome<List<Hit>> retrieval =
                retrievalService.retrieveWithOutcome(query.text(), query.topK(), query.filter());
        List<Hit> hits = retrieval.value() != null ? retrieval.value() : List.of();
        if (hits.isEmpty()) {
            if (retrieval.isDegraded()) {
                log.warn("Retrieval degraded ({}): {}", retrieval.kind(), retrieval.detail());
            } else {
                log.info("No documents matched query: {}", abbreviate(query.text()));
            }
            return RagResult.noInformation(NO_INFORMATION_MESSAGE, query.text());
        }

        // ---------- 2. 证据与提示词 ----------
        RagPrompt prompt = contextBuilder.buildPrompt(query.text(), hits);
        log.debug("Built prompt with {} of {} hits", prompt.entries().size(), hits.size());

        // ---------- 3. 生成 ----------
        StageOutcome<String> generation = generate(prompt.text());
        String generated = switch (generation.kind()) {
            case NONE -> generation.value();
            case GENERATION_FAILURE -> {
                log.warn("Generation degraded ({}): {}", generation.kind(), generation.detail());
                yield generationFallback(generation.detail(), hits.size());
            }
            default -> throw new IllegalStateException("Unexpected generation outcome: " + generation.kind());
        };

        // ---------- 4. 数值校验 ----------
        Answer answer = Answer.unverified(generated);
        if (query.verifyNumbers() && generated != null && !generated.isEmpty()) {
            StageOutcome<VerificationResult> verification = verify(generated, hits);
            switch (verification.kind()) {
                case NONE -> answer = new Answer(generated, true, null);
                case NUMERIC_MISMATCH -> {
                    String warning = verification.value().warning();
                    log.warn("Numeric verification failed: {}", warning);
                    answer = new Answer(generated + "\n\n" + warning, false, warning);
                }
                case VERIFICATION_INCONCLUSIVE ->
                        log.warn("Number verification failed, continuing without it: {}", verification.detail());
                default -> throw new IllegalStateException("Unexpected verification outcome: " + verification.kind());
            }
        }

        log.info("Answered query with {} retrieved documents (verified={})", hits.size(), answer.verified());
        return RagResult.answered(answer.text(), hits, query.text());
    }

    private StageOutcome<String> generate(String prompt) {
        try {
            String content = answerGenerator.generate(prompt,
                    GenerationLimitPolicy.MAX_TOKENS, GenerationLimitPolicy.TEMPERATURE);
            if (content == null || content.isBlank()) {
                return StageOutcome.degraded(null, PipelineFailureKind.GENERATION_FAILURE, EMPTY_RESPONSE_REASON);
            }
            return StageOutcome.ok(content);
        } catch (GenerationTimeoutException | GenerationUnavailableException e) {
            return StageOutcome.degraded(null, e.getKind(), e.getMessage());
        }
    }

    private StageOutcome<VerificationResult> verify(String answer, List<Hit> hits) {
        try {
            VerificationResult result = numericVerifier.verify(answer, hits);
            if (result.passed()) {
                return StageOutcome.ok(result);
            }
            return StageOutcome.degraded(result, PipelineFailureKind.NUMERIC_MISMATCH, result.warning());
        } catch (RuntimeException e) {
            return StageOutcome.degraded(null, PipelineFailureKind.VERIFICATION_INCONCLUSIVE,
                    e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    static String generationFallback(String reason, int retrievalCount) {
        return "I encountered an error while generating a response: " + reason
                + ". However, I found " + retrievalCount
                + " relevant document(s) that might help answer your question.";
    }

    /**
     * 把常见的底层错误翻译成面向用户的提示，其余情况原样返回错误描述。
     */
    static String describeFailure(Exception e) {
        String message = String.valueOf(e.getMessage());
        String lower = message.toLowerCase(Locale.ROOT);
        if (lower.contains("qdrant") || lower.contains("connection")) {
            return "I couldn't connect to the vector database. Please ensure Qdrant is running and accessible.";
        }
        if (lower.contains("llm") || lower.contains("ollama")) {
            return "I couldn't connect to the language model. "
                    + "Please ensure the model server is running and the model is available.";
        }
        if (lower.contains("embedding")) {
            return "I encountered an error while processing your query. Please try again.";
        }
        return message;
    }

    private static String abbreviate(String text) {
        if (text == null) {
            return "";
        }
        return text.length() > LOG_QUERY_MAX ? text.substring(0, LOG_QUERY_MAX) + "..." : text;
    }
}
