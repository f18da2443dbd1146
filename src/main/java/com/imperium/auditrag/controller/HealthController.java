package com.imperium.auditrag.controller;

import com.imperium.auditrag.model.dto.response.HealthResponse;
import com.imperium.auditrag.service.HealthService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@Tag(name = "Health", description = "依赖健康检查")
public class HealthController {

    private final HealthService healthService;

    public HealthController(HealthService healthService) {
        this.healthService = healthService;
    }

    @GetMapping("/health")
    @Operation(summary = "健康检查", description = "探测 embedding 模型、Qdrant 与 LLM 端点；始终返回 200，状态见 status 字段")
    public ResponseEntity<HealthResponse> health() {
        return ResponseEntity.ok(healthService.check());
    }
}
