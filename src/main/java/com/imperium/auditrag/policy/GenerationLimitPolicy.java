package com.imperium.auditrag.policy;

/**
 * 生成阶段的固定限制：最大输出 token 与温度。超时由 app.llm.timeout 配置。
 * 温度固定为 0，保证相同查询与证据得到相同回答。
 */
public final class GenerationLimitPolicy {

    public static final int MAX_TOKENS = 512;

    public static final double TEMPERATURE = 0.0;

    private GenerationLimitPolicy() {}
}
