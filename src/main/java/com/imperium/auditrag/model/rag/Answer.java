package com.imperium.auditrag.model.rag;

/**
 * 流水线内部的回答：正文、数值校验是否通过、校验提示（可为 null）。
 */
public record Answer(
        String text,
        boolean verified,
        String warning
) {
    public static Answer unverified(String text) {
        return new Answer(text, false, null);
    }
}
