package com.imperium.auditrag.model.rag;

public record VerificationResult(
        boolean passed,
        String warning
) {
    private static final VerificationResult PASSED = new VerificationResult(true, "");

    public static VerificationResult pass() {
        return PASSED;
    }

    public static VerificationResult fail(String warning) {
        return new VerificationResult(false, warning);
    }
}
