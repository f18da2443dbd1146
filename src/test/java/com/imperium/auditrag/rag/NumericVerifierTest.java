package com.imperium.auditrag.rag;

import com.imperium.auditrag.model.rag.Hit;
import com.imperium.auditrag.model.rag.HitPayload;
import com.imperium.auditrag.model.rag.VerificationResult;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class NumericVerifierTest {

    private final NumericVerifier verifier = new NumericVerifier();

    private static Hit amountHit(String id, Object amount) {
        return new Hit(id, 0.8, HitPayload.of(Map.of("amount", amount)));
    }

    @Test
    void answerWithoutNumbersPasses() {
        VerificationResult result = verifier.verify("The vendor was ACME.", List.of(amountHit("a", 1000)));

        assertThat(result.passed()).isTrue();
        assertThat(result.warning()).isEmpty();
    }

    @Test
    void groupedAndDecimalFormsMatchPlainAmount() {
        List<Hit> hits = List.of(amountHit("a", 1000), amountHit("b", "2,500.50"));

        assertThat(verifier.verify("Paid $1,000.00 and 2500.5 in total", hits).passed()).isTrue();
        assertThat(verifier.verify("Paid 1000", List.of(amountHit("c", 1000.0))).passed()).isTrue();
    }

    @Test
    void unmatchedTokensAreReportedInOrderOfAppearance() {
        VerificationResult result = verifier.verify("The payment was $2,000 across 45 entries.",
                List.of(amountHit("a", 1000)));

        assertThat(result.passed()).isFalse();
        assertThat(result.warning()).isEqualTo(
                "[VERIFICATION WARNING] Some numeric claims (2,000, 45) could not be verified from retrieved sources.");
    }

    @Test
    void matchedTokenIsNotListedInWarning() {
        VerificationResult result = verifier.verify("Amounts: 1000 and 2000", List.of(amountHit("a", 1000)));

        assertThat(result.warning()).contains("(2000)").doesNotContain("1000");
    }

    @Test
    void duplicateClaimsAreCollapsed() {
        VerificationResult result = verifier.verify("€300 then €300 again", List.of());

        assertThat(result.warning()).contains("(300)");
    }

    @Test
    void hitsWithoutAmountOnlyYieldWarningsForNumbers() {
        List<Hit> hits = List.of(new Hit("n", 0.5, HitPayload.of(Map.of("text", "no amount here"))));

        assertThat(verifier.verify("See [Source 1]", hits).passed()).isFalse();
        assertThat(verifier.verify("Nothing numeric", hits).passed()).isTrue();
    }

    @Test
    void normalizeCanonicalisesNumericStrings() {
        assertThat(NumericVerifier.normalize("1,000.00")).isEqualTo("1000");
        assertThat(NumericVerifier.normalize("$ 12.50")).isEqualTo("12.5");
        assertThat(NumericVerifier.normalize("N/A")).isEqualTo("N/A");
    }

    @Test
    void exponentAmountsAreComparedVerbatim() {
        VerificationResult result = verifier.verify("It was 5.", List.of(amountHit("a", "1E999999999")));

        assertThat(result.passed()).isFalse();
        assertThat(result.warning()).contains("(5)");
        assertThat(NumericVerifier.normalize("1E999999999")).isEqualTo("1E999999999");
        assertThat(NumericVerifier.normalize("-12.0")).isEqualTo("-12.0");
    }
}
