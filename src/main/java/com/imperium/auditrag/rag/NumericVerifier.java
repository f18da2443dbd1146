package com.imperium.auditrag.rag;

import com.imperium.auditrag.model.rag.Hit;
import com.imperium.auditrag.model.rag.HitPayload;
import com.imperium.auditrag.model.rag.VerificationResult;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 回答中数值声明的词法校验：抽取回答里形似金额的数字，检查是否出现在命中的 amount 字段中。
 * <p>
 * 只做字面比对，不理解语义；年份、条数、来源序号等非金额数字同样会被抽取，
 * 它们通常不在 amount 中，因此可能产生误报，调用方只把结果当作提示。
 */
@Component
public class NumericVerifier {

    /** 可选货币符号 + 千分位分组或连续数字 + 可选小数部分；group(1) 为数字部分 */
    static final Pattern AMOUNT_TOKEN =
            Pattern.compile("[$€£¥]?\\s*(\\d{1,3}(?:,\\d{3})+(?:\\.\\d+)?|\\d+(?:\\.\\d+)?)");

    private static final Pattern STRIPPED_CHARS = Pattern.compile("[,$€£¥\\s]");

    /** 只有纯十进制写法才按数值规范化；指数写法等其它形式一律按原文比较 */
    private static final Pattern PLAIN_DECIMAL = Pattern.compile("\\d+(?:\\.\\d+)?");

    public VerificationResult verify(String answerText, List<Hit> hits) {
        if (answerText == null || answerText.isEmpty()) {
            return VerificationResult.pass();
        }

        Set<String> claims = new LinkedHashSet<>();
        Matcher matcher = AMOUNT_TOKEN.matcher(answerText);
        while (matcher.find()) {
            claims.add(matcher.group(1));
        }
        if (claims.isEmpty()) {
            return VerificationResult.pass();
        }

        Set<String> knownAmounts = collectAmounts(hits);
        Set<String> unverified = new LinkedHashSet<>();
        for (String claim : claims) {
            if (!knownAmounts.contains(normalize(claim))) {
                unverified.add(claim);
            }
        }
        if (unverified.isEmpty()) {
            return VerificationResult.pass();
        }
        return VerificationResult.fail("[VERIFICATION WARNING] Some numeric claims ("
                + String.join(", ", unverified)
                + ") could not be verified from retrieved sources.");
    }

    private static Set<String> collectAmounts(List<Hit> hits) {
        Set<String> amounts = new HashSet<>();
        if (hits == null) {
            return amounts;
        }
        for (Hit hit : hits) {
            hit.payload().amount()
                    .map(HitPayload::render)
                    .map(NumericVerifier::normalize)
                    .ifPresent(amounts::add);
        }
        return amounts;
    }

    /**
     * 去掉千分位逗号、货币符号与空白后按数值规范化：1000、1000.0、1,000.00 得到同一结果。
     * 不是纯十进制写法的字符串（含 1E999999999 这类指数写法）原样保留，
     * 规范化结果的长度因此不会超过输入。
     */
    static String normalize(String raw) {
        String cleaned = STRIPPED_CHARS.matcher(raw).replaceAll("");
        if (!PLAIN_DECIMAL.matcher(cleaned).matches()) {
            return cleaned;
        }
        return new BigDecimal(cleaned).stripTrailingZeros().toPlainString();
    }
}
