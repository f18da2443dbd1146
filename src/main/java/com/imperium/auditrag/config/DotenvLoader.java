package com.imperium.auditrag.config;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * 启动前加载工作目录下的 .env 文件，将 KEY=VALUE 写入 System.setProperty，
 * 以便 application.yaml 中的 ${KEY}（QDRANT_HOST、OPENAI_BASE_URL、EMBED_MODEL 等）能解析到 .env 里的值。
 * <p>
 * 已存在的系统属性或环境变量优先，.env 只补缺省值。
 * 此时 Spring 与日志系统尚未初始化，只能输出到控制台。
 */
public final class DotenvLoader {

    private static final Pattern ENV_LINE = Pattern.compile("^(?:export\\s+)?([A-Za-z_][A-Za-z0-9_]*)=(.*)$");

    /** Spring AI 的 OpenAI client 会自行拼接 /v1，这些 key 需去掉尾部 /v1 */
    private static final Set<String> OPENAI_BASE_URL_KEYS = Set.of("OPENAI_BASE_URL", "OPENAI_EMBEDDING_BASE_URL");

    private DotenvLoader() {
    }

    public static void load() {
        load(Paths.get(System.getProperty("user.dir")).resolve(".env"));
    }

    /**
     * @return 实际写入系统属性的 key 数量
     */
    public static int load(Path envPath) {
        if (!Files.isRegularFile(envPath)) {
            System.out.println("[DotenvLoader] .env file not found at: " + envPath);
            return 0;
        }
        int loaded = 0;
        try {
            List<String> lines = Files.readAllLines(envPath);
            for (String line : lines) {
                String trimmed = line.trim();
                if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                    continue;
                }
                var matcher = ENV_LINE.matcher(trimmed);
                if (!matcher.matches()) {
                    continue;
                }
                String key = matcher.group(1).trim();
                String value = unquote(stripInlineComment(matcher.group(2).trim()));

                if (System.getProperty(key) != null || System.getenv(key) != null) {
                    System.out.println("[DotenvLoader] Skipped (already set): " + key);
                    continue;
                }

                // 用户在 .env 里把 base-url 配成 .../v1 时，请求会变成 .../v1/v1/... 从而 404
                if (OPENAI_BASE_URL_KEYS.contains(key)) {
                    String normalized = normalizeOpenAiBaseUrl(value);
                    if (!normalized.equals(value)) {
                        System.out.println("[DotenvLoader] Normalized " + key + " (removed trailing /v1): "
                                + value + " -> " + normalized);
                    }
                    value = normalized;
                }
                System.setProperty(key, value);
                loaded++;
                System.out.println("[DotenvLoader] Loaded: " + key + " = " + (isSecret(key) ? "***" : value));
            }
        } catch (Exception e) {
            System.err.println("[DotenvLoader] Failed to load .env: " + e.getMessage());
        }
        return loaded;
    }

    static String normalizeOpenAiBaseUrl(String value) {
        if (value == null) {
            return "";
        }
        String v = stripTrailingSlashes(value.trim());
        if (v.endsWith("/v1")) {
            v = v.substring(0, v.length() - 3);
        }
        return stripTrailingSlashes(v);
    }

    private static String stripTrailingSlashes(String v) {
        while (v.endsWith("/")) {
            v = v.substring(0, v.length() - 1);
        }
        return v;
    }

    private static boolean isSecret(String key) {
        return key.contains("KEY") || key.contains("SECRET") || key.contains("PASSWORD");
    }

    private static String stripInlineComment(String s) {
        if (s.startsWith("\"") || s.startsWith("'")) {
            return s;
        }
        int idx = s.indexOf(" #");
        return idx >= 0 ? s.substring(0, idx).trim() : s;
    }

    private static String unquote(String s) {
        if (s.length() >= 2 && ((s.startsWith("\"") && s.endsWith("\"")) || (s.startsWith("'") && s.endsWith("'")))) {
            return s.substring(1, s.length() - 1).replace("\\\"", "\"");
        }
        return s;
    }
}
