package com.imperium.auditrag.config;

import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.MDC;

import java.util.UUID;
import java.util.regex.Pattern;

/**
 * 请求 ID 工具：上游（如 api-services 网关）透传的 X-Request-Id 优先，否则生成 req_ 前缀 ID。
 */
public final class RequestIdSupport {

    public static final String HEADER_REQUEST_ID = "X-Request-Id";
    public static final String ATTR_REQUEST_ID = "requestId";

    /** 只接受可安全写入日志的 ID，避免日志注入 */
    private static final Pattern SAFE_ID = Pattern.compile("^[A-Za-z0-9._:-]{1,64}$");

    private RequestIdSupport() {
    }

    public static String newRequestId() {
        return "req_" + UUID.randomUUID().toString().replace("-", "").substring(0, 16);
    }

    /** 上游传入的 ID 合法则沿用，否则生成新的 */
    public static String acceptOrGenerate(String inbound) {
        if (inbound != null && SAFE_ID.matcher(inbound.trim()).matches()) {
            return inbound.trim();
        }
        return newRequestId();
    }

    public static String resolve(HttpServletRequest request) {
        if (request == null) {
            return current();
        }
        Object attr = request.getAttribute(ATTR_REQUEST_ID);
        if (attr instanceof String value && !value.isBlank()) {
            return value;
        }
        String resolved = acceptOrGenerate(request.getHeader(HEADER_REQUEST_ID));
        request.setAttribute(ATTR_REQUEST_ID, resolved);
        return resolved;
    }

    /** 当前线程 MDC 中的请求 ID；不在请求线程内时生成一个新的 */
    public static String current() {
        String fromMdc = MDC.get(ATTR_REQUEST_ID);
        return fromMdc != null ? fromMdc : newRequestId();
    }
}
