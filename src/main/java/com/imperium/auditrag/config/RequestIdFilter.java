package com.imperium.auditrag.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * 为每个请求绑定 requestId：写入 request attribute、响应头和 MDC，
 * 日志 pattern 中的 %X{requestId} 即可把一次 RAG 流水线的各阶段日志串起来。
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class RequestIdFilter extends OncePerRequestFilter {

    @Override
    protected void doFilterInternal(HttpServletRequest request,
            HttpServletResponse response,
            FilterChain filterChain) throws ServletException, IOException {
        String requestId = RequestIdSupport.resolve(request);
        response.setHeader(RequestIdSupport.HEADER_REQUEST_ID, requestId);
        MDC.put(RequestIdSupport.ATTR_REQUEST_ID, requestId);
        try {
            filterChain.doFilter(request, response);
        } finally {
            MDC.remove(RequestIdSupport.ATTR_REQUEST_ID);
        }
    }
}
