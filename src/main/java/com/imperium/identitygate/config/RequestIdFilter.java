package com.imperium.identitygate.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * 为每个请求分配 X-Request-Id（宿主传入则沿用），并写入 MDC 供日志输出。
 */
@Component
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
            MDC.remove(RequestIdSupport.MDC_CHANNEL);
            MDC.remove(RequestIdSupport.MDC_PEER_ID);
        }
    }
}
