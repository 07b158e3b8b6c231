package com.edge.odometry.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.unit.DataSize;
import org.springframework.web.filter.OncePerRequestFilter;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 请求体大小限制
 * <p>
 * 在 Jackson 解析帧数组之前按 Content-Length 拒绝过大的请求（413）。
 * 未声明长度的分块请求不在此拦截，解析后仍受 max-frame-side 限制
 */
@Component
public class RequestSizeLimitFilter extends OncePerRequestFilter {
    private static final Logger logger = LoggerFactory.getLogger(RequestSizeLimitFilter.class);

    private final DataSize maxRequestSize;
    private final ObjectMapper objectMapper;

    public RequestSizeLimitFilter(@Value("${edge-odometry.input.max-request-size:64MB}") DataSize maxRequestSize,
                                  ObjectMapper objectMapper) {
        this.maxRequestSize = maxRequestSize;
        this.objectMapper = objectMapper;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return !request.getRequestURI().startsWith("/api/");
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        long length = request.getContentLengthLong();
        if (length > maxRequestSize.toBytes()) {
            logger.warn("Rejected {} {}: body of {} bytes exceeds {}", request.getMethod(), request.getRequestURI(),
                    length, maxRequestSize);

            Map<String, Object> body = new LinkedHashMap<>();
            body.put("status", "error");
            body.put("message", String.format("Request body of %d bytes exceeds the limit of %d bytes",
                    length, maxRequestSize.toBytes()));

            response.setStatus(HttpStatus.PAYLOAD_TOO_LARGE.value());
            response.setContentType(MediaType.APPLICATION_JSON_VALUE);
            response.setCharacterEncoding(StandardCharsets.UTF_8.name());
            objectMapper.writeValue(response.getOutputStream(), body);
            return;
        }
        filterChain.doFilter(request, response);
    }
}
