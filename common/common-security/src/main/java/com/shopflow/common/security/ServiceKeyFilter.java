package com.shopflow.common.security;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ProblemDetail;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Arrays;
import java.util.List;

/**
 * 서비스 간 API Key 필터 (Service Key Filter)
 *
 * <p>서비스 간 전용 엔드포인트(기본: {@code /stock/**})에 들어오는 요청의
 * {@code X-API-Key} 헤더를 공유 키와 비교한다. 사용자 인증은 게이트웨이 몫이고,
 * 이 필터는 "다른 내부 서비스가 보낸 요청인가"만 확인한다.</p>
 *
 * <h3>검증 흐름</h3>
 * <pre>
 *   order-service (Feign RequestInterceptor: X-API-Key 추가)
 *     → stock-service ServiceKeyFilter
 *         1. 보호 경로가 아니면 통과
 *         2. 공유 키가 설정되지 않았으면 통과 (로컬 개발)
 *         3. 헤더 값이 다르면 401 ProblemDetail
 * </pre>
 */
@Slf4j
@Component
public class ServiceKeyFilter extends OncePerRequestFilter {

    public static final String HEADER = "X-API-Key";

    private final byte[] serviceKey;
    private final List<String> protectedPaths;
    private final ObjectMapper objectMapper;

    public ServiceKeyFilter(@Value("${shopflow.security.service-key:}") String serviceKey,
                            @Value("${shopflow.security.protected-paths:/stock}") String[] protectedPaths,
                            ObjectMapper objectMapper) {
        this.serviceKey = serviceKey.getBytes(StandardCharsets.UTF_8);
        this.protectedPaths = Arrays.asList(protectedPaths);
        this.objectMapper = objectMapper;
        if (!StringUtils.hasText(serviceKey)) {
            log.warn("shopflow.security.service-key is not set; service-to-service endpoints are unprotected");
        }
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        if (serviceKey.length == 0) {
            return true;
        }
        String path = request.getRequestURI();
        return protectedPaths.stream().noneMatch(path::startsWith);
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response,
                                    FilterChain chain) throws ServletException, IOException {
        String presented = request.getHeader(HEADER);
        if (presented != null
                && MessageDigest.isEqual(serviceKey, presented.getBytes(StandardCharsets.UTF_8))) {
            chain.doFilter(request, response);
            return;
        }

        log.warn("Rejected service call without valid {}: {} {}", HEADER,
                request.getMethod(), request.getRequestURI());
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(
                HttpStatus.UNAUTHORIZED, "Missing or invalid " + HEADER);
        problem.setType(URI.create("https://shopflow.dev/errors/unauthorized_service"));
        response.setStatus(HttpStatus.UNAUTHORIZED.value());
        response.setContentType(MediaType.APPLICATION_PROBLEM_JSON_VALUE);
        objectMapper.writeValue(response.getOutputStream(), problem);
    }
}
