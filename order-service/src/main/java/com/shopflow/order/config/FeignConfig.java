package com.shopflow.order.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.shopflow.common.security.ServiceKeyFilter;
import com.shopflow.common.tracing.CorrelationIds;
import feign.Request;
import feign.RequestInterceptor;
import feign.codec.ErrorDecoder;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.cloud.openfeign.EnableFeignClients;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * 협력 서비스 Feign 공통 전송 설정
 *
 * <h3>모든 클라이언트에 공통 적용</h3>
 * <pre>
 *   Request.Options    : connect 3s / read 5s (무한 대기 방지)
 *   RequestInterceptor : X-API-Key (서비스 간 인증), X-Correlation-Id (로그 추적)
 *   ErrorDecoder       : ProblemDetail type → ErrorCode 복원
 * </pre>
 *
 * <h3>계단식 타임아웃</h3>
 * Feign read(5s) &lt; saga.step-timeout(10s). 팬아웃 단계의 합류 대기가 끝나기 전에
 * 개별 HTTP 호출이 먼저 실패해야 보상 대상이 정확히 기록된다.
 */
@Configuration
@EnableFeignClients(basePackages = "com.shopflow.order.client")
public class FeignConfig {

    @Bean
    public Request.Options feignRequestOptions(
            @Value("${shopflow.http.connect-timeout:3s}") Duration connectTimeout,
            @Value("${shopflow.http.read-timeout:5s}") Duration readTimeout) {
        return new Request.Options(
                connectTimeout.toMillis(), TimeUnit.MILLISECONDS,
                readTimeout.toMillis(), TimeUnit.MILLISECONDS,
                true);
    }

    @Bean
    public RequestInterceptor shopflowHeadersInterceptor(
            @Value("${shopflow.security.service-key:}") String serviceKey) {
        return template -> {
            if (StringUtils.hasText(serviceKey)) {
                template.header(ServiceKeyFilter.HEADER, serviceKey);
            }
            CorrelationIds.current()
                    .ifPresent(id -> template.header(CorrelationIds.HEADER, id));
        };
    }

    @Bean
    public ErrorDecoder remoteErrorDecoder(ObjectMapper objectMapper) {
        return new RemoteErrorDecoder(objectMapper);
    }
}
