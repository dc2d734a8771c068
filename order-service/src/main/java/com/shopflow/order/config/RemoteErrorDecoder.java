package com.shopflow.order.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.shopflow.common.exception.BusinessException;
import com.shopflow.common.exception.ErrorCode;
import feign.Response;
import feign.codec.ErrorDecoder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;

/**
 * 협력 서비스의 에러 응답을 BusinessException으로 되돌린다.
 *
 * <pre>
 *   stock-service 409 {"type":"https://shopflow.dev/errors/insufficient_stock", "detail":"...shortfall=2"}
 *     → BusinessException(INSUFFICIENT_STOCK, "...shortfall=2")
 *   알 수 없는 type / 본문 없음 / 파싱 실패
 *     → BusinessException(EXTERNAL_SERVICE_ERROR, "<methodKey> failed with HTTP <status>")
 * </pre>
 */
@Slf4j
@RequiredArgsConstructor
public class RemoteErrorDecoder implements ErrorDecoder {

    private final ObjectMapper objectMapper;

    @Override
    public Exception decode(String methodKey, Response response) {
        String fallbackMessage = methodKey + " failed with HTTP " + response.status();
        if (response.body() == null) {
            return new BusinessException(ErrorCode.EXTERNAL_SERVICE_ERROR, fallbackMessage);
        }

        try (InputStream body = response.body().asInputStream()) {
            JsonNode problem = objectMapper.readTree(body);
            if (problem == null || !problem.isObject()) {
                return new BusinessException(ErrorCode.EXTERNAL_SERVICE_ERROR, fallbackMessage);
            }
            String detail = problem.path("detail").asText(fallbackMessage);
            return ErrorCode.fromType(problem.path("type").asText(null))
                    .map(code -> new BusinessException(code, detail))
                    .orElseGet(() -> new BusinessException(ErrorCode.EXTERNAL_SERVICE_ERROR,
                            fallbackMessage + ": " + detail));
        } catch (IOException e) {
            log.warn("Unreadable error body from {}: status={}, error={}",
                    methodKey, response.status(), e.getMessage());
            return new BusinessException(ErrorCode.EXTERNAL_SERVICE_ERROR, fallbackMessage, e);
        }
    }
}
