package com.marginledger.config;

import com.marginledger.api.ApiHeaders;
import com.marginledger.api.dto.response.ApiErrorResponse;
import com.marginledger.api.dto.response.ApiResponse;
import org.springframework.core.MethodParameter;
import org.springframework.http.MediaType;
import org.springframework.http.converter.HttpMessageConverter;
import org.springframework.http.converter.StringHttpMessageConverter;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.mvc.method.annotation.ResponseBodyAdvice;

/**
 * Wraps successful ledger responses in {@link ApiResponse}, tagged with the calling account
 * from the {@code X-Account} header. Errors are already rendered as {@link ApiErrorResponse}.
 */
@RestControllerAdvice
public class ApiResponseAdvice implements ResponseBodyAdvice<Object> {

    private static final String API_PREFIX = "/api/";
    private static final String HEALTH_PATH = "/api/health";

    @Override
    public boolean supports(MethodParameter returnType, Class<? extends HttpMessageConverter<?>> converterType) {
        return !StringHttpMessageConverter.class.isAssignableFrom(converterType);
    }

    @Override
    public Object beforeBodyWrite(
            Object body,
            MethodParameter returnType,
            MediaType selectedContentType,
            Class<? extends HttpMessageConverter<?>> selectedConverterType,
            ServerHttpRequest request,
            ServerHttpResponse response) {

        String path = request.getURI().getPath();

        // Actuator, /error and the health check keep their plain bodies
        if (!path.startsWith(API_PREFIX) || path.equals(HEALTH_PATH)) {
            return body;
        }
        if (body instanceof ApiResponse<?> || body instanceof ApiErrorResponse) {
            return body;
        }

        String caller = request.getHeaders().getFirst(ApiHeaders.CALLER);
        return ApiResponse.of(body, caller);
    }
}
