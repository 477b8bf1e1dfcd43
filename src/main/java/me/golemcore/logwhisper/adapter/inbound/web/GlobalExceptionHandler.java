package me.golemcore.logwhisper.adapter.inbound.web;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.logwhisper.adapter.inbound.web.dto.ApiErrorResponse;
import me.golemcore.logwhisper.domain.model.ErrorKind;
import me.golemcore.logwhisper.domain.model.LogInputException;
import me.golemcore.logwhisper.domain.model.PluginConfigurationException;
import me.golemcore.logwhisper.domain.model.PluginNotFoundException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import reactor.core.publisher.Mono;

/**
 * Maps domain failures raised by the web controllers to HTTP responses.
 */
@ControllerAdvice(basePackages = "me.golemcore.logwhisper.adapter.inbound.web.controller")
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(PluginNotFoundException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handlePluginNotFound(PluginNotFoundException ex) {
        log.warn("[API] Not found: {}", ex.getMessage());
        return respond(HttpStatus.NOT_FOUND, ex.getKind(), ex.getMessage());
    }

    @ExceptionHandler(LogInputException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleInput(LogInputException ex) {
        log.warn("[API] Bad request: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, ex.getKind(), ex.getMessage());
    }

    @ExceptionHandler(PluginConfigurationException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handlePluginConfiguration(PluginConfigurationException ex) {
        log.warn("[API] Rejected configuration for {}: {}", ex.getPluginName(), ex.getMessage());
        return respond(HttpStatus.UNPROCESSABLE_ENTITY, ex.getKind(), ex.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("[API] Bad request: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, ErrorKind.INPUT, ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleGeneric(Exception ex) {
        log.error("[API] Internal server error", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, ErrorKind.INTERNAL, "Internal server error");
    }

    private Mono<ResponseEntity<ApiErrorResponse>> respond(HttpStatus status, ErrorKind kind, String message) {
        ApiErrorResponse body = ApiErrorResponse.builder()
                .status(status.value())
                .kind(kind)
                .message(message)
                .build();
        return Mono.just(ResponseEntity.status(status).body(body));
    }
}
