package me.golemcore.logwhisper.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import me.golemcore.logwhisper.domain.model.CacheDiagnostics;
import me.golemcore.logwhisper.domain.model.EvictionResult;
import me.golemcore.logwhisper.port.inbound.LogViewerPort;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * Cache diagnostics and forced eviction.
 */
@RestController
@RequestMapping("/api/cache")
@RequiredArgsConstructor
public class CacheController {

    private final LogViewerPort logViewerPort;

    @GetMapping("/diagnostics")
    public Mono<ResponseEntity<CacheDiagnostics>> diagnostics() {
        return Mono.just(ResponseEntity.ok(logViewerPort.diagnostics()));
    }

    @DeleteMapping
    public Mono<ResponseEntity<EvictionResult>> evictAll() {
        return Mono.fromCallable(() -> ResponseEntity.ok(logViewerPort.evictAll()));
    }
}
