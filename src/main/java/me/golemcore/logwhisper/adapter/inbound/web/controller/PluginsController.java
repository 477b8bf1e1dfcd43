package me.golemcore.logwhisper.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import me.golemcore.logwhisper.adapter.inbound.web.dto.PluginUpdateRequest;
import me.golemcore.logwhisper.domain.model.PluginCapability;
import me.golemcore.logwhisper.domain.model.PluginUpdate;
import me.golemcore.logwhisper.port.inbound.LogViewerPort;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Renderer plugin introspection and runtime configuration.
 */
@RestController
@RequestMapping("/api/plugins")
@RequiredArgsConstructor
public class PluginsController {

    private final LogViewerPort logViewerPort;

    @GetMapping
    public Mono<ResponseEntity<List<PluginCapability>>> listPlugins() {
        return Mono.fromCallable(() -> ResponseEntity.ok(logViewerPort.listPlugins()));
    }

    @PutMapping("/{name}")
    public Mono<ResponseEntity<PluginCapability>> updatePlugin(
            @PathVariable String name,
            @RequestBody PluginUpdateRequest request) {
        PluginUpdate update = PluginUpdate.builder()
                .name(name)
                .enabled(request.getEnabled())
                .configuration(request.getConfiguration())
                .build();
        return Mono.fromCallable(() -> ResponseEntity.ok(logViewerPort.updatePlugin(update)));
    }
}
