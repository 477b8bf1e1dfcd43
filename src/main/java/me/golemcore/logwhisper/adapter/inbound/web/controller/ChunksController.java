package me.golemcore.logwhisper.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import me.golemcore.logwhisper.adapter.inbound.web.dto.ChunkLayoutResponse;
import me.golemcore.logwhisper.adapter.inbound.web.dto.OpenFileRequest;
import me.golemcore.logwhisper.adapter.inbound.web.dto.VisibleChunksRequest;
import me.golemcore.logwhisper.domain.model.ChunkInfo;
import me.golemcore.logwhisper.domain.model.ChunkLoadRequest;
import me.golemcore.logwhisper.domain.model.ChunkLoadResponse;
import me.golemcore.logwhisper.port.inbound.LogViewerPort;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;

/**
 * Chunked browsing of large files: open, load and report the visible window.
 */
@RestController
@RequestMapping("/api/chunks")
@RequiredArgsConstructor
public class ChunksController {

    private final LogViewerPort logViewerPort;

    @PostMapping("/open")
    public Mono<ResponseEntity<ChunkLayoutResponse>> openFile(@RequestBody OpenFileRequest request) {
        return Mono.fromCallable(() -> ResponseEntity.ok(
                ChunkLayoutResponse.from(logViewerPort.openFile(request.getFilePath()))))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @PostMapping("/load")
    public Mono<ResponseEntity<ChunkLoadResponse>> loadChunks(@RequestBody ChunkLoadRequest request) {
        return Mono.fromCallable(() -> ResponseEntity.ok(logViewerPort.loadChunks(request)))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @PostMapping("/visible")
    public Mono<ResponseEntity<List<ChunkInfo>>> setVisibleChunks(@RequestBody VisibleChunksRequest request) {
        return Mono.fromCallable(() -> ResponseEntity.ok(
                logViewerPort.setVisibleChunks(request.getFilePath(), request.getChunkIndices())));
    }
}
