package me.golemcore.logwhisper.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import me.golemcore.logwhisper.domain.model.ErrorKind;
import me.golemcore.logwhisper.domain.model.ParseRequest;
import me.golemcore.logwhisper.domain.model.ParseResponse;
import me.golemcore.logwhisper.port.inbound.LogViewerPort;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Whole-content parsing of inline text or a file.
 */
@RestController
@RequestMapping("/api/parse")
@RequiredArgsConstructor
public class ParseController {

    private final LogViewerPort logViewerPort;

    @PostMapping
    public Mono<ResponseEntity<ParseResponse>> parse(@RequestBody ParseRequest request) {
        return Mono.fromCallable(() -> toResponse(logViewerPort.parse(request)))
                .subscribeOn(Schedulers.boundedElastic());
    }

    private ResponseEntity<ParseResponse> toResponse(ParseResponse response) {
        if (response.isSuccess()) {
            return ResponseEntity.ok(response);
        }
        HttpStatus status = response.getErrorKind() == ErrorKind.INPUT
                ? HttpStatus.BAD_REQUEST
                : HttpStatus.INTERNAL_SERVER_ERROR;
        return ResponseEntity.status(status).body(response);
    }
}
