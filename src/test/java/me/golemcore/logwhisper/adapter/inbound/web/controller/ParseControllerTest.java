package me.golemcore.logwhisper.adapter.inbound.web.controller;

import me.golemcore.logwhisper.domain.model.ErrorKind;
import me.golemcore.logwhisper.domain.model.ParseRequest;
import me.golemcore.logwhisper.domain.model.ParseResponse;
import me.golemcore.logwhisper.domain.model.ParseStats;
import me.golemcore.logwhisper.port.inbound.LogViewerPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import reactor.test.StepVerifier;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ParseControllerTest {

    private LogViewerPort logViewerPort;
    private ParseController controller;

    @BeforeEach
    void setUp() {
        logViewerPort = mock(LogViewerPort.class);
        controller = new ParseController(logViewerPort);
    }

    @Test
    void shouldReturnOkForSuccessfulParse() {
        ParseRequest request = ParseRequest.ofContent("INFO hello");
        ParseResponse parsed = ParseResponse.builder()
                .success(true)
                .results(List.of())
                .stats(ParseStats.empty())
                .cached(true)
                .build();
        when(logViewerPort.parse(request)).thenReturn(parsed);

        StepVerifier.create(controller.parse(request))
                .assertNext(response -> {
                    assertEquals(HttpStatus.OK, response.getStatusCode());
                    assertTrue(response.getBody().isCached());
                })
                .verifyComplete();
    }

    @Test
    void shouldReturnBadRequestForInputFailure() {
        ParseRequest request = ParseRequest.builder().build();
        when(logViewerPort.parse(request)).thenReturn(
                ParseResponse.failure(ErrorKind.INPUT, "Empty request: provide content or a file path"));

        StepVerifier.create(controller.parse(request))
                .assertNext(response -> {
                    assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
                    assertEquals("Empty request: provide content or a file path",
                            response.getBody().getErrorMessage());
                })
                .verifyComplete();
    }

    @Test
    void shouldReturnServerErrorForInternalFailure() {
        ParseRequest request = ParseRequest.ofContent("x");
        when(logViewerPort.parse(request)).thenReturn(ParseResponse.failure(ErrorKind.INTERNAL, "Parse timed out"));

        StepVerifier.create(controller.parse(request))
                .assertNext(response -> assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, response.getStatusCode()))
                .verifyComplete();
    }
}
