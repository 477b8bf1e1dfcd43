package me.golemcore.logwhisper.adapter.inbound.web.controller;

import me.golemcore.logwhisper.adapter.inbound.web.dto.PluginUpdateRequest;
import me.golemcore.logwhisper.domain.model.PluginCapability;
import me.golemcore.logwhisper.domain.model.PluginNotFoundException;
import me.golemcore.logwhisper.domain.model.PluginUpdate;
import me.golemcore.logwhisper.port.inbound.LogViewerPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.HttpStatus;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class PluginsControllerTest {

    private LogViewerPort logViewerPort;
    private PluginsController controller;

    @BeforeEach
    void setUp() {
        logViewerPort = mock(LogViewerPort.class);
        controller = new PluginsController(logViewerPort);
    }

    @Test
    void shouldListPlugins() {
        List<PluginCapability> plugins = List.of(
                PluginCapability.builder().name("sql").priority(100).enabled(true).build(),
                PluginCapability.builder().name("raw").priority(0).enabled(true).build());
        when(logViewerPort.listPlugins()).thenReturn(plugins);

        StepVerifier.create(controller.listPlugins())
                .assertNext(response -> {
                    assertEquals(HttpStatus.OK, response.getStatusCode());
                    assertEquals(2, response.getBody().size());
                    assertEquals("sql", response.getBody().get(0).getName());
                })
                .verifyComplete();
    }

    @Test
    void shouldUpdatePluginByPathName() {
        when(logViewerPort.updatePlugin(any(PluginUpdate.class))).thenReturn(
                PluginCapability.builder().name("json").enabled(false).build());
        PluginUpdateRequest request = PluginUpdateRequest.builder()
                .enabled(false)
                .configuration(Map.of("maxCandidates", 4))
                .build();

        StepVerifier.create(controller.updatePlugin("json", request))
                .assertNext(response -> assertFalse(response.getBody().isEnabled()))
                .verifyComplete();

        ArgumentCaptor<PluginUpdate> captor = ArgumentCaptor.forClass(PluginUpdate.class);
        verify(logViewerPort).updatePlugin(captor.capture());
        assertEquals("json", captor.getValue().getName());
        assertEquals(Boolean.FALSE, captor.getValue().getEnabled());
        assertEquals(4, captor.getValue().getConfiguration().get("maxCandidates"));
    }

    @Test
    void shouldPropagateUnknownPlugin() {
        when(logViewerPort.updatePlugin(any(PluginUpdate.class))).thenThrow(new PluginNotFoundException("xml"));

        StepVerifier.create(controller.updatePlugin("xml", PluginUpdateRequest.builder().enabled(true).build()))
                .expectError(PluginNotFoundException.class)
                .verify();
    }
}
