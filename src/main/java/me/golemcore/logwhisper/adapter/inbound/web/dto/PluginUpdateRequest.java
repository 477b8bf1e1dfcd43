package me.golemcore.logwhisper.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Body of a plugin update. Omitted fields are left unchanged.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PluginUpdateRequest {
    private Boolean enabled;
    private Map<String, Object> configuration;
}
