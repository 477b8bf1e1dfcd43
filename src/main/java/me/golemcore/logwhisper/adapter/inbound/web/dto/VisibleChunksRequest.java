package me.golemcore.logwhisper.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VisibleChunksRequest {
    private String filePath;
    @Builder.Default
    private List<Integer> chunkIndices = new ArrayList<>();
}
