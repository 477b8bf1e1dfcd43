package me.golemcore.logwhisper.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import me.golemcore.logwhisper.domain.model.ChunkInfo;
import me.golemcore.logwhisper.domain.model.ChunkLayout;
import me.golemcore.logwhisper.domain.model.FileFingerprint;

import java.util.List;

/**
 * Chunk partition of an opened file.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChunkLayoutResponse {
    private String filePath;
    private long size;
    private long lastModified;
    private int totalLines;
    private int chunkSize;
    private int chunkCount;
    private List<ChunkInfo> chunks;

    public static ChunkLayoutResponse from(ChunkLayout layout) {
        FileFingerprint fingerprint = layout.getFingerprint();
        return ChunkLayoutResponse.builder()
                .filePath(fingerprint.source())
                .size(fingerprint.size())
                .lastModified(fingerprint.lastModifiedMillis())
                .totalLines(layout.getTotalLines())
                .chunkSize(layout.getChunkSize())
                .chunkCount(layout.getChunkCount())
                .chunks(layout.describeChunks())
                .build();
    }
}
