package dev.quire.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.jspecify.annotations.Nullable;

/**
 * Body of {@code POST /api/chunks}. Omitted limits fall back to {@code quire.chunking.*}.
 *
 * @param text stylesheet text to chunk
 * @param sourceId identifier echoed back and used in logs; defaults to {@code "inline"}
 * @param maxChunkTokens per-request token maximum
 * @param minChunkTokens per-request token minimum
 * @param overlapTargetLines per-request planned overlap
 */
public record ChunkRequest(
    @JsonProperty("text") @NotBlank String text,
    @JsonProperty("source_id") @Nullable String sourceId,
    @JsonProperty("max_chunk_tokens") @Nullable @Min(1) Integer maxChunkTokens,
    @JsonProperty("min_chunk_tokens") @Nullable @Min(0) Integer minChunkTokens,
    @JsonProperty("overlap_target_lines") @Nullable @Min(0) Integer overlapTargetLines) {

  static final String DEFAULT_SOURCE_ID = "inline";

  public String sourceIdOrDefault() {
    return sourceId == null || sourceId.isBlank() ? DEFAULT_SOURCE_ID : sourceId;
  }
}
