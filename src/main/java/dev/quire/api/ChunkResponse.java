package dev.quire.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import dev.quire.chunking.Chunk;
import java.util.List;

/** Result of {@code POST /api/chunks}: the chunks of one document in sequence order. */
public record ChunkResponse(
    @JsonProperty("source_id") String sourceId,
    @JsonProperty("line_count") int lineCount,
    @JsonProperty("chunk_count") int chunkCount,
    @JsonProperty("chunks") List<Chunk> chunks) {

  public ChunkResponse {
    chunks = List.copyOf(chunks);
  }
}
