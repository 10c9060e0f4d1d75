package dev.quire.api;

import dev.quire.chunking.Chunk;
import dev.quire.chunking.ChunkAssembler;
import dev.quire.chunking.ChunkingConfig;
import dev.quire.chunking.ChunkingProperties;
import dev.quire.document.LineIndexedDocument;
import jakarta.validation.Valid;
import java.util.List;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST adapter over the {@link ChunkAssembler}.
 *
 * <p>Input problems surface as 400 Problem Details through {@link
 * dev.quire.config.GlobalExceptionHandler}.
 */
@RestController
@RequestMapping("/api/chunks")
public class ChunkController {

  private final ChunkAssembler assembler;
  private final ChunkingProperties properties;

  public ChunkController(ChunkAssembler assembler, ChunkingProperties properties) {
    this.assembler = assembler;
    this.properties = properties;
  }

  @PostMapping
  public ChunkResponse chunk(@Valid @RequestBody ChunkRequest request) {
    ChunkingConfig config =
        properties.toConfig(
            request.maxChunkTokens(), request.minChunkTokens(), request.overlapTargetLines());
    LineIndexedDocument document =
        new LineIndexedDocument(request.text(), request.sourceIdOrDefault());
    List<Chunk> chunks = assembler.chunk(document, config);
    return new ChunkResponse(document.sourceId(), document.lineCount(), chunks.size(), chunks);
  }
}
