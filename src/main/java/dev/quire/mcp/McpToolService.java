package dev.quire.mcp;

import dev.quire.chunking.Chunk;
import dev.quire.chunking.ChunkAssembler;
import dev.quire.chunking.ChunkingConfig;
import dev.quire.chunking.ChunkingProperties;
import dev.quire.document.DocumentException;
import java.util.List;
import java.util.Optional;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.stereotype.Service;

/**
 * MCP adapter exposing the chunking engine as tool methods for LLM agents.
 *
 * <p>Each method is annotated with {@code @Tool} and registered via {@link McpToolConfig}. Tool
 * methods follow the structured error pattern: all exceptions are caught and returned as
 * descriptive error strings, never thrown.
 *
 * <p>Chunking is deterministic for a given text and configuration, so {@code read_chunk} re-runs
 * it instead of keeping state between calls.
 *
 * @see TokenBudgetTruncator
 */
@Service
public class McpToolService {

  private static final Logger log = LoggerFactory.getLogger(McpToolService.class);

  private static final String DEFAULT_SOURCE_ID = "stylesheet";

  private final ChunkAssembler assembler;
  private final ChunkingProperties properties;
  private final TokenBudgetTruncator truncator;

  public McpToolService(
      ChunkAssembler assembler, ChunkingProperties properties, TokenBudgetTruncator truncator) {
    this.assembler = assembler;
    this.properties = properties;
    this.truncator = truncator;
  }

  /** Chunks a stylesheet and lists the resulting chunks within the response token budget. */
  @Tool(
      name = "chunk_stylesheet",
      description =
          "Split an XSLT stylesheet into semantically coherent chunks within a token budget. "
              + "Returns the chunk listing: ids, unit types and names, line ranges, token "
              + "estimates, overlap, fallback/budget flags and dependencies. Use read_chunk to "
              + "fetch chunk text.")
  public String chunkStylesheet(
      @ToolParam(description = "Full stylesheet text") @Nullable String text,
      @ToolParam(description = "Identifier of the stylesheet, e.g. its file name", required = false)
          @Nullable String sourceId,
      @ToolParam(description = "Maximum estimated tokens per chunk (default 15000)", required = false)
          @Nullable Integer maxChunkTokens) {
    try {
      if (text == null || text.isBlank()) {
        return "Error: Stylesheet text must not be empty.";
      }
      String source = sourceIdOrDefault(sourceId);
      List<Chunk> chunks = assembler.chunk(text, source, configFor(maxChunkTokens));
      long flagged =
          chunks.stream().filter(c -> c.boundaryFallback() || c.budgetExceeded()).count();
      return "Chunked %s into %d chunks (%d flagged).\n\n%s"
          .formatted(source, chunks.size(), flagged, truncator.truncate(chunks));
    } catch (DocumentException | IllegalArgumentException e) {
      return "Error: " + e.getMessage();
    } catch (Exception e) {
      log.warn("chunk_stylesheet failed", e);
      return "Error chunking stylesheet: " + e.getMessage();
    }
  }

  /** Returns the text of one chunk, identified by the id listed by {@code chunk_stylesheet}. */
  @Tool(
      name = "read_chunk",
      description =
          "Return the text of one chunk of an XSLT stylesheet. Pass the same text and "
              + "max_chunk_tokens as for chunk_stylesheet, and a chunk id such as chunk_003 or "
              + "chunk_003_sub_2.")
  public String readChunk(
      @ToolParam(description = "Full stylesheet text") @Nullable String text,
      @ToolParam(description = "Chunk id from the chunk_stylesheet listing") @Nullable String chunkId,
      @ToolParam(description = "Maximum estimated tokens per chunk (default 15000)", required = false)
          @Nullable Integer maxChunkTokens) {
    try {
      if (text == null || text.isBlank()) {
        return "Error: Stylesheet text must not be empty.";
      }
      if (chunkId == null || chunkId.isBlank()) {
        return "Error: Chunk id must not be empty.";
      }
      List<Chunk> chunks =
          assembler.chunk(text, DEFAULT_SOURCE_ID, configFor(maxChunkTokens));
      Optional<Chunk> match =
          chunks.stream().filter(c -> c.id().equals(chunkId.trim())).findFirst();
      if (match.isEmpty()) {
        return "Error: No chunk with id '%s'. The stylesheet has %d chunks (chunk_001 to %s)."
            .formatted(chunkId, chunks.size(), chunks.get(chunks.size() - 1).id());
      }
      Chunk chunk = match.get();
      return "## %s (lines %d-%d, overlap %d)\n\n%s"
          .formatted(
              chunk.id(),
              chunk.startLine(),
              chunk.endLine(),
              chunk.overlapWithPrevious(),
              chunk.text());
    } catch (DocumentException | IllegalArgumentException e) {
      return "Error: " + e.getMessage();
    } catch (Exception e) {
      log.warn("read_chunk failed", e);
      return "Error reading chunk: " + e.getMessage();
    }
  }

  private ChunkingConfig configFor(@Nullable Integer maxChunkTokens) {
    return properties.toConfig(maxChunkTokens, null, null);
  }

  private static String sourceIdOrDefault(@Nullable String sourceId) {
    return sourceId == null || sourceId.isBlank() ? DEFAULT_SOURCE_ID : sourceId;
  }
}
