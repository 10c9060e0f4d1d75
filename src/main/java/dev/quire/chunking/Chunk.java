package dev.quire.chunking;

import com.fasterxml.jackson.annotation.JsonProperty;
import dev.langchain4j.data.document.Metadata;
import dev.langchain4j.data.segment.TextSegment;
import dev.quire.chunking.profile.ChunkProfile;
import dev.quire.document.LineRange;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * One emitted segment of a document.
 *
 * <p>{@code startLine} includes the overlap repeated from the previous chunk of the same unit; the
 * lines this chunk owns are {@link #ownedRange()}. Owned ranges of all chunks of a document
 * partition it.
 *
 * @param id {@code chunk_NNN} for a unit, {@code chunk_NNN_sub_K} for its sub-segments
 * @param kind whole unit or sub-segment
 * @param unitType classification of the enclosing unit
 * @param name name of the enclosing unit; null for untitled sections
 * @param startLine first line, overlap included
 * @param endLine last line, inclusive
 * @param tokenEstimate estimated tokens of {@code startLine..endLine}
 * @param overlapWithPrevious leading lines shared with the previous chunk
 * @param parentUnitId id of the enclosing unit
 * @param sequenceIndex position in the document's chunk list
 * @param partIndex position among the chunks of the enclosing unit
 * @param boundaryFallback true when a cut next to this chunk is not a structural boundary
 * @param budgetExceeded true when the chunk is over the token maximum
 * @param text raw text of {@code startLine..endLine}
 * @param profile dependency and complexity summary
 */
public record Chunk(
    @JsonProperty("id") String id,
    @JsonProperty("kind") ChunkKind kind,
    @JsonProperty("unit_type") UnitType unitType,
    @JsonProperty("name") @Nullable String name,
    @JsonProperty("start_line") int startLine,
    @JsonProperty("end_line") int endLine,
    @JsonProperty("token_estimate") int tokenEstimate,
    @JsonProperty("overlap_with_previous") int overlapWithPrevious,
    @JsonProperty("parent_unit_id") String parentUnitId,
    @JsonProperty("sequence_index") int sequenceIndex,
    @JsonProperty("part_index") int partIndex,
    @JsonProperty("is_boundary_fallback") boolean boundaryFallback,
    @JsonProperty("is_budget_exceeded") boolean budgetExceeded,
    @JsonProperty("text") String text,
    @JsonProperty("profile") ChunkProfile profile) {

  public Chunk {
    Objects.requireNonNull(id, "id must not be null");
    Objects.requireNonNull(kind, "kind must not be null");
    Objects.requireNonNull(unitType, "unitType must not be null");
    Objects.requireNonNull(parentUnitId, "parentUnitId must not be null");
    Objects.requireNonNull(text, "text must not be null");
    Objects.requireNonNull(profile, "profile must not be null");
    if (startLine < 1 || endLine < startLine) {
      throw new IllegalArgumentException(
          "Invalid chunk lines [" + startLine + ", " + endLine + "] for " + id);
    }
    if (overlapWithPrevious < 0 || overlapWithPrevious > endLine - startLine) {
      throw new IllegalArgumentException(
          "Overlap of " + overlapWithPrevious + " lines leaves no owned line in " + id);
    }
  }

  /** Lines owned by this chunk, i.e. without the overlap repeated from its predecessor. */
  public LineRange ownedRange() {
    return new LineRange(startLine + overlapWithPrevious, endLine);
  }

  public int lineCount() {
    return endLine - startLine + 1;
  }

  /**
   * Converts chunk metadata to a langchain4j {@link Metadata} instance with snake_case keys.
   * Flags are stored as {@code "true"}/{@code "false"} strings.
   */
  public Metadata toMetadata() {
    Metadata metadata =
        Metadata.from("chunk_id", id)
            .put("kind", kind.value())
            .put("unit_type", unitType.value())
            .put("start_line", startLine)
            .put("end_line", endLine)
            .put("token_estimate", tokenEstimate)
            .put("overlap_with_previous", overlapWithPrevious)
            .put("parent_unit_id", parentUnitId)
            .put("sequence_index", sequenceIndex)
            .put("part_index", partIndex)
            .put("is_boundary_fallback", String.valueOf(boundaryFallback))
            .put("is_budget_exceeded", String.valueOf(budgetExceeded))
            .put("complexity_score", profile.complexityScore());
    if (name != null) {
      metadata.put("name", name);
    }
    if (!profile.dependencies().isEmpty()) {
      metadata.put("dependencies", String.join(",", profile.dependencies()));
    }
    return metadata;
  }

  /** Converts this chunk to a langchain4j {@link TextSegment}. */
  public TextSegment toTextSegment() {
    return TextSegment.from(text, toMetadata());
  }
}
