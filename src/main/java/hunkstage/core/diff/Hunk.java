package hunkstage.core.diff;

import java.util.List;

/**
 * A contiguous block of a unified diff sharing one {@code @@} header.
 *
 * <p>{@code rawPatch} holds the file header, this hunk's header and its body exactly as read, so
 * it can be applied on its own.
 */
public record Hunk(
    String header,
    int oldStart,
    int oldLines,
    int newStart,
    int newLines,
    List<DiffLine> lines,
    String rawPatch) {
  public Hunk {
    lines = lines == null ? List.of() : List.copyOf(lines);
  }

  public boolean hasRawPatch() {
    return rawPatch != null && !rawPatch.isBlank();
  }
}
