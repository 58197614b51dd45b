package hunkstage.core.diff;

import hunkstage.core.git.PatchDirection;
import java.util.Collection;
import java.util.Set;
import java.util.TreeSet;

/**
 * Builds a standalone patch for a subset of one hunk's lines.
 *
 * <p>For a forward patch, selected changes are emitted as they are. An unselected deletion stays
 * in the patch as context, so the line survives on both sides. An unselected addition is dropped
 * entirely: it only exists on the new side and cannot serve as context for the old side.
 *
 * <p>A reverse patch is matched against the new side, so the roles swap: an unselected addition
 * is present there and becomes context, and an unselected deletion is absent and is dropped.
 *
 * <p>Start offsets are copied from the source hunk; only the counts are recomputed.
 */
public class PatchSynthesizer {

  public SynthesizedPatch synthesize(
      String filePath, Hunk hunk, Collection<Integer> selectedLineIndices) {
    return synthesize(filePath, hunk, selectedLineIndices, PatchDirection.FORWARD, false);
  }

  /**
   * @param direction direction the patch will be applied in
   * @param newFile emit a file-creation header ({@code --- /dev/null}) instead of a modification
   *     header; used when the path does not exist on the old side yet
   */
  public SynthesizedPatch synthesize(
      String filePath,
      Hunk hunk,
      Collection<Integer> selectedLineIndices,
      PatchDirection direction,
      boolean newFile) {
    if (selectedLineIndices == null || selectedLineIndices.isEmpty()) {
      throw new IllegalArgumentException("Line selection must not be empty.");
    }
    Set<Integer> selected = new TreeSet<>();
    for (Integer index : selectedLineIndices) {
      if (index == null || index < 0 || index >= hunk.lines().size()) {
        throw new IllegalArgumentException("Line index out of range: " + index);
      }
      selected.add(index);
    }
    DiffLineType keptWhenUnselected =
        direction == PatchDirection.REVERSE ? DiffLineType.ADD : DiffLineType.DELETE;

    StringBuilder body = new StringBuilder();
    int oldCount = 0;
    int newCount = 0;
    for (DiffLine line : hunk.lines()) {
      boolean isSelected = selected.contains(line.lineIndex());
      char marker;
      if (line.type() == DiffLineType.CONTEXT
          || (!isSelected && line.type() == keptWhenUnselected)) {
        marker = DiffLineType.CONTEXT.marker();
        oldCount++;
        newCount++;
      } else if (!isSelected) {
        continue;
      } else if (line.type() == DiffLineType.ADD) {
        marker = DiffLineType.ADD.marker();
        newCount++;
      } else {
        marker = DiffLineType.DELETE.marker();
        oldCount++;
      }
      body.append(marker).append(line.content()).append('\n');
      if (line.noNewlineAtEnd()) {
        body.append(UnifiedDiffParser.NO_NEWLINE_MARKER).append('\n');
      }
    }

    String header =
        "@@ -"
            + startFor(hunk.oldStart(), oldCount)
            + ","
            + oldCount
            + " +"
            + startFor(hunk.newStart(), newCount)
            + ","
            + newCount
            + " @@";
    String fileHeader = newFile ? newFileHeader(filePath) : modifiedFileHeader(filePath);
    return new SynthesizedPatch(header, oldCount, newCount, fileHeader + header + "\n" + body);
  }

  // A range that holds lines starts at line 1 or later; "0" is only valid for an empty range.
  private static int startFor(int start, int count) {
    return count > 0 && start == 0 ? 1 : start;
  }

  static String modifiedFileHeader(String filePath) {
    return "diff --git a/"
        + filePath
        + " b/"
        + filePath
        + "\n--- a/"
        + filePath
        + "\n+++ b/"
        + filePath
        + "\n";
  }

  static String newFileHeader(String filePath) {
    return "diff --git a/"
        + filePath
        + " b/"
        + filePath
        + "\nnew file mode 100644\n--- /dev/null\n+++ b/"
        + filePath
        + "\n";
  }
}
