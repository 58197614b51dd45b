package hunkstage.core.diff;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the diff of a file that git does not track yet: a single hunk adding every line of the
 * file, {@code @@ -0,0 +1,N @@}.
 */
public class UntrackedFileDiffFactory {

  public FileDiff create(String filePath, String content) {
    List<String> contentLines = splitContent(content);
    if (contentLines.isEmpty()) {
      return new FileDiff(filePath, null, FileStatus.UNTRACKED, false, 0, 0, List.of());
    }

    boolean missingFinalNewline = !content.endsWith("\n");
    int count = contentLines.size();
    String header = "@@ -0,0 +1," + count + " @@";

    List<DiffLine> lines = new ArrayList<>(count);
    StringBuilder rawPatch = new StringBuilder(PatchSynthesizer.newFileHeader(filePath));
    rawPatch.append(header).append('\n');
    for (int i = 0; i < count; i++) {
      boolean last = i == count - 1;
      boolean noNewline = last && missingFinalNewline;
      String text = contentLines.get(i);
      lines.add(new DiffLine.Add(text, i + 1, i, noNewline));
      rawPatch.append('+').append(text).append('\n');
      if (noNewline) {
        rawPatch.append(UnifiedDiffParser.NO_NEWLINE_MARKER).append('\n');
      }
    }

    Hunk hunk = new Hunk(header, 0, 0, 1, count, lines, rawPatch.toString());
    return new FileDiff(filePath, null, FileStatus.UNTRACKED, false, count, 0, List.of(hunk));
  }

  private static List<String> splitContent(String content) {
    if (content == null || content.isEmpty()) {
      return List.of();
    }
    String[] parts = content.split("\n", -1);
    int length = content.endsWith("\n") ? parts.length - 1 : parts.length;
    return List.of(parts).subList(0, length);
  }
}
