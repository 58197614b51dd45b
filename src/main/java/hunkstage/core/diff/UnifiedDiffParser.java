package hunkstage.core.diff;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses the unified diff of a single file into a {@link FileDiff}.
 *
 * <p>Parsing is permissive: a line inside a hunk that is neither a change, a context line nor a
 * {@code \ No newline at end of file} marker is skipped and the rest of the diff is still read.
 */
public class UnifiedDiffParser {
  private static final Logger log = LoggerFactory.getLogger(UnifiedDiffParser.class);

  private static final Pattern HUNK_HEADER_PATTERN =
      Pattern.compile("^@@ -(\\d+)(?:,(\\d+))? \\+(\\d+)(?:,(\\d+))? @@(.*)$");
  static final String NO_NEWLINE_MARKER = "\\ No newline at end of file";

  public FileDiff parse(String diffText, String filePath) {
    List<Hunk> hunks = new ArrayList<>();
    StringBuilder fileHeader = new StringBuilder();
    FileStatus status = FileStatus.MODIFIED;
    String oldPath = null;
    boolean binary = false;
    int additions = 0;
    int deletions = 0;

    HunkBuilder current = null;
    for (String line : splitLines(diffText)) {
      if (current == null) {
        if (line.startsWith("Binary files") || line.startsWith("GIT binary patch")) {
          binary = true;
          continue;
        }
        if (line.startsWith("new file mode")) {
          status = FileStatus.ADDED;
        } else if (line.startsWith("deleted file mode")) {
          status = FileStatus.DELETED;
        } else if (line.startsWith("rename from ")) {
          oldPath = line.substring("rename from ".length());
          status = FileStatus.RENAMED;
        }
      }

      Matcher matcher = HUNK_HEADER_PATTERN.matcher(line);
      if (matcher.matches()) {
        if (current != null) {
          hunks.add(current.build());
        }
        current =
            new HunkBuilder(
                line,
                Integer.parseInt(matcher.group(1)),
                parseCount(matcher.group(2)),
                Integer.parseInt(matcher.group(3)),
                parseCount(matcher.group(4)),
                fileHeader.toString());
        continue;
      }

      if (current == null) {
        fileHeader.append(line).append('\n');
        continue;
      }

      if (line.startsWith("+") && !line.startsWith("+++")) {
        current.addAddition(line);
        additions++;
      } else if (line.startsWith("-") && !line.startsWith("---")) {
        current.addDeletion(line);
        deletions++;
      } else if (line.startsWith(" ")) {
        current.addContext(line);
      } else if (line.equals(NO_NEWLINE_MARKER)) {
        current.markNoNewlineAtEnd(line);
      } else if (!line.isEmpty()) {
        log.debug("diff_line_skipped path={} line={}", filePath, line);
      }
    }

    if (current != null) {
      hunks.add(current.build());
    }

    if (binary) {
      hunks.clear();
    }

    return new FileDiff(filePath, oldPath, status, binary, additions, deletions, hunks);
  }

  private static int parseCount(String group) {
    return group == null ? 1 : Integer.parseInt(group);
  }

  private static List<String> splitLines(String text) {
    if (text == null || text.isEmpty()) {
      return List.of();
    }
    String[] parts = text.split("\n", -1);
    int length = parts.length;
    if (text.endsWith("\n")) {
      length--;
    }
    List<String> lines = new ArrayList<>(length);
    for (int i = 0; i < length; i++) {
      lines.add(parts[i]);
    }
    return lines;
  }

  private static final class HunkBuilder {
    private final String header;
    private final int oldStart;
    private final int oldLines;
    private final int newStart;
    private final int newLines;
    private final String fileHeader;
    private final List<DiffLine> lines = new ArrayList<>();
    private final StringBuilder rawLines = new StringBuilder();
    private int oldCounter;
    private int newCounter;

    private HunkBuilder(
        String header, int oldStart, int oldLines, int newStart, int newLines, String fileHeader) {
      this.header = header;
      this.oldStart = oldStart;
      this.oldLines = oldLines;
      this.newStart = newStart;
      this.newLines = newLines;
      this.fileHeader = fileHeader;
      this.oldCounter = oldStart;
      this.newCounter = newStart;
      rawLines.append(header).append('\n');
    }

    void addAddition(String raw) {
      lines.add(new DiffLine.Add(raw.substring(1), newCounter++, lines.size(), false));
      rawLines.append(raw).append('\n');
    }

    void addDeletion(String raw) {
      lines.add(new DiffLine.Delete(raw.substring(1), oldCounter++, lines.size(), false));
      rawLines.append(raw).append('\n');
    }

    void addContext(String raw) {
      lines.add(
          new DiffLine.Context(raw.substring(1), oldCounter++, newCounter++, lines.size(), false));
      rawLines.append(raw).append('\n');
    }

    void markNoNewlineAtEnd(String raw) {
      if (lines.isEmpty()) {
        return;
      }
      int last = lines.size() - 1;
      lines.set(last, lines.get(last).withNoNewlineAtEnd());
      rawLines.append(raw).append('\n');
    }

    Hunk build() {
      return new Hunk(
          header, oldStart, oldLines, newStart, newLines, lines, fileHeader + rawLines);
    }
  }
}
