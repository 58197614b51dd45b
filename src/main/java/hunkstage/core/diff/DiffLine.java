package hunkstage.core.diff;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One line of a hunk body. Each variant carries only the line numbers that exist on its side of
 * the diff: an {@link Add} has no old line number and a {@link Delete} has no new one.
 *
 * <p>{@code lineIndex} is the 0-based position of the line inside its owning hunk, counted across
 * all variants.
 */
public sealed interface DiffLine permits DiffLine.Context, DiffLine.Add, DiffLine.Delete {
  DiffLineType type();

  String content();

  int lineIndex();

  /** True when the diff marks this line with {@code \ No newline at end of file}. */
  boolean noNewlineAtEnd();

  DiffLine withNoNewlineAtEnd();

  @JsonIgnore
  default boolean isChange() {
    return type() != DiffLineType.CONTEXT;
  }

  record Context(
      String content, int oldLineNumber, int newLineNumber, int lineIndex, boolean noNewlineAtEnd)
      implements DiffLine {
    @Override
    @JsonProperty("type")
    public DiffLineType type() {
      return DiffLineType.CONTEXT;
    }

    @Override
    public Context withNoNewlineAtEnd() {
      return new Context(content, oldLineNumber, newLineNumber, lineIndex, true);
    }
  }

  record Add(String content, int newLineNumber, int lineIndex, boolean noNewlineAtEnd)
      implements DiffLine {
    @Override
    @JsonProperty("type")
    public DiffLineType type() {
      return DiffLineType.ADD;
    }

    @Override
    public Add withNoNewlineAtEnd() {
      return new Add(content, newLineNumber, lineIndex, true);
    }
  }

  record Delete(String content, int oldLineNumber, int lineIndex, boolean noNewlineAtEnd)
      implements DiffLine {
    @Override
    @JsonProperty("type")
    public DiffLineType type() {
      return DiffLineType.DELETE;
    }

    @Override
    public Delete withNoNewlineAtEnd() {
      return new Delete(content, oldLineNumber, lineIndex, true);
    }
  }
}
