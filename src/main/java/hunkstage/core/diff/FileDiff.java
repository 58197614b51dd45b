package hunkstage.core.diff;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

@JsonInclude(Include.NON_NULL)
public record FileDiff(
    String filePath,
    String oldPath,
    FileStatus status,
    @JsonProperty("isBinary") boolean binary,
    int additions,
    int deletions,
    List<Hunk> hunks) {
  public FileDiff {
    hunks = hunks == null ? List.of() : List.copyOf(hunks);
  }

  public boolean hasHunk(int hunkIndex) {
    return hunkIndex >= 0 && hunkIndex < hunks.size();
  }
}
