package hunkstage.core.status;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import java.util.List;

@JsonInclude(Include.NON_NULL)
public record WorkingStatus(
    boolean hasChanges,
    List<UncommittedFile> files,
    int stagedCount,
    int unstagedCount,
    int additions,
    int deletions,
    String error) {
  public static WorkingStatus failed(String error) {
    return new WorkingStatus(false, List.of(), 0, 0, 0, 0, error);
  }
}
