package hunkstage.core.diff;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum FileStatus {
  ADDED,
  MODIFIED,
  DELETED,
  RENAMED,
  UNTRACKED;

  @JsonValue
  public String jsonValue() {
    return name().toLowerCase(Locale.ROOT);
  }
}
