package hunkstage.core.diff;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum DiffLineType {
  CONTEXT(' '),
  ADD('+'),
  DELETE('-');

  private final char marker;

  DiffLineType(char marker) {
    this.marker = marker;
  }

  /** Leading column character of this line type in a unified diff. */
  public char marker() {
    return marker;
  }

  @JsonValue
  public String jsonValue() {
    return name().toLowerCase(Locale.ROOT);
  }
}
