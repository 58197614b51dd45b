package hunkstage.core.staging;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import hunkstage.core.diff.FileDiff;

@JsonInclude(Include.NON_NULL)
public record FileDiffResponse(String path, boolean staged, FileDiff diff, String error) {
  public static FileDiffResponse failed(String path, boolean staged, String error) {
    return new FileDiffResponse(path, staged, null, error);
  }
}
