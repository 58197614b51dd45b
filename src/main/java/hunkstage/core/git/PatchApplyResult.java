package hunkstage.core.git;

public record PatchApplyResult(int exitCode, String diagnostic) {
  public boolean succeeded() {
    return exitCode == 0;
  }
}
