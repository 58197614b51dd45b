package hunkstage.core.git;

public record GitStatusEntry(Type type, String path, String previousPath, boolean staged) {
  public enum Type {
    ADDED,
    MODIFIED,
    DELETED,
    RENAMED,
    UNTRACKED
  }
}
