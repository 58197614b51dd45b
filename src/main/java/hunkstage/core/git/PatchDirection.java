package hunkstage.core.git;

public enum PatchDirection {
  FORWARD,
  REVERSE
}
