package hunkstage.core.git;

public enum PatchTarget {
  INDEX,
  WORKING_TREE
}
