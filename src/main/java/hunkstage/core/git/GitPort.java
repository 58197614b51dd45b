package hunkstage.core.git;

import java.util.List;

public interface GitPort {
  /**
   * Unified diff of one path: index against HEAD when {@code staged}, otherwise working tree
   * against index. Empty when the path has no changes on that side. Returned as {@link ByteText},
   * one char per byte of git's output.
   */
  String diff(String repoRelativePath, boolean staged);

  boolean isUntracked(String repoRelativePath);

  byte[] readWorkingTreeFile(String repoRelativePath);

  List<GitStatusEntry> status();

  DiffTotals diffTotals(boolean staged);
}
