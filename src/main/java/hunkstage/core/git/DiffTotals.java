package hunkstage.core.git;

public record DiffTotals(int additions, int deletions) {
  public static DiffTotals empty() {
    return new DiffTotals(0, 0);
  }

  public DiffTotals plus(DiffTotals other) {
    return new DiffTotals(additions + other.additions, deletions + other.deletions);
  }
}
