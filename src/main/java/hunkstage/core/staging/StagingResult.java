package hunkstage.core.staging;

public record StagingResult(boolean success, String message) {
  public static StagingResult succeeded(String message) {
    return new StagingResult(true, message);
  }

  public static StagingResult failed(String message) {
    return new StagingResult(false, message);
  }
}
