package hunkstage.core.staging;

/** A staging request was rejected before anything was run against the repository. */
public class StagingValidationException extends RuntimeException {
  public StagingValidationException(String message) {
    super(message);
  }
}
