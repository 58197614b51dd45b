package hunkstage.core.projectconfig;

public class RepositoryNotConfiguredException extends IllegalStateException {
  public RepositoryNotConfiguredException(String message) {
    super(message);
  }
}
