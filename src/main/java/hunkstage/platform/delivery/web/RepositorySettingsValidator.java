package hunkstage.platform.delivery.web;

import java.nio.file.Files;
import java.nio.file.Path;
import org.springframework.stereotype.Component;
import org.springframework.validation.Errors;
import org.springframework.validation.Validator;

@Component
public class RepositorySettingsValidator implements Validator {
  @Override
  public boolean supports(Class<?> clazz) {
    return RepositorySettingsRequest.class.isAssignableFrom(clazz);
  }

  @Override
  public void validate(Object target, Errors errors) {
    RepositorySettingsRequest request = (RepositorySettingsRequest) target;
    if (isBlank(request.localRepoPath())) {
      errors.rejectValue(
          "localRepoPath", "localRepoPath.required", "Local repository path is required.");
      return;
    }

    Path repoPath = Path.of(request.localRepoPath().trim());
    if (!Files.isDirectory(repoPath)) {
      errors.rejectValue(
          "localRepoPath",
          "localRepoPath.invalid",
          "Local repository path must be an existing directory.");
      return;
    }

    // Worktrees and submodules keep a .git file instead of a directory.
    if (!Files.exists(repoPath.resolve(".git"))) {
      errors.rejectValue(
          "localRepoPath",
          "localRepoPath.notGit",
          "Local repository path must contain a .git directory.");
    }
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
