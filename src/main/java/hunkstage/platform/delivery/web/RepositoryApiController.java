package hunkstage.platform.delivery.web;

import hunkstage.core.projectconfig.ProjectConfig;
import hunkstage.core.projectconfig.ProjectConfigPort;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.DirectFieldBindingResult;
import org.springframework.validation.Errors;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class RepositoryApiController {
  private static final Logger log = LoggerFactory.getLogger(RepositoryApiController.class);

  private final ProjectConfigPort projectConfigPort;
  private final RepositorySettingsValidator validator;

  public RepositoryApiController(
      ProjectConfigPort projectConfigPort, RepositorySettingsValidator validator) {
    this.projectConfigPort = projectConfigPort;
    this.validator = validator;
  }

  @GetMapping(path = "/api/repository", produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<ProjectConfig> getRepository() {
    return projectConfigPort
        .load()
        .map(ResponseEntity::ok)
        .orElseGet(() -> ResponseEntity.notFound().build());
  }

  @PutMapping(
      path = "/api/repository",
      consumes = MediaType.APPLICATION_JSON_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<Map<String, Object>> saveRepository(
      @RequestBody RepositorySettingsRequest request) {
    RepositorySettingsRequest body =
        request == null ? new RepositorySettingsRequest(null) : request;
    Errors errors = new DirectFieldBindingResult(body, "repository");
    validator.validate(body, errors);
    if (errors.hasErrors()) {
      Map<String, Object> response = new LinkedHashMap<>();
      response.put("error", errors.getFieldErrors().get(0).getDefaultMessage());
      return ResponseEntity.badRequest().body(response);
    }

    String localRepoPath = body.localRepoPath().trim();
    projectConfigPort.save(new ProjectConfig(localRepoPath));
    log.info("repository_configured path={}", localRepoPath);
    return ResponseEntity.ok(Map.of("localRepoPath", localRepoPath));
  }
}
