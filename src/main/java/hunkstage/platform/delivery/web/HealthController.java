package hunkstage.platform.delivery.web;

import hunkstage.core.projectconfig.ProjectConfigPort;
import java.util.Map;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class HealthController {
  private final ProjectConfigPort projectConfigPort;

  public HealthController(ProjectConfigPort projectConfigPort) {
    this.projectConfigPort = projectConfigPort;
  }

  @GetMapping(path = "/health", produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<Map<String, Object>> health() {
    boolean configured =
        projectConfigPort
            .load()
            .map(config -> config.localRepoPath() != null && !config.localRepoPath().isBlank())
            .orElse(false);
    return ResponseEntity.ok(Map.of("status", "ok", "repositoryConfigured", configured));
  }
}
