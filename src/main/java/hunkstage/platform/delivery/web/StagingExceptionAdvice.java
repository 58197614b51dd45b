package hunkstage.platform.delivery.web;

import hunkstage.core.projectconfig.RepositoryNotConfiguredException;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice(assignableTypes = StagingApiController.class)
public class StagingExceptionAdvice {

  @ExceptionHandler(RepositoryNotConfiguredException.class)
  public ResponseEntity<Map<String, Object>> repositoryNotConfigured(
      RepositoryNotConfiguredException e) {
    return ResponseEntity.status(HttpStatus.CONFLICT)
        .body(Map.of("success", false, "message", e.getMessage()));
  }
}
