package hunkstage.platform.delivery.web;

import hunkstage.core.projectconfig.ProjectConfigPort;
import hunkstage.core.projectconfig.RepositoryNotConfiguredException;
import hunkstage.core.staging.FileDiffResponse;
import hunkstage.core.staging.PartialStagingUseCase;
import hunkstage.core.staging.StagingResult;
import hunkstage.core.status.ReadWorkingStatusUseCase;
import hunkstage.core.status.WorkingStatus;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class StagingApiController {
  private final PartialStagingUseCase partialStagingUseCase;
  private final ReadWorkingStatusUseCase readWorkingStatusUseCase;
  private final ProjectConfigPort projectConfigPort;

  public StagingApiController(
      PartialStagingUseCase partialStagingUseCase,
      ReadWorkingStatusUseCase readWorkingStatusUseCase,
      ProjectConfigPort projectConfigPort) {
    this.partialStagingUseCase = partialStagingUseCase;
    this.readWorkingStatusUseCase = readWorkingStatusUseCase;
    this.projectConfigPort = projectConfigPort;
  }

  @GetMapping(path = "/api/staging/status", produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<WorkingStatus> status() {
    requireRepository();
    WorkingStatus status = readWorkingStatusUseCase.readWorkingStatus().join();
    if (status.error() != null) {
      return ResponseEntity.badRequest().body(status);
    }
    return ResponseEntity.ok(status);
  }

  @GetMapping(path = "/api/staging/diff", produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<FileDiffResponse> diff(
      @RequestParam(name = "path", required = false) String path,
      @RequestParam(name = "staged", required = false, defaultValue = "false") boolean staged) {
    requireRepository();
    FileDiffResponse response = partialStagingUseCase.getFileDiff(path, staged).join();
    if (response.error() != null) {
      return ResponseEntity.badRequest().body(response);
    }
    return ResponseEntity.ok(response);
  }

  @PostMapping(
      path = "/api/staging/hunks/{action}",
      consumes = MediaType.APPLICATION_JSON_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<StagingResult> hunk(
      @PathVariable("action") String action, @RequestBody HunkRequest request) {
    if (request == null) {
      return ResponseEntity.badRequest().body(StagingResult.failed("Request body is required."));
    }
    if (request.hunkIndex() == null) {
      return ResponseEntity.badRequest()
          .body(StagingResult.failed("Field `hunkIndex` is required."));
    }
    requireRepository();

    String path = request.path();
    int hunkIndex = request.hunkIndex();
    CompletableFuture<StagingResult> future;
    switch (action) {
      case "stage" -> future = partialStagingUseCase.stageHunk(path, hunkIndex);
      case "unstage" -> future = partialStagingUseCase.unstageHunk(path, hunkIndex);
      case "discard" -> future = partialStagingUseCase.discardHunk(path, hunkIndex);
      default -> {
        return ResponseEntity.badRequest().body(unknownAction(action));
      }
    }
    return toResponse(future.join());
  }

  @PostMapping(
      path = "/api/staging/lines/{action}",
      consumes = MediaType.APPLICATION_JSON_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<StagingResult> lines(
      @PathVariable("action") String action, @RequestBody LineSelectionRequest request) {
    if (request == null) {
      return ResponseEntity.badRequest().body(StagingResult.failed("Request body is required."));
    }
    if (request.hunkIndex() == null) {
      return ResponseEntity.badRequest()
          .body(StagingResult.failed("Field `hunkIndex` is required."));
    }
    requireRepository();

    String path = request.path();
    int hunkIndex = request.hunkIndex();
    List<Integer> lineIndices = request.lineIndices() == null ? List.of() : request.lineIndices();
    CompletableFuture<StagingResult> future;
    switch (action) {
      case "stage" -> future = partialStagingUseCase.stageLines(path, hunkIndex, lineIndices);
      case "unstage" -> future = partialStagingUseCase.unstageLines(path, hunkIndex, lineIndices);
      case "discard" -> future = partialStagingUseCase.discardLines(path, hunkIndex, lineIndices);
      default -> {
        return ResponseEntity.badRequest().body(unknownAction(action));
      }
    }
    return toResponse(future.join());
  }

  private void requireRepository() {
    boolean configured =
        projectConfigPort
            .load()
            .map(config -> config.localRepoPath() != null && !config.localRepoPath().isBlank())
            .orElse(false);
    if (!configured) {
      throw new RepositoryNotConfiguredException("Repository is not configured.");
    }
  }

  private static StagingResult unknownAction(String action) {
    return StagingResult.failed(
        "Unknown action `" + action + "`; expected stage, unstage or discard.");
  }

  private static ResponseEntity<StagingResult> toResponse(StagingResult result) {
    if (!result.success()) {
      return ResponseEntity.badRequest().body(result);
    }
    return ResponseEntity.ok(result);
  }

  public record HunkRequest(String path, Integer hunkIndex) {}

  public record LineSelectionRequest(String path, Integer hunkIndex, List<Integer> lineIndices) {}
}
