package hunkstage.core.staging;

import hunkstage.core.git.PatchApplyPort;
import hunkstage.core.git.PatchApplyRequest;
import hunkstage.core.git.PatchApplyResult;
import hunkstage.core.git.PatchDirection;
import hunkstage.core.git.PatchTarget;

/**
 * Sends a patch document to the patch-apply port and turns the outcome into a {@link
 * StagingResult}. There is no retry and no fallback strategy: a patch that does not apply is
 * reported with git's own diagnostic.
 */
public class PatchApplicator {
  private final PatchApplyPort patchApplyPort;

  public PatchApplicator(PatchApplyPort patchApplyPort) {
    this.patchApplyPort = patchApplyPort;
  }

  public StagingResult apply(
      String patch, PatchTarget target, PatchDirection direction, String successMessage) {
    PatchApplyResult result = patchApplyPort.apply(new PatchApplyRequest(patch, target, direction));
    if (result.succeeded()) {
      return StagingResult.succeeded(successMessage);
    }

    String diagnostic = result.diagnostic();
    if (diagnostic == null || diagnostic.isBlank()) {
      return StagingResult.failed("git apply failed (exit=" + result.exitCode() + ").");
    }
    return StagingResult.failed(diagnostic);
  }
}
