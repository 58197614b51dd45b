package hunkstage.core.git;

/**
 * Applies a unified-diff document to the configured repository. Implementations report the
 * outcome in the result instead of throwing when the patch does not apply.
 */
public interface PatchApplyPort {
  PatchApplyResult apply(PatchApplyRequest request);
}
