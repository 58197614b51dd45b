package hunkstage.core.staging;

import hunkstage.core.diff.DiffLine;
import hunkstage.core.diff.FileDiff;
import hunkstage.core.diff.FileStatus;
import hunkstage.core.diff.Hunk;
import hunkstage.core.diff.PatchSynthesizer;
import hunkstage.core.diff.UnifiedDiffParser;
import hunkstage.core.diff.UntrackedFileDiffFactory;
import hunkstage.core.git.ByteText;
import hunkstage.core.git.GitPort;
import hunkstage.core.git.PatchDirection;
import hunkstage.core.git.PatchTarget;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.task.TaskExecutor;

/**
 * Stages, unstages and discards single hunks or selected lines of a hunk.
 *
 * <p>Every call reads a fresh diff before acting, so hunk and line indices always refer to the
 * diff as it is when the call runs. Indices obtained before a mutation are stale afterwards.
 * Calls carry no lock of their own; concurrent mutations of the same repository are serialized by
 * the executor this use case is given.
 *
 * <p>Mutations work on {@link ByteText} so file content survives in any encoding. Diffs returned
 * by {@link #getFileDiff} are decoded as UTF-8.
 */
public class PartialStagingUseCase {
  private static final Logger log = LoggerFactory.getLogger(PartialStagingUseCase.class);
  private static final int BINARY_SNIFF_BYTES = 8000;

  private final GitPort gitPort;
  private final PatchApplicator patchApplicator;
  private final UnifiedDiffParser diffParser;
  private final UntrackedFileDiffFactory untrackedFileDiffFactory;
  private final PatchSynthesizer patchSynthesizer;
  private final TaskExecutor taskExecutor;

  public PartialStagingUseCase(
      GitPort gitPort,
      PatchApplicator patchApplicator,
      UnifiedDiffParser diffParser,
      UntrackedFileDiffFactory untrackedFileDiffFactory,
      PatchSynthesizer patchSynthesizer,
      TaskExecutor taskExecutor) {
    this.gitPort = gitPort;
    this.patchApplicator = patchApplicator;
    this.diffParser = diffParser;
    this.untrackedFileDiffFactory = untrackedFileDiffFactory;
    this.patchSynthesizer = patchSynthesizer;
    this.taskExecutor = taskExecutor;
  }

  public CompletableFuture<FileDiffResponse> getFileDiff(String filePath, boolean staged) {
    return CompletableFuture.supplyAsync(() -> readFileDiff(filePath, staged), taskExecutor);
  }

  public CompletableFuture<StagingResult> stageHunk(String filePath, int hunkIndex) {
    return submit(Operation.STAGE, filePath, hunkIndex, null);
  }

  public CompletableFuture<StagingResult> unstageHunk(String filePath, int hunkIndex) {
    return submit(Operation.UNSTAGE, filePath, hunkIndex, null);
  }

  public CompletableFuture<StagingResult> discardHunk(String filePath, int hunkIndex) {
    return submit(Operation.DISCARD, filePath, hunkIndex, null);
  }

  public CompletableFuture<StagingResult> stageLines(
      String filePath, int hunkIndex, List<Integer> lineIndices) {
    return submit(Operation.STAGE, filePath, hunkIndex, nonNull(lineIndices));
  }

  public CompletableFuture<StagingResult> unstageLines(
      String filePath, int hunkIndex, List<Integer> lineIndices) {
    return submit(Operation.UNSTAGE, filePath, hunkIndex, nonNull(lineIndices));
  }

  public CompletableFuture<StagingResult> discardLines(
      String filePath, int hunkIndex, List<Integer> lineIndices) {
    return submit(Operation.DISCARD, filePath, hunkIndex, nonNull(lineIndices));
  }

  private CompletableFuture<StagingResult> submit(
      Operation operation, String filePath, int hunkIndex, List<Integer> lineIndices) {
    return CompletableFuture.supplyAsync(
        () -> run(operation, filePath, hunkIndex, lineIndices), taskExecutor);
  }

  private FileDiffResponse readFileDiff(String filePath, boolean staged) {
    if (filePath == null || filePath.isBlank()) {
      return FileDiffResponse.failed(filePath, staged, "File path is required.");
    }
    try {
      return loadFileDiff(filePath, staged, false)
          .map(diff -> new FileDiffResponse(filePath, staged, diff, null))
          .orElseGet(
              () ->
                  FileDiffResponse.failed(
                      filePath, staged, "No " + side(staged) + " changes found for " + filePath + "."));
    } catch (RuntimeException e) {
      log.warn("staging_diff_failed path={} staged={} error={}", filePath, staged, e.getMessage());
      return FileDiffResponse.failed(filePath, staged, messageOf(e));
    }
  }

  private StagingResult run(
      Operation operation, String filePath, int hunkIndex, List<Integer> lineIndices) {
    try {
      StagingResult result = apply(operation, filePath, hunkIndex, lineIndices);
      log.info(
          "staging_{}_completed path={} hunk={} lines={} success={}",
          operation.verb,
          filePath,
          hunkIndex,
          lineIndices == null ? "all" : lineIndices.size(),
          result.success());
      return result;
    } catch (StagingValidationException e) {
      log.info(
          "staging_{}_rejected path={} hunk={} reason={}",
          operation.verb,
          filePath,
          hunkIndex,
          e.getMessage());
      return StagingResult.failed(e.getMessage());
    } catch (RuntimeException e) {
      log.warn("staging_{}_failed path={} hunk={}", operation.verb, filePath, hunkIndex, e);
      return StagingResult.failed(messageOf(e));
    }
  }

  private StagingResult apply(
      Operation operation, String filePath, int hunkIndex, List<Integer> lineIndices) {
    if (filePath == null || filePath.isBlank()) {
      throw new StagingValidationException("File path is required.");
    }
    if (lineIndices != null && lineIndices.isEmpty()) {
      throw new StagingValidationException("No lines selected.");
    }

    FileDiff diff =
        loadFileDiff(filePath, operation.stagedDiff, true)
            .orElseThrow(
                () ->
                    new StagingValidationException(
                        "No "
                            + side(operation.stagedDiff)
                            + " changes found for "
                            + filePath
                            + "."));
    if (diff.binary()) {
      throw new StagingValidationException(
          "Binary file " + filePath + " cannot be staged by hunk or line.");
    }
    if (!diff.hasHunk(hunkIndex)) {
      throw new StagingValidationException(
          "Hunk index "
              + hunkIndex
              + " is out of range; "
              + filePath
              + " has "
              + diff.hunks().size()
              + " hunk(s).");
    }
    Hunk hunk = diff.hunks().get(hunkIndex);

    if (lineIndices == null) {
      if (!hunk.hasRawPatch()) {
        throw new StagingValidationException("Hunk " + hunkIndex + " has no patch text.");
      }
      return patchApplicator.apply(
          hunk.rawPatch(),
          operation.target,
          operation.direction,
          operation.pastTense + " hunk " + (hunkIndex + 1) + " of " + filePath);
    }

    Set<Integer> selected = validateSelection(hunk, lineIndices);
    String patch;
    if (createsOrDeletesFile(diff.status()) && selectsEveryChange(hunk, selected)) {
      // Only the whole-file patch carries the creation or deletion of the path.
      if (!hunk.hasRawPatch()) {
        throw new StagingValidationException("Hunk " + hunkIndex + " has no patch text.");
      }
      patch = hunk.rawPatch();
    } else {
      boolean newFile =
          diff.status() == FileStatus.UNTRACKED && operation.direction == PatchDirection.FORWARD;
      patch =
          patchSynthesizer
              .synthesize(
                  ByteText.fromUnicode(filePath), hunk, selected, operation.direction, newFile)
              .text();
    }
    return patchApplicator.apply(
        patch,
        operation.target,
        operation.direction,
        operation.pastTense + " " + selected.size() + " line(s) of " + filePath);
  }

  private static boolean createsOrDeletesFile(FileStatus status) {
    return status == FileStatus.ADDED
        || status == FileStatus.DELETED
        || status == FileStatus.UNTRACKED;
  }

  private static boolean selectsEveryChange(Hunk hunk, Set<Integer> selected) {
    for (DiffLine line : hunk.lines()) {
      if (line.isChange() && !selected.contains(line.lineIndex())) {
        return false;
      }
    }
    return true;
  }

  private static Set<Integer> validateSelection(Hunk hunk, List<Integer> lineIndices) {
    Set<Integer> selected = new TreeSet<>();
    boolean hasChange = false;
    for (Integer index : lineIndices) {
      if (index == null || index < 0 || index >= hunk.lines().size()) {
        throw new StagingValidationException(
            "Line index "
                + index
                + " is out of range; hunk has "
                + hunk.lines().size()
                + " line(s).");
      }
      DiffLine line = hunk.lines().get(index);
      hasChange = hasChange || line.isChange();
      selected.add(index);
    }
    if (!hasChange) {
      throw new StagingValidationException("Selection contains no added or removed lines.");
    }
    return selected;
  }

  /**
   * @param byteExact keep content as {@link ByteText} so patches built from it reproduce the file
   *     bytes; otherwise content is read as UTF-8 for display
   */
  private Optional<FileDiff> loadFileDiff(String filePath, boolean staged, boolean byteExact) {
    String diffText = gitPort.diff(filePath, staged);
    if (diffText != null && !diffText.isBlank()) {
      String text = byteExact ? diffText : ByteText.toUnicode(diffText);
      return Optional.of(diffParser.parse(text, filePath));
    }
    if (staged || !gitPort.isUntracked(filePath)) {
      return Optional.empty();
    }

    byte[] content = gitPort.readWorkingTreeFile(filePath);
    if (looksBinary(content)) {
      return Optional.of(
          new FileDiff(filePath, null, FileStatus.UNTRACKED, true, 0, 0, List.of()));
    }
    if (byteExact) {
      return Optional.of(
          untrackedFileDiffFactory.create(ByteText.fromUnicode(filePath), ByteText.decode(content)));
    }
    return Optional.of(
        untrackedFileDiffFactory.create(filePath, new String(content, StandardCharsets.UTF_8)));
  }

  private static boolean looksBinary(byte[] content) {
    int limit = Math.min(content.length, BINARY_SNIFF_BYTES);
    for (int i = 0; i < limit; i++) {
      if (content[i] == 0) {
        return true;
      }
    }
    return false;
  }

  private static List<Integer> nonNull(List<Integer> lineIndices) {
    return lineIndices == null ? List.of() : lineIndices;
  }

  private static String side(boolean staged) {
    return staged ? "staged" : "unstaged";
  }

  private static String messageOf(Exception e) {
    return e.getMessage() == null || e.getMessage().isBlank()
        ? e.getClass().getSimpleName()
        : e.getMessage();
  }

  private enum Operation {
    STAGE("stage", "Staged", false, PatchTarget.INDEX, PatchDirection.FORWARD),
    UNSTAGE("unstage", "Unstaged", true, PatchTarget.INDEX, PatchDirection.REVERSE),
    DISCARD("discard", "Discarded", false, PatchTarget.WORKING_TREE, PatchDirection.REVERSE);

    private final String verb;
    private final String pastTense;
    private final boolean stagedDiff;
    private final PatchTarget target;
    private final PatchDirection direction;

    Operation(
        String verb,
        String pastTense,
        boolean stagedDiff,
        PatchTarget target,
        PatchDirection direction) {
      this.verb = verb;
      this.pastTense = pastTense;
      this.stagedDiff = stagedDiff;
      this.target = target;
      this.direction = direction;
    }
  }
}
