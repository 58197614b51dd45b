package hunkstage.platform.adapters.git;

import hunkstage.core.git.ByteText;
import hunkstage.core.git.DiffTotals;
import hunkstage.core.git.GitPort;
import hunkstage.core.git.GitStatusEntry;
import hunkstage.core.git.PatchApplyPort;
import hunkstage.core.git.PatchApplyRequest;
import hunkstage.core.git.PatchApplyResult;
import hunkstage.core.git.PatchDirection;
import hunkstage.core.git.PatchTarget;
import hunkstage.core.projectconfig.ProjectConfig;
import hunkstage.core.projectconfig.ProjectConfigPort;
import hunkstage.core.projectconfig.RepositoryNotConfiguredException;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

@Component
public class LocalGitAdapter implements GitPort, PatchApplyPort {
  private static final Logger log = LoggerFactory.getLogger(LocalGitAdapter.class);

  private final ProjectConfigPort projectConfigPort;
  private final String gitExecutable;
  private final Duration timeout;

  public LocalGitAdapter(
      ProjectConfigPort projectConfigPort,
      @Value("${hunkstage.git.executable:git}") String gitExecutable,
      @Value("${hunkstage.git.timeout:0s}") Duration timeout) {
    this.projectConfigPort = projectConfigPort;
    this.gitExecutable = gitExecutable;
    this.timeout = timeout == null ? Duration.ZERO : timeout;
  }

  @Override
  public String diff(String repoRelativePath, boolean staged) {
    requirePath(repoRelativePath);

    Path repoPath = resolveLocalRepoPath();
    List<String> args = new ArrayList<>(List.of("diff", "--no-color", "--no-ext-diff"));
    if (staged) {
      args.add("--cached");
    }
    args.add("--");
    args.add(repoRelativePath);
    return ByteText.decode(runGitBytes(repoPath, args.toArray(String[]::new)));
  }

  @Override
  public boolean isUntracked(String repoRelativePath) {
    requirePath(repoRelativePath);

    Path repoPath = resolveLocalRepoPath();
    String stdout =
        runGitText(
            repoPath, "ls-files", "--others", "--exclude-standard", "-z", "--", repoRelativePath);
    return parseNullSeparatedList(stdout).contains(repoRelativePath);
  }

  @Override
  public byte[] readWorkingTreeFile(String repoRelativePath) {
    requirePath(repoRelativePath);

    Path repoPath = resolveLocalRepoPath().toAbsolutePath().normalize();
    Path filePath = repoPath.resolve(repoRelativePath).normalize();
    if (!filePath.startsWith(repoPath)) {
      throw new IllegalArgumentException("Path escapes the repository root: " + repoRelativePath);
    }
    try {
      return Files.readAllBytes(filePath);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read repo file: " + repoRelativePath, e);
    }
  }

  @Override
  public List<GitStatusEntry> status() {
    Path repoPath = resolveLocalRepoPath();
    String stdout =
        runGitText(repoPath, "status", "--porcelain=v1", "-z", "--untracked-files=all");
    return parsePorcelainStatus(stdout);
  }

  @Override
  public DiffTotals diffTotals(boolean staged) {
    Path repoPath = resolveLocalRepoPath();
    String stdout =
        staged
            ? runGitText(repoPath, "diff", "--numstat", "--cached")
            : runGitText(repoPath, "diff", "--numstat");
    return parseNumstat(stdout);
  }

  @Override
  public PatchApplyResult apply(PatchApplyRequest request) {
    if (request == null || request.patch() == null || request.patch().isBlank()) {
      throw new IllegalArgumentException("patch must be non-blank.");
    }

    Path repoPath = resolveLocalRepoPath();
    List<String> args = new ArrayList<>();
    args.add("apply");
    if (request.target() == PatchTarget.INDEX) {
      args.add("--cached");
    }
    if (request.direction() == PatchDirection.REVERSE) {
      args.add("--reverse");
    }
    args.add("-");

    GitOutput output =
        runGitRaw(repoPath, ByteText.encode(request.patch()), args.toArray(String[]::new));
    String stderr = new String(output.stderr(), StandardCharsets.UTF_8).trim();
    if (output.exitCode() != 0) {
      log.info("git_apply_failed exit={} args={} stderr={}", output.exitCode(), args, stderr);
    }
    return new PatchApplyResult(output.exitCode(), stderr);
  }

  private Path resolveLocalRepoPath() {
    ProjectConfig config =
        projectConfigPort
            .load()
            .orElseThrow(() -> new RepositoryNotConfiguredException("Repository is not configured."));

    if (config.localRepoPath() == null || config.localRepoPath().isBlank()) {
      throw new RepositoryNotConfiguredException("Local repo path is not configured.");
    }

    Path repoPath = Path.of(config.localRepoPath());
    if (!Files.exists(repoPath)) {
      throw new IllegalStateException("Local repo path does not exist: " + repoPath);
    }
    return repoPath;
  }

  private static void requirePath(String repoRelativePath) {
    if (repoRelativePath == null || repoRelativePath.isBlank()) {
      throw new IllegalArgumentException("repoRelativePath must be non-blank.");
    }
  }

  private static List<String> parseNullSeparatedList(String stdout) {
    if (stdout == null || stdout.isEmpty()) {
      return List.of();
    }

    String[] entries = stdout.split("\u0000", -1);
    List<String> results = new ArrayList<>(entries.length);
    for (String entry : entries) {
      if (entry != null && !entry.isBlank()) {
        results.add(entry);
      }
    }
    return results;
  }

  /**
   * Parses {@code git status --porcelain=v1 -z}. A file with changes on both sides yields one
   * staged and one unstaged entry.
   */
  static List<GitStatusEntry> parsePorcelainStatus(String stdout) {
    if (stdout == null || stdout.isEmpty()) {
      return List.of();
    }

    String[] tokens = stdout.split("\u0000", -1);
    List<GitStatusEntry> results = new ArrayList<>();
    int index = 0;
    while (index < tokens.length) {
      String token = tokens[index++];
      if (token == null || token.length() < 4) {
        continue;
      }

      char indexStatus = token.charAt(0);
      char workingStatus = token.charAt(1);
      String path = token.substring(3);
      String previousPath = null;
      if (isRenameOrCopy(indexStatus) || isRenameOrCopy(workingStatus)) {
        if (index >= tokens.length) {
          break;
        }
        previousPath = tokens[index++];
      }

      if (indexStatus == '?') {
        results.add(new GitStatusEntry(GitStatusEntry.Type.UNTRACKED, path, null, false));
        continue;
      }
      if (indexStatus != ' ' && indexStatus != '!') {
        results.add(new GitStatusEntry(toType(indexStatus), path, previousPath, true));
      }
      if (workingStatus != ' ' && workingStatus != '!') {
        results.add(new GitStatusEntry(toType(workingStatus), path, null, false));
      }
    }

    return results;
  }

  private static boolean isRenameOrCopy(char code) {
    return code == 'R' || code == 'C';
  }

  private static GitStatusEntry.Type toType(char code) {
    return switch (code) {
      case 'A', 'C' -> GitStatusEntry.Type.ADDED;
      case 'D' -> GitStatusEntry.Type.DELETED;
      case 'R' -> GitStatusEntry.Type.RENAMED;
      default -> GitStatusEntry.Type.MODIFIED;
    };
  }

  static DiffTotals parseNumstat(String stdout) {
    if (stdout == null || stdout.isBlank()) {
      return DiffTotals.empty();
    }

    int additions = 0;
    int deletions = 0;
    for (String line : stdout.split("\r?\n")) {
      String[] parts = line.split("\t", 3);
      if (parts.length < 3) {
        continue;
      }
      try {
        additions += Integer.parseInt(parts[0]);
        deletions += Integer.parseInt(parts[1]);
      } catch (NumberFormatException e) {
        // Binary files report "-" for both counts.
        continue;
      }
    }
    return new DiffTotals(additions, deletions);
  }

  private String runGitText(Path repoPath, String... args) {
    return new String(runGitBytes(repoPath, args), StandardCharsets.UTF_8);
  }

  private byte[] runGitBytes(Path repoPath, String... args) {
    GitOutput output = runGitRaw(repoPath, null, args);
    if (output.exitCode() != 0) {
      String stderrText = new String(output.stderr(), StandardCharsets.UTF_8);
      String message =
          "git failed (exit=" + output.exitCode() + ") in " + repoPath + ": " + stderrText.trim();
      throw new IllegalStateException(message);
    }
    return output.stdout();
  }

  private GitOutput runGitRaw(Path repoPath, byte[] stdin, String... args) {
    List<String> command = new ArrayList<>();
    command.add(gitExecutable);
    for (String arg : args) {
      command.add(arg);
    }

    Process process;
    try {
      process = new ProcessBuilder(command).directory(repoPath.toFile()).start();
    } catch (IOException e) {
      throw new IllegalStateException("Failed to start git process.", e);
    }

    StreamReader stdoutReader = new StreamReader(process.getInputStream());
    StreamReader stderrReader = new StreamReader(process.getErrorStream());

    Thread stdoutThread = new Thread(stdoutReader, "git-stdout-reader");
    Thread stderrThread = new Thread(stderrReader, "git-stderr-reader");
    stdoutThread.setDaemon(true);
    stderrThread.setDaemon(true);
    stdoutThread.start();
    stderrThread.start();

    try (OutputStream input = process.getOutputStream()) {
      if (stdin != null) {
        input.write(stdin);
      }
    } catch (IOException e) {
      process.destroyForcibly();
      throw new UncheckedIOException("Failed to send input to git.", e);
    }

    boolean finished;
    try {
      if (timeout.isZero() || timeout.isNegative()) {
        process.waitFor();
        finished = true;
      } else {
        finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException("Interrupted while waiting for git.", e);
    }

    if (!finished) {
      process.destroyForcibly();
      throw new IllegalStateException("Timed out while running git in " + repoPath);
    }

    try {
      stdoutThread.join();
      stderrThread.join();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException("Interrupted while reading git output.", e);
    }

    stdoutReader.throwIfFailed();
    stderrReader.throwIfFailed();

    return new GitOutput(process.exitValue(), stdoutReader.bytes(), stderrReader.bytes());
  }

  private record GitOutput(int exitCode, byte[] stdout, byte[] stderr) {}

  private static final class StreamReader implements Runnable {
    private final java.io.InputStream inputStream;
    private volatile byte[] bytes;
    private volatile RuntimeException failure;

    private StreamReader(java.io.InputStream inputStream) {
      this.inputStream = inputStream;
    }

    @Override
    public void run() {
      try (inputStream) {
        ByteArrayOutputStream output = new ByteArrayOutputStream();
        inputStream.transferTo(output);
        bytes = output.toByteArray();
      } catch (IOException e) {
        failure = new UncheckedIOException(e);
      }
    }

    public byte[] bytes() {
      return bytes == null ? new byte[0] : bytes;
    }

    public void throwIfFailed() {
      if (failure != null) {
        throw failure;
      }
    }
  }
}
