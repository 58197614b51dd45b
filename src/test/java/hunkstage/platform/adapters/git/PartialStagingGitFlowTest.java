package hunkstage.platform.adapters.git;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.is;

import hunkstage.core.diff.FileDiff;
import hunkstage.core.diff.Hunk;
import hunkstage.core.diff.PatchSynthesizer;
import hunkstage.core.diff.UnifiedDiffParser;
import hunkstage.core.diff.UntrackedFileDiffFactory;
import hunkstage.core.staging.PartialStagingUseCase;
import hunkstage.core.staging.PatchApplicator;
import hunkstage.core.staging.StagingResult;
import hunkstage.testing.GitTestRepo;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.core.task.SyncTaskExecutor;

/** Runs the staging operations against a real repository. */
class PartialStagingGitFlowTest {
  @TempDir Path tempDir;

  private GitTestRepo repo;
  private PartialStagingUseCase useCase;

  @BeforeEach
  void setUp() throws Exception {
    repo = GitTestRepo.init(tempDir.resolve("repo"));
    repo.write("f.txt", "u1\nremoved\nu2\n");
    repo.commitAll("initial");

    LocalGitAdapter adapter = LocalGitAdapterTest.adapterFor(repo);
    useCase =
        new PartialStagingUseCase(
            adapter,
            new PatchApplicator(adapter),
            new UnifiedDiffParser(),
            new UntrackedFileDiffFactory(),
            new PatchSynthesizer(),
            new SyncTaskExecutor());
  }

  @Test
  void stageLines_singleAddition_leavesTheRestUnstaged() throws Exception {
    repo.write("f.txt", "u1\nA\nB\nu2\n");

    StagingResult result = useCase.stageLines("f.txt", 0, List.of(2)).join();

    assertThat(result.message(), result.success(), is(true));
    assertThat(repo.indexContent("f.txt"), is("u1\nremoved\nA\nu2\n"));
    assertThat(repo.read("f.txt"), is("u1\nA\nB\nu2\n"));
  }

  @Test
  void stageLines_singleDeletion_removesOnlyThatLineFromTheIndex() throws Exception {
    repo.write("f.txt", "u1\nA\nB\nu2\n");

    StagingResult result = useCase.stageLines("f.txt", 0, List.of(1)).join();

    assertThat(result.message(), result.success(), is(true));
    assertThat(repo.indexContent("f.txt"), is("u1\nu2\n"));
  }

  @Test
  void stageHunk_thenUnstageHunk_restoresTheIndex() throws Exception {
    repo.write("f.txt", "u1\nA\nB\nu2\n");

    assertThat(useCase.stageHunk("f.txt", 0).join().success(), is(true));
    assertThat(repo.indexContent("f.txt"), is("u1\nA\nB\nu2\n"));

    StagingResult result = useCase.unstageHunk("f.txt", 0).join();

    assertThat(result.message(), result.success(), is(true));
    assertThat(repo.indexContent("f.txt"), is("u1\nremoved\nu2\n"));
    assertThat(repo.git("diff", "--cached", "--name-only"), is(""));
    assertThat(repo.read("f.txt"), is("u1\nA\nB\nu2\n"));
  }

  @Test
  void stageLines_thenUnstageSameLines_restoresTheIndex() throws Exception {
    repo.write("f.txt", "u1\nA\nB\nu2\n");

    assertThat(useCase.stageLines("f.txt", 0, List.of(1, 2)).join().success(), is(true));
    assertThat(repo.indexContent("f.txt"), is("u1\nA\nu2\n"));

    FileDiff staged = useCase.getFileDiff("f.txt", true).join().diff();
    Hunk hunk = staged.hunks().get(0);
    StagingResult result = useCase.unstageLines("f.txt", 0, List.of(1, 2)).join();

    assertThat(hunk.lines().size(), is(4));
    assertThat(result.message(), result.success(), is(true));
    assertThat(repo.indexContent("f.txt"), is("u1\nremoved\nu2\n"));
  }

  @Test
  void unstageLines_singleAddition_keepsTheOtherStagedChanges() throws Exception {
    repo.write("f.txt", "u1\nA\nB\nu2\n");
    assertThat(useCase.stageHunk("f.txt", 0).join().success(), is(true));

    StagingResult result = useCase.unstageLines("f.txt", 0, List.of(2)).join();

    assertThat(result.message(), result.success(), is(true));
    assertThat(repo.indexContent("f.txt"), is("u1\nB\nu2\n"));
  }

  @Test
  void discardLines_singleDeletion_restoresTheLineInTheWorkingTree() throws Exception {
    repo.write("f.txt", "u1\nu2\n");

    StagingResult result = useCase.discardLines("f.txt", 0, List.of(1)).join();

    assertThat(result.message(), result.success(), is(true));
    assertThat(repo.read("f.txt"), is("u1\nremoved\nu2\n"));
    assertThat(repo.git("status", "--porcelain"), is(""));
  }

  @Test
  void discardLines_singleAddition_keepsTheOtherEdits() throws Exception {
    repo.write("f.txt", "u1\nA\nB\nu2\n");

    StagingResult result = useCase.discardLines("f.txt", 0, List.of(3)).join();

    assertThat(result.message(), result.success(), is(true));
    assertThat(repo.read("f.txt"), is("u1\nA\nu2\n"));
  }

  @Test
  void discardHunk_restoresTheCommittedContent() throws Exception {
    repo.write("f.txt", "u1\nA\nu2\n");

    StagingResult result = useCase.discardHunk("f.txt", 0).join();

    assertThat(result.message(), result.success(), is(true));
    assertThat(repo.read("f.txt"), is("u1\nremoved\nu2\n"));
  }

  @Test
  void stageLines_untrackedFile_addsOnlySelectedLinesToTheIndex() throws Exception {
    repo.write("new.txt", "a\nb\nc\nd\ne\n");

    StagingResult result = useCase.stageLines("new.txt", 0, List.of(0, 1)).join();

    assertThat(result.message(), result.success(), is(true));
    assertThat(repo.indexContent("new.txt"), is("a\nb\n"));
    assertThat(repo.read("new.txt"), is("a\nb\nc\nd\ne\n"));
  }

  @Test
  void stageHunk_untrackedFile_addsTheWholeFile() throws Exception {
    repo.write("new.txt", "a\nb\n");

    StagingResult result = useCase.stageHunk("new.txt", 0).join();

    assertThat(result.message(), result.success(), is(true));
    assertThat(repo.indexContent("new.txt"), is("a\nb\n"));
  }

  @Test
  void stageLines_afterWholeHunkStaged_reportsNoUnstagedChanges() throws Exception {
    repo.write("f.txt", "u1\nA\nB\nu2\n");
    assertThat(useCase.stageHunk("f.txt", 0).join().success(), is(true));

    StagingResult result = useCase.stageLines("f.txt", 0, List.of(2)).join();

    assertThat(result.success(), is(false));
    assertThat(result.message(), containsString("No unstaged changes found for f.txt."));
  }

  @Test
  void stageHunk_latin1Content_isCopiedByteForByte() throws Exception {
    repo.writeBytes("f.txt", latin1("u1\ncaf\u00e9\nu2\n"));

    StagingResult result = useCase.stageHunk("f.txt", 0).join();

    assertThat(result.message(), result.success(), is(true));
    assertThat(repo.indexBytes("f.txt"), is(repo.readBytes("f.txt")));
  }

  @Test
  void stageLines_latin1Content_isCopiedByteForByte() throws Exception {
    repo.writeBytes("f.txt", latin1("u1\ncaf\u00e9\nB\nu2\n"));

    StagingResult result = useCase.stageLines("f.txt", 0, List.of(1, 2)).join();

    assertThat(result.message(), result.success(), is(true));
    assertThat(repo.indexBytes("f.txt"), is(latin1("u1\ncaf\u00e9\nu2\n")));
  }

  @Test
  void stageLines_untrackedLatin1File_isCopiedByteForByte() throws Exception {
    repo.writeBytes("n.txt", latin1("a\ncaf\u00e9\nzz\n"));

    StagingResult result = useCase.stageLines("n.txt", 0, List.of(0, 1)).join();

    assertThat(result.message(), result.success(), is(true));
    assertThat(repo.indexBytes("n.txt"), is(latin1("a\ncaf\u00e9\n")));
  }

  @Test
  void stageLines_utf8Content_isCopiedByteForByte() throws Exception {
    repo.write("f.txt", "u1\nna\u00efve \u2603\nB\nu2\n");

    StagingResult result = useCase.stageLines("f.txt", 0, List.of(1, 2)).join();

    assertThat(result.message(), result.success(), is(true));
    assertThat(
        repo.indexBytes("f.txt"),
        is("u1\nna\u00efve \u2603\nu2\n".getBytes(StandardCharsets.UTF_8)));
  }

  @Test
  void unstageLines_everyLineOfNewFile_matchesUnstageHunk() throws Exception {
    repo.write("n1.txt", "a\nb\n");
    repo.write("n2.txt", "a\nb\n");
    repo.git("add", "n1.txt", "n2.txt");

    StagingResult byLines = useCase.unstageLines("n1.txt", 0, List.of(0, 1)).join();
    StagingResult byHunk = useCase.unstageHunk("n2.txt", 0).join();

    assertThat(byLines.message(), byLines.success(), is(true));
    assertThat(byHunk.message(), byHunk.success(), is(true));
    assertThat(repo.git("status", "--porcelain"), is("?? n1.txt\n?? n2.txt\n"));
  }

  @Test
  void stageLines_everyLineOfUntrackedFile_addsTheWholeFile() throws Exception {
    repo.write("n.txt", "a\nb");

    StagingResult result = useCase.stageLines("n.txt", 0, List.of(0, 1)).join();

    assertThat(result.message(), result.success(), is(true));
    assertThat(repo.git("status", "--porcelain"), is("A  n.txt\n"));
    assertThat(repo.indexBytes("n.txt"), is(repo.readBytes("n.txt")));
  }

  @Test
  void stageLines_everyLineOfDeletedFile_stagesTheDeletion() throws Exception {
    repo.write("g.txt", "x\ny\n");
    repo.commitAll("add g");
    Files.delete(repo.root().resolve("g.txt"));

    StagingResult result = useCase.stageLines("g.txt", 0, List.of(0, 1)).join();

    assertThat(result.message(), result.success(), is(true));
    assertThat(repo.git("status", "--porcelain"), is("D  g.txt\n"));
  }

  @Test
  void discardLines_everyLineOfDeletedFile_restoresTheFile() throws Exception {
    repo.write("g.txt", "x\ny\n");
    repo.commitAll("add g");
    Files.delete(repo.root().resolve("g.txt"));

    StagingResult result = useCase.discardLines("g.txt", 0, List.of(0, 1)).join();

    assertThat(result.message(), result.success(), is(true));
    assertThat(repo.read("g.txt"), is("x\ny\n"));
    assertThat(repo.git("status", "--porcelain"), is(""));
  }

  @Test
  void stageLines_largeFile_updatesOnlyTheSelectedLine() throws Exception {
    StringBuilder original = new StringBuilder();
    for (int i = 0; i < 20_000; i++) {
      original.append("line ").append(i).append('\n');
    }
    repo.write("big.txt", original.toString());
    repo.commitAll("add big");
    String edited = original.toString().replace("line 10000\n", "line 10000 edited\n");
    repo.write("big.txt", edited);

    StagingResult result = useCase.stageLines("big.txt", 0, List.of(3, 4)).join();

    assertThat(result.message(), result.success(), is(true));
    assertThat(repo.indexContent("big.txt"), is(edited));
  }

  private static byte[] latin1(String text) {
    return text.getBytes(StandardCharsets.ISO_8859_1);
  }
}
