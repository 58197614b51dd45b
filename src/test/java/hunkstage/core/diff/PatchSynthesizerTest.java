package hunkstage.core.diff;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.startsWith;
import static org.junit.jupiter.api.Assertions.assertThrows;

import hunkstage.core.git.PatchDirection;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class PatchSynthesizerTest {
  private static final String DIFF =
      """
      diff --git a/f.txt b/f.txt
      --- a/f.txt
      +++ b/f.txt
      @@ -10,3 +10,4 @@
       unchanged1
      -removed_line
      +added_line_A
      +added_line_B
       unchanged2
      """;

  private final PatchSynthesizer synthesizer = new PatchSynthesizer();
  private final Hunk hunk = new UnifiedDiffParser().parse(DIFF, "f.txt").hunks().get(0);

  @Test
  void synthesize_singleAddition_keepsUnselectedDeletionAsContext() {
    SynthesizedPatch patch = synthesizer.synthesize("f.txt", hunk, List.of(2));

    assertThat(patch.header(), is("@@ -10,3 +10,4 @@"));
    assertThat(patch.oldCount(), is(3));
    assertThat(patch.newCount(), is(4));
    assertThat(
        patch.text(),
        is(
            """
            diff --git a/f.txt b/f.txt
            --- a/f.txt
            +++ b/f.txt
            @@ -10,3 +10,4 @@
             unchanged1
             removed_line
            +added_line_A
             unchanged2
            """));
  }

  @Test
  void synthesize_singleDeletion_dropsUnselectedAdditions() {
    SynthesizedPatch patch = synthesizer.synthesize("f.txt", hunk, List.of(1));

    assertThat(patch.header(), is("@@ -10,3 +10,2 @@"));
    assertThat(patch.text(), containsString("\n unchanged1\n-removed_line\n unchanged2\n"));
    assertThat(patch.text(), not(containsString("added_line")));
  }

  @Test
  void synthesize_everyChangeSelected_reproducesTheHunkCounts() {
    SynthesizedPatch patch = synthesizer.synthesize("f.txt", hunk, List.of(0, 1, 2, 3, 4));

    assertThat(patch.oldCount(), is(hunk.oldLines()));
    assertThat(patch.newCount(), is(hunk.newLines()));
    assertThat(patch.header(), is("@@ -10,3 +10,4 @@"));
  }

  @Test
  void synthesize_countsMatchEmittedLinesForEverySubset() {
    int size = hunk.lines().size();
    for (int mask = 1; mask < (1 << size); mask++) {
      List<Integer> selection = new ArrayList<>();
      for (int i = 0; i < size; i++) {
        if ((mask & (1 << i)) != 0) {
          selection.add(i);
        }
      }
      for (PatchDirection direction : PatchDirection.values()) {
        SynthesizedPatch patch =
            synthesizer.synthesize("f.txt", hunk, selection, direction, false);

        int oldSide = 0;
        int newSide = 0;
        String body = patch.text().substring(patch.text().indexOf(patch.header()));
        for (String line : body.split("\n")) {
          if (line.startsWith(" ")) {
            oldSide++;
            newSide++;
          } else if (line.startsWith("-")) {
            oldSide++;
          } else if (line.startsWith("+")) {
            newSide++;
          }
        }
        assertThat("old " + selection + " " + direction, patch.oldCount(), is(oldSide));
        assertThat("new " + selection + " " + direction, patch.newCount(), is(newSide));
      }
    }
  }

  @Test
  void synthesize_reverse_keepsUnselectedAdditionsAsContext() {
    SynthesizedPatch patch =
        synthesizer.synthesize("f.txt", hunk, List.of(2), PatchDirection.REVERSE, false);

    assertThat(patch.header(), is("@@ -10,3 +10,4 @@"));
    assertThat(
        patch.text(),
        containsString(
            "\n unchanged1\n+added_line_A\n added_line_B\n unchanged2\n"));
    assertThat(patch.text(), not(containsString("removed_line")));
  }

  @Test
  void synthesize_reverseDeletion_isMatchedAgainstTheNewSide() {
    SynthesizedPatch patch =
        synthesizer.synthesize("f.txt", hunk, List.of(1), PatchDirection.REVERSE, false);

    assertThat(patch.header(), is("@@ -10,5 +10,4 @@"));
    assertThat(
        patch.text(),
        containsString(
            "\n unchanged1\n-removed_line\n added_line_A\n added_line_B\n unchanged2\n"));
  }

  @Test
  void synthesize_newFile_usesCreationHeader() {
    Hunk untracked = new UntrackedFileDiffFactory().create("n.txt", "a\nb\nc\n").hunks().get(0);

    SynthesizedPatch patch =
        synthesizer.synthesize("n.txt", untracked, Set.of(1), PatchDirection.FORWARD, true);

    assertThat(patch.text(), startsWith("diff --git a/n.txt b/n.txt\nnew file mode 100644\n"));
    assertThat(patch.text(), containsString("--- /dev/null\n+++ b/n.txt\n"));
    assertThat(patch.header(), is("@@ -0,0 +1,1 @@"));
    assertThat(patch.text().endsWith("@@ -0,0 +1,1 @@\n+b\n"), is(true));
  }

  @Test
  void synthesize_lineWithoutFinalNewline_keepsTheMarker() {
    Hunk untracked = new UntrackedFileDiffFactory().create("n.txt", "a\nb").hunks().get(0);

    SynthesizedPatch patch =
        synthesizer.synthesize("n.txt", untracked, List.of(1), PatchDirection.FORWARD, true);

    assertThat(patch.text().endsWith("+b\n\\ No newline at end of file\n"), is(true));
  }

  @Test
  void synthesize_emptySelection_isRejected() {
    assertThrows(
        IllegalArgumentException.class, () -> synthesizer.synthesize("f.txt", hunk, List.of()));
  }

  @Test
  void synthesize_outOfRangeIndex_isRejected() {
    assertThrows(
        IllegalArgumentException.class, () -> synthesizer.synthesize("f.txt", hunk, List.of(5)));
  }
}
