package hunkstage.core.status;

import hunkstage.core.diff.FileStatus;
import hunkstage.core.git.DiffTotals;
import hunkstage.core.git.GitPort;
import hunkstage.core.git.GitStatusEntry;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.task.TaskExecutor;

/** Lists uncommitted files, each side (staged, unstaged) as its own entry, with line totals. */
public class ReadWorkingStatusUseCase {
  private static final Logger log = LoggerFactory.getLogger(ReadWorkingStatusUseCase.class);

  private final GitPort gitPort;
  private final TaskExecutor taskExecutor;

  public ReadWorkingStatusUseCase(GitPort gitPort, TaskExecutor taskExecutor) {
    this.gitPort = gitPort;
    this.taskExecutor = taskExecutor;
  }

  public CompletableFuture<WorkingStatus> readWorkingStatus() {
    return CompletableFuture.supplyAsync(this::read, taskExecutor);
  }

  private WorkingStatus read() {
    List<GitStatusEntry> entries;
    try {
      entries = gitPort.status();
    } catch (RuntimeException e) {
      log.warn("working_status_failed error={}", e.getMessage());
      return WorkingStatus.failed(
          e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
    }

    List<UncommittedFile> files = new ArrayList<>(entries.size());
    int stagedCount = 0;
    for (GitStatusEntry entry : entries) {
      files.add(new UncommittedFile(entry.path(), toFileStatus(entry.type()), entry.staged()));
      if (entry.staged()) {
        stagedCount++;
      }
    }

    DiffTotals totals = readTotals();
    return new WorkingStatus(
        !files.isEmpty(),
        List.copyOf(files),
        stagedCount,
        files.size() - stagedCount,
        totals.additions(),
        totals.deletions(),
        null);
  }

  // Totals are informational; a failing numstat leaves them at zero.
  private DiffTotals readTotals() {
    try {
      return gitPort.diffTotals(false).plus(gitPort.diffTotals(true));
    } catch (RuntimeException e) {
      log.warn("working_status_totals_failed error={}", e.getMessage());
      return DiffTotals.empty();
    }
  }

  private static FileStatus toFileStatus(GitStatusEntry.Type type) {
    return switch (type) {
      case ADDED -> FileStatus.ADDED;
      case DELETED -> FileStatus.DELETED;
      case RENAMED -> FileStatus.RENAMED;
      case UNTRACKED -> FileStatus.UNTRACKED;
      case MODIFIED -> FileStatus.MODIFIED;
    };
  }
}
