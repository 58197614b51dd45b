package hunkstage.core.status;

import hunkstage.core.diff.FileStatus;

public record UncommittedFile(String path, FileStatus status, boolean staged) {}
