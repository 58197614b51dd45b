package hunkstage.core.git;

/** {@code patch} is {@link ByteText}; it is written to git byte for byte. */
public record PatchApplyRequest(String patch, PatchTarget target, PatchDirection direction) {}
