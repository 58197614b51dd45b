package hunkstage.core.diff;

public record SynthesizedPatch(String header, int oldCount, int newCount, String text) {}
