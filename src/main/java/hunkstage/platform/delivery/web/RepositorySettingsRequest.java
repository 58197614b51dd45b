package hunkstage.platform.delivery.web;

public record RepositorySettingsRequest(String localRepoPath) {}
