package hunkstage.platform.adapters.projectconfig;

import com.fasterxml.jackson.databind.ObjectMapper;
import hunkstage.core.projectconfig.ProjectConfig;
import hunkstage.core.projectconfig.ProjectConfigPort;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Keeps the repository root in a small JSON file, replaced atomically on every save. */
public class FileProjectConfigAdapter implements ProjectConfigPort {
  private static final Logger log = LoggerFactory.getLogger(FileProjectConfigAdapter.class);

  private final ObjectMapper objectMapper;
  private final Path configFile;

  public FileProjectConfigAdapter(ObjectMapper objectMapper, String configPath) {
    this.objectMapper = objectMapper;
    this.configFile = expandHome(configPath).toAbsolutePath().normalize();
  }

  @Override
  public Optional<ProjectConfig> load() {
    if (!Files.isRegularFile(configFile)) {
      return Optional.empty();
    }

    try {
      ProjectConfig config = objectMapper.readValue(configFile.toFile(), ProjectConfig.class);
      return Optional.ofNullable(config);
    } catch (IOException e) {
      throw new IllegalStateException("Failed to read repository config from " + configFile, e);
    }
  }

  @Override
  public void save(ProjectConfig config) {
    Path parent = configFile.getParent();
    try {
      Files.createDirectories(parent);
      Path tmp = Files.createTempFile(parent, "hunkstage", ".json.tmp");
      objectMapper.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), config);
      Files.move(
          tmp, configFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    } catch (IOException e) {
      throw new IllegalStateException("Failed to write repository config to " + configFile, e);
    }
    log.debug("project_config_saved file={}", configFile);
  }

  private static Path expandHome(String configPath) {
    if (configPath.equals("~") || configPath.startsWith("~/")) {
      return Path.of(System.getProperty("user.home") + configPath.substring(1));
    }
    return Path.of(configPath);
  }
}
