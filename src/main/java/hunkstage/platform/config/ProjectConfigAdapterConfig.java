package hunkstage.platform.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import hunkstage.core.projectconfig.ProjectConfigPort;
import hunkstage.platform.adapters.projectconfig.FileProjectConfigAdapter;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;
import org.springframework.core.env.Environment;

@Configuration
@Profile("!test")
public class ProjectConfigAdapterConfig {
  @Bean
  public ProjectConfigPort fileProjectConfigAdapter(
      ObjectMapper objectMapper,
      Environment environment) {
    String configPath =
        environment.getProperty("hunkstage.config.path", ".hunkstage/config.json");
    return new FileProjectConfigAdapter(objectMapper, configPath);
  }
}
