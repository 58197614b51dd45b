package hunkstage.platform.config;

import hunkstage.core.diff.PatchSynthesizer;
import hunkstage.core.diff.UnifiedDiffParser;
import hunkstage.core.diff.UntrackedFileDiffFactory;
import hunkstage.core.git.GitPort;
import hunkstage.core.git.PatchApplyPort;
import hunkstage.core.staging.PartialStagingUseCase;
import hunkstage.core.staging.PatchApplicator;
import hunkstage.core.status.ReadWorkingStatusUseCase;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class StagingConfig {
  /**
   * One worker thread: index and working tree are shared mutable state, so every repository
   * operation issued through this application runs one at a time.
   */
  @Bean
  public ThreadPoolTaskExecutor stagingTaskExecutor() {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(1);
    executor.setMaxPoolSize(1);
    executor.setThreadNamePrefix("staging-");
    executor.setWaitForTasksToCompleteOnShutdown(true);
    return executor;
  }

  @Bean
  public PartialStagingUseCase partialStagingUseCase(
      GitPort gitPort,
      PatchApplyPort patchApplyPort,
      @Qualifier("stagingTaskExecutor") TaskExecutor taskExecutor) {
    return new PartialStagingUseCase(
        gitPort,
        new PatchApplicator(patchApplyPort),
        new UnifiedDiffParser(),
        new UntrackedFileDiffFactory(),
        new PatchSynthesizer(),
        taskExecutor);
  }

  @Bean
  public ReadWorkingStatusUseCase readWorkingStatusUseCase(
      GitPort gitPort, @Qualifier("stagingTaskExecutor") TaskExecutor taskExecutor) {
    return new ReadWorkingStatusUseCase(gitPort, taskExecutor);
  }
}
