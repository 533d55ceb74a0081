package org.waabox.maskflow.runner;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.waabox.maskflow.metrics.NoopPipelineMetrics;
import org.waabox.maskflow.metrics.PipelineMetrics;

/** Spring configuration that wires the pipeline runner.
 *
 * <p>A {@link PipelineMetrics} bean, if the context has one, is handed to
 * every pipeline; otherwise metrics are discarded.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@Configuration
@EnableConfigurationProperties(MaskflowProperties.class)
public class RunnerConfiguration {

  /** The class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(RunnerConfiguration.class);

  /** Creates the pipeline factory.
   *
   * @param properties      the runner properties, never null
   * @param metricsProvider provider for an optional PipelineMetrics bean
   *
   * @return the factory, never null
   */
  @Bean
  public PipelineFactory pipelineFactory(final MaskflowProperties properties,
      final ObjectProvider<PipelineMetrics> metricsProvider) {
    final PipelineMetrics metrics = metricsProvider.getIfAvailable(
        NoopPipelineMetrics::new);
    log.info("Pipeline metrics: {}", metrics.getClass().getSimpleName());
    return new PipelineFactory(properties, metrics);
  }

  /** Creates the runner that consumes one pass of the pipeline.
   *
   * @param factory the pipeline factory, never null
   *
   * @return the runner, never null
   */
  @Bean
  public BatchFeedRunner batchFeedRunner(final PipelineFactory factory) {
    return new BatchFeedRunner(factory);
  }
}
