package org.waabox.maskflow.runner;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Command line entry point that streams a dataset through the pipeline.
 *
 * <p>Runs one pass over the dataset configured under {@code maskflow.*},
 * logs every batch and exits with the code of the run:
 * <ul>
 *   <li>{@code 0} the run completed, with or without skipped items</li>
 *   <li>{@code 2} the run was misconfigured</li>
 *   <li>{@code 3} the load worker failed</li>
 * </ul>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@SpringBootApplication
public class RunnerApplication {

  /** Launches the application and exits with the run's exit code.
   *
   * @param args the command-line arguments
   */
  public static void main(final String[] args) {
    System.exit(SpringApplication.exit(
        SpringApplication.run(RunnerApplication.class, args)));
  }
}
