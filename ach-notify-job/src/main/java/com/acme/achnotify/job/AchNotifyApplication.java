package com.acme.achnotify.job;

import com.acme.achnotify.core.ConfigurationException;
import com.acme.achnotify.domain.SummaryReport;
import com.acme.achnotify.job.db.SchemaMigrator;
import com.acme.achnotify.pipeline.AchEmailJob;
import io.micronaut.context.ApplicationContext;
import io.micronaut.runtime.Micronaut;
import lombok.extern.slf4j.Slf4j;

/**
 * ACH Notification Job - one scheduled batch run. Migrates the schema, runs the notification
 * pipeline and exits with 1 when the run was aborted by a configuration error, 0 otherwise.
 */
@Slf4j
public class AchNotifyApplication {

  static final int EXIT_OK = 0;
  static final int EXIT_CONFIGURATION_ERROR = 1;

  public static void main(String[] args) {
    System.exit(run(args));
  }

  static int run(String... args) {
    try (ApplicationContext context =
        Micronaut.build(args).mainClass(AchNotifyApplication.class).start()) {
      return execute(context);
    }
  }

  static int execute(ApplicationContext context) {
    context.getBean(SchemaMigrator.class).migrate();
    AchEmailJob job = context.getBean(AchEmailJob.class);
    try {
      SummaryReport report = job.run();
      log.info(
          "ACH notification run {} finished: {} group(s) notified, {} skipped, {} errors, {} failed group(s)",
          report.runId(),
          report.notifiedGroups(),
          report.skippedCount(),
          report.errorCount(),
          report.failedGroups().size());
      return EXIT_OK;
    } catch (ConfigurationException e) {
      log.error("ACH notification run aborted: {}", e.getMessage(), e);
      return EXIT_CONFIGURATION_ERROR;
    }
  }
}
