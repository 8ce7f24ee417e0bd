package com.acme.achnotify.pipeline;

import com.acme.achnotify.config.AchNotifyConfig;
import com.acme.achnotify.core.ErrorKind;
import com.acme.achnotify.core.Jsons;
import com.acme.achnotify.core.StepResult;
import com.acme.achnotify.domain.EmailMessage;
import com.acme.achnotify.domain.GroupNotificationResult;
import com.acme.achnotify.domain.GroupStatus;
import com.acme.achnotify.domain.GroupingResult;
import com.acme.achnotify.domain.SummaryReport;
import com.acme.achnotify.domain.SummaryReport.GroupFailure;
import com.acme.achnotify.spi.EmailTransport;
import java.time.Instant;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Summarize stage. Builds the run report from the group outcomes and both buckets and, when
 * anything was skipped or failed, emails it to operations.
 */
public class ReportAggregator {
  private static final Logger LOG = LoggerFactory.getLogger(ReportAggregator.class);

  private final AchNotifyConfig config;
  private final EmailTransport transport;
  private final OperationalReportComposer composer;

  public ReportAggregator(
      AchNotifyConfig config, EmailTransport transport, OperationalReportComposer composer) {
    this.config = config;
    this.transport = transport;
    this.composer = composer;
  }

  public SummaryReport summarize(
      String runId,
      long totalRecords,
      GroupingResult grouping,
      List<GroupNotificationResult> outcomes,
      Instant startedAt) {
    List<GroupFailure> failedGroups =
        outcomes.stream()
            .filter(outcome -> outcome.status().isFailure())
            .map(
                outcome ->
                    new GroupFailure(
                        outcome.group().groupKey(),
                        outcome.group().accountId(),
                        outcome.group().vendorId(),
                        outcome.status(),
                        outcome.errorNote()))
            .toList();
    int notified = (int) outcomes.stream().filter(GroupNotificationResult::isNotified).count();
    long alreadyDispatched =
        outcomes.stream().filter(outcome -> outcome.status() == GroupStatus.ALREADY_DISPATCHED).count();
    if (alreadyDispatched > 0) {
      LOG.info("{} groups were already dispatched by an earlier attempt of run {}", alreadyDispatched, runId);
    }

    SummaryReport report =
        new SummaryReport(
            runId,
            totalRecords,
            outcomes.size(),
            notified,
            grouping.skipped(),
            grouping.errored(),
            failedGroups,
            startedAt,
            Instant.now());

    if (!report.skippedRecords().isEmpty()) {
      LOG.info("Skipped Records: found {} skipped records", report.skippedCount());
    }
    if (!report.errorRecords().isEmpty()) {
      LOG.info("Error Records: found {} error records", report.errorCount());
    }
    LOG.info("Processing Summary: {}", Jsons.toJson(report));

    if (report.hasProblems()) {
      sendOperationalReport(report);
    }
    return report;
  }

  private void sendOperationalReport(SummaryReport report) {
    StepResult<Void> sent =
        StepResult.attemptRun(
            ErrorKind.SEND,
            () ->
                transport.send(
                    new EmailMessage(
                        config.getEmailAuthor(),
                        List.of(config.getReportRecipient()),
                        composer.subject(report),
                        composer.body(report),
                        List.of(),
                        true)));
    if (sent.isFailure()) {
      LOG.error("Error sending processing report to {}: {}", config.getReportRecipient(), sent.error());
    } else {
      LOG.info("Processing report sent to {}", config.getReportRecipient());
    }
  }
}
