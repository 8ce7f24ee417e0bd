package com.acme.achnotify.pipeline;

import static com.acme.achnotify.core.TemplatePlaceholders.escapeHtml;

import com.acme.achnotify.domain.BucketEntry;
import com.acme.achnotify.domain.SummaryReport;
import com.acme.achnotify.domain.SummaryReport.GroupFailure;
import java.util.List;

/** Renders the operational report email: counts in the subject, HTML tables in the body. */
public class OperationalReportComposer {

  public String subject(SummaryReport report) {
    String subject =
        String.format(
            "ACH Payment Processing Report: %d Skipped, %d Errors",
            report.skippedCount(), report.errorCount());
    if (!report.failedGroups().isEmpty()) {
      subject += String.format(", %d Failed Groups", report.failedGroups().size());
    }
    return subject;
  }

  public String body(SummaryReport report) {
    StringBuilder html = new StringBuilder();
    html.append("<h2>ACH Payment Processing Report</h2>\n");
    html.append("<p>Run ID: ").append(escapeHtml(report.runId())).append("</p>\n");
    html.append("<p>Total Records: ").append(report.totalRecords()).append("</p>\n");
    html.append("<p>Successfully Processed: ")
        .append(report.successfullyProcessed())
        .append("</p>\n");
    html.append("<p>Vendors Notified: ").append(report.notifiedGroups()).append("</p>\n");

    appendRecordTable(html, "Skipped Records", report.skippedRecords());
    appendRecordTable(html, "Error Records", report.errorRecords());

    if (!report.failedGroups().isEmpty()) {
      html.append("<h3>Failed Groups (").append(report.failedGroups().size()).append(")</h3>\n");
      html.append("<table border=\"1\" cellpadding=\"4\">\n");
      html.append("<tr><th>Account</th><th>Vendor</th><th>Status</th><th>Error Description</th></tr>\n");
      for (GroupFailure failure : report.failedGroups()) {
        html.append("<tr><td>")
            .append(escapeHtml(failure.accountId()))
            .append("</td><td>")
            .append(escapeHtml(failure.vendorId()))
            .append("</td><td>")
            .append(failure.status())
            .append("</td><td>")
            .append(escapeHtml(failure.errorNote()))
            .append("</td></tr>\n");
      }
      html.append("</table>\n");
    }
    return html.toString();
  }

  private void appendRecordTable(StringBuilder html, String title, List<BucketEntry> entries) {
    if (entries.isEmpty()) {
      return;
    }
    html.append("<h3>").append(title).append(" (").append(entries.size()).append(")</h3>\n");
    html.append("<table border=\"1\" cellpadding=\"4\">\n");
    html.append(
        "<tr><th>Transaction ID</th><th>Vendor</th><th>Account</th><th>Error Description</th></tr>\n");
    for (BucketEntry entry : entries) {
      html.append("<tr><td>")
          .append(escapeHtml(entry.orderNumber()))
          .append("</td><td>")
          .append(escapeHtml(entry.entityName()))
          .append("</td><td>")
          .append(escapeHtml(entry.accountId()))
          .append("</td><td>")
          .append(escapeHtml(entry.errorNote()))
          .append("</td></tr>\n");
    }
    html.append("</table>\n");
  }
}
