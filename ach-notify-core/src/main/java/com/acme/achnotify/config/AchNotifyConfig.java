package com.acme.achnotify.config;

import com.acme.achnotify.core.ConfigurationException;
import java.util.ArrayList;
import java.util.List;

/**
 * Parameters of one notification run. Pure POJO - no framework dependencies. Built once at
 * start and handed to every stage.
 */
public class AchNotifyConfig {

  private String eligiblePaymentsSearchId;
  private String emailAuthor;
  private String printTemplateId;
  private String reportRecipient;
  private String voucherFolder = "ach-vouchers";
  private String runId;
  private RenderFailurePolicy renderFailurePolicy = RenderFailurePolicy.SEND_PARTIAL;
  private int pageSize = 1000;
  private int normalizerParallelism = 4;
  private int generatorParallelism = 4;
  private int renderParallelism = 2;

  public String getEligiblePaymentsSearchId() {
    return eligiblePaymentsSearchId;
  }

  public void setEligiblePaymentsSearchId(String eligiblePaymentsSearchId) {
    this.eligiblePaymentsSearchId = eligiblePaymentsSearchId;
  }

  public String getEmailAuthor() {
    return emailAuthor;
  }

  public void setEmailAuthor(String emailAuthor) {
    this.emailAuthor = emailAuthor;
  }

  public String getPrintTemplateId() {
    return printTemplateId;
  }

  public void setPrintTemplateId(String printTemplateId) {
    this.printTemplateId = printTemplateId;
  }

  public String getReportRecipient() {
    return reportRecipient;
  }

  public void setReportRecipient(String reportRecipient) {
    this.reportRecipient = reportRecipient;
  }

  public String getVoucherFolder() {
    return voucherFolder;
  }

  public void setVoucherFolder(String voucherFolder) {
    this.voucherFolder = voucherFolder;
  }

  /** Identifier of the run; a scheduler retry of the same run must pass the same value. */
  public String getRunId() {
    return runId;
  }

  public void setRunId(String runId) {
    this.runId = runId;
  }

  public RenderFailurePolicy getRenderFailurePolicy() {
    return renderFailurePolicy;
  }

  public void setRenderFailurePolicy(RenderFailurePolicy renderFailurePolicy) {
    this.renderFailurePolicy = renderFailurePolicy;
  }

  public int getPageSize() {
    return pageSize;
  }

  public void setPageSize(int pageSize) {
    this.pageSize = pageSize;
  }

  public int getNormalizerParallelism() {
    return normalizerParallelism;
  }

  public void setNormalizerParallelism(int normalizerParallelism) {
    this.normalizerParallelism = normalizerParallelism;
  }

  public int getGeneratorParallelism() {
    return generatorParallelism;
  }

  public void setGeneratorParallelism(int generatorParallelism) {
    this.generatorParallelism = generatorParallelism;
  }

  public int getRenderParallelism() {
    return renderParallelism;
  }

  public void setRenderParallelism(int renderParallelism) {
    this.renderParallelism = renderParallelism;
  }

  /**
   * Checks every required parameter and reports all missing ones at once.
   *
   * @throws ConfigurationException naming each missing parameter
   */
  public void validate() {
    List<String> missing = new ArrayList<>();
    if (isBlank(eligiblePaymentsSearchId)) {
      missing.add("Eligible ACH Payments Search");
    }
    if (isBlank(printTemplateId)) {
      missing.add("Print Template ID");
    }
    if (isBlank(emailAuthor)) {
      missing.add("Email Author");
    }
    if (isBlank(reportRecipient)) {
      missing.add("Report Recipient");
    }
    if (!missing.isEmpty()) {
      throw new ConfigurationException(
          "Required parameter(s) not configured: " + String.join(", ", missing));
    }
    if (pageSize < 1 || normalizerParallelism < 1 || generatorParallelism < 1
        || renderParallelism < 1) {
      throw new ConfigurationException("Page size and parallelism settings must be positive");
    }
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
