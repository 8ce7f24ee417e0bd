package com.acme.achnotify.pipeline;

import com.acme.achnotify.config.AchNotifyConfig;
import com.acme.achnotify.core.ConfigurationException;
import com.acme.achnotify.domain.GroupNotificationResult;
import com.acme.achnotify.domain.GroupingResult;
import com.acme.achnotify.domain.JobStage;
import com.acme.achnotify.domain.NormalizedResult;
import com.acme.achnotify.domain.PaymentGroup;
import com.acme.achnotify.domain.RawPaymentRecord;
import com.acme.achnotify.domain.SummaryReport;
import com.acme.achnotify.spi.PaymentSearchService;
import com.acme.achnotify.spi.SearchResultSet;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one ACH notification batch end to end: read the eligible payments, normalize them in
 * parallel, group by account and vendor, notify each group, summarize.
 *
 * <p>Stages are separated by barriers: grouping starts only after every record was normalized
 * and the summary only after every group finished. Only a {@link ConfigurationException}
 * escapes {@link #run()}; every other failure ends up in the returned report.
 */
public class AchEmailJob {
  private static final Logger LOG = LoggerFactory.getLogger(AchEmailJob.class);

  private final AchNotifyConfig config;
  private final PaymentSearchService searchService;
  private final RecordNormalizer normalizer;
  private final PaymentGrouper grouper;
  private final VoucherNotificationGenerator generator;
  private final ReportAggregator aggregator;

  private volatile JobStage stage;

  public AchEmailJob(
      AchNotifyConfig config,
      PaymentSearchService searchService,
      RecordNormalizer normalizer,
      PaymentGrouper grouper,
      VoucherNotificationGenerator generator,
      ReportAggregator aggregator) {
    this.config = config;
    this.searchService = searchService;
    this.normalizer = normalizer;
    this.grouper = grouper;
    this.generator = generator;
    this.aggregator = aggregator;
  }

  public SummaryReport run() {
    Instant startedAt = Instant.now();
    enter(JobStage.COLLECTING_INPUT);
    try {
      config.validate();
    } catch (ConfigurationException e) {
      LOG.error("Error in input stage: {}", e.getMessage());
      throw e;
    }
    String runId = resolveRunId();
    LOG.info(
        "Job parameters: searchId={}, printTemplateId={}, emailAuthor={}, reportRecipient={}, runId={}",
        config.getEligiblePaymentsSearchId(),
        config.getPrintTemplateId(),
        config.getEmailAuthor(),
        config.getReportRecipient(),
        runId);

    SearchResultSet resultSet = openSearch();

    ExecutorService normalizerPool = Executors.newFixedThreadPool(config.getNormalizerParallelism());
    ExecutorService generatorPool = Executors.newFixedThreadPool(config.getGeneratorParallelism());
    try {
      enter(JobStage.NORMALIZING);
      List<NormalizedResult> normalized = normalizeAll(resultSet, normalizerPool);

      enter(JobStage.GROUPING);
      GroupingResult grouping = grouper.group(normalized);

      enter(JobStage.GENERATING_AND_NOTIFYING);
      List<GroupNotificationResult> outcomes =
          generateAll(grouping.groups(), runId, generatorPool);

      enter(JobStage.SUMMARIZING);
      SummaryReport report =
          aggregator.summarize(runId, normalized.size(), grouping, outcomes, startedAt);

      enter(JobStage.DONE);
      return report;
    } finally {
      normalizerPool.shutdownNow();
      generatorPool.shutdownNow();
    }
  }

  public JobStage getStage() {
    return stage;
  }

  private String resolveRunId() {
    if (config.getRunId() == null || config.getRunId().isBlank()) {
      String generated = UUID.randomUUID().toString();
      LOG.info("No run ID configured, generated {}", generated);
      return generated;
    }
    return config.getRunId();
  }

  private SearchResultSet openSearch() {
    String searchId = config.getEligiblePaymentsSearchId();
    try {
      SearchResultSet resultSet = searchService.runSearch(searchId);
      LOG.info(
          "Input Data Records: found {} eligible payment records to process", resultSet.count());
      return resultSet;
    } catch (RuntimeException e) {
      LOG.error("Error in input stage: invalid search ID {}", searchId, e);
      throw new ConfigurationException(
          "Invalid search ID (" + searchId + "): " + e.getMessage(), e);
    }
  }

  /** Reads the search page by page and normalizes each page on the pool. */
  private List<NormalizedResult> normalizeAll(SearchResultSet resultSet, ExecutorService pool) {
    List<CompletableFuture<List<NormalizedResult>>> pages = new ArrayList<>();
    int pageIndex = 0;
    while (true) {
      List<RawPaymentRecord> page = readPage(resultSet, pageIndex);
      if (page.isEmpty()) {
        break;
      }
      pages.add(
          CompletableFuture.supplyAsync(
              () -> page.stream().map(normalizer::normalize).toList(), pool));
      if (page.size() < config.getPageSize()) {
        break;
      }
      pageIndex++;
    }

    List<NormalizedResult> results = new ArrayList<>();
    for (CompletableFuture<List<NormalizedResult>> page : pages) {
      results.addAll(page.join());
    }
    LOG.info("Normalized {} records from {} pages", results.size(), pages.size());
    return results;
  }

  private List<RawPaymentRecord> readPage(SearchResultSet resultSet, int pageIndex) {
    try {
      return resultSet.page(pageIndex, config.getPageSize());
    } catch (RuntimeException e) {
      throw new ConfigurationException(
          "Unable to read page " + pageIndex + " of search "
              + config.getEligiblePaymentsSearchId() + ": " + e.getMessage(),
          e);
    }
  }

  private List<GroupNotificationResult> generateAll(
      List<PaymentGroup> groups, String runId, ExecutorService pool) {
    List<CompletableFuture<GroupNotificationResult>> futures = new ArrayList<>(groups.size());
    for (PaymentGroup group : groups) {
      futures.add(CompletableFuture.supplyAsync(() -> generator.generate(group, runId), pool));
    }
    List<GroupNotificationResult> outcomes = new ArrayList<>(futures.size());
    for (CompletableFuture<GroupNotificationResult> future : futures) {
      outcomes.add(future.join());
    }
    return outcomes;
  }

  private void enter(JobStage next) {
    LOG.info("ACH notification run entering stage {}", next);
    this.stage = next;
  }
}
