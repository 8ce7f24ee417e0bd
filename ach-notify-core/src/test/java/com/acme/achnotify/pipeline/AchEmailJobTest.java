package com.acme.achnotify.pipeline;

import com.acme.achnotify.config.AchNotifyConfig;
import com.acme.achnotify.core.ConfigurationException;
import com.acme.achnotify.core.TemplateNotFoundException;
import com.acme.achnotify.domain.BucketEntry;
import com.acme.achnotify.domain.EmailMessage;
import com.acme.achnotify.domain.JobStage;
import com.acme.achnotify.domain.MergedEmail;
import com.acme.achnotify.domain.RawPaymentRecord;
import com.acme.achnotify.domain.SummaryReport;
import com.acme.achnotify.pipeline.test.CapturingEmailTransport;
import com.acme.achnotify.pipeline.test.InMemoryDispatchLedger;
import com.acme.achnotify.pipeline.test.InMemoryFileStore;
import com.acme.achnotify.pipeline.test.InMemoryPaymentRecordStore;
import com.acme.achnotify.pipeline.test.ListSearchService;
import com.acme.achnotify.spi.EmailTemplateLookup;
import com.acme.achnotify.spi.TemplateMergeService;
import com.acme.achnotify.spi.VoucherRenderer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static com.acme.achnotify.pipeline.PipelineTestData.RawRecordBuilder.aCompleteRecord;
import static org.assertj.core.api.Assertions.*;

/**
 * End-to-end tests of the job over in-memory collaborators.
 */
@DisplayName("AchEmailJob Tests")
class AchEmailJobTest {

    private static final String SEARCH_ID = "customsearch_ach_eligible";
    private static final String OPS = "ops@example.com";

    private AchNotifyConfig config;
    private InMemoryPaymentRecordStore recordStore;
    private CapturingEmailTransport transport;
    private InMemoryDispatchLedger ledger;
    private ExecutorService renderPool;

    private final EmailTemplateLookup templateLookup = accountId -> {
        if ("A1".equals(accountId)) {
            return "77";
        }
        throw new TemplateNotFoundException(accountId);
    };
    private final TemplateMergeService templateMerge =
        (templateId, authorId, recipientId) -> new MergedEmail("Payment advice for " + recipientId, "body", false);
    private final VoucherRenderer renderer = (printTemplateId, payment) -> ("PDF " + payment.getId()).getBytes();

    @BeforeEach
    void setUp() {
        config = new AchNotifyConfig();
        config.setEligiblePaymentsSearchId(SEARCH_ID);
        config.setEmailAuthor("-5");
        config.setPrintTemplateId("CUSTTMPL_ACH_VOUCHER");
        config.setReportRecipient(OPS);
        config.setRunId("run-1");
        recordStore = new InMemoryPaymentRecordStore();
        transport = new CapturingEmailTransport();
        ledger = new InMemoryDispatchLedger();
        renderPool = Executors.newFixedThreadPool(2);
    }

    @AfterEach
    void tearDown() {
        renderPool.shutdownNow();
    }

    private AchEmailJob newJob(List<RawPaymentRecord> rows) {
        return newJob(new ListSearchService(Map.of(SEARCH_ID, rows)));
    }

    private AchEmailJob newJob(ListSearchService searchService) {
        VoucherNotificationGenerator generator = new VoucherNotificationGenerator(
            config, templateLookup, templateMerge, renderer, new InMemoryFileStore(), transport,
            recordStore, ledger, renderPool);
        ReportAggregator aggregator =
            new ReportAggregator(config, transport, new OperationalReportComposer());
        return new AchEmailJob(
            config, searchService, new RecordNormalizer(), new PaymentGrouper(), generator, aggregator);
    }

    private List<EmailMessage> vendorEmails() {
        return transport.getSent().stream().filter(m -> !m.recipients().contains(OPS)).toList();
    }

    @Nested
    @DisplayName("Batch processing")
    class BatchProcessing {

        @Test
        @DisplayName("should notify complete vendors and skip the record without vendor email")
        void testThreeRecordScenario() {
            // Given
            recordStore.withPayment("1", "PAY-1").withPayment("2", "PAY-2").withPayment("3", "PAY-3");
            List<RawPaymentRecord> rows = List.of(
                aCompleteRecord("1").withAccount("A1").withVendor("V1", "Vendor One")
                    .withVendorEmail("v1@example.com").build(),
                aCompleteRecord("2").withAccount("A1").withVendor("V1", "Vendor One")
                    .without(RawPaymentRecord.VENDOR_EMAIL).build(),
                aCompleteRecord("3").withAccount("A1").withVendor("V2", "Vendor Two")
                    .withVendorEmail("v2@example.com").build());

            // When
            AchEmailJob job = newJob(rows);
            SummaryReport report = job.run();

            // Then
            assertThat(vendorEmails()).hasSize(2);
            assertThat(transport.sentTo("v1@example.com")).singleElement()
                .satisfies(m -> assertThat(m.attachments()).hasSize(1));
            assertThat(transport.sentTo("v2@example.com")).hasSize(1);
            assertThat(recordStore.isEmailSent("1")).isTrue();
            assertThat(recordStore.isEmailSent("2")).isFalse();
            assertThat(recordStore.isEmailSent("3")).isTrue();

            assertThat(report.totalRecords()).isEqualTo(3);
            assertThat(report.successfullyProcessed()).isEqualTo(2);
            assertThat(report.skippedRecords()).singleElement().satisfies(entry -> {
                assertThat(entry.recordId()).isEqualTo("2");
                assertThat(entry.errorNote()).contains("vendor email");
            });
            assertThat(report.errorRecords()).isEmpty();
            assertThat(job.getStage()).isEqualTo(JobStage.DONE);

            assertThat(transport.sentTo(OPS)).singleElement()
                .satisfies(m -> assertThat(m.subject()).isEqualTo("ACH Payment Processing Report: 1 Skipped, 0 Errors"));
        }

        @Test
        @DisplayName("should isolate a group without template from the other groups")
        void testTemplateMissingForOneAccount() {
            recordStore.withPayment("1", "PAY-1").withPayment("2", "PAY-2");
            List<RawPaymentRecord> rows = List.of(
                aCompleteRecord("1").withAccount("A1").withVendor("V1", "Vendor One").build(),
                aCompleteRecord("2").withAccount("A2").withVendor("V1", "Vendor One").build());

            SummaryReport report = newJob(rows).run();

            assertThat(vendorEmails()).hasSize(1);
            assertThat(recordStore.isEmailSent("1")).isTrue();
            assertThat(recordStore.isEmailSent("2")).isFalse();
            assertThat(report.successfullyProcessed()).isEqualTo(2);
            assertThat(report.notifiedGroups()).isEqualTo(1);
            assertThat(report.failedGroups()).extracting(f -> f.accountId()).containsExactly("A2");
        }

        @Test
        @DisplayName("should read every page and account for every record exactly once")
        void testPagingAndAccounting() {
            config.setPageSize(2);
            List<RawPaymentRecord> rows = new ArrayList<>();
            for (int i = 1; i <= 7; i++) {
                recordStore.withPayment(String.valueOf(i), "PAY-" + i);
                rows.add(aCompleteRecord(String.valueOf(i)).withVendor("V" + (i % 3), "Vendor").build());
            }
            rows.add(aCompleteRecord("8").without(RawPaymentRecord.TRAN_DATE).build());
            rows.add(aCompleteRecord("9").with(RawPaymentRecord.TRAN_ID, List.of("x")).build());
            ListSearchService searchService = new ListSearchService(Map.of(SEARCH_ID, rows));

            SummaryReport report = newJob(searchService).run();

            assertThat(report.totalRecords()).isEqualTo(9);
            assertThat(report.successfullyProcessed()).isEqualTo(3);
            assertThat(report.skippedCount()).isEqualTo(1);
            assertThat(report.errorCount()).isEqualTo(1);
            assertThat(recordStore.countEmailSent()).isEqualTo(7);
            assertThat(searchService.getPagesRead()).isEqualTo(5);
        }

        @Test
        @DisplayName("should generate a run ID when none is configured")
        void testGeneratedRunId() {
            config.setRunId(null);

            SummaryReport report = newJob(List.of()).run();

            assertThat(report.runId()).isNotBlank();
            assertThat(report.totalRecords()).isZero();
            assertThat(transport.getSent()).isEmpty();
        }

        @Test
        @DisplayName("should not email vendors again when the same run is restarted")
        void testRestartSameRun() {
            recordStore.withPayment("1", "PAY-1");
            List<RawPaymentRecord> rows = List.of(aCompleteRecord("1").build());

            newJob(rows).run();
            SummaryReport second = newJob(rows).run();

            assertThat(vendorEmails()).hasSize(1);
            assertThat(second.notifiedGroups()).isZero();
            assertThat(second.failedGroups()).isEmpty();
            assertThat(transport.getSent()).noneMatch(m -> m.recipients().contains(OPS));
        }
    }

    @Nested
    @DisplayName("Configuration errors")
    class ConfigurationErrors {

        @Test
        @DisplayName("should abort before reading input when parameters are missing")
        void testMissingParameters() {
            config.setEmailAuthor(null);
            config.setReportRecipient(" ");
            ListSearchService searchService = new ListSearchService(Map.of(SEARCH_ID, List.of()));
            AchEmailJob job = newJob(searchService);

            assertThatThrownBy(job::run)
                .isInstanceOf(ConfigurationException.class)
                .hasMessage("Required parameter(s) not configured: Email Author, Report Recipient");
            assertThat(job.getStage()).isEqualTo(JobStage.COLLECTING_INPUT);
            assertThat(searchService.getPagesRead()).isZero();
            assertThat(transport.getSent()).isEmpty();
        }

        @Test
        @DisplayName("should abort with the search id when the search does not exist")
        void testUnknownSearch() {
            config.setEligiblePaymentsSearchId("customsearch_missing");
            AchEmailJob job = newJob(List.of());

            assertThatThrownBy(job::run)
                .isInstanceOf(ConfigurationException.class)
                .hasMessageStartingWith("Invalid search ID (customsearch_missing): ");
        }
    }

    @Test
    @DisplayName("BucketEntry of skipped records should carry the missing fields")
    void testSkippedEntryFields() {
        List<RawPaymentRecord> rows = List.of(aCompleteRecord("5").without(RawPaymentRecord.VENDOR_EMAIL).build());

        SummaryReport report = newJob(rows).run();

        BucketEntry entry = report.skippedRecords().get(0);
        assertThat(entry.missingFields()).containsExactly("vendor email");
        assertThat(entry.orderNumber()).isEqualTo("PAY-5");
    }
}
