package com.acme.achnotify.pipeline;

import static com.acme.achnotify.pipeline.PipelineTestData.RawRecordBuilder.aCompleteRecord;
import static com.acme.achnotify.pipeline.PipelineTestData.RawRecordBuilder.anEmptyRecord;
import static org.assertj.core.api.Assertions.*;

import com.acme.achnotify.domain.BucketEntry;
import com.acme.achnotify.domain.NormalizedResult;
import com.acme.achnotify.domain.NormalizedResult.Outcome;
import com.acme.achnotify.domain.PaymentOrder;
import com.acme.achnotify.domain.RawPaymentRecord;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("RecordNormalizer Tests")
class RecordNormalizerTest {

    private RecordNormalizer normalizer;

    @BeforeEach
    void setUp() {
        normalizer = new RecordNormalizer();
    }

    @Nested
    @DisplayName("Valid records")
    class ValidRecords {

        @Test
        @DisplayName("should build a payment order keyed by account and vendor")
        void testNormalize_CompleteRecord() {
            // Given
            RawPaymentRecord raw =
                    aCompleteRecord("101").withAccount("A1").withVendor("V1", "Vendor One").build();

            // When
            NormalizedResult result = normalizer.normalize(raw);

            // Then
            assertThat(result.outcome()).isEqualTo(Outcome.VALID);
            PaymentOrder order = result.order();
            assertThat(order.orderId()).isEqualTo("101");
            assertThat(order.groupKey()).isEqualTo("A1_V1");
            assertThat(order.orderDate()).isEqualTo("2024-03-15");
            assertThat(order.postingPeriod()).isEqualTo("Mar 2024");
            assertThat(order.orderNumber()).isEqualTo("PAY-101");
            assertThat(order.entityName()).isEqualTo("Vendor One");
            assertThat(order.vendorEmail()).isEqualTo("ap@vendor-one.example");
            assertThat(result.entry()).isNull();
        }

        @Test
        @DisplayName("should default a missing posting period to empty")
        void testNormalize_NoPostingPeriod() {
            RawPaymentRecord raw = aCompleteRecord("102").without(RawPaymentRecord.POSTING_PERIOD).build();

            NormalizedResult result = normalizer.normalize(raw);

            assertThat(result.isValid()).isTrue();
            assertThat(result.order().postingPeriod()).isEmpty();
        }

        @Test
        @DisplayName("should fall back to the vendor id when the vendor has no display name")
        void testNormalize_VendorWithoutText() {
            RawPaymentRecord raw = aCompleteRecord("103").with(RawPaymentRecord.ENTITY, "V9").build();

            NormalizedResult result = normalizer.normalize(raw);

            assertThat(result.isValid()).isTrue();
            assertThat(result.order().entityName()).isEqualTo("V9");
            assertThat(result.order().groupKey()).isEqualTo("A1_V9");
        }

        @Test
        @DisplayName("should produce identical results when run twice on the same record")
        void testNormalize_Idempotent() {
            RawPaymentRecord valid = aCompleteRecord("104").build();
            RawPaymentRecord incomplete = aCompleteRecord("105").without(RawPaymentRecord.TRAN_ID).build();

            assertThat(normalizer.normalize(valid)).isEqualTo(normalizer.normalize(valid));
            assertThat(normalizer.normalize(incomplete)).isEqualTo(normalizer.normalize(incomplete));
        }
    }

    @Nested
    @DisplayName("Missing required fields")
    class MissingFields {

        @Test
        @DisplayName("should skip a record without vendor email")
        void testNormalize_MissingVendorEmail() {
            RawPaymentRecord raw =
                    aCompleteRecord("201").without(RawPaymentRecord.VENDOR_EMAIL).build();

            NormalizedResult result = normalizer.normalize(raw);

            assertThat(result.outcome()).isEqualTo(Outcome.SKIPPED);
            assertThat(result.order()).isNull();
            BucketEntry entry = result.entry();
            assertThat(entry.recordId()).isEqualTo("201");
            assertThat(entry.orderNumber()).isEqualTo("PAY-201");
            assertThat(entry.entityName()).isEqualTo("Vendor One");
            assertThat(entry.accountId()).isEqualTo("A1");
            assertThat(entry.vendorId()).isEqualTo("V1");
            assertThat(entry.missingFields()).containsExactly("vendor email");
            assertThat(entry.errorNote()).isEqualTo("Missing required fields: vendor email");
        }

        @Test
        @DisplayName("should list every missing field in check order")
        void testNormalize_AllFieldsMissing() {
            NormalizedResult result = normalizer.normalize(anEmptyRecord("202").build());

            assertThat(result.outcome()).isEqualTo(Outcome.SKIPPED);
            assertThat(result.entry().missingFields())
                    .containsExactly(
                            "account", "entity", "transaction date", "transaction ID", "vendor email");
            assertThat(result.entry().errorNote())
                    .isEqualTo(
                            "Missing required fields: account, entity, transaction date, transaction ID, vendor email");
            assertThat(result.entry().orderNumber()).isEqualTo(BucketEntry.NOT_AVAILABLE);
            assertThat(result.entry().accountId()).isEqualTo(BucketEntry.NOT_AVAILABLE);
        }

        @Test
        @DisplayName("should treat a select field without value as missing")
        void testNormalize_SelectWithoutValue() {
            RawPaymentRecord raw =
                    aCompleteRecord("203").with(RawPaymentRecord.ACCOUNT, Map.of("text", "Operating")).build();

            NormalizedResult result = normalizer.normalize(raw);

            assertThat(result.outcome()).isEqualTo(Outcome.SKIPPED);
            assertThat(result.entry().missingFields()).containsExactly("account");
        }

        @Test
        @DisplayName("should treat blank values as missing")
        void testNormalize_BlankValues() {
            RawPaymentRecord raw =
                    aCompleteRecord("204")
                            .withTranDate("  ")
                            .withTranId("")
                            .build();

            NormalizedResult result = normalizer.normalize(raw);

            assertThat(result.entry().missingFields())
                    .containsExactly("transaction date", "transaction ID");
        }
    }

    @Nested
    @DisplayName("Malformed records")
    class MalformedRecords {

        @Test
        @DisplayName("should route a record with an unexpected structure to the error bucket")
        void testNormalize_StructuredTranId() {
            RawPaymentRecord raw =
                    aCompleteRecord("301").with(RawPaymentRecord.TRAN_ID, List.of("a", "b")).build();

            NormalizedResult result = normalizer.normalize(raw);

            assertThat(result.outcome()).isEqualTo(Outcome.ERRORED);
            assertThat(result.entry().recordId()).isEqualTo("301");
            assertThat(result.entry().errorNote()).startsWith("Error processing record: ");
            assertThat(result.entry().orderNumber()).isEqualTo(BucketEntry.NOT_AVAILABLE);
            assertThat(result.entry().accountId()).isEqualTo("A1");
        }

        @Test
        @DisplayName("should reject account ids containing the key separator")
        void testNormalize_AccountWithSeparator() {
            RawPaymentRecord raw = aCompleteRecord("302").withAccount("A_1").build();

            NormalizedResult result = normalizer.normalize(raw);

            assertThat(result.outcome()).isEqualTo(Outcome.ERRORED);
            assertThat(result.entry().errorNote()).contains("must not contain '_'");
        }

        @Test
        @DisplayName("should route a null record to the error bucket")
        void testNormalize_NullRecord() {
            NormalizedResult result = normalizer.normalize(null);

            assertThat(result.outcome()).isEqualTo(Outcome.ERRORED);
            assertThat(result.entry().recordId()).isNull();
        }
    }
}
