package com.acme.achnotify.job.mail;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.acme.achnotify.core.TransientException;
import com.acme.achnotify.domain.EmailMessage;
import com.acme.achnotify.domain.VoucherFile;
import com.acme.achnotify.job.config.MailConfig;
import jakarta.mail.BodyPart;
import jakarta.mail.Message;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MimeMessage;
import jakarta.mail.internet.MimeMultipart;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("JakartaMailEmailTransport")
class JakartaMailEmailTransportTest {

    private MailConfig config;
    private JakartaMailEmailTransport transport;

    @BeforeEach
    void setUp() {
        config = new MailConfig();
        config.setHost("localhost");
        config.setPort(1);
        config.setTimeoutMillis(2000);
        config.setDefaultFrom("ach-notifications@acme.example");
        transport = new JakartaMailEmailTransport(config);
    }

    @Nested
    @DisplayName("buildMessage")
    class BuildMessage {

        @Test
        @DisplayName("should attach every voucher as a PDF part after the body")
        void shouldAttachVouchers() throws Exception {
            // Given
            EmailMessage message = new EmailMessage(
                    "E100",
                    List.of("ap@vendor-one.example"),
                    "Payment advice",
                    "<p>Hello</p>",
                    List.of(
                            voucher("1", "ACH_Payment_1.pdf"),
                            voucher("2", "ACH_Payment_2.pdf")),
                    true);

            // When
            MimeMessage mime = transport.buildMessage(message);

            // Then
            assertThat(mime.getSubject()).isEqualTo("Payment advice");
            assertThat(mime.getFrom())
                    .containsExactly(new InternetAddress("ach-notifications@acme.example"));
            assertThat(mime.getRecipients(Message.RecipientType.TO))
                    .containsExactly(new InternetAddress("ap@vendor-one.example"));

            MimeMultipart content = (MimeMultipart) mime.getContent();
            assertThat(content.getCount()).isEqualTo(3);
            assertThat(content.getBodyPart(0).getContentType()).startsWith("text/html");
            BodyPart first = content.getBodyPart(1);
            assertThat(first.getFileName()).isEqualTo("ACH_Payment_1.pdf");
            assertThat(first.getContentType()).startsWith("application/pdf");
            assertThat(content.getBodyPart(2).getFileName()).isEqualTo("ACH_Payment_2.pdf");
        }

        @Test
        @DisplayName("should send plain text bodies as text/plain")
        void shouldUsePlainText() throws Exception {
            EmailMessage message = new EmailMessage(
                    "payables@acme.example", List.of("ops@acme.example"), "Report", "All good", List.of(), false);

            MimeMessage mime = transport.buildMessage(message);

            MimeMultipart content = (MimeMultipart) mime.getContent();
            assertThat(content.getCount()).isEqualTo(1);
            assertThat(content.getBodyPart(0).getContentType()).startsWith("text/plain");
            assertThat(content.getBodyPart(0).getContent()).isEqualTo("All good");
        }
    }

    @Nested
    @DisplayName("resolveSender")
    class ResolveSender {

        @Test
        @DisplayName("should use an author that is already an address")
        void shouldKeepAddress() {
            assertThat(transport.resolveSender("payables@acme.example")).isEqualTo("payables@acme.example");
        }

        @Test
        @DisplayName("should fall back to the default sender for employee ids")
        void shouldFallBackForIds() {
            assertThat(transport.resolveSender("E100")).isEqualTo("ach-notifications@acme.example");
        }

        @Test
        @DisplayName("should fail when an id cannot be mapped to a sender")
        void shouldFailWithoutDefault() {
            config.setDefaultFrom(null);

            assertThatThrownBy(() -> transport.resolveSender("E100"))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("mail.default-from");
        }
    }

    @Test
    @DisplayName("send should report an unreachable server as a transient failure")
    void shouldWrapDeliveryFailure() {
        EmailMessage message = new EmailMessage(
                "E100", List.of("ap@vendor-one.example"), "Payment advice", "body", List.of(), false);

        assertThatThrownBy(() -> transport.send(message))
                .isInstanceOf(TransientException.class)
                .hasMessageStartingWith("Failed to send email to [ap@vendor-one.example]");
    }

    private static VoucherFile voucher(String id, String name) {
        return new VoucherFile(id, name, "ach-vouchers", "%PDF-1.4".getBytes(StandardCharsets.US_ASCII));
    }
}
