package com.acme.achnotify.job.mail;

import com.acme.achnotify.core.TransientException;
import com.acme.achnotify.domain.EmailMessage;
import com.acme.achnotify.domain.VoucherFile;
import com.acme.achnotify.job.config.MailConfig;
import com.acme.achnotify.spi.EmailTransport;
import jakarta.activation.DataHandler;
import jakarta.inject.Singleton;
import jakarta.mail.Authenticator;
import jakarta.mail.Message;
import jakarta.mail.MessagingException;
import jakarta.mail.PasswordAuthentication;
import jakarta.mail.Session;
import jakarta.mail.Transport;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MimeBodyPart;
import jakarta.mail.internet.MimeMessage;
import jakarta.mail.internet.MimeMultipart;
import jakarta.mail.util.ByteArrayDataSource;
import java.nio.charset.StandardCharsets;
import lombok.extern.slf4j.Slf4j;

/**
 * SMTP delivery through Jakarta Mail. Each message is multipart: the body first, then one
 * application/pdf part per voucher.
 */
@Slf4j
@Singleton
public class JakartaMailEmailTransport implements EmailTransport {

  private static final String PDF = "application/pdf";

  private final MailConfig config;
  private final Session session;

  public JakartaMailEmailTransport(MailConfig config) {
    this.config = config;
    this.session = createSession(config);
  }

  @Override
  public void send(EmailMessage message) {
    try {
      MimeMessage mime = buildMessage(message);
      Transport.send(mime);
      log.info(
          "Sent email '{}' to {} with {} attachment(s)",
          message.subject(),
          message.recipients(),
          message.attachments().size());
    } catch (MessagingException e) {
      throw new TransientException(
          "Failed to send email to " + message.recipients() + ": " + e.getMessage(), e);
    }
  }

  MimeMessage buildMessage(EmailMessage message) throws MessagingException {
    MimeMessage mime = new MimeMessage(session);
    mime.setFrom(new InternetAddress(resolveSender(message.author())));
    for (String recipient : message.recipients()) {
      mime.addRecipient(Message.RecipientType.TO, new InternetAddress(recipient));
    }
    mime.setSubject(message.subject(), StandardCharsets.UTF_8.name());

    MimeMultipart content = new MimeMultipart();
    MimeBodyPart body = new MimeBodyPart();
    if (message.html()) {
      body.setContent(message.body(), "text/html; charset=UTF-8");
    } else {
      body.setText(message.body(), StandardCharsets.UTF_8.name());
    }
    content.addBodyPart(body);

    for (VoucherFile voucher : message.attachments()) {
      MimeBodyPart attachment = new MimeBodyPart();
      attachment.setDataHandler(new DataHandler(new ByteArrayDataSource(voucher.contents(), PDF)));
      attachment.setFileName(voucher.name());
      content.addBodyPart(attachment);
    }
    mime.setContent(content);
    mime.saveChanges();
    return mime;
  }

  /** The author is either an address or an employee id; ids fall back to mail.default-from. */
  String resolveSender(String author) {
    if (author != null && author.contains("@")) {
      return author;
    }
    if (config.getDefaultFrom() == null || config.getDefaultFrom().isBlank()) {
      throw new IllegalStateException(
          "Email author " + author + " is not an address and mail.default-from is not set");
    }
    return config.getDefaultFrom();
  }

  private static Session createSession(MailConfig config) {
    if (!config.hasCredentials()) {
      return Session.getInstance(config.toSessionProperties());
    }
    return Session.getInstance(
        config.toSessionProperties(),
        new Authenticator() {
          @Override
          protected PasswordAuthentication getPasswordAuthentication() {
            return new PasswordAuthentication(config.getUsername(), config.getPassword());
          }
        });
  }
}
