package com.acme.achnotify.pipeline.test;

import com.acme.achnotify.domain.EmailMessage;
import com.acme.achnotify.spi.EmailTransport;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Predicate;

/**
 * Email transport that records every message instead of sending it. A failure predicate makes
 * selected sends throw.
 */
public class CapturingEmailTransport implements EmailTransport {
    private final List<EmailMessage> sent = new CopyOnWriteArrayList<>();
    private volatile Predicate<EmailMessage> failWhen = message -> false;

    @Override
    public void send(EmailMessage message) {
        if (failWhen.test(message)) {
            throw new IllegalStateException("SMTP connection refused");
        }
        sent.add(message);
    }

    public void failWhen(Predicate<EmailMessage> predicate) {
        this.failWhen = predicate;
    }

    public List<EmailMessage> getSent() {
        return sent;
    }

    public List<EmailMessage> sentTo(String recipient) {
        return sent.stream().filter(m -> m.recipients().contains(recipient)).toList();
    }
}
