package com.acme.achnotify.pipeline;

import com.acme.achnotify.config.AchNotifyConfig;
import com.acme.achnotify.config.RenderFailurePolicy;
import com.acme.achnotify.core.ErrorKind;
import com.acme.achnotify.core.StepResult;
import com.acme.achnotify.domain.EmailMessage;
import com.acme.achnotify.domain.GroupNotificationResult;
import com.acme.achnotify.domain.GroupStatus;
import com.acme.achnotify.domain.MergedEmail;
import com.acme.achnotify.domain.PaymentGroup;
import com.acme.achnotify.domain.PaymentRecord;
import com.acme.achnotify.domain.RecordType;
import com.acme.achnotify.domain.VoucherFile;
import com.acme.achnotify.spi.DispatchLedger;
import com.acme.achnotify.spi.EmailTemplateLookup;
import com.acme.achnotify.spi.EmailTransport;
import com.acme.achnotify.spi.FileStore;
import com.acme.achnotify.spi.PaymentRecordStore;
import com.acme.achnotify.spi.TemplateMergeService;
import com.acme.achnotify.spi.VoucherRenderer;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Finalize stage for one payment group: resolve the email template, render a voucher per
 * payment, send one email to the vendor and flag every payment as notified.
 *
 * <p>Failures are isolated per group, except for render failures (per payment) and flag
 * updates (per payment, after the email went out). Different groups may be generated
 * concurrently; the instance holds no per-group state.
 */
public class VoucherNotificationGenerator {
  private static final Logger LOG = LoggerFactory.getLogger(VoucherNotificationGenerator.class);

  private final AchNotifyConfig config;
  private final EmailTemplateLookup templateLookup;
  private final TemplateMergeService templateMerge;
  private final VoucherRenderer renderer;
  private final FileStore fileStore;
  private final EmailTransport transport;
  private final PaymentRecordStore recordStore;
  private final DispatchLedger dispatchLedger;
  private final Executor renderExecutor;

  public VoucherNotificationGenerator(
      AchNotifyConfig config,
      EmailTemplateLookup templateLookup,
      TemplateMergeService templateMerge,
      VoucherRenderer renderer,
      FileStore fileStore,
      EmailTransport transport,
      PaymentRecordStore recordStore,
      DispatchLedger dispatchLedger,
      Executor renderExecutor) {
    this.config = config;
    this.templateLookup = templateLookup;
    this.templateMerge = templateMerge;
    this.renderer = renderer;
    this.fileStore = fileStore;
    this.transport = transport;
    this.recordStore = recordStore;
    this.dispatchLedger = dispatchLedger;
    this.renderExecutor = renderExecutor;
  }

  public GroupNotificationResult generate(PaymentGroup group, String runId) {
    String token = DispatchTokens.tokenFor(runId, group.orderIds());
    try {
      return notifyGroup(group, runId, token);
    } catch (RuntimeException e) {
      LOG.error("Unexpected failure generating group {}: {}", group.groupKey(), e.getMessage(), e);
      return GroupNotificationResult.failed(
          group, GroupStatus.FAILED, token, "Unexpected failure: " + e.getMessage());
    }
  }

  private GroupNotificationResult notifyGroup(PaymentGroup group, String runId, String token) {
    StepResult<String> template =
        StepResult.attempt(
            ErrorKind.TEMPLATE_RESOLUTION,
            () -> templateLookup.findEmailTemplate(group.accountId()));
    if (template.isFailure()) {
      LOG.error(
          "Template resolution failed for group {}, no email sent: {}",
          group.groupKey(),
          template.error());
      return GroupNotificationResult.failed(
          group, GroupStatus.TEMPLATE_NOT_FOUND, token, template.error());
    }
    LOG.debug("Group {} uses email template {}", group.groupKey(), template.value());

    StepResult<Boolean> claim =
        StepResult.attempt(
            ErrorKind.PERSISTENCE, () -> dispatchLedger.begin(token, group.groupKey(), runId));
    if (claim.isFailure()) {
      LOG.error(
          "Could not record dispatch of group {}, no email sent: {}",
          group.groupKey(),
          claim.error());
      return GroupNotificationResult.failed(
          group, GroupStatus.FAILED, token, "Dispatch ledger unavailable: " + claim.error());
    }
    if (!claim.value()) {
      return alreadyClaimed(group, runId, token);
    }

    try {
      return dispatchClaimed(group, template.value(), token);
    } catch (RuntimeException e) {
      release(token, "Unexpected failure: " + e.getMessage());
      throw e;
    }
  }

  private GroupNotificationResult alreadyClaimed(PaymentGroup group, String runId, String token) {
    StepResult<Boolean> sent =
        StepResult.attempt(ErrorKind.PERSISTENCE, () -> dispatchLedger.isSent(token));
    if (sent.isFailure()) {
      LOG.error("Could not read dispatch token {}: {}", token, sent.error());
      return GroupNotificationResult.failed(
          group, GroupStatus.FAILED, token, "Dispatch ledger unavailable: " + sent.error());
    }
    if (sent.value()) {
      LOG.info(
          "Group {} already dispatched in run {} (token {}), not sending again",
          group.groupKey(),
          runId,
          token);
      return GroupNotificationResult.alreadyDispatched(group, token);
    }
    LOG.warn(
        "RECONCILE: group {} was claimed in run {} (token {}) but never marked sent, not sending",
        group.groupKey(),
        runId,
        token);
    return GroupNotificationResult.failed(
        group,
        GroupStatus.DISPATCH_IN_PROGRESS,
        token,
        "Dispatch pending from an earlier attempt, check whether the email went out");
  }

  /** Runs once the token is claimed; every path that sends nothing releases the token. */
  private GroupNotificationResult dispatchClaimed(
      PaymentGroup group, String templateId, String token) {
    List<VoucherFile> attachments = new ArrayList<>();
    List<String> rendered = new ArrayList<>();
    List<String> renderFailed = new ArrayList<>();
    renderVouchers(group, attachments, rendered, renderFailed);

    if (!renderFailed.isEmpty()
        && config.getRenderFailurePolicy() == RenderFailurePolicy.DEFER_GROUP) {
      LOG.warn(
          "Deferring group {}: vouchers failed to render for {}",
          group.groupKey(),
          renderFailed);
      String note = "Voucher rendering failed for " + String.join(", ", renderFailed);
      release(token, note);
      return new GroupNotificationResult(
          group,
          GroupStatus.DEFERRED_RENDER_FAILURE,
          token,
          rendered,
          renderFailed,
          List.of(),
          List.of(),
          note);
    }

    StepResult<MergedEmail> merged =
        StepResult.attempt(
            ErrorKind.TEMPLATE_RESOLUTION,
            () -> templateMerge.mergeTemplate(templateId, config.getEmailAuthor(), group.vendorId()));
    if (merged.isFailure()) {
      LOG.error("Email merge failed for group {}: {}", group.groupKey(), merged.error());
      String note = "Email merge failed: " + merged.error();
      release(token, note);
      return new GroupNotificationResult(
          group,
          GroupStatus.FAILED,
          token,
          rendered,
          renderFailed,
          List.of(),
          List.of(),
          note);
    }

    EmailMessage message =
        new EmailMessage(
            config.getEmailAuthor(),
            List.of(group.recipientEmail()),
            merged.value().subject(),
            merged.value().body(),
            attachments,
            merged.value().html());
    LOG.debug(
        "Sending email for group {} to {} with {} attachments",
        group.groupKey(),
        group.recipientEmail(),
        attachments.size());

    StepResult<Void> sent = StepResult.attemptRun(ErrorKind.SEND, () -> transport.send(message));
    if (sent.isFailure()) {
      LOG.error("sendEmail failed for group {}: {}", group.groupKey(), sent.error(), sent.cause());
      release(token, sent.error());
      return new GroupNotificationResult(
          group,
          GroupStatus.SEND_FAILED,
          token,
          rendered,
          renderFailed,
          List.of(),
          List.of(),
          "Send failed: " + sent.error());
    }

    StepResult<Void> recorded =
        StepResult.attemptRun(ErrorKind.PERSISTENCE, () -> dispatchLedger.markSent(token));
    if (recorded.isFailure()) {
      LOG.error(
          "RECONCILE: email for group {} sent but dispatch token {} not marked sent: {}",
          group.groupKey(),
          token,
          recorded.error());
    }

    List<String> flagged = new ArrayList<>();
    List<String> flagFailed = new ArrayList<>();
    for (String orderId : group.orderIds()) {
      StepResult<Void> flag =
          StepResult.attemptRun(ErrorKind.PERSISTENCE, () -> markNotified(orderId));
      if (flag.isSuccess()) {
        flagged.add(orderId);
      } else {
        LOG.error(
            "RECONCILE: email for group {} sent but notified flag not saved on payment {}: {}",
            group.groupKey(),
            orderId,
            flag.error());
        flagFailed.add(orderId);
      }
    }

    LOG.info(
        "Notified group {}: {} vouchers attached, {} render failures, {} payments flagged",
        group.groupKey(),
        rendered.size(),
        renderFailed.size(),
        flagged.size());
    return new GroupNotificationResult(
        group, GroupStatus.NOTIFIED, token, rendered, renderFailed, flagged, flagFailed, null);
  }

  /** Renders every voucher of the group and waits for all attempts before returning. */
  private void renderVouchers(
      PaymentGroup group,
      List<VoucherFile> attachments,
      List<String> rendered,
      List<String> renderFailed) {
    List<CompletableFuture<StepResult<VoucherFile>>> futures = new ArrayList<>();
    for (String orderId : group.orderIds()) {
      futures.add(CompletableFuture.supplyAsync(() -> renderVoucher(orderId), renderExecutor));
    }

    for (int i = 0; i < futures.size(); i++) {
      String orderId = group.orderIds().get(i);
      StepResult<VoucherFile> result = futures.get(i).join();
      if (result.isSuccess()) {
        attachments.add(result.value());
        rendered.add(orderId);
      } else {
        LOG.error(
            "Error generating PDF for transaction {}: {}", orderId, result.error(), result.cause());
        renderFailed.add(orderId);
      }
    }
  }

  private StepResult<VoucherFile> renderVoucher(String orderId) {
    return StepResult.attempt(
        ErrorKind.RENDER,
        () -> {
          PaymentRecord payment = recordStore.load(RecordType.VENDOR_PAYMENT, orderId);
          byte[] pdf = renderer.renderVoucher(config.getPrintTemplateId(), payment);
          return fileStore.createFile(VoucherFile.nameFor(orderId), pdf, config.getVoucherFolder());
        });
  }

  private void release(String token, String error) {
    StepResult<Void> released =
        StepResult.attemptRun(
            ErrorKind.PERSISTENCE, () -> dispatchLedger.markFailed(token, error));
    if (released.isFailure()) {
      LOG.error("Could not release dispatch token {}: {}", token, released.error());
    }
  }

  private void markNotified(String orderId) {
    PaymentRecord payment = recordStore.load(RecordType.VENDOR_PAYMENT, orderId);
    payment.setValue(PaymentRecord.FIELD_EMAIL_SENT, Boolean.TRUE);
    recordStore.save(payment);
  }
}
