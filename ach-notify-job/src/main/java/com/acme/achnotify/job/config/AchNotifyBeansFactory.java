package com.acme.achnotify.job.config;

import com.acme.achnotify.config.AchNotifyConfig;
import com.acme.achnotify.pipeline.AchEmailJob;
import com.acme.achnotify.pipeline.OperationalReportComposer;
import com.acme.achnotify.pipeline.PaymentGrouper;
import com.acme.achnotify.pipeline.RecordNormalizer;
import com.acme.achnotify.pipeline.ReportAggregator;
import com.acme.achnotify.pipeline.VoucherNotificationGenerator;
import com.acme.achnotify.spi.DispatchLedger;
import com.acme.achnotify.spi.EmailTemplateLookup;
import com.acme.achnotify.spi.EmailTransport;
import com.acme.achnotify.spi.FileStore;
import com.acme.achnotify.spi.PaymentRecordStore;
import com.acme.achnotify.spi.PaymentSearchService;
import com.acme.achnotify.spi.TemplateMergeService;
import com.acme.achnotify.spi.VoucherRenderer;
import io.micronaut.context.annotation.Bean;
import io.micronaut.context.annotation.ConfigurationProperties;
import io.micronaut.context.annotation.Factory;
import jakarta.inject.Named;
import jakarta.inject.Singleton;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wires the framework-free pipeline into the Micronaut context.
 *
 * <p>The core module knows nothing about dependency injection; every stage is created here from
 * the bound {@link AchNotifyConfig} and the collaborator beans.
 */
@Factory
public class AchNotifyBeansFactory {

  /** Creates AchNotifyConfig bean populated from application.yml ach-notify.* properties */
  @Singleton
  @ConfigurationProperties("ach-notify")
  public AchNotifyConfig achNotifyConfig() {
    return new AchNotifyConfig();
  }

  /** Creates MailConfig bean populated from application.yml mail.* properties */
  @Singleton
  @ConfigurationProperties("mail")
  public MailConfig mailConfig() {
    return new MailConfig();
  }

  @Singleton
  public RecordNormalizer recordNormalizer() {
    return new RecordNormalizer();
  }

  @Singleton
  public PaymentGrouper paymentGrouper() {
    return new PaymentGrouper();
  }

  @Singleton
  public OperationalReportComposer operationalReportComposer() {
    return new OperationalReportComposer();
  }

  /** Pool rendering the vouchers of one group; closed with the context. */
  @Singleton
  @Named("voucher-render")
  @Bean(preDestroy = "shutdown")
  public ExecutorService voucherRenderExecutor(AchNotifyConfig config) {
    AtomicInteger counter = new AtomicInteger();
    ThreadFactory threads =
        runnable -> {
          Thread thread = new Thread(runnable, "voucher-render-" + counter.incrementAndGet());
          thread.setDaemon(true);
          return thread;
        };
    return Executors.newFixedThreadPool(config.getRenderParallelism(), threads);
  }

  @Singleton
  public VoucherNotificationGenerator voucherNotificationGenerator(
      AchNotifyConfig config,
      EmailTemplateLookup templateLookup,
      TemplateMergeService templateMerge,
      VoucherRenderer renderer,
      FileStore fileStore,
      EmailTransport transport,
      PaymentRecordStore recordStore,
      DispatchLedger dispatchLedger,
      @Named("voucher-render") ExecutorService renderExecutor) {
    return new VoucherNotificationGenerator(
        config,
        templateLookup,
        templateMerge,
        renderer,
        fileStore,
        transport,
        recordStore,
        dispatchLedger,
        renderExecutor);
  }

  @Singleton
  public ReportAggregator reportAggregator(
      AchNotifyConfig config, EmailTransport transport, OperationalReportComposer composer) {
    return new ReportAggregator(config, transport, composer);
  }

  /** Creates the job orchestrator with every stage it drives */
  @Singleton
  public AchEmailJob achEmailJob(
      AchNotifyConfig config,
      PaymentSearchService searchService,
      RecordNormalizer normalizer,
      PaymentGrouper grouper,
      VoucherNotificationGenerator generator,
      ReportAggregator aggregator) {
    return new AchEmailJob(config, searchService, normalizer, grouper, generator, aggregator);
  }
}
