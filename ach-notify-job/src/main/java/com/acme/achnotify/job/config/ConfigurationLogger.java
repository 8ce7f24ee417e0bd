package com.acme.achnotify.job.config;

import com.acme.achnotify.config.AchNotifyConfig;
import io.micronaut.context.annotation.Property;
import io.micronaut.context.annotation.Requires;
import io.micronaut.context.event.ApplicationEventListener;
import io.micronaut.context.event.StartupEvent;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs effective configuration when the context starts, before the run begins.
 * Disabled in test environment.
 */
@Singleton
@Requires(notEnv = "test")
public class ConfigurationLogger implements ApplicationEventListener<StartupEvent> {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigurationLogger.class);

    private final AchNotifyConfig config;
    private final MailConfig mailConfig;

    @Property(name = "datasources.default.url")
    private String datasourceUrl;

    @Property(name = "datasources.default.username")
    private String datasourceUsername;

    @Property(name = "datasources.default.maximum-pool-size")
    private int maxPoolSize;

    @Property(name = "db.dialect")
    private String dialect;

    public ConfigurationLogger(AchNotifyConfig config, MailConfig mailConfig) {
        this.config = config;
        this.mailConfig = mailConfig;
    }

    @Override
    public void onApplicationEvent(StartupEvent event) {
        LOG.info("═══════════════════════════════════════════════════════════════════════════════");
        LOG.info("                         EFFECTIVE CONFIGURATION                                ");
        LOG.info("═══════════════════════════════════════════════════════════════════════════════");
        LOG.info("");

        LOG.info("━━━ Run Parameters ━━━");
        LOG.info("  Search ID:          {} (Saved search listing eligible ACH payments)", config.getEligiblePaymentsSearchId());
        LOG.info("  Print Template:     {} (Template used to render each voucher)", config.getPrintTemplateId());
        LOG.info("  Email Author:       {} (Sender and merge author of vendor emails)", config.getEmailAuthor());
        LOG.info("  Report Recipient:   {} (Receives the operational report)", config.getReportRecipient());
        LOG.info("  Voucher Folder:     {} (File store folder for rendered vouchers)", config.getVoucherFolder());
        LOG.info("  Run ID:             {} (Blank = generated per run)", config.getRunId() == null ? "<generated>" : config.getRunId());
        LOG.info("  Render Failures:    {} (SEND_PARTIAL or DEFER_GROUP)", config.getRenderFailurePolicy());
        LOG.info("");

        LOG.info("━━━ Concurrency ━━━");
        LOG.info("  Page Size:          {} (Search rows read per page)", config.getPageSize());
        LOG.info("  Normalizer Threads: {} (Pool normalizing search pages)", config.getNormalizerParallelism());
        LOG.info("  Generator Threads:  {} (Pool notifying payment groups)", config.getGeneratorParallelism());
        LOG.info("  Render Threads:     {} (Pool rendering vouchers of one group)", config.getRenderParallelism());
        LOG.info("");

        LOG.info("━━━ Database Configuration ━━━");
        LOG.info("  Dialect:            {} (Selects the dispatch ledger SQL)", dialect);
        LOG.info("  JDBC URL:           {}", datasourceUrl);
        LOG.info("  Username:           {}", datasourceUsername);
        LOG.info("  Max Pool Size:      {} (HikariCP maximum connections)", maxPoolSize);
        LOG.info("");

        LOG.info("━━━ Mail Configuration ━━━");
        LOG.info("  SMTP Host:          {}:{}", mailConfig.getHost(), mailConfig.getPort());
        LOG.info("  STARTTLS:           {}", mailConfig.isStartTls() ? "ENABLED" : "DISABLED");
        LOG.info("  Authentication:     {}", mailConfig.hasCredentials() ? "ENABLED" : "DISABLED");
        LOG.info("  Default From:       {}", mailConfig.getDefaultFrom());
        LOG.info("═══════════════════════════════════════════════════════════════════════════════");
        LOG.info("");
    }
}
