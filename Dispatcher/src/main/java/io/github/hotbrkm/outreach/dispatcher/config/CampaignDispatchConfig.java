package io.github.hotbrkm.outreach.dispatcher.config;

import io.github.hotbrkm.outreach.dispatcher.ledger.CsvFileLedger;
import io.github.hotbrkm.outreach.dispatcher.ledger.Ledger;
import io.github.hotbrkm.outreach.dispatcher.schedule.CampaignDispatcher;
import io.github.hotbrkm.outreach.dispatcher.send.DispatchMetricsRecorder;
import io.github.hotbrkm.outreach.dispatcher.send.JakartaMailTransport;
import io.github.hotbrkm.outreach.dispatcher.send.MailTransport;
import io.github.hotbrkm.outreach.dispatcher.send.MessageComposer;
import io.github.hotbrkm.outreach.dispatcher.send.Pacer;
import io.github.hotbrkm.outreach.dispatcher.send.PacingExecutorFactory;
import io.github.hotbrkm.outreach.dispatcher.send.RandomPacer;
import io.github.hotbrkm.outreach.dispatcher.send.TemplateMessageComposer;
import io.github.hotbrkm.outreach.dispatcher.source.ConfiguredFillerTrafficSource;
import io.github.hotbrkm.outreach.dispatcher.source.FillerTrafficSource;
import io.github.hotbrkm.outreach.dispatcher.source.RecipientSource;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;
import java.util.Random;

/**
 * Wires the dispatch engine. The host application supplies the {@link RecipientSource} bean.
 */
@Configuration
@EnableConfigurationProperties(CampaignProperties.class)
public class CampaignDispatchConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public DispatchOptions dispatchOptions(CampaignProperties campaignProperties) {
        return DispatchOptions.fromProperties(campaignProperties);
    }

    @Bean
    public Ledger ledger(CampaignProperties campaignProperties, Clock clock) {
        String path = campaignProperties.getLedger().getPath();
        if (path == null || path.isBlank()) {
            throw new CampaignConfigException("campaign.ledger.path must be set");
        }
        return new CsvFileLedger(Path.of(path), clock.getZone());
    }

    @Bean
    @ConditionalOnMissingBean
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }

    @Bean
    public DispatchMetricsRecorder dispatchMetricsRecorder(MeterRegistry meterRegistry) {
        return new DispatchMetricsRecorder(meterRegistry);
    }

    @Bean
    @ConditionalOnMissingBean
    public Pacer pacer() {
        return new RandomPacer(new Random());
    }

    @Bean
    @ConditionalOnMissingBean
    public MailTransport mailTransport(CampaignProperties campaignProperties) {
        return new JakartaMailTransport(campaignProperties.getSmtp());
    }

    @Bean
    public MessageComposer messageComposer(CampaignProperties campaignProperties) {
        return new TemplateMessageComposer(campaignProperties.getTemplates(), campaignProperties.getFiller(), new Random());
    }

    @Bean
    public FillerTrafficSource fillerTrafficSource(CampaignProperties campaignProperties) {
        return new ConfiguredFillerTrafficSource(campaignProperties.getFiller().getAddresses(), new Random());
    }

    @Bean
    public PacingExecutorFactory pacingExecutorFactory(DispatchOptions dispatchOptions, MessageComposer messageComposer,
                                                       MailTransport mailTransport, Pacer pacer, Ledger ledger, Clock clock,
                                                       DispatchMetricsRecorder dispatchMetricsRecorder) {
        return new PacingExecutorFactory(dispatchOptions, messageComposer, mailTransport, pacer, ledger, clock,
                dispatchMetricsRecorder);
    }

    @Bean
    public CampaignDispatcher campaignDispatcher(CampaignProperties campaignProperties, DispatchOptions dispatchOptions,
                                                 Ledger ledger, RecipientSource recipientSource,
                                                 FillerTrafficSource fillerTrafficSource, MailTransport mailTransport,
                                                 PacingExecutorFactory pacingExecutorFactory, Clock clock) {
        return CampaignDispatcher.builder()
                .options(dispatchOptions)
                .ledger(ledger)
                .recipientSource(recipientSource)
                .fillerSource(fillerTrafficSource)
                .transport(mailTransport)
                .executorFactory(pacingExecutorFactory)
                .clock(clock)
                .verifyBeforeCycle(campaignProperties.getSmtp().isVerifyBeforeCycle())
                .build();
    }
}
