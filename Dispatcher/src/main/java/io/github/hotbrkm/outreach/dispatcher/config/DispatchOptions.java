package io.github.hotbrkm.outreach.dispatcher.config;

import io.github.hotbrkm.outreach.dispatcher.domain.EmailAddressUtil;
import io.github.hotbrkm.outreach.dispatcher.domain.QuotaBucket;
import io.github.hotbrkm.outreach.dispatcher.domain.TrafficCategory;
import io.github.hotbrkm.outreach.dispatcher.eligibility.FollowUpPolicy;
import io.github.hotbrkm.outreach.dispatcher.send.DelayRange;
import io.github.hotbrkm.outreach.dispatcher.send.RetryPolicy;
import lombok.Builder;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Validated, immutable runtime options of the dispatch engine.
 */
@Builder(toBuilder = true)
public record DispatchOptions(String fromAddress,
                              int firstTouchDailyCap,
                              int fillerDailyCap,
                              RetryPolicy retryPolicy,
                              DelayRange fillerDelay,
                              DelayRange outreachDelay,
                              FollowUpPolicy followUpPolicy,
                              int subBatchSize,
                              int initialBurstSize) {

    public DispatchOptions {
        require(fromAddress != null && EmailAddressUtil.isValid(EmailAddressUtil.normalize(fromAddress)),
                "campaign.smtp.from-address must be a valid address but was '" + fromAddress + "'");
        require(firstTouchDailyCap >= 0, "campaign.quota.first-touch-daily-cap must not be negative");
        require(fillerDailyCap >= 0, "campaign.quota.filler-daily-cap must not be negative");
        require(retryPolicy != null, "retry policy must not be null");
        require(fillerDelay != null && outreachDelay != null, "pacing delay ranges must not be null");
        require(followUpPolicy != null, "follow-up policy must not be null");
        require(subBatchSize >= 1, "campaign.schedule.sub-batch-size must be at least 1");
        require(initialBurstSize >= 0, "campaign.schedule.initial-burst-size must not be negative");
    }

    /**
     * Normalizes and validates the bound configuration properties.
     *
     * @throws CampaignConfigException if any value is missing or out of range
     */
    public static DispatchOptions fromProperties(CampaignProperties properties) {
        Objects.requireNonNull(properties, "properties must not be null");
        CampaignProperties.Retry retry = properties.getRetry();
        CampaignProperties.Pacing pacing = properties.getPacing();
        CampaignProperties.FollowUp followUp = properties.getFollowUp();

        require(retry.getMaxRetries() >= 1, "campaign.retry.max-retries must be at least 1");
        require(retry.getRetryWait() != null && !retry.getRetryWait().isNegative(),
                "campaign.retry.retry-wait must not be negative");

        return DispatchOptions.builder()
                .fromAddress(properties.getSmtp().getFromAddress())
                .firstTouchDailyCap(properties.getQuota().getFirstTouchDailyCap())
                .fillerDailyCap(properties.getQuota().getFillerDailyCap())
                .retryPolicy(new RetryPolicy(retry.getMaxRetries(), retry.getRetryWait()))
                .fillerDelay(delayRange("filler", pacing.getFillerMinDelay(), pacing.getFillerMaxDelay()))
                .outreachDelay(delayRange("outreach", pacing.getOutreachMinDelay(), pacing.getOutreachMaxDelay()))
                .followUpPolicy(followUpPolicy(followUp))
                .subBatchSize(properties.getSchedule().getSubBatchSize())
                .initialBurstSize(properties.getSchedule().getInitialBurstSize())
                .build();
    }

    public int ceiling(QuotaBucket bucket) {
        return bucket == QuotaBucket.FILLER ? fillerDailyCap : firstTouchDailyCap;
    }

    public DelayRange delayRange(TrafficCategory category) {
        return category == TrafficCategory.FILLER ? fillerDelay : outreachDelay;
    }

    private static DelayRange delayRange(String label, Duration min, Duration max) {
        require(min != null && max != null, "campaign.pacing." + label + " delays must be set");
        require(!min.isNegative(), "campaign.pacing." + label + "-min-delay must not be negative");
        require(min.compareTo(max) <= 0,
                "campaign.pacing." + label + "-min-delay must not exceed " + label + "-max-delay");
        return new DelayRange(min, max);
    }

    private static FollowUpPolicy followUpPolicy(CampaignProperties.FollowUp followUp) {
        int maxFollowups = followUp.getMaxFollowups();
        require(maxFollowups >= 0, "campaign.follow-up.max-followups must not be negative");
        List<Integer> intervals = followUp.getIntervalsDays() == null ? List.of() : followUp.getIntervalsDays();
        require(maxFollowups == 0 || !intervals.isEmpty(),
                "campaign.follow-up.intervals-days must not be empty when follow-ups are enabled");
        for (Integer interval : intervals) {
            require(interval != null && interval >= 0, "campaign.follow-up.intervals-days must hold non-negative values");
        }
        return new FollowUpPolicy(maxFollowups, intervals);
    }

    private static void require(boolean condition, String message) {
        if (!condition) {
            throw new CampaignConfigException(message);
        }
    }
}
