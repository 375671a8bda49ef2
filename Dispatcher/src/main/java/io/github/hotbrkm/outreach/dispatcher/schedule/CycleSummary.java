package io.github.hotbrkm.outreach.dispatcher.schedule;

import io.github.hotbrkm.outreach.dispatcher.domain.TrafficCategory;
import io.github.hotbrkm.outreach.dispatcher.quota.QuotaSnapshot;
import io.github.hotbrkm.outreach.dispatcher.send.SendOutcome;
import lombok.Builder;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;

/**
 * Result of one cycle: what was sent, what failed, and how much quota is left.
 *
 * @param outcomes every send of the cycle, in send order
 */
@Builder
public record CycleSummary(String cycleId,
                           OffsetDateTime startedAt,
                           OffsetDateTime finishedAt,
                           CycleState finalState,
                           CycleEndReason endReason,
                           QuotaSnapshot quotaBefore,
                           QuotaSnapshot quotaAfter,
                           Map<TrafficCategory, Integer> sent,
                           Map<TrafficCategory, Integer> failed,
                           List<SendOutcome> outcomes,
                           int remainingFresh,
                           int remainingFollowUps) {

    public CycleSummary {
        sent = sent == null ? Map.of() : Map.copyOf(sent);
        failed = failed == null ? Map.of() : Map.copyOf(failed);
        outcomes = outcomes == null ? List.of() : List.copyOf(outcomes);
    }

    public int sent(TrafficCategory category) {
        return sent.getOrDefault(category, 0);
    }

    public int failed(TrafficCategory category) {
        return failed.getOrDefault(category, 0);
    }

    public int totalSent() {
        return sent.values().stream().mapToInt(Integer::intValue).sum();
    }

    public int totalFailed() {
        return failed.values().stream().mapToInt(Integer::intValue).sum();
    }
}
