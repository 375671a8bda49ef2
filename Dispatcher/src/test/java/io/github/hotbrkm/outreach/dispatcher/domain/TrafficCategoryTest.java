package io.github.hotbrkm.outreach.dispatcher.domain;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("TrafficCategory test")
class TrafficCategoryTest {

    @DisplayName("First-touch and follow-up share the outreach bucket")
    @Test
    void outreachCategoriesShouldShareBucket() {
        assertThat(TrafficCategory.FIRST_TOUCH.bucket()).isEqualTo(QuotaBucket.OUTREACH);
        assertThat(TrafficCategory.FOLLOW_UP.bucket()).isEqualTo(QuotaBucket.OUTREACH);
        assertThat(TrafficCategory.FILLER.bucket()).isEqualTo(QuotaBucket.FILLER);
        assertThat(TrafficCategory.FILLER.isOutreach()).isFalse();
    }

    @DisplayName("fromCode reads current codes and legacy send-log labels")
    @Test
    void fromCodeShouldAcceptLegacyLabels() {
        assertThat(TrafficCategory.fromCode("first_touch")).isEqualTo(TrafficCategory.FIRST_TOUCH);
        assertThat(TrafficCategory.fromCode("cold")).isEqualTo(TrafficCategory.FIRST_TOUCH);
        assertThat(TrafficCategory.fromCode(" FollowUp ")).isEqualTo(TrafficCategory.FOLLOW_UP);
        assertThat(TrafficCategory.fromCode("warmup")).isEqualTo(TrafficCategory.FILLER);
    }

    @DisplayName("fromCode rejects unknown codes")
    @Test
    void fromCodeShouldRejectUnknown() {
        assertThatThrownBy(() -> TrafficCategory.fromCode("newsletter"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("newsletter");
    }
}
