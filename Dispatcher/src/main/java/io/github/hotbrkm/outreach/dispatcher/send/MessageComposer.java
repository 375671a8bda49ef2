package io.github.hotbrkm.outreach.dispatcher.send;

import io.github.hotbrkm.outreach.dispatcher.domain.Recipient;
import io.github.hotbrkm.outreach.dispatcher.domain.TrafficCategory;

/**
 * Builds the message for one send. A runtime exception is treated as a failure of that send only.
 */
public interface MessageComposer {

    /**
     * @param sequence follow-up number, null for first-touch and filler sends
     */
    ComposedMessage compose(Recipient recipient, TrafficCategory category, Integer sequence);
}
