package io.github.hotbrkm.outreach.dispatcher.source;

import io.github.hotbrkm.outreach.dispatcher.domain.Recipient;

import java.util.List;

/**
 * Supplies the recipient pool for one cycle, in priority order.
 */
public interface RecipientSource {

    /**
     * @return valid recipients, unique by key
     */
    List<Recipient> loadRecipients();
}
