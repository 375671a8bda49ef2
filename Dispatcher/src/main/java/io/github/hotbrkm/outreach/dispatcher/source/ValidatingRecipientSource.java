package io.github.hotbrkm.outreach.dispatcher.source;

import io.github.hotbrkm.outreach.dispatcher.domain.Recipient;
import io.github.hotbrkm.outreach.dispatcher.domain.RecipientValidationException;
import io.github.hotbrkm.outreach.dispatcher.domain.RecipientValidator;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Wraps raw records from the host: invalid records are logged and skipped, duplicates keep their first occurrence.
 */
@Slf4j
public class ValidatingRecipientSource implements RecipientSource {

    private final Supplier<? extends Collection<Recipient>> records;

    public ValidatingRecipientSource(Supplier<? extends Collection<Recipient>> records) {
        this.records = Objects.requireNonNull(records, "records must not be null");
    }

    @Override
    public List<Recipient> loadRecipients() {
        Collection<Recipient> raw = records.get();
        if (raw == null || raw.isEmpty()) {
            log.info("Recipient source returned no records");
            return List.of();
        }

        List<Recipient> valid = new ArrayList<>(raw.size());
        Set<String> seen = new LinkedHashSet<>();
        int invalid = 0;
        int duplicates = 0;
        for (Recipient recipient : raw) {
            try {
                RecipientValidator.validate(recipient);
            } catch (RecipientValidationException e) {
                invalid++;
                log.warn("Skipping invalid recipient. key={}, reason={}", e.getRecipientKey(), e.getMessage());
                continue;
            }
            if (!seen.add(recipient.key())) {
                duplicates++;
                log.debug("Skipping duplicate recipient. key={}", recipient.key());
                continue;
            }
            valid.add(recipient);
        }
        log.info("Recipients loaded. total={}, valid={}, invalid={}, duplicates={}",
                raw.size(), valid.size(), invalid, duplicates);
        return List.copyOf(valid);
    }
}
