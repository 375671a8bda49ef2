package io.github.hotbrkm.outreach.dispatcher.source;

import io.github.hotbrkm.outreach.dispatcher.domain.EmailAddressUtil;
import io.github.hotbrkm.outreach.dispatcher.domain.Recipient;
import io.github.hotbrkm.outreach.dispatcher.send.Candidate;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Random;
import java.util.Set;

/**
 * Picks a random address from the configured warm-up pool for every filler send.
 */
@Slf4j
public class ConfiguredFillerTrafficSource implements FillerTrafficSource {

    private final List<String> addresses;
    private final Random random;

    public ConfiguredFillerTrafficSource(List<String> addresses, Random random) {
        this.random = Objects.requireNonNull(random, "random must not be null");
        this.addresses = normalize(addresses);
        if (this.addresses.isEmpty()) {
            log.warn("No valid filler addresses configured; filler traffic is disabled");
        }
    }

    @Override
    public Optional<Candidate> nextFiller() {
        if (addresses.isEmpty()) {
            return Optional.empty();
        }
        String address = addresses.get(random.nextInt(addresses.size()));
        return Optional.of(Candidate.filler(Recipient.ofAddress(address)));
    }

    public List<String> getAddresses() {
        return addresses;
    }

    private static List<String> normalize(List<String> configured) {
        Set<String> unique = new LinkedHashSet<>();
        if (configured != null) {
            for (String address : configured) {
                String normalized = EmailAddressUtil.normalize(address);
                if (EmailAddressUtil.isValid(normalized)) {
                    unique.add(normalized);
                } else if (!normalized.isEmpty()) {
                    log.warn("Ignoring invalid filler address. address={}", address);
                }
            }
        }
        return List.copyOf(new ArrayList<>(unique));
    }
}
