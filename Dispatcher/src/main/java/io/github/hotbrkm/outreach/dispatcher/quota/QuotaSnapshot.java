package io.github.hotbrkm.outreach.dispatcher.quota;

import java.time.LocalDate;

public record QuotaSnapshot(LocalDate date, QuotaState outreach, QuotaState filler) {

    public boolean allExhausted() {
        return outreach.isExhausted() && filler.isExhausted();
    }
}
