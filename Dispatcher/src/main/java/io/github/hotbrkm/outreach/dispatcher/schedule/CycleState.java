package io.github.hotbrkm.outreach.dispatcher.schedule;

public enum CycleState {
    INIT,
    FILLER_BURST,
    INTERLEAVE,
    DONE
}
