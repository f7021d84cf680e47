package com.talentpilot.tracker.pipeline;

import com.talentpilot.tracker.model.PipelineStage;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.talentpilot.tracker.model.PipelineStage.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StageModelTest {

    private final StageModel model = new StageModel();

    @Test
    void funnelOrder_excludesRejected() {
        assertThat(model.stagesInFunnelOrder())
                .containsExactly(SOURCING, SHORTLIST, TERNA, INTERVIEW, OFFER, HIRED);
        assertThat(model.orderOf(REJECTED)).isGreaterThan(model.orderOf(HIRED));
    }

    @Test
    void isCompleted_strictlyBefore() {
        assertThat(model.isCompleted(SHORTLIST, INTERVIEW)).isTrue();
        assertThat(model.isCompleted(INTERVIEW, INTERVIEW)).isFalse();
        assertThat(model.isCompleted(OFFER, INTERVIEW)).isFalse();
    }

    @Test
    void isTerminal_onlyHiredAndRejected() {
        for (PipelineStage s : PipelineStage.values()) {
            assertThat(model.isTerminal(s)).isEqualTo(s == HIRED || s == REJECTED);
        }
    }

    @Test
    void canMove_forwardSkipAllowed_backwardRejected() {
        assertThat(model.canMove(SOURCING, TERNA)).isTrue();
        assertThat(model.canMove(INTERVIEW, SHORTLIST)).isFalse();
        assertThat(model.canMove(INTERVIEW, INTERVIEW)).isFalse();
    }

    @Test
    void canMove_rejectedFromAnyNonTerminal_neverOutOfTerminal() {
        assertThat(model.canMove(OFFER, REJECTED)).isTrue();
        assertThat(model.canMove(null, SOURCING)).isTrue();
        assertThat(model.canMove(HIRED, REJECTED)).isFalse();
        assertThat(model.canMove(REJECTED, OFFER)).isFalse();
    }

    @Test
    void nullStage_failsLoudly() {
        assertThatThrownBy(() -> model.orderOf(null)).isInstanceOf(NullPointerException.class);
    }

    @Test
    void timeline_marksCompletedAndActive() {
        List<StageModel.TimelineEntry> t = model.timeline(INTERVIEW, false);

        assertThat(t).hasSize(6);
        assertThat(t).filteredOn(StageModel.TimelineEntry::completed)
                .extracting(StageModel.TimelineEntry::stage)
                .containsExactly(SOURCING, SHORTLIST, TERNA);
        assertThat(t).filteredOn(StageModel.TimelineEntry::active)
                .extracting(StageModel.TimelineEntry::stage)
                .containsExactly(INTERVIEW);
    }

    @Test
    void timeline_rejectedHasNoActiveStage() {
        assertThat(model.timeline(TERNA, true)).noneMatch(StageModel.TimelineEntry::active);
    }

    @Test
    void timeline_hiredIsCompleted() {
        assertThat(model.timeline(HIRED, false)).allMatch(StageModel.TimelineEntry::completed);
    }
}
