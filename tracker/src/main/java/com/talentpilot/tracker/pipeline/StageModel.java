package com.talentpilot.tracker.pipeline;

import com.talentpilot.tracker.model.PipelineStage;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Ordering and completion rules for the recruiting funnel.
 *
 * Funnel order is SOURCING(1) … HIRED(6). REJECTED sorts after everything
 * (99) and is rendered outside the funnel. All methods are pure.
 */
@Component
public class StageModel {

    private static final int REJECTED_ORDER = 99;

    private static final Map<PipelineStage, Integer> ORDER = buildOrder();

    private static final List<PipelineStage> FUNNEL = Arrays.stream(PipelineStage.values())
            .filter(s -> s != PipelineStage.REJECTED)
            .sorted((a, b) -> Integer.compare(ORDER.get(a), ORDER.get(b)))
            .toList();

    public int orderOf(PipelineStage stage) {
        return ORDER.get(Objects.requireNonNull(stage, "stage"));
    }

    public boolean isTerminal(PipelineStage stage) {
        Objects.requireNonNull(stage, "stage");
        return stage == PipelineStage.HIRED || stage == PipelineStage.REJECTED;
    }

    /** Funnel stages in display order; REJECTED is not part of it. */
    public List<PipelineStage> stagesInFunnelOrder() {
        return FUNNEL;
    }

    /** True iff {@code stage} comes strictly before {@code relativeTo}. */
    public boolean isCompleted(PipelineStage stage, PipelineStage relativeTo) {
        return orderOf(stage) < orderOf(relativeTo);
    }

    /**
     * Forward-only moves (skipping is allowed), plus REJECTED from any
     * non-terminal stage. Nothing leaves a terminal stage.
     */
    public boolean canMove(PipelineStage from, PipelineStage to) {
        Objects.requireNonNull(to, "to");
        if (from == null) {
            return true;   // first placement
        }
        if (isTerminal(from)) {
            return false;
        }
        if (to == PipelineStage.REJECTED) {
            return true;
        }
        return orderOf(to) > orderOf(from);
    }

    /**
     * One entry per funnel stage, marked completed/active relative to
     * {@code reached} (the furthest funnel stage the application got to).
     */
    public List<TimelineEntry> timeline(PipelineStage reached, boolean rejected) {
        List<TimelineEntry> entries = new ArrayList<>();
        for (PipelineStage s : FUNNEL) {
            boolean completed = isCompleted(s, reached)
                    || (s == reached && s == PipelineStage.HIRED);
            boolean active = !rejected && s == reached && s != PipelineStage.HIRED;
            entries.add(new TimelineEntry(s, orderOf(s), completed, active));
        }
        return Collections.unmodifiableList(entries);
    }

    public record TimelineEntry(PipelineStage stage, int order, boolean completed, boolean active) {}

    private static Map<PipelineStage, Integer> buildOrder() {
        Map<PipelineStage, Integer> m = new EnumMap<>(PipelineStage.class);
        m.put(PipelineStage.SOURCING,  1);
        m.put(PipelineStage.SHORTLIST, 2);
        m.put(PipelineStage.TERNA,     3);
        m.put(PipelineStage.INTERVIEW, 4);
        m.put(PipelineStage.OFFER,     5);
        m.put(PipelineStage.HIRED,     6);
        m.put(PipelineStage.REJECTED,  REJECTED_ORDER);
        return Collections.unmodifiableMap(m);
    }
}
