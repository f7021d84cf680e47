package com.talentpilot.tracker.pipeline;

import com.talentpilot.tracker.model.PipelineStage;

/**
 * Thrown when a funnel move goes backwards or leaves a terminal stage.
 */
public class IllegalStageTransitionException extends RuntimeException {

    private final PipelineStage from;
    private final PipelineStage to;

    public IllegalStageTransitionException(PipelineStage from, PipelineStage to) {
        super("Cannot move application from '" + from.wireName() + "' to '" + to.wireName() + "'");
        this.from = from;
        this.to   = to;
    }

    public PipelineStage getFrom() { return from; }
    public PipelineStage getTo()   { return to; }
}
