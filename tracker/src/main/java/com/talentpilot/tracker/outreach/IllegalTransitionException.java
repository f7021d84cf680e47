package com.talentpilot.tracker.outreach;

import com.talentpilot.tracker.model.OutreachEvent;
import com.talentpilot.tracker.model.OutreachState;

/**
 * Thrown when a requested outreach move is not in the transition table.
 *
 * Carries the current state and either the attempted event or, when the
 * caller asked for a target state with no event leading to it, that target.
 */
public class IllegalTransitionException extends RuntimeException {

    private final OutreachState current;
    private final OutreachEvent event;
    private final OutreachState target;

    public IllegalTransitionException(OutreachState current, OutreachEvent event) {
        super("Event '" + event.wireName() + "' is not allowed from state '" + current.wireName() + "'");
        this.current = current;
        this.event   = event;
        this.target  = null;
    }

    public IllegalTransitionException(OutreachState current, OutreachState target) {
        super("No transition from '" + current.wireName() + "' to '" + target.wireName() + "'");
        this.current = current;
        this.event   = null;
        this.target  = target;
    }

    public OutreachState getCurrent() { return current; }
    public OutreachEvent getEvent()   { return event; }
    public OutreachState getTarget()  { return target; }
}
