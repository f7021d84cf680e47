package com.talentpilot.tracker.bulk;

import java.util.Locale;

/**
 * Operations the orchestrator runs over a set of candidates. The label is
 * the action name operators see in the batch summary.
 */
public enum BulkOperation {
    CONTACT("Contactar"),
    RESEND("Reenviar"),
    UPDATE_STATUS("Cambiar estado"),
    FORCE_STATUS("Forzar estado"),
    ADD_NOTE("Agregar nota");

    private final String label;

    BulkOperation(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public String metricTag() {
        return name().toLowerCase(Locale.ROOT);
    }
}
