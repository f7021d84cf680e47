package com.talentpilot.tracker.bulk;

import org.springframework.stereotype.Component;

/**
 * Renders one batch result as the single summary line operators see,
 * e.g. "Contactar: 2 procesados, 1 fallidos".
 */
@Component
public class NotificationReporter {

    public enum Level { SUCCESS, PARTIAL, FAILURE, EMPTY }

    public record Notification(Level level, String message) {}

    public Notification report(BulkOperation operation, BulkActionResult result) {
        return new Notification(levelOf(result), render(operation, result));
    }

    public Level levelOf(BulkActionResult result) {
        if (result.attempted() == 0) {
            return Level.EMPTY;
        }
        if (result.failed() == 0) {
            return Level.SUCCESS;
        }
        return result.processed() == 0 ? Level.FAILURE : Level.PARTIAL;
    }

    public String render(BulkOperation operation, BulkActionResult result) {
        StringBuilder sb = new StringBuilder(operation.label()).append(": ");
        if (result.attempted() == 0) {
            return sb.append("ningún candidato seleccionado").toString();
        }
        sb.append(result.processed()).append(" procesados");
        if (result.failed() > 0) {
            sb.append(", ").append(result.failed()).append(" fallidos");
        }
        // Sent but not recorded: operators must not simply resend these.
        int unrecorded = result.errorsOfKind(FailureKind.PERSISTENCE_ERROR).size();
        if (unrecorded > 0) {
            sb.append(" (").append(unrecorded).append(" enviados sin registrar estado)");
        }
        return sb.toString();
    }
}
