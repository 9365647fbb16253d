package uk.gegc.vidstream.features.subscription.application;

import lombok.Builder;
import lombok.Data;
import org.slf4j.Logger;
import org.slf4j.MDC;

import java.util.UUID;

/**
 * Structured logging context for payment webhook processing. Every MDC key set here is rendered
 * by {@code logging.pattern.level}.
 */
@Data
@Builder
public class PaymentLoggingContext {
    public static final String MDC_REFERENCE = "payment_reference";
    public static final String MDC_EVENT_STATUS = "payment_event_status";
    public static final String MDC_USER_ID = "user_id";

    private String reference;
    private String eventStatus;
    private UUID userId;

    public void setMDC() {
        if (reference != null) MDC.put(MDC_REFERENCE, reference);
        if (eventStatus != null) MDC.put(MDC_EVENT_STATUS, eventStatus);
        if (userId != null) MDC.put(MDC_USER_ID, userId.toString());
    }

    public static void clearMDC() {
        MDC.remove(MDC_REFERENCE);
        MDC.remove(MDC_EVENT_STATUS);
        MDC.remove(MDC_USER_ID);
    }

    public void logInfo(Logger logger, String message, Object... args) {
        setMDC();
        try {
            logger.info(message, args);
        } finally {
            clearMDC();
        }
    }

    public void logWarn(Logger logger, String message, Object... args) {
        setMDC();
        try {
            logger.warn(message, args);
        } finally {
            clearMDC();
        }
    }

    public void logError(Logger logger, String message, Object... args) {
        setMDC();
        try {
            logger.error(message, args);
        } finally {
            clearMDC();
        }
    }
}
