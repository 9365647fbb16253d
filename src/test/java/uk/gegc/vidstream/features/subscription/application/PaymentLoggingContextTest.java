package uk.gegc.vidstream.features.subscription.application;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.support.PropertiesLoaderUtils;

import java.util.Properties;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class PaymentLoggingContextTest {

    @AfterEach
    void tearDown() {
        MDC.clear();
    }

    @Test
    @DisplayName("the log pattern renders every MDC key the context sets")
    void patternRendersAllKeys() throws Exception {
        Properties properties = PropertiesLoaderUtils.loadProperties(new ClassPathResource("application.properties"));
        String pattern = properties.getProperty("logging.pattern.level");

        assertThat(pattern).isNotNull();
        assertThat(pattern)
                .contains("%X{" + PaymentLoggingContext.MDC_REFERENCE + ":-}")
                .contains("%X{" + PaymentLoggingContext.MDC_EVENT_STATUS + ":-}")
                .contains("%X{" + PaymentLoggingContext.MDC_USER_ID + ":-}");
    }

    @Test
    @DisplayName("setMDC publishes the populated fields and clearMDC removes them")
    void setAndClear() {
        UUID userId = UUID.randomUUID();
        PaymentLoggingContext context = PaymentLoggingContext.builder()
                .reference("VS-123")
                .eventStatus("success")
                .userId(userId)
                .build();

        context.setMDC();

        assertThat(MDC.get(PaymentLoggingContext.MDC_REFERENCE)).isEqualTo("VS-123");
        assertThat(MDC.get(PaymentLoggingContext.MDC_EVENT_STATUS)).isEqualTo("success");
        assertThat(MDC.get(PaymentLoggingContext.MDC_USER_ID)).isEqualTo(userId.toString());

        PaymentLoggingContext.clearMDC();

        assertThat(MDC.get(PaymentLoggingContext.MDC_REFERENCE)).isNull();
        assertThat(MDC.get(PaymentLoggingContext.MDC_EVENT_STATUS)).isNull();
        assertThat(MDC.get(PaymentLoggingContext.MDC_USER_ID)).isNull();
    }
}
