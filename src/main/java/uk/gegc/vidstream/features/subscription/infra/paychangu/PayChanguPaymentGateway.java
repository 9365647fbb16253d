package uk.gegc.vidstream.features.subscription.infra.paychangu;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import uk.gegc.vidstream.features.subscription.application.PayChanguProperties;
import uk.gegc.vidstream.features.subscription.application.PaymentGateway;
import uk.gegc.vidstream.features.subscription.domain.exception.InvalidTransactionReferenceException;
import uk.gegc.vidstream.features.subscription.domain.exception.PaymentVerificationUnavailableException;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * PayChangu mobile-money adapter over the provider's REST API.
 */
@Slf4j
@Component
public class PayChanguPaymentGateway implements PaymentGateway {

    static final String INITIALIZE_PATH = "/mobile-money/payments/initialize";
    static final String VERIFY_PATH = "/mobile-money/payments/{reference}/verify";

    private final RestClient restClient;
    private final PayChanguProperties properties;

    public PayChanguPaymentGateway(@Qualifier("payChanguRestClient") RestClient restClient,
                                   PayChanguProperties properties) {
        this.restClient = restClient;
        this.properties = properties;
    }

    @Override
    public ProviderCharge initiateCharge(ChargeRequest request) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("mobile", request.phoneNumber());
        body.put("mobile_money_operator", request.network());
        body.put("amount", request.amount());
        body.put("currency", request.currency());
        body.put("charge_id", request.reference());
        body.put("email", request.email());
        body.put("first_name", request.firstName());
        body.put("last_name", request.lastName());
        body.put("description", request.description());
        if (properties.getCallbackUrl() != null) {
            body.put("callback_url", properties.getCallbackUrl());
        }

        JsonNode response;
        try {
            response = restClient.post()
                    .uri(INITIALIZE_PATH)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(body)
                    .retrieve()
                    .body(JsonNode.class);
        } catch (ResourceAccessException e) {
            log.error("PayChangu unreachable while initiating charge {}: {}", request.reference(), e.getMessage());
            throw new PaymentVerificationUnavailableException("Payment provider unreachable", e);
        } catch (RestClientResponseException e) {
            log.error("PayChangu rejected charge {} with HTTP {}: {}",
                    request.reference(), e.getStatusCode().value(), e.getResponseBodyAsString());
            throw new PaymentVerificationUnavailableException("Payment provider rejected the charge", e);
        } catch (RestClientException e) {
            log.error("PayChangu call failed while initiating charge {}: {}", request.reference(), e.getMessage());
            throw new PaymentVerificationUnavailableException("Payment provider call failed", e);
        }

        JsonNode data = dataOf(response);
        String paymentUrl = text(data, "payment_url");
        if (paymentUrl == null) {
            paymentUrl = text(data, "checkout_url");
        }
        return new ProviderCharge(request.reference(), paymentUrl, text(data, "status"));
    }

    @Override
    public ProviderVerification verifyCharge(String reference) {
        JsonNode response;
        try {
            response = restClient.get()
                    .uri(VERIFY_PATH, reference)
                    .retrieve()
                    .body(JsonNode.class);
        } catch (ResourceAccessException e) {
            log.error("PayChangu unreachable while verifying {}: {}", reference, e.getMessage());
            throw new PaymentVerificationUnavailableException("Payment provider unreachable", e);
        } catch (RestClientResponseException e) {
            HttpStatus status = HttpStatus.resolve(e.getStatusCode().value());
            if (status == HttpStatus.NOT_FOUND || status == HttpStatus.BAD_REQUEST) {
                log.warn("PayChangu does not recognise reference {} (HTTP {})", reference, e.getStatusCode().value());
                throw new InvalidTransactionReferenceException("Unknown transaction reference");
            }
            log.error("PayChangu verification of {} failed with HTTP {}", reference, e.getStatusCode().value());
            throw new PaymentVerificationUnavailableException("Payment provider verification failed", e);
        } catch (RestClientException e) {
            log.error("PayChangu call failed while verifying {}: {}", reference, e.getMessage());
            throw new PaymentVerificationUnavailableException("Payment provider call failed", e);
        }

        JsonNode data = dataOf(response);
        String amount = text(data, "amount");
        BigDecimal parsedAmount;
        try {
            parsedAmount = amount != null ? new BigDecimal(amount) : null;
        } catch (NumberFormatException e) {
            log.warn("PayChangu returned a non-numeric amount '{}' for {}", amount, reference);
            parsedAmount = null;
        }
        return new ProviderVerification(reference, text(data, "status"), parsedAmount, text(data, "currency"));
    }

    private static JsonNode dataOf(JsonNode response) {
        if (response == null) {
            throw new PaymentVerificationUnavailableException("Empty response from payment provider");
        }
        JsonNode data = response.get("data");
        return data != null && data.isObject() ? data : response;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }
}
