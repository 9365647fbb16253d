package uk.gegc.vidstream.features.subscription.integration;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import uk.gegc.vidstream.features.auth.domain.repository.PasswordResetTokenRepository;
import uk.gegc.vidstream.features.subscription.application.PaymentGateway;
import uk.gegc.vidstream.features.subscription.application.PaymentGateway.ProviderCharge;
import uk.gegc.vidstream.features.subscription.application.PaymentGateway.ProviderVerification;
import uk.gegc.vidstream.features.subscription.domain.exception.PaymentVerificationUnavailableException;
import uk.gegc.vidstream.features.subscription.domain.model.PaymentTransactionStatus;
import uk.gegc.vidstream.features.subscription.domain.model.SubscriptionPlan;
import uk.gegc.vidstream.features.subscription.domain.repository.PaymentTransactionRepository;
import uk.gegc.vidstream.features.subscription.domain.repository.SubscriptionPlanRepository;
import uk.gegc.vidstream.features.user.domain.model.User;
import uk.gegc.vidstream.features.user.domain.repository.UserRepository;
import uk.gegc.vidstream.features.video.domain.model.Video;
import uk.gegc.vidstream.features.video.domain.repository.VideoRepository;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.HexFormat;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.hamcrest.Matchers.endsWith;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Register, get refused, pay, verify and watch, end to end over HTTP with the provider mocked.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@DisplayName("Subscription flow")
class SubscriptionFlowIntegrationTest {

    private static final String WEBHOOK_SECRET = "test-webhook-secret";

    @Autowired
    private MockMvc mockMvc;
    @Autowired
    private ObjectMapper objectMapper;
    @Autowired
    private UserRepository userRepository;
    @Autowired
    private SubscriptionPlanRepository planRepository;
    @Autowired
    private PaymentTransactionRepository paymentTransactionRepository;
    @Autowired
    private PasswordResetTokenRepository passwordResetTokenRepository;
    @Autowired
    private VideoRepository videoRepository;

    @MockitoBean
    private PaymentGateway paymentGateway;

    private SubscriptionPlan plan;
    private Video video;

    @BeforeEach
    void setUp() {
        paymentTransactionRepository.deleteAll();
        passwordResetTokenRepository.deleteAll();
        videoRepository.deleteAll();
        planRepository.deleteAll();
        userRepository.deleteAll();

        plan = new SubscriptionPlan();
        plan.setName("Monthly");
        plan.setDescription("Unlimited streaming for 30 days");
        plan.setPrice(new BigDecimal("5000.00"));
        plan.setCurrency("MWK");
        plan.setDurationDays(30);
        plan = planRepository.save(plan);

        video = new Video();
        video.setTitle("Lake Malawi at dawn");
        video.setVideoUrl("https://cdn.example/videos/lake.m3u8");
        video.setVideoHostId("vh-100");
        video = videoRepository.save(video);

        when(paymentGateway.initiateCharge(any())).thenAnswer(inv -> new ProviderCharge(
                inv.<PaymentGateway.ChargeRequest>getArgument(0).reference(), "https://checkout.example/pay", "pending"));
    }

    private String register(String username) throws Exception {
        String body = """
                {"username":"%s","email":"%s@example.com","password":"s3cretPass!","first_name":"Test","last_name":"User","phone_number":"0991234567"}
                """.formatted(username, username);
        MvcResult result = mockMvc.perform(post("/api/v1/auth/register")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isCreated())
                .andReturn();
        return objectMapper.readTree(result.getResponse().getContentAsString()).get("access_token").asText();
    }

    private String initiate(String token) throws Exception {
        MvcResult result = mockMvc.perform(post("/api/v1/subscriptions/payments")
                        .header("Authorization", "Bearer " + token)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"plan_id":"%s","phone_number":"0991234567","network":"airtel"}
                                """.formatted(plan.getId())))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.payment_url").value("https://checkout.example/pay"))
                .andReturn();
        JsonNode response = objectMapper.readTree(result.getResponse().getContentAsString());
        assertThat(response.get("verification_url").asText()).endsWith("/verify");
        return response.get("transaction_reference").asText();
    }

    private void providerConfirms(String reference) {
        when(paymentGateway.verifyCharge(reference))
                .thenReturn(new ProviderVerification(reference, "successful", new BigDecimal("5000.00"), "MWK"));
    }

    private static String sign(String payload) throws Exception {
        Mac mac = Mac.getInstance("HmacSHA256");
        mac.init(new SecretKeySpec(WEBHOOK_SECRET.getBytes(StandardCharsets.UTF_8), "HmacSHA256"));
        return HexFormat.of().formatHex(mac.doFinal(payload.getBytes(StandardCharsets.UTF_8)));
    }

    private User reload(String username) {
        return userRepository.findByUsername(username).orElseThrow();
    }

    @Test
    @DisplayName("a paid subscription unlocks playback")
    void payThenWatch() throws Exception {
        String token = register("viewer");

        mockMvc.perform(get("/api/v1/videos"))
                .andExpect(status().isUnauthorized());
        mockMvc.perform(get("/api/v1/videos").header("Authorization", "Bearer " + token))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.content[0].title").value("Lake Malawi at dawn"))
                .andExpect(jsonPath("$.content[0].video_url").doesNotExist());

        mockMvc.perform(get("/api/v1/videos/{id}", video.getId()).header("Authorization", "Bearer " + token))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.type").value(endsWith("/subscription-required")));

        String reference = initiate(token);
        providerConfirms(reference);

        mockMvc.perform(post("/api/v1/subscriptions/payments/{ref}/verify", reference)
                        .header("Authorization", "Bearer " + token))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.is_active").value(true))
                .andExpect(jsonPath("$.state").value("ACTIVE"))
                .andExpect(jsonPath("$.current_plan.name").value("Monthly"));

        LocalDateTime expected = LocalDateTime.now(ZoneOffset.UTC).plusDays(30);
        assertThat(reload("viewer").getSubscriptionExpiry()).isCloseTo(expected, within(1, ChronoUnit.MINUTES));

        mockMvc.perform(get("/api/v1/videos/{id}", video.getId()).header("Authorization", "Bearer " + token))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.video_url").value("https://cdn.example/videos/lake.m3u8"));
    }

    @Test
    @DisplayName("repeating verification and replaying the webhook extend only once")
    void activationIsIdempotent() throws Exception {
        String token = register("replayer");
        String reference = initiate(token);
        providerConfirms(reference);

        mockMvc.perform(get("/api/v1/subscriptions/payments/{ref}/verify", reference)
                        .header("Authorization", "Bearer " + token))
                .andExpect(status().isOk());
        LocalDateTime expiry = reload("replayer").getSubscriptionExpiry();

        mockMvc.perform(get("/api/v1/subscriptions/payments/{ref}/verify", reference)
                        .header("Authorization", "Bearer " + token))
                .andExpect(status().isOk());

        String payload = "{\"tx_ref\":\"" + reference + "\",\"status\":\"successful\"}";
        for (int i = 0; i < 2; i++) {
            mockMvc.perform(post("/api/v1/subscriptions/webhook")
                            .header("Signature", sign(payload))
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(payload))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.status").value("success"));
        }

        assertThat(reload("replayer").getSubscriptionExpiry()).isEqualTo(expiry);
        verify(paymentGateway, times(1)).verifyCharge(reference);
    }

    @Test
    @DisplayName("the webhook alone activates a pending payment")
    void webhookActivates() throws Exception {
        String token = register("hooked");
        String reference = initiate(token);
        providerConfirms(reference);
        String payload = "{\"event_type\":\"api.charge.payment\",\"data\":{\"tx_ref\":\"" + reference + "\",\"status\":\"success\"}}";

        mockMvc.perform(post("/api/v1/subscriptions/webhook")
                        .header("Signature", sign(payload))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(payload))
                .andExpect(status().isOk());

        assertThat(reload("hooked").isSubscribed()).isTrue();
        assertThat(paymentTransactionRepository.findById(reference).orElseThrow().getStatus())
                .isEqualTo(PaymentTransactionStatus.COMPLETED);
    }

    @Test
    @DisplayName("a forged webhook is rejected")
    void forgedWebhook() throws Exception {
        String payload = "{\"tx_ref\":\"sub-anything\",\"status\":\"successful\"}";

        mockMvc.perform(post("/api/v1/subscriptions/webhook")
                        .header("Signature", sign(payload + " "))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(payload))
                .andExpect(status().isUnauthorized());
        verifyNoInteractions(paymentGateway);
    }

    @Test
    @DisplayName("an unconfirmed payment is 402 and grants nothing")
    void pendingPayment() throws Exception {
        String token = register("waiting");
        String reference = initiate(token);
        when(paymentGateway.verifyCharge(reference))
                .thenReturn(new ProviderVerification(reference, "pending", null, "MWK"));

        mockMvc.perform(post("/api/v1/subscriptions/payments/{ref}/verify", reference)
                        .header("Authorization", "Bearer " + token))
                .andExpect(status().isPaymentRequired());

        assertThat(reload("waiting").isSubscribed()).isFalse();
    }

    @Test
    @DisplayName("a provider outage is 502 and grants nothing")
    void providerOutage() throws Exception {
        String token = register("outage");
        String reference = initiate(token);
        when(paymentGateway.verifyCharge(reference)).thenThrow(new PaymentVerificationUnavailableException("timeout"));

        mockMvc.perform(post("/api/v1/subscriptions/payments/{ref}/verify", reference)
                        .header("Authorization", "Bearer " + token))
                .andExpect(status().isBadGateway());

        assertThat(reload("outage").isSubscribed()).isFalse();
    }

    @Test
    @DisplayName("someone else's reference is 400")
    void foreignReference() throws Exception {
        String ownerToken = register("owner");
        String reference = initiate(ownerToken);
        String otherToken = register("intruder");

        mockMvc.perform(post("/api/v1/subscriptions/payments/{ref}/verify", reference)
                        .header("Authorization", "Bearer " + otherToken))
                .andExpect(status().isBadRequest());
        verify(paymentGateway, never()).verifyCharge(anyString());
    }

    @Test
    @DisplayName("an expired subscription is refused again")
    void lapsedSubscription() throws Exception {
        String token = register("lapsed");
        User user = reload("lapsed");
        user.setSubscribed(true);
        user.setSubscriptionExpiry(LocalDateTime.now(ZoneOffset.UTC).minusMinutes(1));
        userRepository.save(user);

        mockMvc.perform(get("/api/v1/videos/{id}", video.getId()).header("Authorization", "Bearer " + token))
                .andExpect(status().isForbidden());
        mockMvc.perform(get("/api/v1/subscriptions/status").header("Authorization", "Bearer " + token))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.is_subscribed").value(true))
                .andExpect(jsonPath("$.is_active").value(false))
                .andExpect(jsonPath("$.state").value("LAPSED"));
    }

    @Test
    @DisplayName("plans are public but only admins manage them")
    void planAdministration() throws Exception {
        mockMvc.perform(get("/api/v1/subscriptions/plans"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].name").value("Monthly"));

        String createPlan = """
                {"name":"Weekly","price":1500.00,"currency":"MWK","duration_days":7}
                """;
        String userToken = register("regular");
        mockMvc.perform(post("/api/v1/subscriptions/plans")
                        .header("Authorization", "Bearer " + userToken)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(createPlan))
                .andExpect(status().isForbidden());

        String adminToken = register("boss");
        User admin = reload("boss");
        admin.setAdmin(true);
        userRepository.save(admin);
        mockMvc.perform(post("/api/v1/subscriptions/plans")
                        .header("Authorization", "Bearer " + adminToken)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(createPlan))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.name").value("Weekly"))
                .andExpect(jsonPath("$.duration_days").value(7));
    }
}
