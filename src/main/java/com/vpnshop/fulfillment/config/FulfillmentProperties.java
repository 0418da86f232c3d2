package com.vpnshop.fulfillment.config;

import com.vpnshop.fulfillment.domain.HostType;
import com.vpnshop.fulfillment.domain.ReferralCreditKind;
import io.github.resilience4j.core.IntervalFunction;
import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Typed settings for the fulfillment pipeline ({@code fulfillment.*} in application.yml).
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "fulfillment")
public class FulfillmentProperties {

    @Valid
    private final Orders orders = new Orders();

    @Valid
    private final Provisioning provisioning = new Provisioning();

    @Valid
    private final Sweeps sweeps = new Sweeps();

    @Valid
    private final Referral referral = new Referral();

    private final Notification notification = new Notification();

    private final Providers providers = new Providers();

    @Valid
    private List<Plan> plans = new ArrayList<>();

    @Valid
    private List<Host> hosts = new ArrayList<>();

    public Optional<Plan> findPlan(String planId) {
        return plans.stream().filter(p -> p.getId().equals(planId)).findFirst();
    }

    public Optional<Host> findHost(String hostId) {
        return hosts.stream().filter(h -> h.getId().equals(hostId)).findFirst();
    }

    @Getter
    @Setter
    public static class Orders {
        /** Unpaid orders older than this are expired by the sweep */
        @NotNull private Duration paymentTimeout = Duration.ofHours(1);

        /** Absolute tolerance when comparing paid and expected amounts */
        @NotNull
        @DecimalMin("0")
        private BigDecimal amountTolerance = new BigDecimal("0.01");

        /** Whether paying more than expected (beyond tolerance) still confirms the order */
        private boolean acceptOverpayment = true;
    }

    @Getter
    @Setter
    public static class Provisioning {
        /** Total host calls per order, including the first synchronous one */
        @Min(1)
        private int maxAttempts = 5;

        @NotNull private Duration initialBackoff = Duration.ofSeconds(30);

        @DecimalMin("2.0")
        private double backoffMultiplier = 2.0;

        @NotNull private Duration maxBackoff = Duration.ofMinutes(30);

        /** Lease taken before a host call; a crashed call becomes due again after it */
        @NotNull private Duration callLease = Duration.ofMinutes(5);

        /** How long a caller waits for a free per-host slot before the call counts as unreachable */
        @NotNull private Duration queueWait = Duration.ofSeconds(20);

        /** HTTP timeouts for host panels and the bot API */
        @NotNull private Duration connectTimeout = Duration.ofSeconds(5);

        @NotNull private Duration readTimeout = Duration.ofSeconds(30);

        /** Sequential HTTP requests one issue call may make (3x-ui: login, get inbound, add or update) */
        @Min(1)
        private int requestsPerCall = 3;

        /** Longest a claimed host call can take before its HTTP timeouts fire. */
        public Duration worstCaseCallDuration() {
            return queueWait.plus(connectTimeout.plus(readTimeout).multipliedBy(requestsPerCall));
        }

        @AssertTrue(message = "call-lease must exceed queue-wait + requests-per-call x (connect-timeout + read-timeout)")
        public boolean isCallLeaseCoveringHostCall() {
            if (callLease == null || queueWait == null || connectTimeout == null || readTimeout == null) {
                return true;
            }
            return callLease.compareTo(worstCaseCallDuration()) > 0;
        }
    }

    @Getter
    @Setter
    public static class Sweeps {
        @Min(1)
        private int batchSize = 50;

        /** Unprocessed payment events younger than this are left to the live request */
        @NotNull private Duration redriveGrace = Duration.ofMinutes(2);

        /** Credentials expired longer than this are revoked on the host */
        @NotNull private Duration cleanupGrace = Duration.ofDays(5);

        /** Hours-before-expiry marks at which the buyer is reminded */
        private List<Integer> reminderHours = new ArrayList<>(List.of(72, 48, 24, 1));

        /** Backoff for items a sweep failed on */
        @NotNull private Duration retryInitialBackoff = Duration.ofMinutes(1);

        @NotNull private Duration retryMaxBackoff = Duration.ofHours(6);

        /** Failed sweep attempts after which the item is handed to an operator */
        @Min(1)
        private int maxRetries = 10;

        /** Delay before the next sweep attempt of an item that has failed {@code failures} times. */
        public Duration retryDelay(int failures) {
            IntervalFunction backoff = IntervalFunction.ofExponentialBackoff(retryInitialBackoff.toMillis(), 2.0, retryMaxBackoff.toMillis());
            return Duration.ofMillis(backoff.apply(Math.max(1, failures)));
        }
    }

    @Getter
    @Setter
    public static class Referral {
        private Set<ReferralCreditKind> enabledKinds = EnumSet.of(ReferralCreditKind.PERCENTAGE);

        /** Percent of the order price credited to the referrer */
        @DecimalMin("0")
        private BigDecimal percentage = new BigDecimal("10");

        @DecimalMin("0")
        private BigDecimal fixedPurchaseAmount = new BigDecimal("50");

        @DecimalMin("0")
        private BigDecimal signupBonusAmount = new BigDecimal("20");

        /** Ledger currency for all credits */
        @NotBlank private String currency = "RUB";

        /** Balance required before a payout may be requested; 0 disables the check */
        @DecimalMin("0")
        private BigDecimal minimumWithdrawal = new BigDecimal("100");

        /** Discount for referred buyers applied at order creation; 0 disables it */
        @DecimalMin("0")
        private BigDecimal referredDiscountPercent = BigDecimal.ZERO;
    }

    @Getter
    @Setter
    public static class Notification {
        private boolean enabled = true;
        private String botToken;
        private String apiUrl = "https://api.telegram.org";
    }

    @Getter
    @Setter
    public static class Providers {
        private final YooKassa yookassa = new YooKassa();
        private final CryptoBot cryptobot = new CryptoBot();
        private final Heleket heleket = new Heleket();
        private final TonApi tonapi = new TonApi();
    }

    @Getter
    @Setter
    public static class YooKassa {
        private String webhookSecret;
    }

    @Getter
    @Setter
    public static class CryptoBot {
        private String apiToken;
    }

    @Getter
    @Setter
    public static class Heleket {
        private String apiKey;
    }

    @Getter
    @Setter
    public static class TonApi {
        private String webhookToken;

        /** Wallet that receives TON payments */
        private String walletAddress;

        /** Window for amount-based correlation when the transfer carries no comment */
        private Duration matchWindow = Duration.ofMinutes(30);
    }

    @Getter
    @Setter
    public static class Plan {
        @NotBlank private String id;

        @Min(1)
        private int days;

        @NotNull private BigDecimal price;

        @NotBlank private String currency;

        /** 0 means unlimited */
        private long trafficLimitGb;
    }

    @Getter
    @Setter
    public static class Host {
        @NotBlank private String id;

        @NotNull private HostType type;

        @NotBlank private String baseUrl;

        private String username;
        private String password;
        private String apiToken;

        /** 3x-ui inbound that receives new clients */
        private Integer inboundId;

        /** Remnawave internal squad assigned to new users */
        private String squadUuid;

        /** Subscription URL; {token} is replaced, otherwise the token is appended */
        private String subscriptionTemplate;

        private String flow = "xtls-rprx-vision";

        @Min(1)
        private int maxConcurrentCalls = 4;
    }
}
