package io.b2mash.credits.ledger;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * @param provider {@code noop} (in-process, default) or {@code http}
 * @param baseUrl ledger service root, required for {@code http}
 * @param apiKey sent as a bearer token when set
 */
@ConfigurationProperties(prefix = "credits.ledger")
public record CreditLedgerProperties(
    @DefaultValue("noop") String provider,
    String baseUrl,
    String apiKey,
    @DefaultValue("5s") Duration connectTimeout,
    @DefaultValue("10s") Duration readTimeout) {}
