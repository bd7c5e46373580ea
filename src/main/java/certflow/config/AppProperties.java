package certflow.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * @param acme            the ACME certificate authority
 * @param responseTimeout allowed response time when communicating with the CA and the providers
 * @param authFinalize    configuration of the client polling after challenges were answered as described in
 *                        <a href="https://datatracker.ietf.org/doc/html/rfc8555#section-7.5.1">RFC 8555 Sec 7.5.1</a>
 * @param verification    retries of the external visibility check of published proofs
 * @param workflow        bounds of one issuance workflow
 * @param renewal         discovery of certificates due for renewal
 * @param hosting         hosting control plane
 * @param dns             DNS provider and resolver
 * @param webhookUrl      optional receiver of completion events
 * @param dryRun          discover certificates due for renewal, but don't perform any issuing process
 */
@ConfigurationProperties("certflow")
@Validated
public record AppProperties(
    @NotNull @Valid
    Issuer acme,

    @DefaultValue("10s") @NotNull
    Duration responseTimeout,

    @DefaultValue @Valid
    AuthFinalize authFinalize,

    @DefaultValue @Valid
    Verification verification,

    @DefaultValue @Valid
    Workflow workflow,

    @DefaultValue @Valid
    Renewal renewal,

    @NotNull @Valid
    Hosting hosting,

    @NotNull @Valid
    Dns dns,

    URI webhookUrl,

    boolean dryRun
) {

    /**
     * @param maxAttempts
     * @param pollDelay amount of delay between polls of the server's status
     */
    public record AuthFinalize(
        @DefaultValue("60") @Min(1)
        long maxAttempts,

        @DefaultValue("2s") @NotNull
        Duration pollDelay
    ) {

    }

    /**
     * @param maxAttempts
     * @param delay between checks, covers DNS propagation and content deployment delays
     */
    public record Verification(
        @DefaultValue("12") @Min(1)
        long maxAttempts,

        @DefaultValue("10s") @NotNull
        Duration delay
    ) {

    }

    /**
     * @param maxOrderRestarts how many times an invalid order is replaced by a new one before giving up
     * @param runDeadline      upper bound for one domain set within a run
     * @param concurrency      domain sets processed in parallel
     * @param stateDirectory   where workflow checkpoints are kept
     * @param transientAttempts attempts of a step failing with transient CA, DNS or hosting errors
     * @param transientDelay   delay between those attempts
     */
    public record Workflow(
        @DefaultValue("3") @Min(0)
        int maxOrderRestarts,

        @DefaultValue("30m") @NotNull
        Duration runDeadline,

        @DefaultValue("4") @Min(1)
        int concurrency,

        @DefaultValue("state/workflows") @NotNull
        Path stateDirectory,

        @DefaultValue("3") @Min(1)
        long transientAttempts,

        @DefaultValue("5s") @NotNull
        Duration transientDelay
    ) {

    }

    /**
     * @param renewBefore renew certificates expiring within this window
     * @param issuerTag   value of the {@value certflow.services.Metadata#ISSUER_TAG} tag placed on certificates we import
     * @param cron        when to look for renewals, "-" disables
     */
    public record Renewal(
        @DefaultValue("30d") @NotNull
        Duration renewBefore,

        @DefaultValue("certflow") @NotBlank
        String issuerTag,

        @DefaultValue("0 0 0 * * *") @NotBlank
        String cron
    ) {

    }

    /**
     * @param baseUrl              control plane API
     * @param accessToken          bearer token, when required
     * @param secretStoreUrl       secret store the control plane imports keys into, passed through untouched
     * @param platformDnsSuffixes  suffixes of platform-managed host names, such as per-environment default domains,
     *                             which never get custom certificates
     */
    public record Hosting(
        @NotNull
        URI baseUrl,

        String accessToken,

        URI secretStoreUrl,

        @DefaultValue
        List<@NotBlank String> platformDnsSuffixes
    ) {

        public boolean isPlatformName(String dnsName) {
            return platformDnsSuffixes.stream()
                .anyMatch(suffix -> dnsName.toLowerCase(Locale.ROOT).endsWith(suffix.toLowerCase(Locale.ROOT)));
        }
    }

    /**
     * @param baseUrl     DNS provider API
     * @param accessToken bearer token, when required
     * @param nameServer  host[:port] of the resolver used to observe records externally, system resolvers if unset
     */
    public record Dns(
        @NotNull
        URI baseUrl,

        String accessToken,

        String nameServer
    ) {

    }
}
