package certflow.services;

import certflow.config.AppProperties;
import certflow.config.Issuer;
import certflow.messages.AccountRequest;
import certflow.messages.AccountResponse;
import certflow.model.AcmeAccount;
import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.jwk.JWK;
import com.nimbusds.jose.jwk.KeyUse;
import com.nimbusds.jose.jwk.gen.RSAKeyGenerator;
import com.nimbusds.jose.util.Base64URL;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.text.ParseException;
import java.time.Duration;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

@Service
@Slf4j
public class AcmeAccountService {

    private final AcmeBaseRequestService baseRequestService;
    private final AcmeDirectoryService directoryService;
    private final Issuer issuer;
    private final Mono<AcmeAccount> account;

    public AcmeAccountService(
        AcmeDirectoryService directoryService,
        AcmeBaseRequestService baseRequestService,
        AppProperties appProperties
    ) {
        this.directoryService = directoryService;
        this.baseRequestService = baseRequestService;
        this.issuer = appProperties.acme();
        this.account = Mono.fromCallable(() -> loadOrCreateAccountKey(issuer.accountKeyPath()))
            .subscribeOn(Schedulers.boundedElastic())
            .flatMap(this::retrieveAccount)
            .cache(loaded -> Duration.ofMillis(Long.MAX_VALUE),
                throwable -> Duration.ZERO,
                () -> Duration.ZERO
            );
    }

    private static JWK generateJwk() {
        try {
            return new RSAKeyGenerator(2048)
                .algorithm(JWSAlgorithm.RS256)
                .keyUse(KeyUse.SIGNATURE)
                .keyID(UUID.randomUUID().toString())
                .generate();
        } catch (JOSEException e) {
            throw new IllegalStateException("Unable to generate account key", e);
        }
    }

    /**
     * The key has to survive restarts: key authorizations of resumed workflows are bound to it.
     */
    static JWK loadOrCreateAccountKey(Path keyPath) {
        try {
            if (Files.exists(keyPath)) {
                log.debug("Loading account key from {}", keyPath);
                return JWK.parse(Files.readString(keyPath, StandardCharsets.UTF_8));
            }
            final JWK jwk = generateJwk();
            if (keyPath.getParent() != null) {
                Files.createDirectories(keyPath.getParent());
            }
            Files.writeString(keyPath, jwk.toJSONString(), StandardCharsets.UTF_8);
            log.info("Created new account key at {}", keyPath);
            return jwk;
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to access account key at " + keyPath, e);
        } catch (ParseException e) {
            throw new IllegalStateException("Account key at " + keyPath + " is not a valid JWK", e);
        }
    }

    public Mono<AcmeAccount> account() {
        return account;
    }

    /**
     * Registering an already registered key returns the existing account.
     */
    private Mono<AcmeAccount> retrieveAccount(JWK jwk) {
        log.debug("Retrieving account for endpoint={}", issuer.endpoint());

        return directoryService.directory()
            .doOnNext(directory -> {
                if (directory.meta() != null) {
                    if (directory.meta().externalAccountRequired()) {
                        throw new IllegalStateException(
                            "CA at " + issuer.endpoint() + " requires external account binding, which is not supported");
                    }
                    log.debug("Agreeing to terms={} of endpoint={}", directory.meta().termsOfService(),
                        issuer.endpoint()
                    );
                }
            })
            .flatMap(directory -> baseRequestService.request(
                jwk, null,
                directory.newAccount(),
                AccountRequest.forContacts(issuer.emails(), issuer.termsOfServiceAgreed()),
                AccountResponse.class
            ))
            .map(entity -> {
                final AccountResponse response = entity.getBody();

                if (response != null) {
                    if (!response.isValid()) {
                        throw new IllegalStateException("Account is not valid, was " + response.status());
                    }
                    log.debug("Account contacts={}", response.contact());

                    return AcmeAccount.builder()
                        .accountUri(entity.getHeaders().getLocation())
                        .jwk(jwk)
                        .build();
                } else {
                    throw new IllegalStateException("New account response was null");
                }
            })
            .doOnNext(acmeAccount -> log.debug("Retrieved account={}", acmeAccount.accountUri()));
    }

    /**
     * @see <a href="https://datatracker.ietf.org/doc/html/rfc8555#section-8.1">RFC 8555 8.1</a>
     */
    public Mono<String> buildKeyAuthorization(String token) {
        return account
            .map(acmeAccount -> keyAuthorization(acmeAccount.jwk(), token));
    }

    static String keyAuthorization(JWK jwk, String token) {
        try {
            return token + "." + jwk.computeThumbprint();
        } catch (JOSEException e) {
            throw new IllegalStateException("Trying to compute jwk thumbprint", e);
        }
    }

    /**
     * @see <a href="https://datatracker.ietf.org/doc/html/rfc8555#section-8.4">RFC 8555 8.4</a>
     */
    public static String dnsTxtValue(String keyAuthorization) {
        try {
            final byte[] digest = MessageDigest.getInstance("SHA-256")
                .digest(keyAuthorization.getBytes(StandardCharsets.UTF_8));
            return Base64URL.encode(digest).toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
