package certflow.services;

import certflow.messages.AuthzResponse;
import certflow.model.ChallengeProof;
import certflow.model.ChallengeResult;
import certflow.model.ChallengeType;
import certflow.model.DnsProof;
import certflow.model.HttpProof;
import certflow.model.Site;
import java.net.URI;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Turns the authorizations of an order into the proofs that satisfy them.
 */
@Service
@Slf4j
public class ChallengeResolver {

    private static final String STATUS_VALID = "valid";

    private final AcmeClient acmeClient;
    private final HostingControlPlane hostingControlPlane;

    public ChallengeResolver(AcmeClient acmeClient, HostingControlPlane hostingControlPlane) {
        this.acmeClient = acmeClient;
        this.hostingControlPlane = hostingControlPlane;
    }

    /**
     * Authorizations the CA already considers valid, such as ones reused from a recent order, need no proof and are
     * left out.
     *
     * @throws ChallengeTypeConflictException when an authorization doesn't offer the required type
     */
    public Mono<List<ChallengeResult>> resolve(List<URI> authorizationUrls, ChallengeType type) {
        return Flux.fromIterable(authorizationUrls)
            .concatMap(authzUrl -> acmeClient.getAuthorization(authzUrl)
                .doOnNext(authz -> log.debug("Loaded authz={} for name={} status={}", authzUrl, authz.dnsName(),
                    authz.status()
                ))
            )
            .filter(authz -> !STATUS_VALID.equals(authz.status()))
            .concatMap(authz -> resolveOne(authz, type))
            .collectList();
    }

    /**
     * Writes each HTTP-01 proof below the site's content root. DNS-01 proofs are published by
     * {@link DnsChallengePublisher}.
     */
    public Mono<Void> deliverHttpProofs(Site site, List<ChallengeResult> results) {
        return Flux.fromIterable(results)
            .map(ChallengeResult::proof)
            .concatMap(proof -> proof.accept(new ChallengeProof.Visitor<Mono<Void>>() {
                @Override
                public Mono<Void> visitHttp(HttpProof httpProof) {
                    return hostingControlPlane.writeFile(site, httpProof.path(), httpProof.value());
                }

                @Override
                public Mono<Void> visitDns(DnsProof dnsProof) {
                    return Mono.empty();
                }
            }))
            .then();
    }

    private Mono<ChallengeResult> resolveOne(AuthzResponse authz, ChallengeType type) {
        return Mono.justOrEmpty(authz.challengeOfType(type.wireName()))
            .switchIfEmpty(Mono.error(() -> new ChallengeTypeConflictException(authz.dnsName(), type.wireName())))
            .flatMap(challenge -> acmeClient.keyAuthorization(challenge.token())
                .map(keyAuthorization -> new ChallengeResult(challenge.url(),
                    proofFor(type, authz, challenge.token(), keyAuthorization)
                ))
            );
    }

    static ChallengeProof proofFor(ChallengeType type, AuthzResponse authz, String token, String keyAuthorization) {
        return switch (type) {
            case HTTP_01 -> HttpProof.forToken(authz.identifier().value(), token, keyAuthorization);
            case DNS_01 -> DnsProof.forName(authz.identifier().value(),
                AcmeAccountService.dnsTxtValue(keyAuthorization)
            );
        };
    }
}
