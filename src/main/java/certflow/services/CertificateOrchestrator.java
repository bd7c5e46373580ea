package certflow.services;

import certflow.config.AppProperties;
import certflow.model.ChallengeResult;
import certflow.model.ChallengeType;
import certflow.model.DnsZone;
import certflow.model.FailureKind;
import certflow.model.IssuanceRequest;
import certflow.model.IssuedCertificate;
import certflow.model.Site;
import certflow.model.WorkflowReport;
import certflow.model.WorkflowStage;
import certflow.model.WorkflowState;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Drives each domain set through the issuance stages, one checkpoint per transition. A workflow found unfinished in
 * the store resumes at its last stage; a finished one is started over.
 */
@Service
@Slf4j
public class CertificateOrchestrator {

    private final AcmeClient acmeClient;
    private final DnsProvider dnsProvider;
    private final HostingControlPlane hostingControlPlane;
    private final DnsZoneMatcher zoneMatcher;
    private final ChallengeResolver challengeResolver;
    private final DnsChallengePublisher dnsChallengePublisher;
    private final ChallengeVerifier challengeVerifier;
    private final ValidationPoller validationPoller;
    private final CertificateFinalizer certificateFinalizer;
    private final CertificateDeployer certificateDeployer;
    private final CompletionNotifier completionNotifier;
    private final WorkflowStateStore stateStore;
    private final StepRunner stepRunner;
    private final AppProperties appProperties;
    private final Set<String/*workflow id*/> activeWorkflows = Collections.synchronizedSet(new HashSet<>());

    public CertificateOrchestrator(AcmeClient acmeClient,
        DnsProvider dnsProvider,
        HostingControlPlane hostingControlPlane,
        DnsZoneMatcher zoneMatcher,
        ChallengeResolver challengeResolver,
        DnsChallengePublisher dnsChallengePublisher,
        ChallengeVerifier challengeVerifier,
        ValidationPoller validationPoller,
        CertificateFinalizer certificateFinalizer,
        CertificateDeployer certificateDeployer,
        CompletionNotifier completionNotifier,
        WorkflowStateStore stateStore,
        StepRunner stepRunner,
        AppProperties appProperties
    ) {
        this.acmeClient = acmeClient;
        this.dnsProvider = dnsProvider;
        this.hostingControlPlane = hostingControlPlane;
        this.zoneMatcher = zoneMatcher;
        this.challengeResolver = challengeResolver;
        this.dnsChallengePublisher = dnsChallengePublisher;
        this.challengeVerifier = challengeVerifier;
        this.validationPoller = validationPoller;
        this.certificateFinalizer = certificateFinalizer;
        this.certificateDeployer = certificateDeployer;
        this.completionNotifier = completionNotifier;
        this.stateStore = stateStore;
        this.stepRunner = stepRunner;
        this.appProperties = appProperties;
    }

    /**
     * Processes the domain sets concurrently, each bounded by the run deadline. Zones are listed at most once per run.
     * A domain set that is already being processed by another run is left out of the result.
     */
    public Flux<WorkflowReport> runAll(List<IssuanceRequest> requests) {
        final Mono<List<DnsZone>> zones = cacheSuccess(dnsProvider.listZones());
        return Flux.fromIterable(requests)
            .flatMap(request -> runOne(request, zones), appProperties.workflow().concurrency());
    }

    public Mono<WorkflowReport> run(IssuanceRequest request) {
        return runAll(List.of(request)).next();
    }

    private Mono<WorkflowReport> runOne(IssuanceRequest request, Mono<List<DnsZone>> zones) {
        final String workflowId = request.workflowId();
        if (!activeWorkflows.add(workflowId)) {
            log.info("Workflow={} for names={} is already running, skipping", workflowId, request.domains().names());
            return Mono.empty();
        }

        final RunContext context = new RunContext(zones, cacheSuccess(
            hostingControlPlane.getSite(request.site())
                .switchIfEmpty(Mono.error(() -> new PreconditionException("Site " + request.site() + " is not found")))
        ));
        final Duration deadline = appProperties.workflow().runDeadline();

        return stateStore.load(workflowId)
            .filter(state -> !state.stage().isTerminal())
            .doOnNext(state -> log.info("Resuming workflow={} at stage={}", workflowId, state.stage()))
            .switchIfEmpty(Mono.defer(() -> {
                log.info("Starting workflow={} for site={} names={}", workflowId, request.site(),
                    request.domains().names()
                );
                return save(WorkflowState.start(request));
            }))
            .flatMap(state -> drive(state, context))
            .timeout(deadline)
            .onErrorResume(throwable -> Mono.just(abort(request, context, throwable, deadline)))
            .map(WorkflowReport::of)
            .doOnNext(report -> {
                if (report.succeeded()) {
                    log.info("Workflow={} completed, thumbprint={} expires={}", workflowId, report.thumbprint(),
                        report.expiration()
                    );
                }
            })
            .doFinally(signalType -> activeWorkflows.remove(workflowId));
    }

    private Mono<WorkflowState> drive(WorkflowState state, RunContext context) {
        context.current = state;
        if (state.stage().isTerminal()) {
            return Mono.just(state);
        }
        return execute(state, context)
            .flatMap(outcome -> transition(state, outcome, context))
            .flatMap(this::save)
            .flatMap(next -> drive(next, context));
    }

    /**
     * The checkpoint is left as it was so that the next run resumes where this one was cut off.
     */
    private WorkflowState abort(IssuanceRequest request, RunContext context, Throwable throwable, Duration deadline) {
        final WorkflowState last = context.current != null ? context.current : WorkflowState.start(request);
        final String reason = throwable instanceof TimeoutException
            ? "Deadline of %s exceeded at stage %s".formatted(deadline, last.stage())
            : "Workflow aborted at stage %s: %s".formatted(last.stage(), throwable.getMessage());
        log.error("Workflow={} {}", last.workflowId(), reason, throwable instanceof TimeoutException ? null : throwable);
        return last.fail(FailureKind.FATAL, reason);
    }

    private Mono<StepOutcome<WorkflowState>> execute(WorkflowState state, RunContext context) {
        final AppProperties.Verification verification = appProperties.verification();
        final AppProperties.AuthFinalize authFinalize = appProperties.authFinalize();
        final List<ChallengeResult> results = state.challengeResultsOrEmpty();

        return switch (state.stage()) {
            case DISCOVERED -> transientStep(state, "create-order", () -> createOrder(state, context));
            case ORDER_CREATED -> transientStep(state, "prepare-challenges", () -> prepareChallenges(state, context));
            case CHALLENGES_PREPARED -> stepRunner.run(state.workflowId(), "verify-challenges",
                () -> challengeVerifier.verify(results)
                    .then(Mono.fromSupplier(() -> state.advanceTo(WorkflowStage.CHALLENGES_VERIFIED))),
                verification.maxAttempts(), verification.delay()
            );
            case CHALLENGES_VERIFIED -> transientStep(state, "answer-challenges",
                () -> Flux.fromIterable(results)
                    .concatMap(result -> acmeClient.answerChallenge(result.challengeUrl()))
                    .then(Mono.fromSupplier(() -> state.advanceTo(WorkflowStage.CHALLENGES_ANSWERED)))
            );
            case CHALLENGES_ANSWERED -> stepRunner.run(state.workflowId(), "await-validation",
                () -> validationPoller.checkOrder(state.orderUrl(), results)
                    .map(order -> state.toBuilder().order(order).build().advanceTo(WorkflowStage.VALIDATED)),
                authFinalize.maxAttempts(), authFinalize.pollDelay()
            );
            // a repeated CSR submission would hit an order that is already processing
            case VALIDATED -> stepRunner.run(state.workflowId(), "finalize",
                () -> certificateFinalizer.issue(state.orderUrl(), state.domains())
                    .map(certificate -> {
                        context.issued = certificate;
                        return state.toBuilder()
                            .thumbprint(certificate.thumbprint())
                            .expiration(certificate.notAfter())
                            .build()
                            .advanceTo(WorkflowStage.FINALIZED);
                    }),
                1, Duration.ZERO
            );
            case FINALIZED -> transientStep(state, "deploy", () -> deploy(state, context));
            case DEPLOYED -> transientStep(state, "cleanup",
                () -> cleanupProofs(state, context)
                    .then(Mono.fromSupplier(() -> state.advanceTo(WorkflowStage.CLEANED_UP)))
            )
                .map(outcome -> {
                    if (outcome instanceof StepOutcome.Failed<WorkflowState> failed) {
                        log.warn("Leaving DNS proofs of workflow={} behind: {}", state.workflowId(), failed.message());
                        return StepOutcome.completed(state.advanceTo(WorkflowStage.CLEANED_UP));
                    }
                    return outcome;
                });
            case CLEANED_UP -> stepRunner.run(state.workflowId(), "notify",
                () -> completionNotifier.notifyCompleted(state.site(), state.expiration(), state.domains())
                    .then(Mono.fromSupplier(() -> state.toBuilder()
                        .challengeResults(null)
                        .build()
                        .advanceTo(WorkflowStage.COMPLETED)
                    )),
                1, Duration.ZERO
            );
            case COMPLETED, FAILED -> Mono.error(new IllegalStateException(
                "Workflow " + state.workflowId() + " is already " + state.stage()));
        };
    }

    private Mono<WorkflowState> transition(WorkflowState state, StepOutcome<WorkflowState> outcome,
        RunContext context
    ) {
        if (outcome instanceof StepOutcome.Completed<WorkflowState> completed) {
            log.debug("Workflow={} advanced from {} to {}", state.workflowId(), state.stage(),
                completed.value().stage()
            );
            return Mono.just(completed.value());
        }

        final StepOutcome.Failed<WorkflowState> failed = (StepOutcome.Failed<WorkflowState>) outcome;
        final int maxOrderRestarts = appProperties.workflow().maxOrderRestarts();
        if (failed.kind() == FailureKind.RESTART_REQUIRED && state.restarts() < maxOrderRestarts) {
            log.warn("Restarting workflow={} with a new order, restart {} of {}: {}", state.workflowId(),
                state.restarts() + 1, maxOrderRestarts, failed.message()
            );
            return bestEffortCleanup(state, context)
                .then(Mono.fromSupplier(() -> {
                    context.pendingResults = List.of();
                    context.issued = null;
                    return state.restart(failed.message());
                }));
        }

        final String reason = failed.kind() == FailureKind.RESTART_REQUIRED
            ? "Gave up after %d order restarts: %s".formatted(state.restarts(), failed.message())
            : failed.message();
        log.error("Workflow={} failed at stage={} kind={}: {}", state.workflowId(), state.stage(), failed.kind(),
            reason
        );
        return bestEffortCleanup(state, context)
            .then(Mono.fromSupplier(() -> state.fail(failed.kind(), reason)));
    }

    private Mono<WorkflowState> createOrder(WorkflowState state, RunContext context) {
        return checkPreconditions(state, context)
            .then(Mono.defer(() -> acmeClient.createOrder(state.domains())))
            .map(order -> {
                log.info("Created order={} for workflow={}", order.location(), state.workflowId());
                return state.toBuilder()
                    .orderUrl(order.location())
                    .order(order.order())
                    .build()
                    .advanceTo(WorkflowStage.ORDER_CREATED);
            });
    }

    /**
     * Everything that can be checked without the CA is checked before an order is placed.
     */
    private Mono<Void> checkPreconditions(WorkflowState state, RunContext context) {
        final AppProperties.Hosting hosting = appProperties.hosting();
        final List<String> platformNames = state.domains().names().stream()
            .filter(hosting::isPlatformName)
            .toList();
        if (!platformNames.isEmpty()) {
            return Mono.error(new PreconditionException(
                "Platform managed names can't be issued custom certificates: " + String.join(",", platformNames)));
        }

        if (state.challengeType() == ChallengeType.DNS_01) {
            return context.zones
                .flatMap(zones -> zoneMatcher.checkPreconditions(state.domains(), zones))
                .then();
        }
        return context.site
            .flatMap(site -> {
                final List<String> foreign = state.domains().names().stream()
                    .filter(dnsName -> !site.hasHostName(dnsName))
                    .toList();
                if (!foreign.isEmpty()) {
                    return Mono.error(new PreconditionException(
                        "HTTP-01 requires names to be host names of site %s: %s".formatted(
                            site.ref(), String.join(",", foreign))));
                }
                return Mono.empty();
            });
    }

    private Mono<WorkflowState> prepareChallenges(WorkflowState state, RunContext context) {
        final ChallengeType type = state.challengeType();
        return challengeResolver.resolve(state.order().authorizations(), type)
            .flatMap(results -> {
                context.pendingResults = results;
                final Mono<Void> published = type == ChallengeType.DNS_01
                    ? context.zones.flatMap(zones -> dnsChallengePublisher.publish(results, zones))
                    : context.site.flatMap(site -> challengeResolver.deliverHttpProofs(site, results));
                return published
                    .then(Mono.fromSupplier(() -> state.toBuilder()
                        .challengeResults(results)
                        .build()
                        .advanceTo(WorkflowStage.CHALLENGES_PREPARED)
                    ));
            });
    }

    /**
     * Without the certificate of this run in memory the only way forward is a certificate an earlier run already
     * imported; otherwise its key is gone.
     */
    private Mono<WorkflowState> deploy(WorkflowState state, RunContext context) {
        return context.site
            .flatMap(site -> {
                final IssuedCertificate issued = context.issued;
                final Mono<?> imported = issued != null && issued.thumbprint().equals(state.thumbprint())
                    ? certificateDeployer.upload(site, issued, state.challengeType())
                    : certificateDeployer.findImported(site, state.domains(), state.thumbprint())
                        .switchIfEmpty(Mono.error(() -> FinalizeException.keyUnavailable(
                            "Certificate %s was issued but never imported, its key is not available".formatted(
                                state.certificateName()))));
                return imported.then(certificateDeployer.bind(site, state.domains(), state.thumbprint()));
            })
            .then(Mono.fromSupplier(() -> {
                context.issued = null;
                return state.advanceTo(WorkflowStage.DEPLOYED);
            }));
    }

    private Mono<Void> cleanupProofs(WorkflowState state, RunContext context) {
        final List<ChallengeResult> results = !state.challengeResultsOrEmpty().isEmpty()
            ? state.challengeResultsOrEmpty()
            : context.pendingResults;
        if (state.challengeType() != ChallengeType.DNS_01 || results.isEmpty()) {
            return Mono.empty();
        }
        return context.zones
            .flatMap(zones -> dnsChallengePublisher.cleanup(results, zones))
            .doOnSuccess(unused -> log.debug("Removed DNS proofs of workflow={}", state.workflowId()));
    }

    private Mono<Void> bestEffortCleanup(WorkflowState state, RunContext context) {
        return cleanupProofs(state, context)
            .onErrorResume(throwable -> {
                log.warn("Unable to remove DNS proofs of workflow={}: {}", state.workflowId(), throwable.getMessage());
                return Mono.empty();
            });
    }

    private Mono<StepOutcome<WorkflowState>> transientStep(WorkflowState state, String step,
        Supplier<Mono<WorkflowState>> action
    ) {
        final AppProperties.Workflow workflow = appProperties.workflow();
        return stepRunner.run(state.workflowId(), step, action, workflow.transientAttempts(),
            workflow.transientDelay()
        );
    }

    private Mono<WorkflowState> save(WorkflowState state) {
        return stateStore.save(state.toBuilder().updated(Instant.now()).build());
    }

    private static <T> Mono<T> cacheSuccess(Mono<T> source) {
        return source.cache(value -> Duration.ofMillis(Long.MAX_VALUE), throwable -> Duration.ZERO,
            () -> Duration.ZERO
        );
    }

    /**
     * What one run keeps in memory only. The certificate and its key in particular never reach the store.
     */
    private static class RunContext {

        final Mono<List<DnsZone>> zones;
        final Mono<Site> site;
        volatile WorkflowState current;
        volatile IssuedCertificate issued;
        volatile List<ChallengeResult> pendingResults = List.of();

        RunContext(Mono<List<DnsZone>> zones, Mono<Site> site) {
            this.zones = zones;
            this.site = site;
        }
    }
}
