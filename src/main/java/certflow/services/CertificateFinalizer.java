package certflow.services;

import certflow.config.AppProperties;
import certflow.messages.OrderResponse;
import certflow.model.CertificateDownload;
import certflow.model.DomainSet;
import certflow.model.FailureKind;
import certflow.model.IssuedCertificate;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.StringReader;
import java.net.URI;
import java.security.GeneralSecurityException;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.KeyStore;
import java.security.MessageDigest;
import java.security.PrivateKey;
import java.security.cert.CertificateFactory;
import java.security.cert.X509Certificate;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import javax.security.auth.x500.X500Principal;
import lombok.extern.slf4j.Slf4j;
import org.bouncycastle.asn1.pkcs.PKCSObjectIdentifiers;
import org.bouncycastle.asn1.x500.RDN;
import org.bouncycastle.asn1.x500.X500Name;
import org.bouncycastle.asn1.x500.style.BCStyle;
import org.bouncycastle.asn1.x500.style.IETFUtils;
import org.bouncycastle.asn1.x509.Extension;
import org.bouncycastle.asn1.x509.ExtensionsGenerator;
import org.bouncycastle.asn1.x509.GeneralName;
import org.bouncycastle.asn1.x509.GeneralNames;
import org.bouncycastle.operator.ContentSigner;
import org.bouncycastle.operator.OperatorCreationException;
import org.bouncycastle.operator.jcajce.JcaContentSignerBuilder;
import org.bouncycastle.pkcs.PKCS10CertificationRequest;
import org.bouncycastle.pkcs.jcajce.JcaPKCS10CertificationRequestBuilder;
import org.bouncycastle.util.io.pem.PemObject;
import org.bouncycastle.util.io.pem.PemReader;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

/**
 * Generates the certificate key, submits the CSR, waits for issuance and bundles the downloaded chain with the key.
 * The key only ever lives in the returned {@link IssuedCertificate}.
 */
@Service
@Slf4j
public class CertificateFinalizer {

    static final int KEY_SIZE = 2048;

    /**
     * Upper bound of a certificate subject's common name
     */
    private static final int MAX_COMMON_NAME_LENGTH = 64;

    private static final String KEY_ALIAS = "certificate";

    /**
     * Protects the bundle only on its way to the hosting layer, it is neither persisted nor exposed.
     */
    static final String TRANSPORT_PASSPHRASE = "P@ssw0rd";

    private final AcmeClient acmeClient;
    private final AppProperties appProperties;

    public CertificateFinalizer(AcmeClient acmeClient, AppProperties appProperties) {
        this.acmeClient = acmeClient;
        this.appProperties = appProperties;
    }

    /**
     * Finalizes the order as currently known to the CA. An order that is already processing or valid was finalized
     * with a key that is gone, which fails with {@link FinalizeException#keyUnavailable(String)}.
     */
    public Mono<IssuedCertificate> issue(URI orderUrl, DomainSet domains) {
        return acmeClient.getOrder(orderUrl)
            .flatMap(order -> {
                if (order.hasStatus(OrderResponse.STATUS_PROCESSING) || order.hasStatus(OrderResponse.STATUS_VALID)) {
                    return Mono.error(FinalizeException.keyUnavailable(
                        "Order %s was already finalized by an earlier attempt".formatted(orderUrl)));
                }
                if (!order.hasStatus(OrderResponse.STATUS_READY)) {
                    return Mono.error(FinalizeException.fatal(
                        "Order %s is %s, expected ready".formatted(orderUrl, order.status())));
                }
                return submitCsr(orderUrl, order, domains);
            });
    }

    private Mono<IssuedCertificate> submitCsr(URI orderUrl, OrderResponse order, DomainSet domains) {
        log.debug("Submitting CSR for order={} with names={}", orderUrl, domains.names());

        final KeyPair keyPair = generateCertKeyPair();
        final byte[] csr = buildCsr(domains, keyPair);

        return acmeClient.finalizeOrder(order.finalizeUri(), csr)
            .flatMap(finalized -> finalized.hasStatus(OrderResponse.STATUS_VALID)
                ? Mono.just(finalized)
                : awaitIssued(orderUrl)
            )
            .flatMap(issued -> {
                if (issued.certificate() == null) {
                    return Mono.error(FinalizeException.fatal("Order %s is valid but has no certificate".formatted(
                        orderUrl)));
                }
                return downloadChain(issued.certificate());
            })
            .map(chain -> bundle(domains, chain, keyPair.getPrivate()))
            .doOnNext(certificate -> log.info("Issued certificate thumbprint={} for names={} notAfter={}",
                certificate.thumbprint(), domains.names(), certificate.notAfter()
            ));
    }

    private Mono<OrderResponse> awaitIssued(URI orderUrl) {
        final AppProperties.AuthFinalize authFinalize = appProperties.authFinalize();
        return Mono.defer(() -> acmeClient.getOrder(orderUrl))
            .flatMap(order -> {
                log.debug("Polling finalized order={}, got status={}", orderUrl, order.status());
                if (order.hasStatus(OrderResponse.STATUS_PROCESSING)) {
                    // not an actual error, but drives the retry cycle
                    return Mono.error(FinalizeException.stillProcessing(orderUrl.toString()));
                }
                if (order.hasStatus(OrderResponse.STATUS_VALID)) {
                    return Mono.just(order);
                }
                return Mono.error(FinalizeException.fatal("Order %s became %s during finalization: %s".formatted(
                    orderUrl, order.status(), order.error() != null ? order.error().detail() : "no details")));
            })
            .retryWhen(Retry.fixedDelay(authFinalize.maxAttempts(), authFinalize.pollDelay())
                .filter(throwable -> throwable instanceof FinalizeException finalizeException
                    && finalizeException.getKind() == FailureKind.RETRIABLE)
                .onRetryExhaustedThrow((spec, signal) -> signal.failure())
            );
    }

    /**
     * Picks the chain whose top certificate was issued by the preferred root, falling back to the default chain.
     */
    Mono<List<X509Certificate>> downloadChain(URI certificateUrl) {
        final String preferredChain = appProperties.acme().preferredChain();
        return acmeClient.downloadCertificate(certificateUrl)
            .flatMap(download -> {
                final List<X509Certificate> defaultChain = parseChain(download.pemChain());
                if (preferredChain == null || preferredChain.isBlank()
                    || issuedBy(defaultChain, preferredChain) || download.alternates().isEmpty()) {
                    return Mono.just(defaultChain);
                }
                return Flux.fromIterable(download.alternates())
                    .concatMap(acmeClient::downloadCertificate)
                    .map(CertificateDownload::pemChain)
                    .map(CertificateFinalizer::parseChain)
                    .filter(chain -> issuedBy(chain, preferredChain))
                    .next()
                    .doOnNext(chain -> log.debug("Using alternate chain issued by {}", preferredChain))
                    .defaultIfEmpty(defaultChain);
            });
    }

    static boolean issuedBy(List<X509Certificate> chain, String issuerCommonName) {
        if (chain.isEmpty()) {
            return false;
        }
        final X509Certificate top = chain.get(chain.size() - 1);
        final RDN[] commonNames = X500Name.getInstance(top.getIssuerX500Principal().getEncoded())
            .getRDNs(BCStyle.CN);
        return commonNames.length > 0
            && IETFUtils.valueToString(commonNames[0].getFirst().getValue()).equalsIgnoreCase(issuerCommonName);
    }

    static List<X509Certificate> parseChain(String pemChain) {
        final List<X509Certificate> chain = new ArrayList<>();
        try (PemReader pemReader = new PemReader(new StringReader(pemChain))) {
            final CertificateFactory certificateFactory = CertificateFactory.getInstance("X.509");
            PemObject pemObject;
            while ((pemObject = pemReader.readPemObject()) != null) {
                if ("CERTIFICATE".equals(pemObject.getType())) {
                    chain.add((X509Certificate) certificateFactory.generateCertificate(
                        new ByteArrayInputStream(pemObject.getContent())));
                }
            }
        } catch (IOException | GeneralSecurityException e) {
            throw FinalizeException.fatal("Unable to parse downloaded certificate chain", e);
        }
        if (chain.isEmpty()) {
            throw FinalizeException.fatal("Downloaded certificate chain contains no certificate");
        }
        return chain;
    }

    IssuedCertificate bundle(DomainSet domains, List<X509Certificate> chain, PrivateKey privateKey) {
        final X509Certificate leaf = chain.get(0);
        final String passphrase = TRANSPORT_PASSPHRASE;
        try {
            final KeyStore keyStore = KeyStore.getInstance("PKCS12");
            keyStore.load(null, null);
            keyStore.setKeyEntry(KEY_ALIAS, privateKey, passphrase.toCharArray(),
                chain.toArray(X509Certificate[]::new)
            );
            final ByteArrayOutputStream out = new ByteArrayOutputStream();
            keyStore.store(out, passphrase.toCharArray());

            return IssuedCertificate.builder()
                .domains(domains)
                .thumbprint(thumbprint(leaf))
                .notBefore(leaf.getNotBefore().toInstant())
                .notAfter(leaf.getNotAfter().toInstant())
                .pkcs12(out.toByteArray())
                .passphrase(passphrase)
                .build();
        } catch (IOException | GeneralSecurityException e) {
            throw FinalizeException.fatal("Failed to bundle certificate with its key", e);
        }
    }

    static String thumbprint(X509Certificate certificate) throws GeneralSecurityException {
        return HexFormat.of().withUpperCase()
            .formatHex(MessageDigest.getInstance("SHA-1").digest(certificate.getEncoded()));
    }

    static byte[] buildCsr(DomainSet domains, KeyPair keyPair) {
        final String primaryName = domains.primaryName();
        final X500Principal subject = primaryName.length() <= MAX_COMMON_NAME_LENGTH
            ? new X500Principal("CN=" + primaryName)
            : new X500Principal("");
        final JcaPKCS10CertificationRequestBuilder csrBuilder =
            new JcaPKCS10CertificationRequestBuilder(subject, keyPair.getPublic());
        try {
            final ExtensionsGenerator extensionsGenerator = new ExtensionsGenerator();
            extensionsGenerator.addExtension(Extension.subjectAlternativeName, false, new GeneralNames(
                domains.names().stream()
                    .map(name -> new GeneralName(GeneralName.dNSName, name))
                    .toArray(GeneralName[]::new)
            ));
            csrBuilder.addAttribute(PKCSObjectIdentifiers.pkcs_9_at_extensionRequest, extensionsGenerator.generate());

            final ContentSigner signer = new JcaContentSignerBuilder("SHA256withRSA").build(keyPair.getPrivate());
            final PKCS10CertificationRequest csr = csrBuilder.build(signer);
            return csr.getEncoded();
        } catch (IOException | OperatorCreationException e) {
            throw FinalizeException.fatal("Trying to build CSR for " + domains.names(), e);
        }
    }

    static KeyPair generateCertKeyPair() {
        try {
            final KeyPairGenerator keyPairGenerator = KeyPairGenerator.getInstance("RSA");
            keyPairGenerator.initialize(KEY_SIZE);
            return keyPairGenerator.generateKeyPair();
        } catch (GeneralSecurityException e) {
            throw FinalizeException.fatal("Unable to find RSA key pair algorithm", e);
        }
    }
}
