package certflow.services;

import certflow.model.SignableValue;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.JWSHeader.Builder;
import com.nimbusds.jose.JWSObjectJSON;
import com.nimbusds.jose.JWSSigner;
import com.nimbusds.jose.Payload;
import com.nimbusds.jose.crypto.ECDSASigner;
import com.nimbusds.jose.crypto.RSASSASigner;
import com.nimbusds.jose.jwk.ECKey;
import com.nimbusds.jose.jwk.JWK;
import com.nimbusds.jose.jwk.RSAKey;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.jetbrains.annotations.NotNull;
import org.reactivestreams.Publisher;
import org.springframework.core.ResolvableType;
import org.springframework.http.MediaType;
import org.springframework.http.ReactiveHttpOutputMessage;
import org.springframework.http.codec.HttpMessageWriter;
import reactor.core.publisher.Mono;

/**
 * Writes {@link SignableValue}s as flattened JWS, signed with the account key.
 */
@Slf4j
public class JwsMessageWriter implements HttpMessageWriter<SignableValue> {

    public static final MediaType JOSE_JSON = MediaType.parseMediaType("application/jose+json");
    /**
     * <a href="https://datatracker.ietf.org/doc/html/rfc8555#section-6.5">Replay Protection</a>
     */
    public static final String NONCE_SIGN_HEADER = "nonce";
    /**
     * <a href="https://datatracker.ietf.org/doc/html/rfc8555#section-6.4">Request URL Integrity</a>
     */
    public static final String URL_SIGN_HEADER = "url";

    private final ObjectMapper objectMapper;

    public JwsMessageWriter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @NotNull
    @Override
    public List<MediaType> getWritableMediaTypes() {
        return List.of(JOSE_JSON);
    }

    @Override
    public boolean canWrite(ResolvableType elementType, MediaType mediaType) {
        return SignableValue.class.isAssignableFrom(elementType.toClass())
            && (mediaType == null || JOSE_JSON.isCompatibleWith(mediaType));
    }

    @Override
    public Mono<Void> write(Publisher<? extends SignableValue> inputStream, ResolvableType elementType, MediaType mediaType,
        ReactiveHttpOutputMessage message, Map<String, Object> hints) {

        return Mono.from(inputStream)
            .flatMap(signableValue -> {
                try {
                    final byte[] body = sign(signableValue).getBytes(StandardCharsets.UTF_8);
                    message.getHeaders().setContentType(JOSE_JSON);
                    return message.writeWith(Mono.just(message.bufferFactory().wrap(body)));
                } catch (JsonProcessingException | JOSEException e) {
                    log.warn("Failed to sign/write the value for url={}", signableValue.requestUrl(), e);
                    return Mono.error(new IllegalStateException("Unable to sign ACME request", e));
                }
            });
    }

    String sign(SignableValue signableValue) throws JsonProcessingException, JOSEException {
        log.trace("Signing and serializing value={}", signableValue.value());
        final Object value = signableValue.value();
        final Payload payload;
        if (signableValue.isPostAsGet()) {
            payload = new Payload("");
        } else if (value instanceof String s) {
            payload = new Payload(s);
        } else {
            payload = new Payload(objectMapper.writeValueAsBytes(value));
        }

        final JWK jwk = signableValue.jwk();
        final Builder headerBuilder = new Builder(algorithmFor(jwk))
            .customParam(NONCE_SIGN_HEADER, signableValue.nonce())
            .customParam(URL_SIGN_HEADER, signableValue.requestUrl().toString());
        if (signableValue.kid() != null) {
            log.trace("Using kid={} in signing header", signableValue.kid());
            headerBuilder.keyID(signableValue.kid());
        } else {
            headerBuilder.jwk(jwk.toPublicJWK());
        }

        final JWSObjectJSON jwsObjectJSON = new JWSObjectJSON(payload);
        jwsObjectJSON.sign(headerBuilder.build(), signerFor(jwk));

        final String serialized = jwsObjectJSON.serializeFlattened();
        log.trace("Serialized to JWS object={}", serialized);
        return serialized;
    }

    static JWSAlgorithm algorithmFor(JWK jwk) throws JOSEException {
        if (jwk.getAlgorithm() instanceof JWSAlgorithm algorithm) {
            return algorithm;
        }
        if (jwk instanceof RSAKey) {
            return JWSAlgorithm.RS256;
        }
        if (jwk instanceof ECKey ecKey) {
            return switch (ecKey.getCurve().getName()) {
                case "P-384" -> JWSAlgorithm.ES384;
                case "P-521" -> JWSAlgorithm.ES512;
                default -> JWSAlgorithm.ES256;
            };
        }
        throw new JOSEException("Unsupported account key type " + jwk.getKeyType());
    }

    private static JWSSigner signerFor(JWK jwk) throws JOSEException {
        if (jwk instanceof RSAKey rsaKey) {
            return new RSASSASigner(rsaKey);
        }
        if (jwk instanceof ECKey ecKey) {
            return new ECDSASigner(ecKey);
        }
        throw new JOSEException("Unsupported account key type " + jwk.getKeyType());
    }
}
