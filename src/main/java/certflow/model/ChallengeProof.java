package certflow.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonSubTypes.Type;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Proof of control computed for one challenge. Callers handle the variants through {@link Visitor} so that adding a
 * variant breaks every consumer at compile time.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
    @Type(value = HttpProof.class, name = Challenge.TYPE_HTTP_01),
    @Type(value = DnsProof.class, name = Challenge.TYPE_DNS_01)
})
public sealed interface ChallengeProof permits HttpProof, DnsProof {

    String value();

    <R> R accept(Visitor<R> visitor);

    interface Visitor<R> {

        R visitHttp(HttpProof proof);

        R visitDns(DnsProof proof);
    }
}
