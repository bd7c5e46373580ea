package certflow.model;

import java.util.List;

/**
 * @param type        such as <code>urn:ietf:params:acme:error:badNonce</code>
 * @param detail
 * @param status      HTTP status echoed by the server, when present
 * @param subproblems per-identifier problems
 * @see <a href="https://datatracker.ietf.org/doc/html/rfc8555#section-6.7">RFC 8555 6.7</a>
 */
public record Problem(
    String type,
    String detail,
    Integer status,
    List<Subproblem> subproblems
) {

    public static final String BAD_NONCE = "urn:ietf:params:acme:error:badNonce";
    public static final String RATE_LIMITED = "urn:ietf:params:acme:error:rateLimited";
    public static final String SERVER_INTERNAL = "urn:ietf:params:acme:error:serverInternal";

    public record Subproblem(
        String type,
        String detail,
        Identifier identifier
    ) {

    }
}
