package certflow.model;

import java.net.URI;

/**
 * @param challengeUrl used to answer the challenge and to fetch its error detail
 * @param proof
 */
public record ChallengeResult(
    URI challengeUrl,
    ChallengeProof proof
) {

}
