package certflow.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ChallengeType {
    HTTP_01(Challenge.TYPE_HTTP_01),
    DNS_01(Challenge.TYPE_DNS_01);

    private final String wireName;

    ChallengeType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /**
     * Wildcard names can only be validated over DNS, so any wildcard forces DNS-01 for the whole set.
     */
    public static ChallengeType select(DomainSet domains, boolean forceDns01) {
        return forceDns01 || domains.hasWildcard() ? DNS_01 : HTTP_01;
    }
}
