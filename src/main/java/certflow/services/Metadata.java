package certflow.services;

/**
 * Tags placed on imported certificates, used to find them again when they are due for renewal.
 */
public class Metadata {

    public static final String ISSUER_TAG = "Issuer";

    public static final String ENDPOINT_TAG = "Endpoint";

    public static final String SITE_TAG = "Site";

    public static final String CHALLENGE_TAG = "ChallengeType";

    private Metadata() {}
}
