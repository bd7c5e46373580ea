package certflow.services;

import certflow.model.Problem;
import java.util.Objects;
import lombok.ToString;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.WebClientResponseException;

@ToString
public class AcmeProblemException extends RuntimeException {

    private final Problem problem;
    private final WebClientResponseException clientException;

    public AcmeProblemException(Problem problem, WebClientResponseException clientException) {
        super(
            "ACME Server reported a problem with the request. Type=%s details=%s".formatted(
                problem.type(), problem.detail()),
            clientException
        );
        this.problem = problem;
        this.clientException = clientException;
    }

    public Problem getProblem() {
        return problem;
    }

    public int getStatusCode() {
        return clientException.getStatusCode().value();
    }

    public boolean isBadNonce() {
        return Objects.equals(problem.type(), Problem.BAD_NONCE);
    }

    /**
     * @return true for problems that a later identical request may not run into
     */
    public boolean isTransient() {
        return isBadNonce()
            || Objects.equals(problem.type(), Problem.RATE_LIMITED)
            || Objects.equals(problem.type(), Problem.SERVER_INTERNAL)
            || clientException.getStatusCode().is5xxServerError()
            || clientException.getStatusCode().value() == HttpStatus.TOO_MANY_REQUESTS.value();
    }
}
