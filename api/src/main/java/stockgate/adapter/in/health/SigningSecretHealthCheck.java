package stockgate.adapter.in.health;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;

import stockgate.core.service.session.SessionTokenCodec;

/**
 * Reports not ready while no usable signing secret is configured, since
 * every protected request would be sent to login.
 */
@Readiness
@ApplicationScoped
public class SigningSecretHealthCheck implements HealthCheck {

    static final String NAME = "session-signing-secret";

    private final SessionTokenCodec codec;

    @Inject
    public SigningSecretHealthCheck(SessionTokenCodec codec) {
        this.codec = codec;
    }

    @Override
    public HealthCheckResponse call() {
        var builder = HealthCheckResponse.named(NAME);
        if (codec.isSigningAvailable()) {
            return builder.up().build();
        }
        return builder.down()
                .withData("reason", codec.signingProblem().orElse("unknown"))
                .build();
    }
}
