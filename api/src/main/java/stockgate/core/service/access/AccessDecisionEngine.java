package stockgate.core.service.access;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import stockgate.core.config.RouteConfig;
import stockgate.core.model.access.AccessDecision;
import stockgate.core.model.routing.RouteClassification;
import stockgate.core.port.in.AccessGateway;
import stockgate.core.service.routing.RouteClassifier;
import stockgate.core.service.session.SessionClaims;
import stockgate.core.service.session.SessionTokenCodec;
import stockgate.core.service.session.VerificationResult;

/**
 * Combines route category, artifact verification and role policy into a
 * single {@link AccessDecision}.
 *
 * <p>Evaluation order for session-protected routes:
 * <ol>
 *   <li>no artifact: login, keep nothing to delete</li>
 *   <li>artifact fails verification: login and delete the artifact</li>
 *   <li>onboarding requested with an organization assigned: dashboard</li>
 *   <li>dashboard requested without an organization: onboarding</li>
 *   <li>dashboard path refused by role policy: unauthorized landing</li>
 *   <li>otherwise allow, annotated with the verified identity</li>
 * </ol>
 */
@ApplicationScoped
public class AccessDecisionEngine implements AccessGateway {

    private static final Logger LOG = Logger.getLogger(AccessDecisionEngine.class);

    private final RouteClassifier classifier;
    private final SessionTokenCodec codec;
    private final RolePolicyTable policy;
    private final RouteConfig routes;

    @Inject
    public AccessDecisionEngine(
            RouteClassifier classifier, SessionTokenCodec codec, RolePolicyTable policy, RouteConfig routes) {
        this.classifier = classifier;
        this.codec = codec;
        this.policy = policy;
        this.routes = routes;
    }

    @Override
    public AccessDecision evaluate(String path, Optional<String> artifact) {
        RouteClassification classification = classifier.classify(path);
        if (!classification.requiresSession()) {
            return AccessDecision.Allow.anonymous();
        }

        String requested = classification.path();
        Optional<String> token = artifact.filter(value -> !value.isBlank());
        if (token.isEmpty()) {
            LOG.debugf("No session artifact for protected path %s", requested);
            return login(requested, false, AccessDecision.RedirectToLogin.NO_SESSION);
        }

        VerificationResult result;
        try {
            result = codec.verify(token.get());
        } catch (RuntimeException e) {
            LOG.warnf(e, "Unexpected error verifying session artifact for %s", requested);
            return login(requested, true, AccessDecision.RedirectToLogin.VERIFICATION_ERROR);
        }

        if (!(result instanceof VerificationResult.Valid valid)) {
            logFailure(result, requested);
            return login(requested, true, result.reason());
        }

        return decide(classification, valid.claims());
    }

    private AccessDecision decide(RouteClassification classification, SessionClaims claims) {
        String requested = classification.path();

        if (classification.isOnboarding() && claims.hasCompletedOnboarding()) {
            LOG.debugf("User %s already onboarded, sending to dashboard", claims.userId());
            return new AccessDecision.RedirectToDashboard(routes.dashboardPath());
        }

        if (classification.isDashboard()) {
            if (!claims.hasCompletedOnboarding()) {
                LOG.debugf("User %s has no organization, sending to onboarding", claims.userId());
                return new AccessDecision.RedirectToOnboarding(routes.onboardingPath());
            }
            if (!policy.isAllowed(claims.role(), requested)) {
                return deny(requested, claims);
            }
        }

        return AccessDecision.Allow.authenticated(claims.toIdentity());
    }

    private AccessDecision deny(String requested, SessionClaims claims) {
        String landing = routes.unauthorizedPath();
        if (landing.equals(requested)) {
            // Landing page itself refused: bouncing there again would loop.
            LOG.warnf("Role '%s' of user %s cannot open the landing page %s", claims.role(), claims.userId(), landing);
            return login(requested, true, AccessDecision.RedirectToLogin.NO_ACCESSIBLE_LANDING);
        }
        LOG.infof("Role '%s' of user %s denied access to %s", claims.role(), claims.userId(), requested);
        return new AccessDecision.RedirectToUnauthorized(landing, requested, claims.userId(), claims.role());
    }

    private AccessDecision.RedirectToLogin login(String requested, boolean clearArtifact, String reason) {
        String location = routes.loginPath() + "?" + routes.returnParameter() + "="
                + URLEncoder.encode(requested, StandardCharsets.UTF_8);
        return new AccessDecision.RedirectToLogin(location, requested, clearArtifact, reason);
    }

    private void logFailure(VerificationResult result, String requested) {
        if (result instanceof VerificationResult.Expired) {
            LOG.debugf("Expired session artifact on %s", requested);
        } else if (result instanceof VerificationResult.SignatureInvalid) {
            LOG.warnf("Session artifact with invalid signature on %s", requested);
        } else if (result instanceof VerificationResult.Malformed malformed) {
            LOG.warnf("Malformed session artifact on %s: %s", requested, malformed.detail());
        } else if (result instanceof VerificationResult.MissingSecret) {
            LOG.errorf("Cannot verify session artifact on %s: signing secret is not configured", requested);
        }
    }
}
