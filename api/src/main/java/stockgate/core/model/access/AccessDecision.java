package stockgate.core.model.access;

import java.util.Optional;

/**
 * Terminal outcome of evaluating a request against the session gateway.
 *
 * <p>Every evaluation ends in exactly one of:
 * <ul>
 *   <li>{@link Allow} - continue, optionally annotated with verified identity</li>
 *   <li>{@link RedirectToLogin} - no usable session</li>
 *   <li>{@link RedirectToOnboarding} - dashboard requested before onboarding</li>
 *   <li>{@link RedirectToDashboard} - onboarding requested after completion</li>
 *   <li>{@link RedirectToUnauthorized} - authenticated but under-privileged</li>
 * </ul>
 */
public sealed interface AccessDecision {

    /**
     * Short, stable name for logs and metric tags.
     */
    String outcome();

    /**
     * Request may proceed.
     *
     * @param identity verified identity for protected routes, empty otherwise
     */
    record Allow(Optional<IdentityAnnotation> identity) implements AccessDecision {

        private static final Allow ANONYMOUS = new Allow(Optional.empty());

        public Allow {
            if (identity == null) {
                identity = Optional.empty();
            }
        }

        public static Allow anonymous() {
            return ANONYMOUS;
        }

        public static Allow authenticated(IdentityAnnotation identity) {
            return new Allow(Optional.of(identity));
        }

        @Override
        public String outcome() {
            return "allow";
        }
    }

    /**
     * Outcomes that send the client elsewhere.
     */
    sealed interface Redirect extends AccessDecision
            permits RedirectToLogin, RedirectToOnboarding, RedirectToDashboard, RedirectToUnauthorized {

        /**
         * Target of the redirect (path plus optional query).
         */
        String location();

        /**
         * Whether the stored session artifact must be deleted with this redirect.
         */
        default boolean clearArtifact() {
            return false;
        }
    }

    /**
     * Redirect to the login page.
     *
     * @param location login URL including the encoded return path
     * @param returnPath the originally requested path
     * @param clearArtifact whether to delete the session cookie
     * @param reason why the session was not usable (for logs only)
     */
    record RedirectToLogin(String location, String returnPath, boolean clearArtifact, String reason)
            implements Redirect {

        /** No artifact was presented. */
        public static final String NO_SESSION = "no_session";

        /** Verification threw instead of returning a result. */
        public static final String VERIFICATION_ERROR = "verification_error";

        /** The role may not even open the unauthorized landing page. */
        public static final String NO_ACCESSIBLE_LANDING = "no_accessible_landing";

        @Override
        public String outcome() {
            return "redirect_login";
        }

        /**
         * Whether the presented artifact itself was rejected.
         */
        public boolean isVerificationFailure() {
            return clearArtifact && !NO_ACCESSIBLE_LANDING.equals(reason);
        }
    }

    /**
     * Redirect to onboarding; the user has no organization yet.
     *
     * @param location onboarding path
     */
    record RedirectToOnboarding(String location) implements Redirect {

        @Override
        public String outcome() {
            return "redirect_onboarding";
        }
    }

    /**
     * Redirect to the dashboard; onboarding is already complete.
     *
     * @param location dashboard path
     */
    record RedirectToDashboard(String location) implements Redirect {

        @Override
        public String outcome() {
            return "redirect_dashboard";
        }
    }

    /**
     * Redirect to the unauthorized landing path; the role may not open the page.
     *
     * @param location landing path
     * @param deniedPath the path that was refused
     * @param userId user that was refused
     * @param role role that was refused
     */
    record RedirectToUnauthorized(String location, String deniedPath, String userId, String role)
            implements Redirect {

        @Override
        public String outcome() {
            return "redirect_unauthorized";
        }
    }
}
