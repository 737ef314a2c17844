package stockgate.core.port.in;

import java.util.Optional;

import stockgate.core.model.access.AccessDecision;

/**
 * Inbound port for the per-request access decision.
 *
 * <p>Implementations are pure functions of the path, the presented artifact,
 * immutable configuration and the clock. They perform no I/O and hold no
 * mutable state, so they are safe to call from the event loop.
 */
public interface AccessGateway {

    /**
     * Decide what happens to a request.
     *
     * @param path request path, without query string
     * @param artifact session artifact from the cookie, if any
     * @return the decision; never null and never thrown as an exception
     */
    AccessDecision evaluate(String path, Optional<String> artifact);
}
