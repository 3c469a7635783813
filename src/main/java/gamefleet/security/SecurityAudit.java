package gamefleet.security;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Audit trail of authentication decisions, written to the {@code gamefleet.audit}
 * logger so it can be routed to its own appender. Never logs secret material.
 */
public final class SecurityAudit {

    private static final Logger audit = LoggerFactory.getLogger("gamefleet.audit");

    public void loginSucceeded(String username, String origin) {
        audit.info("action=login result=ok user={} origin={}", username, origin);
    }

    public void loginFailed(String username, String origin, String reason) {
        audit.warn("action=login result=denied user={} origin={} reason={}", username, origin, reason);
    }

    public void tokenRejected(String origin, String reason) {
        audit.warn("action=token result=denied origin={} reason={}", origin, reason);
    }

    public void spokeCallAccepted(String spokeId, String origin) {
        audit.debug("action=spoke-call result=ok spoke={} origin={}", spokeId, origin);
    }

    public void spokeCallRejected(String spokeId, String origin, AuthFailure failure, String reason) {
        audit.warn("action=spoke-call result=denied spoke={} origin={} failure={} reason={}",
                spokeId, origin, failure, reason);
    }

    public void throttled(String origin, String action) {
        audit.warn("action={} result=throttled origin={}", action, origin);
    }

    public void adminAction(String actor, String action, String resource) {
        audit.info("action={} result=ok actor={} resource={}", action, actor, resource);
    }
}
