package com.plainer.collab.security;

import com.plainer.collab.error.AuthorizationException;
import com.plainer.collab.message.UserInfo;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.jwt.JsonWebToken;

@ApplicationScoped
public class AuthService {

    @Inject
    JsonWebToken jwt;

    /**
     * Subject of the bearer token on the current request or WebSocket upgrade.
     * Returns null if not authenticated.
     */
    public String getCurrentUserId() {
        try {
            return jwt.getSubject();
        } catch (RuntimeException e) {
            return null;
        }
    }

    public String getCurrentUserName() {
        try {
            Object name = jwt.getClaim("name");
            return name != null ? name.toString() : null;
        } catch (RuntimeException e) {
            return null;
        }
    }

    public boolean isAuthenticated() {
        return getCurrentUserId() != null;
    }

    /**
     * Identity a joining client may use. A verified token always wins over what the client claims.
     */
    public UserInfo resolve(UserInfo claimed) {
        String subject = getCurrentUserId();
        if (subject == null) {
            return claimed;
        }
        String name = getCurrentUserName();
        if (claimed == null) {
            return new UserInfo(subject, name != null ? name : subject, null);
        }
        return claimed.withIdentity(subject, name != null ? name : claimed.name());
    }

    /** Caller of a management request: token subject, else the {@code X-User-Id} header. */
    public String requireRequester(String headerUserId) {
        String subject = getCurrentUserId();
        if (subject != null) {
            return subject;
        }
        if (headerUserId == null || headerUserId.isBlank()) {
            throw new AuthorizationException(AuthorizationException.AUTHENTICATION_REQUIRED,
                "Authentication required");
        }
        return headerUserId;
    }
}
