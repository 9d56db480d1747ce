package com.innstay.booking.security;

/**
 * Who is making a request, as forwarded by the gateway. Guests reaching a
 * booking through a verification link have no userId.
 * <p>
 * SYSTEM is never derived from request headers; it exists only for scheduled
 * and provider-driven work inside the service.
 */
public record ActorContext(Long userId, String email, ActorRole role, String clientIp) {

    private static final ActorContext SYSTEM = new ActorContext(null, null, ActorRole.SYSTEM, "internal");

    public static ActorContext system() {
        return SYSTEM;
    }

    public static ActorContext anonymous(String clientIp) {
        return new ActorContext(null, null, ActorRole.GUEST, clientIp);
    }

    public boolean isAuthenticated() {
        return userId != null;
    }

    public boolean isStaff() {
        return role == ActorRole.STAFF || role == ActorRole.ADMIN;
    }

    public boolean isSystem() {
        return role == ActorRole.SYSTEM;
    }
}
