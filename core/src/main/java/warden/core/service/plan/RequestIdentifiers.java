package warden.core.service.plan;

/**
 * Builds rate limit identifiers for HTTP callers.
 */
public final class RequestIdentifiers {

    private RequestIdentifiers() {}

    /**
     * Prefer the authenticated user, falling back to the client address.
     *
     * @param userId the user id, may be null
     * @param ip the client address, may be null
     * @return {@code user:<id>}, {@code ip:<ip>} or {@code ip:unknown}
     */
    public static String of(String userId, String ip) {
        if (userId != null && !userId.isBlank()) {
            return "user:" + userId;
        }
        return "ip:" + (ip == null || ip.isBlank() ? "unknown" : ip);
    }

    /**
     * Resolve the client address from proxy headers.
     *
     * @param forwardedFor the {@code X-Forwarded-For} header, may be null
     * @param realIp the {@code X-Real-IP} header, may be null
     * @return the first forwarded address, else the real IP, else {@code "unknown"}
     */
    public static String clientIp(String forwardedFor, String realIp) {
        if (forwardedFor != null && !forwardedFor.isBlank()) {
            final var first = forwardedFor.split(",")[0].trim();
            if (!first.isEmpty()) {
                return first;
            }
        }
        return realIp == null || realIp.isBlank() ? "unknown" : realIp.trim();
    }
}
