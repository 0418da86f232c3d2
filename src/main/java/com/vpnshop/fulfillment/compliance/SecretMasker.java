package com.vpnshop.fulfillment.compliance;

/**
 * Redacts secrets and credential material so they are safe to include in logs.
 * Subscription links grant VPN access on their own and are treated as secrets.
 */
public final class SecretMasker {

    private static final String MASKED = "***";

    private SecretMasker() {}

    /** Keeps the first four characters of a signature or token ("a1b2c3..." -> "a1b2***"). */
    public static String maskToken(String token) {
        if (token == null || token.isBlank()) return null;
        if (token.length() <= 8) return MASKED;
        return token.substring(0, 4) + MASKED;
    }

    /** Keeps scheme and host of a subscription link, drops the path that carries the access token. */
    public static String maskSubscriptionLink(String link) {
        if (link == null || link.isBlank()) return null;
        int schemeEnd = link.indexOf("://");
        int pathStart = schemeEnd >= 0 ? link.indexOf('/', schemeEnd + 3) : -1;
        if (pathStart < 0) return MASKED;
        return link.substring(0, pathStart) + "/" + MASKED;
    }

    /** Masks the local part of an email-like client reference ("c1a2b3@host" -> "c1***@host"). */
    public static String maskClientReference(String reference) {
        if (reference == null || reference.isBlank()) return null;
        int at = reference.indexOf('@');
        String local = at >= 0 ? reference.substring(0, at) : reference;
        String domain = at >= 0 ? reference.substring(at) : "";
        String visible = local.length() > 2 ? local.substring(0, 2) : "";
        return visible + MASKED + domain;
    }
}
