package com.vpnshop.fulfillment.adapters;

import com.vpnshop.fulfillment.domain.HostAuthFailedException;
import com.vpnshop.fulfillment.domain.HostRejectedException;
import com.vpnshop.fulfillment.domain.HostUnreachableException;
import com.vpnshop.fulfillment.domain.ProvisioningException;
import org.springframework.http.HttpStatus;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;

/**
 * Maps RestTemplate failures onto the provisioning error taxonomy.
 */
final class HostCallErrors {

    private HostCallErrors() {
    }

    static ProvisioningException classify(String hostId, String operation, RestClientException e) {
        if (e instanceof ResourceAccessException) {
            return new HostUnreachableException(hostId, operation + " failed: " + e.getMessage(), e);
        }
        if (e instanceof HttpStatusCodeException) {
            HttpStatusCodeException status = (HttpStatusCodeException) e;
            int code = status.getStatusCode().value();
            if (code == HttpStatus.UNAUTHORIZED.value() || code == HttpStatus.FORBIDDEN.value()) {
                return new HostAuthFailedException(hostId, operation + " refused with " + code, e);
            }
            if (code == HttpStatus.TOO_MANY_REQUESTS.value() || status.getStatusCode().is5xxServerError()) {
                return new HostUnreachableException(hostId, operation + " returned " + code, e);
            }
            return new HostRejectedException(hostId, operation + " rejected with " + code + ": "
                    + abbreviate(status.getResponseBodyAsString()), e);
        }
        return new HostUnreachableException(hostId, operation + " failed: " + e.getMessage(), e);
    }

    private static String abbreviate(String body) {
        if (body == null) {
            return "";
        }
        return body.length() > 300 ? body.substring(0, 300) : body;
    }
}
