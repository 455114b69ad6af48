package com.example.videoenhance.ai.providers;

import com.example.videoenhance.ai.core.ServiceCallException;
import com.example.videoenhance.ai.core.TransientServiceException;
import org.springframework.http.HttpStatusCode;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;

/**
 * Maps RestTemplate failures onto the pipeline's service-call exceptions:
 * timeouts, 429 and 5xx are transient, any other HTTP error is not.
 */
public final class ProviderErrors {

    private static final int MAX_BODY_CHARS = 200;

    private ProviderErrors() {
    }

    public static ServiceCallException translate(String provider, RestClientException e) {
        if (e instanceof HttpStatusCodeException http) {
            HttpStatusCode status = http.getStatusCode();
            String message = "HTTP " + status.value() + ": " + truncate(http.getResponseBodyAsString());
            if (status.value() == 429 || status.is5xxServerError()) {
                return new TransientServiceException(provider, message, e);
            }
            return new ServiceCallException(provider, message, e);
        }
        if (e instanceof ResourceAccessException) {
            return new TransientServiceException(provider, "I/O error: " + e.getMessage(), e);
        }
        return new ServiceCallException(provider, e.getMessage(), e);
    }

    public static String truncate(String text) {
        if (text == null) {
            return "";
        }
        return text.length() <= MAX_BODY_CHARS ? text : text.substring(0, MAX_BODY_CHARS) + "...";
    }
}
