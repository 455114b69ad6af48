package com.example.videoenhance.util;

import com.google.auth.oauth2.AccessToken;
import com.google.auth.oauth2.GoogleCredentials;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Locale;

/**
 * Bearer tokens for Vertex AI calls. A configured static token wins; otherwise
 * service-account JSON from the environment, then a key file, then application
 * default credentials ({@code GOOGLE_APPLICATION_CREDENTIALS} or the file written
 * by {@code gcloud auth application-default login}).
 */
@Component
public class VertexCredentials {

    private static final Logger log = LoggerFactory.getLogger(VertexCredentials.class);

    private static final String CLOUD_PLATFORM_SCOPE = "https://www.googleapis.com/auth/cloud-platform";
    private static final String ADC_FILE_NAME = "application_default_credentials.json";

    @Value("${enhancement.providers.imagen.access-token:}")
    private String accessToken;

    @Value("${enhancement.providers.imagen.service-account-key:}")
    private String serviceAccountKeyPath;

    // Empty means the gcloud default: CLOUDSDK_CONFIG, else %APPDATA%/gcloud or ~/.config/gcloud
    @Value("${enhancement.providers.imagen.gcloud-config-dir:}")
    private String gcloudConfigDir;

    private GoogleCredentials credentials;

    public boolean isConfigured() {
        return hasText(accessToken)
            || hasText(System.getenv("GOOGLE_APPLICATION_CREDENTIALS_JSON"))
            || (hasText(serviceAccountKeyPath) && Files.exists(Paths.get(serviceAccountKeyPath)))
            || hasText(System.getenv("GOOGLE_APPLICATION_CREDENTIALS"))
            || Files.isRegularFile(applicationDefaultCredentialsFile());
    }

    Path applicationDefaultCredentialsFile() {
        if (hasText(gcloudConfigDir)) {
            return Paths.get(gcloudConfigDir, ADC_FILE_NAME);
        }
        String cloudSdkConfig = System.getenv("CLOUDSDK_CONFIG");
        if (hasText(cloudSdkConfig)) {
            return Paths.get(cloudSdkConfig, ADC_FILE_NAME);
        }
        String appData = System.getenv("APPDATA");
        if (System.getProperty("os.name", "").toLowerCase(Locale.ROOT).startsWith("windows") && hasText(appData)) {
            return Paths.get(appData, "gcloud", ADC_FILE_NAME);
        }
        return Paths.get(System.getProperty("user.home", ""), ".config", "gcloud", ADC_FILE_NAME);
    }

    /**
     * @throws IOException if no credentials can be loaded or the token refresh fails
     */
    public synchronized String getAccessToken() throws IOException {
        if (hasText(accessToken)) {
            return accessToken;
        }
        if (credentials == null) {
            credentials = loadCredentials().createScoped(List.of(CLOUD_PLATFORM_SCOPE));
        }
        credentials.refreshIfExpired();
        AccessToken token = credentials.getAccessToken();
        if (token == null) {
            throw new IOException("Google credentials returned no access token");
        }
        return token.getTokenValue();
    }

    private GoogleCredentials loadCredentials() throws IOException {
        String credentialsJson = System.getenv("GOOGLE_APPLICATION_CREDENTIALS_JSON");
        if (hasText(credentialsJson)) {
            try (InputStream in = new ByteArrayInputStream(credentialsJson.getBytes(StandardCharsets.UTF_8))) {
                return GoogleCredentials.fromStream(in);
            }
        }
        if (hasText(serviceAccountKeyPath) && Files.exists(Paths.get(serviceAccountKeyPath))) {
            try (InputStream in = new FileInputStream(serviceAccountKeyPath)) {
                return GoogleCredentials.fromStream(in);
            }
        }
        log.info("Using application default credentials for Vertex AI");
        return GoogleCredentials.getApplicationDefault();
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
