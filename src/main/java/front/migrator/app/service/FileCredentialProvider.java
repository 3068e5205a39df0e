package front.migrator.app.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.api.client.auth.oauth2.BearerToken;
import com.google.api.client.auth.oauth2.ClientParametersAuthentication;
import com.google.api.client.auth.oauth2.Credential;
import com.google.api.client.http.GenericUrl;
import com.google.api.client.http.HttpTransport;
import com.google.api.client.json.JsonFactory;
import front.migrator.app.config.FrontProperties;
import front.migrator.app.config.GoogleProperties;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Reads credentials from configuration and from the files written by the interactive setup:
 * front_token.json ({"token": "..."}), the Google OAuth client secrets (credentials.json)
 * and the stored Google user token (token.json).
 */
@Slf4j
public class FileCredentialProvider implements CredentialProvider {
    private static final String DEFAULT_TOKEN_URI = "https://oauth2.googleapis.com/token";

    private final FrontProperties frontProperties;
    private final GoogleProperties googleProperties;
    private final HttpTransport httpTransport;
    private final JsonFactory jsonFactory;
    private final ObjectMapper objectMapper;

    public FileCredentialProvider(FrontProperties frontProperties, GoogleProperties googleProperties,
                                  HttpTransport httpTransport, JsonFactory jsonFactory, ObjectMapper objectMapper) {
        this.frontProperties = frontProperties;
        this.googleProperties = googleProperties;
        this.httpTransport = httpTransport;
        this.jsonFactory = jsonFactory;
        this.objectMapper = objectMapper;
    }

    @Override
    public String frontApiToken() {
        String apiKey = frontProperties.getApiKey();
        if (apiKey != null && !apiKey.isBlank()) {
            return apiKey.trim();
        }

        Path tokenFile = Paths.get(frontProperties.getTokenFile());
        if (Files.isRegularFile(tokenFile)) {
            JsonNode json = readJson(tokenFile, "Front token file");
            if (json.hasNonNull("token") && !json.get("token").asText().isBlank()) {
                log.debug("Using Front token from {}", tokenFile.toAbsolutePath());
                return json.get("token").asText().trim();
            }
        }
        throw new MissingCredentialsException(
            "FRONT_API_KEY is required. Set it in the environment or provide " + tokenFile + ".");
    }

    @Override
    public Credential gmailCredential() {
        Path credentialsPath = Paths.get(googleProperties.getCredentialsPath());
        if (!Files.isRegularFile(credentialsPath)) {
            throw new MissingCredentialsException(
                "Google OAuth client credentials not found at " + credentialsPath.toAbsolutePath());
        }
        JsonNode clientSecrets = readJson(credentialsPath, "Google credentials");
        JsonNode installed = clientSecrets.has("installed") ? clientSecrets.get("installed") : clientSecrets.get("web");
        if (installed == null || !installed.hasNonNull("client_id") || !installed.hasNonNull("client_secret")) {
            throw new MissingCredentialsException(
                "Invalid Google credentials: expected installed.client_id and installed.client_secret in " + credentialsPath);
        }

        Path tokenPath = Paths.get(googleProperties.getTokenPath());
        if (!Files.isRegularFile(tokenPath)) {
            throw new MissingCredentialsException(
                "Google token not found at " + tokenPath.toAbsolutePath() + ". Authorize Gmail access before running the migration.");
        }
        JsonNode token = readJson(tokenPath, "Google token");
        if (!token.hasNonNull("access_token") && !token.hasNonNull("refresh_token")) {
            throw new MissingCredentialsException("Google token at " + tokenPath + " has neither access_token nor refresh_token");
        }

        String tokenUri = installed.hasNonNull("token_uri") ? installed.get("token_uri").asText() : DEFAULT_TOKEN_URI;
        Credential credential = new Credential.Builder(BearerToken.authorizationHeaderAccessMethod())
            .setTransport(httpTransport)
            .setJsonFactory(jsonFactory)
            .setTokenServerUrl(new GenericUrl(tokenUri))
            .setClientAuthentication(new ClientParametersAuthentication(
                installed.get("client_id").asText(), installed.get("client_secret").asText()))
            .build();
        if (token.hasNonNull("access_token")) {
            credential.setAccessToken(token.get("access_token").asText());
        }
        if (token.hasNonNull("refresh_token")) {
            credential.setRefreshToken(token.get("refresh_token").asText());
        }
        if (token.hasNonNull("expiry_date")) {
            credential.setExpirationTimeMilliseconds(token.get("expiry_date").asLong());
        }
        return credential;
    }

    private JsonNode readJson(Path path, String what) {
        try {
            return objectMapper.readTree(path.toFile());
        } catch (IOException e) {
            throw new MissingCredentialsException("Could not read " + what + " at " + path + ": " + e.getMessage(), e);
        }
    }
}
