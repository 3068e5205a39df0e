package front.migrator.app.service;

import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import front.migrator.app.model.FrontConversation;
import front.migrator.app.model.FrontInbox;
import front.migrator.app.model.FrontMessage;
import front.migrator.app.model.FrontPage;
import front.migrator.app.model.FrontTag;
import front.migrator.app.support.AdmissionLimiter;
import front.migrator.app.support.RemoteCallResult;
import front.migrator.app.support.RetryPolicy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;
import org.springframework.web.util.UriUtils;

import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

@Slf4j
public class FrontService implements FrontApiService {
    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final String baseUrl;
    private final int pageSize;
    private final AdmissionLimiter limiter;
    private final RetryPolicy retryPolicy;

    public FrontService(RestTemplate restTemplate, ObjectMapper objectMapper, String baseUrl, int pageSize,
                        AdmissionLimiter limiter, RetryPolicy retryPolicy) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.baseUrl = baseUrl;
        this.pageSize = pageSize;
        this.limiter = limiter;
        this.retryPolicy = retryPolicy;
    }

    @Override
    public Stream<FrontConversation> streamConversations(String inboxId) {
        Iterator<FrontConversation> iterator = new ConversationIterator(inboxId);
        return StreamSupport.stream(Spliterators.spliteratorUnknownSize(iterator, Spliterator.ORDERED), false);
    }

    @Override
    public List<FrontConversation> listAllConversations(String inboxId) {
        List<FrontConversation> all = new ArrayList<>();
        String pageToken = null;
        do {
            FrontPage<FrontConversation> page = fetchConversationPage(inboxId, pageToken);
            all.addAll(page.getResults());
            pageToken = page.getNextPageToken();
            if (page.hasNext()) {
                log.info("Fetched {} conversations...", all.size());
            }
        } while (pageToken != null);
        return all;
    }

    @Override
    public List<FrontInbox> listInboxes() {
        JsonNode body = get("listInboxes", uri("/inboxes").build().toUri());
        return readResults(body, FrontInbox.class);
    }

    @Override
    public List<FrontTag> listTags() {
        JsonNode body = get("listTags", uri("/tags").build().toUri());
        return readResults(body, FrontTag.class);
    }

    @Override
    public List<FrontMessage> listConversationMessages(String conversationId) {
        URI target = uri("/conversations/{id}/messages").buildAndExpand(conversationId).toUri();
        JsonNode body = get("listConversationMessages", target);
        return readResults(body, FrontMessage.class);
    }

    FrontPage<FrontConversation> fetchConversationPage(String inboxId, String pageToken) {
        Map<String, Object> variables = new HashMap<>();
        UriComponentsBuilder builder;
        if (inboxId != null && !inboxId.isBlank()) {
            builder = uri("/inboxes/{inboxId}/conversations");
            variables.put("inboxId", inboxId);
        } else {
            builder = uri("/conversations");
        }
        builder.queryParam("limit", pageSize)
            .queryParam("include_messages", true);
        if (pageToken != null) {
            builder.queryParam("page_token", "{pageToken}");
            variables.put("pageToken", pageToken);
        }
        URI target = builder.encode().buildAndExpand(variables).toUri();

        JsonNode body = get("listConversations", target);
        List<FrontConversation> conversations = readResults(body, FrontConversation.class);
        return new FrontPage<>(conversations, nextPageToken(body));
    }

    /**
     * Front returns the next page as a full URL; the cursor is its page_token parameter.
     */
    static String nextPageToken(JsonNode body) {
        JsonNode next = body.path("_pagination").path("next");
        if (next.isMissingNode() || next.isNull() || next.asText().isBlank()) {
            return null;
        }
        String value = next.asText();
        if (!value.startsWith("http")) {
            return value;
        }
        String token = UriComponentsBuilder.fromUriString(value).build().getQueryParams().getFirst("page_token");
        return token == null || token.isBlank() ? null : UriUtils.decode(token, StandardCharsets.UTF_8);
    }

    private UriComponentsBuilder uri(String path) {
        return UriComponentsBuilder.fromHttpUrl(baseUrl).path(path);
    }

    private JsonNode get(String description, URI target) {
        return retryPolicy.execute(description, () -> attemptGet(description, target));
    }

    private RemoteCallResult<JsonNode> attemptGet(String description, URI target) {
        try {
            ResponseEntity<String> response = limiter.call(() -> restTemplate.getForEntity(target, String.class));
            String body = response.getBody();
            if (body == null || body.isEmpty()) {
                return RemoteCallResult.fatal(new FrontApiException(
                    "Front " + description + " returned an empty body", response.getStatusCode().value(), null));
            }
            return RemoteCallResult.success(objectMapper.readTree(body));
        } catch (HttpStatusCodeException e) {
            return classify(description, e);
        } catch (ResourceAccessException e) {
            // Connection reset, timeout, DNS failure
            return RemoteCallResult.retryable(new FrontApiException(
                "Front " + description + " I/O failure: " + e.getMessage(), 0, e));
        } catch (IOException e) {
            return RemoteCallResult.fatal(new FrontApiException(
                "Front " + description + " returned malformed JSON: " + e.getMessage(), 0, e));
        } catch (RestClientException e) {
            return RemoteCallResult.fatal(new FrontApiException(
                "Front " + description + " failed: " + e.getMessage(), 0, e));
        }
    }

    RemoteCallResult<JsonNode> classify(String description, HttpStatusCodeException e) {
        HttpStatusCode status = e.getStatusCode();
        if (status.value() == 401) {
            return RemoteCallResult.fatal(new SourceAuthException(
                "FRONT_AUTH_401: " + authMessage(e), e));
        }
        FrontApiException error = new FrontApiException(
            "Front " + description + " failed with HTTP " + status.value() + ": " + e.getStatusText(), status.value(), e);
        if (status.value() == 429 || status.is5xxServerError()) {
            return RemoteCallResult.retryable(error);
        }
        return RemoteCallResult.fatal(error);
    }

    private String authMessage(HttpStatusCodeException e) {
        try {
            JsonNode body = objectMapper.readTree(e.getResponseBodyAsString());
            String message = body == null ? null : body.path("_error").path("message").asText(null);
            return message != null ? message : "Unauthorized";
        } catch (IOException parseFailure) {
            return "Unauthorized";
        }
    }

    private <T> List<T> readResults(JsonNode body, Class<T> type) {
        JsonNode results = body.path("_results");
        if (!results.isArray()) {
            return Collections.emptyList();
        }
        JavaType listType = objectMapper.getTypeFactory().constructCollectionType(List.class, type);
        try {
            return objectMapper.readerFor(listType).readValue(results);
        } catch (IOException e) {
            throw new FrontApiException("Could not decode Front " + type.getSimpleName() + " results: " + e.getMessage(), 0, e);
        }
    }

    /**
     * Fetches the next page only once the previous one has been consumed.
     */
    private class ConversationIterator implements Iterator<FrontConversation> {
        private final String inboxId;
        private Iterator<FrontConversation> current = Collections.emptyIterator();
        private String nextPageToken;
        private boolean exhausted;
        private boolean started;
        private int fetched;

        ConversationIterator(String inboxId) {
            this.inboxId = inboxId;
        }

        @Override
        public boolean hasNext() {
            while (!current.hasNext()) {
                if (exhausted) {
                    return false;
                }
                FrontPage<FrontConversation> page = fetchConversationPage(inboxId, started ? nextPageToken : null);
                started = true;
                fetched += page.getResults().size();
                current = page.getResults().iterator();
                nextPageToken = page.getNextPageToken();
                if (page.hasNext()) {
                    log.info("Fetched {} conversations...", fetched);
                } else {
                    exhausted = true;
                }
            }
            return true;
        }

        @Override
        public FrontConversation next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            return current.next();
        }
    }
}
