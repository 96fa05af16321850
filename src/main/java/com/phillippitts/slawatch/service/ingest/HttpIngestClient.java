package com.phillippitts.slawatch.service.ingest;

import com.phillippitts.slawatch.config.properties.IngestProperties;
import com.phillippitts.slawatch.domain.TelemetryEvent;
import com.phillippitts.slawatch.exception.IngestException;
import com.phillippitts.slawatch.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONObject;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;

/**
 * {@link IngestClient} that POSTs JSON arrays to an Axiom-compatible dataset ingest endpoint
 * ({@code {base-url}/v1/datasets/{dataset}/ingest}) with bearer-token authentication.
 *
 * <p>Status mapping:
 * <ul>
 *   <li>401, 403 → {@link IngestException.Kind#AUTH}</li>
 *   <li>429 → {@link IngestException.Kind#RATE_LIMIT}</li>
 *   <li>5xx → {@link IngestException.Kind#SERVER}</li>
 *   <li>other 4xx → {@link IngestException.Kind#VALIDATION}</li>
 *   <li>connection/read failure → {@link IngestException.Kind#NETWORK}</li>
 * </ul>
 */
public class HttpIngestClient implements IngestClient {

    private static final Logger LOG = LogManager.getLogger(HttpIngestClient.class);
    private static final String ORG_ID_HEADER = "X-Axiom-Org-Id";
    private static final int MAX_LOGGED_BODY = 200;

    private final RestTemplate restTemplate;
    private final IngestProperties props;
    private final Clock clock;
    private final String endpoint;

    public HttpIngestClient(RestTemplate restTemplate, IngestProperties props, Clock clock) {
        this.restTemplate = Objects.requireNonNull(restTemplate, "restTemplate");
        this.props = Objects.requireNonNull(props, "props");
        this.clock = Objects.requireNonNull(clock, "clock");
        String base = props.getBaseUrl().endsWith("/")
                ? props.getBaseUrl().substring(0, props.getBaseUrl().length() - 1)
                : props.getBaseUrl();
        this.endpoint = base + "/" + API_VERSION + "/datasets/" + props.getDataset() + "/ingest";
        if (props.getToken() == null || props.getToken().isBlank()) {
            LOG.warn("No ingest token configured; remote deliveries will be rejected (set AXIOM_TOKEN)");
        }
        LOG.info("Ingest client initialized (v{}, API {}, endpoint={}, token={})",
                VERSION, API_VERSION, endpoint, LogSanitizer.maskSecret(props.getToken()));
    }

    @Override
    public void ingest(TelemetryEvent event) {
        Objects.requireNonNull(event, "event");
        JSONArray body = new JSONArray().put(toJson(event));
        post(body, "event " + event.id());
    }

    @Override
    public void probe() {
        JSONObject check = new JSONObject();
        check.put("health_check", true);
        check.put("_metadata", metadata());
        post(new JSONArray().put(check), "health probe");
    }

    /** Visible for tests */
    String endpoint() {
        return endpoint;
    }

    JSONObject toJson(TelemetryEvent event) {
        JSONObject obj = new JSONObject();
        obj.put("id", event.id());
        obj.put("channel", event.channel());
        obj.put("kind", event.kind().name());
        obj.put("_time", event.timestamp().toString());
        obj.put("payload", new JSONObject(event.payload()));
        obj.put("_metadata", metadata());
        return obj;
    }

    private JSONObject metadata() {
        JSONObject meta = new JSONObject();
        meta.put("version", VERSION);
        meta.put("api_version", API_VERSION);
        meta.put("protocol", PROTOCOL);
        meta.put("timestamp", Instant.now(clock).toString());
        return meta;
    }

    private void post(JSONArray body, String what) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        if (props.getToken() != null && !props.getToken().isBlank()) {
            headers.setBearerAuth(props.getToken());
        }
        if (props.getOrgId() != null && !props.getOrgId().isBlank()) {
            headers.set(ORG_ID_HEADER, props.getOrgId());
        }
        try {
            restTemplate.exchange(endpoint, HttpMethod.POST, new HttpEntity<>(body.toString(), headers), String.class);
            LOG.debug("Ingest of {} acknowledged", what);
        } catch (RestClientResponseException e) {
            IngestException.Kind kind = classify(e.getStatusCode());
            String responseBody = LogSanitizer.truncate(e.getResponseBodyAsString(), MAX_LOGGED_BODY);
            throw new IngestException(kind, "Ingest of " + what + " failed with HTTP "
                    + e.getStatusCode().value() + ": " + responseBody, e);
        } catch (ResourceAccessException e) {
            throw new IngestException(IngestException.Kind.NETWORK, "Ingest of " + what + " failed: " + e.getMessage(), e);
        } catch (RestClientException e) {
            throw new IngestException(IngestException.Kind.SERVER, "Ingest of " + what + " failed: " + e.getMessage(), e);
        }
    }

    static IngestException.Kind classify(HttpStatusCode status) {
        int code = status.value();
        if (code == 401 || code == 403) {
            return IngestException.Kind.AUTH;
        }
        if (code == 429) {
            return IngestException.Kind.RATE_LIMIT;
        }
        if (status.is5xxServerError()) {
            return IngestException.Kind.SERVER;
        }
        return IngestException.Kind.VALIDATION;
    }
}
