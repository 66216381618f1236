package github.sarthakdev143.segment_forge.integration.render;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import github.sarthakdev143.segment_forge.config.HttpClientConfig;
import github.sarthakdev143.segment_forge.config.SegmentForgeProperties;
import github.sarthakdev143.segment_forge.exception.ScriptPlanningException;
import github.sarthakdev143.segment_forge.exception.SegmentFailureException;
import github.sarthakdev143.segment_forge.exception.StageTimeoutException;
import github.sarthakdev143.segment_forge.model.SegmentType;
import github.sarthakdev143.segment_forge.model.render.RenderOutcome;
import github.sarthakdev143.segment_forge.model.render.RenderRequest;
import github.sarthakdev143.segment_forge.model.visual.SimulationSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.StreamUtils;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

/**
 * Talks to the animation, manim and simulation backends over their shared JSON contract:
 * {@code POST /preview-script} returns {@code {"script"}}, {@code POST /generate} returns
 * {@code {"video_path", "script"}}, and a 422 from {@code /generate} carries the script that failed.
 */
@Component
public class HttpVisualRenderer implements VisualRenderer {

    private static final Logger logger = LoggerFactory.getLogger(HttpVisualRenderer.class);

    private final RestClient previewClient;
    private final RestClient renderClient;
    private final ObjectMapper objectMapper;
    private final SegmentForgeProperties.Renderers renderers;

    public HttpVisualRenderer(
            @Qualifier(HttpClientConfig.PREVIEW_CLIENT) RestClient previewClient,
            @Qualifier(HttpClientConfig.RENDER_CLIENT) RestClient renderClient,
            ObjectMapper objectMapper,
            SegmentForgeProperties properties) {
        this.previewClient = previewClient;
        this.renderClient = renderClient;
        this.objectMapper = objectMapper;
        this.renderers = properties.renderers();
    }

    @Override
    public String generateScript(RenderRequest request) throws SegmentFailureException {
        if (!request.category().supportsScriptPreview()) {
            throw new IllegalArgumentException(
                    request.category().toApiValue() + " segments do not support script preview.");
        }

        String url = baseUrl(request.category()) + "/preview-script";
        logger.info("Requesting script preview from {} for '{}'", url, request.title());
        BackendResponse response;
        try {
            response = post(previewClient, url, buildPayload(request));
        } catch (ResourceAccessException e) {
            throw timeoutOr(e, "script preview", renderers.previewTimeout(),
                    new ScriptPlanningException("Script preview request failed: " + e.getMessage(), e));
        } catch (RestClientException e) {
            throw new ScriptPlanningException("Script preview request failed: " + e.getMessage(), e);
        }

        if (!response.status().is2xxSuccessful()) {
            throw new ScriptPlanningException(
                    "Script preview returned " + response.status().value() + ": " + response.body());
        }

        String script = readTree(response.body()).path("script").asText("");
        if (script.isBlank()) {
            throw new ScriptPlanningException("Script preview returned no script.");
        }
        return script;
    }

    @Override
    public RenderOutcome render(RenderRequest request) throws SegmentFailureException {
        String url = baseUrl(request.category()) + "/generate";
        logger.info(
                "Requesting {} render from {} for '{}' duration={}s scripted={}",
                request.category().toApiValue(),
                url,
                request.title(),
                request.durationSeconds(),
                request.script() != null);

        BackendResponse response;
        try {
            response = post(renderClient, url, buildPayload(request));
        } catch (ResourceAccessException e) {
            throw timeoutOr(e, "render", renderers.renderTimeout(),
                    new SegmentFailureException("Render request failed: " + e.getMessage(), e));
        } catch (RestClientException e) {
            throw new SegmentFailureException("Render request failed: " + e.getMessage(), e);
        }

        if (response.status().value() == HttpStatus.UNPROCESSABLE_ENTITY.value()) {
            JsonNode body = readTreeOrNull(response.body());
            String script = body == null ? "" : body.path("script").asText("");
            if (!script.isBlank()) {
                String error = body.path("detail").asText("Script execution failed.");
                return new RenderOutcome.ScriptOnly(script, error);
            }
        }

        if (!response.status().is2xxSuccessful()) {
            throw new SegmentFailureException(
                    "Renderer returned " + response.status().value() + ": " + response.body());
        }

        JsonNode body = readTree(response.body());
        String videoPath = body.path("video_path").asText("");
        if (videoPath.isBlank()) {
            throw new SegmentFailureException("Renderer response did not include a video_path.");
        }
        String scriptUsed = body.hasNonNull("script") ? body.get("script").asText() : request.script();
        return new RenderOutcome.Rendered(Path.of(videoPath), scriptUsed);
    }

    ObjectNode buildPayload(RenderRequest request) {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("description", request.description());
        if (request.title() != null) {
            payload.put("title", request.title());
        }
        payload.put("duration_seconds", request.durationSeconds());
        ObjectNode metadata = payload.putObject("metadata");
        for (Map.Entry<String, Object> entry : request.spec().metadata().entrySet()) {
            metadata.set(entry.getKey(), objectMapper.valueToTree(entry.getValue()));
        }
        if (request.spec() instanceof SimulationSpec simulation && simulation.simulationType() != null) {
            payload.put("simulation_type", simulation.simulationType());
        }
        if (request.script() != null) {
            payload.put("script", request.script());
        }
        if (request.previousError() != null) {
            payload.put("previous_error", request.previousError());
        }
        return payload;
    }

    String baseUrl(SegmentType category) {
        String url = switch (category) {
            case ANIMATION -> renderers.animationUrl();
            case PYSIM -> renderers.pysimUrl();
            case MANIM, TRANSITION -> renderers.manimUrl();
        };
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    private BackendResponse post(RestClient client, String url, ObjectNode payload) {
        return client.post()
                .uri(url)
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.APPLICATION_JSON)
                .body(payload)
                .exchange((clientRequest, clientResponse) -> new BackendResponse(
                        clientResponse.getStatusCode(),
                        StreamUtils.copyToString(clientResponse.getBody(), StandardCharsets.UTF_8)));
    }

    private SegmentFailureException timeoutOr(
            ResourceAccessException e,
            String stage,
            Duration timeout,
            SegmentFailureException otherwise) {
        if (e.getCause() instanceof SocketTimeoutException) {
            return new StageTimeoutException(stage, timeout, e);
        }
        return otherwise;
    }

    private JsonNode readTree(String body) throws SegmentFailureException {
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new SegmentFailureException("Renderer returned malformed JSON: " + e.getOriginalMessage(), e);
        }
    }

    private JsonNode readTreeOrNull(String body) {
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            logger.debug("Ignoring non-JSON error body from renderer", e);
            return null;
        }
    }

    private record BackendResponse(HttpStatusCode status, String body) {
    }
}
