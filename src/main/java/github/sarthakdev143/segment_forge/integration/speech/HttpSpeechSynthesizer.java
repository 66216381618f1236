package github.sarthakdev143.segment_forge.integration.speech;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import github.sarthakdev143.segment_forge.config.HttpClientConfig;
import github.sarthakdev143.segment_forge.config.SegmentForgeProperties;
import github.sarthakdev143.segment_forge.exception.SegmentFailureException;
import github.sarthakdev143.segment_forge.exception.StageTimeoutException;
import github.sarthakdev143.segment_forge.integration.media.MediaProbe;
import github.sarthakdev143.segment_forge.model.SpeechResult;
import github.sarthakdev143.segment_forge.model.VoiceoverConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.net.SocketTimeoutException;
import java.nio.file.Path;

/**
 * Calls the speech backend, which writes a wav file to the shared output volume and answers with
 * {@code {"audio_path", "duration_seconds"}}. The duration is probed when the backend omits it.
 */
@Component
public class HttpSpeechSynthesizer implements SpeechSynthesizer {

    private static final Logger logger = LoggerFactory.getLogger(HttpSpeechSynthesizer.class);

    private final RestClient speechClient;
    private final ObjectMapper objectMapper;
    private final MediaProbe mediaProbe;
    private final SegmentForgeProperties.Speech speech;

    public HttpSpeechSynthesizer(
            @Qualifier(HttpClientConfig.SPEECH_CLIENT) RestClient speechClient,
            ObjectMapper objectMapper,
            MediaProbe mediaProbe,
            SegmentForgeProperties properties) {
        this.speechClient = speechClient;
        this.objectMapper = objectMapper;
        this.mediaProbe = mediaProbe;
        this.speech = properties.speech();
    }

    @Override
    public SpeechResult synthesize(VoiceoverConfig voiceover) throws SegmentFailureException, InterruptedException {
        if (voiceover == null || voiceover.text() == null || voiceover.text().isBlank()) {
            throw new IllegalArgumentException("voiceover text is required.");
        }

        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("text", voiceover.text());
        payload.put("voice", voiceover.voice());
        payload.put("speed", voiceover.speed());

        logger.info(
                "Synthesizing {} chars of narration voice={} speed={}",
                voiceover.text().length(),
                voiceover.voice(),
                voiceover.speed());

        JsonNode response;
        try {
            response = speechClient.post()
                    .uri("/synthesize")
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(payload)
                    .retrieve()
                    .body(JsonNode.class);
        } catch (ResourceAccessException e) {
            if (e.getCause() instanceof SocketTimeoutException) {
                throw new StageTimeoutException("speech synthesis", speech.timeout(), e);
            }
            throw new SegmentFailureException("Speech synthesis request failed: " + e.getMessage(), e);
        } catch (RestClientException e) {
            throw new SegmentFailureException("Speech synthesis request failed: " + e.getMessage(), e);
        }

        if (response == null || response.path("audio_path").asText("").isBlank()) {
            throw new SegmentFailureException("Speech synthesis response did not include an audio_path.");
        }

        Path audioPath = Path.of(response.get("audio_path").asText());
        double durationSeconds = response.path("duration_seconds").asDouble(0.0);
        if (durationSeconds <= 0.0) {
            durationSeconds = mediaProbe.durationSeconds(audioPath);
        }
        return new SpeechResult(audioPath, durationSeconds);
    }
}
