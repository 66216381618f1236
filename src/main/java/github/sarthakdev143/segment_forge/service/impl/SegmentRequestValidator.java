package github.sarthakdev143.segment_forge.service.impl;

import github.sarthakdev143.segment_forge.config.SegmentForgeProperties;
import github.sarthakdev143.segment_forge.dto.CreateJobRequest;
import github.sarthakdev143.segment_forge.dto.SegmentRequest;
import github.sarthakdev143.segment_forge.dto.SegmentUpdateRequest;
import github.sarthakdev143.segment_forge.dto.VoiceoverRequest;
import github.sarthakdev143.segment_forge.model.Segment;
import github.sarthakdev143.segment_forge.model.SegmentType;
import github.sarthakdev143.segment_forge.model.SegmentUpdate;
import github.sarthakdev143.segment_forge.model.VoiceoverConfig;
import github.sarthakdev143.segment_forge.model.visual.AnimationSpec;
import github.sarthakdev143.segment_forge.model.visual.ManimSpec;
import github.sarthakdev143.segment_forge.model.visual.SimulationSpec;
import github.sarthakdev143.segment_forge.model.visual.TransitionSpec;
import github.sarthakdev143.segment_forge.model.visual.VisualSpec;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Validates incoming segment plans and edits and turns them into domain objects.
 */
@Component
public class SegmentRequestValidator {

    private static final int MAX_SEGMENTS = 100;
    private static final int MAX_TITLE_LENGTH = 200;
    private static final double MAX_VOICE_SPEED = 4.0;

    private final SegmentForgeProperties.Speech speech;

    public SegmentRequestValidator(SegmentForgeProperties properties) {
        this.speech = properties.speech();
    }

    public List<Segment> toSegments(CreateJobRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("request body is required.");
        }

        List<SegmentRequest> segments = request.segments();
        if (segments == null || segments.isEmpty()) {
            throw new IllegalArgumentException("segments must contain at least one segment.");
        }
        if (segments.size() > MAX_SEGMENTS) {
            throw new IllegalArgumentException("segments supports at most " + MAX_SEGMENTS + " segments.");
        }

        List<Segment> result = new ArrayList<>();
        for (int index = 0; index < segments.size(); index++) {
            result.add(toSegment(index, segments.get(index)));
        }
        return result;
    }

    public SegmentUpdate toUpdate(SegmentUpdateRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("request body is required.");
        }

        String field = "segment";
        String title = request.title() == null ? null : validateTitle(field, request.title());
        String description = null;
        if (request.description() != null) {
            if (request.description().isBlank()) {
                throw new IllegalArgumentException(field + ".description must not be blank.");
            }
            description = request.description().trim();
        }

        VisualSpec visualSpec = null;
        boolean visualParametersGiven = request.style() != null
                || request.simulationType() != null
                || request.conclusion() != null;
        if (request.type() != null) {
            visualSpec = buildVisualSpec(
                    field,
                    request.type(),
                    request.style(),
                    request.simulationType(),
                    request.conclusion());
        } else if (visualParametersGiven) {
            throw new IllegalArgumentException(field + ".type is required when changing visual parameters.");
        }

        VoiceoverConfig voiceover = request.voiceover() == null ? null : toVoiceover(field, request.voiceover());
        SegmentUpdate update = new SegmentUpdate(title, description, visualSpec, voiceover, request.order());
        if (update.isEmpty()) {
            throw new IllegalArgumentException("At least one field must be updated.");
        }
        return update;
    }

    private Segment toSegment(int index, SegmentRequest request) {
        String field = "segments[" + index + "]";
        if (request == null) {
            throw new IllegalArgumentException(field + " must not be null.");
        }

        VisualSpec visualSpec = buildVisualSpec(
                field,
                request.type(),
                request.style(),
                request.simulationType(),
                request.conclusion());

        String title = request.title() == null ? null : validateTitle(field, request.title());
        if (request.description() == null || request.description().isBlank()) {
            throw new IllegalArgumentException(field + ".description is required.");
        }

        VoiceoverConfig voiceover = request.voiceover() == null ? null : toVoiceover(field, request.voiceover());
        if (visualSpec.type() == SegmentType.TRANSITION && voiceover == null) {
            throw new IllegalArgumentException(field + ": transition segments require a voiceover.");
        }

        return new Segment(title, request.description().trim(), voiceover, visualSpec);
    }

    private VisualSpec buildVisualSpec(
            String field,
            String typeInput,
            String style,
            String simulationType,
            Boolean conclusionInput) {
        SegmentType type;
        try {
            type = SegmentType.fromInput(typeInput);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(field + "." + e.getMessage(), e);
        }

        boolean conclusion = Boolean.TRUE.equals(conclusionInput);
        return switch (type) {
            case ANIMATION -> new AnimationSpec(trimToNull(style));
            case MANIM -> new ManimSpec(trimToNull(style), conclusion);
            case PYSIM -> new SimulationSpec(trimToNull(simulationType), conclusion);
            case TRANSITION -> new TransitionSpec(conclusion);
        };
    }

    private VoiceoverConfig toVoiceover(String field, VoiceoverRequest voiceover) {
        if (voiceover.text() == null || voiceover.text().isBlank()) {
            throw new IllegalArgumentException(field + ".voiceover.text is required.");
        }

        double speed = speech.defaultSpeed();
        if (voiceover.speed() != null) {
            speed = voiceover.speed();
            if (speed <= 0.0 || speed > MAX_VOICE_SPEED) {
                throw new IllegalArgumentException(
                        field + ".voiceover.speed must be greater than 0 and at most " + MAX_VOICE_SPEED + ".");
            }
        }

        String voice = voiceover.voice() == null || voiceover.voice().isBlank()
                ? speech.defaultVoice()
                : voiceover.voice().trim();
        return new VoiceoverConfig(voiceover.text().trim(), voice, speed);
    }

    private String validateTitle(String field, String title) {
        String trimmed = title.trim();
        if (trimmed.length() > MAX_TITLE_LENGTH) {
            throw new IllegalArgumentException(
                    field + ".title must be at most " + MAX_TITLE_LENGTH + " characters.");
        }
        return trimmed;
    }

    private String trimToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
