package github.sarthakdev143.segment_forge.integration.speech;

import github.sarthakdev143.segment_forge.exception.SegmentFailureException;
import github.sarthakdev143.segment_forge.model.SpeechResult;
import github.sarthakdev143.segment_forge.model.VoiceoverConfig;

public interface SpeechSynthesizer {

    SpeechResult synthesize(VoiceoverConfig voiceover) throws SegmentFailureException, InterruptedException;
}
