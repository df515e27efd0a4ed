package github.sarthakdev143.story_renderer.service;

import github.sarthakdev143.story_renderer.model.NarrationAudio;

import java.io.IOException;

public interface NarrationSynthesizer {

    NarrationAudio synthesizeNarration(String text, String voice) throws IOException;
}
