package github.sarthakdev143.story_renderer.service.impl;

import github.sarthakdev143.story_renderer.dto.RenderProjectRequest;
import github.sarthakdev143.story_renderer.dto.RenderSceneRequest;
import github.sarthakdev143.story_renderer.model.Orientation;
import github.sarthakdev143.story_renderer.model.composition.RenderProjectPlan;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.util.List;
import java.util.Locale;

@Component
public class RenderProjectValidator {

    static final int MAX_SCENES = 100;
    private static final int MAX_PROJECT_ID_LENGTH = 128;

    public RenderProjectPlan normalizeAndValidate(RenderProjectRequest project) {
        if (project == null) {
            throw new IllegalArgumentException("project is required.");
        }

        List<RenderSceneRequest> scenes = project.scenes();
        if (scenes.isEmpty()) {
            throw new IllegalArgumentException("project.scenes must contain at least one scene.");
        }
        if (scenes.size() > MAX_SCENES) {
            throw new IllegalArgumentException("project.scenes supports at most " + MAX_SCENES + " scenes.");
        }

        for (int index = 0; index < scenes.size(); index++) {
            RenderSceneRequest scene = scenes.get(index);
            if (scene == null) {
                throw new IllegalArgumentException("project.scenes[" + index + "] must not be null.");
            }
            validateMediaUrl(index, scene.mediaUrl());
        }

        return new RenderProjectPlan(
                normalizeProjectId(project.id()),
                Orientation.fromInput(project.format()),
                blankToNull(project.voiceModel()),
                blankToNull(project.captionStyle()),
                scenes);
    }

    private String normalizeProjectId(String projectId) {
        String normalized = blankToNull(projectId);
        if (normalized != null && normalized.length() > MAX_PROJECT_ID_LENGTH) {
            throw new IllegalArgumentException("project.id must be at most " + MAX_PROJECT_ID_LENGTH + " characters.");
        }
        return normalized;
    }

    private void validateMediaUrl(int index, String mediaUrl) {
        if (mediaUrl == null) {
            return;
        }

        URI uri;
        try {
            uri = URI.create(mediaUrl);
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("project.scenes[" + index + "].media.url is not a valid URL.", ex);
        }

        String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
        if (!scheme.equals("http") && !scheme.equals("https")) {
            throw new IllegalArgumentException("project.scenes[" + index + "].media.url must use http or https.");
        }
        if (uri.getHost() == null || uri.getHost().isBlank()) {
            throw new IllegalArgumentException("project.scenes[" + index + "].media.url must include a host.");
        }
    }

    private String blankToNull(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return value.trim();
    }
}
