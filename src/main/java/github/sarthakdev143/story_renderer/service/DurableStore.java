package github.sarthakdev143.story_renderer.service;

import github.sarthakdev143.story_renderer.model.RenderJob;

import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;

/**
 * Optional remote mirror of job records and rendered artifacts.
 */
public interface DurableStore {

    boolean isEnabled();

    void putJob(RenderJob job);

    Optional<RenderJob> getJob(String jobId);

    void putIndex(Map<String, String> projectIndex);

    Map<String, String> getIndex();

    /**
     * Uploads a finished artifact and returns its public URL, or empty when uploading is unavailable.
     */
    Optional<String> uploadArtifact(Path artifact, String projectKey);
}
