package github.sarthakdev143.story_renderer.integration.storage;

import github.sarthakdev143.story_renderer.model.RenderJob;
import github.sarthakdev143.story_renderer.service.DurableStore;

import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;

/**
 * Durable store used when no object storage is configured: jobs live only on local disk and artifacts
 * are served locally.
 */
public class LocalOnlyDurableStore implements DurableStore {

    @Override
    public boolean isEnabled() {
        return false;
    }

    @Override
    public void putJob(RenderJob job) {
    }

    @Override
    public Optional<RenderJob> getJob(String jobId) {
        return Optional.empty();
    }

    @Override
    public void putIndex(Map<String, String> projectIndex) {
    }

    @Override
    public Map<String, String> getIndex() {
        return Map.of();
    }

    @Override
    public Optional<String> uploadArtifact(Path artifact, String projectKey) {
        return Optional.empty();
    }
}
