package github.sarthakdev143.story_renderer.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Public shape of one render attempt. {@code videoUrl} is only set once completed and
 * {@code error} only once failed.
 */
public record RenderJob(
        String id,
        RenderJobStatus status,
        String projectId,
        int progress,
        String videoUrl,
        String error) {

    public RenderJob {
        progress = Math.max(0, Math.min(100, progress));
    }

    public static RenderJob queued(String id, String projectId) {
        return new RenderJob(id, RenderJobStatus.QUEUED, projectId, 0, null, null);
    }

    @JsonIgnore
    public boolean isTerminal() {
        return status != null && status.isTerminal();
    }

    public RenderJob rendering(int progress) {
        return new RenderJob(id, RenderJobStatus.RENDERING, projectId, progress, null, null);
    }

    public RenderJob withProgress(int progress) {
        return new RenderJob(id, status, projectId, progress, videoUrl, error);
    }

    public RenderJob stopping(RenderJobStatus interimStatus) {
        return new RenderJob(id, interimStatus, projectId, progress, null, null);
    }

    public RenderJob stopped(RenderJobStatus targetStatus) {
        return new RenderJob(id, targetStatus, projectId, progress, null, null);
    }

    public RenderJob completed(String videoUrl) {
        return new RenderJob(id, RenderJobStatus.COMPLETED, projectId, 100, videoUrl, null);
    }

    public RenderJob failed(String error) {
        return new RenderJob(id, RenderJobStatus.FAILED, projectId, 100, null, error);
    }
}
