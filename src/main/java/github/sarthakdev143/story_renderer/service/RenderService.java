package github.sarthakdev143.story_renderer.service;

import github.sarthakdev143.story_renderer.dto.RenderProjectRequest;
import github.sarthakdev143.story_renderer.model.RenderJob;
import github.sarthakdev143.story_renderer.model.RenderJobStatus;

import java.util.Optional;

public interface RenderService {

    /**
     * Records a queued job and schedules it. Returns without waiting for the render.
     */
    RenderJob submit(RenderProjectRequest project);

    Optional<RenderJob> getJob(String jobId);

    Optional<RenderJob> getJobByProject(String projectId);

    /**
     * Asks a job to wind down toward {@link RenderJobStatus#CANCELLED} or {@link RenderJobStatus#PAUSED}.
     * Terminal jobs are returned unchanged.
     */
    Optional<RenderJob> requestStop(String jobId, RenderJobStatus targetStatus);
}
