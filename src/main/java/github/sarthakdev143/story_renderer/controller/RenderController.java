package github.sarthakdev143.story_renderer.controller;

import github.sarthakdev143.story_renderer.dto.RenderProjectRequest;
import github.sarthakdev143.story_renderer.model.RenderJob;
import github.sarthakdev143.story_renderer.model.RenderJobStatus;
import github.sarthakdev143.story_renderer.service.RenderService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Optional;

@RestController
@RequestMapping("/api/project/render")
public class RenderController {

    private static final Logger logger = LoggerFactory.getLogger(RenderController.class);

    private final RenderService renderService;

    public RenderController(RenderService renderService) {
        this.renderService = renderService;
    }

    @PostMapping
    public ResponseEntity<?> submit(@RequestBody(required = false) RenderProjectRequest project) {
        try {
            RenderJob job = renderService.submit(project);
            return ResponseEntity.accepted().body(job);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body("Invalid request: " + e.getMessage());
        } catch (Exception e) {
            logger.error("Render submission failed", e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body("Failed to queue render. Please try again.");
        }
    }

    /**
     * Looks the job up by id, then by the {@code projectId} hint, then treats the path value itself as a
     * project id.
     */
    @GetMapping("/{jobId}")
    public ResponseEntity<?> getStatus(
            @PathVariable String jobId,
            @RequestParam(value = "projectId", required = false) String projectId) {
        Optional<RenderJob> job = renderService.getJob(jobId);
        if (job.isEmpty() && projectId != null && !projectId.isBlank()) {
            job = renderService.getJobByProject(projectId.trim());
        }
        if (job.isEmpty()) {
            job = renderService.getJobByProject(jobId);
        }
        return job.<ResponseEntity<?>>map(ResponseEntity::ok)
                .orElseGet(() -> notFound(jobId));
    }

    @PostMapping("/{jobId}/cancel")
    public ResponseEntity<?> cancel(@PathVariable String jobId) {
        return stop(jobId, RenderJobStatus.CANCELLED);
    }

    @PostMapping("/{jobId}/pause")
    public ResponseEntity<?> pause(@PathVariable String jobId) {
        return stop(jobId, RenderJobStatus.PAUSED);
    }

    private ResponseEntity<?> stop(String jobId, RenderJobStatus target) {
        return renderService.requestStop(jobId, target)
                .<ResponseEntity<?>>map(ResponseEntity::ok)
                .orElseGet(() -> notFound(jobId));
    }

    private ResponseEntity<?> notFound(String jobId) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body("Job not found for id: " + jobId);
    }
}
