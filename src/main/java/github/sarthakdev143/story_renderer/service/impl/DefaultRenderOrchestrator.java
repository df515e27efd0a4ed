package github.sarthakdev143.story_renderer.service.impl;

import github.sarthakdev143.story_renderer.config.RenderExecutorConfig;
import github.sarthakdev143.story_renderer.config.RenderProperties;
import github.sarthakdev143.story_renderer.dto.RenderProjectRequest;
import github.sarthakdev143.story_renderer.dto.RenderSceneRequest;
import github.sarthakdev143.story_renderer.exception.CaptionTimingException;
import github.sarthakdev143.story_renderer.exception.CompositionException;
import github.sarthakdev143.story_renderer.exception.MissingAudioException;
import github.sarthakdev143.story_renderer.exception.RenderCancelledException;
import github.sarthakdev143.story_renderer.exception.RenderException;
import github.sarthakdev143.story_renderer.model.CaptionWord;
import github.sarthakdev143.story_renderer.model.NarrationAudio;
import github.sarthakdev143.story_renderer.model.Orientation;
import github.sarthakdev143.story_renderer.model.RenderJob;
import github.sarthakdev143.story_renderer.model.RenderJobStatus;
import github.sarthakdev143.story_renderer.model.composition.PreparedScene;
import github.sarthakdev143.story_renderer.model.composition.RenderProjectPlan;
import github.sarthakdev143.story_renderer.service.CaptionTimer;
import github.sarthakdev143.story_renderer.service.DurableStore;
import github.sarthakdev143.story_renderer.service.MediaAcquirer;
import github.sarthakdev143.story_renderer.service.NarrationSynthesizer;
import github.sarthakdev143.story_renderer.service.RenderCancellationToken;
import github.sarthakdev143.story_renderer.service.RenderService;
import github.sarthakdev143.story_renderer.service.SceneCompositor;
import github.sarthakdev143.story_renderer.service.SubtitleTrackBuilder;
import github.sarthakdev143.story_renderer.service.TimelineAssembler;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.function.UnaryOperator;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Owns the render job table. Jobs run one at a time on the render job executor; inside a job, scene
 * preparation and clip rendering fan out over a small per-job pool and are put back into declared scene
 * order before assembly.
 *
 * <p>The job table and the project index are only touched while holding {@code lock}. Every accepted
 * transition is written to disk (and mirrored remotely) before the lock is released, and a job that has
 * reached a terminal status is never changed again.
 */
@Service
public class DefaultRenderOrchestrator implements RenderService {

    private static final Logger logger = LoggerFactory.getLogger(DefaultRenderOrchestrator.class);
    static final int PROGRESS_STARTED = 5;
    static final int PROGRESS_SCENES_PREPARED = 60;
    static final int PROGRESS_SUBTITLES_BUILT = 65;
    static final int PROGRESS_CLIPS_RENDERED = 90;
    static final String UNEXPECTED_TERMINATION_ERROR = "Render terminated unexpectedly.";
    private static final long POOL_DRAIN_TIMEOUT_MINUTES = 15;
    private static final int PROJECT_KEY_HASH_LENGTH = 12;
    private static final Pattern SAFE_PROJECT_KEY = Pattern.compile("[A-Za-z0-9_-]+");

    private final RenderProperties properties;
    private final RenderProjectValidator validator;
    private final RenderJobStore jobStore;
    private final NarrationSynthesizer narrationSynthesizer;
    private final CaptionTimer captionTimer;
    private final MediaAcquirer mediaAcquirer;
    private final SubtitleTrackBuilder subtitleTrackBuilder;
    private final SceneCompositor sceneCompositor;
    private final TimelineAssembler timelineAssembler;
    private final DurableStore durableStore;
    private final TaskExecutor taskExecutor;
    private final MeterRegistry meterRegistry;

    private final Object lock = new Object();
    private final Map<String, RenderJob> jobs = new HashMap<>();
    private final Map<String, String> projectJobs = new LinkedHashMap<>();
    private final Map<String, RenderCancellationToken> cancellationTokens = new ConcurrentHashMap<>();

    private final Counter submittedCounter;
    private final Counter completedCounter;
    private final Counter failedCounter;
    private final Counter captionFallbackCounter;

    public DefaultRenderOrchestrator(
            RenderProperties properties,
            RenderProjectValidator validator,
            RenderJobStore jobStore,
            NarrationSynthesizer narrationSynthesizer,
            CaptionTimer captionTimer,
            MediaAcquirer mediaAcquirer,
            SubtitleTrackBuilder subtitleTrackBuilder,
            SceneCompositor sceneCompositor,
            TimelineAssembler timelineAssembler,
            DurableStore durableStore,
            @Qualifier(RenderExecutorConfig.RENDER_JOB_EXECUTOR) TaskExecutor taskExecutor,
            MeterRegistry meterRegistry) {
        this.properties = properties;
        this.validator = validator;
        this.jobStore = jobStore;
        this.narrationSynthesizer = narrationSynthesizer;
        this.captionTimer = captionTimer;
        this.mediaAcquirer = mediaAcquirer;
        this.subtitleTrackBuilder = subtitleTrackBuilder;
        this.sceneCompositor = sceneCompositor;
        this.timelineAssembler = timelineAssembler;
        this.durableStore = durableStore;
        this.taskExecutor = taskExecutor;
        this.meterRegistry = meterRegistry;
        this.submittedCounter = meterRegistry.counter("story_renderer.jobs.submitted");
        this.completedCounter = meterRegistry.counter("story_renderer.jobs.completed");
        this.failedCounter = meterRegistry.counter("story_renderer.jobs.failed");
        this.captionFallbackCounter = meterRegistry.counter("story_renderer.captions.fallbacks");
        this.projectJobs.putAll(jobStore.loadIndex());
    }

    @Override
    public RenderJob submit(RenderProjectRequest project) {
        RenderProjectPlan plan = validator.normalizeAndValidate(project);
        String jobId = newId();
        RenderJob job = RenderJob.queued(jobId, plan.projectId());
        RenderCancellationToken token = new RenderCancellationToken();

        synchronized (lock) {
            String previousJobId = null;
            try {
                jobStore.saveJob(job, true);
                jobs.put(jobId, job);
                cancellationTokens.put(jobId, token);
                if (plan.projectId() != null) {
                    previousJobId = projectJobs.put(plan.projectId(), jobId);
                    jobStore.saveIndex(projectJobs);
                }
            } catch (RuntimeException e) {
                cancellationTokens.remove(jobId);
                jobs.remove(jobId);
                if (plan.projectId() != null) {
                    if (previousJobId != null) {
                        projectJobs.put(plan.projectId(), previousJobId);
                    } else {
                        projectJobs.remove(plan.projectId(), jobId);
                    }
                }
                logger.error("render_submit_persist_failed job={} project={}", jobId, plan.projectId(), e);
                throw e;
            }
        }
        submittedCounter.increment();
        logger.info(
                "render_submit job={} project={} sceneCount={} orientation={}",
                jobId,
                plan.projectId(),
                plan.scenes().size(),
                plan.orientation().toApiValue());

        try {
            taskExecutor.execute(() -> runJob(jobId, plan, token));
        } catch (TaskRejectedException e) {
            logger.error("render_rejected job={}", jobId, e);
            cancellationTokens.remove(jobId);
            RenderJob rejected = update(jobId, current -> current.failed("Render queue rejected the job.")).orElse(job);
            failedCounter.increment();
            return rejected;
        }
        return job;
    }

    @Override
    public Optional<RenderJob> getJob(String jobId) {
        if (jobId == null || jobId.isBlank()) {
            return Optional.empty();
        }

        synchronized (lock) {
            RenderJob inMemory = jobs.get(jobId);
            if (inMemory != null) {
                return Optional.of(inMemory);
            }
        }

        Optional<RenderJob> local = jobStore.readLocalJob(jobId);
        Optional<RenderJob> found = local.isPresent() ? local : jobStore.readRemoteJob(jobId);
        if (found.isEmpty()) {
            logger.warn("render_get miss job={}", jobId);
            return Optional.empty();
        }

        RenderJob admitted = admit(found.get(), local.isEmpty(), false);
        logger.info(
                "render_get restored job={} project={} status={} source={}",
                jobId,
                admitted.projectId(),
                admitted.status().toApiValue(),
                local.isPresent() ? "disk" : "remote");
        return Optional.of(admitted);
    }

    @Override
    public Optional<RenderJob> getJobByProject(String projectId) {
        if (projectId == null || projectId.isBlank()) {
            return Optional.empty();
        }

        String indexedJobId;
        synchronized (lock) {
            indexedJobId = projectJobs.get(projectId);
        }
        if (indexedJobId != null) {
            Optional<RenderJob> indexed = getJob(indexedJobId);
            if (indexed.isPresent()) {
                return indexed;
            }
            dropStaleIndexEntry(projectId, indexedJobId);
        }

        Optional<RenderJob> scanned = jobStore.scanForProject(projectId);
        if (scanned.isPresent()) {
            RenderJob admitted = admit(scanned.get(), false, true);
            logger.info("render_get_by_project hydrated_from_disk project={} job={}", projectId, admitted.id());
            return Optional.of(admitted);
        }

        String remoteJobId = durableStore.isEnabled() ? durableStore.getIndex().get(projectId) : null;
        if (remoteJobId != null && !remoteJobId.equals(indexedJobId)) {
            Optional<RenderJob> remote = jobStore.readRemoteJob(remoteJobId);
            if (remote.isPresent()) {
                RenderJob admitted = admit(remote.get(), true, true);
                logger.info("render_get_by_project hydrated_remote project={} job={}", projectId, admitted.id());
                return Optional.of(admitted);
            }
        }

        logger.warn("render_get_by_project miss project={}", projectId);
        return Optional.empty();
    }

    @Override
    public Optional<RenderJob> requestStop(String jobId, RenderJobStatus targetStatus) {
        if (targetStatus == null || !targetStatus.isStopTarget()) {
            throw new IllegalArgumentException("Stop target must be cancelled or paused.");
        }
        if (getJob(jobId).isEmpty()) {
            return Optional.empty();
        }

        synchronized (lock) {
            RenderJob current = jobs.get(jobId);
            if (current == null || current.isTerminal()) {
                return Optional.ofNullable(current);
            }

            RenderCancellationToken token = cancellationTokens.get(jobId);
            RenderJob next;
            if (token == null) {
                // no live execution will ever observe a signal, so settle the job now
                next = current.stopped(targetStatus);
                countStopped(targetStatus);
            } else {
                token.requestStop(targetStatus);
                next = current.stopping(RenderJobStatus.interimFor(targetStatus));
            }
            persistLocked(next);
            logger.info(
                    "render_stop_requested job={} target={} status={}",
                    jobId,
                    targetStatus.toApiValue(),
                    next.status().toApiValue());
            return Optional.of(next);
        }
    }

    void runJob(String jobId, RenderProjectPlan plan, RenderCancellationToken token) {
        Path workDir = null;
        try {
            token.throwIfStopRequested("before start");
            update(jobId, current -> current.status().isStopping()
                    ? current.withProgress(PROGRESS_STARTED)
                    : current.rendering(PROGRESS_STARTED));

            String projectKey = plan.projectId() != null ? projectKey(plan.projectId()) : newId();
            logger.info(
                    "render_run_start job={} project={} scenes={}",
                    jobId,
                    projectKey,
                    plan.scenes().size());

            List<PreparedScene> orderedScenes = orderScenes(prepareScenes(jobId, plan, token));

            Path subtitleTrack = subtitleTrackBuilder
                    .buildSubtitleFile(projectKey, orderedScenes, plan.captionStyle(), plan.orientation())
                    .orElse(null);
            updateProgress(jobId, PROGRESS_SUBTITLES_BUILT);

            Path outputDir = properties.renderDir().resolve(projectKey);
            workDir = Files.createDirectories(outputDir.resolve("work-" + jobId));
            List<Path> clips = renderClips(jobId, orderedScenes, plan.orientation(), workDir, token);

            token.throwIfStopRequested("before final assembly");
            updateProgress(jobId, PROGRESS_CLIPS_RENDERED);

            Path finalPath = outputDir.resolve(projectKey + "_final.mp4");
            timelineAssembler.assemble(clips, subtitleTrack, finalPath, token);

            String videoUrl = resolveVideoUrl(finalPath, projectKey);
            RenderJob finished = update(jobId, current -> current.status().isStopping()
                    ? current.stopped(current.status().stopTarget())
                    : current.completed(videoUrl)).orElse(null);
            recordOutcome(finished);
            logger.info(
                    "render_run_complete job={} project={} status={} url={}",
                    jobId,
                    projectKey,
                    finished == null ? null : finished.status().toApiValue(),
                    videoUrl);
        } catch (RenderCancelledException e) {
            logger.info("render_run_stopped job={} target={} reason={}",
                    jobId, e.getTargetStatus().toApiValue(), e.getMessage());
            recordOutcome(update(jobId, current -> current.stopped(e.getTargetStatus())).orElse(null));
        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            if (e instanceof CompositionException composition) {
                logger.error("render_run_error job={} project={} stage={} exitCode={} error={}",
                        jobId, plan.projectId(), composition.getStage(), composition.getExitCode(),
                        e.getMessage(), e);
            } else {
                logger.error("render_run_error job={} project={} error={}", jobId, plan.projectId(), e.getMessage(), e);
            }
            String error = describe(e);
            recordOutcome(update(jobId, current -> current.status().isStopping()
                    ? current.stopped(current.status().stopTarget())
                    : current.failed(error)).orElse(null));
        } finally {
            ensureTerminal(jobId);
            cancellationTokens.remove(jobId);
            deleteRecursively(workDir);
        }
    }

    /**
     * Declared order first, submission index as the tie-breaker. Never completion order.
     */
    static List<PreparedScene> orderScenes(List<PreparedScene> scenes) {
        List<PreparedScene> ordered = new ArrayList<>(scenes);
        ordered.sort(Comparator.comparingDouble(PreparedScene::sortKey)
                .thenComparingInt(PreparedScene::submissionIndex));
        return ordered;
    }

    private List<PreparedScene> prepareScenes(
            String jobId,
            RenderProjectPlan plan,
            RenderCancellationToken token) throws InterruptedException {
        List<RenderSceneRequest> requests = plan.scenes();
        int sceneCount = requests.size();
        PreparedScene[] prepared = new PreparedScene[sceneCount];
        Map<Integer, Exception> failures = new TreeMap<>();

        ExecutorService pool = newScenePool(sceneCount, "render-prep-");
        List<Future<ScenePreparation>> futures = new ArrayList<>(sceneCount);
        try {
            CompletionService<ScenePreparation> completion = new ExecutorCompletionService<>(pool);
            for (int index = 0; index < sceneCount; index++) {
                PreparedScene seed = PreparedScene.from(index, requests.get(index), plan.voice());
                futures.add(completion.submit(() -> prepareScene(jobId, seed)));
            }

            for (int done = 1; done <= sceneCount; done++) {
                ScenePreparation result = awaitPreparation(completion.take());
                if (result.failure() != null) {
                    failures.put(result.index(), result.failure());
                } else {
                    prepared[result.index()] = result.scene();
                }

                token.throwIfStopRequested("during scene preparation");
                int progress = PROGRESS_STARTED
                        + (PROGRESS_SCENES_PREPARED - PROGRESS_STARTED) * done / sceneCount;
                updateProgress(jobId, progress);
            }
        } finally {
            drain(jobId, pool, futures);
        }

        if (!failures.isEmpty()) {
            Map.Entry<Integer, Exception> first = failures.entrySet().iterator().next();
            logger.error("render_scene_prepare_failed job={} scene={} failures={}",
                    jobId, first.getKey(), failures.size());
            throw asRenderFailure(first.getValue());
        }
        return List.of(prepared);
    }

    private ScenePreparation prepareScene(String jobId, PreparedScene seed) {
        try {
            NarrationAudio narration = narrationSynthesizer.synthesizeNarration(seed.text(), seed.voice());
            if (narration == null || narration.audioPath() == null || !Files.isRegularFile(narration.audioPath())) {
                throw new MissingAudioException(sceneLabel(seed), narration == null ? null : narration.audioPath());
            }

            PreparedScene withAudio = seed.withNarration(
                    narration.audioPath(),
                    CaptionWord.round3(narration.durationSeconds()));
            List<CaptionWord> timed = timeCaptions(jobId, withAudio);
            PreparedScene scene = timed.isEmpty() ? withAudio : withAudio.withCaptions(timed);
            logger.debug(
                    "render_scene_prepared job={} scene={} audioDuration={} captionWords={}",
                    jobId,
                    sceneLabel(scene),
                    scene.audioDuration(),
                    scene.captions().size());
            return new ScenePreparation(seed.submissionIndex(), scene, null);
        } catch (Exception e) {
            return new ScenePreparation(seed.submissionIndex(), null, e);
        }
    }

    /**
     * Transcribed words when available, otherwise whatever the scene was submitted with. Timing failures
     * never fail the scene.
     */
    private List<CaptionWord> timeCaptions(String jobId, PreparedScene scene) {
        try {
            List<CaptionWord> words = captionTimer.transcribeWordTimings(scene.audioPath(), scene.text());
            if (words == null || words.isEmpty()) {
                return List.of();
            }
            return PreparedScene.normalizeCaptionWords(words);
        } catch (RuntimeException e) {
            CaptionTimingException failure = e instanceof CaptionTimingException timingException
                    ? timingException
                    : new CaptionTimingException("Caption timing failed for scene " + sceneLabel(scene), e);
            captionFallbackCounter.increment();
            logger.warn(
                    "render_caption_fallback job={} scene={} reason={}",
                    jobId,
                    sceneLabel(scene),
                    failure.getMessage(),
                    failure);
            return List.of();
        }
    }

    private List<Path> renderClips(
            String jobId,
            List<PreparedScene> orderedScenes,
            Orientation orientation,
            Path workDir,
            RenderCancellationToken token) throws InterruptedException {
        int sceneCount = orderedScenes.size();
        double fallbackSeconds = properties.getDefaultSceneSeconds();
        List<Future<Path>> futures = new ArrayList<>(sceneCount);
        List<Path> clips = new ArrayList<>(sceneCount);

        ExecutorService pool = newScenePool(sceneCount, "render-clip-");
        try {
            for (int position = 0; position < sceneCount; position++) {
                PreparedScene scene = orderedScenes.get(position);
                Path clipPath = workDir.resolve(String.format("scene_%03d.mp4", position));
                futures.add(pool.submit(() -> {
                    token.throwIfStopRequested("before rendering scene " + sceneLabel(scene));
                    Path mediaPath = scene.mediaUrl() == null ? null : mediaAcquirer.acquire(scene.mediaUrl());
                    return sceneCompositor.buildSceneClip(
                            mediaPath,
                            scene.audioPath(),
                            scene.effectiveDuration(fallbackSeconds),
                            orientation,
                            clipPath);
                }));
            }

            for (int position = 0; position < sceneCount; position++) {
                clips.add(awaitClip(futures.get(position)));
                int progress = PROGRESS_SUBTITLES_BUILT
                        + (PROGRESS_CLIPS_RENDERED - PROGRESS_SUBTITLES_BUILT) * (position + 1) / sceneCount;
                updateProgress(jobId, progress);
            }
            return clips;
        } finally {
            drain(jobId, pool, futures);
        }
    }

    /**
     * Cancels work that has not started and waits for started work to finish. Running tasks are never
     * interrupted, so no scene work outlives the job.
     */
    private void drain(String jobId, ExecutorService pool, List<? extends Future<?>> futures) {
        for (Future<?> future : futures) {
            future.cancel(false);
        }
        pool.shutdown();
        try {
            if (!pool.awaitTermination(POOL_DRAIN_TIMEOUT_MINUTES, TimeUnit.MINUTES)) {
                logger.warn("render_pool_drain_timeout job={} minutes={}", jobId, POOL_DRAIN_TIMEOUT_MINUTES);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("render_pool_drain_interrupted job={}", jobId);
        }
    }

    private ExecutorService newScenePool(int sceneCount, String threadPrefix) {
        int poolSize = Math.max(1, Math.min(properties.getSceneWorkers(), sceneCount));
        return Executors.newFixedThreadPool(poolSize, new CustomizableThreadFactory(threadPrefix));
    }

    private ScenePreparation awaitPreparation(Future<ScenePreparation> future) throws InterruptedException {
        try {
            return future.get();
        } catch (ExecutionException e) {
            throw asRenderFailure(e.getCause());
        }
    }

    private Path awaitClip(Future<Path> future) throws InterruptedException {
        try {
            return future.get();
        } catch (ExecutionException e) {
            throw asRenderFailure(e.getCause());
        }
    }

    private String resolveVideoUrl(Path finalPath, String projectKey) {
        Optional<String> uploaded = durableStore.isEnabled()
                ? durableStore.uploadArtifact(finalPath, projectKey)
                : Optional.empty();
        if (uploaded.isPresent()) {
            logger.info("render_uploaded project={} url={}", projectKey, uploaded.get());
            return uploaded.get();
        }

        String prefix = properties.getPublicPathPrefix();
        while (prefix.endsWith("/")) {
            prefix = prefix.substring(0, prefix.length() - 1);
        }
        String cacheBuster = UUID.randomUUID().toString().replace("-", "").substring(0, 6);
        logger.info("render_local_output project={} file={}", projectKey, finalPath);
        return prefix + "/" + projectKey + "/" + finalPath.getFileName() + "?v=" + cacheBuster;
    }

    private void updateProgress(String jobId, int progress) {
        update(jobId, current -> current.withProgress(progress));
    }

    /**
     * Applies {@code change} under the lock unless the job is already terminal.
     */
    private Optional<RenderJob> update(String jobId, UnaryOperator<RenderJob> change) {
        synchronized (lock) {
            RenderJob current = jobs.get(jobId);
            if (current == null) {
                current = jobStore.readLocalJob(jobId).orElse(null);
            }
            if (current == null) {
                return Optional.empty();
            }
            if (current.isTerminal()) {
                logger.debug("render_update ignored job={} status={}", jobId, current.status().toApiValue());
                return Optional.of(current);
            }

            RenderJob next = change.apply(current);
            persistLocked(next);
            return Optional.of(next);
        }
    }

    private void ensureTerminal(String jobId) {
        Optional<RenderJob> settled = update(jobId, current -> current.status().isStopping()
                ? current.stopped(current.status().stopTarget())
                : current.failed(UNEXPECTED_TERMINATION_ERROR));
        settled.ifPresent(job -> {
            if (UNEXPECTED_TERMINATION_ERROR.equals(job.error())) {
                failedCounter.increment();
            }
        });
    }

    private void persistLocked(RenderJob job) {
        jobs.put(job.id(), job);
        jobStore.saveJob(job, true);
    }

    /**
     * Puts a rehydrated job back into the table. The index is only repointed when {@code repairIndex} is
     * set; otherwise an existing newer entry for the project is left alone.
     */
    private RenderJob admit(RenderJob job, boolean writeLocalCopy, boolean repairIndex) {
        synchronized (lock) {
            RenderJob existing = jobs.putIfAbsent(job.id(), job);
            if (existing != null) {
                return existing;
            }

            if (job.projectId() != null) {
                String previous = repairIndex
                        ? projectJobs.put(job.projectId(), job.id())
                        : projectJobs.putIfAbsent(job.projectId(), job.id());
                if (!job.id().equals(previous)) {
                    jobStore.saveIndex(projectJobs);
                }
            }
            if (writeLocalCopy) {
                jobStore.saveJob(job, false);
            }
            return job;
        }
    }

    private void dropStaleIndexEntry(String projectId, String jobId) {
        synchronized (lock) {
            if (projectJobs.remove(projectId, jobId)) {
                jobStore.saveIndex(projectJobs);
                logger.warn("render_get_by_project stale_index project={} job={}", projectId, jobId);
            }
        }
    }

    private void recordOutcome(RenderJob job) {
        if (job == null) {
            return;
        }
        switch (job.status()) {
            case COMPLETED -> completedCounter.increment();
            case FAILED -> failedCounter.increment();
            case CANCELLED, PAUSED -> countStopped(job.status());
            default -> {
            }
        }
    }

    private void countStopped(RenderJobStatus status) {
        meterRegistry.counter("story_renderer.jobs.stopped", "status", status.toApiValue()).increment();
    }

    private static RenderException asRenderFailure(Throwable failure) {
        if (failure instanceof RenderException renderException) {
            return renderException;
        }
        if (failure instanceof IOException || failure instanceof IllegalArgumentException) {
            return new RenderException(describe(failure), failure);
        }
        return new RenderException("Scene processing failed: " + describe(failure), failure);
    }

    private static String describe(Throwable failure) {
        String message = failure.getMessage();
        return message == null || message.isBlank() ? failure.getClass().getSimpleName() : message;
    }

    private static String sceneLabel(PreparedScene scene) {
        return scene.sceneId() != null ? scene.sceneId() : "#" + scene.submissionIndex();
    }

    /**
     * Path-safe key for a project. IDs that are already safe are used as-is; others are sanitized and
     * suffixed with {@code .} plus a hash of the raw ID, so two IDs never share a key.
     */
    static String projectKey(String projectId) {
        if (SAFE_PROJECT_KEY.matcher(projectId).matches()) {
            return projectId;
        }
        String sanitized = projectId.replaceAll("[^A-Za-z0-9_-]", "_");
        return sanitized + "." + sha256(projectId).substring(0, PROJECT_KEY_HASH_LENGTH);
    }

    private static String sha256(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }

    private static String newId() {
        return UUID.randomUUID().toString().replace("-", "");
    }

    private void deleteRecursively(Path directory) {
        if (directory == null || !Files.exists(directory)) {
            return;
        }
        try (Stream<Path> paths = Files.walk(directory)) {
            paths.sorted(Comparator.reverseOrder()).forEach(path -> {
                try {
                    Files.deleteIfExists(path);
                } catch (IOException ignored) {
                    // Cleanup failures are non-fatal.
                }
            });
        } catch (IOException e) {
            logger.warn("Could not clean up work directory {}", directory, e);
        }
    }

    private record ScenePreparation(int index, PreparedScene scene, Exception failure) {
    }
}
