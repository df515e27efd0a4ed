package github.sarthakdev143.story_renderer.service.impl;

import github.sarthakdev143.story_renderer.config.RenderProperties;
import github.sarthakdev143.story_renderer.dto.RenderProjectRequest;
import github.sarthakdev143.story_renderer.dto.RenderSceneRequest;
import github.sarthakdev143.story_renderer.dto.SceneMediaRequest;
import github.sarthakdev143.story_renderer.exception.CaptionTimingException;
import github.sarthakdev143.story_renderer.exception.CompositionException;
import github.sarthakdev143.story_renderer.exception.MediaFetchException;
import github.sarthakdev143.story_renderer.integration.storage.LocalOnlyDurableStore;
import github.sarthakdev143.story_renderer.model.CaptionWord;
import github.sarthakdev143.story_renderer.model.NarrationAudio;
import github.sarthakdev143.story_renderer.model.RenderJob;
import github.sarthakdev143.story_renderer.model.RenderJobStatus;
import github.sarthakdev143.story_renderer.model.composition.PreparedScene;
import github.sarthakdev143.story_renderer.service.CaptionTimer;
import github.sarthakdev143.story_renderer.service.DurableStore;
import github.sarthakdev143.story_renderer.service.MediaAcquirer;
import github.sarthakdev143.story_renderer.service.NarrationSynthesizer;
import github.sarthakdev143.story_renderer.service.SceneCompositor;
import github.sarthakdev143.story_renderer.service.TimelineAssembler;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.springframework.core.task.TaskExecutor;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class DefaultRenderOrchestratorTest {

    @TempDir
    Path tempDir;

    private RenderProperties properties;
    private SimpleMeterRegistry meterRegistry;
    private final AtomicInteger narrationCalls = new AtomicInteger();
    private final Map<Path, Path> clipAudio = new ConcurrentHashMap<>();
    private final Map<Path, String> audioText = new ConcurrentHashMap<>();
    private final List<Path> mediaPassedToCompositor = new CopyOnWriteArrayList<>();
    private final List<List<Path>> assembledTimelines = new CopyOnWriteArrayList<>();
    private final List<Runnable> deferredJobs = new ArrayList<>();

    private NarrationSynthesizer narrationSynthesizer;
    private CaptionTimer captionTimer;
    private MediaAcquirer mediaAcquirer;
    private SceneCompositor sceneCompositor;
    private TimelineAssembler timelineAssembler;
    private DurableStore durableStore;

    @BeforeEach
    void setUp() {
        properties = new RenderProperties();
        properties.setOutputDir(tempDir.resolve("outputs"));
        properties.setSceneWorkers(3);
        meterRegistry = new SimpleMeterRegistry();
        durableStore = new LocalOnlyDurableStore();

        narrationSynthesizer = (text, voice) -> {
            narrationCalls.incrementAndGet();
            sleepRandomly();
            Path audio = tempDir.resolve("audio").resolve("narration-" + text.replace(' ', '_') + ".wav");
            Files.createDirectories(audio.getParent());
            Files.writeString(audio, voice + ":" + text, StandardCharsets.UTF_8);
            audioText.put(audio, text);
            return new NarrationAudio(audio, 2.0);
        };
        captionTimer = (audioPath, referenceText) -> List.of();
        mediaAcquirer = url -> tempDir.resolve("media").resolve(Integer.toHexString(url.hashCode()) + ".mp4");
        sceneCompositor = (mediaPath, audioPath, durationSeconds, orientation, outputPath) -> {
            sleepRandomly();
            if (mediaPath != null) {
                mediaPassedToCompositor.add(mediaPath);
            }
            clipAudio.put(outputPath, audioPath);
            Files.writeString(outputPath, "clip", StandardCharsets.UTF_8);
            return outputPath;
        };
        timelineAssembler = (orderedClips, subtitleTrack, finalOutputPath, cancellationToken) -> {
            cancellationToken.throwIfStopRequested("before final assembly");
            assembledTimelines.add(List.copyOf(orderedClips));
            Files.createDirectories(finalOutputPath.getParent());
            Files.writeString(finalOutputPath, "video", StandardCharsets.UTF_8);
            return finalOutputPath;
        };
    }

    @Test
    void submitRendersScenesInDeclaredOrderRegardlessOfCompletionOrder() {
        DefaultRenderOrchestrator orchestrator = newOrchestrator(Runnable::run);

        RenderJob submitted = orchestrator.submit(project(
                "p-order",
                scene("a", "3", "s0"),
                scene("b", 1, "s1"),
                scene("c", null, "s2"),
                scene("d", 2.5, "s3"),
                scene("e", "not-a-number", "s4"),
                scene("f", 0, "s5")));

        RenderJob job = orchestrator.getJob(submitted.id()).orElseThrow();
        assertThat(job.status()).isEqualTo(RenderJobStatus.COMPLETED);
        assertThat(job.progress()).isEqualTo(100);
        assertThat(job.error()).isNull();
        assertThat(job.videoUrl()).startsWith("/videos/p-order/p-order_final.mp4?v=");
        assertThat(assembledTimelines).hasSize(1);
        assertThat(narratedTextsOf(assembledTimelines.get(0)))
                .containsExactly("s5", "s1", "s2", "s3", "s0", "s4");
        assertThat(meterRegistry.counter("story_renderer.jobs.completed").count()).isEqualTo(1.0);
    }

    @Test
    void orderScenesBreaksTiesBySubmissionIndex() {
        List<PreparedScene> completionOrder = List.of(
                prepared(3, 1.0),
                prepared(0, 2.0),
                prepared(2, 1.0),
                prepared(1, 0.5));

        List<PreparedScene> ordered = DefaultRenderOrchestrator.orderScenes(completionOrder);

        assertThat(ordered).extracting(PreparedScene::submissionIndex).containsExactly(1, 2, 3, 0);
    }

    @Test
    void stopRequestedBeforeStartCancelsWithoutRenderingAnything() {
        DefaultRenderOrchestrator orchestrator = newOrchestrator(deferredJobs::add);
        RenderJob submitted = orchestrator.submit(project("p-cancel", scene("a", 0, "hello")));
        assertThat(submitted.status()).isEqualTo(RenderJobStatus.QUEUED);

        RenderJob stopping = orchestrator.requestStop(submitted.id(), RenderJobStatus.CANCELLED).orElseThrow();
        assertThat(stopping.status()).isEqualTo(RenderJobStatus.CANCELLING);

        runDeferredJobs();

        for (int attempt = 0; attempt < 5; attempt++) {
            RenderJob job = orchestrator.getJob(submitted.id()).orElseThrow();
            assertThat(job.status()).isEqualTo(RenderJobStatus.CANCELLED);
            assertThat(job.error()).isNull();
            assertThat(job.videoUrl()).isNull();
        }
        assertThat(narrationCalls).hasValue(0);
        assertThat(assembledTimelines).isEmpty();
        assertThat(meterRegistry.counter("story_renderer.jobs.stopped", "status", "cancelled").count())
                .isEqualTo(1.0);
    }

    @Test
    void stopRequestedDuringScenePreparationAbandonsTheRender() {
        AtomicReference<DefaultRenderOrchestrator> orchestratorRef = new AtomicReference<>();
        AtomicReference<String> jobIdRef = new AtomicReference<>();
        NarrationSynthesizer delegate = narrationSynthesizer;
        narrationSynthesizer = (text, voice) -> {
            if (text.equals("second")) {
                orchestratorRef.get().requestStop(jobIdRef.get(), RenderJobStatus.CANCELLED);
            }
            return delegate.synthesizeNarration(text, voice);
        };
        properties.setSceneWorkers(1);
        DefaultRenderOrchestrator orchestrator = newOrchestrator(deferredJobs::add);
        orchestratorRef.set(orchestrator);

        RenderJob submitted = orchestrator.submit(project(
                "p-midflight",
                scene("a", 0, "first"),
                scene("b", 1, "second"),
                scene("c", 2, "third")));
        jobIdRef.set(submitted.id());
        runDeferredJobs();

        RenderJob job = orchestrator.getJob(submitted.id()).orElseThrow();
        assertThat(job.status()).isEqualTo(RenderJobStatus.CANCELLED);
        assertThat(job.error()).isNull();
        assertThat(job.videoUrl()).isNull();
        assertThat(assembledTimelines).isEmpty();
        assertThat(clipAudio).isEmpty();

        RenderJob afterPause = orchestrator.requestStop(submitted.id(), RenderJobStatus.PAUSED).orElseThrow();
        assertThat(afterPause.status()).isEqualTo(RenderJobStatus.CANCELLED);
    }

    @Test
    void pauseRequestEndsInPausedStatus() {
        DefaultRenderOrchestrator orchestrator = newOrchestrator(deferredJobs::add);
        RenderJob submitted = orchestrator.submit(project("p-pause", scene("a", 0, "hello")));

        RenderJob pausing = orchestrator.requestStop(submitted.id(), RenderJobStatus.PAUSED).orElseThrow();
        assertThat(pausing.status()).isEqualTo(RenderJobStatus.PAUSING);
        runDeferredJobs();

        assertThat(orchestrator.getJob(submitted.id()).orElseThrow().status()).isEqualTo(RenderJobStatus.PAUSED);
    }

    @Test
    void terminalJobIgnoresLaterStopRequests() {
        DefaultRenderOrchestrator orchestrator = newOrchestrator(Runnable::run);
        RenderJob submitted = orchestrator.submit(project("p-final", scene("a", 0, "hello world")));
        RenderJob completed = orchestrator.getJob(submitted.id()).orElseThrow();
        assertThat(completed.status()).isEqualTo(RenderJobStatus.COMPLETED);

        RenderJob afterCancel = orchestrator.requestStop(submitted.id(), RenderJobStatus.CANCELLED).orElseThrow();
        RenderJob afterPause = orchestrator.requestStop(submitted.id(), RenderJobStatus.PAUSED).orElseThrow();

        assertThat(afterCancel).isEqualTo(completed);
        assertThat(afterPause).isEqualTo(completed);
        assertThat(orchestrator.getJob(submitted.id())).contains(completed);
    }

    @Test
    void requestStopRejectsNonStopStatus() {
        DefaultRenderOrchestrator orchestrator = newOrchestrator(deferredJobs::add);
        RenderJob submitted = orchestrator.submit(project("p-bad-stop", scene("a", 0, "hello")));

        assertThatThrownBy(() -> orchestrator.requestStop(submitted.id(), RenderJobStatus.COMPLETED))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void unknownJobLookupsReturnEmpty() {
        DefaultRenderOrchestrator orchestrator = newOrchestrator(Runnable::run);

        assertThat(orchestrator.getJob("does-not-exist")).isEmpty();
        assertThat(orchestrator.getJob("../escape")).isEmpty();
        assertThat(orchestrator.getJobByProject("nobody")).isEmpty();
        assertThat(orchestrator.requestStop("does-not-exist", RenderJobStatus.CANCELLED)).isEmpty();
    }

    @Test
    void restartedOrchestratorRestoresPersistedJobWithoutRerendering() {
        DefaultRenderOrchestrator first = newOrchestrator(Runnable::run);
        RenderJob submitted = first.submit(project("p-restart", scene("a", 0, "hello")));
        RenderJob completed = first.getJob(submitted.id()).orElseThrow();
        int narrationsBeforeRestart = narrationCalls.get();

        DefaultRenderOrchestrator restarted = newOrchestrator(Runnable::run);

        assertThat(restarted.getJob(submitted.id())).contains(completed);
        assertThat(restarted.getJobByProject("p-restart")).contains(completed);
        assertThat(narrationCalls).hasValue(narrationsBeforeRestart);
        assertThat(assembledTimelines).hasSize(1);
    }

    @Test
    void stopRequestForRestoredQueuedJobSettlesImmediately() {
        DefaultRenderOrchestrator first = newOrchestrator(deferredJobs::add);
        RenderJob submitted = first.submit(project("p-orphan", scene("a", 0, "hello")));

        DefaultRenderOrchestrator restarted = newOrchestrator(Runnable::run);
        assertThat(restarted.getJob(submitted.id()).orElseThrow().status()).isEqualTo(RenderJobStatus.QUEUED);

        RenderJob stopped = restarted.requestStop(submitted.id(), RenderJobStatus.CANCELLED).orElseThrow();

        assertThat(stopped.status()).isEqualTo(RenderJobStatus.CANCELLED);
        assertThat(newOrchestrator(Runnable::run).getJob(submitted.id()).orElseThrow().status())
                .isEqualTo(RenderJobStatus.CANCELLED);
    }

    @Test
    void getJobByProjectRebuildsLostIndexFromJobRecords() throws IOException {
        DefaultRenderOrchestrator first = newOrchestrator(Runnable::run);
        RenderJob submitted = first.submit(project("p-heal", scene("a", 0, "hello")));
        Path indexFile = properties.renderDir().resolve(RenderJobStore.INDEX_FILE_NAME);
        Files.delete(indexFile);

        DefaultRenderOrchestrator restarted = newOrchestrator(Runnable::run);
        RenderJob found = restarted.getJobByProject("p-heal").orElseThrow();

        assertThat(found.id()).isEqualTo(submitted.id());
        assertThat(Files.readString(indexFile)).contains("p-heal").contains(submitted.id());
    }

    @Test
    void getJobByProjectRepairsIndexPointingAtMissingJob() throws IOException {
        DefaultRenderOrchestrator first = newOrchestrator(Runnable::run);
        RenderJob submitted = first.submit(project("p-stale", scene("a", 0, "hello")));
        Path indexFile = properties.renderDir().resolve(RenderJobStore.INDEX_FILE_NAME);
        Files.writeString(indexFile, "{\"p-stale\":\"0000deadbeef\"}", StandardCharsets.UTF_8);

        DefaultRenderOrchestrator restarted = newOrchestrator(Runnable::run);
        RenderJob found = restarted.getJobByProject("p-stale").orElseThrow();

        assertThat(found.id()).isEqualTo(submitted.id());
        assertThat(Files.readString(indexFile)).doesNotContain("0000deadbeef");
    }

    @Test
    void missingNarrationAudioFailsTheJob() {
        narrationSynthesizer = (text, voice) -> new NarrationAudio(tempDir.resolve("missing.wav"), 2.0);
        DefaultRenderOrchestrator orchestrator = newOrchestrator(Runnable::run);

        RenderJob submitted = orchestrator.submit(project("p-noaudio", scene("a", 0, "hello"), scene("b", 1, "bye")));

        RenderJob job = orchestrator.getJob(submitted.id()).orElseThrow();
        assertThat(job.status()).isEqualTo(RenderJobStatus.FAILED);
        assertThat(job.error()).contains("Audio track missing");
        assertThat(job.videoUrl()).isNull();
        assertThat(assembledTimelines).isEmpty();
        assertThat(meterRegistry.counter("story_renderer.jobs.failed").count()).isEqualTo(1.0);
    }

    @Test
    void narrationFailureFailsTheJobWithItsMessage() {
        narrationSynthesizer = (text, voice) -> {
            throw new IOException("speech engine unavailable");
        };
        DefaultRenderOrchestrator orchestrator = newOrchestrator(Runnable::run);

        RenderJob submitted = orchestrator.submit(project("p-tts", scene("a", 0, "hello")));

        RenderJob job = orchestrator.getJob(submitted.id()).orElseThrow();
        assertThat(job.status()).isEqualTo(RenderJobStatus.FAILED);
        assertThat(job.error()).isEqualTo("speech engine unavailable");
    }

    @Test
    void captionTimingFailureFallsBackAndStillCompletes() throws IOException {
        captionTimer = (audioPath, referenceText) -> {
            throw new CaptionTimingException("alignment service timed out");
        };
        DefaultRenderOrchestrator orchestrator = newOrchestrator(Runnable::run);

        RenderJob submitted = orchestrator.submit(project("p-captions", scene("a", 0, "hello world")));

        assertThat(orchestrator.getJob(submitted.id()).orElseThrow().status()).isEqualTo(RenderJobStatus.COMPLETED);
        assertThat(meterRegistry.counter("story_renderer.captions.fallbacks").count()).isEqualTo(1.0);
        Path subtitles = properties.subtitleCacheDir().resolve("p-captions.ass");
        assertThat(Files.readString(subtitles)).contains("Dialogue:").contains("hello world");
    }

    @Test
    void transcribedWordsReplaceSubmittedCaptions() throws IOException {
        captionTimer = (audioPath, referenceText) -> List.of(new CaptionWord("Transcribed", 0.0, 0.5));
        DefaultRenderOrchestrator orchestrator = newOrchestrator(Runnable::run);

        orchestrator.submit(project("p-timed", scene("a", 0, "submitted text")));

        String subtitles = Files.readString(properties.subtitleCacheDir().resolve("p-timed.ass"));
        assertThat(subtitles).contains("Transcribed").doesNotContain("submitted");
    }

    @Test
    void compositionFailureFailsTheJobWithToolOutput() {
        sceneCompositor = (mediaPath, audioPath, durationSeconds, orientation, outputPath) -> {
            throw new CompositionException("render scene", 1, "Invalid data found when processing input");
        };
        DefaultRenderOrchestrator orchestrator = newOrchestrator(Runnable::run);

        RenderJob submitted = orchestrator.submit(project("p-ffmpeg", scene("a", 0, "hello")));

        RenderJob job = orchestrator.getJob(submitted.id()).orElseThrow();
        assertThat(job.status()).isEqualTo(RenderJobStatus.FAILED);
        assertThat(job.error())
                .contains("FFmpeg failed during stage render scene")
                .contains("Invalid data found when processing input");
    }

    @Test
    void mediaReferencesAreAcquiredAndFetchFailuresAreFatal() {
        DefaultRenderOrchestrator orchestrator = newOrchestrator(Runnable::run);
        RenderSceneRequest withMedia = new RenderSceneRequest(
                "a", 0, "hello", null, null, new SceneMediaRequest("https://cdn.example.com/clip.mp4"),
                List.of(), null, null, List.of());

        RenderJob ok = orchestrator.submit(project("p-media", withMedia, scene("b", 1, "plain")));
        assertThat(orchestrator.getJob(ok.id()).orElseThrow().status()).isEqualTo(RenderJobStatus.COMPLETED);
        assertThat(mediaPassedToCompositor).hasSize(1);

        mediaAcquirer = url -> {
            throw new MediaFetchException(url, "404 Not Found");
        };
        DefaultRenderOrchestrator failing = newOrchestrator(Runnable::run);
        RenderJob failed = failing.submit(project("p-media-404", withMedia));

        RenderJob job = failing.getJob(failed.id()).orElseThrow();
        assertThat(job.status()).isEqualTo(RenderJobStatus.FAILED);
        assertThat(job.error()).contains("Media download failed for https://cdn.example.com/clip.mp4");
    }

    @Test
    void uploadedArtifactUrlIsPreferredOverLocalPath() {
        durableStore = mock(DurableStore.class);
        when(durableStore.isEnabled()).thenReturn(true);
        when(durableStore.getIndex()).thenReturn(Map.of());
        when(durableStore.uploadArtifact(any(Path.class), eq("p-upload")))
                .thenReturn(Optional.of("https://bucket.example.com/videos/p-upload/p-upload_final.mp4"));
        DefaultRenderOrchestrator orchestrator = newOrchestrator(Runnable::run);

        RenderJob submitted = orchestrator.submit(project("p-upload", scene("a", 0, "hello")));

        RenderJob job = orchestrator.getJob(submitted.id()).orElseThrow();
        assertThat(job.videoUrl()).isEqualTo("https://bucket.example.com/videos/p-upload/p-upload_final.mp4");
        verify(durableStore, atLeastOnce()).putJob(any(RenderJob.class));
        verify(durableStore, atLeastOnce()).putIndex(any());
    }

    @Test
    void failedClipWaitsForSiblingClipsBeforeCleaningUp() throws IOException {
        CountDownLatch secondStarted = new CountDownLatch(1);
        AtomicReference<String> secondOutcome = new AtomicReference<>();
        AtomicReference<Path> secondClip = new AtomicReference<>();
        sceneCompositor = (mediaPath, audioPath, durationSeconds, orientation, outputPath) -> {
            if ("first".equals(audioText.get(audioPath))) {
                awaitQuietly(secondStarted);
                throw new CompositionException("render scene", 1, "Conversion failed!");
            }
            secondStarted.countDown();
            secondClip.set(outputPath);
            try {
                Thread.sleep(300);
                Files.writeString(outputPath, "clip", StandardCharsets.UTF_8);
                secondOutcome.set("written");
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                secondOutcome.set("interrupted");
            } catch (IOException e) {
                secondOutcome.set(e.getClass().getSimpleName());
            }
            return outputPath;
        };
        DefaultRenderOrchestrator orchestrator = newOrchestrator(Runnable::run);

        RenderJob submitted = orchestrator.submit(project("p-sibling", scene("a", 0, "first"), scene("b", 1, "second")));

        RenderJob job = orchestrator.getJob(submitted.id()).orElseThrow();
        assertThat(job.status()).isEqualTo(RenderJobStatus.FAILED);
        assertThat(job.error()).contains("Conversion failed!");
        assertThat(secondOutcome).hasValue("written");
        assertThat(secondClip.get()).isNotNull();
        assertThat(secondClip.get().getParent()).doesNotExist();
    }

    @Test
    void stopDuringPreparationLetsRunningNarrationFinish() {
        CountDownLatch secondStarted = new CountDownLatch(1);
        AtomicBoolean secondInterrupted = new AtomicBoolean();
        AtomicBoolean secondFinished = new AtomicBoolean();
        AtomicReference<DefaultRenderOrchestrator> orchestratorRef = new AtomicReference<>();
        AtomicReference<String> jobIdRef = new AtomicReference<>();
        NarrationSynthesizer delegate = narrationSynthesizer;
        narrationSynthesizer = (text, voice) -> {
            if (text.equals("first")) {
                awaitQuietly(secondStarted);
                orchestratorRef.get().requestStop(jobIdRef.get(), RenderJobStatus.CANCELLED);
            } else {
                secondStarted.countDown();
                try {
                    Thread.sleep(300);
                } catch (InterruptedException e) {
                    secondInterrupted.set(true);
                    Thread.currentThread().interrupt();
                }
                secondFinished.set(true);
            }
            return delegate.synthesizeNarration(text, voice);
        };
        properties.setSceneWorkers(2);
        DefaultRenderOrchestrator orchestrator = newOrchestrator(deferredJobs::add);
        orchestratorRef.set(orchestrator);

        RenderJob submitted = orchestrator.submit(project("p-drain", scene("a", 0, "first"), scene("b", 1, "second")));
        jobIdRef.set(submitted.id());
        runDeferredJobs();

        assertThat(orchestrator.getJob(submitted.id()).orElseThrow().status()).isEqualTo(RenderJobStatus.CANCELLED);
        assertThat(secondInterrupted).isFalse();
        assertThat(secondFinished).isTrue();
        assertThat(assembledTimelines).isEmpty();
    }

    @Test
    void projectIdsThatSanitizeAlikeKeepSeparateArtifacts() {
        DefaultRenderOrchestrator orchestrator = newOrchestrator(Runnable::run);

        RenderJob dotted = orchestrator.submit(project("promo.v1", scene("a", 0, "dotted")));
        RenderJob plain = orchestrator.submit(project("promo_v1", scene("a", 0, "plain")));

        String dottedUrl = orchestrator.getJob(dotted.id()).orElseThrow().videoUrl();
        String plainUrl = orchestrator.getJob(plain.id()).orElseThrow().videoUrl();
        assertThat(plainUrl).startsWith("/videos/promo_v1/promo_v1_final.mp4?v=");
        assertThat(dottedUrl).startsWith("/videos/promo_v1.").doesNotStartWith("/videos/promo_v1/");
        assertThat(assembledTimelines).hasSize(2);

        String dottedKey = DefaultRenderOrchestrator.projectKey("promo.v1");
        assertThat(properties.renderDir().resolve(dottedKey).resolve(dottedKey + "_final.mp4")).exists();
        assertThat(properties.renderDir().resolve("promo_v1").resolve("promo_v1_final.mp4")).exists();
        assertThat(properties.subtitleCacheDir().resolve(dottedKey + ".ass")).exists();
        assertThat(properties.subtitleCacheDir().resolve("promo_v1.ass")).exists();
    }

    @Test
    void projectKeyKeepsSafeIdsAndDisambiguatesSanitizedOnes() {
        assertThat(DefaultRenderOrchestrator.projectKey("episode-12_final")).isEqualTo("episode-12_final");

        String slashed = DefaultRenderOrchestrator.projectKey("team/a");
        String spaced = DefaultRenderOrchestrator.projectKey("team a");
        assertThat(slashed).startsWith("team_a.").hasSize("team_a.".length() + 12);
        assertThat(spaced).startsWith("team_a.");
        assertThat(slashed).isNotEqualTo(spaced).isNotEqualTo("team_a");
        assertThat(DefaultRenderOrchestrator.projectKey("team/a")).isEqualTo(slashed);
    }

    @Test
    void transcribedWordsAreNormalizedBeforeSubtitles() throws IOException {
        captionTimer = (audioPath, referenceText) -> List.of(new CaptionWord("Zero", 0.5, 0.5));
        DefaultRenderOrchestrator orchestrator = newOrchestrator(Runnable::run);

        orchestrator.submit(project("p-zero", scene("a", 0, "zero")));

        String subtitles = Files.readString(properties.subtitleCacheDir().resolve("p-zero.ass"));
        assertThat(subtitles).contains("Zero").contains("0:00:00.50,0:00:00.9");
    }

    @Test
    void submitPersistsJobRecordBeforeProjectIndex() {
        RenderJobStore jobStore = mock(RenderJobStore.class);
        DefaultRenderOrchestrator orchestrator = newOrchestrator(deferredJobs::add, jobStore);

        orchestrator.submit(project("p-ordered-save", scene("a", 0, "hello")));

        InOrder order = inOrder(jobStore);
        order.verify(jobStore).saveJob(any(RenderJob.class), eq(true));
        order.verify(jobStore).saveIndex(any());
    }

    @Test
    void submitLeavesNoTraceWhenJobRecordCannotBeSaved() {
        RenderJobStore jobStore = mock(RenderJobStore.class);
        doThrow(new IllegalStateException("disk full")).when(jobStore).saveJob(any(RenderJob.class), eq(true));
        DefaultRenderOrchestrator orchestrator = newOrchestrator(deferredJobs::add, jobStore);

        assertThatThrownBy(() -> orchestrator.submit(project("p-disk-full", scene("a", 0, "hello"))))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("disk full");

        ArgumentCaptor<RenderJob> attempted = ArgumentCaptor.forClass(RenderJob.class);
        verify(jobStore).saveJob(attempted.capture(), eq(true));
        verify(jobStore, never()).saveIndex(any());
        assertThat(deferredJobs).isEmpty();
        assertThat(orchestrator.getJob(attempted.getValue().id())).isEmpty();
        assertThat(orchestrator.getJobByProject("p-disk-full")).isEmpty();
        assertThat(orchestrator.requestStop(attempted.getValue().id(), RenderJobStatus.CANCELLED)).isEmpty();
        assertThat(meterRegistry.counter("story_renderer.jobs.submitted").count()).isZero();
    }

    @Test
    void submitRejectsProjectWithoutScenes() {
        DefaultRenderOrchestrator orchestrator = newOrchestrator(Runnable::run);

        assertThatThrownBy(() -> orchestrator.submit(new RenderProjectRequest("p-empty", null, null, null, List.of())))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("at least one scene");
    }

    private DefaultRenderOrchestrator newOrchestrator(TaskExecutor executor) {
        return newOrchestrator(executor, new RenderJobStore(properties.renderDir(), durableStore));
    }

    private DefaultRenderOrchestrator newOrchestrator(TaskExecutor executor, RenderJobStore jobStore) {
        return new DefaultRenderOrchestrator(
                properties,
                new RenderProjectValidator(),
                jobStore,
                narrationSynthesizer,
                captionTimer,
                mediaAcquirer,
                new AssSubtitleTrackBuilder(properties.subtitleCacheDir()),
                sceneCompositor,
                timelineAssembler,
                durableStore,
                executor,
                meterRegistry);
    }

    private void runDeferredJobs() {
        List<Runnable> pending = new ArrayList<>(deferredJobs);
        deferredJobs.clear();
        pending.forEach(Runnable::run);
    }

    private List<String> narratedTextsOf(List<Path> clips) {
        List<String> texts = new ArrayList<>();
        for (Path clip : clips) {
            texts.add(audioText.get(clipAudio.get(clip)));
        }
        return texts;
    }

    private static RenderProjectRequest project(String id, RenderSceneRequest... scenes) {
        return new RenderProjectRequest(id, "portrait", "voice-a", null, List.of(scenes));
    }

    private static RenderSceneRequest scene(String id, Object order, String text) {
        return new RenderSceneRequest(id, order, text, null, null, null, List.of(), null, null, List.of());
    }

    private static PreparedScene prepared(int submissionIndex, double sortKey) {
        return new PreparedScene(
                submissionIndex, "s" + submissionIndex, sortKey, "", null, null, null, null, null, List.of());
    }

    private static void awaitQuietly(CountDownLatch latch) {
        try {
            latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void sleepRandomly() {
        try {
            Thread.sleep(ThreadLocalRandom.current().nextInt(0, 25));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
