package io.github.hide212131.langchain4j.formagent.runtime.agent;

import io.github.hide212131.langchain4j.formagent.infra.isolation.BestEffort;
import io.github.hide212131.langchain4j.formagent.infra.logging.RunLogger;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Consumer;

/**
 * Wraps a single unit of work with an optional ephemeral resource and mandatory outcome recording.
 *
 * <p>Per run: provision a resource when the definition requires one, call the backend with the input enriched
 * by the resource id, report success or failure to the observability sink, and release the resource on every
 * exit path. Observability and release failures are isolated and never replace the primary outcome. Backend
 * exceptions reach the caller with their identity unchanged.</p>
 *
 * <p>The runner holds no per-run state and may be shared by concurrent callers.</p>
 */
public final class AgentRunner {

    private static final String PHASE = "agent";

    private final AgentDependencies dependencies;
    private final Clock clock;
    private final RunLogger log;
    private final BestEffort bestEffort;
    private final Consumer<AgentRun> completedRuns;

    public AgentRunner(AgentDependencies dependencies) {
        this(dependencies, Clock.systemUTC(), new RunLogger(AgentRunner.class), run -> {
            // no listener
        });
    }

    AgentRunner(AgentDependencies dependencies, Clock clock, RunLogger log, Consumer<AgentRun> completedRuns) {
        this.dependencies = Objects.requireNonNull(dependencies, "dependencies");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.log = Objects.requireNonNull(log, "log");
        this.bestEffort = new BestEffort(log);
        this.completedRuns = Objects.requireNonNull(completedRuns, "completedRuns");
    }

    /**
     * Runs {@code definition} once against {@code input}.
     *
     * @throws ResourceUnavailableException when a resource is required but no provisioner is wired
     * @throws ResourceAcquisitionException when provisioning fails; the backend is not called
     * @throws RuntimeException the backend's own exception, after observability and release have run. An
     *     {@link Error} from the backend takes the same path.
     */
    public TaskOutput run(TaskDefinition definition, TaskInput input) {
        Objects.requireNonNull(definition, "definition");
        Objects.requireNonNull(input, "input");
        AgentRun run = new AgentRun(UUID.randomUUID().toString(), log);
        Instant start = clock.instant();
        log.info(run.runId(), PHASE, "run.start", "エージェント実行を開始します",
                "requiresResource=" + definition.requiresResource());
        try (ResourceLease lease = acquire(definition, run)) {
            TaskInput effectiveInput = lease.isHeld()
                    ? input.withContextEntry(TaskInput.RESOURCE_ID, lease.resourceId())
                    : input;
            return execute(definition, effectiveInput, run, lease, start);
        } finally {
            run.finish();
            log.info(run.runId(), PHASE, "run.end", "エージェント実行を終了しました",
                    "durationMs=" + elapsedMs(start));
            completedRuns.accept(run);
        }
    }

    /** Runs on {@code executor}; the returned future completes with the same outcome as {@link #run}. */
    public CompletableFuture<TaskOutput> runAsync(TaskDefinition definition, TaskInput input, Executor executor) {
        Objects.requireNonNull(executor, "executor");
        return CompletableFuture.supplyAsync(() -> run(definition, input), executor);
    }

    /** Binds {@code definition} so callers only supply the input. */
    public Agent agent(TaskDefinition definition) {
        Objects.requireNonNull(definition, "definition");
        return new Agent() {
            @Override
            public TaskDefinition definition() {
                return definition;
            }

            @Override
            public TaskOutput run(TaskInput input) {
                return AgentRunner.this.run(definition, input);
            }
        };
    }

    @SuppressWarnings("PMD.AvoidCatchingGenericException")
    private ResourceLease acquire(TaskDefinition definition, AgentRun run) {
        if (!definition.requiresResource()) {
            return ResourceLease.none();
        }
        run.advance(RunState.RESOURCE_PENDING);
        ResourceProvisioner provisioner = dependencies.provisioner()
                .orElseThrow(() -> new ResourceUnavailableException(
                        "Agent requires a resource, but no ResourceProvisioner was provided."));
        ResourceHandle handle;
        try {
            handle = provisioner.acquire(definition.resourceConfig());
        } catch (ResourceAcquisitionException ex) {
            log.error(run.runId(), PHASE, "resource.acquire", "リソースの確保に失敗しました", ex);
            throw ex;
        } catch (RuntimeException ex) {
            log.error(run.runId(), PHASE, "resource.acquire", "リソースの確保に失敗しました", ex);
            throw new ResourceAcquisitionException("Failed to acquire resource: " + ex.getMessage(), ex);
        }
        if (handle == null) {
            throw new ResourceAcquisitionException("ResourceProvisioner returned no handle");
        }
        log.info(run.runId(), PHASE, "resource.acquire", "リソースを確保しました", "resourceId=" + handle.id());
        return ResourceLease.of(handle, provisioner, bestEffort, run);
    }

    @SuppressWarnings("PMD.AvoidCatchingGenericException")
    private TaskOutput execute(TaskDefinition definition, TaskInput input, AgentRun run, ResourceLease lease,
            Instant start) {
        run.advance(RunState.EXECUTING);
        TaskOutput output;
        try {
            output = dependencies.backend().run(definition.instructions(), input);
            if (output == null) {
                throw new BackendFailureException("ExecutionBackend returned no output", null);
            }
        } catch (RuntimeException | Error ex) {
            // Errors are recorded too; the caller still receives the same instance
            long durationMs = elapsedMs(start);
            run.advance(RunState.FAILED);
            log.warn(run.runId(), PHASE, "backend.run", "バックエンド実行が失敗しました", ex);
            record(run, RunEvent.failure(run.runId(), definition, input, ex, durationMs, lease.resourceId()));
            throw ex;
        }
        long durationMs = elapsedMs(start);
        Map<String, Object> additions = new LinkedHashMap<>();
        additions.put(TaskOutput.DURATION_MS, durationMs);
        additions.put(TaskOutput.RESOURCE_ID, lease.resourceId());
        TaskOutput enriched = output.withMetadata(additions);
        run.advance(RunState.SUCCEEDED);
        record(run, RunEvent.success(run.runId(), definition, input, enriched, durationMs, lease.resourceId()));
        return enriched;
    }

    private void record(AgentRun run, RunEvent event) {
        dependencies.observability()
                .ifPresent(sink -> bestEffort.run(run.runId(), "observability.record", () -> sink.record(event)));
    }

    private long elapsedMs(Instant start) {
        return Math.max(0L, Duration.between(start, clock.instant()).toMillis());
    }

    /** A definition bound to a runner. */
    public interface Agent {

        TaskDefinition definition();

        TaskOutput run(TaskInput input);
    }
}
