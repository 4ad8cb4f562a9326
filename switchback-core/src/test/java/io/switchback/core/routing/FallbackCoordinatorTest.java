package io.switchback.core.routing;

import static org.assertj.core.api.Assertions.assertThat;

import io.switchback.core.backend.Backend;
import io.switchback.core.backend.BackendException;
import io.switchback.core.backend.BackendKind;
import io.switchback.core.backend.BackendRegistry;
import io.switchback.core.backend.GenerationRequest;
import io.switchback.core.fallback.FallbackResponses;
import io.switchback.core.testing.MutableClock;
import io.switchback.core.testing.StubBackend;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.CompletionService;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.Test;

class FallbackCoordinatorTest {
    private final FallbackResponses responses = FallbackResponses.defaults();

    @Test
    void shouldCascadeToNextBackendAndCallFailedOneOnce() {
        StubBackend local = StubBackend.failing("local", BackendKind.LOCAL);
        StubBackend openai = StubBackend.replying("openai", BackendKind.OPENAI, "from openai");
        RoutingState state = new RoutingState();

        CompletionOutcome outcome = coordinator(List.of(local, openai), null, state).run(GenerationRequest.of("question"));

        assertThat(outcome.success()).isTrue();
        assertThat(outcome.backendUsed()).isEqualTo("openai");
        assertThat(outcome.text()).isEqualTo("from openai");
        assertThat(outcome.attempted()).containsExactly("local", "openai");
        assertThat(local.calls()).isEqualTo(1);
        assertThat(state.lastUsed()).isEqualTo("openai");
        assertThat(state.latencies()).containsOnlyKeys("openai");
    }

    @Test
    void shouldTreatEmptyResultLikeFailure() {
        StubBackend local = StubBackend.empty("local", BackendKind.LOCAL);
        StubBackend claude = StubBackend.replying("claude", BackendKind.CLAUDE, "from claude");

        CompletionOutcome outcome = coordinator(List.of(local, claude), null, new RoutingState()).run(GenerationRequest.of("q"));

        assertThat(outcome.backendUsed()).isEqualTo("claude");
    }

    @Test
    void shouldCatchRuntimeExceptions() {
        StubBackend local = new StubBackend("local", BackendKind.LOCAL, true, request -> {
            throw new IllegalStateException("bug");
        });
        StubBackend openai = StubBackend.replying("openai", BackendKind.OPENAI, "recovered");

        CompletionOutcome outcome = coordinator(List.of(local, openai), null, new RoutingState()).run(GenerationRequest.of("q"));

        assertThat(outcome.text()).isEqualTo("recovered");
    }

    @Test
    void shouldAnswerWithErrorEntryWhenEveryBackendFails() {
        StubBackend local = StubBackend.failing("local", BackendKind.LOCAL);
        StubBackend openai = StubBackend.failing("openai", BackendKind.OPENAI);

        CompletionOutcome outcome = coordinator(List.of(local, openai), null, new RoutingState())
            .run(GenerationRequest.of("what is the weather"));

        assertThat(outcome.success()).isFalse();
        assertThat(outcome.backendUsed()).isEqualTo(CompletionOutcome.FALLBACK);
        assertThat(outcome.fallbackKey()).isEqualTo(FallbackResponses.ERROR);
        assertThat(outcome.text()).isEqualTo(responses.lookup(FallbackResponses.ERROR));
        assertThat(local.calls()).isEqualTo(1);
        assertThat(openai.calls()).isEqualTo(1);
    }

    @Test
    void shouldAnswerGreetingWhenNothingIsAvailable() {
        FallbackResponses greetingOnly = FallbackResponses.of(Map.of(
            "greeting", "Hello! I'm your AI assistant. How can I help you today?"
        ));
        FallbackCoordinator coordinator = new FallbackCoordinator(
            new BackendRegistry(List.of(StubBackend.unavailable("local", BackendKind.LOCAL))),
            new BackendSelector(BackendSelector.DEFAULT_PRIORITY, new Random(1)),
            null,
            new RoutingState(),
            greetingOnly
        );

        CompletionOutcome outcome = coordinator.run(GenerationRequest.of("hello"));

        assertThat(outcome.text()).isEqualTo("Hello! I'm your AI assistant. How can I help you today?");
    }

    @Test
    void shouldAnswerUnavailableWhenNoBackendIsConfigured() {
        CompletionOutcome outcome = coordinator(List.of(StubBackend.unavailable("openai", BackendKind.OPENAI)), null,
            new RoutingState()).run(GenerationRequest.of("summarize this"));

        assertThat(outcome.fallbackKey()).isEqualTo(FallbackResponses.UNAVAILABLE);
        assertThat(outcome.attempted()).isEmpty();
    }

    @Test
    void shouldAnswerBusyWhenEveryBackendIsRateLimited() {
        MutableClock clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        WindowRateLimiter limiter = new WindowRateLimiter(Map.of("openai", 1), clock);
        StubBackend openai = StubBackend.replying("openai", BackendKind.OPENAI, "first");
        FallbackCoordinator coordinator = coordinator(List.of(openai), limiter, new RoutingState());

        assertThat(coordinator.run(GenerationRequest.of("one")).text()).isEqualTo("first");
        CompletionOutcome second = coordinator.run(GenerationRequest.of("two"));

        assertThat(second.fallbackKey()).isEqualTo(FallbackResponses.BUSY);
        assertThat(openai.calls()).isEqualTo(1);
    }

    @Test
    void shouldSkipThrottledBackendAndUseNextOne() {
        MutableClock clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        WindowRateLimiter limiter = new WindowRateLimiter(Map.of("openai", 1), clock);
        StubBackend openai = StubBackend.replying("openai", BackendKind.OPENAI, "openai");
        StubBackend gemini = StubBackend.replying("gemini", BackendKind.GEMINI, "gemini");
        FallbackCoordinator coordinator = coordinator(List.of(openai, gemini), limiter, new RoutingState());

        coordinator.run(GenerationRequest.of("one"));
        CompletionOutcome second = coordinator.run(GenerationRequest.of("two"));

        assertThat(second.backendUsed()).isEqualTo("gemini");
        assertThat(limiter.count("openai")).isEqualTo(1);
    }

    @Test
    void shouldNotRecordQuotaForFailedDispatch() {
        MutableClock clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        WindowRateLimiter limiter = new WindowRateLimiter(Map.of("openai", 3), clock);

        coordinator(List.of(StubBackend.failing("openai", BackendKind.OPENAI)), limiter, new RoutingState())
            .run(GenerationRequest.of("q"));

        assertThat(limiter.count("openai")).isZero();
    }

    @Test
    void shouldReleaseReservationWhenDispatchFailsAndServeLater() {
        MutableClock clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        WindowRateLimiter limiter = new WindowRateLimiter(Map.of("openai", 1), clock);
        AtomicBoolean fail = new AtomicBoolean(true);
        StubBackend openai = new StubBackend("openai", BackendKind.OPENAI, true, request -> {
            if (fail.get()) {
                throw new BackendException("openai", "boom");
            }
            return Optional.of("served");
        });
        FallbackCoordinator coordinator = coordinator(List.of(openai), limiter, new RoutingState());

        assertThat(coordinator.run(GenerationRequest.of("q")).fallbackKey()).isEqualTo(FallbackResponses.ERROR);
        assertThat(limiter.count("openai")).isZero();

        fail.set(false);
        assertThat(coordinator.run(GenerationRequest.of("q")).text()).isEqualTo("served");
        assertThat(limiter.count("openai")).isEqualTo(1);
    }

    @Test
    void shouldNotExceedLimitUnderConcurrentCallers() throws Exception {
        MutableClock clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        WindowRateLimiter limiter = new WindowRateLimiter(Map.of("openai", 1), clock);
        CountDownLatch release = new CountDownLatch(1);
        StubBackend openai = new StubBackend("openai", BackendKind.OPENAI, true, request -> {
            try {
                if (!release.await(5, TimeUnit.SECONDS)) {
                    throw new BackendException("openai", "never released");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new BackendException("openai", "interrupted", e);
            }
            return Optional.of("served");
        });
        FallbackCoordinator coordinator = coordinator(List.of(openai), limiter, new RoutingState());

        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            CompletionService<CompletionOutcome> completions = new ExecutorCompletionService<>(executor);
            for (int i = 0; i < 4; i++) {
                completions.submit(() -> coordinator.run(GenerationRequest.of("question")));
            }

            for (int i = 0; i < 3; i++) {
                Future<CompletionOutcome> done = completions.poll(5, TimeUnit.SECONDS);
                assertThat(done).isNotNull();
                assertThat(done.get().fallbackKey()).isEqualTo(FallbackResponses.BUSY);
            }
            release.countDown();
            Future<CompletionOutcome> last = completions.poll(5, TimeUnit.SECONDS);
            assertThat(last).isNotNull();
            assertThat(last.get().text()).isEqualTo("served");
        } finally {
            release.countDown();
            executor.shutdownNow();
        }

        assertThat(openai.calls()).isEqualTo(1);
        assertThat(limiter.count("openai")).isEqualTo(1);
    }

    private FallbackCoordinator coordinator(List<Backend> backends, WindowRateLimiter limiter, RoutingState state) {
        return new FallbackCoordinator(
            new BackendRegistry(backends),
            new BackendSelector(BackendSelector.DEFAULT_PRIORITY, new Random(1)),
            limiter,
            state,
            responses
        );
    }
}
