package vantage.assist.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;
import vantage.assist.api.model.AssistantRequest;
import vantage.assist.api.model.AssistantResponse;
import vantage.assist.audit.AssistantAuditLogger;
import vantage.assist.history.HistoryEntry;
import vantage.assist.history.RecentHistory;
import vantage.assist.llm.ProviderClient;
import vantage.assist.orchestrator.Answer;
import vantage.assist.orchestrator.FallbackOrchestrator;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.TimeUnit;

@Service
public class AssistantService {
    private final FallbackOrchestrator orchestrator;
    private final AssistantContextResolver contextResolver;
    private final RecentHistory history;
    private final AssistantAuditLogger auditLogger;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    public AssistantService(
            FallbackOrchestrator orchestrator,
            AssistantContextResolver contextResolver,
            RecentHistory history,
            AssistantAuditLogger auditLogger,
            MeterRegistry meterRegistry,
            Clock clock
    ) {
        this.orchestrator = orchestrator;
        this.contextResolver = contextResolver;
        this.history = history;
        this.auditLogger = auditLogger;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
        registerCircuitGauges(orchestrator.providers());
        Gauge.builder("assistant_history_sessions", history, RecentHistory::sessionCount)
                .register(meterRegistry);
    }

    public AssistantResponse ask(String requestId, String sessionId, AssistantRequest request) {
        long startNs = System.nanoTime();
        AssistantContextResolver.ResolvedContext resolved = contextResolver.resolve(sessionId, request);
        Answer answer = orchestrator.answer(request.safeQuestion(), request.tool(), resolved.context());
        long processingMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNs);

        recordMetrics(answer, processingMs);
        auditLogger.logAnswer(requestId, sessionId, request.tool(), answer, resolved.fromHistory(), processingMs);
        history.record(sessionId, new HistoryEntry(
                requestId,
                request.safeQuestion(),
                answer.answer(),
                answer.tool(),
                answer.provider(),
                resolved.context().isEmpty() ? null : resolved.context(),
                clock.instant()
        ));

        return new AssistantResponse(requestId, answer, processingMs);
    }

    public List<HistoryEntry> history(String sessionId) {
        return history.recent(sessionId);
    }

    private void recordMetrics(Answer answer, long processingMs) {
        Counter.builder("assistant_answer_total")
                .tag("provider", answer.provider())
                .tag("tool", answer.tool() == null ? "none" : answer.tool())
                .register(meterRegistry)
                .increment();

        if (answer.isCached()) {
            Counter.builder("assistant_cache_hit_total")
                    .register(meterRegistry)
                    .increment();
        }

        if (answer.isDeterministic()) {
            Counter.builder("assistant_fallback_total")
                    .tag("reason", answer.tool() == null ? "UNAVAILABLE" : "TOOL_GUIDANCE")
                    .register(meterRegistry)
                    .increment();
        }

        Timer.builder("assistant_answer_latency")
                .publishPercentileHistogram()
                .register(meterRegistry)
                .record(processingMs, TimeUnit.MILLISECONDS);
    }

    private void registerCircuitGauges(List<ProviderClient> providers) {
        for (ProviderClient provider : providers) {
            Gauge.builder("assistant_provider_consecutive_failures", provider,
                            p -> p.circuitBreaker().consecutiveFailures())
                    .tag("provider", provider.name())
                    .register(meterRegistry);
        }
    }
}
