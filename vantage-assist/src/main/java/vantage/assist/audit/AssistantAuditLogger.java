package vantage.assist.audit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import vantage.assist.orchestrator.Answer;

@Component
public class AssistantAuditLogger {
    private static final Logger log = LoggerFactory.getLogger(AssistantAuditLogger.class);

    public void logAnswer(
            String requestId,
            String sessionId,
            String toolHint,
            Answer answer,
            boolean contextFromHistory,
            long processingMs
    ) {
        log.info(
                "event=assistant_answer request_id={} session_id={} tool_hint={} tool={} provider={} cache_hit={} fallback_used={} context_from_history={} confidence={} processing_ms={}",
                requestId,
                sessionId,
                toolHint,
                answer.tool(),
                answer.provider(),
                answer.isCached(),
                answer.isDeterministic(),
                contextFromHistory,
                answer.confidence(),
                processingMs
        );
    }
}
