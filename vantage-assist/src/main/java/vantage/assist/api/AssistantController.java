package vantage.assist.api;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import vantage.assist.api.model.AssistantRequest;
import vantage.assist.api.model.AssistantResponse;
import vantage.assist.history.HistoryEntry;
import vantage.assist.service.AssistantService;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/assistant")
public class AssistantController {
    static final String SESSION_HEADER = "X-Session-Id";
    static final String ANONYMOUS = "anonymous";

    private final AssistantService service;

    public AssistantController(AssistantService service) {
        this.service = service;
    }

    @PostMapping
    public ResponseEntity<AssistantResponse> ask(
            @RequestHeader(value = SESSION_HEADER, required = false) String sessionId,
            @RequestBody(required = false) AssistantRequest request
    ) {
        String requestId = "as_" + UUID.randomUUID().toString().replace("-", "");
        AssistantRequest safeRequest = request == null ? new AssistantRequest(null, null, null) : request;
        return ResponseEntity.ok(service.ask(requestId, session(sessionId), safeRequest));
    }

    @GetMapping("/history")
    public ResponseEntity<List<HistoryEntry>> history(
            @RequestHeader(value = SESSION_HEADER, required = false) String sessionId
    ) {
        return ResponseEntity.ok(service.history(session(sessionId)));
    }

    private static String session(String sessionId) {
        return sessionId == null || sessionId.isBlank() ? ANONYMOUS : sessionId.trim();
    }
}
