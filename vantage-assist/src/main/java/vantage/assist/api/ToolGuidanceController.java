package vantage.assist.api;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import vantage.assist.api.model.GuidanceLookupResponse;
import vantage.assist.guidance.GuidanceCatalog;

@RestController
@RequestMapping("/api/tool-guidance")
public class ToolGuidanceController {
    private final GuidanceCatalog catalog;

    public ToolGuidanceController(GuidanceCatalog catalog) {
        this.catalog = catalog;
    }

    @GetMapping
    public ResponseEntity<GuidanceLookupResponse> guidance(@RequestParam(value = "tool", required = false) String tool) {
        return ResponseEntity.ok(catalog.find(tool)
                .map(GuidanceLookupResponse::of)
                .orElseGet(() -> GuidanceLookupResponse.notFound(catalog.supportedTools())));
    }
}
