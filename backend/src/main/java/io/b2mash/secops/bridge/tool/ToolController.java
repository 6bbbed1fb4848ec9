package io.b2mash.secops.bridge.tool;

import io.b2mash.secops.bridge.session.SessionService;
import java.util.List;
import java.util.Map;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class ToolController {

  static final String SESSION_HEADER = "Mcp-Session-Id";

  private final ToolRegistry toolRegistry;
  private final SessionService sessionService;

  public ToolController(ToolRegistry toolRegistry, SessionService sessionService) {
    this.toolRegistry = toolRegistry;
    this.sessionService = sessionService;
  }

  @GetMapping("/api/tools")
  public ResponseEntity<List<ToolSummary>> listTools() {
    return ResponseEntity.ok(
        toolRegistry.tools().stream()
            .map(tool -> new ToolSummary(tool.name(), tool.module(), tool.description()))
            .toList());
  }

  @PostMapping("/api/tools/{name}")
  public ResponseEntity<ToolCallResponse> callTool(
      @PathVariable String name,
      @RequestBody(required = false) Map<String, Object> arguments,
      @RequestHeader(name = SESSION_HEADER, required = false) String sessionId) {
    var result = toolRegistry.invoke(name, arguments);
    if (sessionId != null && !sessionId.isBlank()) {
      sessionService.recordCall(sessionId);
    }
    return ResponseEntity.ok(new ToolCallResponse(name, result));
  }

  @GetMapping("/api/resources")
  public ResponseEntity<List<ResourceSummary>> listResources() {
    return ResponseEntity.ok(
        toolRegistry.resources().stream()
            .map(r -> new ResourceSummary(r.uri(), r.name(), r.module(), r.description()))
            .toList());
  }

  @GetMapping("/api/resources/content")
  public ResponseEntity<ResourceContent> readResource(@RequestParam String uri) {
    var resource = toolRegistry.resource(uri);
    return ResponseEntity.ok(
        new ResourceContent(resource.uri(), resource.name(), "text/markdown", resource.text()));
  }

  // --- DTOs ---

  public record ToolSummary(String name, String module, String description) {}

  public record ToolCallResponse(String tool, Object result) {}

  public record ResourceSummary(String uri, String name, String module, String description) {}

  public record ResourceContent(String uri, String name, String mimeType, String text) {}
}
