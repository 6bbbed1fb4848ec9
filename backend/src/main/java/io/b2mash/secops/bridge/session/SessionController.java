package io.b2mash.secops.bridge.session;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/sessions")
public class SessionController {

  private final SessionService sessionService;

  public SessionController(SessionService sessionService) {
    this.sessionService = sessionService;
  }

  @GetMapping("/{id}")
  public ResponseEntity<ToolSession> getSession(@PathVariable String id) {
    return ResponseEntity.of(sessionService.find(id));
  }

  @DeleteMapping("/{id}")
  public ResponseEntity<Void> endSession(@PathVariable String id) {
    return sessionService.end(id)
        ? ResponseEntity.noContent().build()
        : ResponseEntity.notFound().build();
  }
}
