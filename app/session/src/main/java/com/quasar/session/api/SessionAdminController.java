package com.quasar.session.api;

import com.quasar.session.api.response.AdminSnapshotResponse;
import com.quasar.session.api.response.AdminStatsResponse;
import com.quasar.session.api.response.EndMatchResponse;
import com.quasar.session.service.SessionService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** Operator endpoints. Exposed on the same port; network-level restriction is expected. */
@RestController
@RequestMapping("/v1/session/admin")
@RequiredArgsConstructor
public class SessionAdminController {

  private final SessionService sessionService;

  @GetMapping("/stats")
  public ResponseEntity<AdminStatsResponse> stats() {
    return ResponseEntity.ok(sessionService.stats());
  }

  @GetMapping("/snapshot")
  public ResponseEntity<AdminSnapshotResponse> snapshot() {
    return ResponseEntity.ok(sessionService.snapshot());
  }

  @DeleteMapping("/matches/{matchId}")
  public ResponseEntity<EndMatchResponse> endMatch(
      @PathVariable("matchId") String matchId,
      @RequestParam(name = "reason", required = false) String reason) {
    return ResponseEntity.ok(sessionService.endMatch(matchId, reason));
  }
}
