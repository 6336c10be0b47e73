/*
 * どこで: Session API
 * 何を: キュー・非公開 Match・Match 参加/退出・一覧のエンドポイントを公開する
 * なぜ: クライアントからのセッション操作を受け付ける入口を提供するため
 */
package com.quasar.session.api;

import com.quasar.session.api.request.EnqueueRequest;
import com.quasar.session.api.request.JoinMatchRequest;
import com.quasar.session.api.request.PrivateMatchRequest;
import com.quasar.session.api.response.DequeueResponse;
import com.quasar.session.api.response.EnqueueResponse;
import com.quasar.session.api.response.JoinResponse;
import com.quasar.session.api.response.LeaveResponse;
import com.quasar.session.api.response.PrivateMatchResponse;
import com.quasar.session.api.response.QueuePositionResponse;
import com.quasar.session.model.view.MatchView;
import com.quasar.session.service.SessionService;
import jakarta.validation.Valid;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/session")
@RequiredArgsConstructor
public class SessionController {

  private static final String HEADER_USER_ID = "X-User-Id";
  private final SessionService sessionService;

  @PostMapping("/queues/{gameType}/players")
  public ResponseEntity<EnqueueResponse> enqueue(
      @PathVariable("gameType") String gameType,
      @RequestHeader(HEADER_USER_ID) String userId,
      @Valid @RequestBody(required = false) EnqueueRequest request) {
    return ResponseEntity.ok(sessionService.enqueue(gameType, userId, request));
  }

  @DeleteMapping("/queues/players/me")
  public ResponseEntity<DequeueResponse> dequeue(@RequestHeader(HEADER_USER_ID) String userId) {
    return ResponseEntity.ok(sessionService.dequeue(userId));
  }

  @GetMapping("/queues/players/me")
  public ResponseEntity<QueuePositionResponse> getPosition(
      @RequestHeader(HEADER_USER_ID) String userId) {
    return ResponseEntity.ok(sessionService.getPosition(userId));
  }

  @PostMapping("/private-matches")
  public ResponseEntity<PrivateMatchResponse> createPrivate(
      @RequestHeader(HEADER_USER_ID) String userId,
      @Valid @RequestBody PrivateMatchRequest request) {
    return ResponseEntity.ok(sessionService.createPrivate(userId, request));
  }

  @PostMapping("/private-matches/{inviteCode}/players")
  public ResponseEntity<JoinResponse> joinPrivate(
      @PathVariable("inviteCode") String inviteCode,
      @RequestHeader(HEADER_USER_ID) String userId,
      @Valid @RequestBody(required = false) JoinMatchRequest request) {
    return ResponseEntity.ok(sessionService.joinPrivate(inviteCode, userId, request));
  }

  @PostMapping("/matches/{matchId}/players")
  public ResponseEntity<JoinResponse> joinMatch(
      @PathVariable("matchId") String matchId,
      @RequestHeader(HEADER_USER_ID) String userId,
      @Valid @RequestBody(required = false) JoinMatchRequest request) {
    return ResponseEntity.ok(sessionService.joinMatch(matchId, userId, request));
  }

  @DeleteMapping("/matches/players/me")
  public ResponseEntity<LeaveResponse> leave(@RequestHeader(HEADER_USER_ID) String userId) {
    return ResponseEntity.ok(sessionService.leave(userId));
  }

  @GetMapping("/matches")
  public ResponseEntity<List<MatchView>> listMatches(
      @RequestParam(name = "game_type", required = false) String gameType,
      @RequestParam(name = "state", required = false) String state,
      @RequestParam(name = "public", required = false) Boolean publicMatch,
      @RequestParam(name = "joinable", defaultValue = "false") boolean joinable,
      @RequestParam(name = "full", defaultValue = "false") boolean full) {
    return ResponseEntity.ok(
        sessionService.listMatches(gameType, state, publicMatch, joinable, full));
  }

  @GetMapping("/matches/{matchId}")
  public ResponseEntity<MatchView> getMatch(@PathVariable("matchId") String matchId) {
    return ResponseEntity.ok(sessionService.getMatch(matchId));
  }
}
