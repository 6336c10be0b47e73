/*
 * どこで: Session サービス層
 * 何を: HTTP 入力を Matchmaker / Registry 呼び出しへ変換し、応答 DTO を組み立てる
 * なぜ: コアの Result を API の例外とレスポンス形状から切り離すため
 */
package com.quasar.session.service;

import com.quasar.common.result.Result;
import com.quasar.session.api.InvalidSessionRequestException;
import com.quasar.session.api.SessionRequestException;
import com.quasar.session.api.request.EnqueueRequest;
import com.quasar.session.api.request.JoinMatchRequest;
import com.quasar.session.api.request.PrivateMatchRequest;
import com.quasar.session.api.response.AdminSnapshotResponse;
import com.quasar.session.api.response.AdminStatsResponse;
import com.quasar.session.api.response.DequeueResponse;
import com.quasar.session.api.response.EndMatchResponse;
import com.quasar.session.api.response.EnqueueResponse;
import com.quasar.session.api.response.JoinResponse;
import com.quasar.session.api.response.LeaveResponse;
import com.quasar.session.api.response.PrivateMatchResponse;
import com.quasar.session.api.response.QueuePositionResponse;
import com.quasar.session.matchmaker.EnqueueResult;
import com.quasar.session.matchmaker.Matchmaker;
import com.quasar.session.matchmaker.PrivateMatchTicket;
import com.quasar.session.matchmaker.QueuePosition;
import com.quasar.session.model.ErrorKind;
import com.quasar.session.model.MatchFilter;
import com.quasar.session.model.MatchState;
import com.quasar.session.model.QueueOptions;
import com.quasar.session.model.QueuedPlayer;
import com.quasar.session.model.view.MatchView;
import com.quasar.session.registry.EndResult;
import com.quasar.session.registry.JoinResult;
import com.quasar.session.registry.LeaveResult;
import com.quasar.session.registry.MatchRegistry;
import java.util.List;
import org.springframework.stereotype.Service;

@Service
public class SessionService {

  static final String ADMIN_END_REASON = "admin";

  private final Matchmaker matchmaker;
  private final MatchRegistry registry;

  public SessionService(Matchmaker matchmaker, MatchRegistry registry) {
    this.matchmaker = matchmaker;
    this.registry = registry;
  }

  public EnqueueResponse enqueue(String gameType, String playerId, EnqueueRequest request) {
    final String player = requirePlayerId(playerId);
    final QueueOptions options =
        request == null
            ? QueueOptions.none()
            : new QueueOptions(
                request.monogram(), request.name(), request.skill(), request.preferences());
    final EnqueueResult result = unwrap(matchmaker.enqueue(player, gameType, options));
    return new EnqueueResponse(
        result.gameType(),
        result.position(),
        result.isMatched(),
        result.isMatched() ? registry.publicView(result.matched(), false) : null);
  }

  public DequeueResponse dequeue(String playerId) {
    final QueuedPlayer removed = unwrap(matchmaker.dequeue(requirePlayerId(playerId)));
    return new DequeueResponse(removed.playerId(), removed.gameType(), "dequeued");
  }

  public QueuePositionResponse getPosition(String playerId) {
    final QueuePosition position =
        matchmaker
            .getPosition(requirePlayerId(playerId))
            .orElseThrow(
                () ->
                    new SessionRequestException(
                        ErrorKind.PLAYER_NOT_QUEUED, ErrorKind.PLAYER_NOT_QUEUED.message()));
    return new QueuePositionResponse(
        position.gameType(), position.position(), position.queueSize(), position.waitedMs());
  }

  public PrivateMatchResponse createPrivate(String playerId, PrivateMatchRequest request) {
    final PrivateMatchTicket ticket =
        unwrap(
            matchmaker.createPrivate(
                requirePlayerId(playerId),
                request.gameType(),
                QueueOptions.of(request.monogram(), request.name())));
    return new PrivateMatchResponse(
        ticket.match().idHex(),
        ticket.inviteCode(),
        ticket.slot(),
        registry.view(ticket.match(), true));
  }

  public JoinResponse joinPrivate(String inviteCode, String playerId, JoinMatchRequest request) {
    final JoinResult joined =
        unwrap(matchmaker.joinPrivate(requirePlayerId(playerId), inviteCode, toOptions(request)));
    return toJoinResponse(joined);
  }

  public JoinResponse joinMatch(String matchId, String playerId, JoinMatchRequest request) {
    final JoinResult joined =
        unwrap(matchmaker.joinMatch(requirePlayerId(playerId), matchId, toOptions(request)));
    return toJoinResponse(joined);
  }

  public LeaveResponse leave(String playerId) {
    final LeaveResult left = unwrap(registry.leave(requirePlayerId(playerId)));
    return new LeaveResponse(left.match().idHex(), left.slot(), left.matchEnded());
  }

  public List<MatchView> listMatches(
      String gameType, String state, Boolean publicMatch, boolean joinable, boolean full) {
    final MatchFilter filter =
        new MatchFilter(gameType, parseState(state), publicMatch, joinable, false, full);
    return registry.listPublicViews(filter);
  }

  public MatchView getMatch(String matchId) {
    return registry
        .publicView(matchId)
        .orElseThrow(
            () ->
                new SessionRequestException(
                    ErrorKind.MATCH_NOT_FOUND, ErrorKind.MATCH_NOT_FOUND.message()));
  }

  public AdminStatsResponse stats() {
    return new AdminStatsResponse(registry.getStats(), matchmaker.getQueueStats());
  }

  public AdminSnapshotResponse snapshot() {
    return new AdminSnapshotResponse(registry.snapshot(), matchmaker.snapshot());
  }

  public EndMatchResponse endMatch(String matchId, String reason) {
    final String resolved = reason == null || reason.isBlank() ? ADMIN_END_REASON : reason;
    final EndResult ended = unwrap(registry.end(matchId, resolved));
    return new EndMatchResponse(ended.match().idHex(), ended.summary());
  }

  private JoinResponse toJoinResponse(JoinResult joined) {
    return new JoinResponse(
        joined.match().idHex(), joined.slot(), registry.publicView(joined.match(), true));
  }

  private static QueueOptions toOptions(JoinMatchRequest request) {
    return request == null
        ? QueueOptions.none()
        : QueueOptions.of(request.monogram(), request.name());
  }

  private static String requirePlayerId(String playerId) {
    if (playerId == null || playerId.isBlank()) {
      throw new InvalidSessionRequestException("X-User-Id is required");
    }
    return playerId;
  }

  private static MatchState parseState(String state) {
    if (state == null || state.isBlank()) {
      return null;
    }
    try {
      return MatchState.fromValue(state);
    } catch (IllegalArgumentException ex) {
      throw new InvalidSessionRequestException(ex.getMessage());
    }
  }

  private static <T> T unwrap(Result<T, ErrorKind> result) {
    return result.orElseThrow(SessionRequestException::from);
  }
}
