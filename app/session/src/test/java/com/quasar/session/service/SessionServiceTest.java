package com.quasar.session.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.quasar.session.TestClock;
import com.quasar.session.api.InvalidSessionRequestException;
import com.quasar.session.api.SessionRequestException;
import com.quasar.session.api.request.EnqueueRequest;
import com.quasar.session.api.request.JoinMatchRequest;
import com.quasar.session.api.request.PrivateMatchRequest;
import com.quasar.session.api.response.EndMatchResponse;
import com.quasar.session.api.response.EnqueueResponse;
import com.quasar.session.api.response.JoinResponse;
import com.quasar.session.api.response.LeaveResponse;
import com.quasar.session.api.response.PrivateMatchResponse;
import com.quasar.session.config.SessionProperties;
import com.quasar.session.event.SessionEventBus;
import com.quasar.session.matchmaker.Matchmaker;
import com.quasar.session.model.ErrorKind;
import com.quasar.session.model.view.MatchDetail;
import com.quasar.session.model.view.MatchSummary;
import com.quasar.session.registry.InviteCodeGenerator;
import com.quasar.session.registry.MatchRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.Map;
import java.util.Random;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SessionServiceTest {

  private MatchRegistry registry;
  private SessionService service;

  @BeforeEach
  void setUp() {
    final TestClock clock = TestClock.at("2026-03-01T10:00:00Z");
    final SessionMetrics metrics = new SessionMetrics(new SimpleMeterRegistry());
    final SessionEventBus eventBus = new SessionEventBus(clock, metrics);
    registry = new MatchRegistry(eventBus, new InviteCodeGenerator(new Random(3)), metrics, clock);
    final Matchmaker matchmaker =
        new Matchmaker(registry, eventBus, metrics, SessionProperties.defaults(), clock);
    service = new SessionService(matchmaker, registry);
  }

  @Test
  void enqueueReturnsMatchedSummary() {
    final EnqueueResponse response =
        service.enqueue("pong", "p1", new EnqueueRequest("ABC", "Alice", 1200.0, Map.of()));

    assertThat(response.gameType()).isEqualTo("pong");
    assertThat(response.position()).isEqualTo(1);
    assertThat(response.matched()).isTrue();
    assertThat(response.match()).isInstanceOf(MatchSummary.class);
    assertThat(response.match().id()).isEqualTo("0x00");
  }

  @Test
  void enqueueErrorBecomesSessionRequestException() {
    assertThatThrownBy(() -> service.enqueue("chess", "p1", null))
        .isInstanceOf(SessionRequestException.class)
        .hasMessage("Unknown game type: chess")
        .extracting(ex -> ((SessionRequestException) ex).code())
        .isEqualTo("SESSION_UNKNOWN_GAME_TYPE");
  }

  @Test
  void blankPlayerIdIsRejected() {
    assertThatThrownBy(() -> service.leave(" "))
        .isInstanceOf(InvalidSessionRequestException.class)
        .hasMessageContaining("X-User-Id");
  }

  @Test
  void positionOfUnqueuedPlayerIsConflict() {
    assertThatThrownBy(() -> service.getPosition("p1"))
        .isInstanceOf(SessionRequestException.class)
        .extracting(ex -> ((SessionRequestException) ex).kind())
        .isEqualTo(ErrorKind.PLAYER_NOT_QUEUED);
  }

  @Test
  void privateFlowAndLeave() {
    final PrivateMatchResponse created =
        service.createPrivate("host", new PrivateMatchRequest("trax", "HST", null));
    final JoinResponse joined =
        service.joinPrivate(created.inviteCode(), "guest", new JoinMatchRequest("GST", null));

    assertThat(joined.matchId()).isEqualTo(created.matchId());
    assertThat(joined.slot()).isEqualTo(1);
    assertThat(joined.match()).isInstanceOf(MatchDetail.class);

    final LeaveResponse left = service.leave("guest");
    assertThat(left.slot()).isEqualTo(1);
    assertThat(left.matchEnded()).isFalse();
  }

  @Test
  void publicViewsOfPrivateMatchHideInviteCode() throws Exception {
    final ObjectMapper objectMapper = new ObjectMapper();
    final PrivateMatchResponse created =
        service.createPrivate("host", new PrivateMatchRequest("pong", "HST", null));
    final String code = created.inviteCode();

    final String detail = objectMapper.writeValueAsString(service.getMatch(created.matchId()));
    final String listed =
        objectMapper.writeValueAsString(service.listMatches(null, null, null, false, true));
    final String joined =
        objectMapper.writeValueAsString(
            service.joinPrivate(code, "guest", new JoinMatchRequest("GST", null)));

    assertThat(detail).contains("\"public\":false").doesNotContain(code);
    assertThat(listed).contains(created.matchId()).doesNotContain(code);
    assertThat(joined).doesNotContain(code);
    assertThat(objectMapper.writeValueAsString(created)).contains(code);
  }

  @Test
  void listMatchesParsesStateFilter() {
    service.enqueue("trax", "p1", null);

    assertThat(service.listMatches(null, "lobby", null, false, false)).hasSize(1);
    assertThat(service.listMatches(null, "playing", null, false, false)).isEmpty();
    assertThatThrownBy(() -> service.listMatches(null, "bogus", null, false, false))
        .isInstanceOf(InvalidSessionRequestException.class);
  }

  @Test
  void getMatchReturnsFullViewOrNotFound() {
    service.enqueue("trax", "p1", null);

    assertThat(service.getMatch("0x00")).isInstanceOf(MatchDetail.class);
    assertThatThrownBy(() -> service.getMatch("0x42"))
        .isInstanceOf(SessionRequestException.class)
        .extracting(ex -> ((SessionRequestException) ex).kind())
        .isEqualTo(ErrorKind.MATCH_NOT_FOUND);
  }

  @Test
  void adminEndUsesAdminReasonByDefault() {
    service.enqueue("trax", "p1", null);

    final EndMatchResponse ended = service.endMatch("0x00", null);

    assertThat(ended.matchId()).isEqualTo("0x00");
    assertThat(ended.result().reason()).isEqualTo(SessionService.ADMIN_END_REASON);
    assertThat(registry.isPlayerInMatch("p1")).isFalse();
    assertThat(service.stats().registry().ended()).isEqualTo(1);
  }
}
