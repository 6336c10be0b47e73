package com.quasar.session.api;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.quasar.session.api.request.EnqueueRequest;
import com.quasar.session.api.request.JoinMatchRequest;
import com.quasar.session.api.request.PrivateMatchRequest;
import com.quasar.session.api.response.DequeueResponse;
import com.quasar.session.api.response.EnqueueResponse;
import com.quasar.session.api.response.JoinResponse;
import com.quasar.session.api.response.LeaveResponse;
import com.quasar.session.api.response.PrivateMatchResponse;
import com.quasar.session.api.response.QueuePositionResponse;
import com.quasar.session.model.ErrorKind;
import com.quasar.session.model.MatchState;
import com.quasar.session.model.view.MatchSummary;
import com.quasar.session.service.SessionService;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

@ActiveProfiles("test")
@WebMvcTest(SessionController.class)
@AutoConfigureMockMvc(addFilters = false)
@Import(ApiExceptionHandler.class)
class SessionControllerTest {

  @Autowired private MockMvc mockMvc;

  @MockitoBean private SessionService sessionService;

  private static MatchSummary summary(String id, int players) {
    return new MatchSummary(id, "pong", MatchState.LOBBY, players, 2, true, players < 2, 1L);
  }

  @Test
  void enqueueReturns200WithMatch() throws Exception {
    when(sessionService.enqueue(eq("pong"), eq("player-1"), any(EnqueueRequest.class)))
        .thenReturn(new EnqueueResponse("pong", 1, true, summary("0x00", 1)));

    mockMvc
        .perform(
            post("/v1/session/queues/pong/players")
                .header("X-User-Id", "player-1")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"monogram":"ABC","skill":1200}
                    """))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.game_type").value("pong"))
        .andExpect(jsonPath("$.matched").value(true))
        .andExpect(jsonPath("$.match.id").value("0x00"))
        .andExpect(jsonPath("$.match.gameType").value("pong"))
        .andExpect(jsonPath("$.match.public").value(true))
        .andExpect(jsonPath("$.match.state").value("lobby"));
  }

  @Test
  void enqueueWithoutBodyIsAccepted() throws Exception {
    when(sessionService.enqueue(eq("trax"), eq("player-1"), isNull()))
        .thenReturn(new EnqueueResponse("trax", 2, false, null));

    mockMvc
        .perform(post("/v1/session/queues/trax/players").header("X-User-Id", "player-1"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.position").value(2))
        .andExpect(jsonPath("$.matched").value(false));
  }

  @Test
  void enqueueUnknownGameTypeReturns400() throws Exception {
    when(sessionService.enqueue(eq("chess"), eq("player-1"), any()))
        .thenThrow(
            new SessionRequestException(ErrorKind.UNKNOWN_GAME_TYPE, "Unknown game type: chess"));

    mockMvc
        .perform(post("/v1/session/queues/chess/players").header("X-User-Id", "player-1"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("SESSION_UNKNOWN_GAME_TYPE"))
        .andExpect(jsonPath("$.message").value("Unknown game type: chess"));
  }

  @Test
  void enqueueRejectsOverlongMonogram() throws Exception {
    mockMvc
        .perform(
            post("/v1/session/queues/pong/players")
                .header("X-User-Id", "player-1")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"monogram":"ABCDEFG"}
                    """))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("SESSION_VALIDATION_ERROR"));
  }

  @Test
  void dequeueAndPosition() throws Exception {
    when(sessionService.dequeue("player-1"))
        .thenReturn(new DequeueResponse("player-1", "pong", "dequeued"));
    when(sessionService.getPosition("player-2"))
        .thenReturn(new QueuePositionResponse("pong", 2, 3, 1500L));

    mockMvc
        .perform(delete("/v1/session/queues/players/me").header("X-User-Id", "player-1"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.player_id").value("player-1"))
        .andExpect(jsonPath("$.status").value("dequeued"));
    mockMvc
        .perform(get("/v1/session/queues/players/me").header("X-User-Id", "player-2"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.position").value(2))
        .andExpect(jsonPath("$.queue_size").value(3))
        .andExpect(jsonPath("$.waited_ms").value(1500));
  }

  @Test
  void dequeueWhenNotQueuedReturns409() throws Exception {
    when(sessionService.dequeue("player-1"))
        .thenThrow(
            new SessionRequestException(
                ErrorKind.PLAYER_NOT_QUEUED, ErrorKind.PLAYER_NOT_QUEUED.message()));

    mockMvc
        .perform(delete("/v1/session/queues/players/me").header("X-User-Id", "player-1"))
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.code").value("SESSION_PLAYER_NOT_QUEUED"));
  }

  @Test
  void createPrivateReturnsInviteCode() throws Exception {
    when(sessionService.createPrivate(eq("host"), any(PrivateMatchRequest.class)))
        .thenReturn(new PrivateMatchResponse("0x03", "A1B2C3", 0, summary("0x03", 1)));

    mockMvc
        .perform(
            post("/v1/session/private-matches")
                .header("X-User-Id", "host")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"game_type":"pong","monogram":"HST"}
                    """))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.match_id").value("0x03"))
        .andExpect(jsonPath("$.invite_code").value("A1B2C3"));
  }

  @Test
  void createPrivateRequiresGameType() throws Exception {
    mockMvc
        .perform(
            post("/v1/session/private-matches")
                .header("X-User-Id", "host")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("SESSION_VALIDATION_ERROR"));
  }

  @Test
  void joinPrivateWithUnknownCodeReturns404() throws Exception {
    when(sessionService.joinPrivate(eq("ZZZZZZ"), eq("guest"), any()))
        .thenThrow(
            new SessionRequestException(
                ErrorKind.INVALID_INVITE_CODE, ErrorKind.INVALID_INVITE_CODE.message()));

    mockMvc
        .perform(post("/v1/session/private-matches/ZZZZZZ/players").header("X-User-Id", "guest"))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.code").value("SESSION_INVALID_INVITE_CODE"));
  }

  @Test
  void joinFullMatchReturns503() throws Exception {
    when(sessionService.joinMatch(eq("0x01"), eq("guest"), any(JoinMatchRequest.class)))
        .thenThrow(
            new SessionRequestException(ErrorKind.MATCH_FULL, ErrorKind.MATCH_FULL.message()));

    mockMvc
        .perform(
            post("/v1/session/matches/0x01/players")
                .header("X-User-Id", "guest")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"monogram":"GST"}
                    """))
        .andExpect(status().isServiceUnavailable())
        .andExpect(jsonPath("$.code").value("SESSION_MATCH_FULL"));
  }

  @Test
  void joinMatchReturnsSlot() throws Exception {
    when(sessionService.joinMatch(eq("0x01"), eq("guest"), any()))
        .thenReturn(new JoinResponse("0x01", 1, summary("0x01", 2)));

    mockMvc
        .perform(post("/v1/session/matches/0x01/players").header("X-User-Id", "guest"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.slot").value(1))
        .andExpect(jsonPath("$.match.players").value(2));
  }

  @Test
  void leaveReturnsMatchEnded() throws Exception {
    when(sessionService.leave("player-1")).thenReturn(new LeaveResponse("0x01", 0, true));

    mockMvc
        .perform(delete("/v1/session/matches/players/me").header("X-User-Id", "player-1"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.match_ended").value(true));
  }

  @Test
  void listMatchesPassesFilters() throws Exception {
    when(sessionService.listMatches("pong", "lobby", true, true, false))
        .thenReturn(List.of(summary("0x00", 1), summary("0x01", 0)));

    mockMvc
        .perform(
            get("/v1/session/matches")
                .param("game_type", "pong")
                .param("state", "lobby")
                .param("public", "true")
                .param("joinable", "true"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.length()").value(2))
        .andExpect(jsonPath("$[1].id").value("0x01"));

    verify(sessionService).listMatches("pong", "lobby", true, true, false);
  }

  @Test
  void getMatchNotFoundReturns404() throws Exception {
    when(sessionService.getMatch("0x42"))
        .thenThrow(
            new SessionRequestException(
                ErrorKind.MATCH_NOT_FOUND, ErrorKind.MATCH_NOT_FOUND.message()));

    mockMvc
        .perform(get("/v1/session/matches/0x42"))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.code").value("SESSION_MATCH_NOT_FOUND"));
  }
}
