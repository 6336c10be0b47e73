package com.quasar.session.model;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.quasar.session.TestClock;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class MatchViewJsonTest {

  private final ObjectMapper objectMapper = new ObjectMapper();

  @Test
  void compactViewUsesClientFieldNames() throws Exception {
    final Match match =
        new Match(
            31,
            "trax",
            MatchConfig.resolve(MatchOptions.defaults(), null),
            TestClock.at("2026-03-01T10:00:00Z"));
    match.addPlayer("p1", null, null);

    final JsonNode json = objectMapper.valueToTree(match.toView(false));

    final List<String> fields = new ArrayList<>();
    json.fieldNames().forEachRemaining(fields::add);
    assertThat(fields)
        .containsExactly(
            "id", "gameType", "state", "players", "maxPlayers", "public", "joinable", "created");
    assertThat(json.get("id").asText()).isEqualTo("0x1f");
    assertThat(json.get("state").asText()).isEqualTo("lobby");
    assertThat(json.get("public").asBoolean()).isTrue();
  }

  @Test
  void fullViewAddsDetailFields() throws Exception {
    final Match match =
        new Match(
            0,
            "pong",
            MatchConfig.resolve(MatchOptions.defaults().asPrivate(), "0A0B0C"),
            TestClock.at("2026-03-01T10:00:00Z"));

    final JsonNode json = objectMapper.valueToTree(match.toView(true));

    assertThat(json.has("config")).isTrue();
    assertThat(json.get("config").get("public").asBoolean()).isFalse();
    assertThat(json.get("config").get("inviteCode").asText()).isEqualTo("0A0B0C");
    assertThat(json.has("hostSlot")).isTrue();
    assertThat(json.get("playerList").size()).isEqualTo(4);
    assertThat(json.has("lastActivity")).isTrue();
    assertThat(json.has("game")).isTrue();
  }

  @Test
  void publicViewDropsInviteCodeOnly() throws Exception {
    final Match match =
        new Match(
            0,
            "pong",
            MatchConfig.resolve(MatchOptions.defaults().asPrivate(), "0A0B0C"),
            TestClock.at("2026-03-01T10:00:00Z"));

    final JsonNode json = objectMapper.valueToTree(match.toPublicView(true));

    assertThat(json.get("config").get("inviteCode").isNull()).isTrue();
    assertThat(json.get("config").get("public").asBoolean()).isFalse();
    assertThat(json.get("public").asBoolean()).isFalse();
    assertThat(match.config().inviteCode()).isEqualTo("0A0B0C");
  }
}
