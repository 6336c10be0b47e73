/*
 * どこで: Session ドメインモデル
 * 何を: 1 試合分の状態機械・プレイヤースロット・スコアを保持する
 * なぜ: Registry から独立して試合単位のルールを検証できるようにするため
 */
package com.quasar.session.model;

import com.quasar.common.result.Result;
import com.quasar.session.model.view.FinalScore;
import com.quasar.session.model.view.LastInput;
import com.quasar.session.model.view.MatchDetail;
import com.quasar.session.model.view.MatchEndSummary;
import com.quasar.session.model.view.MatchSummary;
import com.quasar.session.model.view.MatchView;
import com.quasar.session.model.view.PlayerView;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A single game session. Not thread-safe: the owning {@link
 * com.quasar.session.registry.MatchRegistry} serializes roster changes.
 *
 * <p>State machine: LOBBY → PLAYING ⇄ PAUSED, and any state → ENDED (terminal).
 */
public class Match {

  private static final String DEFAULT_MONOGRAM = "AAA";

  private final int id;
  private final String idHex;
  private final String gameType;
  private final MatchConfig config;
  private final PlayerSlot[] players;
  private final Map<String, Object> game = new LinkedHashMap<>();
  private final Clock clock;
  private final Instant created;

  private MatchState state = MatchState.LOBBY;
  private Integer hostSlot;
  private Instant started;
  private Instant ended;
  private Instant lastActivity;

  public Match(int id, String gameType, MatchConfig config, Clock clock) {
    this.id = id;
    this.idHex = toHex(id);
    this.gameType = gameType;
    this.config = config;
    this.clock = clock;
    this.created = clock.instant();
    this.lastActivity = created;
    this.players = new PlayerSlot[config.maxPlayers()];
    for (int i = 0; i < players.length; i++) {
      players[i] = PlayerSlot.empty(i);
    }
  }

  public static String toHex(int id) {
    return String.format("0x%02x", id);
  }

  public int id() {
    return id;
  }

  public String idHex() {
    return idHex;
  }

  public String gameType() {
    return gameType;
  }

  public MatchConfig config() {
    return config;
  }

  public MatchState state() {
    return state;
  }

  public Integer hostSlot() {
    return hostSlot;
  }

  public Instant created() {
    return created;
  }

  public Instant started() {
    return started;
  }

  public Instant ended() {
    return ended;
  }

  public Instant lastActivity() {
    return lastActivity;
  }

  public Map<String, Object> game() {
    return Collections.unmodifiableMap(game);
  }

  public List<PlayerSlot> players() {
    return List.of(players);
  }

  public int playerCount() {
    int count = 0;
    for (PlayerSlot seat : players) {
      if (seat.isActive()) {
        count++;
      }
    }
    return count;
  }

  public List<PlayerSlot> activePlayers() {
    return Arrays.stream(players).filter(PlayerSlot::isActive).toList();
  }

  public boolean isFull() {
    return playerCount() >= config.maxPlayers();
  }

  public boolean canStart() {
    return playerCount() >= config.minPlayers() && state == MatchState.LOBBY;
  }

  public boolean allReady() {
    return activePlayers().stream().allMatch(PlayerSlot::ready);
  }

  public Optional<PlayerSlot> getPlayer(String playerId) {
    if (playerId == null) {
      return Optional.empty();
    }
    return Arrays.stream(players).filter(p -> playerId.equals(p.playerId())).findFirst();
  }

  public Optional<PlayerSlot> getPlayerBySlot(int slot) {
    if (slot < 0 || slot >= players.length) {
      return Optional.empty();
    }
    return Optional.of(players[slot]);
  }

  /**
   * 役割: プレイヤーを最小番号の空きスロットへ着席させる。
   * 動作: 満員なら MATCH_FULL、joinable=false かつ LOBBY 以外なら MATCH_NOT_JOINABLE を返す。最初の着席者を host にする。
   * 前提: playerId の重複参加チェックは Registry 側で済んでいること。
   */
  public Result<PlayerSlot, ErrorKind> addPlayer(String playerId, String monogram, String name) {
    Objects.requireNonNull(playerId, "playerId");
    if (isFull()) {
      return ErrorKind.MATCH_FULL.result();
    }
    if (!config.joinable() && state != MatchState.LOBBY) {
      return ErrorKind.MATCH_NOT_JOINABLE.result();
    }
    final int slot = findOpenSlot();
    if (slot < 0) {
      return ErrorKind.NO_PLAYER_SLOTS.result();
    }
    final Instant now = clock.instant();
    final String resolvedMonogram = isBlank(monogram) ? DEFAULT_MONOGRAM : monogram;
    final String resolvedName =
        !isBlank(name) ? name : !isBlank(monogram) ? monogram : "Player " + (slot + 1);
    players[slot] = PlayerSlot.occupied(slot, playerId, resolvedMonogram, resolvedName, now);
    if (hostSlot == null) {
      hostSlot = slot;
    }
    lastActivity = now;
    return Result.ok(players[slot]);
  }

  /**
   * 役割: プレイヤーをスロットから外す。
   * 動作: スロットを空テンプレートへ戻し、host だった場合は残りの接続中プレイヤーの最小スロットへ付け替える。
   * 前提: なし。未参加なら PLAYER_NOT_FOUND を返す。
   */
  public Result<Integer, ErrorKind> removePlayer(String playerId) {
    final Optional<PlayerSlot> seat = getPlayer(playerId);
    if (seat.isEmpty()) {
      return ErrorKind.PLAYER_NOT_FOUND.result();
    }
    final int slot = seat.get().slot();
    players[slot] = PlayerSlot.empty(slot);
    if (hostSlot != null && hostSlot == slot) {
      hostSlot =
          Arrays.stream(players).filter(PlayerSlot::isActive).map(PlayerSlot::slot).findFirst()
              .orElse(null);
    }
    lastActivity = clock.instant();
    return Result.ok(slot);
  }

  public Result<MatchState, ErrorKind> start() {
    if (!canStart()) {
      return ErrorKind.CANNOT_START.result();
    }
    state = MatchState.PLAYING;
    started = clock.instant();
    lastActivity = started;
    return Result.ok(state);
  }

  public Result<MatchState, ErrorKind> pause() {
    if (state != MatchState.PLAYING) {
      return ErrorKind.MATCH_NOT_PLAYING.result();
    }
    state = MatchState.PAUSED;
    lastActivity = clock.instant();
    return Result.ok(state);
  }

  public Result<MatchState, ErrorKind> resume() {
    if (state != MatchState.PAUSED) {
      return ErrorKind.MATCH_NOT_PAUSED.result();
    }
    state = MatchState.PLAYING;
    lastActivity = clock.instant();
    return Result.ok(state);
  }

  /**
   * 役割: 試合を終了させ、結果を集計する。
   * 動作: どの状態からでも ENDED へ遷移し、開始時刻（未開始なら作成時刻）からの経過ミリ秒と各スロットの得点を返す。
   * 前提: 呼び出し後の状態変更は行わないこと。
   */
  public MatchEndSummary end(String reason) {
    state = MatchState.ENDED;
    ended = clock.instant();
    lastActivity = ended;
    final Instant from = started == null ? created : started;
    final List<FinalScore> scores =
        activePlayers().stream()
            .map(p -> new FinalScore(p.slot(), p.monogram(), p.score()))
            .toList();
    return new MatchEndSummary(reason, ended.toEpochMilli() - from.toEpochMilli(), scores);
  }

  public void heartbeat(String playerId) {
    getPlayer(playerId)
        .ifPresent(
            seat -> {
              final Instant now = clock.instant();
              seat.markConnected(now);
              lastActivity = now;
            });
  }

  public void setReady(String playerId, boolean ready) {
    getPlayer(playerId)
        .ifPresent(
            seat -> {
              seat.setReady(ready);
              lastActivity = clock.instant();
            });
  }

  public void setScore(int slot, int score) {
    getPlayerBySlot(slot)
        .ifPresent(
            seat -> {
              seat.setScore(score);
              lastActivity = clock.instant();
            });
  }

  public void addScore(int slot, int points) {
    getPlayerBySlot(slot)
        .ifPresent(
            seat -> {
              seat.addScore(points);
              lastActivity = clock.instant();
            });
  }

  /** Shallow merge: top-level keys of {@code update} replace existing ones. */
  public void setGameState(Map<String, ?> update) {
    if (update != null) {
      game.putAll(update);
    }
    lastActivity = clock.instant();
  }

  public void recordInput(String playerId, Object input) {
    getPlayer(playerId)
        .ifPresent(
            seat -> {
              final Instant now = clock.instant();
              seat.touch(now);
              lastActivity = now;
              game.put("lastInput", new LastInput(playerId, input, now.toEpochMilli()));
            });
  }

  public Optional<LastInput> lastInput() {
    final Object value = game.get("lastInput");
    return value instanceof LastInput input ? Optional.of(input) : Optional.empty();
  }

  public MatchView toView(boolean full) {
    return render(full, true);
  }

  /** 招待コードを伏せた表示。Match 参加者以外へ返す応答に使う。 */
  public MatchView toPublicView(boolean full) {
    return render(full, false);
  }

  private MatchView render(boolean full, boolean includeInviteCode) {
    final int count = playerCount();
    final boolean joinable = config.joinable() && !isFull();
    if (!full) {
      return new MatchSummary(
          idHex,
          gameType,
          state,
          count,
          config.maxPlayers(),
          config.publicMatch(),
          joinable,
          created.toEpochMilli());
    }
    final List<PlayerView> roster = new ArrayList<>(players.length);
    for (PlayerSlot p : players) {
      roster.add(
          new PlayerView(p.slot(), p.monogram(), p.name(), p.connected(), p.ready(), p.score()));
    }
    return new MatchDetail(
        idHex,
        gameType,
        state,
        count,
        config.maxPlayers(),
        config.publicMatch(),
        joinable,
        created.toEpochMilli(),
        includeInviteCode ? config : config.withoutInviteCode(),
        hostSlot,
        started == null ? null : started.toEpochMilli(),
        lastActivity.toEpochMilli(),
        List.copyOf(roster),
        Collections.unmodifiableMap(new LinkedHashMap<>(game)));
  }

  private int findOpenSlot() {
    for (PlayerSlot seat : players) {
      if (seat.isOpen()) {
        return seat.slot();
      }
    }
    return -1;
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
