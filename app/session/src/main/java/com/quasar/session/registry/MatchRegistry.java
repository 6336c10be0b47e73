/*
 * どこで: Session Registry
 * 何を: 240 スロット固定の Match テーブルと player / invite 索引を管理する
 * なぜ: スロット割り当てと索引更新を単一の監視ロック下で一貫させるため
 */
package com.quasar.session.registry;

import com.quasar.common.result.Result;
import com.quasar.session.event.SessionEventBus;
import com.quasar.session.event.SessionEventPayload;
import com.quasar.session.event.SessionEventType;
import com.quasar.session.model.ErrorKind;
import com.quasar.session.model.Match;
import com.quasar.session.model.MatchConfig;
import com.quasar.session.model.MatchFilter;
import com.quasar.session.model.MatchOptions;
import com.quasar.session.model.PlayerSlot;
import com.quasar.session.model.view.MatchEndSummary;
import com.quasar.session.model.view.MatchView;
import com.quasar.session.model.view.RegistrySnapshot;
import com.quasar.session.model.view.RegistryStats;
import com.quasar.session.service.SessionMetrics;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class MatchRegistry {

  /** Slots 0x00-0xEF; 0xF0-0xFF are reserved for system use. */
  public static final int MAX_MATCHES = 240;

  public static final String REASON_COMPLETED = "completed";
  public static final String REASON_EMPTY = "empty";

  private static final Logger logger = LoggerFactory.getLogger(MatchRegistry.class);

  private final Match[] matches = new Match[MAX_MATCHES];
  private final Map<String, Integer> playerIndex = new HashMap<>();
  private final Map<String, Integer> inviteIndex = new HashMap<>();
  private final SessionEventBus eventBus;
  private final InviteCodeGenerator inviteCodes;
  private final SessionMetrics metrics;
  private final Clock clock;

  private long createdTotal;
  private long endedTotal;
  private int peakActive;

  public MatchRegistry(
      SessionEventBus eventBus,
      InviteCodeGenerator inviteCodes,
      SessionMetrics metrics,
      Clock clock) {
    this.eventBus = eventBus;
    this.inviteCodes = inviteCodes;
    this.metrics = metrics;
    this.clock = clock;
  }

  public synchronized int activeCount() {
    int count = 0;
    for (Match match : matches) {
      if (match != null) {
        count++;
      }
    }
    return count;
  }

  public synchronized int availableCount() {
    return MAX_MATCHES - activeCount();
  }

  /**
   * 役割: Match を新規作成し、最小番号の空きスロットへ配置する。
   * 動作: 空きがなければ NO_MATCH_SLOTS を返す。非公開指定なら招待コードを発行して索引へ登録し、created を発行する。
   * 前提: gameType は呼び出し側で妥当性確認済みであること。
   */
  public synchronized Result<Match, ErrorKind> create(String gameType, MatchOptions options) {
    final int slot = allocate();
    if (slot < 0) {
      logger.warn("match create rejected, registry full gameType={}", gameType);
      return ErrorKind.NO_MATCH_SLOTS.result();
    }
    final boolean privateMatch = options != null && options.privateMatch();
    final String inviteCode = privateMatch ? newInviteCode() : null;
    final Match match = new Match(slot, gameType, MatchConfig.resolve(options, inviteCode), clock);
    matches[slot] = match;
    if (inviteCode != null) {
      inviteIndex.put(inviteCode, slot);
    }

    createdTotal++;
    final int active = activeCount();
    peakActive = Math.max(peakActive, active);
    metrics.updateActiveMatches(active);
    logger.info(
        "match created id={} gameType={} private={}", match.idHex(), gameType, privateMatch);

    eventBus.publish(SessionEventType.CREATED, new SessionEventPayload.MatchCreated(match));
    return Result.ok(match);
  }

  public synchronized Optional<Match> get(int id) {
    if (id < 0 || id >= MAX_MATCHES) {
      return Optional.empty();
    }
    return Optional.ofNullable(matches[id]);
  }

  /** Accepts {@code "0x1f"} or bare hex {@code "1f"}; anything unparsable is not found. */
  public synchronized Optional<Match> get(String id) {
    return parseMatchId(id).flatMap(this::get);
  }

  public synchronized Optional<Match> getByInvite(String code) {
    final String normalized = InviteCodeGenerator.normalize(code);
    if (normalized == null) {
      return Optional.empty();
    }
    final Integer slot = inviteIndex.get(normalized);
    return slot == null ? Optional.empty() : get(slot);
  }

  public synchronized Optional<Match> getByPlayer(String playerId) {
    final Integer slot = playerId == null ? null : playerIndex.get(playerId);
    return slot == null ? Optional.empty() : get(slot);
  }

  public synchronized boolean isPlayerInMatch(String playerId) {
    return playerId != null && playerIndex.containsKey(playerId);
  }

  public synchronized Result<JoinResult, ErrorKind> join(
      String matchId, String playerId, String monogram, String name) {
    return join(get(matchId), playerId, monogram, name);
  }

  public synchronized Result<JoinResult, ErrorKind> join(
      int matchId, String playerId, String monogram, String name) {
    return join(get(matchId), playerId, monogram, name);
  }

  /**
   * 役割: プレイヤーを Match へ参加させ、player 索引を更新する。
   * 動作: Match 不在なら MATCH_NOT_FOUND、既に別 Match に所属していれば PLAYER_ALREADY_IN_MATCH を返す。それ以外は Match.addPlayer
   * の結果に従う。
   * 前提: monitor 取得済みで呼び出すこと。
   */
  private Result<JoinResult, ErrorKind> join(
      Optional<Match> target, String playerId, String monogram, String name) {
    Objects.requireNonNull(playerId, "playerId");
    if (target.isEmpty()) {
      return ErrorKind.MATCH_NOT_FOUND.result();
    }
    if (playerIndex.containsKey(playerId)) {
      return ErrorKind.PLAYER_ALREADY_IN_MATCH.result();
    }
    final Match match = target.get();
    final Result<PlayerSlot, ErrorKind> added = match.addPlayer(playerId, monogram, name);
    if (added.isErr()) {
      return Result.err(added.kind(), added.message());
    }
    playerIndex.put(playerId, match.id());
    logger.debug(
        "player joined match id={} playerId={} slot={}",
        match.idHex(),
        playerId,
        added.value().slot());

    eventBus.publish(
        SessionEventType.JOINED, new SessionEventPayload.PlayerJoined(match, added.value()));
    return Result.ok(new JoinResult(match, added.value()));
  }

  /**
   * 役割: プレイヤーを所属 Match から退出させる。
   * 動作: 退出後に接続中プレイヤーが 0 人になった Match は reason=empty で end() する。
   * 前提: なし。未所属なら PLAYER_NOT_IN_MATCH を返す。
   */
  public synchronized Result<LeaveResult, ErrorKind> leave(String playerId) {
    final Optional<Match> current = getByPlayer(playerId);
    if (current.isEmpty()) {
      return ErrorKind.PLAYER_NOT_IN_MATCH.result();
    }
    final Match match = current.get();
    final Result<Integer, ErrorKind> removed = match.removePlayer(playerId);
    if (removed.isErr()) {
      return Result.err(removed.kind(), removed.message());
    }
    playerIndex.remove(playerId);
    logger.debug(
        "player left match id={} playerId={} slot={}", match.idHex(), playerId, removed.value());

    eventBus.publish(
        SessionEventType.LEFT,
        new SessionEventPayload.PlayerLeft(match, playerId, removed.value()));

    boolean ended = false;
    if (match.playerCount() == 0) {
      ended = end(match.id(), REASON_EMPTY).isOk();
    }
    return Result.ok(new LeaveResult(match, playerId, removed.value(), ended));
  }

  public synchronized Result<EndResult, ErrorKind> end(String matchId, String reason) {
    return parseMatchId(matchId)
        .map(id -> end(id, reason))
        .orElseGet(() -> ErrorKind.MATCH_NOT_FOUND.result());
  }

  /**
   * 役割: Match を終了し、スロットと全索引を解放する。
   * 動作: 所属プレイヤーの player 索引と招待コード索引を消し、スロットを空にして ended を発行する。
   * 前提: Match を空にする / 終了させる全経路はここを通ること。
   */
  public synchronized Result<EndResult, ErrorKind> end(int matchId, String reason) {
    final Optional<Match> target = get(matchId);
    if (target.isEmpty()) {
      return ErrorKind.MATCH_NOT_FOUND.result();
    }
    final Match match = target.get();
    final MatchEndSummary summary = match.end(reason == null ? REASON_COMPLETED : reason);

    for (PlayerSlot seat : match.players()) {
      if (seat.playerId() != null) {
        playerIndex.remove(seat.playerId());
      }
    }
    if (match.config().inviteCode() != null) {
      inviteIndex.remove(match.config().inviteCode());
    }
    matches[match.id()] = null;

    endedTotal++;
    metrics.updateActiveMatches(activeCount());
    logger.info(
        "match ended id={} gameType={} reason={} durationMs={}",
        match.idHex(),
        match.gameType(),
        summary.reason(),
        summary.duration());

    eventBus.publish(SessionEventType.ENDED, new SessionEventPayload.MatchEnded(match, summary));
    return Result.ok(new EndResult(match, summary));
  }

  public synchronized List<Match> list(MatchFilter filter) {
    final MatchFilter effective = filter == null ? MatchFilter.all() : filter;
    final List<Match> result = new ArrayList<>();
    for (Match match : matches) {
      if (match != null && effective.matches(match)) {
        result.add(match);
      }
    }
    return result;
  }

  public synchronized List<MatchView> listViews(MatchFilter filter) {
    final boolean full = filter != null && filter.full();
    return list(filter).stream().map(match -> match.toView(full)).toList();
  }

  /** 招待コードを伏せた一覧。公開 API 向け。 */
  public synchronized List<MatchView> listPublicViews(MatchFilter filter) {
    final boolean full = filter != null && filter.full();
    return list(filter).stream().map(match -> match.toPublicView(full)).toList();
  }

  /**
   * 役割: Match の表示を監視ロック下で組み立てる。
   * 動作: 渡された Match インスタンスをそのまま描画する。終了済みでも最終状態を返す。
   * 前提: Registry 外で保持している Match の描画はここを通すこと。
   */
  public synchronized MatchView view(Match match, boolean full) {
    return match.toView(full);
  }

  public synchronized MatchView publicView(Match match, boolean full) {
    return match.toPublicView(full);
  }

  public synchronized Optional<MatchView> publicView(String matchId) {
    return get(matchId).map(match -> match.toPublicView(true));
  }

  public synchronized List<Match> getActive() {
    return list(MatchFilter.all());
  }

  public synchronized RegistryStats getStats() {
    final Map<String, Integer> byState = new TreeMap<>();
    final Map<String, Integer> byGameType = new TreeMap<>();
    for (Match match : getActive()) {
      byState.merge(match.state().value(), 1, Integer::sum);
      byGameType.merge(match.gameType(), 1, Integer::sum);
    }
    final int active = activeCount();
    return new RegistryStats(
        MAX_MATCHES,
        active,
        MAX_MATCHES - active,
        playerIndex.size(),
        byState,
        byGameType,
        createdTotal,
        endedTotal,
        peakActive);
  }

  public synchronized RegistrySnapshot snapshot() {
    return new RegistrySnapshot(getStats(), listViews(MatchFilter.all()));
  }

  private int allocate() {
    for (int i = 0; i < MAX_MATCHES; i++) {
      if (matches[i] == null) {
        return i;
      }
    }
    return -1;
  }

  private String newInviteCode() {
    String code = inviteCodes.generate();
    while (inviteIndex.containsKey(code)) {
      code = inviteCodes.generate();
    }
    return code;
  }

  static Optional<Integer> parseMatchId(String id) {
    if (id == null || id.isBlank()) {
      return Optional.empty();
    }
    final String trimmed = id.trim();
    final String digits =
        trimmed.startsWith("0x") || trimmed.startsWith("0X") ? trimmed.substring(2) : trimmed;
    try {
      return Optional.of(Integer.parseInt(digits, 16));
    } catch (NumberFormatException ex) {
      return Optional.empty();
    }
  }
}
