/*
 * どこで: Session Matchmaker
 * 何を: ゲーム種別ごとの待機キュー・マッチ成立・非公開 Match の招待フローを管理する
 * なぜ: プレイヤーを Registry 上の Match へ配置する判断を 1 か所へ集約するため
 */
package com.quasar.session.matchmaker;

import com.quasar.common.result.Result;
import com.quasar.session.config.SessionProperties;
import com.quasar.session.event.SessionEventBus;
import com.quasar.session.event.SessionEventPayload;
import com.quasar.session.event.SessionEventType;
import com.quasar.session.model.ErrorKind;
import com.quasar.session.model.GameTypeConfig;
import com.quasar.session.model.Match;
import com.quasar.session.model.QueueOptions;
import com.quasar.session.model.QueuedPlayer;
import com.quasar.session.registry.JoinResult;
import com.quasar.session.registry.MatchRegistry;
import com.quasar.session.service.SessionMetrics;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Queues players per game type and pairs them into registry matches.
 *
 * <p>All public methods synchronize on this instance, so the periodic {@link #tick()} and direct
 * API calls never interleave. The registry is only ever called while holding this monitor (lock
 * order matchmaker → registry).
 */
@Service
public class Matchmaker {

  private static final Logger logger = LoggerFactory.getLogger(Matchmaker.class);

  private final MatchRegistry registry;
  private final SessionEventBus eventBus;
  private final SessionMetrics metrics;
  private final Clock clock;
  private final Duration maxQueueTime;
  private final Map<String, GameTypeConfig> gameConfigs;
  private final Map<String, List<QueuedPlayer>> queues = new LinkedHashMap<>();
  private final Map<String, String> playerQueue = new HashMap<>();

  private boolean running;
  private long queuedTotal;
  private long matchedTotal;
  private long timedOutTotal;
  private long cancelledTotal;

  public Matchmaker(
      MatchRegistry registry,
      SessionEventBus eventBus,
      SessionMetrics metrics,
      SessionProperties properties,
      Clock clock) {
    this.registry = registry;
    this.eventBus = eventBus;
    this.metrics = metrics;
    this.clock = clock;
    this.maxQueueTime = properties.maxQueueTime();
    this.gameConfigs = properties.resolveGameTypes();
    for (String gameType : gameConfigs.keySet()) {
      queues.put(gameType, new ArrayList<>());
    }
  }

  public synchronized void start() {
    if (!running) {
      running = true;
      logger.info("matchmaker started gameTypes={}", gameConfigs.keySet());
    }
  }

  public synchronized void stop() {
    if (running) {
      running = false;
      logger.info("matchmaker stopped");
    }
  }

  public synchronized boolean isRunning() {
    return running;
  }

  /** Scheduler entry point: runs one {@link #checkQueues()} pass while started. */
  public synchronized int tick() {
    return running ? checkQueues() : 0;
  }

  public Optional<GameTypeConfig> getGameConfig(String gameType) {
    return Optional.ofNullable(gameType == null ? null : gameConfigs.get(gameType));
  }

  /**
   * 役割: プレイヤーを指定ゲーム種別のキュー末尾へ追加する。
   * 動作: 未知の種別・キュー待機中・Match 参加中なら失敗を返す。追加後すぐに tryMatch を試み、成立した場合は結果に Match を含める。
   * 前提: playerId は認証済みの不透明 ID であること。
   */
  public synchronized Result<EnqueueResult, ErrorKind> enqueue(
      String playerId, String gameType, QueueOptions options) {
    Objects.requireNonNull(playerId, "playerId");
    final GameTypeConfig config = gameType == null ? null : gameConfigs.get(gameType);
    if (config == null) {
      return ErrorKind.UNKNOWN_GAME_TYPE.result(gameType);
    }
    if (playerQueue.containsKey(playerId)) {
      return ErrorKind.PLAYER_ALREADY_QUEUED.result();
    }
    if (registry.isPlayerInMatch(playerId)) {
      return ErrorKind.PLAYER_ALREADY_IN_MATCH.result();
    }

    final QueueOptions opts = options == null ? QueueOptions.none() : options;
    final QueuedPlayer player =
        new QueuedPlayer(
            playerId,
            gameType,
            opts.monogram(),
            opts.name(),
            opts.skillOrDefault(),
            clock.instant(),
            opts.preferences());
    final List<QueuedPlayer> queue = queues.get(gameType);
    queue.add(player);
    playerQueue.put(playerId, gameType);
    queuedTotal++;
    final int position = queue.size();
    logger.debug(
        "player queued playerId={} gameType={} position={}", playerId, gameType, position);

    eventBus.publish(
        SessionEventType.QUEUED, new SessionEventPayload.PlayerQueued(player, position));

    tryMatch(gameType);
    final Match matched = playerQueue.containsKey(playerId)
        ? null
        : registry.getByPlayer(playerId).orElse(null);
    return Result.ok(new EnqueueResult(gameType, position, matched));
  }

  public synchronized Result<QueuedPlayer, ErrorKind> dequeue(String playerId) {
    final String gameType = playerQueue.get(playerId);
    if (gameType == null) {
      return ErrorKind.PLAYER_NOT_QUEUED.result();
    }
    final Optional<QueuedPlayer> removed = removeFromQueue(gameType, playerId);
    playerQueue.remove(playerId);
    if (removed.isEmpty()) {
      logger.warn("queue index out of sync playerId={} gameType={}", playerId, gameType);
      return ErrorKind.PLAYER_NOT_FOUND_IN_QUEUE.result();
    }
    cancelledTotal++;
    metrics.recordMatchResult("cancelled");
    logger.debug("player dequeued playerId={} gameType={}", playerId, gameType);

    eventBus.publish(
        SessionEventType.DEQUEUED, new SessionEventPayload.PlayerDequeued(removed.get()));
    return Result.ok(removed.get());
  }

  public synchronized Optional<QueuePosition> getPosition(String playerId) {
    final String gameType = playerQueue.get(playerId);
    if (gameType == null) {
      return Optional.empty();
    }
    final List<QueuedPlayer> queue = queues.get(gameType);
    for (int i = 0; i < queue.size(); i++) {
      final QueuedPlayer player = queue.get(i);
      if (player.playerId().equals(playerId)) {
        return Optional.of(
            new QueuePosition(gameType, i + 1, queue.size(), waitedMillis(player, clock.instant())));
      }
    }
    return Optional.empty();
  }

  /**
   * 役割: tick 本体。全キューのタイムアウト除去とマッチ成立試行を行う。
   * 動作: 空でないキューごとに checkTimeouts → tryMatch を 1 回ずつ実行する。
   * 前提: なし。
   *
   * @return number of matches formed in this pass
   */
  public synchronized int checkQueues() {
    int formed = 0;
    for (String gameType : queues.keySet()) {
      if (queues.get(gameType).isEmpty()) {
        continue;
      }
      checkTimeouts(gameType);
      if (tryMatch(gameType).isPresent()) {
        formed++;
      }
    }
    return formed;
  }

  /** Evicts players that waited longer than the max queue time. */
  public synchronized List<QueuedPlayer> checkTimeouts(String gameType) {
    final List<QueuedPlayer> queue = queues.get(gameType);
    if (queue == null || queue.isEmpty()) {
      return List.of();
    }
    final Instant now = clock.instant();
    final List<QueuedPlayer> evicted = new ArrayList<>();
    queue.removeIf(
        player -> {
          if (waitedMillis(player, now) > maxQueueTime.toMillis()) {
            evicted.add(player);
            return true;
          }
          return false;
        });
    for (QueuedPlayer player : evicted) {
      playerQueue.remove(player.playerId());
      timedOutTotal++;
      metrics.recordMatchResult("timeout");
      final long waited = waitedMillis(player, now);
      logger.info(
          "queue timeout playerId={} gameType={} waitedMs={}", player.playerId(), gameType, waited);
      eventBus.publish(
          SessionEventType.TIMEOUT, new SessionEventPayload.QueueTimedOut(player, waited));
    }
    return evicted;
  }

  /**
   * 役割: キューからプレイヤーを選び、新規 Match を作って参加させる。
   * 動作: スキルマッチ種別でキュー長が max を超える場合は分散最小の連続窓を、それ以外は先頭から最大 max 人を選ぶ。 min
   * 人に満たない・Match を作れない場合は選んだ全員をキュー先頭へ戻して中断する。
   * 前提: gameType は既知の種別であること（未知なら何もしない）。
   */
  public synchronized Optional<Match> tryMatch(String gameType) {
    final GameTypeConfig config = gameConfigs.get(gameType);
    final List<QueuedPlayer> queue = queues.get(gameType);
    if (config == null || queue.size() < config.min()) {
      return Optional.empty();
    }

    final List<QueuedPlayer> selected =
        config.skillMatch() && queue.size() > config.max()
            ? takeSkillWindow(queue, config.max())
            : takeFromFront(queue, config.max());

    if (selected.size() < config.min()) {
      queue.addAll(0, selected);
      return Optional.empty();
    }

    final Result<Match, ErrorKind> created = registry.create(gameType, config.matchOptions());
    if (created.isErr()) {
      queue.addAll(0, selected);
      metrics.recordMatchResult("no_slots");
      logger.warn(
          "match formation deferred gameType={} players={} reason={}",
          gameType,
          selected.size(),
          created.message());
      return Optional.empty();
    }

    final Match match = created.value();
    final Instant now = clock.instant();
    final List<QueuedPlayer> joined = new ArrayList<>();
    final List<QueuedPlayer> rejected = new ArrayList<>();
    for (QueuedPlayer player : selected) {
      final Result<JoinResult, ErrorKind> result =
          registry.join(match.id(), player.playerId(), player.monogram(), player.name());
      if (result.isOk()) {
        playerQueue.remove(player.playerId());
        joined.add(player);
        metrics.recordTimeToMatch(Duration.ofMillis(waitedMillis(player, now)));
      } else {
        logger.warn(
            "queued player could not join formed match playerId={} matchId={} reason={}",
            player.playerId(),
            match.idHex(),
            result.message());
        rejected.add(player);
      }
    }
    queue.addAll(0, rejected);

    if (joined.isEmpty()) {
      registry.end(match.id(), MatchRegistry.REASON_EMPTY);
      return Optional.empty();
    }

    matchedTotal += joined.size();
    metrics.recordMatchResult("matched");
    logger.info(
        "match formed id={} gameType={} players={}", match.idHex(), gameType, joined.size());
    eventBus.publish(SessionEventType.MATCHED, new SessionEventPayload.MatchFormed(match, joined));
    return Optional.of(match);
  }

  /**
   * 役割: 招待コード付きの非公開 Match を作成し、作成者を host として参加させる。
   * 動作: 未知の種別・キュー待機中・Match 参加中なら失敗を返す。作成後 privateCreated を発行する。
   * 前提: なし。
   */
  public synchronized Result<PrivateMatchTicket, ErrorKind> createPrivate(
      String playerId, String gameType, QueueOptions options) {
    Objects.requireNonNull(playerId, "playerId");
    final GameTypeConfig config = gameType == null ? null : gameConfigs.get(gameType);
    if (config == null) {
      return ErrorKind.UNKNOWN_GAME_TYPE.result(gameType);
    }
    if (playerQueue.containsKey(playerId)) {
      return ErrorKind.PLAYER_ALREADY_QUEUED.result();
    }
    if (registry.isPlayerInMatch(playerId)) {
      return ErrorKind.PLAYER_ALREADY_IN_MATCH.result();
    }

    final Result<Match, ErrorKind> created =
        registry.create(gameType, config.matchOptions().asPrivate());
    if (created.isErr()) {
      return Result.err(created.kind(), created.message());
    }
    final Match match = created.value();
    final QueueOptions opts = options == null ? QueueOptions.none() : options;
    final Result<JoinResult, ErrorKind> joined =
        registry.join(match.id(), playerId, opts.monogram(), opts.name());
    if (joined.isErr()) {
      registry.end(match.id(), MatchRegistry.REASON_EMPTY);
      return Result.err(joined.kind(), joined.message());
    }

    final String inviteCode = match.config().inviteCode();
    logger.info(
        "private match created id={} gameType={} playerId={}", match.idHex(), gameType, playerId);
    eventBus.publish(
        SessionEventType.PRIVATE_CREATED,
        new SessionEventPayload.PrivateMatchCreated(match, playerId, inviteCode));
    return Result.ok(new PrivateMatchTicket(match, inviteCode, joined.value().slot()));
  }

  public synchronized Result<JoinResult, ErrorKind> joinPrivate(
      String playerId, String inviteCode, QueueOptions options) {
    final Optional<Match> match = registry.getByInvite(inviteCode);
    if (match.isEmpty()) {
      return ErrorKind.INVALID_INVITE_CODE.result();
    }
    if (playerQueue.containsKey(playerId)) {
      return ErrorKind.PLAYER_ALREADY_QUEUED.result();
    }
    if (registry.isPlayerInMatch(playerId)) {
      return ErrorKind.PLAYER_ALREADY_IN_MATCH.result();
    }
    final QueueOptions opts = options == null ? QueueOptions.none() : options;
    return registry.join(match.get().id(), playerId, opts.monogram(), opts.name());
  }

  /** Direct join of a listed match by id. Private matches are only reachable by invite code. */
  public synchronized Result<JoinResult, ErrorKind> joinMatch(
      String playerId, String matchId, QueueOptions options) {
    final Optional<Match> match = registry.get(matchId);
    if (match.isEmpty()) {
      return ErrorKind.MATCH_NOT_FOUND.result();
    }
    if (!match.get().config().publicMatch()) {
      return ErrorKind.MATCH_NOT_JOINABLE.result();
    }
    if (playerQueue.containsKey(playerId)) {
      return ErrorKind.PLAYER_ALREADY_QUEUED.result();
    }
    final QueueOptions opts = options == null ? QueueOptions.none() : options;
    return registry.join(match.get().id(), playerId, opts.monogram(), opts.name());
  }

  public synchronized List<QueuedPlayer> getQueue(String gameType) {
    final List<QueuedPlayer> queue = queues.get(gameType);
    return queue == null ? List.of() : List.copyOf(queue);
  }

  public synchronized MatchmakerStats getStats() {
    return new MatchmakerStats(queuedTotal, matchedTotal, timedOutTotal, cancelledTotal);
  }

  public synchronized QueueStats getQueueStats() {
    final Instant now = clock.instant();
    final List<QueueSummary> summaries = new ArrayList<>();
    int total = 0;
    for (Map.Entry<String, List<QueuedPlayer>> entry : queues.entrySet()) {
      final List<QueuedPlayer> queue = entry.getValue();
      final GameTypeConfig config = gameConfigs.get(entry.getKey());
      final long oldest = queue.isEmpty() ? 0 : waitedMillis(queue.get(0), now);
      summaries.add(
          new QueueSummary(
              entry.getKey(),
              queue.size(),
              oldest,
              config.min(),
              config.max(),
              config.skillMatch()));
      total += queue.size();
    }
    return new QueueStats(total, summaries, getStats());
  }

  public synchronized MatchmakerSnapshot snapshot() {
    final Map<String, List<QueuedPlayer>> copy = new LinkedHashMap<>();
    queues.forEach((gameType, queue) -> copy.put(gameType, List.copyOf(queue)));
    return new MatchmakerSnapshot(running, getQueueStats(), copy);
  }

  private List<QueuedPlayer> takeFromFront(List<QueuedPlayer> queue, int max) {
    final int count = Math.min(max, queue.size());
    final List<QueuedPlayer> selected = new ArrayList<>(queue.subList(0, count));
    queue.subList(0, count).clear();
    return selected;
  }

  /**
   * 役割: スキル昇順で並べたうえで、分散が最小となる長さ size の連続窓を選ぶ。
   * 動作: 同値の場合は開始位置が最も小さい窓を採用する。queue 自体は変更しない。
   * 前提: queue.size() >= size であること。
   */
  static List<QueuedPlayer> selectSkillWindow(List<QueuedPlayer> queue, int size) {
    final List<QueuedPlayer> sorted = new ArrayList<>(queue);
    sorted.sort(Comparator.comparingDouble(QueuedPlayer::skill));
    int bestStart = 0;
    double bestVariance = Double.POSITIVE_INFINITY;
    for (int start = 0; start + size <= sorted.size(); start++) {
      final double variance = populationVariance(sorted.subList(start, start + size));
      if (variance < bestVariance) {
        bestVariance = variance;
        bestStart = start;
      }
    }
    return new ArrayList<>(sorted.subList(bestStart, bestStart + size));
  }

  /** Mean of squared deviations from the mean. */
  static double populationVariance(List<QueuedPlayer> players) {
    if (players.isEmpty()) {
      return 0;
    }
    double sum = 0;
    for (QueuedPlayer player : players) {
      sum += player.skill();
    }
    final double mean = sum / players.size();
    double squares = 0;
    for (QueuedPlayer player : players) {
      final double deviation = player.skill() - mean;
      squares += deviation * deviation;
    }
    return squares / players.size();
  }

  // 並び順がキュー順と異なるため、位置ではなく playerId で除去する
  private List<QueuedPlayer> takeSkillWindow(List<QueuedPlayer> queue, int size) {
    final List<QueuedPlayer> selected = selectSkillWindow(queue, size);
    final Set<String> ids = new HashSet<>();
    for (QueuedPlayer player : selected) {
      ids.add(player.playerId());
    }
    queue.removeIf(player -> ids.contains(player.playerId()));
    return selected;
  }

  private Optional<QueuedPlayer> removeFromQueue(String gameType, String playerId) {
    final List<QueuedPlayer> queue = queues.get(gameType);
    for (int i = 0; i < queue.size(); i++) {
      if (queue.get(i).playerId().equals(playerId)) {
        return Optional.of(queue.remove(i));
      }
    }
    return Optional.empty();
  }

  private static long waitedMillis(QueuedPlayer player, Instant now) {
    return Math.max(0, Duration.between(player.joinedAt(), now).toMillis());
  }
}
