/*
 * どこで: Session イベント
 * 何を: イベントバスの全イベントを配信レイヤー向けエンベロープへ変換して publish する
 * なぜ: Registry / Matchmaker を NATS の可用性から切り離すため
 */
package com.quasar.session.event;

import com.quasar.common.trace.TraceIds;
import com.quasar.session.model.Match;
import com.quasar.session.model.PlayerSlot;
import com.quasar.session.model.QueuedPlayer;
import com.quasar.session.model.view.PlayerView;
import com.quasar.session.registry.MatchRegistry;
import com.quasar.session.service.SessionMetrics;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

@Component
public class SessionEventRelay {

  private static final Logger logger = LoggerFactory.getLogger(SessionEventRelay.class);

  private final SessionEventBus eventBus;
  private final SessionEventPublisher publisher;
  private final MatchRegistry registry;
  private final SessionMetrics metrics;
  private final Executor executor;
  private final List<Subscription> subscriptions = new ArrayList<>();

  public SessionEventRelay(
      SessionEventBus eventBus,
      SessionEventPublisher publisher,
      MatchRegistry registry,
      SessionMetrics metrics,
      @Qualifier("sessionEventExecutor") Executor executor) {
    this.eventBus = eventBus;
    this.publisher = publisher;
    this.registry = registry;
    this.metrics = metrics;
    this.executor = executor;
  }

  @PostConstruct
  public void subscribeAll() {
    for (SessionEventType type : SessionEventType.values()) {
      subscriptions.add(eventBus.subscribe(type, this::relay));
    }
  }

  @PreDestroy
  public void unsubscribeAll() {
    subscriptions.forEach(Subscription::unsubscribe);
    subscriptions.clear();
  }

  /**
   * 役割: 1 件のイベントをエンベロープへ変換し、publish を executor へ引き渡す。
   * 動作: 変換は呼び出し元スレッドで Registry の監視ロック下に行い（MDC の trace_id もここで取得）、publish は
   * executor 上で実行する。投入拒否・publish 失敗はログとメトリクスへ記録し、呼び出し元へは伝播させない。
   * 前提: イベントバスから Registry / Matchmaker のロック保持中に同期的に呼ばれる。
   */
  void relay(SessionEvent event) {
    final SessionEventMessage message = toMessage(event);
    try {
      executor.execute(() -> send(message));
    } catch (RejectedExecutionException ex) {
      logger.warn("session event relay rejected event={}", message.eventType(), ex);
      metrics.recordRelayError(message.eventType());
    }
  }

  private void send(SessionEventMessage message) {
    try {
      publisher.publish(message);
    } catch (RuntimeException ex) {
      logger.warn(
          "session event relay failed event={} eventId={}",
          message.eventType(),
          message.eventId(),
          ex);
      metrics.recordRelayError(message.eventType());
    }
  }

  SessionEventMessage toMessage(SessionEvent event) {
    final SessionEventPayload payload = event.payload();
    return new SessionEventMessage(
        UUID.randomUUID().toString(),
        event.type().value(),
        event.occurredAt().toString(),
        payload.matchId() == null ? null : Match.toHex(payload.matchId()),
        payload.playerId(),
        TraceIds.currentOrNew(),
        toBody(payload));
  }

  private Map<String, Object> toBody(SessionEventPayload payload) {
    final Map<String, Object> body = new LinkedHashMap<>();
    if (payload instanceof SessionEventPayload.MatchCreated created) {
      body.put("match", registry.view(created.match(), true));
    } else if (payload instanceof SessionEventPayload.PlayerJoined joined) {
      body.put("match", registry.view(joined.match(), false));
      body.put("player", toPlayerView(joined.player()));
    } else if (payload instanceof SessionEventPayload.PlayerLeft left) {
      body.put("match", registry.view(left.match(), false));
      body.put("slot", left.slot());
    } else if (payload instanceof SessionEventPayload.MatchEnded ended) {
      body.put("match", registry.view(ended.match(), false));
      body.put("result", ended.result());
    } else if (payload instanceof SessionEventPayload.PlayerQueued queued) {
      body.put("player", toQueuedView(queued.player()));
      body.put("position", queued.position());
    } else if (payload instanceof SessionEventPayload.PlayerDequeued dequeued) {
      body.put("player", toQueuedView(dequeued.player()));
    } else if (payload instanceof SessionEventPayload.QueueTimedOut timedOut) {
      body.put("player", toQueuedView(timedOut.player()));
      body.put("waitedMs", timedOut.waitedMs());
    } else if (payload instanceof SessionEventPayload.MatchFormed formed) {
      body.put("match", registry.view(formed.match(), true));
      body.put("players", formed.players().stream().map(QueuedPlayer::playerId).toList());
    } else if (payload instanceof SessionEventPayload.PrivateMatchCreated privateCreated) {
      body.put("match", registry.view(privateCreated.match(), true));
      body.put("inviteCode", privateCreated.inviteCode());
    }
    return body;
  }

  private PlayerView toPlayerView(PlayerSlot seat) {
    return new PlayerView(
        seat.slot(), seat.monogram(), seat.name(), seat.connected(), seat.ready(), seat.score());
  }

  private Map<String, Object> toQueuedView(QueuedPlayer player) {
    final Map<String, Object> view = new LinkedHashMap<>();
    view.put("playerId", player.playerId());
    view.put("gameType", player.gameType());
    view.put("monogram", player.monogram());
    view.put("name", player.name());
    view.put("skill", player.skill());
    view.put("joinedAt", player.joinedAt().toEpochMilli());
    return view;
  }
}
