/*
 * どこで: Session イベント
 * 何を: イベントの購読登録と同期配信を行う
 * なぜ: Registry / Matchmaker を配信先（relay, メトリクス, テスト）から切り離すため
 */
package com.quasar.session.event;

import com.quasar.session.service.SessionMetrics;
import java.time.Clock;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class SessionEventBus {

  private static final Logger logger = LoggerFactory.getLogger(SessionEventBus.class);

  private final Map<SessionEventType, List<Consumer<SessionEvent>>> handlers =
      new EnumMap<>(SessionEventType.class);
  private final Clock clock;
  private final SessionMetrics metrics;

  public SessionEventBus(Clock clock, SessionMetrics metrics) {
    this.clock = clock;
    this.metrics = metrics;
    for (SessionEventType type : SessionEventType.values()) {
      handlers.put(type, new CopyOnWriteArrayList<>());
    }
  }

  /**
   * 役割: イベント種別に handler を登録する。
   * 動作: 登録順に呼び出されるよう末尾へ追加し、解除用の Subscription を返す。
   * 前提: handler は Matchmaker へ再入しないこと（ロック順序 matchmaker → registry を守るため）。
   */
  public Subscription subscribe(SessionEventType type, Consumer<SessionEvent> handler) {
    final List<Consumer<SessionEvent>> list = handlers.get(type);
    final Consumer<SessionEvent> registered = handler::accept;
    list.add(registered);
    return () -> list.remove(registered);
  }

  /**
   * 役割: イベントを全購読者へ同期配信する。
   * 動作: 登録順に呼び出し、handler の RuntimeException はログとメトリクスに記録して次の handler へ進む。
   * 前提: 呼び出し元のスレッドで配信が完了する。
   */
  public SessionEvent publish(SessionEventType type, SessionEventPayload payload) {
    final SessionEvent event = new SessionEvent(type, clock.instant(), payload);
    for (Consumer<SessionEvent> handler : handlers.get(type)) {
      try {
        handler.accept(event);
      } catch (RuntimeException ex) {
        logger.warn("session event handler failed event={}", type.value(), ex);
        metrics.recordHandlerError(type.value());
      }
    }
    return event;
  }

  public int subscriberCount(SessionEventType type) {
    return handlers.get(type).size();
  }
}
