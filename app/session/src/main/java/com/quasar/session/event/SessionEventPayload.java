/*
 * どこで: Session イベント
 * 何を: イベント種別ごとのペイロードを定義する
 * なぜ: 購読側が型安全に Match / プレイヤー情報を取り出せるようにするため
 */
package com.quasar.session.event;

import com.quasar.session.model.Match;
import com.quasar.session.model.PlayerSlot;
import com.quasar.session.model.QueuedPlayer;
import com.quasar.session.model.view.MatchEndSummary;
import java.util.List;

public sealed interface SessionEventPayload {

  /** 関連する Match の slot id。Match を伴わないイベントでは null。 */
  Integer matchId();

  /** 関連するプレイヤー。複数人・該当なしの場合は null。 */
  String playerId();

  record MatchCreated(Match match) implements SessionEventPayload {
    @Override
    public Integer matchId() {
      return match.id();
    }

    @Override
    public String playerId() {
      return null;
    }
  }

  record PlayerJoined(Match match, PlayerSlot player) implements SessionEventPayload {
    @Override
    public Integer matchId() {
      return match.id();
    }

    @Override
    public String playerId() {
      return player.playerId();
    }
  }

  record PlayerLeft(Match match, String playerId, int slot) implements SessionEventPayload {
    @Override
    public Integer matchId() {
      return match.id();
    }
  }

  record MatchEnded(Match match, MatchEndSummary result) implements SessionEventPayload {
    @Override
    public Integer matchId() {
      return match.id();
    }

    @Override
    public String playerId() {
      return null;
    }
  }

  record PlayerQueued(QueuedPlayer player, int position) implements SessionEventPayload {
    @Override
    public Integer matchId() {
      return null;
    }

    @Override
    public String playerId() {
      return player.playerId();
    }
  }

  record PlayerDequeued(QueuedPlayer player) implements SessionEventPayload {
    @Override
    public Integer matchId() {
      return null;
    }

    @Override
    public String playerId() {
      return player.playerId();
    }
  }

  record QueueTimedOut(QueuedPlayer player, long waitedMs) implements SessionEventPayload {
    @Override
    public Integer matchId() {
      return null;
    }

    @Override
    public String playerId() {
      return player.playerId();
    }
  }

  record MatchFormed(Match match, List<QueuedPlayer> players) implements SessionEventPayload {
    public MatchFormed {
      players = List.copyOf(players);
    }

    @Override
    public Integer matchId() {
      return match.id();
    }

    @Override
    public String playerId() {
      return null;
    }
  }

  record PrivateMatchCreated(Match match, String playerId, String inviteCode)
      implements SessionEventPayload {
    @Override
    public Integer matchId() {
      return match.id();
    }
  }
}
