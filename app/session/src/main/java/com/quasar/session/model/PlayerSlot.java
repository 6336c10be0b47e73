package com.quasar.session.model;

import java.time.Instant;

/** One seat of a match roster. Mutated only by the owning {@link Match}. */
public final class PlayerSlot {

  private final int slot;
  private String playerId;
  private String monogram;
  private String name;
  private boolean connected;
  private boolean ready;
  private Instant lastSeen;
  private int score;

  private PlayerSlot(int slot) {
    this.slot = slot;
  }

  static PlayerSlot empty(int slot) {
    return new PlayerSlot(slot);
  }

  static PlayerSlot occupied(
      int slot, String playerId, String monogram, String name, Instant joinedAt) {
    final PlayerSlot seat = new PlayerSlot(slot);
    seat.playerId = playerId;
    seat.monogram = monogram;
    seat.name = name;
    seat.connected = true;
    seat.lastSeen = joinedAt;
    return seat;
  }

  public int slot() {
    return slot;
  }

  public String playerId() {
    return playerId;
  }

  public String monogram() {
    return monogram;
  }

  public String name() {
    return name;
  }

  public boolean connected() {
    return connected;
  }

  public boolean ready() {
    return ready;
  }

  public Instant lastSeen() {
    return lastSeen;
  }

  public int score() {
    return score;
  }

  public boolean isOpen() {
    return playerId == null;
  }

  /** id を持ち接続中であること。playerCount の集計対象。 */
  public boolean isActive() {
    return playerId != null && connected;
  }

  void touch(Instant now) {
    this.lastSeen = now;
  }

  void markConnected(Instant now) {
    this.connected = true;
    this.lastSeen = now;
  }

  void setReady(boolean ready) {
    this.ready = ready;
  }

  void setScore(int score) {
    this.score = score;
  }

  void addScore(int points) {
    this.score += points;
  }
}
