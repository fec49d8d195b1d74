package com.kalbot.kalshi.ws;

import java.util.EnumSet;
import java.util.Set;

public enum ConnectionState {
  DISCONNECTED,
  CONNECTING,
  CONNECTED,
  RECONNECTING,
  CLOSED;

  public Set<ConnectionState> successors() {
    return switch (this) {
      case DISCONNECTED -> EnumSet.of(CONNECTING, CLOSED);
      case CONNECTING -> EnumSet.of(CONNECTED, RECONNECTING, CLOSED);
      case CONNECTED -> EnumSet.of(RECONNECTING, CLOSED);
      case RECONNECTING -> EnumSet.of(CONNECTING, CLOSED);
      case CLOSED -> EnumSet.noneOf(ConnectionState.class);
    };
  }

  public boolean canTransitionTo(ConnectionState next) {
    return successors().contains(next);
  }
}
