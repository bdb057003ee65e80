package com.killradar.killfeed.stream;

/** Closed set of inbound channel events the stream client reacts to. */
public enum ChannelEvent {
  KILLMAIL_UPDATE,
  KILL_COUNT_UPDATE,
  REPLY,
  CHANNEL_CLOSED,
  UNKNOWN;

  public static ChannelEvent fromWire(String event) {
    if (event == null) {
      return UNKNOWN;
    }
    return switch (event) {
      case "killmail_update" -> KILLMAIL_UPDATE;
      case "kill_count_update" -> KILL_COUNT_UPDATE;
      case "phx_reply" -> REPLY;
      case "phx_close", "phx_error" -> CHANNEL_CLOSED;
      default -> UNKNOWN;
    };
  }
}
