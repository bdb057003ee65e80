package com.killradar.killfeed.stream;

public enum ConnectionState {
  DISCONNECTED,
  CONNECTING,
  CONNECTED
}
