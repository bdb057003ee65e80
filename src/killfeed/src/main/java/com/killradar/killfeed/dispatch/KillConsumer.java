package com.killradar.killfeed.dispatch;

/** Something that displays kill activity for a set of locations, such as an open map. */
public interface KillConsumer {

  String id();

  boolean watches(long systemId);

  void deliver(KillEvent event);
}
