package com.killradar.killfeed.cache;

final class CacheKeys {
  private final String prefix;

  CacheKeys(String prefix) {
    this.prefix = prefix == null ? "" : prefix;
  }

  String killmail(long killmailId) {
    return prefix + "killmail:" + killmailId;
  }

  String systemKills(long systemId) {
    return prefix + "system:kills:" + systemId;
  }

  String systemKillCount(long systemId) {
    return prefix + "system:count:" + systemId;
  }

  String systemReportedCount(long systemId) {
    return prefix + "system:reported_count:" + systemId;
  }

  String systemFetched(long systemId) {
    return prefix + "system:fetched:" + systemId;
  }

  String identity(String kind, long id) {
    return prefix + "identity:" + kind + ":" + id;
  }
}
