package com.killradar.killfeed.identity;

public enum IdentityKind {
  CHARACTER("character", "/characters/%d/"),
  CORPORATION("corporation", "/corporations/%d/"),
  ALLIANCE("alliance", "/alliances/%d/"),
  SHIP_TYPE("ship_type", "/universe/types/%d/");

  private final String cacheName;
  private final String pathTemplate;

  IdentityKind(String cacheName, String pathTemplate) {
    this.cacheName = cacheName;
    this.pathTemplate = pathTemplate;
  }

  public String cacheName() {
    return cacheName;
  }

  String path(long id) {
    return String.format(pathTemplate, id);
  }
}
