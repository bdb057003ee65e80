package com.killradar.killfeed.identity;

/** Display name of a character, corporation, alliance or ship type. Ticker is null where none exists. */
public record IdentityName(String name, String ticker) {}
