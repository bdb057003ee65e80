package com.killradar.killfeed.parser;

import com.killradar.killfeed.model.Killmail;

/** Outcome of running one raw record through the parse pipeline. */
public record ParseResult(Outcome outcome, Killmail killmail, String reason) {

  public enum Outcome {
    /** Validated, enriched and committed to the cache. */
    STORED,
    /** Event time is before the caller's cutoff. */
    OLDER,
    /** Not stored: bad time, missing identity or NPC kill. */
    SKIPPED
  }

  public static ParseResult stored(Killmail killmail) {
    return new ParseResult(Outcome.STORED, killmail, null);
  }

  public static ParseResult older(String reason) {
    return new ParseResult(Outcome.OLDER, null, reason);
  }

  public static ParseResult skipped(String reason) {
    return new ParseResult(Outcome.SKIPPED, null, reason);
  }
}
