package com.killradar.killfeed.stream;

import com.fasterxml.jackson.databind.JsonNode;

/** One channel frame: {@code [join_ref, ref, topic, event, payload]}. Refs may be null. */
public record PhoenixMessage(String joinRef, String ref, String topic, String event, JsonNode payload) {}
