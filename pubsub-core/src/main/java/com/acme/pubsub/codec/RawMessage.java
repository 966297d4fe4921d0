package com.acme.pubsub.codec;

import java.util.Map;

/** Undecoded payload with its attributes, for subscribers that handle bytes themselves. */
public record RawMessage(long id, byte[] data, Map<String, String> attributes) {}
