package com.acme.pubsub.broker;

import com.acme.pubsub.registry.MessageSettledListener;
import com.acme.pubsub.spi.MessageStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Deletes a message body once every subscription settled it. A failed delete leaves the body to
 * the store's retention purge.
 */
public class SettledMessageReaper implements MessageSettledListener {
  private static final Logger LOG = LoggerFactory.getLogger(SettledMessageReaper.class);

  private final MessageStore store;

  public SettledMessageReaper(MessageStore store) {
    this.store = store;
  }

  @Override
  public void settled(String topic, long messageId) {
    try {
      store.deleteMessage(topic, messageId);
      LOG.debug("Deleted settled message {} from topic {}", messageId, topic);
    } catch (RuntimeException e) {
      LOG.warn("Failed to delete settled message {} from topic {}: {}", messageId, topic, e.getMessage());
    }
  }
}
