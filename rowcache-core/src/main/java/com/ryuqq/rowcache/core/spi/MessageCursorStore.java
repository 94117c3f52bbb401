package com.ryuqq.rowcache.core.spi;

import com.ryuqq.rowcache.core.model.ChannelMessage;

import java.util.List;

/**
 * Storage operations behind a polling subscription.
 *
 * <p>Each subscriber owns one cursor row per channel, holding the id of the last
 * message handed to it.</p>
 *
 * @author Rowcache Team
 * @since 1.0.0
 */
public interface MessageCursorStore {

    /**
     * Creates or reuses the cursor row of a subscriber and resets it to {@code -1},
     * so delivery starts from the beginning of the channel log.
     *
     * @param channel the channel name
     * @param subscriberId the subscriber id
     * @return the starting cursor, always {@code -1}
     */
    long attach(String channel, String subscriberId);

    /**
     * Fetches messages with an id greater than the cursor, ascending.
     *
     * @param channel the channel name
     * @param afterId exclusive lower bound
     * @param limit maximum number of messages
     * @return messages in publish order
     */
    List<ChannelMessage> fetchAfter(String channel, long afterId, int limit);

    /**
     * Persists the cursor after a message has been handed off.
     *
     * @param channel the channel name
     * @param subscriberId the subscriber id
     * @param lastDeliveredId id of the delivered message
     */
    void advance(String channel, String subscriberId, long lastDeliveredId);

    /**
     * Deletes the cursor row.
     *
     * @param channel the channel name
     * @param subscriberId the subscriber id
     */
    void detach(String channel, String subscriberId);
}
