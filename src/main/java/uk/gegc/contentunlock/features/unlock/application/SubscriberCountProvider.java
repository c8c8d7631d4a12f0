package uk.gegc.contentunlock.features.unlock.application;

/**
 * Source of the active consumer count that prices an unlock.
 */
public interface SubscriberCountProvider {

    /**
     * @param sourcePageId grouping key the item belongs to, may be null
     * @return number of active subscribers, never negative
     */
    long countActiveSubscribers(String sourcePageId);
}
