package org.pram4j.runtime.spi;

/**
 * Receives every attribute and relation name that rules and queries condition on.
 * Attached to a population only for the duration of an analysed run.
 */
public interface IAttributeUsageObserver {

    void attributeUsed(String name);

    void relationUsed(String name);
}
