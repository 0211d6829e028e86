package com.questrail.edgecontrol.failsafe;

/**
 * Persistent key/value store used for state and safety backups.
 *
 * <p>The engine only writes backups here; configuration persistence is not
 * its concern.</p>
 */
public interface KeyValueStore
{
    void save(String key, String value);

    /**
     * @return the stored value, or {@code defaultValue} when the key is absent
     */
    String load(String key, String defaultValue);

    void remove(String key);
}
