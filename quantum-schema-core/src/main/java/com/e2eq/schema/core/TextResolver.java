package com.e2eq.schema.core;

import java.util.MissingResourceException;
import java.util.ResourceBundle;

/**
 * Resolves display text keys (labels, descriptions, messages) at access time.
 */
@FunctionalInterface
public interface TextResolver {

    String resolve(String key);

    static TextResolver identity() { return key -> key; }

    /**
     * Looks keys up in a resource bundle, falling back to the key itself.
     */
    static TextResolver bundle(ResourceBundle bundle) {
        return key -> {
            if (key == null) return null;
            try {
                return bundle.getString(key);
            } catch (MissingResourceException e) {
                return key;
            }
        };
    }
}
