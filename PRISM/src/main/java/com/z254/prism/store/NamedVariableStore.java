package com.z254.prism.store;

import java.util.Optional;
import java.util.Set;

/**
 * Named variables shared between analyses, such as saved baselines.
 */
public interface NamedVariableStore {

    /**
     * Look up a variable by name.
     */
    Optional<Object> get(String name);

    /**
     * Store a variable. An existing value under the same name is replaced.
     */
    void set(String name, Object value);

    /**
     * Remove a variable.
     *
     * @return whether a value was removed
     */
    boolean delete(String name);

    /**
     * Names of all stored variables.
     */
    Set<String> names();
}
