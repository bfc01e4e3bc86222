package org.abstractica.cloudsession.impl.store;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * In-memory cloud variable values keyed by full variable name.
 *
 * <p>Not thread-safe. The owning session confines access to its lock.</p>
 */
public class VariableStore
{
    /**
     * Outcome of applying a value.
     */
    public enum ApplyResult
    {
        /**
         * The variable did not exist and was created.
         */
        CREATED,

        /**
         * The variable existed and its value was replaced.
         */
        UPDATED
    }

    private final Map<String, String> values;

    /**
     * Creates an empty store.
     */
    public VariableStore()
    {
        this.values = new HashMap<>();
    }

    /**
     * Stores a value, creating the variable if needed.
     *
     * @param name  full variable name
     * @param value the value
     * @return whether the variable was created or updated
     */
    public ApplyResult apply(String name, String value)
    {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(value, "value");

        return values.put(name, value) == null ? ApplyResult.CREATED : ApplyResult.UPDATED;
    }

    /**
     * Returns the value of a variable.
     *
     * @param name full variable name
     * @return the value, or empty if the variable is unknown
     */
    public Optional<String> get(String name)
    {
        return Optional.ofNullable(values.get(name));
    }

    /**
     * Returns whether a variable is known.
     *
     * @param name full variable name
     * @return true if known
     */
    public boolean has(String name)
    {
        return values.containsKey(name);
    }

    public boolean isEmpty()
    {
        return values.isEmpty();
    }

    public int size()
    {
        return values.size();
    }

    /**
     * Returns an immutable copy of all variables.
     *
     * @return name to value map
     */
    public Map<String, String> snapshot()
    {
        return Map.copyOf(values);
    }
}
