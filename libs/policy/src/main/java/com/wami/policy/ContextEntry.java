package com.wami.policy;

import java.util.List;

/**
 * A request-context value supplied to a simulation (e.g., {@code aws:CurrentTime}).
 *
 * <p>Carried through to the evaluation result; conditions are not evaluated.
 *
 * @param contextKeyName   key name
 * @param contextKeyValues one or more values
 * @param contextKeyType   value type (String, StringList, Numeric, Boolean, ...)
 */
public record ContextEntry(String contextKeyName, List<String> contextKeyValues, String contextKeyType) {

    public ContextEntry {
        contextKeyValues = contextKeyValues == null ? List.of() : List.copyOf(contextKeyValues);
    }
}
