package io.agency.core.reasoning;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/// Ordered iterations of one reasoning-loop run. Never persisted on its own.
///
/// @implNote **Not thread-safe**. Scoped to a single loop invocation.
public final class Trajectory {

    private final List<Iteration> iterations = new ArrayList<>();

    public void append(Iteration iteration) {
        iterations.add(iteration);
    }

    public List<Iteration> iterations() {
        return Collections.unmodifiableList(iterations);
    }

    public int size() {
        return iterations.size();
    }

    public boolean isEmpty() {
        return iterations.isEmpty();
    }

    /// Returns the best partial answer gathered so far.
    ///
    /// The latest non-blank tool observation or model text wins, so a loop cut
    /// off after a tool call reports what the tool returned.
    ///
    /// @return partial answer, empty when nothing was gathered
    public String partialAnswer() {
        for (int i = iterations.size() - 1; i >= 0; i--) {
            Iteration iteration = iterations.get(i);
            if (iteration.observation() != null && !iteration.observation().isBlank()) {
                return iteration.observation();
            }
            if (!iteration.response().isBlank()) {
                return iteration.response();
            }
        }
        return "";
    }
}
