package de.anton.pv.simulator.iv_simulator.model;

import java.util.Objects;

/**
 * Result of one advisory sanity check on a curve. Never persisted, never thrown.
 */
public final class Diagnostic {

    private final String name;
    private final boolean passed;
    private final String message;

    public Diagnostic(String name, boolean passed, String message) {
        this.name = Objects.requireNonNull(name, "Diagnostic name cannot be null");
        this.passed = passed;
        this.message = message != null ? message : "";
    }

    public String getName() { return name; }
    public boolean isPassed() { return passed; }
    public String getMessage() { return message; }

    @Override
    public String toString() { return (passed ? "[OK] " : "[FAIL] ") + name + ": " + message; }
}
