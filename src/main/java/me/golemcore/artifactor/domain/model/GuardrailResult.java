package me.golemcore.artifactor.domain.model;

/**
 * Outcome of a single guardrail check. {@code reason} is null when passed.
 */
public record GuardrailResult(String checkName, boolean passed, String reason) {

    public static GuardrailResult pass(String checkName) {
        return new GuardrailResult(checkName, true, null);
    }

    public static GuardrailResult fail(String checkName, String reason) {
        return new GuardrailResult(checkName, false, reason);
    }
}
