package com.umitunal.preemptq.execution;

/**
 * Result of one run of the execution controller.
 *
 * Preemption is a normal outcome, not a failure, and must never reach retry accounting.
 */
public final class ExecutionOutcome {

    public enum Kind {
        COMPLETED,
        PREEMPTED,
        FAILED
    }

    private static final ExecutionOutcome COMPLETED = new ExecutionOutcome(Kind.COMPLETED, null, null);
    private static final ExecutionOutcome PREEMPTED = new ExecutionOutcome(Kind.PREEMPTED, null, null);

    private final Kind kind;
    private final String reason;
    private final Throwable cause;

    private ExecutionOutcome(Kind kind, String reason, Throwable cause) {
        this.kind = kind;
        this.reason = reason;
        this.cause = cause;
    }

    public static ExecutionOutcome completed() {
        return COMPLETED;
    }

    public static ExecutionOutcome preempted() {
        return PREEMPTED;
    }

    public static ExecutionOutcome failed(String reason, Throwable cause) {
        return new ExecutionOutcome(Kind.FAILED, reason, cause);
    }

    public Kind getKind() { return kind; }
    public String getReason() { return reason; }
    public Throwable getCause() { return cause; }

    public boolean isCompleted() { return kind == Kind.COMPLETED; }
    public boolean isPreempted() { return kind == Kind.PREEMPTED; }
    public boolean isFailed() { return kind == Kind.FAILED; }

    @Override
    public String toString() {
        return kind == Kind.FAILED ? "FAILED(" + reason + ")" : kind.name();
    }
}
