package io.borgqueue.core;

/**
 * Lifecycle states of a queued job.
 *
 * <p>Allowed transitions: {@code PENDING -> RUNNING -> COMPLETED | FAILED | CANCELLED},
 * plus {@code PENDING -> CANCELLED}. Nothing ever returns to {@code PENDING}; a failed job is
 * retried by submitting a new record.
 */
public enum JobStatus {
    PENDING {
        @Override
        public boolean isTerminal() {
            return false;
        }
    },
    RUNNING {
        @Override
        public boolean isTerminal() {
            return false;
        }
    },
    COMPLETED {
        @Override
        public boolean isTerminal() {
            return true;
        }
    },
    FAILED {
        @Override
        public boolean isTerminal() {
            return true;
        }
    },
    CANCELLED {
        @Override
        public boolean isTerminal() {
            return true;
        }
    };

    public abstract boolean isTerminal();

    public boolean isActive() {
        return !isTerminal();
    }

    public boolean canTransitionTo(JobStatus target) {
        if (target == null || isTerminal()) {
            return false;
        }
        return switch (this) {
            case PENDING -> target == RUNNING || target == CANCELLED;
            case RUNNING -> target.isTerminal();
            default -> false;
        };
    }
}
