package com.example.routex.service.delivery;

public sealed interface SendOutcome {

    static SendOutcome delivered() {
        return Delivered.INSTANCE;
    }

    static SendOutcome rateLimited(int retryAfterSeconds) {
        return new RateLimited(retryAfterSeconds);
    }

    static SendOutcome permanentFailure(String reason) {
        return new PermanentFailure(reason);
    }

    static SendOutcome transientFailure(String reason) {
        return new TransientFailure(reason);
    }

    record Delivered() implements SendOutcome {
        static final Delivered INSTANCE = new Delivered();
    }

    /** The provider asked us to wait before trying again. */
    record RateLimited(int retryAfterSeconds) implements SendOutcome {
    }

    /** The recipient can never be reached (blocked the bot, deactivated, unknown chat). */
    record PermanentFailure(String reason) implements SendOutcome {
    }

    record TransientFailure(String reason) implements SendOutcome {
    }
}
