package com.filterbench.actor;

import com.filterbench.model.FilterTask;

/**
 * Inbox entry of a {@link ProcessingActor}: either a task to process or the
 * stop signal. Both travel through the same ordered queue.
 */
final class ActorMessage {

    enum Kind {
        TASK, STOP
    }

    private static final ActorMessage STOP = new ActorMessage(Kind.STOP, null);

    private final Kind kind;
    private final FilterTask task;

    private ActorMessage(Kind kind, FilterTask task) {
        this.kind = kind;
        this.task = task;
    }

    static ActorMessage task(FilterTask task) {
        return new ActorMessage(Kind.TASK, task);
    }

    static ActorMessage stop() {
        return STOP;
    }

    Kind getKind() {
        return kind;
    }

    FilterTask getTask() {
        return task;
    }
}
