package io.iamcore.writemodel;

import io.iamcore.CommandContext;
import io.iamcore.Event;
import io.iamcore.spi.EventLog;

import java.util.List;
import java.util.Objects;

/**
 * Hydration of write models from an {@link EventLog}.
 */
public final class WriteModels {
    private WriteModels() {
    }

    /**
     * Replays the model's query and folds every returned event.
     *
     * @return the same model, hydrated
     */
    public static <M extends WriteModel> M hydrate(CommandContext context, EventLog log, M model) {
        Objects.requireNonNull(context, "context");
        Objects.requireNonNull(log, "log");
        Objects.requireNonNull(model, "model");
        context.checkActive();
        List<Event> events = log.replay(context, model.query());
        model.apply(events);
        return model;
    }

    /**
     * Reconstructs the model as of the given sequence (inclusive).
     */
    public static <M extends WriteModel> M hydrateAt(
            CommandContext context, EventLog log, M model, long sequenceAtMost) {
        Objects.requireNonNull(context, "context");
        Objects.requireNonNull(log, "log");
        Objects.requireNonNull(model, "model");
        context.checkActive();
        model.apply(log.replay(context, model.queryBuilder().sequenceAtMost(sequenceAtMost).build()));
        return model;
    }
}
