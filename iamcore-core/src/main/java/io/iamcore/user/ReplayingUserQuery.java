package io.iamcore.user;

import io.iamcore.CommandContext;
import io.iamcore.IamAggregates;
import io.iamcore.spi.EventLog;
import io.iamcore.spi.UserQuery;
import io.iamcore.spi.UserView;
import io.iamcore.writemodel.WriteModels;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link UserQuery} answered by replaying user streams from the event log.
 *
 * <p>Every lookup hydrates the users involved, so this suits small deployments and tests.
 * Users are listed in order of creation; removed users are never returned.
 */
public final class ReplayingUserQuery implements UserQuery {
    private final EventLog eventLog;

    public ReplayingUserQuery(EventLog eventLog) {
        this.eventLog = Objects.requireNonNull(eventLog, "eventLog");
    }

    @Override
    public Optional<UserView> findById(CommandContext context, String userId) {
        Objects.requireNonNull(userId, "userId");
        HumanWriteModel model = WriteModels.hydrate(context, eventLog, new HumanWriteModel(userId, null));
        if (!model.state().exists()) {
            return Optional.empty();
        }
        return Optional.of(toView(model));
    }

    @Override
    public UserSearchResult search(CommandContext context, int offset, int limit) {
        if (offset < 0 || limit < 0) {
            throw new IllegalArgumentException("offset and limit must be >= 0");
        }
        List<UserView> all = new ArrayList<>();
        for (String id : eventLog.aggregateIds(context, IamAggregates.USER.name(), context.resourceOwner())) {
            findById(context, id).ifPresent(all::add);
        }
        if (limit == 0 || offset >= all.size()) {
            return new UserSearchResult(all.size(), List.of());
        }
        int end = (int) Math.min((long) offset + limit, all.size());
        return new UserSearchResult(all.size(), all.subList(offset, end));
    }

    static UserView toView(HumanWriteModel model) {
        return new UserView(
                model.aggregate().id(),
                model.resourceOwner(),
                model.userName(),
                model.firstName(),
                model.lastName(),
                model.nickName(),
                model.displayName(),
                model.preferredLanguage(),
                model.email(),
                model.emailVerified(),
                model.phone(),
                model.phoneVerified(),
                model.state() == UserState.ACTIVE,
                model.metadata(),
                model.processedSequence(),
                model.creationDate(),
                model.changeDate());
    }
}
