package com.sprout.bot.dispatch;

import com.sprout.bot.persistence.UnitOfWork;
import com.sprout.bot.persistence.User;
import com.sprout.bot.transport.InboundEvent;
import java.time.ZoneId;
import java.util.Optional;

/** {@code /start}: registers the sender on first contact and greets them. */
public class StartCommandHandler implements EventHandler {

    private final ZoneId defaultTimezone;

    public StartCommandHandler(ZoneId defaultTimezone) {
        this.defaultTimezone = defaultTimezone;
    }

    @Override
    public String name() {
        return "start";
    }

    @Override
    public boolean supports(InboundEvent event) {
        return "/start".equals(event.command());
    }

    @Override
    public Optional<String> handle(InboundEvent event, UnitOfWork uow) {
        boolean known = uow.users().find(event.userId()).isPresent();
        User user = uow.users().getOrCreate(event.userId(), event.username(), defaultTimezone);
        int plants = uow.plants().listByUser(user.id()).size();
        if (!known) {
            return Optional.of("Welcome! Reminders will use the %s timezone; change it with /tz <zone>."
                    .formatted(user.timezone().getId()));
        }
        return Optional.of("Welcome back! You have %d plant(s).".formatted(plants));
    }
}
