package com.sprout.bot.dispatch;

import com.sprout.bot.persistence.UnitOfWork;
import com.sprout.bot.transport.InboundEvent;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.Optional;

/** {@code /tz <zone>}: changes the sender's timezone, registering them if needed. */
public class TimezoneCommandHandler implements EventHandler {

    private final ZoneId defaultTimezone;

    public TimezoneCommandHandler(ZoneId defaultTimezone) {
        this.defaultTimezone = defaultTimezone;
    }

    @Override
    public String name() {
        return "timezone";
    }

    @Override
    public boolean supports(InboundEvent event) {
        return "/tz".equals(event.command());
    }

    @Override
    public Optional<String> handle(InboundEvent event, UnitOfWork uow) {
        var user = uow.users().getOrCreate(event.userId(), event.username(), defaultTimezone);
        if (event.arguments().isEmpty()) {
            return Optional.of("Your timezone is %s.".formatted(user.timezone().getId()));
        }
        ZoneId zone;
        try {
            zone = ZoneId.of(event.arguments());
        } catch (DateTimeException e) {
            return Optional.of("Unknown timezone '%s'. Try something like Europe/Berlin.".formatted(event.arguments()));
        }
        uow.users().setTimezone(user.id(), zone);
        return Optional.of("Timezone set to %s.".formatted(zone.getId()));
    }
}
