package com.sprout.bot.dispatch;

import com.sprout.bot.persistence.Plant;
import com.sprout.bot.persistence.UnitOfWork;
import com.sprout.bot.transport.InboundEvent;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/** {@code /plants}: lists the sender's plants. */
public class PlantsCommandHandler implements EventHandler {

    @Override
    public String name() {
        return "plants";
    }

    @Override
    public boolean supports(InboundEvent event) {
        return "/plants".equals(event.command());
    }

    @Override
    public Optional<String> handle(InboundEvent event, UnitOfWork uow) {
        if (uow.users().find(event.userId()).isEmpty()) {
            return Optional.of("Send /start first.");
        }
        List<Plant> plants = uow.plants().listByUser(event.userId());
        if (plants.isEmpty()) {
            return Optional.of("You have no plants yet.");
        }
        return Optional.of(plants.stream()
                .map(plant -> "• " + plant.name())
                .collect(Collectors.joining("\n", "Your plants:\n", "")));
    }
}
