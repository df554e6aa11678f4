package com.projectgroup5.pongarena.event;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

class EventBusTest {

    private EventBus eventBus;

    @BeforeEach
    void setUp() {
        eventBus = new EventBus();
    }

    @Test
    void eventsAreDeliveredByType() {
        final List<Long> connected = new ArrayList<>();
        final List<Long> disconnected = new ArrayList<>();
        eventBus.subscribe(UserConnectedEvent.class, e -> connected.add(e.getUserId()));
        eventBus.subscribe(UserDisconnectedEvent.class, e -> disconnected.add(e.getUserId()));

        eventBus.publish(new UserDisconnectedEvent(3));

        assertThat(connected).isEmpty();
        assertThat(disconnected).containsExactly(3L);
    }

    @Test
    void failingSubscriberDoesNotStopOthers() {
        final List<Long> seen = new ArrayList<>();
        eventBus.subscribe(UserDisconnectedEvent.class, e -> {
            throw new IllegalStateException("boom");
        });
        eventBus.subscribe(UserDisconnectedEvent.class, e -> seen.add(e.getUserId()));

        eventBus.publish(new UserDisconnectedEvent(4));

        assertThat(seen).containsExactly(4L);
    }

    @Test
    void publishWithoutSubscribersIsNoop() {
        assertThatCode(() -> eventBus.publish(new UserConnectedEvent(1))).doesNotThrowAnyException();
    }
}
