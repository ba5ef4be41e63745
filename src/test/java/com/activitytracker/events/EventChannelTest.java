package com.activitytracker.events;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

class EventChannelTest {

    private static final DayChangedEvent EVENT =
            new DayChangedEvent(LocalDate.of(2024, 1, 15), LocalDate.of(2024, 1, 16));

    @Test
    void shouldDeliverToRemainingSubscribersWhenOneFails() {
        EventChannel<DayChangedEvent> channel = new EventChannel<>("day-changed");
        List<DayChangedEvent> received = new ArrayList<>();
        channel.subscribe(event -> {
            throw new IllegalStateException("boom");
        });
        channel.subscribe(received::add);

        channel.publish(EVENT);

        assertEquals(List.of(EVENT), received);
    }

    @Test
    void shouldStopDeliveryAfterCancel() {
        EventChannel<DayChangedEvent> channel = new EventChannel<>("day-changed");
        List<DayChangedEvent> received = new ArrayList<>();
        Subscription subscription = channel.subscribe(received::add);

        channel.publish(EVENT);
        subscription.cancel();
        channel.publish(EVENT);

        assertEquals(1, received.size());
        assertEquals(0, channel.subscriberCount());
    }
}
