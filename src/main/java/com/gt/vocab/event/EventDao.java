package com.gt.vocab.event;

import com.gt.vocab.model.Event;

import java.util.List;

public interface EventDao {

    void appendEvent(Event event);
    int appendEvents(List<Event> events);

    List<Event> loadAllEvents();
}
