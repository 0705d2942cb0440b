package com.riskgate.backend.service.bus;

import com.riskgate.backend.model.BusMessage;

import java.io.IOException;

/**
 * One live participant of a bus session.
 */
public interface BusConnection {

    String id();

    void send(BusMessage message) throws IOException;
}
