package ru.vavtech.smartpark.exception;

import java.time.Instant;

/**
 * Момент расчета раньше времени въезда, т.е. часы рассогласованы.
 */
public class NegativeDurationException extends ParkingException {

    public NegativeDurationException(Instant entryTime, Instant now) {
        super("Момент расчета " + now + " раньше времени въезда " + entryTime);
    }
}
