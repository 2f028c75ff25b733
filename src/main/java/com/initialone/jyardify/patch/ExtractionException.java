package com.initialone.jyardify.patch;

/** No extraction strategy produced a parseable directive list. */
public class ExtractionException extends Exception {
    private final int strategiesTried;

    public ExtractionException(String message, int strategiesTried) {
        super(message);
        this.strategiesTried = strategiesTried;
    }

    public int getStrategiesTried() {
        return strategiesTried;
    }
}
