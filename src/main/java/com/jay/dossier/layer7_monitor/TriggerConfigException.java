package com.jay.dossier.layer7_monitor;

/** A trigger definition that cannot be evaluated; raised at registration, before anything is stored. */
public class TriggerConfigException extends IllegalArgumentException {

    public TriggerConfigException(String message) {
        super(message);
    }
}
