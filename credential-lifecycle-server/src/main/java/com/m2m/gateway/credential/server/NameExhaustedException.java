package com.m2m.gateway.credential.server;

import java.util.List;

import lombok.Getter;

/**
 * Every candidate credential name collided with an existing one. Terminal for the request.
 */
@Getter
public class NameExhaustedException extends RuntimeException {

    private final String requestedName;
    private final List<String> attemptedNames;

    public NameExhaustedException(String requestedName, List<String> attemptedNames) {
        super("No free credential name for '" + requestedName + "' after " + attemptedNames.size() + " attempts");
        this.requestedName = requestedName;
        this.attemptedNames = List.copyOf(attemptedNames);
    }
}
