package org.transitmatters.stopevents.models;

public enum EventType {
    ARR, DEP
}
