package com.filterbench.actor;

public enum ActorState {
    CREATED, RUNNING, STOPPED
}
