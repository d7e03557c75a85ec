package com.di.userflow.load;

public enum LoadAction {
    INSERTED,
    UPDATED,
    IGNORED
}
