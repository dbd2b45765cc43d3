package com.example.jestadapter.model;

public enum ResultType {
    SUCCESS, FAILURE;

    public static ResultType of(RunStatus status) {
        return status == RunStatus.PASSED ? SUCCESS : FAILURE;
    }
}
