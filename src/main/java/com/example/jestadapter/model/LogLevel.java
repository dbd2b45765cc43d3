package com.example.jestadapter.model;

public enum LogLevel {
    DEBUG, INFO, WARN, ERROR
}
