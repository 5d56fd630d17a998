package com.flagrank.service;

public interface ScoreEventQueue {

    void enqueue(ScoreEvent event);

    void setConsumer(ScoreEventConsumer consumer);
}
