package com.activitytracker.lifecycle;

public interface ActivityTrackerApplication extends AutoCloseable {

    void start() throws Exception;

    void pause();

    void resume();

    void stop() throws Exception;
}
