package com.activitytracker.config;

@FunctionalInterface
public interface ConfigListener {

    void onConfigReload(AppConfig config);
}
