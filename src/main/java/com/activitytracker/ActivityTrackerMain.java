package com.activitytracker;

import com.activitytracker.config.FileConfigManager;
import com.activitytracker.lifecycle.ActivityTrackerApplication;
import com.activitytracker.lifecycle.ActivityTrackerService;
import com.activitytracker.util.PathUtils;
import com.activitytracker.win32.Win32ForegroundSampler;
import com.activitytracker.win32.Win32IdleDetector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.concurrent.CountDownLatch;

public final class ActivityTrackerMain {

    private static final Logger log = LoggerFactory.getLogger(ActivityTrackerMain.class);

    private ActivityTrackerMain() {
    }

    public static void main(String[] args) {
        Path configPath = resolveConfigPath(args);
        try (FileConfigManager configManager = new FileConfigManager()) {
            ActivityTrackerApplication application = new ActivityTrackerService(
                    configPath, configManager, new Win32ForegroundSampler(), new Win32IdleDetector());
            CountDownLatch latch = new CountDownLatch(1);
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                try {
                    application.stop();
                } catch (Exception ex) {
                    log.error("Error during shutdown", ex);
                } finally {
                    latch.countDown();
                }
            }, "activity-tracker-shutdown"));

            application.start();
            latch.await();
        } catch (Exception ex) {
            log.error("Failed to start activity tracker", ex);
            System.exit(1);
        }
    }

    private static Path resolveConfigPath(String[] args) {
        if (args != null && args.length > 0) {
            return PathUtils.resolve(args[0]);
        }
        return PathUtils.defaultConfigFile().toAbsolutePath().normalize();
    }
}
