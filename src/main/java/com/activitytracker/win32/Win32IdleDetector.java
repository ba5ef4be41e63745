package com.activitytracker.win32;

import com.sun.jna.platform.win32.Kernel32;
import com.sun.jna.platform.win32.User32;
import com.sun.jna.platform.win32.WinUser;
import com.activitytracker.sampling.IdleDetector;
import com.activitytracker.sampling.SamplingException;

import java.time.Duration;

/**
 * Reports the time since the last keyboard or mouse input using GetLastInputInfo.
 */
public class Win32IdleDetector implements IdleDetector {

    @Override
    public Duration timeSinceLastInput() throws SamplingException {
        WinUser.LASTINPUTINFO lastInputInfo = new WinUser.LASTINPUTINFO();
        lastInputInfo.cbSize = lastInputInfo.size();

        if (!User32.INSTANCE.GetLastInputInfo(lastInputInfo)) {
            int error = Kernel32.INSTANCE.GetLastError();
            throw new SamplingException("GetLastInputInfo failed with error " + error);
        }

        // dwTime is a 32-bit tick count; compare modulo 2^32 so the 49.7 day wrap does not yield a negative span.
        long now = Kernel32.INSTANCE.GetTickCount64() & 0xFFFFFFFFL;
        long lastInput = Integer.toUnsignedLong(lastInputInfo.dwTime);
        long delta = (now - lastInput) & 0xFFFFFFFFL;
        return Duration.ofMillis(delta);
    }
}
