package com.activitytracker.win32;

import com.sun.jna.Pointer;
import com.sun.jna.platform.win32.Kernel32;
import com.sun.jna.platform.win32.Kernel32Util;
import com.sun.jna.platform.win32.User32;
import com.sun.jna.platform.win32.WinDef.HWND;
import com.sun.jna.platform.win32.WinNT;
import com.sun.jna.ptr.IntByReference;
import com.activitytracker.sampling.ForegroundSampler;
import com.activitytracker.sampling.SamplingException;
import com.activitytracker.sampling.WindowSnapshot;
import org.apache.commons.lang3.StringUtils;

import java.nio.file.Path;
import java.time.Clock;
import java.util.Locale;
import java.util.Optional;

/**
 * Foreground sampler backed by Win32 APIs (User32 + Kernel32).
 * <p>
 * The executable path, lower-cased, is the stable app id. Windows exposes neither a URL nor a
 * working directory for arbitrary windows, so those fields are always empty.
 */
public class Win32ForegroundSampler implements ForegroundSampler {

    private static final int WINDOW_TITLE_MAX_CHARS = 1024;

    private final Clock clock;

    public Win32ForegroundSampler() {
        this(Clock.systemDefaultZone());
    }

    public Win32ForegroundSampler(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Optional<WindowSnapshot> sample() throws SamplingException {
        HWND foregroundWindow = User32.INSTANCE.GetForegroundWindow();
        if (foregroundWindow == null || Pointer.nativeValue(foregroundWindow.getPointer()) == 0) {
            return Optional.empty();
        }

        int processId = getProcessId(foregroundWindow);
        if (processId <= 0) {
            return Optional.empty();
        }

        Optional<String> exePath = queryExecutablePath(processId).map(this::normalizePath);
        if (exePath.isEmpty() || exePath.get().isBlank()) {
            return Optional.empty();
        }

        String appName = deriveAppName(exePath.get());
        String title = StringUtils.defaultIfBlank(readWindowTitle(foregroundWindow), appName);
        return Optional.of(new WindowSnapshot(
                clock.instant(),
                appName,
                exePath.get().toLowerCase(Locale.ROOT),
                title,
                Optional.empty(),
                Optional.empty()));
    }

    private String normalizePath(String rawPath) {
        try {
            return Path.of(rawPath).toAbsolutePath().normalize().toString();
        } catch (RuntimeException ex) {
            return rawPath;
        }
    }

    private int getProcessId(HWND hwnd) throws SamplingException {
        IntByReference processId = new IntByReference();
        int threadId = User32.INSTANCE.GetWindowThreadProcessId(hwnd, processId);
        if (threadId == 0) {
            int error = Kernel32.INSTANCE.GetLastError();
            throw new SamplingException("GetWindowThreadProcessId failed with error " + error);
        }
        return processId.getValue();
    }

    private Optional<String> queryExecutablePath(int processId) throws SamplingException {
        WinNT.HANDLE processHandle = Kernel32.INSTANCE.OpenProcess(WinNT.PROCESS_QUERY_LIMITED_INFORMATION, false, processId);
        if (processHandle == null || Pointer.nativeValue(processHandle.getPointer()) == 0) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(Kernel32Util.QueryFullProcessImageName(processHandle, 0));
        } catch (RuntimeException ex) {
            throw new SamplingException("QueryFullProcessImageName failed", ex);
        } finally {
            Kernel32.INSTANCE.CloseHandle(processHandle);
        }
    }

    private String deriveAppName(String exePath) {
        Path fileName = Path.of(exePath).getFileName();
        if (fileName == null) {
            return exePath;
        }
        String baseName = fileName.toString();
        int dotIndex = baseName.lastIndexOf('.');
        String withoutExtension = dotIndex > 0 ? baseName.substring(0, dotIndex) : baseName;
        return StringUtils.capitalize(withoutExtension);
    }

    private String readWindowTitle(HWND hwnd) {
        char[] buffer = new char[WINDOW_TITLE_MAX_CHARS];
        int length = User32.INSTANCE.GetWindowText(hwnd, buffer, buffer.length);
        if (length <= 0) {
            return null;
        }
        return new String(buffer, 0, length).strip();
    }
}
