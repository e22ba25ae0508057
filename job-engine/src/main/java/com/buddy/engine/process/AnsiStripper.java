package com.buddy.engine.process;

import java.util.regex.Pattern;

/**
 * Removes terminal escape sequences (colours, cursor movement, OSC titles)
 * so captured lines render as plain text in every viewer.
 */
public final class AnsiStripper {

    private static final Pattern ANSI = Pattern.compile(
            "\u001B\\[[0-9;?]*[ -/]*[@-~]"       // CSI: colours, cursor, erase
          + "|\u001B\\][^\u0007]*\u0007"          // OSC terminated by BEL
          + "|\u001B[PX^_][^\u001B]*\u001B\\\\"   // DCS/SOS/PM/APC terminated by ST
          + "|\u001B[@-Z\\\\-_]");                // lone two-byte escapes

    private AnsiStripper() {}

    public static String strip(String line) {
        if (line == null || line.indexOf('\u001B') < 0) {
            return line;
        }
        return ANSI.matcher(line).replaceAll("");
    }
}
