package com.buddy.engine.service;

import java.time.Duration;
import java.util.regex.Pattern;

/**
 * Tunables shared by every job execution.
 *
 * @param cancelGracePeriod how long a cancelled process tree may take to exit
 * @param approvalTimeout   null waits for a decision indefinitely
 * @param progressPattern   first group of a matching output line is a percentage
 */
public record ExecutionSettings(Duration cancelGracePeriod, Duration approvalTimeout, Pattern progressPattern) {

    public static ExecutionSettings defaults() {
        return new ExecutionSettings(Duration.ofSeconds(5), null, Pattern.compile("^\\[progress (\\d{1,3})%]"));
    }
}
