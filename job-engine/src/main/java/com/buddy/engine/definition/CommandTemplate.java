package com.buddy.engine.definition;

import com.buddy.engine.process.ProcessSpec;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Expands {@code {name}} placeholders in a phase's command line.
 *
 * Supported names: {@code target}, {@code env}, {@code jobId} and
 * {@code param.<name>} for any creation parameter. A placeholder with no
 * value is an error rather than an empty string, so a half-formed command
 * never runs.
 */
public final class CommandTemplate {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{([a-zA-Z0-9_.-]+)}");

    private CommandTemplate() {}

    /** Variables for one job. */
    public static Map<String, String> variables(String jobId, String target, String environment,
                                                Map<String, String> params) {
        Map<String, String> vars = new LinkedHashMap<>();
        vars.put("jobId", jobId);
        vars.put("target", target);
        vars.put("env", environment);
        if (params != null) {
            params.forEach((k, v) -> vars.put("param." + k, v));
        }
        return vars;
    }

    /**
     * @throws IllegalArgumentException if a placeholder has no value
     */
    public static ProcessSpec resolve(PhaseDefinition phase, Map<String, String> vars) {
        List<String> command = new ArrayList<>();
        command.add(expand(phase.command(), vars));
        for (String arg : phase.args()) {
            command.add(expand(arg, vars));
        }
        Path dir = phase.workingDirectory() == null ? null : toPath(expand(phase.workingDirectory(), vars));
        Map<String, String> env = new LinkedHashMap<>();
        phase.env().forEach((k, v) -> env.put(k, expand(v, vars)));
        return new ProcessSpec(command, dir, env);
    }

    public static String expand(String template, Map<String, String> vars) {
        Matcher m = PLACEHOLDER.matcher(template);
        StringBuilder sb = new StringBuilder();
        while (m.find()) {
            String value = vars.get(m.group(1));
            if (value == null) {
                throw new IllegalArgumentException("No value for placeholder {" + m.group(1) + "} in '" + template + "'");
            }
            m.appendReplacement(sb, Matcher.quoteReplacement(value));
        }
        m.appendTail(sb);
        return sb.toString();
    }

    private static Path toPath(String dir) {
        if (dir.equals("~") || dir.startsWith("~/")) {
            return Path.of(System.getProperty("user.home") + dir.substring(1));
        }
        return Path.of(dir);
    }
}
