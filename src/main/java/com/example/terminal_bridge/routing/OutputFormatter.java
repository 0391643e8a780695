package com.example.terminal_bridge.routing;

import org.springframework.stereotype.Component;
import org.springframework.web.util.HtmlUtils;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Escapes captured output to HTML and wraps tool-specific patterns in
 * {@code <span class="...">} markers.
 */
@Component
public class OutputFormatter {

    private static final int LINE_NUMBER_THRESHOLD = 10;

    private static final List<Rule> GIT_RULES = List.of(
            new Rule("modified:|new file:|deleted:", "git-status-modified"),
            new Rule("Untracked files:", "git-status-untracked"),
            new Rule("Changes to be committed:", "git-status-staged"),
            new Rule("\\+\\d+|-\\d+", "git-diff-stats"));

    private static final List<Rule> NPM_RULES = List.of(
            new Rule("WARNING|WARN", "npm-warn"),
            new Rule("ERR!|ERROR", "npm-error"),
            new Rule("✓|✔", "npm-success"));

    private static final List<Rule> PYTHON_RULES = List.of(
            new Rule("Traceback \\(most recent call last\\):", "python-traceback"),
            new Rule("\\w+Error:", "python-error"),
            new Rule("File \".*\", line \\d+", "python-file-ref"));

    private static final List<Rule> DOCKER_RULES = List.of(
            new Rule("CONTAINER ID|IMAGE|COMMAND|CREATED|STATUS|PORTS|NAMES", "docker-header"),
            new Rule("Up \\d+.*|Exited \\(\\d+\\).*", "docker-status"));

    private static final List<Rule> K8S_RULES = List.of(
            new Rule("NAMESPACE|NAME|READY|STATUS|RESTARTS|AGE", "k8s-header"),
            new Rule("Running|Pending|Failed|Succeeded", "k8s-status"));

    private static final List<Rule> SYSTEM_RULES = List.of(
            new Rule("error|ERROR", "system-error"),
            new Rule("warning|WARNING|warn|WARN", "system-warning"),
            new Rule("success|SUCCESS|\\bok\\b|\\bOK\\b|✓|✔", "system-success"),
            new Rule("\\d{4}-\\d{2}-\\d{2} \\d{2}:\\d{2}:\\d{2}", "system-timestamp"));

    private static final class Rule {
        final Pattern pattern;
        final String type;

        Rule(String regex, String type) {
            this.pattern = Pattern.compile(regex);
            this.type = type;
        }
    }

    public FormattedOutput format(CommandInfo info, String output) {
        String text = output == null ? "" : output;
        if (info == null || info.getTool() == null || text.isEmpty()) {
            return plain(text, escape(text));
        }

        switch (info.getCategory()) {
            case DEVELOPMENT:
                if ("git".equals(info.getTool())) {
                    return highlight(text, GIT_RULES);
                }
                if ("node".equals(info.getTool())) {
                    String command = info.getCommand();
                    return command.contains("npm") || command.contains("yarn")
                            ? highlight(text, NPM_RULES)
                            : plain(text, escape(text));
                }
                if ("python".equals(info.getTool())) {
                    return highlight(text, PYTHON_RULES);
                }
                return plain(text, escape(text));
            case AI:
                return plain(text, markdown(text));
            case DEVOPS:
                if ("docker".equals(info.getTool())) {
                    return highlight(text, DOCKER_RULES);
                }
                if ("kubectl".equals(info.getTool())) {
                    return highlight(text, K8S_RULES);
                }
                return plain(text, escape(text));
            case SYSTEM:
                return highlight(text, SYSTEM_RULES);
            default:
                return plain(text, lineNumbered(text));
        }
    }

    public static String escape(String text) {
        return HtmlUtils.htmlEscape(text, StandardCharsets.UTF_8.name());
    }

    private static FormattedOutput plain(String text, String html) {
        return FormattedOutput.builder()
                .formatted(text)
                .html(html)
                .highlights(List.of())
                .build();
    }

    /**
     * Earliest match wins; a later match overlapping an accepted one is dropped.
     */
    private static FormattedOutput highlight(String text, List<Rule> rules) {
        List<FormattedOutput.Highlight> candidates = new ArrayList<>();
        for (Rule rule : rules) {
            Matcher matcher = rule.pattern.matcher(text);
            while (matcher.find()) {
                if (matcher.end() > matcher.start()) {
                    candidates.add(new FormattedOutput.Highlight(matcher.start(), matcher.end(), rule.type));
                }
            }
        }
        candidates.sort(Comparator.comparingInt(FormattedOutput.Highlight::getStart)
                .thenComparingInt(h -> h.getStart() - h.getEnd()));

        List<FormattedOutput.Highlight> accepted = new ArrayList<>();
        StringBuilder html = new StringBuilder();
        int cursor = 0;
        for (FormattedOutput.Highlight h : candidates) {
            if (h.getStart() < cursor) {
                continue;
            }
            html.append(escape(text.substring(cursor, h.getStart())))
                    .append("<span class=\"").append(h.getType()).append("\">")
                    .append(escape(text.substring(h.getStart(), h.getEnd())))
                    .append("</span>");
            cursor = h.getEnd();
            accepted.add(h);
        }
        html.append(escape(text.substring(cursor)));

        return FormattedOutput.builder()
                .formatted(text)
                .html(html.toString())
                .highlights(accepted)
                .build();
    }

    static String markdown(String text) {
        String html = escape(text);
        html = html.replaceAll("\\*\\*(.*?)\\*\\*", "<strong>$1</strong>");
        html = html.replaceAll("\\*(.*?)\\*", "<em>$1</em>");
        html = html.replaceAll("`(.*?)`", "<code>$1</code>");
        html = html.replaceAll("(?m)^### (.*)$", "<h3>$1</h3>");
        html = html.replaceAll("(?m)^## (.*)$", "<h2>$1</h2>");
        html = html.replaceAll("(?m)^# (.*)$", "<h1>$1</h1>");
        return html;
    }

    static String lineNumbered(String text) {
        String[] lines = escape(text).split("\n", -1);
        if (lines.length <= LINE_NUMBER_THRESHOLD) {
            return escape(text);
        }
        StringBuilder html = new StringBuilder();
        for (int i = 0; i < lines.length; i++) {
            if (i > 0) {
                html.append('\n');
            }
            html.append("<span class=\"line-number\">").append(i + 1).append("</span> ").append(lines[i]);
        }
        return html.toString();
    }
}
