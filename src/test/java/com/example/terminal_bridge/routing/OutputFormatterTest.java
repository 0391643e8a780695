package com.example.terminal_bridge.routing;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;

class OutputFormatterTest {

    private final OutputFormatter formatter = new OutputFormatter();

    @Test
    void format_gitStatus_highlightsModifiedLines() {
        FormattedOutput out = formatter.format(info("git", "git", ToolCategory.DEVELOPMENT), "modified:   a.txt\n");

        assertThat(out.getFormatted()).isEqualTo("modified:   a.txt\n");
        assertThat(out.getHtml()).isEqualTo("<span class=\"git-status-modified\">modified:</span>   a.txt\n");
        assertThat(out.getHighlights()).containsExactly(new FormattedOutput.Highlight(0, 9, "git-status-modified"));
    }

    @Test
    void format_npmCommand_highlightsWarnings() {
        FormattedOutput out = formatter.format(info("npm", "node", ToolCategory.DEVELOPMENT), "npm WARN deprecated");

        assertThat(out.getHtml()).isEqualTo("npm <span class=\"npm-warn\">WARN</span> deprecated");
    }

    @Test
    void format_plainNodeCommand_isOnlyEscaped() {
        FormattedOutput out = formatter.format(info("node", "node", ToolCategory.DEVELOPMENT), "WARN <x>");

        assertThat(out.getHtml()).isEqualTo("WARN &lt;x&gt;");
        assertThat(out.getHighlights()).isEmpty();
    }

    @Test
    void format_aiTool_rendersMarkdown() {
        FormattedOutput out = formatter.format(info("claude", "claude-code", ToolCategory.AI),
                "# Plan\n**bold** then *soft* and `code`");

        assertThat(out.getHtml())
                .isEqualTo("<h1>Plan</h1>\n<strong>bold</strong> then <em>soft</em> and <code>code</code>");
    }

    @Test
    void format_escapesAroundHighlights() {
        FormattedOutput out = formatter.format(info("curl", "curl", ToolCategory.SYSTEM), "<b>error</b>");

        assertThat(out.getHtml()).isEqualTo("&lt;b&gt;<span class=\"system-error\">error</span>&lt;/b&gt;");
        assertThat(out.getHighlights()).containsExactly(new FormattedOutput.Highlight(3, 8, "system-error"));
    }

    @Test
    void format_overlappingMatches_keepLongestEarliest() {
        FormattedOutput out = formatter.format(info("kubectl", "kubectl", ToolCategory.DEVOPS), "NAMESPACE NAME");

        assertThat(out.getHighlights()).containsExactly(
                new FormattedOutput.Highlight(0, 9, "k8s-header"),
                new FormattedOutput.Highlight(10, 14, "k8s-header"));
    }

    @Test
    void format_systemOk_requiresWordBoundary() {
        FormattedOutput out = formatter.format(info("curl", "curl", ToolCategory.SYSTEM), "token ok");

        assertThat(out.getHighlights()).containsExactly(new FormattedOutput.Highlight(6, 8, "system-success"));
    }

    @Test
    void format_longOutputOfOtherCategory_isLineNumbered() {
        String text = IntStream.rangeClosed(1, 12).mapToObj(i -> "row" + i).collect(Collectors.joining("\n"));

        FormattedOutput out = formatter.format(info("psql", "psql", ToolCategory.DATABASE), text);

        assertThat(out.getHtml()).startsWith("<span class=\"line-number\">1</span> row1\n");
        assertThat(out.getHtml()).endsWith("<span class=\"line-number\">12</span> row12");
    }

    @Test
    void format_shortOutputOfOtherCategory_isOnlyEscaped() {
        FormattedOutput out = formatter.format(info("psql", "psql", ToolCategory.DATABASE), "a & b");

        assertThat(out.getHtml()).isEqualTo("a &amp; b");
    }

    @Test
    void format_withoutToolOrOutput_isEscapedPlainText() {
        CommandInfo noTool = CommandInfo.builder().command("ls").args(List.of()).category(ToolCategory.UNKNOWN).build();

        assertThat(formatter.format(noTool, "<dir>").getHtml()).isEqualTo("&lt;dir&gt;");
        assertThat(formatter.format(info("git", "git", ToolCategory.DEVELOPMENT), "").getHtml()).isEmpty();
        assertThat(formatter.format(info("git", "git", ToolCategory.DEVELOPMENT), null).getFormatted()).isEmpty();
    }

    private static CommandInfo info(String command, String tool, ToolCategory category) {
        return CommandInfo.builder()
                .command(command)
                .args(List.of())
                .tool(tool)
                .category(category)
                .build();
    }
}
