package com.example.terminal_bridge.routing;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FormattedOutput {
    private String formatted;
    private String html;
    // offsets into the raw text, not into html
    private List<Highlight> highlights;

    @Data
    @AllArgsConstructor
    @NoArgsConstructor
    public static class Highlight {
        private int start;
        private int end;
        private String type;
    }
}
