package com.browsermcp.tools;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Result of a tool call as returned to protocol clients: {@code {content:[...], isError?}}.
 *
 * <p>Failures are results too. Handlers never let an exception reach the client; the
 * {@link ToolCallBridge} folds them into {@link #error(String)}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class CallToolResult {

    @Builder.Default
    private List<Content> content = new ArrayList<>();

    @JsonProperty("isError")
    private Boolean isError;

    public static CallToolResult of(List<Content> content) {
        return CallToolResult.builder().content(new ArrayList<>(content)).build();
    }

    public static CallToolResult text(String text) {
        return of(List.of(Content.text(text)));
    }

    public static CallToolResult error(String message) {
        return CallToolResult.builder()
                .content(new ArrayList<>(List.of(Content.text(message))))
                .isError(true)
                .build();
    }

    @JsonIgnore
    public boolean isErrorResult() {
        return Boolean.TRUE.equals(isError);
    }

    /** Text of the first text part, or {@code null}. */
    @JsonIgnore
    public String firstText() {
        if (content == null) {
            return null;
        }
        return content.stream()
                .filter(c -> "text".equals(c.getType()))
                .map(Content::getText)
                .findFirst()
                .orElse(null);
    }
}
