package com.browsermcp.tools;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One content part of a tool result: {@code text} or {@code image}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class Content {

    private String type;
    private String text;
    private String data;
    private String mimeType;

    public static Content text(String text) {
        return Content.builder().type("text").text(text).build();
    }

    public static Content image(String base64Data, String mimeType) {
        return Content.builder().type("image").data(base64Data).mimeType(mimeType).build();
    }
}
