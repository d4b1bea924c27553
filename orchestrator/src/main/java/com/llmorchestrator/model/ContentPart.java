package com.llmorchestrator.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * One element of a multimodal message: either text or an image reference.
 * The image URL may be an http(s) URL or a {@code data:image/...;base64,} URI.
 */
@Value
@Builder
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ContentPart {

    public enum Type { TEXT, IMAGE_URL }

    Type type;
    String text;
    String imageUrl;
    String detail;

    public static ContentPart text(String text) {
        return ContentPart.builder().type(Type.TEXT).text(text).build();
    }

    public static ContentPart image(String url) {
        return image(url, "auto");
    }

    public static ContentPart image(String url, String detail) {
        return ContentPart.builder().type(Type.IMAGE_URL).imageUrl(url).detail(detail).build();
    }

    @JsonIgnore
    public boolean isImage() {
        return type == Type.IMAGE_URL;
    }

    @JsonIgnore
    public boolean isInlineImage() {
        return isImage() && imageUrl != null && imageUrl.startsWith("data:");
    }

    /**
     * Media type of an inline image ({@code data:image/png;base64,...} gives {@code image/png}).
     */
    public String inlineMediaType() {
        if (!isInlineImage()) {
            return null;
        }
        int end = imageUrl.indexOf(';');
        return end > 5 ? imageUrl.substring(5, end) : "image/png";
    }

    public String inlineData() {
        if (!isInlineImage()) {
            return null;
        }
        int comma = imageUrl.indexOf(',');
        return comma >= 0 ? imageUrl.substring(comma + 1) : "";
    }
}
