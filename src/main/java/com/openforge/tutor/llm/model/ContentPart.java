package com.openforge.tutor.llm.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * One element of a multi-part user message (OpenAI content-array format).
 *
 *   {"type":"text","text":"..."}
 *   {"type":"input_audio","input_audio":{"data":"<base64>","format":"wav"}}
 *   {"type":"image_url","image_url":{"url":"data:image/png;base64,..."}}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ContentPart(
        String type,
        String text,
        InputAudio inputAudio,
        ImageUrl imageUrl
) {

    public record InputAudio(String data, String format) {}

    public record ImageUrl(String url) {}

    public static ContentPart text(String text) {
        return new ContentPart("text", text, null, null);
    }

    /** @param mimeType e.g. "audio/wav" or "audio/webm"; the subtype becomes the format */
    public static ContentPart audio(String base64, String mimeType) {
        String format = mimeType == null ? "wav" : mimeType.substring(mimeType.indexOf('/') + 1);
        int semicolon = format.indexOf(';');
        if (semicolon >= 0) format = format.substring(0, semicolon);
        return new ContentPart("input_audio", null, new InputAudio(base64, format), null);
    }

    public static ContentPart image(String base64, String mimeType) {
        return new ContentPart("image_url", null, null,
                new ImageUrl("data:" + mimeType + ";base64," + base64));
    }
}
