package com.chartclips.pipeline;

/**
 * Target audio codec and quality of the saved clips.
 * @param codec Codec, also used as the file extension (e.g. mp3)
 * @param qualityKbps Bitrate in kbit/s (e.g. 192)
 */
public record ClipFormat(String codec, int qualityKbps) {

    public static final ClipFormat MP3_192 = new ClipFormat("mp3", 192);

    public ClipFormat {
        if (codec == null || codec.isBlank()) {
            throw new IllegalArgumentException("Codec cannot be null or empty");
        }
        if (qualityKbps <= 0) {
            throw new IllegalArgumentException("Quality must be positive: " + qualityKbps);
        }
    }

    public String extension() {
        return codec;
    }
}
