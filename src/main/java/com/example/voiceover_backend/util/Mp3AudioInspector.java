package com.example.voiceover_backend.util;

/**
 * Cheap MP3 sanity check on synthesized audio before it is stored: an ID3v2 tag or an MPEG audio
 * frame sync at the start.
 */
public final class Mp3AudioInspector {
    public static final String MIME_TYPE = "audio/mpeg";

    private Mp3AudioInspector() {}

    public static boolean looksLikeMp3(byte[] audio) {
        if (audio == null || audio.length < 3) return false;
        if (audio[0] == 'I' && audio[1] == 'D' && audio[2] == '3') return true;
        int b0 = audio[0] & 0xFF;
        int b1 = audio[1] & 0xFF;
        // 11-bit frame sync, layer bits != 00
        return b0 == 0xFF && (b1 & 0xE0) == 0xE0 && (b1 & 0x06) != 0;
    }
}
