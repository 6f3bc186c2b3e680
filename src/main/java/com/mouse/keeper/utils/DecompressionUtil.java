package com.mouse.keeper.utils;

import com.aayushatharva.brotli4j.Brotli4jLoader;
import com.aayushatharva.brotli4j.decoder.BrotliInputStream;
import com.github.luben.zstd.ZstdInputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.zip.GZIPInputStream;
import java.util.zip.Inflater;
import java.util.zip.InflaterInputStream;

/**
 * Decodes upstream error bodies so they can be inspected. Successful responses are never
 * decoded; they go back to the client with their original encoding.
 */
public final class DecompressionUtil {

    private static final Logger logger = LoggerFactory.getLogger(DecompressionUtil.class);
    private static final int BUFFER_SIZE = 8192;
    private static boolean brotliLoaded = false;

    static {
        try {
            Brotli4jLoader.ensureAvailability();
            brotliLoaded = true;
        } catch (Throwable e) {
            logger.warn("Brotli native library not available: {}", e.getMessage());
        }
    }

    private DecompressionUtil() {
    }

    /**
     * Decodes {@code data} according to a {@code Content-Encoding} value. Unknown or missing
     * encodings, and data that fails to decode, are read as UTF-8 text.
     */
    public static String decode(byte[] data, String contentEncoding) {
        if (data == null || data.length == 0) {
            return "";
        }
        if (contentEncoding == null || contentEncoding.isBlank()) {
            return new String(data, StandardCharsets.UTF_8);
        }

        String encoding = contentEncoding.toLowerCase().trim();
        try {
            if (encoding.contains("br")) {
                if (!brotliLoaded) {
                    logger.warn("Cannot decode brotli body, native library missing");
                    return new String(data, StandardCharsets.UTF_8);
                }
                return readAll(new BrotliInputStream(new ByteArrayInputStream(data)));
            } else if (encoding.contains("zstd")) {
                return readAll(new ZstdInputStream(new ByteArrayInputStream(data)));
            } else if (encoding.contains("gzip")) {
                return readAll(new GZIPInputStream(new ByteArrayInputStream(data)));
            } else if (encoding.contains("deflate")) {
                return inflate(data);
            }
        } catch (IOException e) {
            logger.warn("Decompression failed for Content-Encoding '{}': {}", encoding, e.getMessage());
        }
        return new String(data, StandardCharsets.UTF_8);
    }

    /**
     * DEFLATE bodies come both zlib-wrapped and raw; zlib is tried first.
     */
    private static String inflate(byte[] data) throws IOException {
        try {
            return readAll(new InflaterInputStream(new ByteArrayInputStream(data), new Inflater(false)));
        } catch (IOException e) {
            logger.debug("zlib inflate failed, retrying raw DEFLATE: {}", e.getMessage());
            return readAll(new InflaterInputStream(new ByteArrayInputStream(data), new Inflater(true)));
        }
    }

    private static String readAll(InputStream in) throws IOException {
        try (InputStream stream = in; ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            byte[] buffer = new byte[BUFFER_SIZE];
            int len;
            while ((len = stream.read(buffer)) > 0) {
                out.write(buffer, 0, len);
            }
            return out.toString(StandardCharsets.UTF_8);
        }
    }
}
