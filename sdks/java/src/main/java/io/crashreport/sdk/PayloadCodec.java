package io.crashreport.sdk;

import io.crashreport.sdk.exception.CrashReportException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Map;
import java.util.zip.Deflater;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/** Encodes event payloads as UTF-8 JSON, optionally gzip-compressed. */
public final class PayloadCodec {

    public static final String CONTENT_TYPE = "application/json";
    public static final String GZIP_ENCODING = "gzip";

    private final ObjectMapper objectMapper;
    private final boolean compress;

    public PayloadCodec(ObjectMapper objectMapper, boolean compress) {
        this.objectMapper = objectMapper;
        this.compress = compress;
    }

    public boolean isCompressing() { return compress; }

    /** Value for the {@code Content-Encoding} header, or null when the body is sent as is. */
    public String contentEncoding() {
        return compress ? GZIP_ENCODING : null;
    }

    public byte[] encode(Map<String, Object> payload) {
        byte[] json;
        try {
            json = objectMapper.writeValueAsBytes(payload);
        } catch (JsonProcessingException e) {
            throw new CrashReportException("Failed to serialize event: " + e.getOriginalMessage(), e, 0, "SERIALIZATION_ERROR");
        }
        return compress ? gzip(json) : json;
    }

    static byte[] gzip(byte[] data) {
        ByteArrayOutputStream out = new ByteArrayOutputStream(Math.max(64, data.length / 2));
        try (GZIPOutputStream gzip = new GZIPOutputStream(out) {
            {
                def.setLevel(Deflater.DEFAULT_COMPRESSION);
            }
        }) {
            gzip.write(data);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return out.toByteArray();
    }

    /** Reverse of gzip compression, for inspecting encoded bodies. */
    public static byte[] decompress(byte[] data) {
        try (InputStream in = new GZIPInputStream(new ByteArrayInputStream(data))) {
            return in.readAllBytes();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
