package com.mouse.keeper.model;

import lombok.Getter;
import okhttp3.MediaType;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.Closeable;
import java.io.IOException;

/**
 * An upstream answer handed back to the caller verbatim. The body is still open and
 * must be streamed then closed by the receiver.
 */
@Getter
public class UpstreamResponse implements Closeable {

    private Response response;
    private final Site site;
    private final String accountName;

    public UpstreamResponse(Response response, Site site, String accountName) {
        this.response = response;
        this.site = site;
        this.accountName = accountName;
    }

    public int status() {
        return response.code();
    }

    public ResponseBody body() {
        return response.body();
    }

    public String header(String name) {
        return response.header(name);
    }

    /**
     * Reads the whole body into memory and replaces it with a replayable copy, still in
     * its original content encoding.
     */
    public byte[] bufferBody() throws IOException {
        ResponseBody original = response.body();
        if (original == null) {
            return new byte[0];
        }
        MediaType contentType = original.contentType();
        byte[] bytes = original.bytes();
        response = response.newBuilder()
                .body(ResponseBody.create(bytes, contentType))
                .build();
        return bytes;
    }

    @Override
    public void close() {
        response.close();
    }
}
