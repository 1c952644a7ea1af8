package de.bsommerfeld.gridkeeper.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;

/**
 * JSON encoding of requests and responses on top of {@link FrameCodec}.
 * Instances are thread-safe.
 */
public class MessageCodec {

    private final ObjectMapper mapper;
    private final int maxFrameBytes;

    public MessageCodec(int maxFrameBytes) {
        this.maxFrameBytes = maxFrameBytes;
        this.mapper = new ObjectMapper()
                .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    public byte[] encode(Object message) throws ProtocolException {
        try {
            return mapper.writeValueAsBytes(message);
        } catch (JsonProcessingException e) {
            throw new ProtocolException("Failed to encode " + message.getClass().getSimpleName(), e);
        }
    }

    public DaemonRequest decodeRequest(byte[] body) throws ProtocolException {
        DaemonRequest request;
        try {
            request = mapper.readValue(body, DaemonRequest.class);
        } catch (IOException e) {
            throw new ProtocolException("Malformed request: " + e.getMessage(), e);
        }
        if (request == null)
            throw new ProtocolException("Empty request body");
        return request;
    }

    public DaemonResponse decodeResponse(byte[] body) throws ProtocolException {
        DaemonResponse response;
        try {
            response = mapper.readValue(body, DaemonResponse.class);
        } catch (IOException e) {
            throw new ProtocolException("Malformed response: " + e.getMessage(), e);
        }
        if (response == null || (!response.isOk() && !response.isError()))
            throw new ProtocolException("Unknown response status: "
                    + (response == null ? null : response.status()));
        return response;
    }

    public void writeRequest(OutputStream out, DaemonRequest request) throws IOException {
        FrameCodec.writeFrame(out, encode(request));
    }

    public DaemonRequest readRequest(InputStream in) throws IOException {
        return decodeRequest(FrameCodec.readFrame(in, maxFrameBytes));
    }

    public void writeResponse(OutputStream out, DaemonResponse response) throws IOException {
        FrameCodec.writeFrame(out, encode(response));
    }

    public DaemonResponse readResponse(InputStream in) throws IOException {
        return decodeResponse(FrameCodec.readFrame(in, maxFrameBytes));
    }
}
