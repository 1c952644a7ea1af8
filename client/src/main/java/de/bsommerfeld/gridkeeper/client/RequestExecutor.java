package de.bsommerfeld.gridkeeper.client;

import de.bsommerfeld.gridkeeper.client.transport.DaemonChannel;
import de.bsommerfeld.gridkeeper.protocol.DaemonRequest;
import de.bsommerfeld.gridkeeper.protocol.DaemonResponse;
import de.bsommerfeld.gridkeeper.protocol.MessageCodec;
import de.bsommerfeld.gridkeeper.protocol.ProtocolException;

import java.io.EOFException;
import java.io.IOException;

/**
 * One request/response exchange over an open channel. Error responses are
 * classified and raised as {@link DaemonSqlException}; whether a class is
 * benign for a given operation is for the caller to decide.
 */
public class RequestExecutor {

    private final MessageCodec codec;

    public RequestExecutor(MessageCodec codec) {
        this.codec = codec;
    }

    public DaemonResponse execute(DaemonChannel channel, DaemonRequest request) throws DaemonException {
        String kind = request.getClass().getSimpleName();

        try {
            codec.writeRequest(channel.output(), request);
        } catch (ProtocolException e) {
            throw new DaemonProtocolException("Could not encode " + kind + ": " + e.getMessage(), e);
        } catch (IOException e) {
            throw new DaemonTransportException("Failed to send " + kind + ": " + e.getMessage(), e);
        }

        DaemonResponse response;
        try {
            response = codec.readResponse(channel.input());
        } catch (ProtocolException e) {
            throw new DaemonProtocolException("Invalid response to " + kind + ": " + e.getMessage(), e);
        } catch (EOFException e) {
            throw new DaemonTransportException("Daemon closed the channel before answering " + kind, e);
        } catch (IOException e) {
            throw new DaemonTransportException("Failed to read response to " + kind + ": " + e.getMessage(), e);
        }

        if (response.isError()) {
            String text = response.errorText();
            throw new DaemonSqlException(text, response.code(), DaemonErrorClassifier.classify(text));
        }
        return response;
    }
}
