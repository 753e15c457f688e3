package com.browsermcp.relay;

/**
 * The live transport to the browser extension.
 *
 * <p>Inbound traffic does not flow through this interface: whoever reads the transport feeds
 * frames into the {@link MessageCorrelator} bound to the socket.
 */
public interface ExtensionSocket {

    boolean isOpen();

    /**
     * Write one text message.
     *
     * @throws com.browsermcp.common.errors.TransportException if the socket is not open
     */
    void send(String text);

    /** Close the socket. Safe to call more than once. */
    void close();
}
