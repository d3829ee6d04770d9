package xray.daq.monitoring;

import com.fasterxml.jackson.core.JsonProcessingException;

import java.nio.charset.StandardCharsets;
import java.util.Map;

import org.apache.log4j.Logger;
import org.zeromq.SocketType;
import org.zeromq.ZContext;
import org.zeromq.ZMQ;
import org.zeromq.ZMQException;

import xray.daq.configuration.ConfigException;

/**
 * ZeroMQ ROUTER socket which accepts requests from REQ clients.  A
 * request is a single text frame; the reply is a JSON-encoded map.
 * Requests are read without blocking so the collector can check for them
 * between frames.
 */
public class ZmqResponder
    implements Responder
{
    private static final Logger LOG = Logger.getLogger(ZmqResponder.class);

    private static final byte[] DELIMITER = new byte[0];

    private final String endpoint;
    private final ZContext context;
    private final ZMQ.Socket socket;

    /**
     * Bind a ROUTER socket.
     *
     * @param endpoint ZeroMQ endpoint, e.g. <tt>tcp://*:12323</tt>
     *
     * @throws ConfigException if the endpoint cannot be bound
     */
    public ZmqResponder(String endpoint)
        throws ConfigException
    {
        this.endpoint = endpoint;

        context = new ZContext();

        boolean bound;
        try {
            socket = context.createSocket(SocketType.ROUTER);
            socket.setSndHWM(1);
            socket.setRcvHWM(1);
            socket.setLinger(0);
            bound = socket.bind(endpoint);
        } catch (ZMQException zex) {
            context.close();
            throw new ConfigException("Cannot bind responding endpoint " +
                                      endpoint, zex);
        }

        if (!bound) {
            context.close();
            throw new ConfigException("Cannot bind responding endpoint " +
                                      endpoint);
        }

        LOG.info("Answering requests on " + endpoint);
    }

    /**
     * @return the bound endpoint, with any wildcard port resolved
     */
    public String getBoundEndpoint()
    {
        return socket.getLastEndpoint();
    }

    @Override
    public synchronized ExternalRequest poll()
    {
        final byte[] identity = socket.recv(ZMQ.DONTWAIT);
        if (identity == null) {
            return null;
        }

        // REQ clients put an empty delimiter before the body
        byte[] body = DELIMITER;
        while (socket.hasReceiveMore()) {
            body = socket.recv();
        }

        return new ExternalRequest(identity,
                                   new String(body, StandardCharsets.UTF_8));
    }

    @Override
    public synchronized boolean reply(ExternalRequest request,
                                      Map<String, Object> data)
    {
        byte[] body;
        try {
            body = ZmqBroadcaster.encode(data);
        } catch (JsonProcessingException jpe) {
            LOG.error("Cannot encode reply to " + request, jpe);
            return false;
        }

        final boolean sent =
            socket.send(request.getIdentity(), ZMQ.SNDMORE | ZMQ.DONTWAIT) &&
            socket.send(DELIMITER, ZMQ.SNDMORE | ZMQ.DONTWAIT) &&
            socket.send(body, ZMQ.DONTWAIT);
        if (!sent) {
            LOG.warn("Could not reply to " + request);
        }

        return sent;
    }

    @Override
    public synchronized void close()
    {
        LOG.info("Closing " + endpoint);
        context.close();
    }
}
