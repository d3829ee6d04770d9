package xray.daq.monitoring;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Map;

import org.apache.log4j.Logger;
import org.zeromq.SocketType;
import org.zeromq.ZContext;
import org.zeromq.ZMQ;
import org.zeromq.ZMQException;

import xray.daq.configuration.ConfigException;

/**
 * ZeroMQ PUB socket broadcaster.  Each message is sent as two frames,
 * the topic followed by the JSON-encoded data.  The send high-water mark
 * is 1, so messages for slow subscribers are dropped rather than queued.
 */
public class ZmqBroadcaster
    implements Broadcaster
{
    private static final Logger LOG = Logger.getLogger(ZmqBroadcaster.class);

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final String endpoint;
    private final ZContext context;
    private final ZMQ.Socket socket;

    private long numSent;
    private long numDropped;

    /**
     * Bind a PUB socket.
     *
     * @param endpoint ZeroMQ endpoint, e.g. <tt>tcp://*:12321</tt>
     *
     * @throws ConfigException if the endpoint cannot be bound
     */
    public ZmqBroadcaster(String endpoint)
        throws ConfigException
    {
        this.endpoint = endpoint;

        context = new ZContext();

        boolean bound;
        try {
            socket = context.createSocket(SocketType.PUB);
            socket.setSndHWM(1);
            socket.setLinger(0);
            bound = socket.bind(endpoint);
        } catch (ZMQException zex) {
            context.close();
            throw new ConfigException("Cannot bind broadcast endpoint " +
                                      endpoint, zex);
        }

        if (!bound) {
            context.close();
            throw new ConfigException("Cannot bind broadcast endpoint " +
                                      endpoint);
        }

        LOG.info("Broadcasting on " + endpoint);
    }

    /**
     * @return the bound endpoint, with any wildcard port resolved
     */
    public String getBoundEndpoint()
    {
        return socket.getLastEndpoint();
    }

    /**
     * Encode a message body.
     */
    static byte[] encode(Map<String, Object> data)
        throws JsonProcessingException
    {
        return MAPPER.writeValueAsBytes(data);
    }

    @Override
    public synchronized boolean publish(String topic,
                                        Map<String, Object> data)
    {
        byte[] body;
        try {
            body = encode(data);
        } catch (JsonProcessingException jpe) {
            LOG.error("Cannot encode \"" + topic + "\" message", jpe);
            numDropped++;
            return false;
        }

        final boolean sent =
            socket.send(topic, ZMQ.SNDMORE | ZMQ.DONTWAIT) &&
            socket.send(body, ZMQ.DONTWAIT);
        if (sent) {
            numSent++;
        } else {
            numDropped++;
            if (LOG.isDebugEnabled()) {
                LOG.debug("Dropped \"" + topic + "\" message");
            }
        }

        return sent;
    }

    public synchronized long getNumSent()
    {
        return numSent;
    }

    public synchronized long getNumDropped()
    {
        return numDropped;
    }

    @Override
    public synchronized void close()
    {
        LOG.info("Closing " + endpoint + " after " + numSent + " messages (" +
                 numDropped + " dropped)");
        context.close();
    }
}
