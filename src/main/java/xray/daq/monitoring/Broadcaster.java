package xray.daq.monitoring;

import java.util.Map;

/**
 * Publishes monitoring data to visualization clients.
 */
public interface Broadcaster
{
    /**
     * Publish one message.  Slow clients may miss messages; a publisher
     * never waits for them.
     *
     * @param topic message topic
     * @param data message contents
     *
     * @return <tt>false</tt> if the message was dropped
     */
    boolean publish(String topic, Map<String, Object> data);

    void close();
}
