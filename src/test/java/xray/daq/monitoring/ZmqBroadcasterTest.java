package xray.daq.monitoring;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

import org.apache.log4j.BasicConfigurator;
import org.apache.log4j.Level;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.zeromq.SocketType;
import org.zeromq.ZContext;
import org.zeromq.ZMQ;

import xray.daq.common.MockAppender;
import xray.daq.configuration.ConfigException;

import static org.junit.Assert.*;

public class ZmqBroadcasterTest
{
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private MockAppender appender;

    @Before
    public void setUp()
    {
        appender = new MockAppender(Level.WARN);

        BasicConfigurator.resetConfiguration();
        BasicConfigurator.configure(appender);
    }

    @After
    public void tearDown()
    {
        appender.assertNoLogMessages();
        BasicConfigurator.resetConfiguration();
    }

    @Test
    public void testEncode()
        throws Exception
    {
        LinkedHashMap<String, Object> map =
            new LinkedHashMap<String, Object>();
        map.put("num_events", 12L);
        map.put("beam_energy", null);
        map.put("rings", Arrays.asList(3.0, 4.0));
        map.put("image", new float[][] { { 1.0F, 2.0F }, { 3.0F, 4.0F } });

        JsonNode node = MAPPER.readTree(ZmqBroadcaster.encode(map));

        assertEquals(12L, node.get("num_events").asLong());
        assertTrue(node.get("beam_energy").isNull());
        assertEquals(2, node.get("rings").size());
        assertEquals(4.0, node.get("image").get(1).get(1).asDouble(), 0.0);
    }

    @Test
    public void testBadEndpoint()
    {
        try {
            new ZmqBroadcaster("nonsense://nowhere");
            fail("Bad endpoint should be rejected");
        } catch (ConfigException cex) {
            assertTrue(cex.getMessage().contains("nonsense://nowhere"));
        }
    }

    @Test
    public void testPublish()
        throws ConfigException, IOException
    {
        ZmqBroadcaster bcast = new ZmqBroadcaster("tcp://127.0.0.1:*");

        ZContext ctx = new ZContext();
        try {
            ZMQ.Socket sub = ctx.createSocket(SocketType.SUB);
            sub.setReceiveTimeOut(100);
            sub.connect(bcast.getBoundEndpoint());
            sub.subscribe(MonitorCollector.SNAPSHOT_TOPIC.getBytes());

            Map<String, Object> data = new LinkedHashMap<String, Object>();
            data.put("num_events", 7);

            // subscriptions take a moment to reach the publisher
            String topic = null;
            for (int i = 0; topic == null && i < 100; i++) {
                assertTrue(bcast.publish(MonitorCollector.SNAPSHOT_TOPIC,
                                         data));
                topic = sub.recvStr();
            }

            assertEquals(MonitorCollector.SNAPSHOT_TOPIC, topic);
            assertTrue(sub.hasReceiveMore());

            JsonNode node = MAPPER.readTree(sub.recv());
            assertEquals(7, node.get("num_events").asInt());

            assertTrue(bcast.getNumSent() > 0);
        } finally {
            ctx.close();
            bcast.close();
        }
    }
}
