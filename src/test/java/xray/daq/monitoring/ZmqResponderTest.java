package xray.daq.monitoring;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
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

public class ZmqResponderTest
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
    public void testBadEndpoint()
    {
        try {
            new ZmqResponder("nonsense://nowhere");
            fail("Bad endpoint should be rejected");
        } catch (ConfigException cex) {
            assertTrue(cex.getMessage().contains("nonsense://nowhere"));
        }
    }

    @Test
    public void testNoRequest()
        throws ConfigException
    {
        ZmqResponder resp = new ZmqResponder("tcp://127.0.0.1:*");
        try {
            assertNull(resp.poll());
        } finally {
            resp.close();
        }
    }

    @Test
    public void testRequestReply()
        throws ConfigException, IOException, InterruptedException
    {
        ZmqResponder resp = new ZmqResponder("tcp://127.0.0.1:*");

        ZContext ctx = new ZContext();
        try {
            ZMQ.Socket req = ctx.createSocket(SocketType.REQ);
            req.setReceiveTimeOut(5000);
            req.connect(resp.getBoundEndpoint());
            assertTrue(req.send(ExternalRequest.NEXT));

            // the request takes a moment to arrive
            ExternalRequest got = null;
            for (int i = 0; got == null && i < 500; i++) {
                got = resp.poll();
                if (got == null) {
                    Thread.sleep(10);
                }
            }

            assertNotNull("No request received", got);
            assertEquals(ExternalRequest.NEXT, got.getCommand());

            Map<String, Object> data = new LinkedHashMap<String, Object>();
            data.put("event_id", "evt12");
            assertTrue(resp.reply(got, data));

            byte[] body = req.recv();
            assertNotNull("No reply received", body);

            JsonNode node = MAPPER.readTree(body);
            assertEquals("evt12", node.get("event_id").asText());
        } finally {
            ctx.close();
            resp.close();
        }
    }
}
