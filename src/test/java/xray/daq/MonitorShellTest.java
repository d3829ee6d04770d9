package xray.daq;

import java.io.File;
import java.net.InetSocketAddress;
import java.net.URISyntaxException;
import java.net.URL;
import java.util.concurrent.TimeUnit;

import org.apache.log4j.BasicConfigurator;
import org.apache.log4j.Level;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import xray.daq.common.MockAppender;
import xray.daq.configuration.ConfigException;
import xray.daq.configuration.MonitorConfig;
import xray.daq.coordinator.ExitStatus;
import xray.daq.coordinator.LocalPool;
import xray.daq.geometry.GeometryParseException;
import xray.daq.monitoring.ExternalRequest;
import xray.daq.monitoring.MockBroadcaster;
import xray.daq.monitoring.MockResponder;
import xray.daq.monitoring.MonitorCollector;
import xray.daq.source.SourceAccessException;

import static org.junit.Assert.*;

public class MonitorShellTest
{
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

    private MonitorConfig syntheticConfig()
        throws ConfigException, URISyntaxException
    {
        URL url = getClass().getResource("/monitor-synthetic.properties");
        return MonitorConfig.load(new File(url.toURI()));
    }

    @Test
    public void testLocalRun()
        throws ConfigException, GeometryParseException, SourceAccessException,
               URISyntaxException
    {
        MonitorShell shell = new MonitorShell(syntheticConfig());
        assertEquals(16, shell.getGeometry().getSlabWidth());

        MockBroadcaster bcast = new MockBroadcaster();
        ExitStatus status = shell.runLocal(new LocalPool(4), bcast, null);

        assertEquals(ExitStatus.CLEAN, status);

        // one frame per event, a snapshot every 10 and one at the end
        assertEquals(4, bcast.count(MonitorCollector.SNAPSHOT_TOPIC));

        int last = -1;
        for (int i = 0; i < bcast.size(); i++) {
            if (bcast.getTopic(i).equals(MonitorCollector.SNAPSHOT_TOPIC)) {
                last = i;
            }
        }
        assertEquals(30L, bcast.getMessage(last).get("num_events"));
        assertEquals(Boolean.TRUE,
                     bcast.getMessage(last).get("resolution_rings_available"));
    }

    @Test
    public void testRunWithBroadcastSocket()
        throws ConfigException, GeometryParseException, SourceAccessException,
               URISyntaxException, InterruptedException
    {
        MonitorShell shell = new MonitorShell(syntheticConfig());

        assertNull(shell.getExitStatus());
        assertEquals(ExitStatus.CLEAN, shell.run());
        assertTrue(shell.awaitFinish(10, TimeUnit.MILLISECONDS));
        assertEquals(ExitStatus.CLEAN, shell.getExitStatus());
    }

    @Test
    public void testRunWithResponder()
        throws ConfigException, GeometryParseException, SourceAccessException,
               URISyntaxException
    {
        MonitorShell shell =
            new MonitorShell(syntheticConfig().with(MonitorConfig.RESPONDING_ENDPOINT,
                                                    "tcp://127.0.0.1:*").
                             with(MonitorConfig.REQUEST_QUEUE_SIZE, "3"));

        assertEquals(ExitStatus.CLEAN, shell.run());
    }

    @Test
    public void testLocalRunWithResponder()
        throws ConfigException, GeometryParseException, SourceAccessException,
               URISyntaxException
    {
        MonitorShell shell = new MonitorShell(syntheticConfig());

        MockBroadcaster bcast = new MockBroadcaster();
        MockResponder resp = new MockResponder();
        resp.addRequest("viewer", ExternalRequest.NEXT);

        assertEquals(ExitStatus.CLEAN,
                     shell.runLocal(new LocalPool(3), bcast, resp));

        assertEquals(1, resp.size());
        assertEquals("viewer", resp.getClient(0));
        assertNotNull(resp.getReply(0).get("peak_list"));
    }

    @Test
    public void testShutdownExitCode()
        throws ConfigException, GeometryParseException, SourceAccessException,
               URISyntaxException
    {
        MonitorShell shell =
            new MonitorShell(syntheticConfig().with(MonitorConfig.SYNTHETIC_EVENTS,
                                                    "1000000"));
        shell.requestShutdown();

        assertEquals(ExitStatus.CLEAN, shell.run());
        assertEquals(ExitStatus.CLEAN.getCode(), shell.shutdownAndWait(10));
    }

    @Test
    public void testShutdownWithoutRun()
        throws ConfigException, GeometryParseException, SourceAccessException,
               URISyntaxException
    {
        MonitorShell shell = new MonitorShell(syntheticConfig());

        assertEquals(ExitStatus.SHUTDOWN_TIMEOUT.getCode(),
                     shell.shutdownAndWait(10));
        appender.assertLogMessage("did not stop within 10 ms");
    }

    @Test
    public void testShutdownBeforeRun()
        throws ConfigException, GeometryParseException, SourceAccessException,
               URISyntaxException, InterruptedException
    {
        MonitorShell shell =
            new MonitorShell(syntheticConfig().with(MonitorConfig.SYNTHETIC_EVENTS,
                                                    "1000000"));
        shell.requestShutdown();

        MockBroadcaster bcast = new MockBroadcaster();
        assertEquals(ExitStatus.CLEAN,
                     shell.runLocal(new LocalPool(3), bcast, null));
        assertFalse(shell.awaitFinish(10, TimeUnit.MILLISECONDS));
    }

    @Test
    public void testBadMode()
        throws ConfigException, GeometryParseException, SourceAccessException,
               URISyntaxException, InterruptedException
    {
        MonitorShell shell =
            new MonitorShell(syntheticConfig().with(MonitorConfig.TRANSPORT_MODE,
                                                    "carrier-pigeon"));
        try {
            shell.run();
            fail("Unknown mode should be rejected");
        } catch (ConfigException cex) {
            assertTrue(cex.getMessage().contains("carrier-pigeon"));
        }

        assertTrue(shell.awaitFinish(10, TimeUnit.MILLISECONDS));
        assertEquals(ExitStatus.STARTUP_FAILURE, shell.getExitStatus());
        assertEquals(ExitStatus.STARTUP_FAILURE.getCode(),
                     shell.shutdownAndWait(10));
    }

    @Test
    public void testBadSetting()
        throws ConfigException, GeometryParseException,
               SourceAccessException, URISyntaxException
    {
        MonitorConfig cfg =
            syntheticConfig().with(MonitorConfig.EVENT_REJECTION_THRESHOLD,
                                   "-5");
        try {
            new MonitorShell(cfg);
            fail("Negative age limit should be rejected");
        } catch (ConfigException cex) {
            assertTrue(cex.getMessage().contains(MonitorConfig.EVENT_REJECTION_THRESHOLD));
        }
    }

    @Test
    public void testMissingGeometry()
        throws ConfigException, SourceAccessException, URISyntaxException
    {
        MonitorConfig cfg =
            syntheticConfig().with(MonitorConfig.GEOMETRY_FILE,
                                   "/no/such/file.geom");
        try {
            new MonitorShell(cfg);
            fail("Missing geometry should be rejected");
        } catch (GeometryParseException gpe) {
            assertTrue(gpe.getMessage().contains("file.geom"));
        }
    }

    @Test
    public void testParseAddress()
        throws ConfigException
    {
        InetSocketAddress addr = MonitorShell.parseAddress("localhost:4321");
        assertEquals("localhost", addr.getHostString());
        assertEquals(4321, addr.getPort());

        final String[] bad = { "localhost", ":12", "host:", "host:port",
                               "host:70000" };
        for (String val : bad) {
            try {
                MonitorShell.parseAddress(val);
                fail("Address \"" + val + "\" should be rejected");
            } catch (ConfigException cex) {
                assertTrue(cex.getMessage().contains(val));
            }
        }
    }
}
