package xray.daq.transport;

import java.io.Closeable;
import java.io.EOFException;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.ByteBuffer;
import java.nio.channels.SelectionKey;
import java.nio.channels.Selector;
import java.nio.channels.ServerSocketChannel;
import java.nio.channels.SocketChannel;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

import org.apache.log4j.Logger;

import xray.daq.performance.queue.QueueProvider;
import xray.daq.performance.queue.QueueStrategy;

/**
 * TCP transport for a pool of ranks running as separate processes.
 *
 * The collector listens and every worker connects to it, so workers can
 * only talk to the collector.  Each connection starts with a handshake in
 * which the worker announces its rank and the pool size it expects.
 * One reader thread per connection decodes incoming messages into this
 * rank's inbox.
 */
public final class SocketTransport
    implements Transport, MessageSink
{
    private static final Logger LOG = Logger.getLogger(SocketTransport.class);

    /** Number of messages which can be waiting in the inbox */
    private static final int INBOX_CAPACITY = 1024;
    /** Number of messages which can be waiting to be sent */
    private static final int SEND_CAPACITY = 16;

    private static final int HANDSHAKE_BYTES = 8;

    /** How long to wait between connection attempts */
    private static final long RETRY_MILLIS = 100L;

    private final int rank;
    private final int poolSize;

    /** Connection to each peer, indexed by rank */
    private final SocketChannel[] channels;

    /** Peers which have sent END or TERMINATED */
    private final boolean[] finished;

    private final QueueStrategy<Message> inbox;
    private final AsyncSender sender;
    private final List<Thread> readers = new ArrayList<Thread>();

    private volatile boolean closing;
    /** Set once this rank has sent END or TERMINATED */
    private volatile boolean sentFinal;
    private volatile TransportException failure;

    private SocketTransport(int rank, int poolSize, SocketChannel[] channels)
    {
        this.rank = rank;
        this.poolSize = poolSize;
        this.channels = channels;

        finished = new boolean[poolSize];
        inbox = QueueProvider.Subsystem.RANK_INBOX.createQueue(INBOX_CAPACITY);
        sender = new AsyncSender(this, SEND_CAPACITY, "SocketSender#" + rank);

        for (int i = 0; i < channels.length; i++) {
            if (channels[i] != null) {
                Thread reader = new Thread(new Reader(i),
                                           "Reader#" + rank + "<-" + i);
                reader.setDaemon(true);
                readers.add(reader);
            }
        }
        for (Thread reader : readers) {
            reader.start();
        }
    }

    /**
     * Open the collector's end: wait for every worker to connect.
     *
     * @param addr address to listen on
     * @param poolSize number of ranks, including the collector
     * @param acceptMillis how long to wait for all workers
     *
     * @return collector transport
     *
     * @throws TransportException if the workers did not all connect
     */
    public static SocketTransport listen(InetSocketAddress addr, int poolSize,
                                         long acceptMillis)
        throws TransportException
    {
        if (poolSize < 2) {
            throw new TransportException("Pool needs at least one worker");
        }

        SocketChannel[] channels = new SocketChannel[poolSize];

        ServerSocketChannel server = null;
        Selector selector = null;
        boolean success = false;
        try {
            server = ServerSocketChannel.open();
            server.bind(addr);
            server.configureBlocking(false);

            selector = Selector.open();
            server.register(selector, SelectionKey.OP_ACCEPT);

            LOG.info("Waiting for " + (poolSize - 1) + " workers on " +
                     server.getLocalAddress());

            final long deadline = System.currentTimeMillis() + acceptMillis;

            int connected = 0;
            while (connected < poolSize - 1) {
                final long remaining = deadline - System.currentTimeMillis();
                if (remaining <= 0) {
                    throw new TransportException("Only " + connected + " of " +
                                                 (poolSize - 1) +
                                                 " workers connected");
                }

                selector.select(remaining);
                selector.selectedKeys().clear();

                SocketChannel chan = server.accept();
                if (chan == null) {
                    continue;
                }

                chan.configureBlocking(true);
                chan.socket().setTcpNoDelay(true);

                final int peer = readHandshake(chan, poolSize);
                if (channels[peer] != null) {
                    chan.close();
                    throw new TransportException("Rank " + peer +
                                                 " connected twice");
                }

                channels[peer] = chan;
                connected++;

                if (LOG.isDebugEnabled()) {
                    LOG.debug("Rank " + peer + " connected from " +
                              chan.getRemoteAddress());
                }
            }

            success = true;
        } catch (IOException ioe) {
            throw new TransportException("Cannot accept workers on " + addr,
                                         ioe);
        } finally {
            closeQuietly(selector);
            closeQuietly(server);
            if (!success) {
                for (SocketChannel chan : channels) {
                    closeQuietly(chan);
                }
            }
        }

        return new SocketTransport(COLLECTOR_RANK, poolSize, channels);
    }

    /**
     * Open a worker's end: connect to the collector.
     *
     * @param addr collector address
     * @param rank this worker's rank
     * @param poolSize number of ranks, including the collector
     * @param connectMillis how long to keep retrying the connection
     *
     * @return worker transport
     *
     * @throws TransportException if the collector could not be reached
     */
    public static SocketTransport connect(InetSocketAddress addr, int rank,
                                          int poolSize, long connectMillis)
        throws TransportException
    {
        if (rank <= COLLECTOR_RANK || rank >= poolSize) {
            throw new TransportException("Bad worker rank " + rank +
                                         " for pool of " + poolSize);
        }

        final long deadline = System.currentTimeMillis() + connectMillis;

        SocketChannel chan;
        while (true) {
            try {
                chan = SocketChannel.open(addr);
                break;
            } catch (IOException ioe) {
                if (System.currentTimeMillis() >= deadline) {
                    throw new TransportException("Cannot connect to " +
                                                 "collector at " + addr, ioe);
                }
            }

            try {
                Thread.sleep(RETRY_MILLIS);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                throw new TransportException("Interrupted while connecting" +
                                             " to " + addr, ie);
            }
        }

        try {
            chan.socket().setTcpNoDelay(true);

            ByteBuffer hello = ByteBuffer.allocate(HANDSHAKE_BYTES);
            hello.putInt(rank);
            hello.putInt(poolSize);
            hello.flip();
            writeFully(chan, hello);
        } catch (IOException ioe) {
            closeQuietly(chan);
            throw new TransportException("Handshake with " + addr + " failed",
                                         ioe);
        }

        SocketChannel[] channels = new SocketChannel[poolSize];
        channels[COLLECTOR_RANK] = chan;

        return new SocketTransport(rank, poolSize, channels);
    }

    private static int readHandshake(SocketChannel chan, int poolSize)
        throws IOException, TransportException
    {
        ByteBuffer hello = ByteBuffer.allocate(HANDSHAKE_BYTES);
        readFully(chan, hello);
        hello.flip();

        final int peer = hello.getInt();
        final int peerPool = hello.getInt();
        if (peerPool != poolSize) {
            chan.close();
            throw new TransportException("Rank " + peer + " expects a pool" +
                                         " of " + peerPool + ", not " +
                                         poolSize);
        }
        if (peer <= COLLECTOR_RANK || peer >= poolSize) {
            chan.close();
            throw new TransportException("Bad worker rank " + peer);
        }

        return peer;
    }

    private static void readFully(SocketChannel chan, ByteBuffer buf)
        throws IOException
    {
        while (buf.hasRemaining()) {
            if (chan.read(buf) < 0) {
                throw new EOFException("Connection closed after " +
                                       buf.position() + " of " +
                                       buf.limit() + " bytes");
            }
        }
    }

    private static void writeFully(SocketChannel chan, ByteBuffer buf)
        throws IOException
    {
        while (buf.hasRemaining()) {
            chan.write(buf);
        }
    }

    private static void closeQuietly(Closeable obj)
    {
        if (obj != null) {
            try {
                obj.close();
            } catch (IOException ioe) {
                LOG.warn("Cannot close " + obj, ioe);
            }
        }
    }

    @Override
    public int getRank()
    {
        return rank;
    }

    @Override
    public int getPoolSize()
    {
        return poolSize;
    }

    @Override
    public void deliver(int dest, Message msg)
        throws TransportException
    {
        if (dest < 0 || dest >= poolSize || channels[dest] == null) {
            throw new TransportException("Rank " + rank + " has no" +
                                         " connection to rank " + dest);
        }

        ByteBuffer buf = MessageCodec.encode(msg);

        final SocketChannel chan = channels[dest];
        synchronized (chan) {
            try {
                writeFully(chan, buf);
            } catch (IOException ioe) {
                throw new TransportException("Cannot send " + msg +
                                             " to rank " + dest, ioe);
            }
        }

        if (msg.getKind() == MessageKind.END ||
            msg.getKind() == MessageKind.TERMINATED)
        {
            sentFinal = true;
        }
    }

    @Override
    public SendRequest send(int dest, Message msg)
        throws TransportException
    {
        checkOpen();
        return sender.submit(dest, msg);
    }

    @Override
    public void sendNow(int dest, Message msg)
        throws TransportException
    {
        checkOpen();
        deliver(dest, msg);
    }

    private void checkOpen()
        throws TransportException
    {
        if (closing) {
            throw new TransportException("Rank " + rank + " is closed");
        }
        if (failure != null) {
            throw failure;
        }
    }

    @Override
    public Message receive(long timeout, TimeUnit unit)
        throws TransportException
    {
        final long deadline = System.nanoTime() + unit.toNanos(timeout);

        // wait in slices so a reader failure is noticed promptly
        final long slice = TimeUnit.MILLISECONDS.toNanos(100L);
        while (true) {
            Message msg = poll();
            if (msg != null) {
                return msg;
            }

            final long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                return null;
            }

            try {
                msg = inbox.poll(Math.min(remaining, slice),
                                 TimeUnit.NANOSECONDS);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                throw new TransportException("Rank " + rank +
                                             " interrupted while receiving",
                                             ie);
            }
            if (msg != null) {
                return msg;
            }
        }
    }

    @Override
    public Message poll()
        throws TransportException
    {
        Message msg = inbox.poll();
        if (msg == null && failure != null) {
            throw failure;
        }

        return msg;
    }

    @Override
    public void close()
    {
        if (closing) {
            return;
        }
        closing = true;

        if (!sender.close(1000L)) {
            LOG.warn("Rank " + rank + " closed with unsent messages");
            sender.abort();
        }

        for (SocketChannel chan : channels) {
            closeQuietly(chan);
        }

        for (Thread reader : readers) {
            try {
                reader.join(1000L);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                break;
            }
        }
    }

    @Override
    public String toString()
    {
        return "SocketTransport#" + rank + "/" + poolSize;
    }

    /**
     * Decode messages from one peer into the inbox.
     */
    private final class Reader
        implements Runnable
    {
        private final int peer;

        Reader(int peer)
        {
            this.peer = peer;
        }

        @Override
        public void run()
        {
            final SocketChannel chan = channels[peer];
            ByteBuffer lenBuf = ByteBuffer.allocate(MessageCodec.LENGTH_BYTES);

            try {
                while (true) {
                    lenBuf.clear();
                    readFully(chan, lenBuf);
                    lenBuf.flip();

                    final int len = lenBuf.getInt();
                    if (len <= 0 || len > MessageCodec.MAX_BODY_BYTES) {
                        throw new TransportException("Bad message length " +
                                                     len + " from rank " +
                                                     peer);
                    }

                    ByteBuffer body = ByteBuffer.allocate(len);
                    readFully(chan, body);
                    body.flip();

                    Message msg = MessageCodec.decode(body);
                    if (msg.getKind() == MessageKind.END ||
                        msg.getKind() == MessageKind.TERMINATED)
                    {
                        finished[peer] = true;
                    }

                    inbox.enqueue(msg);
                }
            } catch (IOException ioe) {
                if (closing || sentFinal || finished[peer]) {
                    if (LOG.isDebugEnabled()) {
                        LOG.debug("Connection to rank " + peer + " closed");
                    }
                } else {
                    failure = new TransportException("Lost connection to" +
                                                     " rank " + peer, ioe);
                    LOG.error("Rank " + rank + " lost connection to rank " +
                              peer, ioe);
                }
            } catch (TransportException te) {
                failure = te;
                LOG.error("Rank " + rank + " received garbage from rank " +
                          peer, te);
            } catch (InterruptedException ie) {
                if (!closing) {
                    failure = new TransportException("Reader for rank " +
                                                     peer + " interrupted",
                                                     ie);
                }
            }
        }
    }
}
