package xray.daq.source;

import java.io.File;
import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.FileChannel;

/**
 * Random access to a file of little-endian float32 slab frames stored
 * back to back.
 */
public final class RawFrameFile
{
    public static final int BYTES_PER_PIXEL = 4;

    private final File file;
    private final int frameBytes;
    private final RandomAccessFile raf;
    private final FileChannel chan;
    private final int numFrames;

    /**
     * Open a frame file.
     *
     * @param file data file
     * @param pixelsPerFrame number of pixels in one slab frame
     *
     * @throws IOException if the file cannot be opened or is not a whole
     *                     number of frames
     */
    public RawFrameFile(File file, int pixelsPerFrame)
        throws IOException
    {
        if (pixelsPerFrame <= 0) {
            throw new IllegalArgumentException("Bad frame size " +
                                               pixelsPerFrame);
        }

        this.file = file;
        this.frameBytes = pixelsPerFrame * BYTES_PER_PIXEL;

        raf = new RandomAccessFile(file, "r");
        chan = raf.getChannel();

        final long len = chan.size();
        if (len == 0 || len % frameBytes != 0) {
            close();
            throw new IOException(file + " holds " + len + " bytes, not a" +
                                  " whole number of " + frameBytes +
                                  "-byte frames");
        }

        numFrames = (int) (len / frameBytes);
    }

    /**
     * Read a single-frame file such as a dark or gain map.
     */
    public static float[] readSingleFrame(File file, int pixelsPerFrame)
        throws IOException
    {
        RawFrameFile rff = new RawFrameFile(file, pixelsPerFrame);
        try {
            if (rff.getNumFrames() != 1) {
                throw new IOException(file + " holds " + rff.getNumFrames() +
                                      " frames, expected 1");
            }

            return rff.readFrame(0);
        } finally {
            rff.close();
        }
    }

    public File getFile()
    {
        return file;
    }

    public int getNumFrames()
    {
        return numFrames;
    }

    public float[] readFrame(int index)
        throws IOException
    {
        if (index < 0 || index >= numFrames) {
            throw new IOException("Frame " + index + " not in " + file +
                                  " (" + numFrames + " frames)");
        }

        ByteBuffer buf = ByteBuffer.allocate(frameBytes);
        buf.order(ByteOrder.LITTLE_ENDIAN);

        long pos = (long) index * frameBytes;
        while (buf.hasRemaining()) {
            final int n = chan.read(buf, pos);
            if (n < 0) {
                throw new IOException("Unexpected end of " + file);
            }
            pos += n;
        }
        buf.flip();

        float[] data = new float[frameBytes / BYTES_PER_PIXEL];
        buf.asFloatBuffer().get(data);
        return data;
    }

    public void close()
        throws IOException
    {
        raf.close();
    }
}
